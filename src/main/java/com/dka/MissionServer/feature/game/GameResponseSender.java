package com.dka.MissionServer.feature.game;

import com.dka.MissionServer.domain.Player;
import com.dka.MissionServer.domain.Room;
import com.dka.MissionServer.feature.game.dto.GamePayloads;
import com.dka.MissionServer.global.constant.SocketEvent;
import com.dka.MissionServer.infra.websocket.WebSocketSender;
import com.dka.MissionServer.infra.websocket.dto.WebSocketResponse;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.List;

@Component
@RequiredArgsConstructor
public class GameResponseSender {

    private final WebSocketSender webSocketSender;

    public void broadcastStartGame(Room room, long startTime) {
        WebSocketResponse<GamePayloads.StartInfo> response = WebSocketResponse.<GamePayloads.StartInfo>builder()
                .event(SocketEvent.START_GAME.getEventName())
                .data(GamePayloads.StartInfo.builder().startTime(startTime).build())
                .build();
        broadcastToRoom(room, response);
    }

    // 보낸 사람 포함 전원에게 전송 (HUD와 리더보드 점수 일치)
    public void broadcastPlayerUpdated(Room room, Player player) {
        WebSocketResponse<Player> response = WebSocketResponse.<Player>builder()
                .event(SocketEvent.PLAYER_UPDATED.getEventName())
                .data(player)
                .build();
        broadcastToRoom(room, response);
    }

    public void broadcastGameOver(Room room, long resetTime) {
        GamePayloads.GameOverInfo data = GamePayloads.GameOverInfo.builder()
                .players(room.getPlayers())
                .resetTime(resetTime)
                .build();

        WebSocketResponse<GamePayloads.GameOverInfo> response = WebSocketResponse.<GamePayloads.GameOverInfo>builder()
                .event(SocketEvent.FORCE_GAME_OVER.getEventName())
                .data(data)
                .build();
        broadcastToRoom(room, response);
    }

    private void broadcastToRoom(Room room, Object response) {
        if (room.getPlayers() != null && !room.getPlayers().isEmpty()) {
            List<String> sessionIds = room.getPlayers().stream().map(Player::getId).toList();
            webSocketSender.sendEventToSessions(sessionIds, response);
        }
    }
}
