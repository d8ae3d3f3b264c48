package com.dka.MissionServer.feature.lobby;

import com.dka.MissionServer.domain.Player;
import com.dka.MissionServer.domain.Room;
import com.dka.MissionServer.feature.lobby.dto.LobbyPayloads;
import com.dka.MissionServer.global.constant.SocketEvent;
import com.dka.MissionServer.infra.websocket.WebSocketSender;
import com.dka.MissionServer.infra.websocket.dto.WebSocketResponse;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.List;

@Component
@RequiredArgsConstructor
public class LobbyResponseSender {

    private static final String KICKED_MESSAGE = "You have been removed from the team.";

    private final WebSocketSender webSocketSender;

    public void broadcastRoomUpdate(Room room) {
        WebSocketResponse<List<Player>> response = WebSocketResponse.<List<Player>>builder()
                .event(SocketEvent.ROOM_UPDATE.getEventName())
                .data(room.getPlayers())
                .build();
        broadcastToRoom(room, response);
    }

    public void sendRoomUpdate(String sessionId, Room room) {
        WebSocketResponse<List<Player>> response = WebSocketResponse.<List<Player>>builder()
                .event(SocketEvent.ROOM_UPDATE.getEventName())
                .data(room.getPlayers())
                .build();
        webSocketSender.sendEventToSession(sessionId, response);
    }

    public void sendError(String sessionId, String code, String message) {
        WebSocketResponse<Void> response = WebSocketResponse.<Void>builder()
                .event(SocketEvent.ERROR_MSG.getEventName())
                .code(code)
                .message(message)
                .build();
        webSocketSender.sendEventToSession(sessionId, response);
    }

    public void sendKicked(String sessionId, String roomId) {
        WebSocketResponse<LobbyPayloads.KickedInfo> response = WebSocketResponse.<LobbyPayloads.KickedInfo>builder()
                .event(SocketEvent.KICKED.getEventName())
                .message(KICKED_MESSAGE)
                .data(LobbyPayloads.KickedInfo.builder().roomId(roomId).build())
                .build();
        webSocketSender.sendEventToSession(sessionId, response);
    }

    private void broadcastToRoom(Room room, Object response) {
        if (room.getPlayers() != null && !room.getPlayers().isEmpty()) {
            List<String> sessionIds = room.getPlayers().stream().map(Player::getId).toList();
            webSocketSender.sendEventToSessions(sessionIds, response);
        }
    }
}
