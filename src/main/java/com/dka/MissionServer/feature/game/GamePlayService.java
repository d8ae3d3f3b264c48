package com.dka.MissionServer.feature.game;

import com.dka.MissionServer.domain.Player;
import com.dka.MissionServer.domain.Room;
import com.dka.MissionServer.feature.game.dto.UpdatePlayerRequest;
import com.dka.MissionServer.global.constant.ErrorCode;
import com.dka.MissionServer.global.result.ActionResult;
import com.dka.MissionServer.infra.persistence.RoomRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.util.Optional;

@Slf4j
@Service
@RequiredArgsConstructor
public class GamePlayService {

    private final RoomRegistry roomRegistry;
    private final RoomLockFacade lockFacade;
    private final GameResponseSender gameResponseSender;
    private final GameFlowService gameFlowService;

    // 점수/상태는 클라이언트 보고값을 그대로 덮어쓴다 (last-write-wins)
    public ActionResult updatePlayer(String sessionId, UpdatePlayerRequest request) {
        if (request == null || !StringUtils.hasText(request.getRoomId())
                || request.getScore() == null || request.getStatus() == null) {
            log.warn("update_player 요청 형식 오류: session={}", sessionId);
            return ActionResult.ignored(ErrorCode.INVALID_REQUEST);
        }
        String roomId = request.getRoomId();

        LockResult<ActionResult> result = lockFacade.execute(roomId, () -> {
            Optional<Room> roomOpt = roomRegistry.findRoomById(roomId);
            if (roomOpt.isEmpty()) {
                return ActionResult.ignored(ErrorCode.ROOM_NOT_FOUND);
            }
            Room room = roomOpt.get();

            Optional<Player> playerOpt = room.findPlayer(sessionId);
            if (playerOpt.isEmpty()) {
                return ActionResult.ignored(ErrorCode.PLAYER_NOT_FOUND);
            }
            Player player = playerOpt.get();

            player.setScore(request.getScore());
            player.setStatus(request.getStatus());
            gameResponseSender.broadcastPlayerUpdated(room, player);
            log.debug("플레이어 상태 갱신: room={}, player={}, score={}, status={}",
                    roomId, player.getName(), player.getScore(), player.getStatus());

            gameFlowService.checkAndEndGame(room);
            return ActionResult.success();
        });

        return result.orElse(ActionResult.ignored(ErrorCode.ROOM_BUSY));
    }
}
