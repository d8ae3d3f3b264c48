package com.dka.MissionServer.feature.lobby;

import com.dka.MissionServer.config.MissionProperties;
import com.dka.MissionServer.domain.Player;
import com.dka.MissionServer.domain.Room;
import com.dka.MissionServer.domain.type.RoomStatus;
import com.dka.MissionServer.feature.game.GameFlowService;
import com.dka.MissionServer.feature.game.LockResult;
import com.dka.MissionServer.feature.game.RoomLockFacade;
import com.dka.MissionServer.global.constant.ErrorCode;
import com.dka.MissionServer.global.result.ActionResult;
import com.dka.MissionServer.infra.persistence.RoomRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.util.Objects;
import java.util.Optional;

@Slf4j
@Service
@RequiredArgsConstructor
public class LobbyService {

    private final RoomRegistry roomRegistry;
    private final RoomLockFacade lockFacade;
    private final MissionProperties missionProperties;
    private final LobbyResponseSender responseSender;
    private final GameFlowService gameFlowService;

    public ActionResult joinRoom(String sessionId, String roomId, String name) {
        if (!StringUtils.hasText(roomId)) {
            log.warn("join_room 요청에 roomId가 없습니다: session={}", sessionId);
            return ActionResult.ignored(ErrorCode.INVALID_REQUEST);
        }

        LockResult<ActionResult> result = lockFacade.execute(roomId, () -> joinRoomInternal(sessionId, roomId, name));

        if (result.isLockFailed()) {
            responseSender.sendError(sessionId, ErrorCode.ROOM_BUSY.name(), ErrorCode.ROOM_BUSY.getMessage());
            return ActionResult.rejected(ErrorCode.ROOM_BUSY);
        }
        return result.getData();
    }

    private ActionResult joinRoomInternal(String sessionId, String roomId, String name) {
        Room room = roomRegistry.getOrCreate(roomId);
        int requiredPlayers = missionProperties.requiredPlayers();

        if (room.getStatus() == RoomStatus.PLAYING) {
            responseSender.sendError(sessionId, ErrorCode.ROOM_ALREADY_PLAYING.name(),
                    ErrorCode.ROOM_ALREADY_PLAYING.getMessage());
            log.info("진행 중인 방 입장 거절: room={}, session={}", roomId, sessionId);
            return ActionResult.rejected(ErrorCode.ROOM_ALREADY_PLAYING);
        }

        if (room.isFull(requiredPlayers)) {
            responseSender.sendError(sessionId, ErrorCode.ROOM_FULL.name(),
                    ErrorCode.ROOM_FULL.format(requiredPlayers));
            log.info("정원 초과 입장 거절: room={}, session={}", roomId, sessionId);
            return ActionResult.rejected(ErrorCode.ROOM_FULL);
        }

        if (room.hasPlayer(sessionId)) {
            responseSender.sendRoomUpdate(sessionId, room);
            return ActionResult.ignored(ErrorCode.ALREADY_JOINED);
        }

        Player newPlayer = Player.join(sessionId, name);
        room.addPlayer(newPlayer);

        responseSender.broadcastRoomUpdate(room);
        log.info("방 입장 완료: room={}, player={}, count={}/{}",
                roomId, newPlayer.getName(), room.getPlayerCount(), requiredPlayers);

        // 새 플레이어는 준비 전 상태지만 조건 검사는 항상 수행
        gameFlowService.checkAndStartGame(room);
        return ActionResult.success();
    }

    public ActionResult toggleReady(String sessionId, String roomId) {
        if (!StringUtils.hasText(roomId)) {
            return ActionResult.ignored(ErrorCode.INVALID_REQUEST);
        }

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

            player.toggleReady();
            responseSender.broadcastRoomUpdate(room);
            log.info("준비 상태 변경: room={}, player={}, ready={}", roomId, player.getName(), player.isReady());

            gameFlowService.checkAndStartGame(room);
            return ActionResult.success();
        });

        return result.orElse(ActionResult.ignored(ErrorCode.ROOM_BUSY));
    }

    public ActionResult kickPlayer(String sessionId, String roomId, String targetId) {
        if (!StringUtils.hasText(roomId) || !StringUtils.hasText(targetId)) {
            return ActionResult.ignored(ErrorCode.INVALID_REQUEST);
        }

        LockResult<ActionResult> result = lockFacade.execute(roomId, () -> {
            Optional<Room> roomOpt = roomRegistry.findRoomById(roomId);
            if (roomOpt.isEmpty()) {
                return ActionResult.ignored(ErrorCode.ROOM_NOT_FOUND);
            }
            Room room = roomOpt.get();

            if (!room.isCaptain(sessionId)) {
                log.info("캡틴이 아닌 플레이어의 강퇴 요청 무시: room={}, session={}", roomId, sessionId);
                return ActionResult.ignored(ErrorCode.NOT_CAPTAIN);
            }
            if (Objects.equals(targetId, sessionId)) {
                return ActionResult.ignored(ErrorCode.SELF_KICK);
            }
            if (!room.removePlayer(targetId)) {
                return ActionResult.ignored(ErrorCode.PLAYER_NOT_FOUND);
            }

            responseSender.sendKicked(targetId, roomId);
            responseSender.broadcastRoomUpdate(room);
            log.info("강퇴 완료: room={}, target={}", roomId, targetId);
            return ActionResult.success();
        });

        return result.orElse(ActionResult.ignored(ErrorCode.ROOM_BUSY));
    }

    /**
     * 연결이 끊긴 플레이어를 참여 중인 모든 방에서 제거한다.
     * 진행 중인 방이라도 자동 시작이나 종료 조건은 다시 검사하지 않는다.
     *
     * @return 플레이어가 제거된 방의 수
     */
    public int disconnect(String sessionId) {
        int leftRooms = 0;

        for (String roomId : roomRegistry.findAllRoomIds()) {
            LockResult<Boolean> result = lockFacade.execute(roomId, () -> leaveRoomInternal(sessionId, roomId));

            if (result.isLockFailed()) {
                log.error("연결 종료 처리 실패 ({}): room={}, session={}", result.getOutcome(), roomId, sessionId);
            } else if (Boolean.TRUE.equals(result.getData())) {
                leftRooms++;
            }
        }
        return leftRooms;
    }

    private boolean leaveRoomInternal(String sessionId, String roomId) {
        Optional<Room> roomOpt = roomRegistry.findRoomById(roomId);
        if (roomOpt.isEmpty() || !roomOpt.get().removePlayer(sessionId)) {
            return false;
        }
        Room room = roomOpt.get();

        if (room.isEmpty()) {
            roomRegistry.delete(roomId);
        } else {
            responseSender.broadcastRoomUpdate(room);
        }
        log.info("방 퇴장 처리 완료: session={}, room={}, remaining={}", sessionId, roomId, room.getPlayerCount());
        return true;
    }
}
