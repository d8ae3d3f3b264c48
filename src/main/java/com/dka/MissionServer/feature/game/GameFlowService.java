package com.dka.MissionServer.feature.game;

import com.dka.MissionServer.config.MissionProperties;
import com.dka.MissionServer.domain.Player;
import com.dka.MissionServer.domain.Room;
import com.dka.MissionServer.domain.type.RoomStatus;
import com.dka.MissionServer.feature.lobby.LobbyResponseSender;
import com.dka.MissionServer.infra.persistence.RoomRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.ScheduledFuture;

/**
 * 방의 상태 전이 (LOBBY/GAME_OVER → PLAYING → GAME_OVER → LOBBY).
 * check* 메서드는 호출 측이 이미 해당 방의 락을 잡고 있다고 가정한다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class GameFlowService {

    private static final long LOCK_RETRY_DELAY_MS = 200L;
    static final int MAX_RESET_ATTEMPTS = 5;

    private final RoomRegistry roomRegistry;
    private final RoomLockFacade lockFacade;
    private final GameResponseSender gameResponseSender;
    private final LobbyResponseSender lobbyResponseSender;
    private final TaskScheduler taskScheduler;
    private final MissionProperties missionProperties;
    private final Clock clock;

    // 자동 시작

    public boolean checkAndStartGame(Room room) {
        if (!room.isReadyToStart(missionProperties.requiredPlayers())) {
            return false;
        }
        if (room.getStatus() == RoomStatus.PLAYING) {
            log.debug("이미 진행 중인 방: room={}", room.getRoomId());
            return false;
        }

        // 리더보드 중 재시작된 경우 남아 있는 리셋 타이머는 상태 검사에서 중단된다
        room.setStatus(RoomStatus.PLAYING);
        long startTime = clock.millis() + missionProperties.startDelay();
        gameResponseSender.broadcastStartGame(room, startTime);

        log.info("전원 준비 완료, 자동 시작: room={}, players={}, startTime={}",
                room.getRoomId(), room.getPlayerCount(), startTime);
        return true;
    }

    // 종료 판정 및 리셋 예약

    public boolean checkAndEndGame(Room room) {
        if (room.getStatus() != RoomStatus.PLAYING || !room.isEveryoneDone()) {
            return false;
        }

        room.setStatus(RoomStatus.GAME_OVER);
        long resetTime = clock.millis() + missionProperties.leaderboardDuration();
        gameResponseSender.broadcastGameOver(room, resetTime);

        scheduleReset(room, Instant.ofEpochMilli(resetTime));
        log.info("전원 종료, 게임 오버: room={}, resetTime={}", room.getRoomId(), resetTime);
        return true;
    }

    private void scheduleReset(Room room, Instant resetAt) {
        room.cancelPendingReset();
        String roomId = room.getRoomId();
        ScheduledFuture<?> future = taskScheduler.schedule(() -> processReset(roomId, room), resetAt);
        room.setPendingReset(future);
    }

    public void processReset(String roomId, Room expected) {
        processReset(roomId, expected, 1);
    }

    private void processReset(String roomId, Room expected, int attempt) {
        LockResult<Boolean> result = lockFacade.execute(roomId, () -> resetInternal(roomId, expected));
        if (!result.isLockFailed()) {
            return;
        }

        if (attempt >= MAX_RESET_ATTEMPTS) {
            log.error("방 리셋 포기 ({}회 락 실패, {}): room={}", attempt, result.getOutcome(), roomId);
            return;
        }
        log.warn("방 리셋 락 획득 실패, 재예약 ({}/{}): room={}", attempt, MAX_RESET_ATTEMPTS, roomId);
        taskScheduler.schedule(() -> processReset(roomId, expected, attempt + 1),
                Instant.ofEpochMilli(clock.millis() + LOCK_RETRY_DELAY_MS));
    }

    private boolean resetInternal(String roomId, Room expected) {
        Room room = roomRegistry.findRoomById(roomId).orElse(null);
        if (room == null || room != expected) {
            log.info("리셋 취소 (방 없음): room={}", roomId);
            return false;
        }
        if (room.getStatus() != RoomStatus.GAME_OVER) {
            log.info("리셋 취소 (상태 변경됨): room={}, status={}", roomId, room.getStatus());
            return false;
        }

        if (room.isEmpty()) {
            roomRegistry.delete(roomId);
            return true;
        }

        List<Player> removed = room.resetToCaptain();
        for (Player player : removed) {
            lobbyResponseSender.sendKicked(player.getId(), roomId);
        }
        lobbyResponseSender.broadcastRoomUpdate(room);

        log.info("방 리셋 완료: room={}, captain={}, removed={}", roomId, room.getCaptain().getName(), removed.size());
        return true;
    }
}
