package com.dka.MissionServer.feature.game;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * 방 단위 상호 배제. 같은 방에 대한 모든 변경(타이머 콜백 포함)은 이 파사드를 거친다.
 * 락은 방 ID 해시로 고른 고정 개수의 스트라이프이므로 방이 삭제되어도 락 객체는 남는다.
 * 한 스레드는 동시에 하나의 방 락만 잡는다.
 */
@Slf4j
@Component
public class RoomLockFacade {

    private static final int STRIPES = 64;
    private static final long WAIT_TIME_MS = 2000L;   // 락 대기 최대 시간
    private static final int MAX_RETRY = 3;           // 최대 3번 재시도
    private static final long RETRY_DELAY_MS = 100L;  // 재시도 사이 휴식

    private final ReentrantLock[] locks;
    private final long waitTimeMs;
    private final int maxRetry;
    private final long retryDelayMs;

    public RoomLockFacade() {
        this(WAIT_TIME_MS, MAX_RETRY, RETRY_DELAY_MS);
    }

    RoomLockFacade(long waitTimeMs, int maxRetry, long retryDelayMs) {
        this.waitTimeMs = waitTimeMs;
        this.maxRetry = maxRetry;
        this.retryDelayMs = retryDelayMs;
        this.locks = new ReentrantLock[STRIPES];
        for (int i = 0; i < STRIPES; i++) {
            this.locks[i] = new ReentrantLock();
        }
    }

    public LockResult<Void> execute(String roomId, Runnable action) {
        return executeInternal(roomId, () -> {
            action.run();
            return null;
        });
    }

    public <T> LockResult<T> execute(String roomId, Supplier<T> action) {
        return executeInternal(roomId, action);
    }

    private <T> LockResult<T> executeInternal(String roomId, Supplier<T> action) {
        ReentrantLock lock = lockFor(roomId);

        for (int i = 0; i < maxRetry; i++) {
            try {
                boolean available = lock.tryLock(waitTimeMs, TimeUnit.MILLISECONDS);

                if (available) {
                    try {
                        T result = action.get();
                        return LockResult.acquired(roomId, result);
                    } finally {
                        lock.unlock();
                    }
                }

                log.warn("방 락 획득 실패, 재시도 대기중 ({}/{}): roomId={}", i + 1, maxRetry, roomId);
                Thread.sleep(retryDelayMs);

            } catch (InterruptedException e) {
                log.error("방 락 대기 중 인터럽트: roomId={}", roomId, e);
                Thread.currentThread().interrupt();
                return LockResult.interrupted(roomId);
            } catch (RuntimeException e) {
                log.error("방 처리 중 오류: roomId={}", roomId, e);
                throw e;
            }
        }

        log.error("방 락 획득 최종 실패 (Timeout): roomId={}", roomId);
        return LockResult.timedOut(roomId);
    }

    private ReentrantLock lockFor(String roomId) {
        return locks[Math.floorMod(roomId.hashCode(), STRIPES)];
    }
}
