package com.dka.MissionServer.feature.game;

import lombok.Getter;

/**
 * 방 락 안에서 실행한 작업의 결과.
 * 락을 잡지 못했다면 작업은 한 번도 실행되지 않았고 data는 null이다.
 */
@Getter
public class LockResult<T> {
    private final String roomId;
    private final T data;
    private final Outcome outcome;

    public enum Outcome {
        ACQUIRED,       // 락 안에서 실행됨 (Runnable이면 data 없음)
        TIMED_OUT,      // 재시도까지 모두 대기 시간 초과
        INTERRUPTED     // 대기 중 인터럽트
    }

    private LockResult(String roomId, T data, Outcome outcome) {
        this.roomId = roomId;
        this.data = data;
        this.outcome = outcome;
    }

    static <T> LockResult<T> acquired(String roomId, T data) {
        return new LockResult<>(roomId, data, Outcome.ACQUIRED);
    }

    static <T> LockResult<T> timedOut(String roomId) {
        return new LockResult<>(roomId, null, Outcome.TIMED_OUT);
    }

    static <T> LockResult<T> interrupted(String roomId) {
        return new LockResult<>(roomId, null, Outcome.INTERRUPTED);
    }

    public boolean isLockFailed() {
        return outcome != Outcome.ACQUIRED;
    }

    /** 락 실패 시 대신 돌려줄 값. 실행된 작업의 결과는 그대로 반환한다. */
    public T orElse(T whenLockFailed) {
        return isLockFailed() ? whenLockFailed : data;
    }
}
