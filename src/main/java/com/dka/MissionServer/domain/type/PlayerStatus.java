package com.dka.MissionServer.domain.type;

public enum PlayerStatus {
    ALIVE,
    DEAD,
    FINISHED;

    public boolean isDone() {
        return this == DEAD || this == FINISHED;
    }
}
