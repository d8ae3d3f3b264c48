package com.dka.MissionServer.domain.type;

public enum RoomStatus {
    LOBBY,     // 대기 중 (입장 가능)
    PLAYING,   // 미션 진행 중 (입장 불가)
    GAME_OVER  // 리더보드 표시 중, 리셋 대기
}
