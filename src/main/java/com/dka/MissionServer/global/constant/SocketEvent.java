package com.dka.MissionServer.global.constant;

import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public enum SocketEvent {

    // inbound
    JOIN_ROOM("join_room"),
    TOGGLE_READY("toggle_ready"),
    KICK_PLAYER("kick_player"),
    UPDATE_PLAYER("update_player"),

    // outbound
    ROOM_UPDATE("room_update"),         // 전체 플레이어 목록
    ERROR_MSG("error_msg"),             // 요청자 전용
    START_GAME("start_game"),           // {startTime}
    PLAYER_UPDATED("player_updated"),   // 단일 플레이어
    FORCE_GAME_OVER("force_game_over"), // {players, resetTime}
    KICKED("kicked");                   // 대상 연결 전용

    private final String eventName;
}
