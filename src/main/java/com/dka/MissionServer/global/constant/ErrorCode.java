package com.dka.MissionServer.global.constant;

import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public enum ErrorCode {

    // 요청자에게 error_msg 로 전달
    ROOM_ALREADY_PLAYING("Mission already in progress. Access Denied."),
    ROOM_FULL("Team is full (Max %d Agents)."),
    ROOM_BUSY("Server is busy. Please try again."),

    // 조용히 무시 (로그만)
    ROOM_NOT_FOUND("Room does not exist."),
    PLAYER_NOT_FOUND("Player is not in this room."),
    ALREADY_JOINED("Player already joined this room."),
    NOT_CAPTAIN("Only the captain can kick players."),
    SELF_KICK("Captain cannot kick themselves."),
    INVALID_REQUEST("Malformed request.");

    private final String message;

    public String format(Object... args) {
        return String.format(message, args);
    }
}
