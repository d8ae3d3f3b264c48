package com.dka.MissionServer.feature.lobby.dto;

import lombok.Builder;
import lombok.Getter;

public class LobbyPayloads {

    // 강퇴 알림 (대상 1명)
    @Getter
    @Builder
    public static class KickedInfo {
        private String roomId;
    }
}
