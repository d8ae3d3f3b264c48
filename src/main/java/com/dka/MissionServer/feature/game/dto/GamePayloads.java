package com.dka.MissionServer.feature.game.dto;

import com.dka.MissionServer.domain.Player;
import lombok.Builder;
import lombok.Getter;

import java.util.List;

public class GamePayloads {

    // 동기화된 카운트다운 시작 시각 (epoch ms, 절대값)
    @Getter
    @Builder
    public static class StartInfo {
        private long startTime;
    }

    // 최종 결과 + 방 리셋 예정 시각
    @Getter
    @Builder
    public static class GameOverInfo {
        private List<Player> players;
        private long resetTime;
    }
}
