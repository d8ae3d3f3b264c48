package com.dka.MissionServer.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "mission.rule")
public record MissionProperties(
        int requiredPlayers,      // 자동 시작 인원 (= 최대 인원)
        long startDelay,          // 시작 카운트다운 (ms)
        long leaderboardDuration  // 게임 종료 후 방 리셋까지 대기 (ms)
) {

    public MissionProperties {
        if (requiredPlayers < 1) {
            throw new IllegalArgumentException("mission.rule.required-players must be >= 1 but was " + requiredPlayers);
        }
        if (startDelay < 0) {
            throw new IllegalArgumentException("mission.rule.start-delay must be >= 0 but was " + startDelay);
        }
        if (leaderboardDuration < 0) {
            throw new IllegalArgumentException("mission.rule.leaderboard-duration must be >= 0 but was " + leaderboardDuration);
        }
    }
}
