package com.dka.MissionServer.domain;

import com.dka.MissionServer.domain.type.PlayerStatus;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;
import org.springframework.util.StringUtils;

@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
@ToString
public class Player {

    private static final String DEFAULT_NAME_PREFIX = "Agent ";
    private static final int DEFAULT_NAME_ID_LENGTH = 4;

    private String id;   // 연결 ID (1:1 전송 주소)
    private String name; // 표시용 이름

    @JsonProperty("isReady")
    private boolean ready;

    private int score;

    @Builder.Default
    private PlayerStatus status = PlayerStatus.ALIVE;

    public static Player join(String id, String name) {
        return Player.builder()
                .id(id)
                .name(StringUtils.hasText(name) ? name : defaultName(id))
                .ready(false)
                .score(0)
                .status(PlayerStatus.ALIVE)
                .build();
    }

    static String defaultName(String id) {
        String prefix = id.length() > DEFAULT_NAME_ID_LENGTH ? id.substring(0, DEFAULT_NAME_ID_LENGTH) : id;
        return DEFAULT_NAME_PREFIX + prefix;
    }

    public void toggleReady() {
        this.ready = !this.ready;
    }

    public void resetForLobby() {
        this.ready = false;
        this.score = 0;
        this.status = PlayerStatus.ALIVE;
    }
}
