package com.dka.MissionServer.feature.game.dto;

import com.dka.MissionServer.domain.type.PlayerStatus;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

@Getter
@NoArgsConstructor
@AllArgsConstructor
public class UpdatePlayerRequest {
    private String roomId;
    private Integer score;
    private PlayerStatus status;
}
