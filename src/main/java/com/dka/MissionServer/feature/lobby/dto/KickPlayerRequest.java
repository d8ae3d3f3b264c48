package com.dka.MissionServer.feature.lobby.dto;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

@Getter
@NoArgsConstructor
@AllArgsConstructor
public class KickPlayerRequest {
    private String roomId;
    private String targetId;
}
