package com.dka.MissionServer.feature.status;

import com.dka.MissionServer.config.MissionProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequiredArgsConstructor
public class StatusController {

    private final MissionProperties missionProperties;

    @GetMapping(value = "/", produces = MediaType.TEXT_PLAIN_VALUE)
    public String status() {
        return "DKA Game Server Running. Mode: " + missionProperties.requiredPlayers() + " Players Auto-Start.";
    }
}
