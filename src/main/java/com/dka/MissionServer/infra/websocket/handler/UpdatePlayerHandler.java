package com.dka.MissionServer.infra.websocket.handler;

import com.dka.MissionServer.feature.game.GamePlayService;
import com.dka.MissionServer.feature.game.dto.UpdatePlayerRequest;
import com.dka.MissionServer.global.constant.SocketEvent;
import com.dka.MissionServer.global.result.ActionResult;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.WebSocketSession;

@Slf4j
@Component
@RequiredArgsConstructor
public class UpdatePlayerHandler implements WebSocketCommandHandler {

    private final GamePlayService gamePlayService;
    private final ObjectMapper objectMapper;

    @Override
    public String getAction() {
        return SocketEvent.UPDATE_PLAYER.getEventName();
    }

    @Override
    public void handle(WebSocketSession session, JsonNode payload) {
        try {
            UpdatePlayerRequest dto = objectMapper.treeToValue(payload, UpdatePlayerRequest.class);
            ActionResult result = gamePlayService.updatePlayer(session.getId(), dto);
            if (!result.isSuccess()) {
                log.debug("[update_player] 처리되지 않음: session={}, result={}", session.getId(), result);
            }
        } catch (Exception e) {
            log.error("[update_player] 처리 중 오류: session={}, msg={}", session.getId(), e.getMessage(), e);
        }
    }
}
