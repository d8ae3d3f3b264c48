package com.dka.MissionServer.infra.websocket.handler;

import com.dka.MissionServer.feature.lobby.LobbyService;
import com.dka.MissionServer.global.constant.SocketEvent;
import com.dka.MissionServer.global.result.ActionResult;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.WebSocketSession;

@Slf4j
@Component
@RequiredArgsConstructor
public class ToggleReadyHandler implements WebSocketCommandHandler {

    private final LobbyService lobbyService;

    @Override
    public String getAction() {
        return SocketEvent.TOGGLE_READY.getEventName();
    }

    // payload: "roomId" 문자열 또는 {"roomId": "..."}
    @Override
    public void handle(WebSocketSession session, JsonNode payload) {
        if (payload == null || payload.isNull()) {
            log.warn("[toggle_ready] payload가 없습니다: session={}", session.getId());
            return;
        }
        String roomId = payload.isTextual() ? payload.asText() : payload.path("roomId").asText(null);

        ActionResult result = lobbyService.toggleReady(session.getId(), roomId);
        if (!result.isSuccess()) {
            log.debug("[toggle_ready] 처리되지 않음: session={}, result={}", session.getId(), result);
        }
    }
}
