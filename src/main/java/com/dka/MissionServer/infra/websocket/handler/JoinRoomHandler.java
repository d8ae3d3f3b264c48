package com.dka.MissionServer.infra.websocket.handler;

import com.dka.MissionServer.feature.lobby.LobbyService;
import com.dka.MissionServer.feature.lobby.dto.JoinRoomRequest;
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
public class JoinRoomHandler implements WebSocketCommandHandler {

    private final LobbyService lobbyService;
    private final ObjectMapper objectMapper;

    @Override
    public String getAction() {
        return SocketEvent.JOIN_ROOM.getEventName();
    }

    @Override
    public void handle(WebSocketSession session, JsonNode payload) {
        try {
            JoinRoomRequest dto = objectMapper.treeToValue(payload, JoinRoomRequest.class);
            if (dto == null) {
                log.warn("[join_room] payload가 없습니다: session={}", session.getId());
                return;
            }
            ActionResult result = lobbyService.joinRoom(session.getId(), dto.getRoomId(), dto.getName());
            if (!result.isSuccess()) {
                log.debug("[join_room] 처리되지 않음: session={}, result={}", session.getId(), result);
            }
        } catch (Exception e) {
            log.error("[join_room] 처리 중 오류: session={}, msg={}", session.getId(), e.getMessage(), e);
        }
    }
}
