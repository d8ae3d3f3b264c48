package com.dka.MissionServer.infra.websocket;

import com.dka.MissionServer.feature.lobby.LobbyService;
import com.dka.MissionServer.infra.websocket.dto.WebSocketRequest;
import com.dka.MissionServer.infra.websocket.handler.WebSocketCommandHandler;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

@Slf4j
@Component
public class WebSocketRouterHandler extends TextWebSocketHandler {

    private final WebSocketSessionManager sessionManager;
    private final ObjectMapper objectMapper;
    private final LobbyService lobbyService;
    private final Map<String, WebSocketCommandHandler> handlers;

    public WebSocketRouterHandler(WebSocketSessionManager sessionManager,
                                  ObjectMapper objectMapper,
                                  LobbyService lobbyService,
                                  List<WebSocketCommandHandler> commandHandlers) {
        this.sessionManager = sessionManager;
        this.objectMapper = objectMapper;
        this.lobbyService = lobbyService;
        this.handlers = commandHandlers.stream()
                .collect(Collectors.toMap(WebSocketCommandHandler::getAction, Function.identity()));
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession session) throws Exception {
        log.info("새로운 세션 연결: {}", session.getId());
        sessionManager.registerSession(session);
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) throws Exception {
        try {
            WebSocketRequest request = objectMapper.readValue(message.getPayload(), WebSocketRequest.class);
            if (request == null || request.getAction() == null) {
                log.warn("action이 없는 메시지: session={}", session.getId());
                return;
            }
            log.debug("Action 수신: {}, Session: {}", request.getAction(), session.getId());

            WebSocketCommandHandler handler = handlers.get(request.getAction());
            if (handler == null) {
                log.warn("알 수 없는 Action입니다: {}", request.getAction());
                return;
            }
            handler.handle(session, request.getPayload());

        } catch (Exception e) {
            log.error("메시지 처리 중 오류: session={}, msg={}", session.getId(), e.getMessage(), e);
        }
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) throws Exception {
        log.info("세션 연결 종료: {} (사유: {})", session.getId(), status);
        sessionManager.removeSession(session);
        lobbyService.disconnect(session.getId());
    }

    @Override
    public void handleTransportError(WebSocketSession session, Throwable exception) throws Exception {
        log.error("전송 오류 발생: [세션 ID: {}], [오류: {}]", session.getId(), exception.getMessage());
    }
}
