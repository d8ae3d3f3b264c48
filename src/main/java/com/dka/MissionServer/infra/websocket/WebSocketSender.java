package com.dka.MissionServer.infra.websocket;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;

import java.io.IOException;
import java.util.Collection;

@Slf4j
@Component
@RequiredArgsConstructor
public class WebSocketSender {

    private final WebSocketSessionManager sessionManager;
    private final ObjectMapper objectMapper;

    public void sendEventToSession(String sessionId, Object event) {
        String payload = serialize(event);
        if (payload != null) {
            sendLocal(sessionId, payload);
        }
    }

    /**
     * 한 번 직렬화한 페이로드를 여러 세션에 전송한다.
     * 호출 시점의 객체 상태가 그대로 전달되므로 방 락 안에서 호출해야 한다.
     */
    public void sendEventToSessions(Collection<String> sessionIds, Object event) {
        String payload = serialize(event);
        if (payload == null) {
            return;
        }
        for (String sessionId : sessionIds) {
            sendLocal(sessionId, payload);
        }
        log.debug("이벤트 브로드캐스트 (1:N): [대상 수: {}], [페이로드: {}]", sessionIds.size(), payload);
    }

    private String serialize(Object event) {
        try {
            return objectMapper.writeValueAsString(event);
        } catch (JsonProcessingException e) {
            log.error("이벤트 직렬화 실패: [이벤트: {}], [오류: {}]", event, e.getMessage(), e);
            return null;
        }
    }

    private void sendLocal(String sessionId, String payload) {
        WebSocketSession session = sessionManager.getSession(sessionId);
        if (session != null && session.isOpen()) {
            try {
                session.sendMessage(new TextMessage(payload));
                log.debug("이벤트 전송 (1:1): [세션 ID: {}], [페이로드: {}]", sessionId, payload);
            } catch (IOException e) {
                log.error("1:1 이벤트 전송 실패: [세션 ID: {}], [오류: {}]", sessionId, e.getMessage());
            }
        } else {
            log.warn("세션을 찾을 수 없거나 닫혀있습니다: [세션 ID: {}]", sessionId);
        }
    }
}
