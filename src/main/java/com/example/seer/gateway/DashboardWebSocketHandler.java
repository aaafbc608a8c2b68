package com.example.seer.gateway;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.io.IOException;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * WebSocket endpoint dashboards connect to. Inbound traffic is limited to
 * heartbeats; everything else flows server to client as JSON-RPC notifications.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DashboardWebSocketHandler extends TextWebSocketHandler implements EventBroadcaster {

    private static final int SEND_TIME_LIMIT_MS = 5_000;
    private static final int BUFFER_SIZE_LIMIT = 512 * 1024;

    private final ObjectMapper objectMapper;

    private final Map<String, WebSocketSession> sessions = new ConcurrentHashMap<>();

    @Override
    public void afterConnectionEstablished(WebSocketSession session) {
        WebSocketSession safe = new ConcurrentWebSocketSessionDecorator(session, SEND_TIME_LIMIT_MS, BUFFER_SIZE_LIMIT);
        sessions.put(session.getId(), safe);
        log.info("Dashboard session connected: {} (total: {})", session.getId(), sessions.size());
        send(safe, JsonRpcMessage.notification("gateway.connected", Map.of(
                "sessionId", session.getId(),
                "timestamp", Instant.now().toString())));
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) {
        WebSocketSession target = sessions.getOrDefault(session.getId(), session);
        try {
            JsonRpcMessage rpc = objectMapper.readValue(message.getPayload(), JsonRpcMessage.class);
            if ("heartbeat".equals(rpc.getMethod())) {
                send(target, JsonRpcMessage.success(rpc.getId(), Map.of(
                        "status", "alive",
                        "timestamp", Instant.now().toString())));
            } else {
                send(target, JsonRpcMessage.error(rpc.getId(), -32601, "Method not found: " + rpc.getMethod()));
            }
        } catch (IOException e) {
            log.warn("Unparseable message from session {}: {}", session.getId(), e.getMessage());
            send(target, JsonRpcMessage.error(null, -32700, "Parse error: " + e.getMessage()));
        }
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        sessions.remove(session.getId());
        log.info("Dashboard session disconnected: {} (reason: {}, total: {})",
                session.getId(), status.getReason(), sessions.size());
    }

    @Override
    public void handleTransportError(WebSocketSession session, Throwable exception) {
        log.error("Transport error for session {}: {}", session.getId(), exception.getMessage());
        sessions.remove(session.getId());
    }

    @Override
    public void broadcast(String method, Object params) {
        JsonRpcMessage notification = JsonRpcMessage.notification(method, params);
        sessions.values().forEach(session -> {
            if (session.isOpen()) {
                send(session, notification);
            }
        });
    }

    public int getActiveSessionCount() {
        return sessions.size();
    }

    private void send(WebSocketSession session, JsonRpcMessage message) {
        try {
            session.sendMessage(new TextMessage(objectMapper.writeValueAsString(message)));
        } catch (IOException e) {
            log.error("Failed to send {} to session {}", message.getMethod(), session.getId(), e);
        }
    }
}
