package io.github.drompincen.acpbridge.gateway.websocket;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.drompincen.acpbridge.protocol.api.ApprovalRequestDto;
import io.github.drompincen.acpbridge.protocol.api.ApprovalRequestDto.ApprovalStatus;
import io.github.drompincen.acpbridge.protocol.api.ProgressUpdate;
import io.github.drompincen.acpbridge.protocol.ws.WsMessage;
import io.github.drompincen.acpbridge.protocol.ws.WsMessageType;
import io.github.drompincen.acpbridge.runtime.agent.AgentOrchestrator;
import io.github.drompincen.acpbridge.runtime.agent.approval.ApprovalListener;
import io.github.drompincen.acpbridge.runtime.agent.approval.ApprovalService;
import io.github.drompincen.acpbridge.runtime.progress.ProgressBroadcaster;
import io.github.drompincen.acpbridge.runtime.progress.ProgressListener;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.io.IOException;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArraySet;

/**
 * Pushes progress snapshots and approval requests to subscribed UI sessions and accepts
 * approval decisions and stop requests back.
 */
@Component
public class AcpBridgeWebSocketHandler extends TextWebSocketHandler implements ProgressListener, ApprovalListener {

    private static final Logger log = LoggerFactory.getLogger(AcpBridgeWebSocketHandler.class);

    private final ObjectMapper objectMapper;
    private final ProgressBroadcaster broadcaster;
    private final ApprovalService approvalService;
    private final AgentOrchestrator orchestrator;
    private final Map<String, Set<WebSocketSession>> subscriptions = new ConcurrentHashMap<>();

    public AcpBridgeWebSocketHandler(ObjectMapper objectMapper, ProgressBroadcaster broadcaster,
                                     ApprovalService approvalService, AgentOrchestrator orchestrator) {
        this.objectMapper = objectMapper;
        this.broadcaster = broadcaster;
        this.approvalService = approvalService;
        this.orchestrator = orchestrator;
    }

    @PostConstruct
    public void init() {
        broadcaster.addListener(this);
        approvalService.addListener(this);
    }

    @PreDestroy
    public void shutdown() {
        broadcaster.removeListener(this);
        approvalService.removeListener(this);
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        subscriptions.values().forEach(set -> set.remove(session));
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) throws Exception {
        JsonNode node;
        try {
            node = objectMapper.readTree(message.getPayload());
        } catch (IOException e) {
            send(session, WsMessage.error(null, "Malformed message"));
            return;
        }
        String sessionId = node.path("uiSessionId").asText(null);
        WsMessageType type;
        try {
            type = WsMessageType.valueOf(node.path("type").asText(""));
        } catch (IllegalArgumentException e) {
            send(session, WsMessage.error(sessionId, "Unknown message type: " + node.path("type").asText("")));
            return;
        }

        switch (type) {
            case SUBSCRIBE_SESSION:
                if (sessionId == null) {
                    send(session, WsMessage.error(null, "uiSessionId is required"));
                    return;
                }
                subscriptions.computeIfAbsent(sessionId, k -> new CopyOnWriteArraySet<>()).add(session);
                send(session, WsMessage.control(WsMessageType.SUBSCRIBED, sessionId));
                for (ApprovalRequestDto pending : approvalService.listPending(sessionId)) {
                    send(session, WsMessage.of(WsMessageType.APPROVAL_REQUEST, sessionId,
                            objectMapper.valueToTree(pending)));
                }
                break;
            case UNSUBSCRIBE:
                Set<WebSocketSession> set = sessionId != null ? subscriptions.get(sessionId) : null;
                if (set != null) set.remove(session);
                send(session, WsMessage.control(WsMessageType.UNSUBSCRIBED, sessionId));
                break;
            case APPROVE_TOOL_CALL:
                respond(session, sessionId, node, ApprovalStatus.APPROVED);
                break;
            case DENY_TOOL_CALL:
                respond(session, sessionId, node, ApprovalStatus.DENIED);
                break;
            case STOP_SESSION:
                if (sessionId == null) {
                    send(session, WsMessage.error(null, "uiSessionId is required"));
                    return;
                }
                orchestrator.stop(sessionId);
                break;
            default:
                send(session, WsMessage.error(sessionId, "Unsupported message type: " + type));
        }
    }

    private void respond(WebSocketSession session, String sessionId, JsonNode node, ApprovalStatus status) {
        String approvalId = node.path("payload").path("approvalId").asText(null);
        if (approvalId == null) {
            send(session, WsMessage.error(sessionId, "approvalId is required"));
            return;
        }
        if (approvalService.respond(approvalId, status).isEmpty()) {
            send(session, WsMessage.error(sessionId, "No pending approval " + approvalId));
        }
    }

    @Override
    public void onProgress(ProgressUpdate update) {
        broadcast(update.sessionId(), WsMessageType.PROGRESS, update);
    }

    @Override
    public void onApprovalRequest(ApprovalRequestDto request) {
        broadcast(request.uiSessionId(), WsMessageType.APPROVAL_REQUEST, request);
    }

    private void broadcast(String uiSessionId, WsMessageType type, Object payload) {
        if (uiSessionId == null) return;
        Set<WebSocketSession> subscribers = subscriptions.get(uiSessionId);
        if (subscribers == null || subscribers.isEmpty()) return;
        try {
            WsMessage message = WsMessage.of(type, uiSessionId, objectMapper.valueToTree(payload));
            TextMessage text = new TextMessage(objectMapper.writeValueAsString(message));
            for (WebSocketSession ws : subscribers) {
                if (ws.isOpen()) {
                    sendRaw(ws, text);
                }
            }
        } catch (Exception e) {
            log.error("Error broadcasting {} to session {}", type, uiSessionId, e);
        }
    }

    private void send(WebSocketSession session, WsMessage message) {
        try {
            sendRaw(session, new TextMessage(objectMapper.writeValueAsString(message)));
        } catch (IOException e) {
            log.warn("Failed to serialize {} message: {}", message.type(), e.getMessage());
        }
    }

    private void sendRaw(WebSocketSession session, TextMessage text) {
        synchronized (session) {
            try {
                session.sendMessage(text);
            } catch (IOException e) {
                log.debug("Dropping message for closed WebSocket {}: {}", session.getId(), e.getMessage());
            }
        }
    }
}
