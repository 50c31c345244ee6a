package io.github.drompincen.acpbridge.protocol.ws;

public enum WsMessageType {
    // Client -> Server
    SUBSCRIBE_SESSION,
    UNSUBSCRIBE,
    APPROVE_TOOL_CALL,
    DENY_TOOL_CALL,
    STOP_SESSION,

    // Server -> Client
    PROGRESS,
    APPROVAL_REQUEST,
    ERROR,
    SUBSCRIBED,
    UNSUBSCRIBED
}
