package io.github.drompincen.acpbridge.persistence.document;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import io.github.drompincen.acpbridge.protocol.api.HistoryMessage;
import io.github.drompincen.acpbridge.protocol.api.PendingToolCall;

import java.util.ArrayList;
import java.util.List;

@JsonInclude(JsonInclude.Include.NON_EMPTY)
@JsonIgnoreProperties(ignoreUnknown = true)
public class MessageDocument {

    private String role;
    private String content;
    private long timestamp;
    private List<PendingToolCall> toolCalls = new ArrayList<>();

    public MessageDocument() {}

    public static MessageDocument from(HistoryMessage message) {
        MessageDocument doc = new MessageDocument();
        doc.setRole(message.role());
        doc.setContent(message.content());
        doc.setTimestamp(message.timestamp() != null ? message.timestamp() : System.currentTimeMillis());
        if (message.toolCalls() != null) {
            doc.setToolCalls(new ArrayList<>(message.toolCalls()));
        }
        return doc;
    }

    public HistoryMessage toHistoryMessage() {
        return new HistoryMessage(role, content, timestamp, toolCalls != null ? List.copyOf(toolCalls) : List.of());
    }

    public String getRole() { return role; }
    public void setRole(String role) { this.role = role; }

    public String getContent() { return content; }
    public void setContent(String content) { this.content = content; }

    public long getTimestamp() { return timestamp; }
    public void setTimestamp(long timestamp) { this.timestamp = timestamp; }

    public List<PendingToolCall> getToolCalls() { return toolCalls; }
    public void setToolCalls(List<PendingToolCall> toolCalls) { this.toolCalls = toolCalls; }
}
