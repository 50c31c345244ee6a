package io.github.drompincen.acpbridge.persistence.document;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.ArrayList;
import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public class ConversationDocument {

    private String id;
    private String title;
    private long createdAt;
    private long updatedAt;
    private List<MessageDocument> messages = new ArrayList<>();

    public ConversationDocument() {}

    public String getId() { return id; }
    public void setId(String id) { this.id = id; }

    public String getTitle() { return title; }
    public void setTitle(String title) { this.title = title; }

    public long getCreatedAt() { return createdAt; }
    public void setCreatedAt(long createdAt) { this.createdAt = createdAt; }

    public long getUpdatedAt() { return updatedAt; }
    public void setUpdatedAt(long updatedAt) { this.updatedAt = updatedAt; }

    public List<MessageDocument> getMessages() { return messages; }
    public void setMessages(List<MessageDocument> messages) { this.messages = messages; }
}
