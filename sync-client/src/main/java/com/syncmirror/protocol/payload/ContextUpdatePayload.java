package com.syncmirror.protocol.payload;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.List;

/**
 * Conversation context shared between platforms.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class ContextUpdatePayload implements Payload, Correlated {

    private final String conversationId;
    private final List<String> activeTopics;
    private final String summary;
    private final List<String> platformHistory;
    private final String replyTo;

    @JsonCreator
    public ContextUpdatePayload(@JsonProperty("conversation_id") String conversationId,
                                @JsonProperty("active_topics") List<String> activeTopics,
                                @JsonProperty("summary") String summary,
                                @JsonProperty("platform_history") List<String> platformHistory,
                                @JsonProperty("reply_to") String replyTo) {
        this.conversationId = conversationId;
        this.activeTopics = activeTopics == null ? Collections.emptyList() : List.copyOf(activeTopics);
        this.summary = summary;
        this.platformHistory = platformHistory == null ? Collections.emptyList() : List.copyOf(platformHistory);
        this.replyTo = replyTo;
    }

    @JsonProperty("conversation_id")
    public String getConversationId() {
        return conversationId;
    }

    @JsonProperty("active_topics")
    public List<String> getActiveTopics() {
        return activeTopics;
    }

    @JsonProperty("summary")
    public String getSummary() {
        return summary;
    }

    @JsonProperty("platform_history")
    public List<String> getPlatformHistory() {
        return platformHistory;
    }

    @JsonProperty("reply_to")
    public String getReplyTo() {
        return replyTo;
    }

    @Override
    public String correlationId() {
        return replyTo;
    }
}
