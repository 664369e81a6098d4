package com.syncmirror.protocol.payload;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A locally generated event. Its envelope id doubles as the event id that the
 * authority echoes back in {@link EventAckPayload}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class EventPayload implements Payload {

    private final String content;
    private final Map<String, String> context;
    private final String platform;
    private final long createdAt;

    @JsonCreator
    public EventPayload(@JsonProperty("content") String content,
                        @JsonProperty("context") Map<String, String> context,
                        @JsonProperty("platform") String platform,
                        @JsonProperty("created_at") long createdAt) {
        this.content = content;
        this.context = context == null
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(context));
        this.platform = platform;
        this.createdAt = createdAt;
    }

    @JsonProperty("content")
    public String getContent() {
        return content;
    }

    @JsonProperty("context")
    public Map<String, String> getContext() {
        return context;
    }

    @JsonProperty("platform")
    public String getPlatform() {
        return platform;
    }

    @JsonProperty("created_at")
    public long getCreatedAt() {
        return createdAt;
    }
}
