package com.syncmirror.protocol.payload;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.List;

/**
 * Identify message sent on every freshly opened connection.
 */
public final class AuthPayload implements Payload {

    private final String clientId;
    private final String platform;
    private final List<String> capabilities;
    private final String version;
    private final int poolIndex;

    @JsonCreator
    public AuthPayload(@JsonProperty("client_id") String clientId,
                       @JsonProperty("platform") String platform,
                       @JsonProperty("capabilities") List<String> capabilities,
                       @JsonProperty("version") String version,
                       @JsonProperty("pool_index") int poolIndex) {
        this.clientId = clientId;
        this.platform = platform;
        this.capabilities = capabilities == null ? Collections.emptyList() : List.copyOf(capabilities);
        this.version = version;
        this.poolIndex = poolIndex;
    }

    @JsonProperty("client_id")
    public String getClientId() {
        return clientId;
    }

    @JsonProperty("platform")
    public String getPlatform() {
        return platform;
    }

    @JsonProperty("capabilities")
    public List<String> getCapabilities() {
        return capabilities;
    }

    @JsonProperty("version")
    public String getVersion() {
        return version;
    }

    @JsonProperty("pool_index")
    public int getPoolIndex() {
        return poolIndex;
    }
}
