package com.syncmirror.connection;

import com.syncmirror.protocol.payload.AuthPayload;

import java.util.List;

/**
 * What a connection declares about this client in its opening handshake.
 */
public final class ClientIdentity {

    private final String clientId;
    private final String platform;
    private final List<String> capabilities;
    private final String version;

    public ClientIdentity(String clientId, String platform, List<String> capabilities, String version) {
        this.clientId = clientId;
        this.platform = platform;
        this.capabilities = List.copyOf(capabilities);
        this.version = version;
    }

    public String getClientId() {
        return clientId;
    }

    public String getPlatform() {
        return platform;
    }

    public List<String> getCapabilities() {
        return capabilities;
    }

    public String getVersion() {
        return version;
    }

    AuthPayload toAuthPayload(int poolIndex) {
        return new AuthPayload(clientId, platform, capabilities, version, poolIndex);
    }
}
