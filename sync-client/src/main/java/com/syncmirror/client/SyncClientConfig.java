package com.syncmirror.client;

import com.syncmirror.state.MilestoneTable;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Arrays;
import java.util.List;
import java.util.function.Function;

/**
 * Immutable client configuration.
 *
 * Built with {@link #builder()} or loaded from environment variables with
 * {@link #fromEnv()}. Values are validated when built.
 */
public final class SyncClientConfig {

    public static final String DEFAULT_ENDPOINT = "ws://localhost:8765/sync";
    public static final List<String> DEFAULT_CAPABILITIES = List.of("state_sync", "context_update", "event_stream");

    private final URI endpoint;
    private final int poolSize;
    private final long reconnectBaseMs;
    private final long reconnectCapMs;
    private final int maxReconnectAttempts;
    private final long heartbeatIntervalMs;
    private final int maxMissedPongs;
    private final long messageTimeoutMs;
    private final int queueCapacity;
    private final int bufferCapacity;
    private final int maxRetries;
    private final long connectTimeoutMs;
    private final long handshakeTimeoutMs;
    private final long drainIntervalMs;
    private final int historyCapacity;
    private final double trendEpsilon;
    private final int dedupWindow;
    private final String platform;
    private final List<String> capabilities;
    private final MilestoneTable milestones;

    private SyncClientConfig(Builder b) {
        this.endpoint = b.endpoint;
        this.poolSize = b.poolSize;
        this.reconnectBaseMs = b.reconnectBaseMs;
        this.reconnectCapMs = b.reconnectCapMs;
        this.maxReconnectAttempts = b.maxReconnectAttempts;
        this.heartbeatIntervalMs = b.heartbeatIntervalMs;
        this.maxMissedPongs = b.maxMissedPongs;
        this.messageTimeoutMs = b.messageTimeoutMs;
        this.queueCapacity = b.queueCapacity;
        this.bufferCapacity = b.bufferCapacity;
        this.maxRetries = b.maxRetries;
        this.connectTimeoutMs = b.connectTimeoutMs;
        this.handshakeTimeoutMs = b.handshakeTimeoutMs;
        this.drainIntervalMs = b.drainIntervalMs;
        this.historyCapacity = b.historyCapacity;
        this.trendEpsilon = b.trendEpsilon;
        this.dedupWindow = b.dedupWindow;
        this.platform = b.platform;
        this.capabilities = List.copyOf(b.capabilities);
        this.milestones = b.milestones;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        Builder b = new Builder();
        b.endpoint = endpoint;
        b.poolSize = poolSize;
        b.reconnectBaseMs = reconnectBaseMs;
        b.reconnectCapMs = reconnectCapMs;
        b.maxReconnectAttempts = maxReconnectAttempts;
        b.heartbeatIntervalMs = heartbeatIntervalMs;
        b.maxMissedPongs = maxMissedPongs;
        b.messageTimeoutMs = messageTimeoutMs;
        b.queueCapacity = queueCapacity;
        b.bufferCapacity = bufferCapacity;
        b.maxRetries = maxRetries;
        b.connectTimeoutMs = connectTimeoutMs;
        b.handshakeTimeoutMs = handshakeTimeoutMs;
        b.drainIntervalMs = drainIntervalMs;
        b.historyCapacity = historyCapacity;
        b.trendEpsilon = trendEpsilon;
        b.dedupWindow = dedupWindow;
        b.platform = platform;
        b.capabilities = capabilities;
        b.milestones = milestones;
        return b;
    }

    public static SyncClientConfig defaults() {
        return builder().build();
    }

    /**
     * Loads configuration from {@code SYNC_*} environment variables, falling back to defaults.
     */
    public static SyncClientConfig fromEnv() {
        return fromEnv(System::getenv);
    }

    static SyncClientConfig fromEnv(Function<String, String> env) {
        Builder b = builder()
                .endpointUrl(getEnv(env, "SYNC_ENDPOINT_URL", DEFAULT_ENDPOINT))
                .poolSize(Integer.parseInt(getEnv(env, "SYNC_POOL_SIZE", "1")))
                .reconnectBaseMs(Long.parseLong(getEnv(env, "SYNC_RECONNECT_BASE_MS", "1000")))
                .reconnectCapMs(Long.parseLong(getEnv(env, "SYNC_RECONNECT_CAP_MS", "30000")))
                .maxReconnectAttempts(Integer.parseInt(getEnv(env, "SYNC_MAX_RECONNECT_ATTEMPTS", "-1")))
                .heartbeatIntervalMs(Long.parseLong(getEnv(env, "SYNC_HEARTBEAT_INTERVAL_MS", "30000")))
                .messageTimeoutMs(Long.parseLong(getEnv(env, "SYNC_MESSAGE_TIMEOUT_MS", "10000")))
                .queueCapacity(Integer.parseInt(getEnv(env, "SYNC_QUEUE_CAPACITY", "1000")))
                .bufferCapacity(Integer.parseInt(getEnv(env, "SYNC_BUFFER_CAPACITY", "500")))
                .platform(getEnv(env, "SYNC_PLATFORM", "jvm"));
        String capabilities = env.apply("SYNC_CAPABILITIES");
        if (capabilities != null && !capabilities.isBlank()) {
            b.capabilities(Arrays.asList(capabilities.trim().split("\\s*,\\s*")));
        }
        return b.build();
    }

    private static String getEnv(Function<String, String> env, String key, String defaultValue) {
        String value = env.apply(key);
        return value != null ? value : defaultValue;
    }

    public URI getEndpoint() {
        return endpoint;
    }

    public int getPoolSize() {
        return poolSize;
    }

    public long getReconnectBaseMs() {
        return reconnectBaseMs;
    }

    public long getReconnectCapMs() {
        return reconnectCapMs;
    }

    /**
     * -1 means unlimited.
     */
    public int getMaxReconnectAttempts() {
        return maxReconnectAttempts;
    }

    public long getHeartbeatIntervalMs() {
        return heartbeatIntervalMs;
    }

    public int getMaxMissedPongs() {
        return maxMissedPongs;
    }

    public long getMessageTimeoutMs() {
        return messageTimeoutMs;
    }

    public int getQueueCapacity() {
        return queueCapacity;
    }

    public int getBufferCapacity() {
        return bufferCapacity;
    }

    public int getMaxRetries() {
        return maxRetries;
    }

    public long getConnectTimeoutMs() {
        return connectTimeoutMs;
    }

    public long getHandshakeTimeoutMs() {
        return handshakeTimeoutMs;
    }

    public long getDrainIntervalMs() {
        return drainIntervalMs;
    }

    public int getHistoryCapacity() {
        return historyCapacity;
    }

    public double getTrendEpsilon() {
        return trendEpsilon;
    }

    public int getDedupWindow() {
        return dedupWindow;
    }

    public String getPlatform() {
        return platform;
    }

    public List<String> getCapabilities() {
        return capabilities;
    }

    public MilestoneTable getMilestones() {
        return milestones;
    }

    @Override
    public String toString() {
        return "SyncClientConfig{" +
                "endpoint=" + endpoint +
                ", poolSize=" + poolSize +
                ", reconnect=" + reconnectBaseMs + ".." + reconnectCapMs + "ms" +
                ", maxReconnectAttempts=" + maxReconnectAttempts +
                ", heartbeatIntervalMs=" + heartbeatIntervalMs +
                ", queueCapacity=" + queueCapacity +
                ", bufferCapacity=" + bufferCapacity +
                '}';
    }

    public static final class Builder {
        private URI endpoint = URI.create(DEFAULT_ENDPOINT);
        private int poolSize = 1;
        private long reconnectBaseMs = 1000;
        private long reconnectCapMs = 30000;
        private int maxReconnectAttempts = -1;
        private long heartbeatIntervalMs = 30000;
        private int maxMissedPongs = 2;
        private long messageTimeoutMs = 10000;
        private int queueCapacity = 1000;
        private int bufferCapacity = 500;
        private int maxRetries = 3;
        private long connectTimeoutMs = 5000;
        private long handshakeTimeoutMs = 5000;
        private long drainIntervalMs = 100;
        private int historyCapacity = 100;
        private double trendEpsilon = 0.01;
        private int dedupWindow = 1024;
        private String platform = "jvm";
        private List<String> capabilities = DEFAULT_CAPABILITIES;
        private MilestoneTable milestones = MilestoneTable.defaults();

        private Builder() {
        }

        public Builder endpointUrl(String endpointUrl) {
            try {
                this.endpoint = new URI(endpointUrl);
            } catch (URISyntaxException e) {
                throw new IllegalArgumentException("Invalid endpoint URL: " + endpointUrl, e);
            }
            return this;
        }

        public Builder endpoint(URI endpoint) {
            this.endpoint = endpoint;
            return this;
        }

        public Builder poolSize(int poolSize) {
            this.poolSize = poolSize;
            return this;
        }

        public Builder reconnectBaseMs(long reconnectBaseMs) {
            this.reconnectBaseMs = reconnectBaseMs;
            return this;
        }

        public Builder reconnectCapMs(long reconnectCapMs) {
            this.reconnectCapMs = reconnectCapMs;
            return this;
        }

        public Builder maxReconnectAttempts(int maxReconnectAttempts) {
            this.maxReconnectAttempts = maxReconnectAttempts;
            return this;
        }

        public Builder heartbeatIntervalMs(long heartbeatIntervalMs) {
            this.heartbeatIntervalMs = heartbeatIntervalMs;
            return this;
        }

        public Builder maxMissedPongs(int maxMissedPongs) {
            this.maxMissedPongs = maxMissedPongs;
            return this;
        }

        public Builder messageTimeoutMs(long messageTimeoutMs) {
            this.messageTimeoutMs = messageTimeoutMs;
            return this;
        }

        public Builder queueCapacity(int queueCapacity) {
            this.queueCapacity = queueCapacity;
            return this;
        }

        public Builder bufferCapacity(int bufferCapacity) {
            this.bufferCapacity = bufferCapacity;
            return this;
        }

        public Builder maxRetries(int maxRetries) {
            this.maxRetries = maxRetries;
            return this;
        }

        public Builder connectTimeoutMs(long connectTimeoutMs) {
            this.connectTimeoutMs = connectTimeoutMs;
            return this;
        }

        public Builder handshakeTimeoutMs(long handshakeTimeoutMs) {
            this.handshakeTimeoutMs = handshakeTimeoutMs;
            return this;
        }

        public Builder drainIntervalMs(long drainIntervalMs) {
            this.drainIntervalMs = drainIntervalMs;
            return this;
        }

        public Builder historyCapacity(int historyCapacity) {
            this.historyCapacity = historyCapacity;
            return this;
        }

        public Builder trendEpsilon(double trendEpsilon) {
            this.trendEpsilon = trendEpsilon;
            return this;
        }

        public Builder dedupWindow(int dedupWindow) {
            this.dedupWindow = dedupWindow;
            return this;
        }

        public Builder platform(String platform) {
            this.platform = platform;
            return this;
        }

        public Builder capabilities(List<String> capabilities) {
            this.capabilities = capabilities;
            return this;
        }

        public Builder milestones(MilestoneTable milestones) {
            this.milestones = milestones;
            return this;
        }

        public SyncClientConfig build() {
            if (endpoint == null) {
                throw new IllegalArgumentException("endpoint is required");
            }
            String scheme = endpoint.getScheme();
            if (scheme == null || endpoint.getHost() == null) {
                throw new IllegalArgumentException("endpoint must be an absolute URL with a host: " + endpoint);
            }
            requireAtLeast("poolSize", poolSize, 1);
            requireAtLeast("reconnectBaseMs", reconnectBaseMs, 1);
            if (reconnectCapMs < reconnectBaseMs) {
                throw new IllegalArgumentException("reconnectCapMs (" + reconnectCapMs
                        + ") must be >= reconnectBaseMs (" + reconnectBaseMs + ")");
            }
            requireAtLeast("maxReconnectAttempts", maxReconnectAttempts, -1);
            requireAtLeast("heartbeatIntervalMs", heartbeatIntervalMs, 0);
            requireAtLeast("maxMissedPongs", maxMissedPongs, 1);
            requireAtLeast("messageTimeoutMs", messageTimeoutMs, 1);
            requireAtLeast("queueCapacity", queueCapacity, 1);
            requireAtLeast("bufferCapacity", bufferCapacity, 1);
            requireAtLeast("maxRetries", maxRetries, 1);
            requireAtLeast("connectTimeoutMs", connectTimeoutMs, 1);
            requireAtLeast("handshakeTimeoutMs", handshakeTimeoutMs, 1);
            requireAtLeast("drainIntervalMs", drainIntervalMs, 1);
            requireAtLeast("historyCapacity", historyCapacity, 2);
            requireAtLeast("dedupWindow", dedupWindow, 0);
            if (trendEpsilon < 0) {
                throw new IllegalArgumentException("trendEpsilon must be >= 0, got " + trendEpsilon);
            }
            if (platform == null || platform.isBlank()) {
                throw new IllegalArgumentException("platform is required");
            }
            if (capabilities == null || milestones == null) {
                throw new IllegalArgumentException("capabilities and milestones are required");
            }
            return new SyncClientConfig(this);
        }

        private static void requireAtLeast(String name, long value, long min) {
            if (value < min) {
                throw new IllegalArgumentException(name + " must be >= " + min + ", got " + value);
            }
        }
    }
}
