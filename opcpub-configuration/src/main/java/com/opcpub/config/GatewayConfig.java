package com.opcpub.config;

import java.nio.file.Path;
import java.util.Map;
import java.util.Objects;

/**
 * Configuration loaded from environment variables for the OPC UA publisher gateway.
 * <p>
 * Node configuration file: _GW_PNFP (path of the published nodes file, default {@code publishednodes.json}).
 * Item defaults: OPCPUB_DEFAULT_SAMPLING_INTERVAL, OPCPUB_DEFAULT_PUBLISHING_INTERVAL,
 * OPCPUB_DEFAULT_HEARTBEAT_INTERVAL, OPCPUB_DEFAULT_SKIP_FIRST.
 * <p>
 * The defaults are applied to every node that does not set the field in the node configuration file;
 * such values are never written back to the file.
 */
public final class GatewayConfig {

    static final String ENV_NODE_CONFIGURATION_FILE = "_GW_PNFP";
    static final String ENV_DEFAULT_SAMPLING_INTERVAL = "OPCPUB_DEFAULT_SAMPLING_INTERVAL";
    static final String ENV_DEFAULT_PUBLISHING_INTERVAL = "OPCPUB_DEFAULT_PUBLISHING_INTERVAL";
    static final String ENV_DEFAULT_HEARTBEAT_INTERVAL = "OPCPUB_DEFAULT_HEARTBEAT_INTERVAL";
    static final String ENV_DEFAULT_SKIP_FIRST = "OPCPUB_DEFAULT_SKIP_FIRST";

    private static final String DEFAULT_NODE_CONFIGURATION_FILE = "publishednodes.json";
    private static final int DEFAULT_SAMPLING_INTERVAL = 1000;
    /** 0 lets the server pick its fastest supported publishing interval. */
    private static final int DEFAULT_PUBLISHING_INTERVAL = 0;
    /** 0 disables heartbeat. */
    private static final int DEFAULT_HEARTBEAT_INTERVAL = 0;
    private static final boolean DEFAULT_SKIP_FIRST = false;

    private final Path nodeConfigurationFile;
    private final int defaultSamplingInterval;
    private final int defaultPublishingInterval;
    private final int defaultHeartbeatInterval;
    private final boolean defaultSkipFirst;

    private GatewayConfig(Builder b) {
        this.nodeConfigurationFile = b.nodeConfigurationFile;
        this.defaultSamplingInterval = b.defaultSamplingInterval;
        this.defaultPublishingInterval = b.defaultPublishingInterval;
        this.defaultHeartbeatInterval = b.defaultHeartbeatInterval;
        this.defaultSkipFirst = b.defaultSkipFirst;
    }

    /** Path of the published nodes file (_GW_PNFP). Default {@code publishednodes.json}. */
    public Path getNodeConfigurationFile() {
        return nodeConfigurationFile;
    }

    /** Sampling interval in ms for nodes without an explicit one. Default 1000. */
    public int getDefaultSamplingInterval() {
        return defaultSamplingInterval;
    }

    /**
     * Publishing interval in ms the protocol layer uses for subscriptions without an explicit one. Default 0.
     * The node configuration core keeps unset publishing intervals unset.
     */
    public int getDefaultPublishingInterval() {
        return defaultPublishingInterval;
    }

    /** Heartbeat interval in seconds for nodes without an explicit one. Default 0 (off). */
    public int getDefaultHeartbeatInterval() {
        return defaultHeartbeatInterval;
    }

    /** Whether the first notification of a node is skipped when not configured per node. Default false. */
    public boolean isDefaultSkipFirst() {
        return defaultSkipFirst;
    }

    public static GatewayConfig fromEnvironment() {
        return fromEnvironment(System.getenv());
    }

    /**
     * Builds the configuration from the given variables. Invalid numbers fall back to the defaults.
     *
     * @param env environment variables (e.g. {@link System#getenv()})
     */
    public static GatewayConfig fromEnvironment(Map<String, String> env) {
        Objects.requireNonNull(env, "env");
        return builder()
                .nodeConfigurationFile(Path.of(getEnv(env, ENV_NODE_CONFIGURATION_FILE, DEFAULT_NODE_CONFIGURATION_FILE)))
                .defaultSamplingInterval(parseInt(env.get(ENV_DEFAULT_SAMPLING_INTERVAL), DEFAULT_SAMPLING_INTERVAL))
                .defaultPublishingInterval(parseInt(env.get(ENV_DEFAULT_PUBLISHING_INTERVAL), DEFAULT_PUBLISHING_INTERVAL))
                .defaultHeartbeatInterval(parseInt(env.get(ENV_DEFAULT_HEARTBEAT_INTERVAL), DEFAULT_HEARTBEAT_INTERVAL))
                .defaultSkipFirst(parseBoolean(env.get(ENV_DEFAULT_SKIP_FIRST), DEFAULT_SKIP_FIRST))
                .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    private static boolean parseBoolean(String value, boolean defaultValue) {
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        return "true".equalsIgnoreCase(value.trim()) || "1".equals(value.trim());
    }

    private static int parseInt(String value, int defaultValue) {
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            return defaultValue;
        }
    }

    private static String getEnv(Map<String, String> env, String key, String defaultValue) {
        String v = env.get(key);
        return (v != null && !v.isBlank()) ? v.trim() : defaultValue;
    }

    @Override
    public String toString() {
        return "GatewayConfig{nodeConfigurationFile=" + nodeConfigurationFile
                + ", defaultSamplingInterval=" + defaultSamplingInterval
                + ", defaultPublishingInterval=" + defaultPublishingInterval
                + ", defaultHeartbeatInterval=" + defaultHeartbeatInterval
                + ", defaultSkipFirst=" + defaultSkipFirst + "}";
    }

    public static final class Builder {
        private Path nodeConfigurationFile = Path.of(DEFAULT_NODE_CONFIGURATION_FILE);
        private int defaultSamplingInterval = DEFAULT_SAMPLING_INTERVAL;
        private int defaultPublishingInterval = DEFAULT_PUBLISHING_INTERVAL;
        private int defaultHeartbeatInterval = DEFAULT_HEARTBEAT_INTERVAL;
        private boolean defaultSkipFirst = DEFAULT_SKIP_FIRST;

        public Builder nodeConfigurationFile(Path nodeConfigurationFile) {
            this.nodeConfigurationFile = Objects.requireNonNull(nodeConfigurationFile, "nodeConfigurationFile");
            return this;
        }

        public Builder defaultSamplingInterval(int defaultSamplingInterval) {
            this.defaultSamplingInterval = defaultSamplingInterval;
            return this;
        }

        public Builder defaultPublishingInterval(int defaultPublishingInterval) {
            this.defaultPublishingInterval = defaultPublishingInterval;
            return this;
        }

        public Builder defaultHeartbeatInterval(int defaultHeartbeatInterval) {
            this.defaultHeartbeatInterval = defaultHeartbeatInterval;
            return this;
        }

        public Builder defaultSkipFirst(boolean defaultSkipFirst) {
            this.defaultSkipFirst = defaultSkipFirst;
            return this;
        }

        public GatewayConfig build() {
            return new GatewayConfig(this);
        }
    }
}
