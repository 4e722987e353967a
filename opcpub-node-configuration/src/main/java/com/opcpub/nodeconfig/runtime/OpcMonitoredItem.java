package com.opcpub.nodeconfig.runtime;

import com.opcpub.nodeconfig.id.NodeIdentifier;

import java.util.Objects;

/**
 * A node monitored inside a subscription. Settings are fixed at creation; the state is updated by the
 * protocol client.
 */
public final class OpcMonitoredItem {

    private final NodeIdentifier identifier;
    private final String endpointUrl;
    private final ConfiguredValue<Integer> samplingInterval;
    private final ConfiguredValue<String> displayName;
    private final ConfiguredValue<Integer> heartbeatInterval;
    private final ConfiguredValue<Boolean> skipFirst;
    private volatile MonitoredItemState state = MonitoredItemState.CONFIGURED;

    public OpcMonitoredItem(NodeIdentifier identifier,
                            String endpointUrl,
                            ConfiguredValue<Integer> samplingInterval,
                            ConfiguredValue<String> displayName,
                            ConfiguredValue<Integer> heartbeatInterval,
                            ConfiguredValue<Boolean> skipFirst) {
        this.identifier = Objects.requireNonNull(identifier, "identifier");
        this.endpointUrl = Objects.requireNonNull(endpointUrl, "endpointUrl");
        this.samplingInterval = Objects.requireNonNull(samplingInterval, "samplingInterval");
        this.displayName = Objects.requireNonNull(displayName, "displayName");
        this.heartbeatInterval = Objects.requireNonNull(heartbeatInterval, "heartbeatInterval");
        this.skipFirst = Objects.requireNonNull(skipFirst, "skipFirst");
    }

    public NodeIdentifier getIdentifier() {
        return identifier;
    }

    /** Selects which form the node id listing can use for this item. */
    public NodeIdentifier.Kind getKind() {
        return identifier.getKind();
    }

    public String getOriginalId() {
        return identifier.getOriginalId();
    }

    /** Endpoint of the owning session. */
    public String getEndpointUrl() {
        return endpointUrl;
    }

    public ConfiguredValue<Integer> getSamplingInterval() {
        return samplingInterval;
    }

    public ConfiguredValue<String> getDisplayName() {
        return displayName;
    }

    public ConfiguredValue<Integer> getHeartbeatInterval() {
        return heartbeatInterval;
    }

    public ConfiguredValue<Boolean> getSkipFirst() {
        return skipFirst;
    }

    public MonitoredItemState getState() {
        return state;
    }

    public void setState(MonitoredItemState state) {
        this.state = Objects.requireNonNull(state, "state");
    }

    @Override
    public String toString() {
        return "OpcMonitoredItem{" + identifier + " on " + endpointUrl + ", state=" + state + "}";
    }
}
