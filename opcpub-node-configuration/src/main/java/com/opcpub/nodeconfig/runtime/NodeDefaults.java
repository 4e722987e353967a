package com.opcpub.nodeconfig.runtime;

import com.opcpub.config.GatewayConfig;

/**
 * Process-wide values for per-node settings that a node does not configure. Display names default to
 * the node id and are not part of this.
 */
public record NodeDefaults(int samplingInterval, int heartbeatInterval, boolean skipFirst) {

    public static NodeDefaults from(GatewayConfig config) {
        return new NodeDefaults(
                config.getDefaultSamplingInterval(),
                config.getDefaultHeartbeatInterval(),
                config.isDefaultSkipFirst());
    }
}
