package com.opcpub.nodeconfig.runtime;

/**
 * Connectivity of a session to its endpoint, maintained by the protocol client.
 */
public enum SessionState {
    DISCONNECTED,
    CONNECTING,
    CONNECTED
}
