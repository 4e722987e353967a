package com.opcpub.nodeconfig;

/**
 * Thrown when the node configuration cannot be loaded or turned into sessions, subscriptions and
 * monitored items (unparsable file, missing credential, unexpected build failure).
 * The gateway must not start with a configuration in this state.
 */
public final class NodeConfigurationException extends RuntimeException {

    public NodeConfigurationException(String message) {
        super(message);
    }

    public NodeConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
