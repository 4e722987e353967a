package com.opcpub.nodeconfig.id;

/**
 * Thrown when a node id string is missing or cannot be parsed in any supported notation.
 * Recoverable: the node entry carrying it is skipped.
 */
public final class InvalidNodeIdentifierException extends RuntimeException {

    private final String nodeId;

    public InvalidNodeIdentifierException(String nodeId, String message) {
        super(message);
        this.nodeId = nodeId;
    }

    public InvalidNodeIdentifierException(String nodeId, String message, Throwable cause) {
        super(message, cause);
        this.nodeId = nodeId;
    }

    /** The offending node id string as given in configuration (may be null). */
    public String getNodeId() {
        return nodeId;
    }
}
