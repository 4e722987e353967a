package com.opcpub.nodeconfig.id;

import org.eclipse.milo.opcua.stack.core.types.builtin.ByteString;
import org.eclipse.milo.opcua.stack.core.types.builtin.ExpandedNodeId;
import org.eclipse.milo.opcua.stack.core.types.builtin.NodeId;
import org.eclipse.milo.opcua.stack.core.types.builtin.unsigned.UInteger;
import org.eclipse.milo.opcua.stack.core.types.builtin.unsigned.UShort;

import java.util.Objects;
import java.util.UUID;

/**
 * Canonical identifier of a published node. Either {@link Kind#NUMERIC} (namespace addressed by its
 * index on the server, e.g. {@code ns=2;i=1001}) or {@link Kind#EXPANDED} (namespace addressed by URI,
 * e.g. {@code nsu=http://x;s=Temp}). The original text is kept so the node can be written back exactly
 * as it was configured.
 * <p>
 * Equality is based on kind and parsed id; the original text is not part of it.
 */
public final class NodeIdentifier {

    public enum Kind {
        NUMERIC,
        EXPANDED
    }

    private final Kind kind;
    private final NodeId nodeId;
    private final ExpandedNodeId expandedNodeId;
    private final String originalId;

    private NodeIdentifier(Kind kind, NodeId nodeId, ExpandedNodeId expandedNodeId, String originalId) {
        this.kind = kind;
        this.nodeId = nodeId;
        this.expandedNodeId = expandedNodeId;
        this.originalId = Objects.requireNonNull(originalId, "originalId");
    }

    public static NodeIdentifier numeric(NodeId nodeId, String originalId) {
        return new NodeIdentifier(Kind.NUMERIC, Objects.requireNonNull(nodeId, "nodeId"), null, originalId);
    }

    public static NodeIdentifier expanded(ExpandedNodeId expandedNodeId, String originalId) {
        return new NodeIdentifier(Kind.EXPANDED, null, Objects.requireNonNull(expandedNodeId, "expandedNodeId"), originalId);
    }

    public Kind getKind() {
        return kind;
    }

    /** Parsed id for {@link Kind#NUMERIC}; null otherwise. */
    public NodeId getNodeId() {
        return nodeId;
    }

    /** Parsed id for {@link Kind#EXPANDED}; null otherwise. */
    public ExpandedNodeId getExpandedNodeId() {
        return expandedNodeId;
    }

    public String getOriginalId() {
        return originalId;
    }

    /**
     * Namespace URI of an expanded identifier, or null when it is numeric or carries an index only.
     */
    public String getNamespaceUri() {
        return expandedNodeId != null ? expandedNodeId.getNamespaceUri() : null;
    }

    /**
     * Returns the identifier as a {@link NodeId} in the given namespace. For a numeric identifier
     * the index is ignored and the configured node id is returned.
     *
     * @param namespaceIndex server namespace index of {@link #getNamespaceUri()}
     */
    public NodeId toNodeId(UShort namespaceIndex) {
        if (kind == Kind.NUMERIC) {
            return nodeId;
        }
        Objects.requireNonNull(namespaceIndex, "namespaceIndex");
        Object identifier = expandedNodeId.getIdentifier();
        if (identifier instanceof UInteger) {
            return new NodeId(namespaceIndex, (UInteger) identifier);
        }
        if (identifier instanceof String) {
            return new NodeId(namespaceIndex, (String) identifier);
        }
        if (identifier instanceof UUID) {
            return new NodeId(namespaceIndex, (UUID) identifier);
        }
        if (identifier instanceof ByteString) {
            return new NodeId(namespaceIndex, (ByteString) identifier);
        }
        throw new IllegalStateException("Unsupported identifier type in " + originalId);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        NodeIdentifier that = (NodeIdentifier) o;
        return kind == that.kind
                && Objects.equals(nodeId, that.nodeId)
                && Objects.equals(expandedNodeId, that.expandedNodeId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, nodeId, expandedNodeId);
    }

    @Override
    public String toString() {
        return originalId;
    }
}
