package com.opcpub.nodeconfig.id;

import org.eclipse.milo.opcua.stack.core.types.builtin.ExpandedNodeId;
import org.eclipse.milo.opcua.stack.core.types.builtin.NodeId;

/**
 * Resolves the node id notations accepted in the published nodes file into a {@link NodeIdentifier}.
 * <ol>
 *   <li>a non-blank separate expanded id is parsed as {@link NodeIdentifier.Kind#EXPANDED}</li>
 *   <li>an id starting with {@code nsu=} is parsed as {@link NodeIdentifier.Kind#EXPANDED}</li>
 *   <li>anything else is parsed as {@link NodeIdentifier.Kind#NUMERIC} ({@code ns=<index>;...})</li>
 * </ol>
 */
public final class NodeIdentifierParser {

    public static final String NAMESPACE_URI_PREFIX = "nsu=";

    private NodeIdentifierParser() {
    }

    /**
     * @param id         node id as configured (the {@code id} or legacy {@code nodeId} field)
     * @param expandedId separate expanded node id field; null or blank when absent
     * @return the canonical identifier
     * @throws InvalidNodeIdentifierException when no notation matches
     */
    public static NodeIdentifier parse(String id, String expandedId) {
        if (expandedId != null && !expandedId.isBlank()) {
            return parseExpanded(expandedId.trim());
        }
        if (id == null || id.isBlank()) {
            throw new InvalidNodeIdentifierException(id, "Node id is missing");
        }
        String trimmed = id.trim();
        if (trimmed.startsWith(NAMESPACE_URI_PREFIX)) {
            return parseExpanded(trimmed);
        }
        return parseNumeric(trimmed);
    }

    /** Same as {@link #parse(String, String)} without a separate expanded id. */
    public static NodeIdentifier parse(String id) {
        return parse(id, null);
    }

    private static NodeIdentifier parseExpanded(String text) {
        try {
            return NodeIdentifier.expanded(ExpandedNodeId.parse(text), text);
        } catch (RuntimeException e) {
            throw new InvalidNodeIdentifierException(text, "Invalid expanded node id '" + text + "': " + e.getMessage(), e);
        }
    }

    private static NodeIdentifier parseNumeric(String text) {
        try {
            return NodeIdentifier.numeric(NodeId.parse(text), text);
        } catch (RuntimeException e) {
            throw new InvalidNodeIdentifierException(text, "Invalid node id '" + text + "': " + e.getMessage(), e);
        }
    }
}
