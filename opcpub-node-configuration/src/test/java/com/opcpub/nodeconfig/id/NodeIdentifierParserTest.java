package com.opcpub.nodeconfig.id;

import org.eclipse.milo.opcua.stack.core.types.builtin.NodeId;
import org.junit.jupiter.api.Test;

import static org.eclipse.milo.opcua.stack.core.types.builtin.unsigned.Unsigned.uint;
import static org.eclipse.milo.opcua.stack.core.types.builtin.unsigned.Unsigned.ushort;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

class NodeIdentifierParserTest {

    @Test
    void parse_namespaceUriPrefixYieldsExpanded() {
        NodeIdentifier id = NodeIdentifierParser.parse("nsu=urn:test;s=Temp");

        assertEquals(NodeIdentifier.Kind.EXPANDED, id.getKind());
        assertEquals("nsu=urn:test;s=Temp", id.getOriginalId());
        assertEquals("urn:test", id.getNamespaceUri());
    }

    @Test
    void parse_namespaceIndexYieldsNumeric() {
        NodeIdentifier id = NodeIdentifierParser.parse("ns=2;i=1001");

        assertEquals(NodeIdentifier.Kind.NUMERIC, id.getKind());
        assertEquals(new NodeId(ushort(2), uint(1001)), id.getNodeId());
        assertNull(id.getNamespaceUri());
    }

    @Test
    void parse_plainNameFails() {
        InvalidNodeIdentifierException e = assertThrows(InvalidNodeIdentifierException.class,
                () -> NodeIdentifierParser.parse("Temp"));
        assertEquals("Temp", e.getNodeId());
    }

    @Test
    void parse_missingIdFails() {
        assertThrows(InvalidNodeIdentifierException.class, () -> NodeIdentifierParser.parse(null));
        assertThrows(InvalidNodeIdentifierException.class, () -> NodeIdentifierParser.parse("  ", null));
    }

    @Test
    void parse_expandedIdTakesPrecedence() {
        NodeIdentifier id = NodeIdentifierParser.parse("ns=2;i=1001", "nsu=urn:test;i=1001");

        assertEquals(NodeIdentifier.Kind.EXPANDED, id.getKind());
        assertEquals("nsu=urn:test;i=1001", id.getOriginalId());
    }

    @Test
    void equality_ignoresOriginalTextButNotKind() {
        assertEquals(NodeIdentifierParser.parse("ns=2;i=1001"), NodeIdentifierParser.parse(" ns=2;i=1001 "));
        assertNotEquals(NodeIdentifierParser.parse("ns=2;s=Temp"), NodeIdentifierParser.parse("nsu=urn:test;s=Temp"));
    }

    @Test
    void toNodeId_usesGivenNamespaceIndexForExpanded() {
        NodeIdentifier id = NodeIdentifierParser.parse("nsu=urn:test;s=Temp");

        assertEquals(new NodeId(ushort(3), "Temp"), id.toNodeId(ushort(3)));
    }
}
