package com.opcpub.nodeconfig.export;

import com.opcpub.nodeconfig.file.ConfigurationFileEntry;
import com.opcpub.nodeconfig.file.ConfigurationFileEntryLegacy;
import com.opcpub.nodeconfig.file.OpcNodeOnEndpoint;
import com.opcpub.nodeconfig.id.NodeIdentifierParser;
import com.opcpub.nodeconfig.load.NodePublishingConfiguration;
import com.opcpub.nodeconfig.runtime.HierarchyBuilder;
import com.opcpub.nodeconfig.runtime.NodeDefaults;
import com.opcpub.nodeconfig.runtime.PublishedNodesRegistry;
import com.opcpub.nodeconfig.runtime.SessionState;
import org.eclipse.milo.opcua.stack.core.NamespaceTable;
import org.eclipse.milo.opcua.stack.core.types.builtin.unsigned.UShort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class NodeConfigurationExporterTest {

    private static final String A = "opc.tcp://a:4840";
    private static final String B = "opc.tcp://b:4840";

    private PublishedNodesRegistry registry;
    private HierarchyBuilder builder;
    private NodeConfigurationExporter exporter;

    @BeforeEach
    void setUp() {
        registry = new PublishedNodesRegistry(new NodeDefaults(1000, 0, false));
        builder = new HierarchyBuilder(registry);
        exporter = new NodeConfigurationExporter(registry);
        builder.build(List.of(
                NodePublishingConfiguration.builder(NodeIdentifierParser.parse("ns=2;i=1"), A)
                        .publishingInterval(1000).samplingInterval(250).build(),
                NodePublishingConfiguration.builder(NodeIdentifierParser.parse("nsu=urn:test;s=Temp"), A)
                        .displayName("Temperature").build(),
                NodePublishingConfiguration.builder(NodeIdentifierParser.parse("ns=3;s=Level"), B)
                        .heartbeatInterval(0).skipFirst(false).build()));
    }

    private static List<String> ids(List<ConfigurationFileEntry> entries) {
        List<String> ids = new ArrayList<>();
        for (ConfigurationFileEntry entry : entries) {
            for (OpcNodeOnEndpoint node : entry.getOpcNodes()) {
                ids.add(entry.getEndpointUrl() + " " + node.getId());
            }
        }
        return ids;
    }

    @Test
    void export_writesOnlyExplicitSettings() {
        NodeConfigurationSnapshot<List<ConfigurationFileEntry>> snapshot = exporter.export(null, true).orElseThrow();

        assertEquals(3L, snapshot.version());
        assertEquals(2, snapshot.entries().size());
        ConfigurationFileEntry a = snapshot.entries().get(0);
        assertEquals(A, a.getEndpointUrl());
        assertTrue(a.isUseSecurity());

        OpcNodeOnEndpoint first = a.getOpcNodes().get(0);
        assertEquals("ns=2;i=1", first.getId());
        assertEquals(1000, first.getPublishingInterval());
        assertEquals(250, first.getSamplingInterval());
        assertNull(first.getDisplayName());
        assertNull(first.getHeartbeatInterval());
        assertNull(first.getSkipFirst());

        OpcNodeOnEndpoint second = a.getOpcNodes().get(1);
        assertEquals("nsu=urn:test;s=Temp", second.getId());
        assertNull(second.getPublishingInterval());
        assertNull(second.getSamplingInterval());
        assertEquals("Temperature", second.getDisplayName());

        OpcNodeOnEndpoint level = snapshot.entries().get(1).getOpcNodes().get(0);
        assertEquals(0, level.getHeartbeatInterval());
        assertEquals(Boolean.FALSE, level.getSkipFirst());
    }

    @Test
    void export_filtersEndpointCaseInsensitively() {
        List<ConfigurationFileEntry> entries = exporter.export("OPC.TCP://B:4840", true).orElseThrow().entries();

        assertEquals(List.of(B + " ns=3;s=Level"), ids(entries));
    }

    @Test
    void export_removalPendingItemsOnlyWhenRequested() {
        registry.requestNodeRemoval(A, NodeIdentifierParser.parse("ns=2;i=1"));

        assertEquals(3, ids(exporter.export(null, true).orElseThrow().entries()).size());
        assertEquals(List.of(A + " nsu=urn:test;s=Temp", B + " ns=3;s=Level"),
                ids(exporter.export(null, false).orElseThrow().entries()));
    }

    @Test
    void exportLegacy_omitsExpandedNodesWhileDisconnected() {
        List<ConfigurationFileEntryLegacy> entries = exporter.exportLegacy(null).orElseThrow().entries();

        assertEquals(2, entries.size());
        assertEquals("ns=2;i=1", entries.get(0).getNodeId());
        assertEquals(A, entries.get(0).getEndpointUrl());
        assertNull(entries.get(0).getOpcNodes());
        assertEquals("ns=3;s=Level", entries.get(1).getNodeId());
    }

    @Test
    void exportLegacy_convertsExpandedNodesThroughServerNamespaceTable() {
        NamespaceTable table = new NamespaceTable();
        UShort index = table.addUri("urn:test");
        registry.findSession(A).orElseThrow().updateState(SessionState.CONNECTED, table);

        List<ConfigurationFileEntryLegacy> entries = exporter.exportLegacy(A).orElseThrow().entries();

        assertEquals(2, entries.size());
        assertEquals("ns=" + index + ";s=Temp", entries.get(1).getNodeId());
    }

    @Test
    void exportLegacy_omitsUnknownNamespaceAndRemovalPending() {
        registry.findSession(A).orElseThrow().updateState(SessionState.CONNECTED, new NamespaceTable());
        registry.requestNodeRemoval(A, NodeIdentifierParser.parse("ns=2;i=1"));

        assertTrue(exporter.exportLegacy(A).orElseThrow().entries().isEmpty());
    }

    @Test
    void export_versionFollowsAddedItems() {
        long before = exporter.export(null, true).orElseThrow().version();

        builder.build(List.of(NodePublishingConfiguration.builder(NodeIdentifierParser.parse("ns=2;i=9"), B).build()));

        NodeConfigurationSnapshot<List<ConfigurationFileEntry>> after = exporter.export(null, true).orElseThrow();
        assertEquals(before + 1, after.version());
        assertEquals(4, ids(after.entries()).size());
    }
}
