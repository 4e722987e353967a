package com.opcpub.nodeconfig.runtime;

import com.opcpub.nodeconfig.NodeConfigurationException;
import com.opcpub.nodeconfig.file.AuthenticationMode;
import com.opcpub.nodeconfig.file.EncryptedCredential;
import com.opcpub.nodeconfig.id.NodeIdentifierParser;
import com.opcpub.nodeconfig.load.NodePublishingConfiguration;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class HierarchyBuilderTest {

    private static final String ENDPOINT = "opc.tcp://plc:4840";

    private PublishedNodesRegistry registry;
    private HierarchyBuilder builder;

    @BeforeEach
    void setUp() {
        registry = new PublishedNodesRegistry(new NodeDefaults(1000, 0, false));
        builder = new HierarchyBuilder(registry);
    }

    private static NodePublishingConfiguration.Builder node(String endpointUrl, String id) {
        return NodePublishingConfiguration.builder(NodeIdentifierParser.parse(id), endpointUrl);
    }

    private static List<OpcSubscription> subscriptions(OpcSession session) {
        session.lockSession();
        try {
            return new ArrayList<>(session.getSubscriptionsUnlocked());
        } finally {
            session.releaseSession();
        }
    }

    @Test
    void build_groupsByEndpointAndPublishingInterval() {
        int added = builder.build(List.of(
                node(ENDPOINT, "ns=2;i=1").publishingInterval(1000).build(),
                node(ENDPOINT, "ns=2;i=2").publishingInterval(500).build(),
                node(ENDPOINT, "ns=2;i=3").publishingInterval(1000).build()));

        assertEquals(3, added);
        assertEquals(3L, registry.getVersion().get());
        assertEquals(1, registry.numberOfSessionsConfigured());
        List<OpcSubscription> subs = subscriptions(registry.findSession(ENDPOINT).orElseThrow());
        assertEquals(2, subs.size());
        assertEquals(1000, subs.get(0).getPublishingInterval());
        assertEquals(2, subs.get(0).getMonitoredItems().size());
        assertEquals("ns=2;i=1", subs.get(0).getMonitoredItems().get(0).getOriginalId());
        assertEquals("ns=2;i=3", subs.get(0).getMonitoredItems().get(1).getOriginalId());
        assertEquals(500, subs.get(1).getPublishingInterval());
        assertEquals(1, subs.get(1).getMonitoredItems().size());
    }

    @Test
    void build_endpointsAreCaseInsensitiveAndKeepFirstSpelling() {
        builder.build(List.of(
                node("opc.tcp://PLC:4840", "ns=2;i=1").build(),
                node("opc.tcp://b:4840", "ns=2;i=1").build(),
                node("opc.tcp://plc:4840", "ns=2;i=2").build()));

        assertEquals(List.of("opc.tcp://PLC:4840", "opc.tcp://b:4840"), registry.configuredEndpointUrls());
        assertEquals(3, registry.numberOfMonitoredItemsConfigured());
    }

    @Test
    void build_unsetPublishingIntervalIsItsOwnSubscription() {
        builder.build(List.of(
                node(ENDPOINT, "ns=2;i=1").build(),
                node(ENDPOINT, "ns=2;i=2").publishingInterval(0).build()));

        List<OpcSubscription> subs = subscriptions(registry.findSession(ENDPOINT).orElseThrow());
        assertEquals(2, subs.size());
        assertNull(subs.get(0).getPublishingInterval());
        assertEquals(0, subs.get(1).getPublishingInterval());
    }

    @Test
    void build_recordsProvenanceOfItemSettings() {
        builder.build(List.of(
                node(ENDPOINT, "ns=2;i=1").samplingInterval(250).displayName("Speed").build(),
                node(ENDPOINT, "ns=2;i=2").heartbeatInterval(5).skipFirst(true).build()));

        List<OpcMonitoredItem> items = subscriptions(registry.findSession(ENDPOINT).orElseThrow()).get(0).getMonitoredItems();
        OpcMonitoredItem first = items.get(0);
        assertEquals(ConfiguredValue.explicit(250), first.getSamplingInterval());
        assertEquals(ConfiguredValue.explicit("Speed"), first.getDisplayName());
        assertFalse(first.getHeartbeatInterval().isExplicitlySet());
        assertEquals(0, first.getHeartbeatInterval().getValue());

        OpcMonitoredItem second = items.get(1);
        assertEquals(ConfiguredValue.ofDefault(1000), second.getSamplingInterval());
        assertEquals(ConfiguredValue.ofDefault("ns=2;i=2"), second.getDisplayName());
        assertEquals(ConfiguredValue.explicit(5), second.getHeartbeatInterval());
        assertEquals(ConfiguredValue.explicit(true), second.getSkipFirst());
        assertEquals(MonitoredItemState.CONFIGURED, second.getState());
    }

    @Test
    void build_usernamePasswordWithoutCredentialIsFatal() {
        List<NodePublishingConfiguration> nodes = List.of(
                node("opc.tcp://ok:4840", "ns=2;i=1").build(),
                node(ENDPOINT, "ns=2;i=2").authenticationMode(AuthenticationMode.USERNAME_PASSWORD).build());

        assertThrows(NodeConfigurationException.class, () -> builder.build(nodes));
        assertEquals(List.of("opc.tcp://ok:4840"), registry.configuredEndpointUrls());
    }

    @Test
    void build_usernamePasswordWithCredentialKeepsIt() {
        EncryptedCredential credential = new EncryptedCredential("dXNlcg==", "cGFzcw==");
        builder.build(List.of(node(ENDPOINT, "ns=2;i=1")
                .authenticationMode(AuthenticationMode.USERNAME_PASSWORD)
                .encryptedCredential(credential)
                .useSecurity(false)
                .build()));

        OpcSession session = registry.findSession(ENDPOINT).orElseThrow();
        assertEquals(credential, session.getEncryptedCredential());
        assertFalse(session.isUseSecurity());
    }

    @Test
    void build_firstEntryDecidesConnectionSettings() {
        builder.build(List.of(
                node(ENDPOINT, "ns=2;i=1").useSecurity(false).build(),
                node(ENDPOINT, "ns=2;i=2").useSecurity(true).build()));

        assertFalse(registry.findSession(ENDPOINT).orElseThrow().isUseSecurity());
    }

    @Test
    void build_skipsEntriesWithoutIdentifier() {
        int added = builder.build(List.of(
                NodePublishingConfiguration.builder(null, ENDPOINT).build(),
                node(ENDPOINT, "ns=2;i=1").build()));

        assertEquals(1, added);
        assertEquals(1L, registry.getVersion().get());
    }

    @Test
    void build_mergesIntoExistingSessionWithoutDuplicates() {
        builder.build(List.of(node(ENDPOINT, "ns=2;i=1").build()));

        int added = builder.build(List.of(
                node(ENDPOINT.toUpperCase(), "ns=2;i=1").build(),
                node(ENDPOINT, "ns=2;i=2").build()));

        assertEquals(1, added);
        assertEquals(1, registry.numberOfSessionsConfigured());
        assertEquals(1, registry.numberOfSubscriptionsConfigured());
        assertEquals(2, registry.numberOfMonitoredItemsConfigured());
        assertEquals(2L, registry.getVersion().get());
    }

    @Test
    void build_isDeterministic() {
        List<NodePublishingConfiguration> nodes = List.of(
                node("opc.tcp://b:4840", "ns=2;i=1").publishingInterval(100).build(),
                node("opc.tcp://a:4840", "ns=2;i=2").build(),
                node("opc.tcp://b:4840", "ns=2;i=3").build(),
                node("opc.tcp://b:4840", "ns=2;i=4").publishingInterval(100).build());
        PublishedNodesRegistry other = new PublishedNodesRegistry(new NodeDefaults(1000, 0, false));

        builder.build(nodes);
        new HierarchyBuilder(other).build(nodes);

        assertEquals(describe(registry), describe(other));
        assertTrue(describe(registry).startsWith("opc.tcp://b:4840|100:ns=2;i=1,ns=2;i=4|null:ns=2;i=3"));
    }

    @Test
    void build_emptyInputAddsNothing() {
        assertEquals(0, builder.build(List.of()));
        assertEquals(0L, registry.getVersion().get());
        assertEquals(0, registry.numberOfSessionsConfigured());
    }

    private static String describe(PublishedNodesRegistry registry) {
        StringBuilder sb = new StringBuilder();
        registry.visitSessions(session -> {
            sb.append(session.getEndpointUrl());
            for (OpcSubscription subscription : session.getSubscriptionsUnlocked()) {
                sb.append('|').append(subscription.getPublishingInterval()).append(':');
                List<String> ids = new ArrayList<>();
                for (OpcMonitoredItem item : subscription.getMonitoredItems()) {
                    ids.add(item.getOriginalId());
                }
                sb.append(String.join(",", ids));
            }
            sb.append(';');
        });
        return sb.toString();
    }

    @Test
    void build_storesEndpointUrlTrimmed() {
        builder.build(List.of(node("  " + ENDPOINT + " ", "ns=2;i=1").build()));

        assertEquals(List.of(ENDPOINT), registry.configuredEndpointUrls());
        assertTrue(registry.findSession(ENDPOINT).orElseThrow().matchesEndpoint(ENDPOINT));
        assertTrue(registry.requestNodeRemoval(ENDPOINT, NodeIdentifierParser.parse("ns=2;i=1")));
    }
}
