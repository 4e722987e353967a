package com.opcpub.nodeconfig.export;

import com.opcpub.nodeconfig.file.ConfigurationFileEntry;
import com.opcpub.nodeconfig.file.ConfigurationFileEntryLegacy;
import com.opcpub.nodeconfig.file.OpcNodeOnEndpoint;
import com.opcpub.nodeconfig.id.NodeIdentifier;
import com.opcpub.nodeconfig.id.NodeIdentifierParser;
import com.opcpub.nodeconfig.runtime.MonitoredItemState;
import com.opcpub.nodeconfig.runtime.OpcMonitoredItem;
import com.opcpub.nodeconfig.runtime.OpcSession;
import com.opcpub.nodeconfig.runtime.OpcSubscription;
import com.opcpub.nodeconfig.runtime.PublishedNodesRegistry;
import org.eclipse.milo.opcua.stack.core.types.builtin.ExpandedNodeId;
import org.eclipse.milo.opcua.stack.core.types.builtin.unsigned.UShort;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Rebuilds file entries from the live structure.
 * <p>
 * The grouped export writes one endpoint block per session and only the per-node settings that were
 * configured explicitly, so defaults never leak into the file. The node id listing writes one
 * {@code endpointUrl}/{@code nodeId} record per item; nodes configured with a namespace URI can only
 * be listed while their session is connected and the server knows the URI.
 */
public final class NodeConfigurationExporter {

    private static final Logger log = LoggerFactory.getLogger(NodeConfigurationExporter.class);

    private final PublishedNodesRegistry registry;

    public NodeConfigurationExporter(PublishedNodesRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "registry");
    }

    /**
     * Exports the grouped schema.
     *
     * @param endpointUrlFilter only this endpoint (case-insensitive); null for all
     * @param includeRemovalPending whether items waiting for removal are still written
     * @return entries and version, or empty if the export failed
     */
    public Optional<NodeConfigurationSnapshot<List<ConfigurationFileEntry>>> export(String endpointUrlFilter,
                                                                                  boolean includeRemovalPending) {
        try {
            List<ConfigurationFileEntry> entries = new ArrayList<>();
            long version = registry.visitSessions(session -> {
                if (!session.matchesEndpoint(endpointUrlFilter)) {
                    return;
                }
                List<OpcNodeOnEndpoint> nodes = new ArrayList<>();
                for (OpcSubscription subscription : session.getSubscriptionsUnlocked()) {
                    for (OpcMonitoredItem item : subscription.getMonitoredItems()) {
                        if (!includeRemovalPending && item.getState() == MonitoredItemState.REMOVAL_REQUESTED) {
                            continue;
                        }
                        nodes.add(toOpcNode(item, subscription.getPublishingInterval()));
                    }
                }
                entries.add(new ConfigurationFileEntry(session.getEndpointUrl(), session.isUseSecurity(),
                        session.getAuthenticationMode(), session.getEncryptedCredential(), nodes));
            });
            return Optional.of(new NodeConfigurationSnapshot<>(List.copyOf(entries), version));
        } catch (RuntimeException e) {
            log.error("Reading configuration file entries failed.", e);
            return Optional.empty();
        }
    }

    /**
     * Exports the node id listing: one record per monitored item, never including items waiting for
     * removal.
     *
     * @param endpointUrlFilter only this endpoint (case-insensitive); null for all
     * @return records and version, or empty if the export failed
     */
    public Optional<NodeConfigurationSnapshot<List<ConfigurationFileEntryLegacy>>> exportLegacy(String endpointUrlFilter) {
        try {
            List<ConfigurationFileEntryLegacy> entries = new ArrayList<>();
            long version = registry.visitSessions(session -> {
                if (!session.matchesEndpoint(endpointUrlFilter)) {
                    return;
                }
                for (OpcSubscription subscription : session.getSubscriptionsUnlocked()) {
                    for (OpcMonitoredItem item : subscription.getMonitoredItems()) {
                        if (item.getState() == MonitoredItemState.REMOVAL_REQUESTED) {
                            continue;
                        }
                        toListedNodeId(session, item).ifPresent(nodeId ->
                                entries.add(ConfigurationFileEntryLegacy.ofNodeId(session.getEndpointUrl(), nodeId)));
                    }
                }
            });
            return Optional.of(new NodeConfigurationSnapshot<>(List.copyOf(entries), version));
        } catch (RuntimeException e) {
            log.error("Reading configuration file entries failed.", e);
            return Optional.empty();
        }
    }

    private static OpcNodeOnEndpoint toOpcNode(OpcMonitoredItem item, Integer publishingInterval) {
        String id = item.getOriginalId();
        String expandedId = null;
        // keep the kind across a reload when the original text alone would parse differently
        if (item.getKind() == NodeIdentifier.Kind.EXPANDED && !id.startsWith(NodeIdentifierParser.NAMESPACE_URI_PREFIX)) {
            expandedId = id;
        }
        return new OpcNodeOnEndpoint(
                id,
                expandedId,
                publishingInterval,
                item.getSamplingInterval().explicitValueOrNull(),
                item.getDisplayName().explicitValueOrNull(),
                item.getHeartbeatInterval().explicitValueOrNull(),
                item.getSkipFirst().explicitValueOrNull());
    }

    private static Optional<String> toListedNodeId(OpcSession session, OpcMonitoredItem item) {
        NodeIdentifier identifier = item.getIdentifier();
        if (identifier.getKind() == NodeIdentifier.Kind.NUMERIC) {
            return Optional.of(identifier.getOriginalId());
        }
        if (!session.isConnected()) {
            log.debug("Session for {} is not connected; node {} is not listed", session.getEndpointUrl(), identifier);
            return Optional.empty();
        }
        ExpandedNodeId expanded = identifier.getExpandedNodeId();
        Optional<UShort> index = identifier.getNamespaceUri() != null
                ? session.getNamespaceIndexUnlocked(identifier.getNamespaceUri())
                : Optional.of(expanded.getNamespaceIndex());
        if (index.isEmpty()) {
            log.warn("Namespace {} of node {} is unknown to the server at {}; node is not listed",
                    identifier.getNamespaceUri(), identifier, session.getEndpointUrl());
            return Optional.empty();
        }
        return Optional.of(identifier.toNodeId(index.get()).toParseableString());
    }
}
