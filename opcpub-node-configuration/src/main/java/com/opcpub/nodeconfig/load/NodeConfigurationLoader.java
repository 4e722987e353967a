package com.opcpub.nodeconfig.load;

import com.opcpub.nodeconfig.NodeConfigurationException;
import com.opcpub.nodeconfig.file.AuthenticationMode;
import com.opcpub.nodeconfig.file.ConfigurationFileEntryLegacy;
import com.opcpub.nodeconfig.file.NodeConfigurationJson;
import com.opcpub.nodeconfig.file.OpcNodeOnEndpoint;
import com.opcpub.nodeconfig.id.InvalidNodeIdentifierException;
import com.opcpub.nodeconfig.id.NodeIdentifier;
import com.opcpub.nodeconfig.id.NodeIdentifierParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.URISyntaxException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Reads the published nodes file and flattens it into one {@link NodePublishingConfiguration} per node,
 * in file order. Both record forms are accepted: a bare {@code nodeId} with endpoint defaults, and an
 * endpoint block with {@code opcNodes}. Per-node settings are carried through as configured; defaults
 * are applied later when monitored items are created.
 * <p>
 * A missing file yields an empty list (nodes may be published remotely later). An existing file that
 * cannot be read or parsed is fatal. A node whose id cannot be resolved is logged and skipped.
 */
public final class NodeConfigurationLoader {

    private static final Logger log = LoggerFactory.getLogger(NodeConfigurationLoader.class);

    private final NodeConfigurationStore store;

    public NodeConfigurationLoader(NodeConfigurationStore store) {
        this.store = Objects.requireNonNull(store, "store");
    }

    /**
     * Loads all nodes to publish.
     *
     * @return flattened nodes in file order (never null)
     * @throws NodeConfigurationException if the file exists but cannot be read or parsed
     */
    public List<NodePublishingConfiguration> load() {
        log.info("The name of the configuration file for published nodes is: {}", store.location());
        Optional<String> json;
        try {
            json = store.read();
        } catch (IOException e) {
            throw new NodeConfigurationException("Failed to read node configuration file " + store.location(), e);
        }
        if (json.isEmpty()) {
            log.info("The node configuration file '{}' does not exist. Continue and wait for remote configuration requests.",
                    store.location());
            return List.of();
        }

        List<ConfigurationFileEntryLegacy> entries;
        try {
            entries = NodeConfigurationJson.readEntries(json.get());
        } catch (RuntimeException e) {
            throw new NodeConfigurationException("Failed to parse node configuration file " + store.location()
                    + ": " + e.getMessage(), e);
        }
        log.info("Loaded {} config file entry/entries.", entries.size());

        List<NodePublishingConfiguration> nodes = new ArrayList<>();
        for (ConfigurationFileEntryLegacy entry : entries) {
            if (entry == null) {
                continue;
            }
            String endpointUrl = validateEndpointUrl(entry.getEndpointUrl());
            if (entry.getNodeId() != null) {
                if (entry.getOpcNodes() != null) {
                    log.warn("Config file entry for endpoint {} has both nodeId and opcNodes; using nodeId {}",
                            endpointUrl, entry.getNodeId());
                }
                addNode(nodes, entry, endpointUrl, entry.getNodeId(), null, null);
            } else if (entry.getOpcNodes() != null) {
                for (OpcNodeOnEndpoint opcNode : entry.getOpcNodes()) {
                    if (opcNode == null) {
                        log.warn("Skipping empty node entry for endpoint {}", endpointUrl);
                        continue;
                    }
                    addNode(nodes, entry, endpointUrl, opcNode.getId(), opcNode.getExpandedId(), opcNode);
                }
            } else {
                log.warn("Config file entry for endpoint {} has neither nodeId nor opcNodes; ignored", endpointUrl);
            }
        }
        log.info("There are {} nodes to publish.", nodes.size());
        return List.copyOf(nodes);
    }

    private static void addNode(List<NodePublishingConfiguration> nodes, ConfigurationFileEntryLegacy entry,
                                String endpointUrl, String id, String expandedId, OpcNodeOnEndpoint opcNode) {
        NodeIdentifier identifier;
        try {
            identifier = NodeIdentifierParser.parse(id, expandedId);
        } catch (InvalidNodeIdentifierException e) {
            log.warn("Node {} on endpoint {} has an invalid format. Skipping... ({})",
                    e.getNodeId(), endpointUrl, e.getMessage());
            return;
        }
        NodePublishingConfiguration.Builder b = NodePublishingConfiguration.builder(identifier, endpointUrl)
                .useSecurity(entry.getUseSecurity() == null || entry.getUseSecurity())
                .authenticationMode(entry.getAuthenticationMode() != null ? entry.getAuthenticationMode() : AuthenticationMode.ANONYMOUS)
                .encryptedCredential(entry.getEncryptedCredential());
        if (opcNode != null) {
            b.publishingInterval(opcNode.getPublishingInterval())
                    .samplingInterval(opcNode.getSamplingInterval())
                    .displayName(opcNode.getDisplayName())
                    .heartbeatInterval(opcNode.getHeartbeatInterval())
                    .skipFirst(opcNode.getSkipFirst());
        }
        nodes.add(b.build());
    }

    private String validateEndpointUrl(String endpointUrl) {
        if (endpointUrl == null || endpointUrl.isBlank()) {
            throw new NodeConfigurationException("Config file entry without endpointUrl in " + store.location());
        }
        String trimmed = endpointUrl.trim();
        try {
            URI uri = new URI(trimmed);
            if (uri.getScheme() == null) {
                throw new NodeConfigurationException("Endpoint URL '" + trimmed + "' has no scheme in " + store.location());
            }
        } catch (URISyntaxException e) {
            throw new NodeConfigurationException("Invalid endpoint URL '" + trimmed + "' in " + store.location(), e);
        }
        return trimmed;
    }
}
