package com.opcpub.nodeconfig;

import com.opcpub.config.GatewayConfig;
import com.opcpub.nodeconfig.export.NodeConfigurationExporter;
import com.opcpub.nodeconfig.export.NodeConfigurationSnapshot;
import com.opcpub.nodeconfig.file.ConfigurationFileEntry;
import com.opcpub.nodeconfig.file.ConfigurationFileEntryLegacy;
import com.opcpub.nodeconfig.id.NodeIdentifier;
import com.opcpub.nodeconfig.load.FileNodeConfigurationStore;
import com.opcpub.nodeconfig.load.NodeConfigurationLoader;
import com.opcpub.nodeconfig.load.NodeConfigurationStore;
import com.opcpub.nodeconfig.load.NodePublishingConfiguration;
import com.opcpub.nodeconfig.persist.NodeConfigurationPersister;
import com.opcpub.nodeconfig.runtime.HierarchyBuilder;
import com.opcpub.nodeconfig.runtime.NodeDefaults;
import com.opcpub.nodeconfig.runtime.PublishedNodesRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Entry point of the published nodes configuration: loads the file into the live structure, answers
 * queries about it, publishes and unpublishes nodes at runtime, and writes it back.
 * <p>
 * Usage: construct, call {@link #init()} once at startup, then hand {@link #getRegistry()} to the
 * protocol client.
 */
public final class PublishedNodesConfiguration {

    private static final Logger log = LoggerFactory.getLogger(PublishedNodesConfiguration.class);

    private final NodeConfigurationStore store;
    private final PublishedNodesRegistry registry;
    private final HierarchyBuilder builder;
    private final NodeConfigurationExporter exporter;
    private final NodeConfigurationPersister persister;

    public PublishedNodesConfiguration(GatewayConfig config) {
        this(config, new FileNodeConfigurationStore(config.getNodeConfigurationFile()));
    }

    public PublishedNodesConfiguration(GatewayConfig config, NodeConfigurationStore store) {
        Objects.requireNonNull(config, "config");
        this.store = Objects.requireNonNull(store, "store");
        this.registry = new PublishedNodesRegistry(NodeDefaults.from(config));
        this.builder = new HierarchyBuilder(registry);
        this.exporter = new NodeConfigurationExporter(registry);
        this.persister = new NodeConfigurationPersister(exporter, registry.getVersion(), store);
    }

    /**
     * Loads the node configuration file and creates the sessions, subscriptions and monitored items.
     *
     * @return number of monitored items created
     * @throws NodeConfigurationException if the file cannot be read or parsed, or the structure cannot be built
     */
    public int init() {
        try {
            List<NodePublishingConfiguration> nodes = new NodeConfigurationLoader(store).load();
            int added = builder.build(nodes);
            log.info("Node configuration initialized: {} session(s), {} subscription(s), {} monitored item(s)",
                    registry.numberOfSessionsConfigured(), registry.numberOfSubscriptionsConfigured(), added);
            return added;
        } catch (NodeConfigurationException e) {
            log.error("Initialization of the node configuration from '{}' failed", store.location(), e);
            throw e;
        }
    }

    public PublishedNodesRegistry getRegistry() {
        return registry;
    }

    public int numberOfSessionsConfigured() {
        return registry.numberOfSessionsConfigured();
    }

    public int numberOfSessionsConnected() {
        return registry.numberOfSessionsConnected();
    }

    public int numberOfSubscriptionsConfigured() {
        return registry.numberOfSubscriptionsConfigured();
    }

    public int numberOfSubscriptionsConnected() {
        return registry.numberOfSubscriptionsConnected();
    }

    public int numberOfMonitoredItemsConfigured() {
        return registry.numberOfMonitoredItemsConfigured();
    }

    public int numberOfMonitoredItemsMonitored() {
        return registry.numberOfMonitoredItemsMonitored();
    }

    public int numberOfMonitoredItemsToRemove() {
        return registry.numberOfMonitoredItemsToRemove();
    }

    public List<String> configuredEndpointUrls() {
        return registry.configuredEndpointUrls();
    }

    public Optional<NodeConfigurationSnapshot<List<ConfigurationFileEntry>>> export(String endpointUrlFilter,
                                                                                  boolean includeRemovalPending) {
        return exporter.export(endpointUrlFilter, includeRemovalPending);
    }

    public Optional<NodeConfigurationSnapshot<List<ConfigurationFileEntryLegacy>>> exportLegacy(String endpointUrlFilter) {
        return exporter.exportLegacy(endpointUrlFilter);
    }

    /**
     * Publishes one node at runtime, creating its session and subscription when needed.
     *
     * @return true if a monitored item was added, false if the node was already published there
     * @throws NodeConfigurationException if the endpoint requires a credential the entry does not carry
     */
    public boolean publishNode(NodePublishingConfiguration node) {
        Objects.requireNonNull(node, "node");
        boolean added = builder.build(List.of(node)) > 0;
        if (!added) {
            log.info("Node {} is already published on endpoint {}", node.getOriginalId(), node.getEndpointUrl());
        }
        return added;
    }

    /** See {@link PublishedNodesRegistry#requestNodeRemoval(String, NodeIdentifier)}. */
    public boolean requestNodeRemoval(String endpointUrl, NodeIdentifier identifier) {
        return registry.requestNodeRemoval(endpointUrl, identifier);
    }

    /** See {@link NodeConfigurationPersister#updateNodeConfigurationFile()}. */
    public boolean updateNodeConfigurationFile() {
        return persister.updateNodeConfigurationFile();
    }
}
