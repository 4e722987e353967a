package com.opcpub.nodeconfig.runtime;

import com.opcpub.nodeconfig.NodeConfigurationException;
import com.opcpub.nodeconfig.load.NodePublishingConfiguration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Turns flat node entries into sessions, subscriptions and monitored items.
 * <p>
 * Entries are grouped by endpoint URL (case-insensitive, first-seen order, first spelling kept) and,
 * within an endpoint, by publishing interval (first-seen order; an unset interval is its own group).
 * The first entry of an endpoint decides its connection settings. Endpoints that already have a
 * session are merged into it; a node already present in the target subscription is not added again.
 * Every added item increments the version by one.
 */
public final class HierarchyBuilder {

    private static final Logger log = LoggerFactory.getLogger(HierarchyBuilder.class);

    private final PublishedNodesRegistry registry;

    public HierarchyBuilder(PublishedNodesRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "registry");
    }

    /**
     * Adds the entries to the registry.
     *
     * @return number of monitored items added
     * @throws NodeConfigurationException if an endpoint requires a credential it does not have, or on any
     *                                    unexpected failure; sessions created before the failure remain
     */
    public int build(List<NodePublishingConfiguration> entries) {
        if (entries == null || entries.isEmpty()) {
            return 0;
        }
        try {
            return registry.withStructureLock(sessions -> buildUnlocked(sessions, entries));
        } catch (NodeConfigurationException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new NodeConfigurationException("Creation of the node configuration failed: " + e.getMessage(), e);
        }
    }

    private int buildUnlocked(List<OpcSession> sessions, List<NodePublishingConfiguration> entries) {
        Map<String, List<NodePublishingConfiguration>> byEndpoint = new LinkedHashMap<>();
        for (NodePublishingConfiguration entry : entries) {
            if (entry == null) {
                continue;
            }
            byEndpoint.computeIfAbsent(entry.getEndpointUrl().toLowerCase(Locale.ROOT), k -> new ArrayList<>()).add(entry);
        }

        int added = 0;
        for (List<NodePublishingConfiguration> endpointEntries : byEndpoint.values()) {
            NodePublishingConfiguration first = endpointEntries.get(0);
            warnOnDivergentSettings(first, endpointEntries);
            if (first.getAuthenticationMode().requiresCredential() && first.getEncryptedCredential() == null) {
                throw new NodeConfigurationException("Endpoint " + first.getEndpointUrl()
                        + " uses authentication mode " + first.getAuthenticationMode().toValue() + " but has no credential");
            }
            OpcSession session = obtainSession(sessions, first);
            session.lockSession();
            try {
                added += addItems(session, endpointEntries);
            } finally {
                session.releaseSession();
            }
        }
        log.info("Added {} monitored item(s); {} session(s) configured; node configuration version {}",
                added, sessions.size(), registry.getVersion());
        return added;
    }

    private static OpcSession obtainSession(List<OpcSession> sessions, NodePublishingConfiguration first) {
        Optional<OpcSession> existing = PublishedNodesRegistry.findSessionUnlocked(sessions, first.getEndpointUrl());
        if (existing.isPresent()) {
            OpcSession session = existing.get();
            if (session.isUseSecurity() != first.isUseSecurity()
                    || session.getAuthenticationMode() != first.getAuthenticationMode()
                    || !Objects.equals(session.getEncryptedCredential(), first.getEncryptedCredential())) {
                log.warn("Connection settings for endpoint {} differ from the existing session; keeping the session's settings",
                        session.getEndpointUrl());
            }
            return session;
        }
        OpcSession session = new OpcSession(first.getEndpointUrl(), first.isUseSecurity(),
                first.getAuthenticationMode(), first.getEncryptedCredential());
        sessions.add(session);
        log.debug("Created session for endpoint {} (useSecurity={}, authentication={})",
                session.getEndpointUrl(), session.isUseSecurity(), session.getAuthenticationMode().toValue());
        return session;
    }

    private int addItems(OpcSession session, List<NodePublishingConfiguration> endpointEntries) {
        List<Integer> intervals = new ArrayList<>();
        for (NodePublishingConfiguration entry : endpointEntries) {
            if (!intervals.contains(entry.getPublishingInterval())) {
                intervals.add(entry.getPublishingInterval());
            }
        }

        NodeDefaults defaults = registry.getDefaults();
        int added = 0;
        for (Integer interval : intervals) {
            OpcSubscription subscription = session.getOrAddSubscriptionUnlocked(interval);
            for (NodePublishingConfiguration entry : endpointEntries) {
                if (!Objects.equals(entry.getPublishingInterval(), interval)) {
                    continue;
                }
                if (entry.getIdentifier() == null) {
                    log.warn("Node entry on endpoint {} has no node identifier. Skipping...", session.getEndpointUrl());
                    continue;
                }
                if (subscription.containsNode(entry.getIdentifier())) {
                    log.debug("Node {} is already published on endpoint {} with publishing interval {}",
                            entry.getIdentifier(), session.getEndpointUrl(), interval);
                    continue;
                }
                subscription.addMonitoredItem(new OpcMonitoredItem(
                        entry.getIdentifier(),
                        session.getEndpointUrl(),
                        ConfiguredValue.resolve(entry.getSamplingInterval(), defaults.samplingInterval()),
                        ConfiguredValue.resolve(entry.getDisplayName(), entry.getOriginalId()),
                        ConfiguredValue.resolve(entry.getHeartbeatInterval(), defaults.heartbeatInterval()),
                        ConfiguredValue.resolve(entry.getSkipFirst(), defaults.skipFirst())));
                registry.getVersion().increment();
                added++;
            }
        }
        return added;
    }

    private static void warnOnDivergentSettings(NodePublishingConfiguration first, List<NodePublishingConfiguration> endpointEntries) {
        for (NodePublishingConfiguration entry : endpointEntries) {
            if (entry == first) {
                continue;
            }
            if (entry.isUseSecurity() != first.isUseSecurity()
                    || entry.getAuthenticationMode() != first.getAuthenticationMode()
                    || !Objects.equals(entry.getEncryptedCredential(), first.getEncryptedCredential())) {
                log.warn("Node {} on endpoint {} has connection settings different from the first entry of the endpoint; "
                        + "using the first entry's settings", entry.getOriginalId(), first.getEndpointUrl());
            }
        }
    }
}
