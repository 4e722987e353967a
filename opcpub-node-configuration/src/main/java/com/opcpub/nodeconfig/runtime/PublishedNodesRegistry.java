package com.opcpub.nodeconfig.runtime;

import com.opcpub.nodeconfig.id.NodeIdentifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.Semaphore;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.ToIntFunction;

/**
 * Live Session → Subscription → MonitoredItem structure of the gateway.
 * <p>
 * Locking: the structure lock, then the session-list lock, then one session lock at a time. Session
 * locks are never nested and never held while acquiring the other two. All locks are non-reentrant
 * and acquired uninterruptibly. Queries and exports hold the structure and session-list locks for
 * their whole run, so they are exclusive with each other and with structural changes.
 * <p>
 * The version is only incremented while the structure lock is held.
 */
public final class PublishedNodesRegistry {

    private static final Logger log = LoggerFactory.getLogger(PublishedNodesRegistry.class);

    private final Semaphore structureLock = new Semaphore(1);
    private final Semaphore sessionListLock = new Semaphore(1);
    private final List<OpcSession> sessions = new ArrayList<>();
    private final NodeConfigVersion version = new NodeConfigVersion();
    private final NodeDefaults defaults;

    public PublishedNodesRegistry(NodeDefaults defaults) {
        this.defaults = Objects.requireNonNull(defaults, "defaults");
    }

    public NodeConfigVersion getVersion() {
        return version;
    }

    public NodeDefaults getDefaults() {
        return defaults;
    }

    /**
     * Runs {@code action} with the structure and session-list locks held and the mutable session list.
     */
    <T> T withStructureLock(Function<List<OpcSession>, T> action) {
        structureLock.acquireUninterruptibly();
        try {
            sessionListLock.acquireUninterruptibly();
            try {
                return action.apply(sessions);
            } finally {
                sessionListLock.release();
            }
        } finally {
            structureLock.release();
        }
    }

    /**
     * Visits every session in creation order, each one while its session lock is held.
     *
     * @return the version read at the end of the traversal, still under the structure lock, so it
     * matches what the visitor saw
     */
    public long visitSessions(Consumer<OpcSession> visitor) {
        Objects.requireNonNull(visitor, "visitor");
        return withStructureLock(list -> {
            for (OpcSession session : list) {
                session.lockSession();
                try {
                    visitor.accept(session);
                } finally {
                    session.releaseSession();
                }
            }
            return version.get();
        });
    }

    public int numberOfSessionsConfigured() {
        return withStructureLock(List::size);
    }

    public int numberOfSessionsConnected() {
        return sumOverSessions(s -> s.isConnected() ? 1 : 0);
    }

    public int numberOfSubscriptionsConfigured() {
        return sumOverSessions(s -> s.getSubscriptionsUnlocked().size());
    }

    public int numberOfSubscriptionsConnected() {
        return sumOverSessions(s -> s.isConnected() ? s.getSubscriptionsUnlocked().size() : 0);
    }

    public int numberOfMonitoredItemsConfigured() {
        return sumOverSessions(OpcSession::countMonitoredItemsUnlocked);
    }

    /** Items the server accepted, counted on connected sessions only. */
    public int numberOfMonitoredItemsMonitored() {
        return sumOverSessions(s -> s.isConnected() ? s.countMonitoredItemsUnlocked(MonitoredItemState.MONITORED) : 0);
    }

    public int numberOfMonitoredItemsToRemove() {
        return sumOverSessions(s -> s.countMonitoredItemsUnlocked(MonitoredItemState.REMOVAL_REQUESTED));
    }

    /** Endpoint URLs of all sessions, in creation order. */
    public List<String> configuredEndpointUrls() {
        return withStructureLock(list -> {
            List<String> urls = new ArrayList<>(list.size());
            for (OpcSession session : list) {
                urls.add(session.getEndpointUrl());
            }
            return List.copyOf(urls);
        });
    }

    public Optional<OpcSession> findSession(String endpointUrl) {
        Objects.requireNonNull(endpointUrl, "endpointUrl");
        return withStructureLock(list -> findSessionUnlocked(list, endpointUrl));
    }

    static Optional<OpcSession> findSessionUnlocked(List<OpcSession> list, String endpointUrl) {
        for (OpcSession session : list) {
            if (session.matchesEndpoint(endpointUrl)) {
                return Optional.of(session);
            }
        }
        return Optional.empty();
    }

    /**
     * Marks every item for the node on the endpoint as {@link MonitoredItemState#REMOVAL_REQUESTED}.
     * The items stay in the structure until the protocol client removes them. The version does not
     * change.
     *
     * @return true if at least one item matched
     */
    public boolean requestNodeRemoval(String endpointUrl, NodeIdentifier identifier) {
        Objects.requireNonNull(endpointUrl, "endpointUrl");
        Objects.requireNonNull(identifier, "identifier");
        boolean matched = withStructureLock(list -> {
            Optional<OpcSession> session = findSessionUnlocked(list, endpointUrl);
            if (session.isEmpty()) {
                return false;
            }
            OpcSession s = session.get();
            boolean found = false;
            s.lockSession();
            try {
                for (OpcSubscription subscription : s.getSubscriptionsUnlocked()) {
                    for (OpcMonitoredItem item : subscription.getMonitoredItems()) {
                        if (item.getIdentifier().equals(identifier) && item.getState() != MonitoredItemState.REMOVED) {
                            item.setState(MonitoredItemState.REMOVAL_REQUESTED);
                            found = true;
                        }
                    }
                }
            } finally {
                s.releaseSession();
            }
            return found;
        });
        if (matched) {
            log.info("Requested removal of node {} on endpoint {}", identifier, endpointUrl);
        } else {
            log.warn("Node {} is not published on endpoint {}", identifier, endpointUrl);
        }
        return matched;
    }

    private int sumOverSessions(ToIntFunction<OpcSession> counter) {
        int[] total = {0};
        visitSessions(s -> total[0] += counter.applyAsInt(s));
        return total[0];
    }
}
