package com.opcpub.nodeconfig.runtime;

import com.opcpub.nodeconfig.id.NodeIdentifier;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Subscription of a session for one publishing interval. A null interval means none was configured;
 * the protocol client applies its default when it creates the subscription on the server.
 * <p>
 * Not thread-safe: the item list is read and changed only while the owning session is locked.
 */
public final class OpcSubscription {

    private final Integer publishingInterval;
    private final List<OpcMonitoredItem> monitoredItems = new ArrayList<>();

    public OpcSubscription(Integer publishingInterval) {
        this.publishingInterval = publishingInterval;
    }

    public Integer getPublishingInterval() {
        return publishingInterval;
    }

    public boolean hasPublishingInterval(Integer interval) {
        return Objects.equals(publishingInterval, interval);
    }

    public List<OpcMonitoredItem> getMonitoredItems() {
        return Collections.unmodifiableList(monitoredItems);
    }

    void addMonitoredItem(OpcMonitoredItem item) {
        monitoredItems.add(Objects.requireNonNull(item, "item"));
    }

    boolean containsNode(NodeIdentifier identifier) {
        for (OpcMonitoredItem item : monitoredItems) {
            if (item.getIdentifier().equals(identifier)) {
                return true;
            }
        }
        return false;
    }

    int countItemsInState(MonitoredItemState state) {
        int count = 0;
        for (OpcMonitoredItem item : monitoredItems) {
            if (item.getState() == state) {
                count++;
            }
        }
        return count;
    }
}
