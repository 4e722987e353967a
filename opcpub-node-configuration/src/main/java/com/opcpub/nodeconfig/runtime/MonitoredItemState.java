package com.opcpub.nodeconfig.runtime;

/**
 * Lifecycle of a monitored item. Items start {@link #CONFIGURED}; the protocol client moves them to
 * {@link #MONITORED} once the server accepted them, and from {@link #REMOVAL_REQUESTED} to
 * {@link #REMOVED} when unpublishing.
 */
public enum MonitoredItemState {
    CONFIGURED,
    MONITORED,
    /** Queued for removal; still part of the structure until the protocol client removes it. */
    REMOVAL_REQUESTED,
    REMOVED
}
