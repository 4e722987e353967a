package com.opcpub.nodeconfig.runtime;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Version of the published nodes. Incremented once for every monitored item added to a subscription,
 * never decremented. Compared against the version last written to disk to decide whether the
 * configuration file is stale.
 * <p>
 * Increments happen only while the structure lock of {@link PublishedNodesRegistry} is held; reads
 * need no lock.
 */
public final class NodeConfigVersion {

    private final AtomicLong version = new AtomicLong();

    public long get() {
        return version.get();
    }

    long increment() {
        return version.incrementAndGet();
    }

    @Override
    public String toString() {
        return String.format("%08X", version.get());
    }
}
