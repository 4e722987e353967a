package com.opcpub.nodeconfig.persist;

import com.opcpub.nodeconfig.export.NodeConfigurationExporter;
import com.opcpub.nodeconfig.export.NodeConfigurationSnapshot;
import com.opcpub.nodeconfig.file.ConfigurationFileEntry;
import com.opcpub.nodeconfig.file.NodeConfigurationJson;
import com.opcpub.nodeconfig.load.NodeConfigurationStore;
import com.opcpub.nodeconfig.runtime.NodeConfigVersion;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.Semaphore;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Writes the live configuration back to the published nodes file when it changed since the last
 * successful write. The whole file is rewritten with the grouped schema, including items waiting for
 * removal.
 * <p>
 * The marker records the version of the snapshot that was written, not the version at the time of
 * the call, so a change that races with a write leaves the file stale and the next call writes again.
 * Updates are serialized: check, export, write and marker update run as one step, so the marker
 * always describes the file contents.
 */
public final class NodeConfigurationPersister {

    private static final Logger log = LoggerFactory.getLogger(NodeConfigurationPersister.class);

    private final NodeConfigurationExporter exporter;
    private final NodeConfigVersion version;
    private final NodeConfigurationStore store;
    private final AtomicLong lastWrittenVersion = new AtomicLong();
    private final Semaphore updateLock = new Semaphore(1);

    public NodeConfigurationPersister(NodeConfigurationExporter exporter, NodeConfigVersion version,
                                      NodeConfigurationStore store) {
        this.exporter = Objects.requireNonNull(exporter, "exporter");
        this.version = Objects.requireNonNull(version, "version");
        this.store = Objects.requireNonNull(store, "store");
    }

    /**
     * Rewrites the file if the configuration changed since the last successful write.
     *
     * @return true if the file was written
     */
    public boolean updateNodeConfigurationFile() {
        updateLock.acquireUninterruptibly();
        try {
            return updateUnlocked();
        } finally {
            updateLock.release();
        }
    }

    private boolean updateUnlocked() {
        if (version.get() == lastWrittenVersion.get()) {
            return false;
        }
        Optional<NodeConfigurationSnapshot<List<ConfigurationFileEntry>>> snapshot = exporter.export(null, true);
        if (snapshot.isEmpty()) {
            log.error("Update of node configuration file '{}' failed: the configuration could not be exported",
                    store.location());
            return false;
        }
        try {
            store.write(NodeConfigurationJson.toJson(snapshot.get().entries()));
        } catch (IOException | RuntimeException e) {
            log.error("Update of node configuration file '{}' failed", store.location(), e);
            return false;
        }
        lastWrittenVersion.set(snapshot.get().version());
        log.info("Node configuration file '{}' updated to version {}", store.location(),
                String.format("%08X", snapshot.get().version()));
        return true;
    }

    /** Version of the configuration last written to the file; 0 before the first write. */
    public long getLastWrittenVersion() {
        return lastWrittenVersion.get();
    }
}
