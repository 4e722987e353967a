package com.opcpub.nodeconfig.load;

import java.io.IOException;
import java.util.Optional;

/**
 * Storage of the published nodes file: read once at startup by {@link NodeConfigurationLoader},
 * rewritten by {@link com.opcpub.nodeconfig.persist.NodeConfigurationPersister} whenever the
 * published nodes change.
 */
public interface NodeConfigurationStore {

    /**
     * Reads the whole configuration document.
     *
     * @return the JSON content, or empty if nothing has been stored yet
     * @throws IOException if the document exists but cannot be read
     */
    Optional<String> read() throws IOException;

    /**
     * Replaces the whole configuration document. Readers never observe a partially written document.
     *
     * @param json full configuration JSON
     * @throws IOException if the document cannot be written
     */
    void write(String json) throws IOException;

    /** Human-readable location for logs (e.g. the file path). */
    String location();
}
