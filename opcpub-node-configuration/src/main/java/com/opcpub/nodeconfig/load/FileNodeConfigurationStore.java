package com.opcpub.nodeconfig.load;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.Semaphore;

/**
 * Published nodes file on the local file system. All reads and writes are serialized by the file
 * lock, which is independent of the locks guarding the in-memory structure. Writes go to a temporary
 * file in the same directory that is then moved over the target.
 */
public final class FileNodeConfigurationStore implements NodeConfigurationStore {

    private static final Logger log = LoggerFactory.getLogger(FileNodeConfigurationStore.class);

    private final Path file;
    private final Semaphore fileLock = new Semaphore(1);

    public FileNodeConfigurationStore(Path file) {
        this.file = Objects.requireNonNull(file, "file").toAbsolutePath();
    }

    public Path getFile() {
        return file;
    }

    @Override
    public Optional<String> read() throws IOException {
        fileLock.acquireUninterruptibly();
        try {
            if (!Files.exists(file)) {
                return Optional.empty();
            }
            return Optional.of(Files.readString(file, StandardCharsets.UTF_8));
        } finally {
            fileLock.release();
        }
    }

    @Override
    public void write(String json) throws IOException {
        Objects.requireNonNull(json, "json");
        fileLock.acquireUninterruptibly();
        try {
            Path dir = file.getParent();
            if (dir != null) {
                Files.createDirectories(dir);
            }
            Path tmp = Files.createTempFile(dir, file.getFileName().toString(), ".tmp");
            try {
                Files.writeString(tmp, json, StandardCharsets.UTF_8);
                try {
                    Files.move(tmp, file, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
                } catch (AtomicMoveNotSupportedException e) {
                    log.debug("Atomic move not supported for {}; replacing file", file);
                    Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING);
                }
            } finally {
                Files.deleteIfExists(tmp);
            }
        } finally {
            fileLock.release();
        }
    }

    @Override
    public String location() {
        return file.toString();
    }
}
