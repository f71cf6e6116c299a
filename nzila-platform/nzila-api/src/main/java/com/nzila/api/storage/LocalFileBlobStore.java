package com.nzila.api.storage;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Optional;

/**
 * Stores blobs under a root directory. Writes go to a temporary file first and are
 * moved into place atomically.
 */
public class LocalFileBlobStore implements DocumentBlobStore {

    private static final Logger log = LoggerFactory.getLogger(LocalFileBlobStore.class);

    private final Path root;

    public LocalFileBlobStore(Path root) {
        this.root = root.toAbsolutePath().normalize();
    }

    @Override
    public void put(String path, byte[] content) {
        Path target = resolve(path);
        Path temp = null;
        try {
            Files.createDirectories(target.getParent());
            temp = Files.createTempFile(target.getParent(), ".upload-", ".tmp");
            Files.write(temp, content);
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            log.debug("Stored blob {} ({} bytes)", path, content.length);
        } catch (IOException e) {
            BlobStoreException failure = new BlobStoreException("Failed to store blob " + path, e);
            if (temp != null) {
                try {
                    Files.deleteIfExists(temp);
                } catch (IOException cleanup) {
                    failure.addSuppressed(cleanup);
                }
            }
            throw failure;
        }
    }

    @Override
    public Optional<byte[]> get(String path) {
        Path target = resolve(path);
        if (!Files.isRegularFile(target)) {
            return Optional.empty();
        }
        try {
            return Optional.of(Files.readAllBytes(target));
        } catch (IOException e) {
            throw new BlobStoreException("Failed to read blob " + path, e);
        }
    }

    @Override
    public boolean exists(String path) {
        return Files.isRegularFile(resolve(path));
    }

    private Path resolve(String path) {
        Path resolved = root.resolve(BlobPaths.requireValid(path)).normalize();
        if (!resolved.startsWith(root)) {
            throw new BlobStoreException("Blob path escapes storage root: " + path);
        }
        return resolved;
    }
}
