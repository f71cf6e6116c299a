package com.nzila.api.storage;

import java.util.Optional;

/**
 * Path-addressed blob storage. Paths are relative, forward-slash separated.
 */
public interface DocumentBlobStore {

    void put(String path, byte[] content);

    Optional<byte[]> get(String path);

    boolean exists(String path);
}
