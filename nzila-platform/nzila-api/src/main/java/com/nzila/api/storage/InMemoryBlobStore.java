package com.nzila.api.storage;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

public class InMemoryBlobStore implements DocumentBlobStore {

    private final Map<String, byte[]> blobs = new ConcurrentHashMap<>();

    @Override
    public void put(String path, byte[] content) {
        blobs.put(BlobPaths.requireValid(path), content.clone());
    }

    @Override
    public Optional<byte[]> get(String path) {
        return Optional.ofNullable(blobs.get(BlobPaths.requireValid(path))).map(byte[]::clone);
    }

    @Override
    public boolean exists(String path) {
        return blobs.containsKey(BlobPaths.requireValid(path));
    }
}
