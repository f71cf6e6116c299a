package com.nzila.api.storage;

import java.util.regex.Pattern;

final class BlobPaths {

    private static final Pattern SEGMENT = Pattern.compile("[A-Za-z0-9._-]+");

    private BlobPaths() {
    }

    /**
     * Rejects absolute paths, empty segments and parent references.
     */
    static String requireValid(String path) {
        if (path == null || path.isBlank() || path.startsWith("/")) {
            throw new BlobStoreException("Invalid blob path: " + path);
        }
        for (String segment : path.split("/", -1)) {
            if (segment.equals(".") || segment.equals("..") || !SEGMENT.matcher(segment).matches()) {
                throw new BlobStoreException("Invalid blob path: " + path);
            }
        }
        return path;
    }
}
