package com.nzila.api.storage;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;

/**
 * Selects the blob store with {@code nzila.blob.type}.
 */
@Configuration
public class BlobStoreConfig {

    @Bean
    @ConditionalOnProperty(name = "nzila.blob.type", havingValue = "filesystem", matchIfMissing = true)
    public DocumentBlobStore localFileBlobStore(@Value("${nzila.blob.root:./var/blobs}") String root) {
        return new LocalFileBlobStore(Path.of(root));
    }

    @Bean
    @ConditionalOnProperty(name = "nzila.blob.type", havingValue = "memory")
    public DocumentBlobStore inMemoryBlobStore() {
        return new InMemoryBlobStore();
    }
}
