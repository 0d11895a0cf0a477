package com.eios.collab.persistence;

import com.eios.collab.config.CollabConfig;
import io.quarkus.arc.DefaultBean;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Singleton;

import java.nio.file.Path;

/**
 * Selects the object store.
 *
 * collab.storage.provider:
 *  - filesystem (default, local directory)
 *  - s3         (S3 or MinIO)
 */
@ApplicationScoped
public class StorageProducer {

    @Produces
    @Singleton
    @DefaultBean
    public BlobStore blobStore(CollabConfig config) {
        String provider = config.storage().provider().trim().toLowerCase();
        return switch (provider) {
            case "s3" -> S3BlobStore.create(config.storage().s3());
            case "filesystem" -> new FileSystemBlobStore(Path.of(config.storage().directory()));
            default -> throw new IllegalStateException("Unknown collab.storage.provider: " + provider);
        };
    }
}
