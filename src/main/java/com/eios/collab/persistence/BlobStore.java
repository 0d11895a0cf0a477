package com.eios.collab.persistence;

import java.util.List;
import java.util.Optional;

/**
 * Durable object storage for snapshots and log segments. Keys are written once and
 * never overwritten with different content.
 *
 * <p>Calls block; callers run them off the event loop. Failures of the backing store
 * surface as {@link com.eios.collab.error.TransientStorageException}.
 */
public interface BlobStore {

    void put(String key, byte[] data);

    Optional<byte[]> get(String key);

    /**
     * Keys starting with {@code prefix}, in lexicographic order.
     */
    List<String> list(String prefix);

    void delete(String key);

    /**
     * Fails when the store is unreachable.
     */
    void ping();
}
