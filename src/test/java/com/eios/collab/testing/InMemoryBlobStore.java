package com.eios.collab.testing;

import com.eios.collab.error.TransientStorageException;
import com.eios.collab.persistence.BlobStore;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Blob store kept in a sorted map. Can be switched unavailable, or told to fail a
 * number of upcoming writes, to exercise retries and degraded mode.
 */
public class InMemoryBlobStore implements BlobStore {

    private final Map<String, byte[]> blobs = new ConcurrentSkipListMap<>();
    private final AtomicInteger failWrites = new AtomicInteger();
    private final AtomicInteger writes = new AtomicInteger();
    private volatile boolean available = true;

    public void setAvailable(boolean available) {
        this.available = available;
    }

    public void failNextWrites(int count) {
        failWrites.set(count);
    }

    public int writes() {
        return writes.get();
    }

    public Map<String, byte[]> blobs() {
        return blobs;
    }

    @Override
    public void put(String key, byte[] data) {
        check();
        if (failWrites.getAndUpdate(n -> Math.max(0, n - 1)) > 0) {
            throw new TransientStorageException("Injected write failure for " + key, null);
        }
        writes.incrementAndGet();
        blobs.put(key, data.clone());
    }

    @Override
    public Optional<byte[]> get(String key) {
        check();
        return Optional.ofNullable(blobs.get(key)).map(byte[]::clone);
    }

    @Override
    public List<String> list(String prefix) {
        check();
        return blobs.keySet().stream().filter(k -> k.startsWith(prefix)).toList();
    }

    @Override
    public void delete(String key) {
        check();
        blobs.remove(key);
    }

    @Override
    public void ping() {
        check();
    }

    private void check() {
        if (!available) {
            throw new TransientStorageException("Store unavailable", null);
        }
    }
}
