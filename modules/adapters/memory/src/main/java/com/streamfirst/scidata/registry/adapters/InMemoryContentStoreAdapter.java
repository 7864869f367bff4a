package com.streamfirst.scidata.registry.adapters;

import com.streamfirst.scidata.registry.domain.ContentReference;
import com.streamfirst.scidata.registry.domain.StorageException;
import com.streamfirst.scidata.registry.ports.ContentStorePort;
import lombok.extern.slf4j.Slf4j;

import java.util.Arrays;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory implementation of ContentStorePort for testing and development.
 * Blobs are copied on the way in and out and keyed by random identifiers.
 * Data is lost when the application stops - not suitable for production use.
 */
@Slf4j
public class InMemoryContentStoreAdapter implements ContentStorePort {

    private final Map<String, byte[]> blobs = new ConcurrentHashMap<>();

    @Override
    public ContentReference put(byte[] data) {
        ContentReference reference = new ContentReference("mem-" + UUID.randomUUID());
        blobs.put(reference.key(), Arrays.copyOf(data, data.length));
        log.debug("Stored blob {} ({} bytes)", reference, data.length);
        return reference;
    }

    @Override
    public byte[] get(ContentReference reference) {
        byte[] content = blobs.get(reference.key());
        if (content == null) {
            throw new StorageException("Blob not found: " + reference);
        }
        return Arrays.copyOf(content, content.length);
    }

    @Override
    public long size(ContentReference reference) {
        byte[] content = blobs.get(reference.key());
        if (content == null) {
            throw new StorageException("Blob not found: " + reference);
        }
        return content.length;
    }

    @Override
    public boolean exists(ContentReference reference) {
        return blobs.containsKey(reference.key());
    }

    /**
     * Overwrites a stored blob in place. Lets tests simulate corruption of the backing store.
     */
    public void overwrite(ContentReference reference, byte[] data) {
        if (!blobs.containsKey(reference.key())) {
            throw new StorageException("Blob not found: " + reference);
        }
        log.warn("Overwriting blob {} in place", reference);
        blobs.put(reference.key(), Arrays.copyOf(data, data.length));
    }

    /**
     * Gets the number of stored blobs.
     */
    public int blobCount() {
        return blobs.size();
    }
}
