package com.streamfirst.scidata.registry.ports;

import com.streamfirst.scidata.registry.domain.ContentReference;

/**
 * Port for the byte-addressable store holding dataset file content.
 * The registry only ever sees opaque references; how and where bytes are kept is up to the
 * implementation (local disk, object store, etc.).
 */
public interface ContentStorePort {

    /**
     * Stores a blob. The data must be durable when this method returns.
     *
     * @param data the bytes to store
     * @return reference under which the bytes can be read back
     * @throws com.streamfirst.scidata.registry.domain.StorageException if the write fails
     */
    ContentReference put(byte[] data);

    /**
     * Reads the full content of a blob.
     *
     * @param reference the blob reference
     * @return the stored bytes
     * @throws com.streamfirst.scidata.registry.domain.StorageException if the blob is missing or unreadable
     */
    byte[] get(ContentReference reference);

    /**
     * Gets the size of a blob without reading it.
     *
     * @param reference the blob reference
     * @return size in bytes
     * @throws com.streamfirst.scidata.registry.domain.StorageException if the blob is missing
     */
    long size(ContentReference reference);

    /**
     * Checks whether a blob exists.
     *
     * @param reference the blob reference
     * @return true if the store holds content for the reference
     */
    boolean exists(ContentReference reference);
}
