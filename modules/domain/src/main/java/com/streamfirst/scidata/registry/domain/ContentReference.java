package com.streamfirst.scidata.registry.domain;

import java.util.Objects;

/**
 * Opaque key of a blob held by the content store.
 *
 * @param key the store-specific key
 */
public record ContentReference(String key) {
    public ContentReference {
        Objects.requireNonNull(key, "Content reference key cannot be null");
        if (key.trim().isEmpty()) {
            throw new IllegalArgumentException("Content reference key cannot be empty");
        }
    }

    @Override
    public String toString() {
        return key;
    }
}
