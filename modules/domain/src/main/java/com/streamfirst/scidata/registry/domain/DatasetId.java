package com.streamfirst.scidata.registry.domain;

import java.util.Objects;
import java.util.UUID;

/**
 * Globally unique identifier of a dataset version. Assigned once at upload start and never
 * reused. The natural ordering is lexicographic on the string value and is the global order in
 * which dataset locks are acquired.
 *
 * @param value the identifier, normally a UUID string
 */
public record DatasetId(String value) implements Comparable<DatasetId> {
    public DatasetId {
        Objects.requireNonNull(value, "Dataset ID cannot be null");
        if (value.trim().isEmpty()) {
            throw new IllegalArgumentException("Dataset ID cannot be empty");
        }
    }

    /**
     * Allocates a fresh random identifier.
     */
    public static DatasetId random() {
        return new DatasetId(UUID.randomUUID().toString());
    }

    public static DatasetId of(String value) {
        return new DatasetId(value);
    }

    @Override
    public int compareTo(DatasetId other) {
        return value.compareTo(other.value);
    }

    @Override
    public String toString() {
        return value;
    }
}
