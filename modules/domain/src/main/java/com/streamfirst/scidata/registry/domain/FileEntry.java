package com.streamfirst.scidata.registry.domain;

import lombok.NonNull;

import java.util.Optional;

/**
 * One file of a dataset manifest. The bytes live in the content store; only small previews
 * (e.g. the text of JSON members) are carried inline. Previews are not part of the payload hash.
 */
public record FileEntry(
    @NonNull String name,
    long size,
    @NonNull ContentReference reference,
    String preview // optional
) {
    public FileEntry {
        if (name.isBlank()) {
            throw new IllegalArgumentException("File name cannot be blank");
        }
        if (size < 0) {
            throw new IllegalArgumentException("File size cannot be negative: " + size);
        }
    }

    public static FileEntry of(String name, long size, ContentReference reference) {
        return new FileEntry(name, size, reference, null);
    }

    public Optional<String> previewText() {
        return Optional.ofNullable(preview);
    }
}
