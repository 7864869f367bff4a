package com.streamfirst.scidata.registry.domain;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Immutable snapshot of one dataset version. Every state transition returns a new snapshot, so a
 * reader that obtained an instance always sees a consistent view while the registry replaces the
 * stored snapshot under the dataset's lock.
 *
 * <p>Transitions enforce the lifecycle: files may only be appended while the dataset is neither
 * complete nor invalidated, completion happens at most once, and invalidation never reverses.
 */
@Value
@Builder(toBuilder = true)
public class Dataset {
    @NonNull DatasetId id;

    @NonNull DatasetMetadata metadata;

    /** User name of the uploader; always holds read and write */
    @NonNull String owner;

    /** Total byte size of all manifest entries */
    long size;

    /** Server-assigned when the upload begins */
    @NonNull Instant uploadTime;

    /** Server-assigned when the upload completes, null before */
    Instant storageTime;

    boolean complete;

    /** Hex payload digest, null until complete */
    String hash;

    /** Predecessor this version supersedes, null if none */
    DatasetId replaces;

    @NonNull
    @Builder.Default
    List<FileEntry> content = List.of();

    boolean invalidated;

    /**
     * Creates the initial, incomplete snapshot of a new upload.
     */
    public static Dataset started(DatasetId id, DatasetMetadata metadata, String owner,
                                  DatasetId replaces, Instant uploadTime) {
        return Dataset.builder()
            .id(id)
            .metadata(metadata)
            .owner(owner)
            .replaces(replaces)
            .uploadTime(uploadTime)
            .build();
    }

    public Optional<DatasetId> replacesId() {
        return Optional.ofNullable(replaces);
    }

    public Optional<String> payloadHash() {
        return Optional.ofNullable(hash);
    }

    public Optional<FileEntry> file(String name) {
        return content.stream().filter(entry -> entry.name().equals(name)).findFirst();
    }

    /**
     * Returns a snapshot with the entry appended to the manifest.
     *
     * @throws ImmutableDatasetException if the dataset is complete or invalidated
     * @throws ValidationException if an entry with the same name already exists
     */
    public Dataset withFile(FileEntry entry) {
        requireMutable("append file " + entry.name());
        if (file(entry.name()).isPresent()) {
            throw new ValidationException(
                "Dataset " + id + " already contains a file named '" + entry.name() + "'");
        }
        List<FileEntry> files = new ArrayList<>(content);
        files.add(entry);
        return toBuilder()
            .content(Collections.unmodifiableList(files))
            .size(size + entry.size())
            .build();
    }

    /**
     * Returns the completed snapshot carrying the verified payload hash.
     *
     * @throws ImmutableDatasetException if the dataset is already complete or invalidated
     */
    public Dataset completed(String verifiedHash, Instant completedAt) {
        requireMutable("complete upload");
        long total = content.stream().mapToLong(FileEntry::size).sum();
        return toBuilder()
            .complete(true)
            .hash(verifiedHash)
            .storageTime(completedAt)
            .size(total)
            .build();
    }

    /**
     * Returns the invalidated snapshot, or this one if it is already invalidated.
     */
    public Dataset invalidated() {
        if (invalidated) {
            return this;
        }
        return toBuilder().invalidated(true).build();
    }

    /**
     * @throws ImmutableDatasetException if the dataset no longer accepts content changes
     */
    public void requireMutable(String action) {
        if (invalidated) {
            throw new ImmutableDatasetException(id, "cannot " + action + ": dataset is invalidated");
        }
        if (complete) {
            throw new ImmutableDatasetException(id, "cannot " + action + ": dataset is complete");
        }
    }

    @Override
    public String toString() {
        return "Dataset{"
            + "id=" + id
            + ", title='" + metadata.getTitle() + '\''
            + ", owner='" + owner + '\''
            + ", files=" + content.size()
            + ", complete=" + complete
            + ", invalidated=" + invalidated
            + '}';
    }
}
