package com.streamfirst.scidata.registry.application;

import com.streamfirst.scidata.registry.domain.AccessList;
import com.streamfirst.scidata.registry.domain.ContentReference;
import com.streamfirst.scidata.registry.domain.Dataset;
import com.streamfirst.scidata.registry.domain.DatasetId;
import com.streamfirst.scidata.registry.domain.DatasetMetadata;
import com.streamfirst.scidata.registry.domain.FileEntry;
import com.streamfirst.scidata.registry.domain.ForbiddenException;
import com.streamfirst.scidata.registry.domain.ChainConflictException;
import com.streamfirst.scidata.registry.domain.Grant;
import com.streamfirst.scidata.registry.domain.ImmutableDatasetException;
import com.streamfirst.scidata.registry.domain.IntegrityException;
import com.streamfirst.scidata.registry.domain.NotFoundException;
import com.streamfirst.scidata.registry.domain.Operation;
import com.streamfirst.scidata.registry.domain.Principal;
import com.streamfirst.scidata.registry.domain.ValidationException;
import com.streamfirst.scidata.registry.domain.VerificationReport;
import com.streamfirst.scidata.registry.ports.ContentStorePort;
import com.streamfirst.scidata.registry.ports.DatasetRepositoryPort;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.Collection;
import java.util.Comparator;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Aggregate root of the catalog and the only component that changes dataset state.
 *
 * <p>Every mutating operation runs under the dataset's lock; reads work on the immutable snapshot
 * last stored and take no lock. The requester is always passed explicitly and is authorized
 * through the {@link PermissionMatrix} before anything is changed. All failures are typed
 * {@link com.streamfirst.scidata.registry.domain.RegistryException}s and nothing is retried here.
 */
@Slf4j
@RequiredArgsConstructor
public class DatasetRegistry {

    private static final Comparator<Dataset> MOST_RECENT_FIRST =
        Comparator.comparing(Dataset::getUploadTime).reversed()
            .thenComparing(Dataset::getId);

    private final DatasetRepositoryPort datasets;
    private final ContentStorePort contentStore;
    private final PermissionMatrix permissions;
    private final VersionChainManager chains;
    private final HashVerifier hashVerifier;
    private final MetadataValidator validator;
    private final DatasetLockManager locks;
    private final Clock clock;

    /**
     * Starts an upload that does not replace an earlier version.
     *
     * @see #beginUpload(Principal, DatasetMetadata, DatasetId)
     */
    public DatasetId beginUpload(Principal requester, DatasetMetadata metadata) {
        return beginUpload(requester, metadata, null);
    }

    /**
     * Validates the metadata and creates a new, incomplete dataset owned by the requester. The
     * container's own identifier is used when it declares one. When a predecessor is given the
     * requester needs write access to it, and the dataset and its chain link are created together
     * or not at all.
     *
     * @param predecessorId the version this upload supersedes, or null
     * @return the identifier of the new dataset
     * @throws ValidationException if the metadata is invalid, the requester is not a user, or the
     *     declared identifier is already registered
     * @throws ChainConflictException if the predecessor is unknown or already replaced
     * @throws ForbiddenException if the requester may not write the predecessor
     */
    public DatasetId beginUpload(Principal requester, DatasetMetadata metadata, DatasetId predecessorId) {
        if (!requester.isUser()) {
            throw new ValidationException("Uploads must be started by a user, not " + requester);
        }
        DatasetMetadata validated = validator.validate(metadata);
        DatasetId id = validated.getContainerId() != null ? validated.getContainerId() : DatasetId.random();

        if (predecessorId == null) {
            return locks.withLock(id, () -> create(requester, validated, id, null));
        }
        return locks.withLocks(id, predecessorId, () -> {
            if (!datasets.exists(predecessorId)) {
                throw new ChainConflictException("Predecessor " + predecessorId + " does not exist");
            }
            requireAccess(predecessorId, requester, Operation.WRITE, "replace");
            return create(requester, validated, id, predecessorId);
        });
    }

    private DatasetId create(Principal requester, DatasetMetadata metadata, DatasetId id, DatasetId predecessorId) {
        if (datasets.exists(id)) {
            throw new ValidationException("Dataset " + id + " is already registered");
        }
        if (predecessorId != null) {
            chains.checkLinkable(id, predecessorId);
        }
        Dataset started = Dataset.started(id, metadata, requester.name(), predecessorId, clock.instant());
        StorageCalls.run("store dataset " + id, () -> datasets.save(started));
        if (predecessorId != null) {
            try {
                chains.link(id, predecessorId);
            } catch (RuntimeException e) {
                discard(id, e);
                throw e;
            }
        }
        log.info("{} started upload of dataset {} '{}'{}", requester, id, metadata.getTitle(),
                 predecessorId == null ? "" : " replacing " + predecessorId);
        return id;
    }

    // a version link never points at a dataset that was not stored
    private void discard(DatasetId id, RuntimeException cause) {
        try {
            StorageCalls.run("discard dataset " + id, () -> datasets.delete(id));
            log.info("Discarded dataset {} after its version link failed", id);
        } catch (RuntimeException e) {
            cause.addSuppressed(e);
            log.error("Dataset {} could not be discarded and stays incomplete without a version link", id, e);
        }
    }

    /**
     * Appends a manifest entry whose bytes are already in the content store.
     *
     * @return the updated snapshot
     * @throws ImmutableDatasetException if the dataset is complete or invalidated, whoever asks
     * @throws ForbiddenException if the requester may not write the dataset
     * @throws IntegrityException if the reference has no stored content or its size differs from
     *     the declared size
     * @throws ValidationException if the manifest already has a file of that name
     */
    public Dataset appendFile(DatasetId datasetId, Principal requester, FileEntry entry) {
        return locks.withLock(datasetId, () -> {
            Dataset dataset = require(datasetId);
            dataset.requireMutable("append file " + entry.name());
            requireAccess(datasetId, requester, Operation.WRITE, "append to");

            boolean present = StorageCalls.call("look up content " + entry.reference(),
                () -> contentStore.exists(entry.reference()));
            if (!present) {
                throw new IntegrityException(datasetId, entry.name(),
                    "stored content " + entry.reference(), "no content");
            }
            long stored = StorageCalls.call("stat content " + entry.reference(),
                () -> contentStore.size(entry.reference()));
            if (stored != entry.size()) {
                throw new IntegrityException(datasetId, entry.name(),
                    entry.size() + " bytes", stored + " bytes");
            }

            Dataset updated = dataset.withFile(entry);
            StorageCalls.run("store dataset " + datasetId, () -> datasets.save(updated));
            log.debug("Appended '{}' ({} bytes) to dataset {}", entry.name(), entry.size(), datasetId);
            return updated;
        });
    }

    /**
     * Stores the bytes in the content store and appends them as a new manifest entry.
     *
     * @param preview optional inline preview, not hashed
     * @see #appendFile(DatasetId, Principal, FileEntry)
     */
    public Dataset uploadFile(DatasetId datasetId, Principal requester, String name, byte[] bytes, String preview) {
        Dataset dataset = require(datasetId);
        dataset.requireMutable("append file " + name);
        requireAccess(datasetId, requester, Operation.WRITE, "append to");

        ContentReference reference = StorageCalls.call("store content of '" + name + "'",
            () -> contentStore.put(bytes));
        return appendFile(datasetId, requester, new FileEntry(name, bytes.length, reference, preview));
    }

    /**
     * Verifies the payload against the claimed digest and, on a match, marks the dataset
     * complete. On a mismatch the dataset stays incomplete and the call may be retried.
     *
     * @return the completed snapshot
     * @throws IntegrityException if a file or the aggregate digest does not match
     */
    public Dataset completeUpload(DatasetId datasetId, Principal requester, String claimedHash) {
        if (claimedHash == null || claimedHash.isBlank()) {
            throw new ValidationException("A payload hash is required to complete dataset " + datasetId);
        }
        return locks.withLock(datasetId, () -> {
            Dataset dataset = require(datasetId);
            dataset.requireMutable("complete upload");
            requireAccess(datasetId, requester, Operation.WRITE, "complete");

            HashVerifier.Verification verification = hashVerifier.verify(dataset.getContent(), claimedHash);
            if (!verification.match()) {
                log.warn("Refusing to complete dataset {}: {} expected {}, computed {}", datasetId,
                         verification.fileName() == null ? "payload" : verification.fileName(),
                         verification.expected(), verification.computed());
                throw new IntegrityException(datasetId, verification.fileName(),
                    verification.expected(), verification.computed());
            }

            Dataset completed = dataset.completed(verification.computed(), clock.instant());
            StorageCalls.run("store dataset " + datasetId, () -> datasets.save(completed));
            log.info("Dataset {} complete: {} files, {} bytes, {} {}", datasetId,
                     completed.getContent().size(), completed.getSize(),
                     hashVerifier.getAlgorithm(), completed.getHash());
            return completed;
        });
    }

    /**
     * Finds an upload the requester started and may still continue: the dataset exists, is
     * neither complete nor invalidated, and is owned by the requester.
     *
     * @return the current snapshot, or empty when there is nothing to resume
     */
    public Optional<Dataset> findResumable(DatasetId datasetId, Principal requester) {
        return datasets.findById(datasetId)
            .filter(dataset -> requester.isUser() && dataset.getOwner().equals(requester.name()))
            .filter(dataset -> !dataset.isComplete() && !dataset.isInvalidated());
    }

    /**
     * Returns a dataset, including invalidated ones, to a requester with read access.
     *
     * @throws NotFoundException if the dataset is unknown
     * @throws ForbiddenException if the requester may not read it
     */
    public Dataset read(DatasetId datasetId, Principal requester) {
        Dataset dataset = require(datasetId);
        requireAccess(datasetId, requester, Operation.READ, "read");
        return dataset;
    }

    /**
     * Marks a dataset invalidated. Invalidating twice is a no-op.
     *
     * @return the invalidated snapshot
     */
    public Dataset invalidate(DatasetId datasetId, Principal requester) {
        return locks.withLock(datasetId, () -> {
            Dataset dataset = require(datasetId);
            requireAccess(datasetId, requester, Operation.WRITE, "invalidate");
            if (dataset.isInvalidated()) {
                log.debug("Dataset {} already invalidated", datasetId);
                return dataset;
            }
            Dataset invalidated = dataset.invalidated();
            StorageCalls.run("store dataset " + datasetId, () -> datasets.save(invalidated));
            log.info("{} invalidated dataset {}", requester, datasetId);
            return invalidated;
        });
    }

    /**
     * Lists the datasets the requester can read, excluding invalidated ones, most recent upload
     * first. The listing is evaluated lazily and every iteration starts over from the current
     * state.
     */
    public DatasetListing listVisible(Principal requester) {
        return new DatasetListing(requester);
    }

    /**
     * Applies permission changes atomically. Only the owner may manage permissions.
     *
     * @return the resulting access list
     * @throws ForbiddenException if the requester is not the owner
     * @throws ImmutableDatasetException if the dataset is invalidated
     * @throws NotFoundException if the dataset or a grantee is unknown
     */
    public AccessList updatePermissions(DatasetId datasetId, Principal requester,
                                        Collection<Grant> grants, Collection<Grant> revokes) {
        return locks.withLock(datasetId, () -> {
            Dataset dataset = require(datasetId);
            if (!requester.isUser() || !dataset.getOwner().equals(requester.name())) {
                log.warn("{} denied permission management of dataset {}", requester, datasetId);
                throw new ForbiddenException(datasetId, requester, "manage permissions of");
            }
            if (dataset.isInvalidated()) {
                throw new ImmutableDatasetException(datasetId, "cannot change permissions: dataset is invalidated");
            }
            permissions.apply(datasetId, grants, revokes);
            return permissions.list(datasetId);
        });
    }

    /**
     * Returns the explicit grants of a dataset to a requester with read access.
     */
    public AccessList permissionsOf(DatasetId datasetId, Principal requester) {
        read(datasetId, requester);
        return permissions.list(datasetId);
    }

    /**
     * Returns the version chain containing a dataset, oldest first.
     */
    public List<DatasetId> chainOf(DatasetId datasetId, Principal requester) {
        read(datasetId, requester);
        return chains.chainOf(datasetId);
    }

    /**
     * Recomputes the payload digest of a completed dataset and compares it with the recorded hash,
     * detecting corruption or tampering in the content store.
     *
     * @throws ValidationException if the dataset is not complete
     */
    public VerificationReport verify(DatasetId datasetId, Principal requester) {
        Dataset dataset = read(datasetId, requester);
        if (!dataset.isComplete()) {
            throw new ValidationException("Dataset " + datasetId + " is not complete");
        }
        String computed = hashVerifier.digest(dataset.getContent());
        VerificationReport report = new VerificationReport(datasetId, dataset.getHash(), computed, clock.instant());
        if (report.intact()) {
            log.debug("Dataset {} verified intact", datasetId);
        } else {
            log.warn("Dataset {} failed verification: recorded {}, computed {}", datasetId, dataset.getHash(), computed);
        }
        return report;
    }

    private Dataset require(DatasetId datasetId) {
        return datasets.findById(datasetId).orElseThrow(() -> NotFoundException.dataset(datasetId));
    }

    private void requireAccess(DatasetId datasetId, Principal requester, Operation operation, String action) {
        if (!permissions.check(datasetId, requester, operation)) {
            log.warn("{} denied {} access to dataset {}", requester, operation, datasetId);
            throw new ForbiddenException(datasetId, requester, action);
        }
    }

    /**
     * Lazy, restartable view of the datasets visible to one requester.
     */
    @RequiredArgsConstructor
    public final class DatasetListing implements Iterable<Dataset> {

        private final Principal requester;

        public Stream<Dataset> stream() {
            return datasets.findAll().stream()
                .sorted(MOST_RECENT_FIRST)
                .filter(dataset -> !dataset.isInvalidated())
                .filter(dataset -> permissions.check(dataset.getId(), requester, Operation.READ));
        }

        @Override
        public Iterator<Dataset> iterator() {
            return stream().iterator();
        }

        public List<Dataset> toList() {
            return stream().toList();
        }
    }
}
