package com.streamfirst.scidata.registry.application;

import com.streamfirst.scidata.registry.domain.AccessList;
import com.streamfirst.scidata.registry.domain.Dataset;
import com.streamfirst.scidata.registry.domain.DatasetId;
import com.streamfirst.scidata.registry.domain.Grant;
import com.streamfirst.scidata.registry.domain.NotFoundException;
import com.streamfirst.scidata.registry.domain.Operation;
import com.streamfirst.scidata.registry.domain.PermissionEntry;
import com.streamfirst.scidata.registry.domain.Principal;
import com.streamfirst.scidata.registry.domain.ValidationException;
import com.streamfirst.scidata.registry.ports.DatasetRepositoryPort;
import com.streamfirst.scidata.registry.ports.PermissionRepositoryPort;
import com.streamfirst.scidata.registry.ports.PrincipalDirectoryPort;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.Collection;
import java.util.HashSet;
import java.util.Optional;
import java.util.Set;

/**
 * Per-dataset, per-principal, per-operation access matrix.
 *
 * <p>A principal may perform an operation on a dataset if it is the dataset's owner (implicit and
 * not stored), holds the grant directly, or is a user belonging to a group that holds it. Read and
 * write are independent. Grants naming the owner are ignored since ownership already implies full
 * access.
 *
 * <p>Mutating methods read-modify-write one dataset's entry set; callers must hold that dataset's
 * lock.
 */
@Slf4j
@RequiredArgsConstructor
public class PermissionMatrix {

    private final PermissionRepositoryPort permissions;
    private final DatasetRepositoryPort datasets;
    private final PrincipalDirectoryPort directory;

    /**
     * Grants an operation. Idempotent.
     *
     * @return true if a new entry was stored
     * @throws NotFoundException if the dataset is unknown
     */
    public boolean grant(DatasetId datasetId, Principal principal, Operation operation) {
        return apply(datasetId, Set.of(new Grant(principal, operation)), Set.of());
    }

    /**
     * Revokes an operation. Revoking a grant that does not exist is a no-op.
     *
     * @return true if an entry was removed
     * @throws NotFoundException if the dataset is unknown
     */
    public boolean revoke(DatasetId datasetId, Principal principal, Operation operation) {
        return apply(datasetId, Set.of(), Set.of(new Grant(principal, operation)));
    }

    /**
     * Applies a batch of grants and revokes as one atomic replacement of the dataset's entries.
     * Every grantee must be known to the principal directory; nothing is stored if one is not.
     *
     * @return true if the stored entry set changed
     * @throws NotFoundException if the dataset or a grantee is unknown
     * @throws ValidationException if the same grant is both granted and revoked
     */
    public boolean apply(DatasetId datasetId, Collection<Grant> grants, Collection<Grant> revokes) {
        String owner = ownerOf(datasetId);
        for (Grant grant : grants) {
            if (revokes.contains(grant)) {
                throw new ValidationException(
                    "Grant " + grant + " is both granted and revoked on dataset " + datasetId);
            }
            requireKnown(grant.principal());
        }

        Set<PermissionEntry> current = permissions.entriesFor(datasetId);
        Set<PermissionEntry> updated = new HashSet<>(current);
        for (Grant grant : grants) {
            if (isOwner(owner, grant.principal())) {
                log.debug("Ignoring explicit grant of {} to owner of dataset {}", grant.operation(), datasetId);
                continue;
            }
            updated.add(PermissionEntry.of(datasetId, grant));
        }
        for (Grant revoke : revokes) {
            updated.remove(PermissionEntry.of(datasetId, revoke));
        }

        if (updated.equals(current)) {
            log.debug("Permissions of dataset {} unchanged", datasetId);
            return false;
        }
        StorageCalls.run("store permissions of dataset " + datasetId,
            () -> permissions.replaceEntries(datasetId, updated));
        log.info("Permissions of dataset {} updated: {} grants, {} revokes requested, {} entries stored",
                 datasetId, grants.size(), revokes.size(), updated.size());
        return true;
    }

    /**
     * Decides whether a principal may perform an operation. Unknown datasets deny everything.
     */
    public boolean check(DatasetId datasetId, Principal principal, Operation operation) {
        Optional<Dataset> dataset = datasets.findById(datasetId);
        if (dataset.isEmpty()) {
            return false;
        }
        if (isOwner(dataset.get().getOwner(), principal)) {
            return true;
        }

        Set<PermissionEntry> entries = permissions.entriesFor(datasetId);
        if (entries.contains(new PermissionEntry(datasetId, principal, operation))) {
            return true;
        }
        if (!principal.isUser()) {
            return false;
        }
        boolean anyGroupGrant = entries.stream()
            .anyMatch(e -> e.operation() == operation && e.principal().isGroup());
        if (!anyGroupGrant) {
            return false;
        }
        for (String group : directory.groupsOf(principal.name())) {
            if (entries.contains(new PermissionEntry(datasetId, Principal.group(group), operation))) {
                log.debug("{} holds {} on dataset {} through group {}", principal, operation, datasetId, group);
                return true;
            }
        }
        return false;
    }

    /**
     * Lists the explicit grants of a dataset for display or audit.
     *
     * @throws NotFoundException if the dataset is unknown
     */
    public AccessList list(DatasetId datasetId) {
        String owner = ownerOf(datasetId);
        return AccessList.from(datasetId, owner, permissions.entriesFor(datasetId));
    }

    private String ownerOf(DatasetId datasetId) {
        return datasets.findById(datasetId)
            .map(Dataset::getOwner)
            .orElseThrow(() -> NotFoundException.dataset(datasetId));
    }

    private void requireKnown(Principal principal) {
        boolean known = principal.isUser()
            ? directory.userExists(principal.name())
            : directory.groupExists(principal.name());
        if (!known) {
            throw NotFoundException.principal(principal);
        }
    }

    private static boolean isOwner(String owner, Principal principal) {
        return principal.isUser() && principal.name().equals(owner);
    }
}
