package com.streamfirst.scidata.registry.domain;

import lombok.NonNull;

import java.util.Collection;
import java.util.Set;
import java.util.TreeSet;

/**
 * Display/audit view of the explicit grants held on a dataset, split by operation and by
 * principal kind. The implicit owner grant is reported separately.
 */
public record AccessList(
    @NonNull DatasetId datasetId,
    @NonNull String owner,
    @NonNull Grantees read,
    @NonNull Grantees write
) {

    /**
     * Users and groups holding one operation.
     */
    public record Grantees(@NonNull Set<String> users, @NonNull Set<String> groups) {
        public Grantees {
            users = Set.copyOf(users);
            groups = Set.copyOf(groups);
        }

        public boolean isEmpty() {
            return users.isEmpty() && groups.isEmpty();
        }
    }

    /**
     * Builds the view from the stored entries of one dataset.
     */
    public static AccessList from(DatasetId datasetId, String owner, Collection<PermissionEntry> entries) {
        return new AccessList(datasetId, owner,
            grantees(entries, Operation.READ), grantees(entries, Operation.WRITE));
    }

    private static Grantees grantees(Collection<PermissionEntry> entries, Operation operation) {
        Set<String> users = new TreeSet<>();
        Set<String> groups = new TreeSet<>();
        for (PermissionEntry entry : entries) {
            if (entry.operation() != operation) {
                continue;
            }
            if (entry.principal().isUser()) {
                users.add(entry.principal().name());
            } else {
                groups.add(entry.principal().name());
            }
        }
        return new Grantees(users, groups);
    }
}
