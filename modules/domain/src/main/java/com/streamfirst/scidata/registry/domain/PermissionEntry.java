package com.streamfirst.scidata.registry.domain;

import lombok.NonNull;

/**
 * A single stored grant of one operation on one dataset to one principal. Entries are unique per
 * (dataset, principal, operation), so granting twice stores one entry.
 */
public record PermissionEntry(
    @NonNull DatasetId datasetId,
    @NonNull Principal principal,
    @NonNull Operation operation
) {
    public static PermissionEntry of(DatasetId datasetId, Grant grant) {
        return new PermissionEntry(datasetId, grant.principal(), grant.operation());
    }
}
