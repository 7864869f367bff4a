package com.streamfirst.scidata.registry.domain;

import lombok.NonNull;

/**
 * A (principal, operation) pair, used when requesting permission changes on a dataset.
 */
public record Grant(@NonNull Principal principal, @NonNull Operation operation) {

    public static Grant read(Principal principal) {
        return new Grant(principal, Operation.READ);
    }

    public static Grant write(Principal principal) {
        return new Grant(principal, Operation.WRITE);
    }
}
