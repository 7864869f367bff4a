package com.streamfirst.scidata.registry.domain;

import lombok.NonNull;

import java.time.Instant;

/**
 * Outcome of recomputing a completed dataset's payload digest against its recorded hash.
 */
public record VerificationReport(
    @NonNull DatasetId datasetId,
    @NonNull String expected,
    @NonNull String computed,
    @NonNull Instant verifiedAt
) {
    public boolean intact() {
        return expected.equalsIgnoreCase(computed);
    }
}
