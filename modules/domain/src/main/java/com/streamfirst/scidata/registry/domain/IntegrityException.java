package com.streamfirst.scidata.registry.domain;

import lombok.Getter;

import java.util.Optional;

/**
 * Raised when stored content does not match what was declared. Carries enough detail for an
 * operator: the offending file entry (null when the aggregate digest is at fault) and the expected
 * and computed values. The dataset stays incomplete, so the upload can be retried.
 */
@Getter
public class IntegrityException extends RegistryException {

    private final DatasetId datasetId;
    private final String fileName;
    private final String expected;
    private final String computed;

    public IntegrityException(DatasetId datasetId, String fileName, String expected, String computed) {
        super(ErrorKind.INTEGRITY, describe(datasetId, fileName, expected, computed));
        this.datasetId = datasetId;
        this.fileName = fileName;
        this.expected = expected;
        this.computed = computed;
    }

    public Optional<String> file() {
        return Optional.ofNullable(fileName);
    }

    private static String describe(DatasetId datasetId, String fileName, String expected, String computed) {
        String subject = fileName == null ? "payload digest" : "file '" + fileName + "'";
        return "Integrity check failed for " + subject + " of dataset " + datasetId
            + ": expected " + expected + " but computed " + computed;
    }
}
