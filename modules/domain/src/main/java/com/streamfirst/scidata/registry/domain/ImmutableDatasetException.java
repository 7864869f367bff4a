package com.streamfirst.scidata.registry.domain;

import lombok.Getter;

/**
 * Raised when a mutation targets a dataset that is complete or invalidated.
 */
@Getter
public class ImmutableDatasetException extends RegistryException {

    private final DatasetId datasetId;

    public ImmutableDatasetException(DatasetId datasetId, String message) {
        super(ErrorKind.IMMUTABLE, "Dataset " + datasetId + ": " + message);
        this.datasetId = datasetId;
    }
}
