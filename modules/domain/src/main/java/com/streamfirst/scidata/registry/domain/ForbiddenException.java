package com.streamfirst.scidata.registry.domain;

import lombok.Getter;

/**
 * Raised when the requester lacks the permission an operation needs.
 */
@Getter
public class ForbiddenException extends RegistryException {

    private final DatasetId datasetId;
    private final Principal requester;

    public ForbiddenException(DatasetId datasetId, Principal requester, String action) {
        super(ErrorKind.FORBIDDEN, requester + " is not allowed to " + action + " dataset " + datasetId);
        this.datasetId = datasetId;
        this.requester = requester;
    }
}
