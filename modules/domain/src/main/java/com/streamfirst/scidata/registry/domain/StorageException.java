package com.streamfirst.scidata.registry.domain;

/**
 * Raised when the content store or a state repository fails. Not retryable within the
 * operation; the caller may re-issue the whole operation.
 */
public class StorageException extends RegistryException {

    public StorageException(String message, Throwable cause) {
        super(ErrorKind.STORAGE, message, cause);
    }

    public StorageException(String message) {
        super(ErrorKind.STORAGE, message);
    }
}
