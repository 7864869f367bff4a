package com.streamfirst.scidata.registry.domain;

import lombok.Getter;
import lombok.NonNull;

/**
 * Base of all typed registry failures. The registry never retries internally; callers decide
 * whether to re-issue an operation.
 */
@Getter
public abstract class RegistryException extends RuntimeException {

    private final ErrorKind kind;

    protected RegistryException(@NonNull ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    protected RegistryException(@NonNull ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }
}
