package com.streamfirst.scidata.registry.domain;

/**
 * Raised when linking a new version would break the replacement chain: the predecessor is
 * unknown, already has a successor, or the link would close a cycle.
 */
public class ChainConflictException extends RegistryException {

    public ChainConflictException(String message) {
        super(ErrorKind.CHAIN_CONFLICT, message);
    }
}
