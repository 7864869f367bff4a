package com.streamfirst.scidata.registry.domain;

/**
 * Failure categories surfaced by the registry. A presentation layer may map several kinds onto
 * one response, e.g. report {@link #FORBIDDEN} as {@link #NOT_FOUND} to hide existence.
 */
public enum ErrorKind {
    /** Unknown dataset or principal */
    NOT_FOUND,
    /** Permission check failed */
    FORBIDDEN,
    /** Mutation of a completed or invalidated dataset */
    IMMUTABLE,
    /** Payload digest or stored size mismatch */
    INTEGRITY,
    /** Version-chain invariant violated */
    CHAIN_CONFLICT,
    /** Malformed or incomplete input */
    VALIDATION,
    /** A storage collaborator failed; the operation was not applied */
    STORAGE,
    /** The caller was interrupted before the operation was applied */
    CANCELLED
}
