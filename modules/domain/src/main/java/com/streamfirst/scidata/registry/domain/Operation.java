package com.streamfirst.scidata.registry.domain;

/**
 * Operations governed by the permission matrix. Read and write are independent grants; holding
 * {@link #WRITE} does not imply {@link #READ}.
 */
public enum Operation {
    READ,
    WRITE
}
