package com.streamfirst.scidata.registry.domain;

import java.util.Arrays;
import java.util.Objects;

/**
 * Dotted numeric version of the container data model (e.g. "0.3", "0.5.1"). Missing trailing
 * components compare as zero, so "0.5" equals "0.5.0".
 */
public record ModelVersion(int[] parts) implements Comparable<ModelVersion> {

    public static final ModelVersion MINIMUM_SUPPORTED = parse("0.3");

    public ModelVersion {
        Objects.requireNonNull(parts, "Version parts cannot be null");
        if (parts.length == 0) {
            throw new IllegalArgumentException("Version must have at least one component");
        }
        parts = parts.clone();
    }

    /**
     * @return a copy of the numeric components
     */
    @Override
    public int[] parts() {
        return parts.clone();
    }

    /**
     * @throws ValidationException if the text is not a dotted sequence of non-negative integers
     */
    public static ModelVersion parse(String text) {
        if (text == null || text.isBlank()) {
            throw new ValidationException("Model version is missing");
        }
        String[] tokens = text.trim().split("\\.");
        int[] parts = new int[tokens.length];
        for (int i = 0; i < tokens.length; i++) {
            try {
                parts[i] = Integer.parseInt(tokens[i]);
            } catch (NumberFormatException e) {
                throw new ValidationException("Malformed model version '" + text + "'", e);
            }
            if (parts[i] < 0) {
                throw new ValidationException("Malformed model version '" + text + "'");
            }
        }
        return new ModelVersion(parts);
    }

    public boolean isBefore(ModelVersion other) {
        return compareTo(other) < 0;
    }

    @Override
    public int compareTo(ModelVersion other) {
        int length = Math.max(parts.length, other.parts.length);
        for (int i = 0; i < length; i++) {
            int mine = i < parts.length ? parts[i] : 0;
            int theirs = i < other.parts.length ? other.parts[i] : 0;
            if (mine != theirs) {
                return Integer.compare(mine, theirs);
            }
        }
        return 0;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof ModelVersion other && compareTo(other) == 0;
    }

    @Override
    public int hashCode() {
        int end = parts.length;
        while (end > 1 && parts[end - 1] == 0) {
            end--;
        }
        return Arrays.hashCode(Arrays.copyOf(parts, end));
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < parts.length; i++) {
            if (i > 0) {
                sb.append('.');
            }
            sb.append(parts[i]);
        }
        return sb.toString();
    }
}
