package com.streamfirst.scidata.registry.domain;

import java.util.Objects;

/**
 * A user or a group that permissions can be granted to.
 *
 * @param kind whether the name refers to a user or a group
 * @param name the user or group name as known to the principal directory
 */
public record Principal(Kind kind, String name) {

    public enum Kind {
        USER,
        GROUP
    }

    public Principal {
        Objects.requireNonNull(kind, "Principal kind cannot be null");
        Objects.requireNonNull(name, "Principal name cannot be null");
        if (name.trim().isEmpty()) {
            throw new IllegalArgumentException("Principal name cannot be empty");
        }
    }

    public static Principal user(String name) {
        return new Principal(Kind.USER, name);
    }

    public static Principal group(String name) {
        return new Principal(Kind.GROUP, name);
    }

    public boolean isUser() {
        return kind == Kind.USER;
    }

    public boolean isGroup() {
        return kind == Kind.GROUP;
    }

    @Override
    public String toString() {
        return kind.name().toLowerCase() + ":" + name;
    }
}
