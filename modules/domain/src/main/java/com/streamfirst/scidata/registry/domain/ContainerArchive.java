package com.streamfirst.scidata.registry.domain;

import lombok.NonNull;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * A packaged container after parsing: its declared metadata, the predecessor it claims to
 * replace, and the raw bytes of every member.
 */
public record ContainerArchive(
    @NonNull DatasetMetadata metadata,
    DatasetId replaces, // optional
    @NonNull List<Member> members
) {
    public ContainerArchive {
        members = List.copyOf(members);
    }

    /**
     * One member file of the container. JSON members keep their text as preview. The bytes are
     * copied in and out, and compared by content.
     */
    public record Member(@NonNull String name, @NonNull byte[] bytes, String preview) {

        public Member {
            bytes = bytes.clone();
        }

        @Override
        public byte[] bytes() {
            return bytes.clone();
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Member other
                && name.equals(other.name)
                && Arrays.equals(bytes, other.bytes)
                && Objects.equals(preview, other.preview);
        }

        @Override
        public int hashCode() {
            return Objects.hash(name, Arrays.hashCode(bytes), preview);
        }

        @Override
        public String toString() {
            return "Member[" + name + ", " + bytes.length + " bytes]";
        }
    }
}
