package com.streamfirst.scidata.registry.domain;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ContainerArchiveTest {

    private static DatasetMetadata metadata() {
        return DatasetMetadata.builder()
            .title("frames")
            .author("Ada Author")
            .email("ada@example.org")
            .modelVersion("0.5.1")
            .containerType(new ContainerType("camera-frame", "1.0", null))
            .build();
    }

    @Test
    void memberBytesAreCopiedInAndOut() {
        byte[] source = "0123".getBytes(StandardCharsets.UTF_8);
        ContainerArchive.Member member = new ContainerArchive.Member("a.bin", source, null);

        source[0] = 'x';
        member.bytes()[1] = 'y';

        assertThat(member.bytes()).isEqualTo("0123".getBytes(StandardCharsets.UTF_8));
    }

    @Test
    void membersCompareByContent() {
        ContainerArchive.Member one = new ContainerArchive.Member("a.bin", new byte[] {1, 2}, null);
        ContainerArchive.Member same = new ContainerArchive.Member("a.bin", new byte[] {1, 2}, null);
        ContainerArchive.Member other = new ContainerArchive.Member("a.bin", new byte[] {1, 3}, null);

        assertThat(one).isEqualTo(same).hasSameHashCodeAs(same).isNotEqualTo(other);
        assertThat(one).hasToString("Member[a.bin, 2 bytes]");
    }

    @Test
    void memberListIsFixedAtConstruction() {
        List<ContainerArchive.Member> members = new ArrayList<>();
        members.add(new ContainerArchive.Member("a.bin", new byte[] {1}, null));
        ContainerArchive archive = new ContainerArchive(metadata(), null, members);

        members.clear();

        assertThat(archive.members()).hasSize(1);
        assertThatThrownBy(() -> archive.members().clear()).isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void nullBytesAreRejected() {
        assertThatThrownBy(() -> new ContainerArchive.Member("a.bin", null, null))
            .isInstanceOf(NullPointerException.class);
    }
}
