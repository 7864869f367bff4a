package com.streamfirst.scidata.registry.domain;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class AccessListTest {

    @Test
    void groupsEntriesByOperationAndKind() {
        DatasetId id = DatasetId.of("d-1");
        List<PermissionEntry> entries = List.of(
            PermissionEntry.of(id, Grant.read(Principal.user("bob"))),
            PermissionEntry.of(id, Grant.read(Principal.user("amy"))),
            PermissionEntry.of(id, Grant.read(Principal.group("lab"))),
            PermissionEntry.of(id, Grant.write(Principal.group("lab"))));

        AccessList access = AccessList.from(id, "ada", entries);

        assertThat(access.read().users()).containsExactlyInAnyOrder("amy", "bob");
        assertThat(access.read().groups()).containsExactly("lab");
        assertThat(access.write().users()).isEmpty();
        assertThat(access.write().groups()).containsExactly("lab");
        assertThat(access.write().isEmpty()).isFalse();
    }

    @Test
    void noEntriesMeansOwnerOnly() {
        AccessList access = AccessList.from(DatasetId.of("d-1"), "ada", List.of());

        assertThat(access.owner()).isEqualTo("ada");
        assertThat(access.read().isEmpty()).isTrue();
        assertThat(access.write().isEmpty()).isTrue();
    }
}
