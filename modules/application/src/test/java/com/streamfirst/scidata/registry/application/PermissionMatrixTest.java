package com.streamfirst.scidata.registry.application;

import com.streamfirst.scidata.registry.domain.AccessList;
import com.streamfirst.scidata.registry.domain.DatasetId;
import com.streamfirst.scidata.registry.domain.Grant;
import com.streamfirst.scidata.registry.domain.NotFoundException;
import com.streamfirst.scidata.registry.domain.Operation;
import com.streamfirst.scidata.registry.domain.Principal;
import com.streamfirst.scidata.registry.domain.ValidationException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static com.streamfirst.scidata.registry.application.RegistryFixture.LAB;
import static com.streamfirst.scidata.registry.application.RegistryFixture.STRANGER;
import static com.streamfirst.scidata.registry.application.RegistryFixture.UPLOADER;
import static com.streamfirst.scidata.registry.application.RegistryFixture.VIEWER;
import static com.streamfirst.scidata.registry.application.RegistryFixture.metadata;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PermissionMatrixTest {

    private RegistryFixture fixture;
    private PermissionMatrix matrix;
    private DatasetId id;

    @BeforeEach
    void setUp() {
        fixture = new RegistryFixture();
        matrix = fixture.permissions;
        id = fixture.registry.beginUpload(UPLOADER, metadata("frames"));
    }

    @Test
    void ownerAlwaysHoldsBothOperations() {
        assertThat(matrix.check(id, UPLOADER, Operation.READ)).isTrue();
        assertThat(matrix.check(id, UPLOADER, Operation.WRITE)).isTrue();
        assertThat(fixture.permissionEntries.entriesFor(id)).isEmpty();
    }

    @Test
    void grantingOwnerStoresNothing() {
        assertThat(matrix.grant(id, UPLOADER, Operation.READ)).isFalse();
        assertThat(fixture.permissionEntries.entriesFor(id)).isEmpty();
    }

    @Test
    void grantThenRevokeRestoresPreviousDecision() {
        assertThat(matrix.check(id, VIEWER, Operation.READ)).isFalse();

        assertThat(matrix.grant(id, VIEWER, Operation.READ)).isTrue();
        assertThat(matrix.check(id, VIEWER, Operation.READ)).isTrue();

        assertThat(matrix.revoke(id, VIEWER, Operation.READ)).isTrue();
        assertThat(matrix.check(id, VIEWER, Operation.READ)).isFalse();
    }

    @Test
    void grantAndRevokeAreIdempotent() {
        matrix.grant(id, VIEWER, Operation.WRITE);

        assertThat(matrix.grant(id, VIEWER, Operation.WRITE)).isFalse();
        assertThat(matrix.revoke(id, STRANGER, Operation.WRITE)).isFalse();
    }

    @Test
    void readAndWriteAreIndependent() {
        matrix.grant(id, VIEWER, Operation.WRITE);

        assertThat(matrix.check(id, VIEWER, Operation.WRITE)).isTrue();
        assertThat(matrix.check(id, VIEWER, Operation.READ)).isFalse();
    }

    @Test
    void groupGrantAppliesToMembersOnly() {
        matrix.grant(id, LAB, Operation.READ);

        assertThat(matrix.check(id, VIEWER, Operation.READ)).isTrue();
        assertThat(matrix.check(id, STRANGER, Operation.READ)).isFalse();
        assertThat(matrix.check(id, LAB, Operation.READ)).isTrue();
        assertThat(matrix.check(id, VIEWER, Operation.WRITE)).isFalse();
    }

    @Test
    void membershipIsEvaluatedAtCheckTime() {
        matrix.grant(id, LAB, Operation.READ);
        fixture.directory.addMember(LAB.name(), STRANGER.name());
        assertThat(matrix.check(id, STRANGER, Operation.READ)).isTrue();

        fixture.directory.removeMember(LAB.name(), STRANGER.name());
        assertThat(matrix.check(id, STRANGER, Operation.READ)).isFalse();
    }

    @Test
    void unknownDatasetDeniesEverything() {
        assertThat(matrix.check(DatasetId.random(), UPLOADER, Operation.READ)).isFalse();
        assertThatThrownBy(() -> matrix.grant(DatasetId.random(), VIEWER, Operation.READ))
            .isInstanceOf(NotFoundException.class);
    }

    @Test
    void unknownGranteeStoresNothing() {
        assertThatThrownBy(() -> matrix.apply(id,
                List.of(Grant.read(VIEWER), Grant.write(Principal.group("ghosts"))), List.of()))
            .isInstanceOf(NotFoundException.class)
            .hasMessageContaining("group:ghosts");

        assertThat(fixture.permissionEntries.entriesFor(id)).isEmpty();
    }

    @Test
    void sameGrantCannotBeGrantedAndRevoked() {
        assertThatThrownBy(() -> matrix.apply(id, Set.of(Grant.read(VIEWER)), Set.of(Grant.read(VIEWER))))
            .isInstanceOf(ValidationException.class);
    }

    @Test
    void listSplitsGranteesByOperationAndKind() {
        matrix.apply(id, List.of(Grant.read(VIEWER), Grant.read(LAB), Grant.write(STRANGER)), List.of());

        AccessList access = matrix.list(id);

        assertThat(access.owner()).isEqualTo(UPLOADER.name());
        assertThat(access.read().users()).containsExactly(VIEWER.name());
        assertThat(access.read().groups()).containsExactly(LAB.name());
        assertThat(access.write().users()).containsExactly(STRANGER.name());
        assertThat(access.write().groups()).isEmpty();
    }
}
