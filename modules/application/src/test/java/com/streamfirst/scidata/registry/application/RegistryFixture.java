package com.streamfirst.scidata.registry.application;

import com.streamfirst.scidata.registry.adapters.InMemoryContentStoreAdapter;
import com.streamfirst.scidata.registry.adapters.InMemoryDatasetRepositoryAdapter;
import com.streamfirst.scidata.registry.adapters.InMemoryPermissionRepositoryAdapter;
import com.streamfirst.scidata.registry.adapters.InMemoryPrincipalDirectoryAdapter;
import com.streamfirst.scidata.registry.adapters.InMemoryVersionLinkRepositoryAdapter;
import com.streamfirst.scidata.registry.domain.ContainerType;
import com.streamfirst.scidata.registry.domain.DatasetMetadata;
import com.streamfirst.scidata.registry.domain.Principal;

import java.time.Instant;

/**
 * A registry wired to in-memory adapters, plus the principals most tests need.
 */
class RegistryFixture {

    static final Principal UPLOADER = Principal.user("uploader");
    static final Principal VIEWER = Principal.user("viewer");
    static final Principal STRANGER = Principal.user("stranger");
    static final Principal LAB = Principal.group("lab");

    final InMemoryDatasetRepositoryAdapter datasets;
    final InMemoryPermissionRepositoryAdapter permissionEntries = new InMemoryPermissionRepositoryAdapter();
    final InMemoryVersionLinkRepositoryAdapter links;
    final InMemoryContentStoreAdapter contentStore;
    final InMemoryPrincipalDirectoryAdapter directory = new InMemoryPrincipalDirectoryAdapter();

    final HashVerifier hashVerifier;
    final PermissionMatrix permissions;
    final VersionChainManager chains;
    final DatasetLockManager locks = new DatasetLockManager();
    final DatasetRegistry registry;

    RegistryFixture() {
        this(new InMemoryDatasetRepositoryAdapter(), new InMemoryVersionLinkRepositoryAdapter(),
             new InMemoryContentStoreAdapter());
    }

    RegistryFixture(InMemoryDatasetRepositoryAdapter datasets, InMemoryVersionLinkRepositoryAdapter links,
                    InMemoryContentStoreAdapter contentStore) {
        this.datasets = datasets;
        this.links = links;
        this.contentStore = contentStore;
        this.hashVerifier = new HashVerifier(contentStore);
        this.permissions = new PermissionMatrix(permissionEntries, datasets, directory);
        this.chains = new VersionChainManager(links, datasets);
        this.registry = new DatasetRegistry(datasets, contentStore, permissions, chains, hashVerifier,
            new MetadataValidator(), locks, new TickingClock(Instant.parse("2024-03-01T10:00:00Z")));

        directory.registerUser(UPLOADER.name());
        directory.registerUser(VIEWER.name());
        directory.registerUser(STRANGER.name());
        directory.addMember(LAB.name(), VIEWER.name());
    }

    static DatasetMetadata metadata(String title) {
        return DatasetMetadata.builder()
            .title(title)
            .author("Ada Author")
            .email("ada@example.org")
            .modelVersion("0.5.1")
            .containerType(new ContainerType("camera-frame", "1.0", null))
            .build();
    }
}
