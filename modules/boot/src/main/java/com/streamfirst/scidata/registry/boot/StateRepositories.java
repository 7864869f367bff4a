package com.streamfirst.scidata.registry.boot;

import com.streamfirst.scidata.registry.adapters.InMemoryDatasetRepositoryAdapter;
import com.streamfirst.scidata.registry.adapters.InMemoryPermissionRepositoryAdapter;
import com.streamfirst.scidata.registry.adapters.InMemoryVersionLinkRepositoryAdapter;
import com.streamfirst.scidata.registry.adapters.state.file.JsonFileRegistryStore;
import com.streamfirst.scidata.registry.ports.DatasetRepositoryPort;
import com.streamfirst.scidata.registry.ports.PermissionRepositoryPort;
import com.streamfirst.scidata.registry.ports.VersionLinkRepositoryPort;

import java.nio.file.Path;

/**
 * The three state repositories, either all backed by one state file or all in memory.
 */
record StateRepositories(
    DatasetRepositoryPort datasets,
    PermissionRepositoryPort permissions,
    VersionLinkRepositoryPort links,
    String description
) {
    static StateRepositories inMemory() {
        return new StateRepositories(
            new InMemoryDatasetRepositoryAdapter(),
            new InMemoryPermissionRepositoryAdapter(),
            new InMemoryVersionLinkRepositoryAdapter(),
            "in-memory");
    }

    static StateRepositories stateFile(Path directory) {
        JsonFileRegistryStore store = JsonFileRegistryStore.open(directory);
        return new StateRepositories(store, store, store, store.getStateFile().toString());
    }
}
