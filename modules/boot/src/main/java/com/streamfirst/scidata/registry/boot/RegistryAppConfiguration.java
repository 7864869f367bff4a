package com.streamfirst.scidata.registry.boot;

import com.streamfirst.scidata.registry.adapters.InMemoryContentStoreAdapter;
import com.streamfirst.scidata.registry.adapters.InMemoryPrincipalDirectoryAdapter;
import com.streamfirst.scidata.registry.adapters.container.zip.ZipContainerReader;
import com.streamfirst.scidata.registry.adapters.content.fs.FileSystemContentStoreAdapter;
import com.streamfirst.scidata.registry.application.ContainerImporter;
import com.streamfirst.scidata.registry.application.DatasetLockManager;
import com.streamfirst.scidata.registry.application.DatasetRegistry;
import com.streamfirst.scidata.registry.application.HashVerifier;
import com.streamfirst.scidata.registry.application.MetadataValidator;
import com.streamfirst.scidata.registry.application.PermissionMatrix;
import com.streamfirst.scidata.registry.application.VersionChainManager;
import com.streamfirst.scidata.registry.ports.ContainerReaderPort;
import com.streamfirst.scidata.registry.ports.ContentStorePort;
import com.streamfirst.scidata.registry.ports.DatasetRepositoryPort;
import com.streamfirst.scidata.registry.ports.PermissionRepositoryPort;
import com.streamfirst.scidata.registry.ports.PrincipalDirectoryPort;
import com.streamfirst.scidata.registry.ports.VersionLinkRepositoryPort;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Wires the registry core to its adapters. Persistent adapters are chosen when the corresponding
 * directory is configured, in-memory ones otherwise.
 */
@Slf4j
@Configuration
@EnableConfigurationProperties(RegistryProperties.class)
public class RegistryAppConfiguration {

    // --- Adapter Beans ---

    @Bean
    StateRepositories stateRepositories(RegistryProperties properties) {
        if (properties.persistentState()) {
            return StateRepositories.stateFile(properties.stateDirectoryPath());
        }
        log.warn("No state directory configured; registry state will not survive a restart");
        return StateRepositories.inMemory();
    }

    @Bean
    public DatasetRepositoryPort datasetRepository(StateRepositories state) {
        return state.datasets();
    }

    @Bean
    public PermissionRepositoryPort permissionRepository(StateRepositories state) {
        return state.permissions();
    }

    @Bean
    public VersionLinkRepositoryPort versionLinkRepository(StateRepositories state) {
        return state.links();
    }

    @Bean
    public ContentStorePort contentStore(RegistryProperties properties) {
        if (properties.persistentContent()) {
            return new FileSystemContentStoreAdapter(properties.contentDirectoryPath());
        }
        log.warn("No content directory configured; file content is kept in memory");
        return new InMemoryContentStoreAdapter();
    }

    @Bean
    public PrincipalDirectoryPort principalDirectory(RegistryProperties properties) {
        InMemoryPrincipalDirectoryAdapter directory = InMemoryPrincipalDirectoryAdapter.fromGroups(properties.groups());
        properties.users().forEach(directory::registerUser);
        directory.setAcceptAnyUser(!properties.restrictUsers());
        log.info("Principal directory: {} groups, {} listed users, {}", properties.groups().size(),
                 properties.users().size(), properties.restrictUsers() ? "restricted to known users" : "any user accepted");
        return directory;
    }

    @Bean
    public ContainerReaderPort containerReader() {
        return new ZipContainerReader();
    }

    // --- Application Service Beans ---

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public HashVerifier hashVerifier(ContentStorePort contentStore, RegistryProperties properties) {
        return new HashVerifier(contentStore, properties.digestAlgorithm());
    }

    @Bean
    public PermissionMatrix permissionMatrix(PermissionRepositoryPort permissions,
                                             DatasetRepositoryPort datasets,
                                             PrincipalDirectoryPort directory) {
        return new PermissionMatrix(permissions, datasets, directory);
    }

    @Bean
    public VersionChainManager versionChainManager(VersionLinkRepositoryPort links, DatasetRepositoryPort datasets) {
        return new VersionChainManager(links, datasets);
    }

    @Bean
    public DatasetRegistry datasetRegistry(DatasetRepositoryPort datasets,
                                           ContentStorePort contentStore,
                                           PermissionMatrix permissionMatrix,
                                           VersionChainManager versionChainManager,
                                           HashVerifier hashVerifier,
                                           Clock clock) {
        return new DatasetRegistry(datasets, contentStore, permissionMatrix, versionChainManager,
            hashVerifier, new MetadataValidator(), new DatasetLockManager(), clock);
    }

    @Bean
    public ContainerImporter containerImporter(ContainerReaderPort containerReader,
                                               DatasetRegistry datasetRegistry,
                                               HashVerifier hashVerifier) {
        return new ContainerImporter(containerReader, datasetRegistry, hashVerifier);
    }

    // --- Startup summary ---

    @Bean
    public CommandLineRunner startupSummary(StateRepositories state, DatasetRepositoryPort datasets,
                                            HashVerifier hashVerifier) {
        return args -> log.info("Registry ready: state {}, {} datasets, payload digest {}",
                                state.description(), datasets.findAll().size(), hashVerifier.getAlgorithm());
    }
}
