package com.streamfirst.scidata.registry.boot;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * Externalized settings of the registry.
 *
 * @param stateDirectory directory of the JSON state file; blank keeps state in memory
 * @param contentDirectory root of the file-system content store; blank keeps content in memory
 * @param digestAlgorithm message digest algorithm for payload hashes
 * @param groups static group membership, group name to member user names
 * @param users user names known besides the group members
 * @param restrictUsers true to accept only {@code users} and group members as grantees; by
 *     default any user name is accepted
 */
@ConfigurationProperties(prefix = "scidata.registry")
public record RegistryProperties(
    String stateDirectory,
    String contentDirectory,
    @DefaultValue("SHA-256") String digestAlgorithm,
    Map<String, List<String>> groups,
    List<String> users,
    @DefaultValue("false") boolean restrictUsers
) {
    public RegistryProperties {
        groups = groups == null ? Map.of() : Map.copyOf(groups);
        users = users == null ? List.of() : List.copyOf(users);
    }

    public boolean persistentState() {
        return stateDirectory != null && !stateDirectory.isBlank();
    }

    public boolean persistentContent() {
        return contentDirectory != null && !contentDirectory.isBlank();
    }

    public Path stateDirectoryPath() {
        return Path.of(stateDirectory);
    }

    public Path contentDirectoryPath() {
        return Path.of(contentDirectory);
    }
}
