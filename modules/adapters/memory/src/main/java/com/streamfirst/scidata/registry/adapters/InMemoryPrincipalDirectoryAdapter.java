package com.streamfirst.scidata.registry.adapters;

import com.streamfirst.scidata.registry.ports.PrincipalDirectoryPort;
import lombok.extern.slf4j.Slf4j;

import java.util.Collection;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory implementation of PrincipalDirectoryPort.
 * Users and groups are registered programmatically or from static configuration. A directory
 * that accepts any user treats every user name as known; groups must still be registered.
 */
@Slf4j
public class InMemoryPrincipalDirectoryAdapter implements PrincipalDirectoryPort {

    private final Set<String> users = ConcurrentHashMap.newKeySet();

    private volatile boolean acceptAnyUser;

    // group name -> member user names
    private final Map<String, Set<String>> members = new ConcurrentHashMap<>();

    /**
     * Creates a directory pre-populated from a group to members mapping.
     * Every member is registered as a user as well.
     */
    public static InMemoryPrincipalDirectoryAdapter fromGroups(Map<String, ? extends Collection<String>> groups) {
        InMemoryPrincipalDirectoryAdapter directory = new InMemoryPrincipalDirectoryAdapter();
        groups.forEach((group, users) -> {
            directory.registerGroup(group);
            users.forEach(user -> directory.addMember(group, user));
        });
        return directory;
    }

    /**
     * @param acceptAnyUser true to treat every user name as known, false to accept only
     *     registered users and group members
     */
    public void setAcceptAnyUser(boolean acceptAnyUser) {
        this.acceptAnyUser = acceptAnyUser;
        log.debug("Directory accepts {}", acceptAnyUser ? "any user" : "registered users only");
    }

    public void registerUser(String user) {
        if (users.add(user)) {
            log.debug("Registered user {}", user);
        }
    }

    public void registerGroup(String group) {
        if (members.putIfAbsent(group, ConcurrentHashMap.newKeySet()) == null) {
            log.debug("Registered group {}", group);
        }
    }

    /**
     * Adds a user to a group, registering both if needed.
     */
    public void addMember(String group, String user) {
        registerUser(user);
        registerGroup(group);
        members.get(group).add(user);
        log.debug("Added user {} to group {}", user, group);
    }

    public void removeMember(String group, String user) {
        Set<String> groupMembers = members.get(group);
        if (groupMembers != null && groupMembers.remove(user)) {
            log.debug("Removed user {} from group {}", user, group);
        }
    }

    @Override
    public Set<String> groupsOf(String user) {
        Set<String> groups = new HashSet<>();
        members.forEach((group, groupMembers) -> {
            if (groupMembers.contains(user)) {
                groups.add(group);
            }
        });
        return groups;
    }

    @Override
    public boolean userExists(String user) {
        return acceptAnyUser || users.contains(user);
    }

    @Override
    public boolean groupExists(String group) {
        return members.containsKey(group);
    }
}
