package com.streamfirst.scidata.registry.ports;

import java.util.Set;

/**
 * Port for the directory that knows users, groups and group membership.
 * Authentication happens before the registry is called; this port is only consulted for
 * authorization decisions and to validate grantees.
 */
public interface PrincipalDirectoryPort {

    /**
     * Resolves the groups a user belongs to.
     *
     * @param user the user name
     * @return group names, empty if the user is in no group or unknown
     */
    Set<String> groupsOf(String user);

    /**
     * @param user the user name
     * @return true if the directory knows the user
     */
    boolean userExists(String user);

    /**
     * @param group the group name
     * @return true if the directory knows the group
     */
    boolean groupExists(String group);
}
