// Copyright Vespa.ai. Licensed under the terms of the Apache 2.0 license. See LICENSE in the project root.
package ai.nodeverify.verifier;

import java.util.Arrays;
import java.util.stream.Collectors;

/**
 * The role of the units to verify, named by the application they run.
 *
 * @author nodeverify
 */
public enum Role {

    /** Storage nodes, holding object replicas */
    STORAGE_NODE("ceph-osd"),

    /** Cluster members, forming the monitor quorum */
    MONITOR("ceph-mon");

    private final String applicationName;

    Role(String applicationName) {
        this.applicationName = applicationName;
    }

    public String applicationName() { return applicationName; }

    public static Role fromApplicationName(String name) {
        return Arrays.stream(values())
                     .filter(role -> role.applicationName.equals(name))
                     .findFirst()
                     .orElseThrow(() -> new IllegalArgumentException(
                             "Unsupported role '" + name + "', must be one of " +
                             Arrays.stream(values()).map(Role::applicationName).collect(Collectors.joining(", "))));
    }

    @Override
    public String toString() { return applicationName; }

}
