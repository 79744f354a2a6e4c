// Copyright Vespa.ai. Licensed under the terms of the Apache 2.0 license. See LICENSE in the project root.
package ai.nodeverify.snapshot;

import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Sets;

import java.util.Collection;
import java.util.Set;

/**
 * The quorum status seen by one monitor.
 *
 * @param knownMembers the names of all monitors in the monitor map
 * @param onlineMembers the names of the monitors currently in quorum
 *
 * @author nodeverify
 */
public record QuorumStatus(Set<String> knownMembers, Set<String> onlineMembers) {

    public QuorumStatus {
        knownMembers = ImmutableSet.copyOf(knownMembers);
        onlineMembers = ImmutableSet.copyOf(onlineMembers);
    }

    /** Returns the members which stay online when the monitors on the given hosts go away */
    public Set<String> onlineMembersWithout(Collection<String> removedHostnames) {
        return ImmutableSet.copyOf(Sets.difference(onlineMembers, ImmutableSet.copyOf(removedHostnames)));
    }

    /**
     * Returns whether the quorum is lost when the monitors on the given hosts go away,
     * i.e. when no more than half the known members remain online.
     */
    public boolean losesQuorumWithout(Collection<String> removedHostnames) {
        return onlineMembersWithout(removedHostnames).size() <= knownMembers.size() / 2;
    }

}
