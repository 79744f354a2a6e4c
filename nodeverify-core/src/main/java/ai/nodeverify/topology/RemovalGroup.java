// Copyright Vespa.ai. Licensed under the terms of the Apache 2.0 license. See LICENSE in the project root.
package ai.nodeverify.topology;

import java.util.List;
import java.util.stream.Collectors;

import static java.util.Objects.requireNonNull;

/**
 * A set of hosts proposed for removal which share the same ancestor, with the space balance of that ancestor
 * after the removal.
 *
 * @param ancestor the ancestor which must absorb the data of the removed hosts
 * @param hosts the hosts to remove, all descendants of the ancestor
 *
 * @author nodeverify
 */
public record RemovalGroup(TopologyNode ancestor, List<TopologyNode> hosts) {

    public RemovalGroup {
        requireNonNull(ancestor, "ancestor cannot be null");
        hosts = List.copyOf(hosts);
    }

    /** Returns the total space used by the hosts, which must be moved elsewhere in the ancestor */
    public long kbUsed() {
        return hosts.stream().mapToLong(TopologyNode::kbUsed).sum();
    }

    /** Returns the total space available on the hosts, which the ancestor loses */
    public long kbAvail() {
        return hosts.stream().mapToLong(TopologyNode::kbAvail).sum();
    }

    /** Returns the space left available in the ancestor once the hosts are gone */
    public long remainingKbAvail() {
        return ancestor.kbAvail() - kbAvail();
    }

    /** Returns whether the remaining available space of the ancestor exceeds the data of the removed hosts */
    public boolean isSafe() {
        return remainingKbAvail() > kbUsed();
    }

    @Override
    public String toString() {
        return hosts.stream().map(TopologyNode::toString).collect(Collectors.joining(",")) + " in " + ancestor +
               " (" + remainingKbAvail() + " kB available after removal, " + kbUsed() + " kB to move)";
    }

}
