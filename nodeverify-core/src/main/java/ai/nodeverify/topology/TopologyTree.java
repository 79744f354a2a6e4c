// Copyright Vespa.ai. Licensed under the terms of the Apache 2.0 license. See LICENSE in the project root.
package ai.nodeverify.topology;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.LinkedListMultimap;
import com.google.common.collect.ListMultimap;

import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.Collectors;

/**
 * The CRUSH hierarchy of a Ceph cluster with the disk usage of each node, built once from a
 * <code>ceph df osd tree</code> report and never modified.
 * <p>
 * The main use is to decide whether a set of hosts can be taken out of the cluster, i.e. whether the
 * ancestors of the hosts have room for the data which will be redistributed when the hosts disappear.
 *
 * @author nodeverify
 */
public class TopologyTree {

    private static final Logger log = Logger.getLogger(TopologyTree.class.getName());

    private final List<TopologyNode> nodes;
    private final Map<String, Integer> indexByName;
    private final Map<Integer, TopologyNode> parentById;

    /**
     * Creates a tree from the given nodes.
     *
     * @throws IllegalArgumentException if two nodes have the same name or the same id
     */
    public TopologyTree(List<TopologyNode> nodes) {
        this.nodes = ImmutableList.copyOf(nodes);

        ImmutableMap.Builder<String, Integer> names = ImmutableMap.builder();
        Set<Integer> ids = new HashSet<>();
        for (int i = 0; i < this.nodes.size(); i++) {
            TopologyNode node = this.nodes.get(i);
            if ( ! ids.add(node.id()))
                throw new IllegalArgumentException("Duplicate node id " + node.id() + " in topology");
            names.put(node.name(), i);
        }
        this.indexByName = names.buildOrThrow();

        // The first node listing a child is its parent
        Map<Integer, TopologyNode> parents = new HashMap<>();
        for (TopologyNode node : this.nodes)
            for (int child : node.children())
                parents.putIfAbsent(child, node);
        this.parentById = Map.copyOf(parents);
    }

    /** Returns the nodes of this, in the order they were given */
    public List<TopologyNode> nodes() { return nodes; }

    /** Returns the node with the given name, or throws NodeNotFoundException if there is none */
    public TopologyNode lookup(String name) {
        Integer index = indexByName.get(name);
        if (index == null) throw new NodeNotFoundException(name);
        return nodes.get(index);
    }

    private int indexOf(TopologyNode node) {
        return indexByName.get(node.name());
    }

    /** Returns the parent of the given node, or empty if it has none */
    public Optional<TopologyNode> parentOf(TopologyNode node) {
        return Optional.ofNullable(parentById.get(node.id()));
    }

    /**
     * Returns the nearest ancestor of the given node which has the required type, or empty if there is no such
     * ancestor. A node is never its own ancestor.
     */
    public Optional<TopologyNode> findAncestor(TopologyNode node, NodeType requiredType) {
        Optional<TopologyNode> parent = parentOf(node);
        // Bounded by the node count, so a cycle in the report cannot hang us
        for (int hops = 0; parent.isPresent() && hops < nodes.size(); hops++) {
            if (parent.get().type() == requiredType) return parent;
            parent = parentOf(parent.get());
        }
        return Optional.empty();
    }

    /**
     * Returns whether all the given hosts can be removed, that is, whether for each ancestor of the required type,
     * the space it has available after losing the hosts is larger than the space used on the hosts it loses.
     *
     * @param hostNames the names of the hosts to remove
     * @param requiredAncestorType the type of the ancestor which must absorb the data of the removed hosts
     * @throws IllegalArgumentException if the ancestor type is not supported, a name is not of a host,
     *                                  or a host has no ancestor of the required type
     * @throws NodeNotFoundException if a name is not in this tree
     */
    public boolean canRemoveHosts(Collection<String> hostNames, NodeType requiredAncestorType) {
        return unsafeRemovalGroups(hostNames, requiredAncestorType).isEmpty();
    }

    /**
     * Returns the groups of {@link #removalGroups} which cannot be removed, in the same order.
     *
     * @throws IllegalArgumentException and NodeNotFoundException as {@link #canRemoveHosts}
     */
    public List<RemovalGroup> unsafeRemovalGroups(Collection<String> hostNames, NodeType requiredAncestorType) {
        List<RemovalGroup> unsafe = removalGroups(hostNames, requiredAncestorType).stream()
                                                                                  .filter(group -> ! group.isSafe())
                                                                                  .toList();
        unsafe.forEach(group -> log.log(Level.FINE, () -> "Lack of space: " + group));
        return unsafe;
    }

    /**
     * Returns the given hosts grouped by their ancestor of the required type. Groups are ordered by the position of
     * their ancestor in this tree, and hosts within a group by their order in the argument.
     *
     * @throws IllegalArgumentException and NodeNotFoundException as {@link #canRemoveHosts}
     */
    public List<RemovalGroup> removalGroups(Collection<String> hostNames, NodeType requiredAncestorType) {
        if ( ! requiredAncestorType.isSupportedAncestor())
            throw new IllegalArgumentException("Ancestor type '" + requiredAncestorType + "' is not supported");

        List<TopologyNode> hosts = hostNames.stream().distinct().map(this::lookup).toList();
        for (TopologyNode host : hosts)
            if (host.type() != NodeType.HOST)
                throw new IllegalArgumentException("Only nodes of type host can be removed, but " + host +
                                                   " is of type " + host.type());

        ListMultimap<TopologyNode, TopologyNode> hostsByAncestor = LinkedListMultimap.create();
        for (TopologyNode host : hosts) {
            TopologyNode ancestor = findAncestor(host, requiredAncestorType).orElseThrow(() -> new IllegalArgumentException(
                    "An ancestor of type " + requiredAncestorType + " for the host node " + host + " could not be found"));
            log.log(Level.FINE, () -> "Found ancestor " + ancestor + " for host node " + host);
            hostsByAncestor.put(ancestor, host);
        }

        return hostsByAncestor.keySet().stream()
                              .sorted(Comparator.comparingInt(this::indexOf))
                              .map(ancestor -> new RemovalGroup(ancestor, hostsByAncestor.get(ancestor)))
                              .toList();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return nodes.equals(((TopologyTree) o).nodes);
    }

    @Override
    public int hashCode() {
        return nodes.hashCode();
    }

    /** Returns all nodes, with those closest to the root first */
    @Override
    public String toString() {
        return nodes.stream()
                    .sorted(Comparator.comparingInt(TopologyNode::typeId).reversed())
                    .map(TopologyNode::toString)
                    .collect(Collectors.joining(","));
    }

}
