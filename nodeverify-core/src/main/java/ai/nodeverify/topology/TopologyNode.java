// Copyright Vespa.ai. Licensed under the terms of the Apache 2.0 license. See LICENSE in the project root.
package ai.nodeverify.topology;

import java.util.List;

import static java.util.Objects.requireNonNull;

/**
 * A node in the CRUSH hierarchy with its disk usage, as reported by <code>ceph df osd tree</code>.
 * For buckets the sizes are aggregated over all descendants. Immutable.
 *
 * @param id the node id, negative for buckets and non-negative for devices
 * @param name the node name, which for nodes of type host is the host name of the machine
 * @param type the type of this node
 * @param kb the total capacity in kB
 * @param kbUsed the used capacity in kB
 * @param kbAvail the available capacity in kB
 * @param children the ids of the children of this, empty for devices
 *
 * @author nodeverify
 */
public record TopologyNode(int id, String name, NodeType type, long kb, long kbUsed, long kbAvail, List<Integer> children) {

    public TopologyNode {
        requireNonNull(name, "name cannot be null");
        requireNonNull(type, "type cannot be null");
        children = children == null ? List.of() : List.copyOf(children);
    }

    /** Creates a node without children */
    public TopologyNode(int id, String name, NodeType type, long kb, long kbUsed, long kbAvail) {
        this(id, name, type, kb, kbUsed, kbAvail, List.of());
    }

    public int typeId() { return type.typeId(); }

    @Override
    public String toString() {
        return typeId() + "-" + name + "(" + id + ")";
    }

}
