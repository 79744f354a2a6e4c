// Copyright Vespa.ai. Licensed under the terms of the Apache 2.0 license. See LICENSE in the project root.
package ai.nodeverify.topology;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class TopologyTreeTest {

    /** root(-1) -> rack(-2) -> host(-4) -> osd(0) */
    private static TopologyTree chain() {
        return new TopologyTree(List.of(new TopologyNode(-1, "default", NodeType.ROOT, 1000, 100, 900, List.of(-2)),
                                        new TopologyNode(-2, "rack.0", NodeType.RACK, 1000, 100, 900, List.of(-4)),
                                        new TopologyNode(-4, "host.0", NodeType.HOST, 1000, 100, 900, List.of(0)),
                                        new TopologyNode(0, "osd.0", NodeType.OSD, 1000, 100, 900)));
    }

    /** A root with two hosts, each using 100 kB and having 400 kB available */
    private static TopologyTree twoHosts(long rootKbAvail) {
        return new TopologyTree(List.of(new TopologyNode(-1, "default", NodeType.ROOT, 2000, 200, rootKbAvail, List.of(-2, -3)),
                                        new TopologyNode(-2, "host.0", NodeType.HOST, 500, 100, 400, List.of(0)),
                                        new TopologyNode(-3, "host.1", NodeType.HOST, 500, 100, 400, List.of(1)),
                                        new TopologyNode(0, "osd.0", NodeType.OSD, 500, 100, 400),
                                        new TopologyNode(1, "osd.1", NodeType.OSD, 500, 100, 400)));
    }

    /** A root with two racks of two hosts each. Hosts on rack.0 can be removed, those on rack.1 can not. */
    private static TopologyTree twoRacks() {
        return new TopologyTree(List.of(new TopologyNode(-1, "default", NodeType.ROOT, 4000, 2200, 1000, List.of(-2, -3)),
                                        new TopologyNode(-2, "rack.0", NodeType.RACK, 2000, 200, 1800, List.of(-4, -5)),
                                        new TopologyNode(-3, "rack.1", NodeType.RACK, 2000, 2000, 0, List.of(-6, -7)),
                                        new TopologyNode(-4, "host.0", NodeType.HOST, 500, 100, 400, List.of(0)),
                                        new TopologyNode(-5, "host.1", NodeType.HOST, 500, 100, 400, List.of(1)),
                                        new TopologyNode(-6, "host.2", NodeType.HOST, 1000, 1000, 0, List.of(2)),
                                        new TopologyNode(-7, "host.3", NodeType.HOST, 1000, 1000, 0, List.of(3)),
                                        new TopologyNode(0, "osd.0", NodeType.OSD, 500, 100, 400),
                                        new TopologyNode(1, "osd.1", NodeType.OSD, 500, 100, 400),
                                        new TopologyNode(2, "osd.2", NodeType.OSD, 1000, 1000, 0),
                                        new TopologyNode(3, "osd.3", NodeType.OSD, 1000, 1000, 0)));
    }

    @Test
    void lookup_by_name() {
        TopologyTree tree = chain();
        assertEquals(-4, tree.lookup("host.0").id());
        NodeNotFoundException e = assertThrows(NodeNotFoundException.class, () -> tree.lookup("host.1"));
        assertEquals("Node host.1 was not found", e.getMessage());
    }

    @Test
    void ancestors_are_resolved_upwards() {
        TopologyTree tree = chain();
        TopologyNode root = tree.lookup("default");
        TopologyNode rack = tree.lookup("rack.0");
        TopologyNode host = tree.lookup("host.0");

        assertEquals(Optional.of(root), tree.findAncestor(host, NodeType.ROOT));
        assertEquals(Optional.of(rack), tree.findAncestor(host, NodeType.RACK));
        assertEquals(Optional.of(host), tree.findAncestor(tree.lookup("osd.0"), NodeType.HOST));
        assertEquals(Optional.empty(), tree.findAncestor(root, NodeType.ROOT));
        assertEquals(Optional.empty(), tree.findAncestor(host, NodeType.HOST));
        assertEquals(Optional.empty(), tree.findAncestor(host, NodeType.DATACENTER));
    }

    @Test
    void ancestor_search_terminates_on_cyclic_input() {
        TopologyTree tree = new TopologyTree(List.of(new TopologyNode(-1, "a", NodeType.RACK, 0, 0, 0, List.of(-2)),
                                                     new TopologyNode(-2, "b", NodeType.HOST, 0, 0, 0, List.of(-1))));
        assertEquals(Optional.empty(), tree.findAncestor(tree.lookup("b"), NodeType.ROOT));
    }

    @Test
    void removal_is_unsafe_when_remaining_space_equals_displaced_data() {
        // 1000 - (400 + 400) = 200 <= 100 + 100
        assertFalse(twoHosts(1000).canRemoveHosts(List.of("host.0", "host.1"), NodeType.ROOT));
        // 1001 - (400 + 400) = 201 > 100 + 100
        assertTrue(twoHosts(1001).canRemoveHosts(List.of("host.0", "host.1"), NodeType.ROOT));
    }

    @Test
    void removal_groups_expose_the_space_balance() {
        List<RemovalGroup> groups = twoHosts(1000).removalGroups(List.of("host.1", "host.0"), NodeType.ROOT);
        assertEquals(1, groups.size());
        RemovalGroup group = groups.get(0);
        assertEquals("default", group.ancestor().name());
        assertEquals(List.of("host.1", "host.0"), group.hosts().stream().map(TopologyNode::name).toList());
        assertEquals(200, group.kbUsed());
        assertEquals(800, group.kbAvail());
        assertEquals(200, group.remainingKbAvail());
        assertFalse(group.isSafe());
        assertEquals("1-host.1(-3),1-host.0(-2) in 10-default(-1) (200 kB available after removal, 200 kB to move)",
                     group.toString());
    }

    @Test
    void any_unsafe_group_makes_removal_unsafe() {
        TopologyTree tree = twoRacks();
        assertTrue(tree.canRemoveHosts(List.of("host.0", "host.1"), NodeType.RACK));
        assertFalse(tree.canRemoveHosts(List.of("host.2"), NodeType.RACK));
        assertFalse(tree.canRemoveHosts(List.of("host.0", "host.2"), NodeType.RACK));

        List<RemovalGroup> unsafe = tree.unsafeRemovalGroups(List.of("host.3", "host.0", "host.2"), NodeType.RACK);
        assertEquals(1, unsafe.size());
        assertEquals("rack.1", unsafe.get(0).ancestor().name());
        assertEquals(List.of("host.3", "host.2"), unsafe.get(0).hosts().stream().map(TopologyNode::name).toList());
    }

    @Test
    void groups_are_ordered_by_tree_position() {
        List<RemovalGroup> groups = twoRacks().removalGroups(List.of("host.2", "host.0"), NodeType.RACK);
        assertEquals(List.of("rack.0", "rack.1"), groups.stream().map(group -> group.ancestor().name()).toList());
    }

    @Test
    void grouping_by_root_combines_all_hosts() {
        // 1000 - 400 - 400 = 200 <= 200
        TopologyTree tree = twoRacks();
        assertFalse(tree.canRemoveHosts(List.of("host.0", "host.1"), NodeType.ROOT));
        assertTrue(tree.canRemoveHosts(List.of("host.0"), NodeType.ROOT));
    }

    @Test
    void duplicate_host_names_count_once() {
        // 1000 - 400 = 600 > 100, where counting host.0 twice would give 200 <= 200
        assertTrue(twoRacks().canRemoveHosts(List.of("host.0", "host.0"), NodeType.ROOT));
    }

    @Test
    void removing_nothing_is_safe() {
        assertTrue(twoRacks().canRemoveHosts(Set.of(), NodeType.ROOT));
    }

    @Test
    void unsupported_ancestor_type_is_rejected() {
        TopologyTree tree = chain();
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                                                  () -> tree.canRemoveHosts(List.of("host.0"), NodeType.HOST));
        assertEquals("Ancestor type 'host' is not supported", e.getMessage());
        assertThrows(IllegalArgumentException.class, () -> tree.canRemoveHosts(List.of("host.0"), NodeType.OSD));
    }

    @Test
    void only_hosts_can_be_removed() {
        TopologyTree tree = chain();
        assertThrows(IllegalArgumentException.class, () -> tree.canRemoveHosts(List.of("osd.0"), NodeType.ROOT));
        assertThrows(IllegalArgumentException.class, () -> tree.canRemoveHosts(List.of("host.0", "rack.0"), NodeType.ROOT));
        assertThrows(NodeNotFoundException.class, () -> tree.canRemoveHosts(List.of("unknown"), NodeType.ROOT));
    }

    @Test
    void missing_ancestor_is_an_error() {
        TopologyTree tree = new TopologyTree(List.of(new TopologyNode(-1, "default", NodeType.ROOT, 1000, 0, 1000, List.of()),
                                                     new TopologyNode(-2, "orphan", NodeType.HOST, 100, 0, 100)));
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                                                  () -> tree.canRemoveHosts(List.of("orphan"), NodeType.ROOT));
        assertEquals("An ancestor of type root for the host node 1-orphan(-2) could not be found", e.getMessage());
    }

    @Test
    void names_and_ids_must_be_unique() {
        assertThrows(IllegalArgumentException.class,
                     () -> new TopologyTree(List.of(new TopologyNode(-1, "a", NodeType.ROOT, 0, 0, 0),
                                                    new TopologyNode(-2, "a", NodeType.HOST, 0, 0, 0))));
        assertThrows(IllegalArgumentException.class,
                     () -> new TopologyTree(List.of(new TopologyNode(-1, "a", NodeType.ROOT, 0, 0, 0),
                                                    new TopologyNode(-1, "b", NodeType.HOST, 0, 0, 0))));
    }

    @Test
    void string_form_lists_nodes_from_the_root() {
        assertEquals("10-default(-1),3-rack.0(-2),1-host.0(-4),0-osd.0(0)", chain().toString());
        assertEquals("10-default(-1),1-host.0(-2),1-host.1(-3),0-osd.0(0),0-osd.1(1)", twoHosts(1000).toString());
    }

    @Test
    void trees_with_equal_nodes_are_equal() {
        assertEquals(twoHosts(1000), twoHosts(1000));
        assertEquals(twoHosts(1000).hashCode(), twoHosts(1000).hashCode());
        assertNotEquals(twoHosts(1000), twoHosts(1001));
    }

    @Test
    void failure_domain_maps_to_ancestor_type() {
        assertEquals(NodeType.ROOT, NodeType.ancestorForFailureDomain(NodeType.HOST));
        assertEquals(NodeType.RACK, NodeType.ancestorForFailureDomain(NodeType.RACK));
        assertEquals(NodeType.CHASSIS, NodeType.ancestorForFailureDomain(NodeType.CHASSIS));
    }

    @Test
    void node_types() {
        assertEquals(NodeType.DATACENTER, NodeType.fromName("datacenter"));
        assertEquals(8, NodeType.DATACENTER.typeId());
        assertEquals(Optional.empty(), NodeType.find("device"));
        assertThrows(IllegalArgumentException.class, () -> NodeType.fromName("zone"));
        assertTrue(NodeType.CHASSIS.isSupportedAncestor());
        assertFalse(NodeType.HOST.isSupportedAncestor());
    }

}
