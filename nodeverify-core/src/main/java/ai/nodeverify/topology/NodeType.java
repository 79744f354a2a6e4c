// Copyright Vespa.ai. Licensed under the terms of the Apache 2.0 license. See LICENSE in the project root.
package ai.nodeverify.topology;

import java.util.Arrays;
import java.util.Optional;

/**
 * The bucket types of a CRUSH map hierarchy, from the leaf devices up to the root.
 * The type id of a type is higher the closer it is to the root.
 *
 * @author nodeverify
 */
public enum NodeType {

    OSD("osd", 0),
    HOST("host", 1),
    CHASSIS("chassis", 2),
    RACK("rack", 3),
    ROW("row", 4),
    PDU("pdu", 5),
    POD("pod", 6),
    ROOM("room", 7),
    DATACENTER("datacenter", 8),
    REGION("region", 9),
    ROOT("root", 10);

    private final String typeName;
    private final int typeId;

    NodeType(String typeName, int typeId) {
        this.typeName = typeName;
        this.typeId = typeId;
    }

    /** Returns the name of this type, as used by Ceph */
    public String typeName() { return typeName; }

    /** Returns the id of this type, as used by Ceph */
    public int typeId() { return typeId; }

    /** Returns whether this type may be used as the ancestor level when removing hosts, i.e. chassis or above */
    public boolean isSupportedAncestor() {
        return typeId > HOST.typeId;
    }

    /**
     * Returns the type of the ancestor which must absorb the data of removed hosts, given the failure domain
     * of the replication rule. With failure domain host the whole root must absorb it, and otherwise the
     * failure domain itself.
     */
    public static NodeType ancestorForFailureDomain(NodeType failureDomain) {
        return failureDomain == HOST ? ROOT : failureDomain;
    }

    public static Optional<NodeType> find(String typeName) {
        return Arrays.stream(values()).filter(type -> type.typeName.equals(typeName)).findFirst();
    }

    /** Returns the type with the given name, or throws IllegalArgumentException if there is none */
    public static NodeType fromName(String typeName) {
        return find(typeName).orElseThrow(() -> new IllegalArgumentException("Unknown node type '" + typeName + "'"));
    }

    @Override
    public String toString() { return typeName; }

}
