// Copyright Vespa.ai. Licensed under the terms of the Apache 2.0 license. See LICENSE in the project root.
package ai.nodeverify.snapshot;

import ai.nodeverify.topology.NodeType;
import ai.nodeverify.topology.TopologyNode;
import ai.nodeverify.topology.TopologyTree;
import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonFactoryBuilder;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.StreamReadFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.BiConsumer;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Parses the JSON output of the Ceph diagnostic commands, and whole verification snapshots, into typed records.
 * All methods throw {@link MalformedSnapshotException} on input which is not JSON or lacks expected fields.
 *
 * @author nodeverify
 */
public class SnapshotParser {

    private static final Logger log = Logger.getLogger(SnapshotParser.class.getName());

    private static final ObjectMapper mapper = createMapper();

    private SnapshotParser() { }

    private static ObjectMapper createMapper() {
        JsonFactory jsonFactory = new JsonFactoryBuilder()
                .configure(StreamReadFeature.INCLUDE_SOURCE_IN_LOCATION, true)
                .build();
        return new ObjectMapper(jsonFactory);
    }

    /** Parses the output of <code>ceph df osd tree</code> into a topology tree */
    public static TopologyTree parseTopology(String payload) {
        log.log(Level.FINE, () -> "Parsing disk utilization: " + payload);
        List<TopologyNode> parsed = new ArrayList<>();
        for (JsonNode node : arrayField(readTree(payload, "disk utilization"), "nodes"))
            parsed.add(parseNode(node));
        try {
            return new TopologyTree(parsed);
        } catch (IllegalArgumentException e) {
            throw new MalformedSnapshotException("Invalid topology: " + e.getMessage(), e);
        }
    }

    private static TopologyNode parseNode(JsonNode node) {
        String typeName = textField(node, "type");
        NodeType type = NodeType.find(typeName).orElseThrow(() -> new MalformedSnapshotException(
                "Unknown type '" + typeName + "' of node " + node));
        if (node.has("type_id") && intField(node, "type_id") != type.typeId())
            throw new MalformedSnapshotException("Type id " + node.get("type_id") + " does not match type '" + typeName + "'");

        List<Integer> children = new ArrayList<>();
        if (node.hasNonNull("children")) {
            for (JsonNode child : arrayField(node, "children")) {
                if ( ! child.canConvertToInt())
                    throw new MalformedSnapshotException("Expected integer child ids, but got " + child);
                children.add(child.intValue());
            }
        }
        return new TopologyNode(intField(node, "id"), textField(node, "name"), type,
                                longField(node, "kb"), longField(node, "kb_used"), longField(node, "kb_avail"),
                                children);
    }

    /** Parses the detailed output of the <code>list-pools</code> action */
    public static List<PoolReplication> parsePools(String payload) {
        log.log(Level.FINE, () -> "Parsing information about pools: " + payload);
        JsonNode pools = readTree(payload, "pools");
        if ( ! pools.isArray())
            throw new MalformedSnapshotException("Expected a list of pools, but got " + pools.getNodeType());

        List<PoolReplication> parsed = new ArrayList<>();
        for (JsonNode pool : pools)
            parsed.add(new PoolReplication(intField(pool, "size"), intField(pool, "min_size")));
        return parsed;
    }

    /** Parses the output of the <code>get-quorum-status</code> action */
    public static QuorumStatus parseQuorumStatus(String payload) {
        JsonNode status = readTree(payload, "quorum status");
        Set<String> known = new LinkedHashSet<>();
        for (JsonNode mon : arrayField(field(status, "monmap"), "mons"))
            known.add(textField(mon, "name"));

        Set<String> online = new LinkedHashSet<>();
        for (JsonNode name : arrayField(status, "quorum_names"))
            online.add(textElement(name, "quorum_names"));

        return new QuorumStatus(known, online);
    }

    /** Reads a verification snapshot document */
    public static VerificationSnapshot parseSnapshot(InputStream in) throws IOException {
        JsonNode root;
        try {
            root = mapper.readTree(in);
        } catch (JsonProcessingException e) {
            throw new MalformedSnapshotException("Snapshot is not valid JSON: " + e.getOriginalMessage(), e);
        }
        if (root == null || ! root.isObject())
            throw new MalformedSnapshotException("Expected the snapshot to be a JSON object");
        return parseSnapshot(root);
    }

    /** Reads a verification snapshot document */
    public static VerificationSnapshot parseSnapshot(String json) {
        return parseSnapshot(readTree(json, "snapshot"));
    }

    private static VerificationSnapshot parseSnapshot(JsonNode root) {
        VerificationSnapshot.Builder builder = VerificationSnapshot.builder();
        for (JsonNode unit : arrayField(root, "units"))
            builder.addUnit(new UnitInfo(textField(unit, "id"),
                                         textField(unit, "application"),
                                         textField(unit, "hostname"),
                                         unit.path("workload-status").asText("unknown"),
                                         Optional.ofNullable(unit.get("agent-version")).map(JsonNode::asText)));
        for (JsonNode target : arrayField(root, "targets"))
            builder.addTarget(textElement(target, "targets"));

        forEachPayload(root, "health", builder::setHealth);
        forEachPayload(root, "pools", builder::setPools);
        forEachPayload(root, "disk-usage", builder::setDiskUsage);
        forEachPayload(root, "quorum-status", builder::setQuorumStatus);
        try {
            return builder.build();
        } catch (IllegalArgumentException e) {
            throw new MalformedSnapshotException("Invalid snapshot: " + e.getMessage(), e);
        }
    }

    /** Payloads are either strings holding raw command output, or the output embedded as JSON */
    private static void forEachPayload(JsonNode root, String name, BiConsumer<String, String> consumer) {
        JsonNode payloads = root.path(name);
        if (payloads.isMissingNode() || payloads.isNull()) return;
        if ( ! payloads.isObject())
            throw new MalformedSnapshotException("Expected '" + name + "' to be an object, but got " + payloads.getNodeType());

        for (Map.Entry<String, JsonNode> entry : payloads.properties())
            consumer.accept(entry.getKey(), entry.getValue().isTextual() ? entry.getValue().textValue()
                                                                          : entry.getValue().toString());
    }

    private static JsonNode readTree(String payload, String description) {
        if (payload == null)
            throw new MalformedSnapshotException("No " + description + " data");
        try {
            JsonNode node = mapper.readTree(payload);
            if (node == null || node.isMissingNode())
                throw new MalformedSnapshotException("Empty " + description + " data");
            return node;
        } catch (JsonProcessingException e) {
            throw new MalformedSnapshotException("Failed to parse " + description + ": " + e.getOriginalMessage(), e);
        }
    }

    private static JsonNode field(JsonNode node, String name) {
        JsonNode value = node.get(name);
        if (value == null || value.isNull())
            throw new MalformedSnapshotException("Missing field '" + name + "' in " + node);
        return value;
    }

    private static JsonNode arrayField(JsonNode node, String name) {
        JsonNode value = field(node, name);
        if ( ! value.isArray())
            throw new MalformedSnapshotException("Expected '" + name + "' to be an array, but got " + value.getNodeType());
        return value;
    }

    private static String textElement(JsonNode element, String arrayName) {
        if ( ! element.isTextual())
            throw new MalformedSnapshotException("Expected the elements of '" + arrayName + "' to be strings, but got " + element);
        return element.textValue();
    }

    private static String textField(JsonNode node, String name) {
        JsonNode value = field(node, name);
        if ( ! value.isTextual())
            throw new MalformedSnapshotException("Expected field '" + name + "' to be a string, but got " + value);
        return value.textValue();
    }

    private static int intField(JsonNode node, String name) {
        JsonNode value = field(node, name);
        if ( ! value.canConvertToInt() || ! value.isIntegralNumber())
            throw new MalformedSnapshotException("Expected field '" + name + "' to be an integer, but got " + value);
        return value.intValue();
    }

    private static long longField(JsonNode node, String name) {
        JsonNode value = field(node, name);
        if ( ! value.isIntegralNumber() || ! value.canConvertToLong())
            throw new MalformedSnapshotException("Expected field '" + name + "' to be an integer, but got " + value);
        return value.longValue();
    }

}
