// Copyright Vespa.ai. Licensed under the terms of the Apache 2.0 license. See LICENSE in the project root.
package ai.nodeverify.snapshot;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Everything fetched from a cluster for one verification run. Immutable.
 * <p>
 * Diagnostic command outputs are kept as the raw payload text, and are parsed by the checks using them,
 * so that a malformed payload fails only the check which needs it.
 *
 * @param units all known units of the affected applications, including the targets
 * @param targets the ids of the units to reboot or shut down
 * @param health the cluster health status reported by each reachable monitor unit
 * @param poolPayloads the pool list, in JSON, per storage application
 * @param diskUsagePayloads the <code>ceph df osd tree</code> report, in JSON, per storage application
 * @param quorumPayloads the quorum status, in JSON, per monitor unit
 *
 * @author nodeverify
 */
public record VerificationSnapshot(List<UnitInfo> units,
                                   Set<String> targets,
                                   Map<String, String> health,
                                   Map<String, String> poolPayloads,
                                   Map<String, String> diskUsagePayloads,
                                   Map<String, String> quorumPayloads) {

    public VerificationSnapshot {
        units = ImmutableList.copyOf(units);
        targets = ImmutableSet.copyOf(targets);
        health = ImmutableMap.copyOf(health);
        poolPayloads = ImmutableMap.copyOf(poolPayloads);
        diskUsagePayloads = ImmutableMap.copyOf(diskUsagePayloads);
        quorumPayloads = ImmutableMap.copyOf(quorumPayloads);

        ImmutableMap.Builder<String, UnitInfo> byId = ImmutableMap.builder();
        units.forEach(unit -> byId.put(unit.id(), unit));
        Map<String, UnitInfo> unitsById = byId.buildOrThrow();
        for (String target : targets)
            if ( ! unitsById.containsKey(target))
                throw new IllegalArgumentException("Target unit '" + target + "' is not among the known units");
    }

    public Optional<UnitInfo> unit(String id) {
        return units.stream().filter(unit -> unit.id().equals(id)).findFirst();
    }

    /** Returns the target units, in the order of {@link #units} */
    public List<UnitInfo> targetUnits() {
        return units.stream().filter(unit -> targets.contains(unit.id())).toList();
    }

    /** Returns the distinct applications of the target units */
    public Set<String> targetApplications() {
        return targetUnits().stream().map(UnitInfo::application).collect(ImmutableSet.toImmutableSet());
    }

    /** Returns the target units of the given application */
    public List<UnitInfo> targetUnitsOf(String application) {
        return targetUnits().stream().filter(unit -> unit.application().equals(application)).toList();
    }

    /** Returns all known units of the given application */
    public List<UnitInfo> unitsOf(String application) {
        return units.stream().filter(unit -> unit.application().equals(application)).toList();
    }

    public static Builder builder() { return new Builder(); }

    public static class Builder {

        private final ImmutableList.Builder<UnitInfo> units = ImmutableList.builder();
        private final ImmutableSet.Builder<String> targets = ImmutableSet.builder();
        private final ImmutableMap.Builder<String, String> health = ImmutableMap.builder();
        private final ImmutableMap.Builder<String, String> poolPayloads = ImmutableMap.builder();
        private final ImmutableMap.Builder<String, String> diskUsagePayloads = ImmutableMap.builder();
        private final ImmutableMap.Builder<String, String> quorumPayloads = ImmutableMap.builder();

        public Builder addUnit(UnitInfo unit) {
            units.add(unit);
            return this;
        }

        public Builder addTarget(String unitId) {
            targets.add(unitId);
            return this;
        }

        public Builder setHealth(String monitorUnit, String status) {
            health.put(monitorUnit, status);
            return this;
        }

        public Builder setPools(String application, String payload) {
            poolPayloads.put(application, payload);
            return this;
        }

        public Builder setDiskUsage(String application, String payload) {
            diskUsagePayloads.put(application, payload);
            return this;
        }

        public Builder setQuorumStatus(String monitorUnit, String payload) {
            quorumPayloads.put(monitorUnit, payload);
            return this;
        }

        public VerificationSnapshot build() {
            return new VerificationSnapshot(units.build(), targets.build(), health.buildOrThrow(),
                                            poolPayloads.buildOrThrow(), diskUsagePayloads.buildOrThrow(),
                                            quorumPayloads.buildOrThrow());
        }

    }

}
