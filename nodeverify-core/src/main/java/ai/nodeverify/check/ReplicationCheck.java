// Copyright Vespa.ai. Licensed under the terms of the Apache 2.0 license. See LICENSE in the project root.
package ai.nodeverify.check;

import ai.nodeverify.result.Check;
import ai.nodeverify.result.Result;
import ai.nodeverify.result.Severity;
import ai.nodeverify.snapshot.PoolReplication;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Sets;

import java.util.List;
import java.util.OptionalInt;
import java.util.Set;

import static java.util.Objects.requireNonNull;

/**
 * Checks that no pool of a storage application loses more replicas than it can tolerate: the units to remove,
 * together with the units which are already inactive, must not outnumber the smallest replication margin
 * among the pools of the application.
 *
 * @author nodeverify
 */
public class ReplicationCheck implements Check {

    public static final String NAME = "replication number";

    private final List<Application> applications;

    public ReplicationCheck(List<Application> applications) {
        this.applications = ImmutableList.copyOf(applications);
    }

    @Override
    public String name() { return NAME; }

    @Override
    public Result run() {
        Result result = new Result();
        for (Application application : applications) {
            OptionalInt margin = application.minimumMargin();
            if (margin.isEmpty()) continue; // no pools, nothing to lose

            if (application.affectedUnits().size() > margin.getAsInt())
                result.addPartial(Severity.FAIL,
                                  String.format("The minimum number of replicas in '%s' is %d and it's not safe to " +
                                                "reboot/shutdown %d units. %d units are not active.",
                                                application.name(), margin.getAsInt(),
                                                application.removedUnits().size(), application.inactiveUnits().size()));
        }
        return result.isEmpty() ? new Result(Severity.OK, "Minimum replica number check passed.") : result;
    }

    /**
     * The replication state of one storage application.
     *
     * @param name the application name
     * @param pools the pools of the cluster the application stores data in
     * @param removedUnits the ids of the units of the application proposed for removal
     * @param inactiveUnits the ids of the units of the application which are not active
     */
    public record Application(String name, List<PoolReplication> pools, Set<String> removedUnits, Set<String> inactiveUnits) {

        public Application {
            requireNonNull(name, "name cannot be null");
            pools = ImmutableList.copyOf(pools);
            removedUnits = ImmutableSet.copyOf(removedUnits);
            inactiveUnits = ImmutableSet.copyOf(inactiveUnits);
        }

        /** Returns the number of replicas the least tolerant pool can lose, or empty if there are no pools */
        public OptionalInt minimumMargin() {
            return pools.stream().mapToInt(PoolReplication::margin).min();
        }

        /** Returns the units which will not serve replicas once the removal happens */
        public Set<String> affectedUnits() {
            return Sets.union(removedUnits, inactiveUnits);
        }

    }

}
