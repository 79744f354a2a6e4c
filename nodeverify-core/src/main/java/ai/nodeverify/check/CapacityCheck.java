// Copyright Vespa.ai. Licensed under the terms of the Apache 2.0 license. See LICENSE in the project root.
package ai.nodeverify.check;

import ai.nodeverify.result.Check;
import ai.nodeverify.result.Result;
import ai.nodeverify.result.Severity;
import ai.nodeverify.topology.NodeType;
import ai.nodeverify.topology.RemovalGroup;
import ai.nodeverify.topology.TopologyTree;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static java.util.Objects.requireNonNull;

/**
 * Checks that the availability zone of each storage application has room for the data on the hosts to remove.
 * The availability zone is the ancestor of the hosts at the level given by the failure domain of the replication
 * rule, or the root when replicas are only required to be on distinct hosts.
 *
 * @author nodeverify
 */
public class CapacityCheck implements Check {

    public static final String NAME = "availability zone";

    private final List<Application> applications;
    private final NodeType failureDomain;

    public CapacityCheck(List<Application> applications, NodeType failureDomain) {
        this.applications = ImmutableList.copyOf(applications);
        this.failureDomain = requireNonNull(failureDomain);
    }

    @Override
    public String name() { return NAME; }

    /** Returns the type of the ancestors which must absorb the data of removed hosts */
    public NodeType requiredAncestorType() {
        return NodeType.ancestorForFailureDomain(failureDomain);
    }

    @Override
    public Result run() {
        Result result = new Result();
        for (Application application : applications) {
            List<RemovalGroup> unsafe = application.tree().unsafeRemovalGroups(application.hostnamesByUnit().values(),
                                                                               requiredAncestorType());
            if (unsafe.isEmpty()) continue;

            result = result.plus(new Result(Severity.FAIL,
                                            "It's not safe to reboot/shutdown unit(s) " +
                                            String.join(", ", application.hostnamesByUnit().keySet()) +
                                            " in the availability zone '" + application.tree() + "'. Lack of space for " +
                                            unsafe.stream().map(RemovalGroup::toString).collect(Collectors.joining("; "))));
        }
        return result.isEmpty() ? new Result(Severity.OK, "Availability zone check passed.") : result;
    }

    /**
     * The units of one storage application proposed for removal.
     *
     * @param name the application name
     * @param tree the topology of the cluster the application stores data in
     * @param hostnamesByUnit the host name of each unit to remove, by unit id
     */
    public record Application(String name, TopologyTree tree, Map<String, String> hostnamesByUnit) {

        public Application {
            requireNonNull(name, "name cannot be null");
            requireNonNull(tree, "tree cannot be null");
            hostnamesByUnit = ImmutableMap.copyOf(hostnamesByUnit);
        }

    }

}
