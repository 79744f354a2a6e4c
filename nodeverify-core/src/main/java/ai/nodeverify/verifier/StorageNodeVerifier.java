// Copyright Vespa.ai. Licensed under the terms of the Apache 2.0 license. See LICENSE in the project root.
package ai.nodeverify.verifier;

import ai.nodeverify.check.CapacityCheck;
import ai.nodeverify.check.ClusterHealthCheck;
import ai.nodeverify.check.ReplicationCheck;
import ai.nodeverify.result.Check;
import ai.nodeverify.result.ChecksExecutor;
import ai.nodeverify.result.Result;
import ai.nodeverify.snapshot.MalformedSnapshotException;
import ai.nodeverify.snapshot.SnapshotParser;
import ai.nodeverify.snapshot.UnitInfo;
import ai.nodeverify.snapshot.VerificationSnapshot;
import ai.nodeverify.topology.TopologyTree;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.Collectors;

import static java.util.Objects.requireNonNull;

/**
 * Verifies that storage node units can be taken down: the cluster must be healthy, every pool must tolerate
 * losing the units in addition to those already inactive, and the availability zone of the units must have
 * room for their data. All three checks always run.
 *
 * @author nodeverify
 */
public class StorageNodeVerifier implements Verifier {

    private static final Logger log = Logger.getLogger(StorageNodeVerifier.class.getName());

    private final VerificationSnapshot snapshot;
    private final VerificationPolicy policy;

    private Map<String, TopologyTree> trees = null;

    public StorageNodeVerifier(VerificationSnapshot snapshot, VerificationPolicy policy) {
        this.snapshot = requireNonNull(snapshot);
        this.policy = requireNonNull(policy);
    }

    @Override
    public Result verifyReboot() {
        return ChecksExecutor.run(Check.of(ClusterHealthCheck.NAME, () -> new ClusterHealthCheck(snapshot.health()).run()),
                                  Check.of(ReplicationCheck.NAME, () -> new ReplicationCheck(replicationState()).run()),
                                  Check.of(CapacityCheck.NAME, () -> new CapacityCheck(removals(), policy.failureDomain()).run()));
    }

    @Override
    public Result verifyShutdown() {
        return verifyReboot();
    }

    /** Returns the topology tree of each affected application, parsed on first use */
    Map<String, TopologyTree> trees() {
        if (trees == null) {
            Map<String, TopologyTree> parsed = new LinkedHashMap<>();
            for (String application : snapshot.targetApplications())
                parsed.put(application, SnapshotParser.parseTopology(payload(snapshot.diskUsagePayloads(), application, "disk usage")));
            if (parsed.isEmpty())
                log.log(Level.WARNING, "No topology of any affected application");
            trees = Map.copyOf(parsed);
        }
        return trees;
    }

    private List<ReplicationCheck.Application> replicationState() {
        List<ReplicationCheck.Application> applications = new ArrayList<>();
        for (String application : snapshot.targetApplications()) {
            applications.add(new ReplicationCheck.Application(
                    application,
                    SnapshotParser.parsePools(payload(snapshot.poolPayloads(), application, "pool")),
                    snapshot.targetUnitsOf(application).stream().map(UnitInfo::id).collect(Collectors.toSet()),
                    snapshot.unitsOf(application).stream().filter(unit -> ! unit.isActive()).map(UnitInfo::id).collect(Collectors.toSet())));
        }
        return applications;
    }

    private List<CapacityCheck.Application> removals() {
        List<CapacityCheck.Application> applications = new ArrayList<>();
        for (String application : snapshot.targetApplications()) {
            Map<String, String> hostnamesByUnit = new LinkedHashMap<>();
            snapshot.targetUnitsOf(application).forEach(unit -> hostnamesByUnit.put(unit.id(), unit.hostname()));
            applications.add(new CapacityCheck.Application(application, trees().get(application), hostnamesByUnit));
        }
        return applications;
    }

    private static String payload(Map<String, String> payloads, String application, String description) {
        String payload = payloads.get(application);
        if (payload == null)
            throw new MalformedSnapshotException("No " + description + " information for application '" + application + "'");
        return payload;
    }

}
