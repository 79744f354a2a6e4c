// Copyright Vespa.ai. Licensed under the terms of the Apache 2.0 license. See LICENSE in the project root.
package ai.nodeverify.check;

import ai.nodeverify.result.Check;
import ai.nodeverify.result.Result;
import ai.nodeverify.result.Severity;
import ai.nodeverify.snapshot.MalformedSnapshotException;
import ai.nodeverify.snapshot.QuorumStatus;
import ai.nodeverify.snapshot.SnapshotParser;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;

import java.util.Map;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Checks that the monitors keep a majority quorum when the given hosts go away.
 * The status is checked per monitor unit, as the units may belong to different clusters.
 *
 * @author nodeverify
 */
public class QuorumCheck implements Check {

    public static final String NAME = "quorum";

    private static final Logger log = Logger.getLogger(QuorumCheck.class.getName());

    private final Map<String, String> statusPayloadByUnit;
    private final Set<String> removedHostnames;

    /**
     * @param statusPayloadByUnit the raw quorum status, in JSON, reported by each monitor unit
     * @param removedHostnames the host names of the machines which go away
     */
    public QuorumCheck(Map<String, String> statusPayloadByUnit, Set<String> removedHostnames) {
        this.statusPayloadByUnit = ImmutableMap.copyOf(statusPayloadByUnit);
        this.removedHostnames = ImmutableSet.copyOf(removedHostnames);
    }

    @Override
    public String name() { return NAME; }

    @Override
    public Result run() {
        if (statusPayloadByUnit.isEmpty())
            return new Result(Severity.FAIL, "Ceph-mon quorum status could not be obtained");

        Result result = new Result();
        statusPayloadByUnit.forEach((unit, payload) -> {
            try {
                QuorumStatus status = SnapshotParser.parseQuorumStatus(payload);
                if (status.losesQuorumWithout(removedHostnames))
                    result.addPartial(Severity.FAIL, "Rebooting or shutting down the unit " + unit + " will lose ceph-mon quorum");
            } catch (MalformedSnapshotException e) {
                log.log(Level.WARNING, "Failed to parse quorum status from unit " + unit + ": " + e.getMessage());
                result.addPartial(Severity.FAIL, "Failed to parse quorum status from unit " + unit + ".");
            }
        });
        return result.isEmpty() ? new Result(Severity.OK, "Ceph-mon quorum check passed.") : result;
    }

}
