// Copyright Vespa.ai. Licensed under the terms of the Apache 2.0 license. See LICENSE in the project root.
package ai.nodeverify.verifier;

import ai.nodeverify.check.ClusterHealthCheck;
import ai.nodeverify.check.QuorumCheck;
import ai.nodeverify.check.VersionCheck;
import ai.nodeverify.result.Check;
import ai.nodeverify.result.ChecksExecutor;
import ai.nodeverify.result.Result;
import ai.nodeverify.snapshot.UnitInfo;
import ai.nodeverify.snapshot.VerificationSnapshot;

import java.util.Set;
import java.util.stream.Collectors;

import static java.util.Objects.requireNonNull;

/**
 * Verifies that monitor units can be taken down. The agents of the units must first be recent enough to
 * report host names, as the quorum is computed from them; if they are not, no other check is run.
 * Otherwise the monitors must keep their quorum, and the cluster must be healthy.
 *
 * @author nodeverify
 */
public class MonitorVerifier implements Verifier {

    private final VerificationSnapshot snapshot;
    private final VerificationPolicy policy;

    public MonitorVerifier(VerificationSnapshot snapshot, VerificationPolicy policy) {
        this.snapshot = requireNonNull(snapshot);
        this.policy = requireNonNull(policy);
    }

    @Override
    public Result verifyReboot() {
        Result version = ChecksExecutor.run(new VersionCheck(snapshot.targetUnits(), policy.minimumAgentVersion()));
        if ( ! version.success())
            return version;

        return version.plus(ChecksExecutor.run(Check.of(QuorumCheck.NAME, () -> new QuorumCheck(snapshot.quorumPayloads(), removedHostnames()).run()),
                                               new ClusterHealthCheck(snapshot.health())));
    }

    @Override
    public Result verifyShutdown() {
        return verifyReboot();
    }

    private Set<String> removedHostnames() {
        return snapshot.targetUnits().stream().map(UnitInfo::hostname).collect(Collectors.toSet());
    }

}
