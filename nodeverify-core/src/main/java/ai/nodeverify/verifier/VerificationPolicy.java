// Copyright Vespa.ai. Licensed under the terms of the Apache 2.0 license. See LICENSE in the project root.
package ai.nodeverify.verifier;

import ai.nodeverify.check.VersionCheck;
import ai.nodeverify.snapshot.AgentVersion;
import ai.nodeverify.topology.NodeType;

import static java.util.Objects.requireNonNull;

/**
 * The policy data verifiers are parameterized with.
 *
 * @param failureDomain the failure domain of the replication rule of the storage pools
 * @param minimumAgentVersion the lowest agent version monitor units may run
 *
 * @author nodeverify
 */
public record VerificationPolicy(NodeType failureDomain, AgentVersion minimumAgentVersion) {

    public VerificationPolicy {
        requireNonNull(failureDomain, "failureDomain cannot be null");
        requireNonNull(minimumAgentVersion, "minimumAgentVersion cannot be null");
    }

    /** Returns the policy of replicas on distinct hosts, and agents reporting host names */
    public static VerificationPolicy defaults() {
        return new VerificationPolicy(NodeType.HOST, VersionCheck.HOSTNAME_SUPPORT);
    }

    public VerificationPolicy withFailureDomain(NodeType failureDomain) {
        return new VerificationPolicy(failureDomain, minimumAgentVersion);
    }

    public VerificationPolicy withMinimumAgentVersion(AgentVersion minimumAgentVersion) {
        return new VerificationPolicy(failureDomain, minimumAgentVersion);
    }

}
