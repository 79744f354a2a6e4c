// Copyright Vespa.ai. Licensed under the terms of the Apache 2.0 license. See LICENSE in the project root.
package ai.nodeverify.client;

import ai.nodeverify.snapshot.AgentVersion;
import ai.nodeverify.topology.NodeType;
import ai.nodeverify.verifier.Operation;
import ai.nodeverify.verifier.Role;
import ai.nodeverify.verifier.VerificationPolicy;

/**
 * This class contains the program parameters.
 *
 * @author nodeverify
 */
public class ClientParameters {

    // Show help page if true
    public final boolean help;
    // Log diagnostic details if true
    public final boolean verbose;
    // The role of the units to verify
    public final Role role;
    // The operation to verify
    public final Operation operation;
    // Path of the snapshot document, or "-" for standard input
    public final String snapshotPath;
    // The failure domain of the replication rule
    public final NodeType failureDomain;
    // The lowest agent version accepted on monitor units
    public final AgentVersion minimumAgentVersion;

    public ClientParameters(boolean help, boolean verbose, Role role, Operation operation, String snapshotPath,
                            NodeType failureDomain, AgentVersion minimumAgentVersion) {
        this.help = help;
        this.verbose = verbose;
        this.role = role;
        this.operation = operation;
        this.snapshotPath = snapshotPath;
        this.failureDomain = failureDomain;
        this.minimumAgentVersion = minimumAgentVersion;
    }

    public VerificationPolicy policy() {
        return new VerificationPolicy(failureDomain, minimumAgentVersion);
    }

    public static class Builder {

        private boolean help;
        private boolean verbose;
        private Role role;
        private Operation operation = Operation.REBOOT;
        private String snapshotPath;
        private NodeType failureDomain = VerificationPolicy.defaults().failureDomain();
        private AgentVersion minimumAgentVersion = VerificationPolicy.defaults().minimumAgentVersion();

        public Builder setHelp(boolean help) {
            this.help = help;
            return this;
        }

        public Builder setVerbose(boolean verbose) {
            this.verbose = verbose;
            return this;
        }

        public Builder setRole(Role role) {
            this.role = role;
            return this;
        }

        public Builder setOperation(Operation operation) {
            this.operation = operation;
            return this;
        }

        public Builder setSnapshotPath(String snapshotPath) {
            this.snapshotPath = snapshotPath;
            return this;
        }

        public Builder setFailureDomain(NodeType failureDomain) {
            this.failureDomain = failureDomain;
            return this;
        }

        public Builder setMinimumAgentVersion(AgentVersion minimumAgentVersion) {
            this.minimumAgentVersion = minimumAgentVersion;
            return this;
        }

        public ClientParameters build() {
            return new ClientParameters(help, verbose, role, operation, snapshotPath, failureDomain, minimumAgentVersion);
        }

    }

}
