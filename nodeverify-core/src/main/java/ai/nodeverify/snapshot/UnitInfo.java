// Copyright Vespa.ai. Licensed under the terms of the Apache 2.0 license. See LICENSE in the project root.
package ai.nodeverify.snapshot;

import java.util.Optional;

import static java.util.Objects.requireNonNull;

/**
 * A deployed unit of an application, and the machine it runs on.
 *
 * @param id the unit id, e.g. "ceph-osd/0"
 * @param application the application the unit belongs to, e.g. "ceph-osd"
 * @param hostname the host name of the machine running the unit
 * @param workloadStatus the workload status reported by the unit, e.g. "active"
 * @param agentVersion the version of the agent on the machine, if known
 *
 * @author nodeverify
 */
public record UnitInfo(String id, String application, String hostname, String workloadStatus,
                       Optional<String> agentVersion) {

    public UnitInfo {
        requireNonNull(id, "id cannot be null");
        requireNonNull(application, "application cannot be null");
        requireNonNull(hostname, "hostname cannot be null");
        requireNonNull(workloadStatus, "workloadStatus cannot be null");
        requireNonNull(agentVersion, "agentVersion cannot be null");
    }

    public UnitInfo(String id, String application, String hostname, String workloadStatus) {
        this(id, application, hostname, workloadStatus, Optional.empty());
    }

    public boolean isActive() {
        return "active".equals(workloadStatus);
    }

}
