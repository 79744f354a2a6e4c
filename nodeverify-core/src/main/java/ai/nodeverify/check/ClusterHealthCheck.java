// Copyright Vespa.ai. Licensed under the terms of the Apache 2.0 license. See LICENSE in the project root.
package ai.nodeverify.check;

import ai.nodeverify.result.Check;
import ai.nodeverify.result.Result;
import ai.nodeverify.result.Severity;
import com.google.common.collect.ImmutableMap;

import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Checks that every reachable monitor reports the Ceph cluster as healthy.
 * It fails if any monitor reports a warning, an error or an unknown state, and if no monitor could be reached.
 *
 * @author nodeverify
 */
public class ClusterHealthCheck implements Check {

    public static final String NAME = "cluster health";

    private static final Logger log = Logger.getLogger(ClusterHealthCheck.class.getName());

    private final Map<String, String> healthByMonitor;

    /** @param healthByMonitor the health status text reported by each monitor unit */
    public ClusterHealthCheck(Map<String, String> healthByMonitor) {
        this.healthByMonitor = ImmutableMap.copyOf(healthByMonitor);
    }

    @Override
    public String name() { return NAME; }

    @Override
    public Result run() {
        if (healthByMonitor.isEmpty())
            return new Result(Severity.FAIL, "Ceph cluster status could not be obtained");

        Result result = new Result();
        healthByMonitor.forEach((monitor, health) -> {
            log.log(Level.FINE, () -> "Unit (" + monitor + "): Ceph cluster health '" + health + "'");
            if (health.contains("HEALTH_OK"))
                result.addPartial(Severity.OK, monitor + ": Ceph cluster is healthy");
            else if (health.contains("HEALTH_WARN"))
                result.addPartial(Severity.FAIL, monitor + ": Ceph cluster is in a warning state\n  " + health);
            else if (health.contains("HEALTH_ERR"))
                result.addPartial(Severity.FAIL, monitor + ": Ceph cluster is unhealthy\n  " + health);
            else
                result.addPartial(Severity.FAIL, monitor + ": Ceph cluster is in an unknown state\n  " + health);
        });
        return result;
    }

}
