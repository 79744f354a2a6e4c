// Copyright Vespa.ai. Licensed under the terms of the Apache 2.0 license. See LICENSE in the project root.
package ai.nodeverify.check;

import ai.nodeverify.result.Check;
import ai.nodeverify.result.Result;
import ai.nodeverify.result.Severity;
import ai.nodeverify.snapshot.AgentVersion;
import ai.nodeverify.snapshot.UnitInfo;
import com.google.common.collect.ImmutableList;

import java.util.List;

import static java.util.Objects.requireNonNull;

/**
 * Checks that the machine agent of every unit is at least the given version.
 *
 * @author nodeverify
 */
public class VersionCheck implements Check {

    public static final String NAME = "agent version";

    /** The first agent version reporting the host name of machines */
    public static final AgentVersion HOSTNAME_SUPPORT = new AgentVersion(2, 8, 10);

    private final List<UnitInfo> units;
    private final AgentVersion minimum;

    public VersionCheck(List<UnitInfo> units, AgentVersion minimum) {
        this.units = ImmutableList.copyOf(units);
        this.minimum = requireNonNull(minimum);
    }

    @Override
    public String name() { return NAME; }

    @Override
    public Result run() {
        Result result = new Result();
        for (UnitInfo unit : units) {
            if (unit.agentVersion().isEmpty()) {
                result.addPartial(Severity.FAIL, "Unable to determine the agent version of unit " + unit.id() +
                                                 ". Minimum required version is " + minimum + ".");
                continue;
            }
            try {
                AgentVersion version = AgentVersion.fromString(unit.agentVersion().get());
                if (version.isBefore(minimum))
                    result.addPartial(Severity.FAIL, "Unit " + unit.id() + " runs agent version " + version +
                                                     ". Minimum required version is " + minimum + ".");
            } catch (IllegalArgumentException e) {
                result.addPartial(Severity.FAIL, "Unit " + unit.id() + " reports an invalid agent version: " + e.getMessage());
            }
        }
        return result.isEmpty() ? new Result(Severity.OK, "Minimum agent version check passed.") : result;
    }

}
