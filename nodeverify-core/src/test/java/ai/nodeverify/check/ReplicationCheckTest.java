// Copyright Vespa.ai. Licensed under the terms of the Apache 2.0 license. See LICENSE in the project root.
package ai.nodeverify.check;

import ai.nodeverify.result.Result;
import ai.nodeverify.result.Severity;
import ai.nodeverify.snapshot.PoolReplication;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.OptionalInt;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;

public class ReplicationCheckTest {

    private static final Result passed = new Result(Severity.OK, "Minimum replica number check passed.");

    private static Result run(ReplicationCheck.Application... applications) {
        return new ReplicationCheck(List.of(applications)).run();
    }

    @Test
    void one_removal_within_margin_passes() {
        assertEquals(passed, run(new ReplicationCheck.Application("ceph-osd", List.of(new PoolReplication(3, 2)),
                                                                  Set.of("ceph-osd/0"), Set.of())));
    }

    @Test
    void inactive_units_count_against_the_margin() {
        assertEquals(new Result(Severity.FAIL, "The minimum number of replicas in 'ceph-osd' is 1 and it's not safe to " +
                                               "reboot/shutdown 1 units. 1 units are not active."),
                     run(new ReplicationCheck.Application("ceph-osd", List.of(new PoolReplication(3, 2)),
                                                          Set.of("ceph-osd/0"), Set.of("ceph-osd/1"))));
    }

    @Test
    void inactive_target_is_counted_once() {
        assertEquals(passed, run(new ReplicationCheck.Application("ceph-osd", List.of(new PoolReplication(3, 2)),
                                                                  Set.of("ceph-osd/0"), Set.of("ceph-osd/0"))));
    }

    @Test
    void least_tolerant_pool_decides() {
        ReplicationCheck.Application application = new ReplicationCheck.Application(
                "ceph-osd", List.of(new PoolReplication(4, 1), new PoolReplication(2, 1)), Set.of("ceph-osd/0", "ceph-osd/1"), Set.of());
        assertEquals(OptionalInt.of(1), application.minimumMargin());
        assertEquals(Severity.FAIL, run(application).severity());
    }

    @Test
    void application_without_pools_is_skipped() {
        ReplicationCheck.Application application = new ReplicationCheck.Application(
                "ceph-osd", List.of(), Set.of("ceph-osd/0", "ceph-osd/1"), Set.of("ceph-osd/2"));
        assertEquals(OptionalInt.empty(), application.minimumMargin());
        assertEquals(passed, run(application));
    }

    @Test
    void applications_are_checked_independently() {
        Result result = run(new ReplicationCheck.Application("ceph-osd", List.of(new PoolReplication(3, 2)), Set.of("ceph-osd/0"), Set.of()),
                            new ReplicationCheck.Application("ceph-osd-hdd", List.of(new PoolReplication(2, 2)), Set.of("ceph-osd-hdd/0"), Set.of()));
        assertEquals(new Result(Severity.FAIL, "The minimum number of replicas in 'ceph-osd-hdd' is 0 and it's not safe to " +
                                               "reboot/shutdown 1 units. 0 units are not active."),
                     result);
    }

}
