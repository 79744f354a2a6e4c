// Copyright Vespa.ai. Licensed under the terms of the Apache 2.0 license. See LICENSE in the project root.
package ai.nodeverify.snapshot;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class VerificationSnapshotTest {

    private static final UnitInfo osd0 = new UnitInfo("ceph-osd/0", "ceph-osd", "host.0", "active");
    private static final UnitInfo osd1 = new UnitInfo("ceph-osd/1", "ceph-osd", "host.1", "blocked");
    private static final UnitInfo fast0 = new UnitInfo("ceph-osd-fast/0", "ceph-osd-fast", "host.2", "active");

    @Test
    void targets_are_selected_from_units() {
        VerificationSnapshot snapshot = VerificationSnapshot.builder()
                                                            .addUnit(osd0).addUnit(osd1).addUnit(fast0)
                                                            .addTarget("ceph-osd-fast/0").addTarget("ceph-osd/0")
                                                            .build();
        assertEquals(List.of(osd0, fast0), snapshot.targetUnits());
        assertEquals(Set.of("ceph-osd", "ceph-osd-fast"), snapshot.targetApplications());
        assertEquals(List.of(osd0), snapshot.targetUnitsOf("ceph-osd"));
        assertEquals(List.of(osd0, osd1), snapshot.unitsOf("ceph-osd"));
        assertEquals(Optional.of(osd1), snapshot.unit("ceph-osd/1"));
        assertEquals(Optional.empty(), snapshot.unit("ceph-osd/2"));
    }

    @Test
    void unit_status() {
        assertTrue(osd0.isActive());
        assertFalse(osd1.isActive());
    }

    @Test
    void invalid_snapshots_are_rejected() {
        assertThrows(IllegalArgumentException.class,
                     () -> VerificationSnapshot.builder().addUnit(osd0).addTarget("ceph-osd/1").build());
        assertThrows(IllegalArgumentException.class,
                     () -> VerificationSnapshot.builder().addUnit(osd0).addUnit(osd0).build());
        assertThrows(IllegalArgumentException.class,
                     () -> VerificationSnapshot.builder().setPools("ceph-osd", "[]").setPools("ceph-osd", "[]").build());
    }

}
