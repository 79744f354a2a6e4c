// Copyright Vespa.ai. Licensed under the terms of the Apache 2.0 license. See LICENSE in the project root.
package ai.nodeverify.client;

import ai.nodeverify.snapshot.VerificationSnapshot;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verifyNoInteractions;

public class SnapshotReaderTest {

    @Test
    void reads_file() throws VerificationException {
        InputStream stdin = mock(InputStream.class);
        VerificationSnapshot snapshot = new SnapshotReader(stdin).read("src/test/resources/snapshots/safe-osd.json");
        assertEquals(Set.of("ceph-osd/0"), snapshot.targets());
        assertEquals(3, snapshot.units().size());
        verifyNoInteractions(stdin);
    }

    @Test
    void reads_standard_input() throws VerificationException {
        String json = "{\"units\": [{\"id\": \"ceph-mon/0\", \"application\": \"ceph-mon\", \"hostname\": \"h\"}], \"targets\": []}";
        VerificationSnapshot snapshot = new SnapshotReader(new ByteArrayInputStream(json.getBytes(StandardCharsets.UTF_8))).read("-");
        assertEquals(1, snapshot.units().size());
        assertTrue(snapshot.targets().isEmpty());
    }

    @Test
    void missing_file_is_reported() {
        VerificationException e = assertThrows(VerificationException.class,
                                               () -> new SnapshotReader(InputStream.nullInputStream()).read("no/such/file.json"));
        assertEquals("Snapshot file 'no/such/file.json' does not exist", e.getMessage());
    }

    @Test
    void malformed_snapshot_is_reported() {
        VerificationException e = assertThrows(VerificationException.class,
                                               () -> new SnapshotReader(InputStream.nullInputStream()).read("src/test/resources/snapshots/malformed.json"));
        assertTrue(e.getMessage().startsWith("Invalid snapshot in 'src/test/resources/snapshots/malformed.json': Missing field 'hostname'"),
                   e.getMessage());
    }

}
