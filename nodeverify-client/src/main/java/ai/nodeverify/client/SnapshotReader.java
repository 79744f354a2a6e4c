// Copyright Vespa.ai. Licensed under the terms of the Apache 2.0 license. See LICENSE in the project root.
package ai.nodeverify.client;

import ai.nodeverify.snapshot.MalformedSnapshotException;
import ai.nodeverify.snapshot.SnapshotParser;
import ai.nodeverify.snapshot.VerificationSnapshot;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;

/**
 * Reads the snapshot of a cluster from a file or standard input.
 *
 * @author nodeverify
 */
public class SnapshotReader {

    private final InputStream stdin;

    public SnapshotReader(InputStream stdin) {
        this.stdin = stdin;
    }

    public VerificationSnapshot read(String path) throws VerificationException {
        try {
            if ("-".equals(path))
                return SnapshotParser.parseSnapshot(stdin);

            try (InputStream in = Files.newInputStream(Path.of(path))) {
                return SnapshotParser.parseSnapshot(in);
            }
        } catch (NoSuchFileException e) {
            throw new VerificationException("Snapshot file '" + path + "' does not exist", e);
        } catch (IOException e) {
            throw new VerificationException("Failed to read snapshot from '" + path + "': " + e.getMessage(), e);
        } catch (MalformedSnapshotException e) {
            throw new VerificationException("Invalid snapshot in '" + path + "': " + e.getMessage(), e);
        }
    }

}
