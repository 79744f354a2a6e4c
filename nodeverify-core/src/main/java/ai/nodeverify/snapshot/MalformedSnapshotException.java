// Copyright Vespa.ai. Licensed under the terms of the Apache 2.0 license. See LICENSE in the project root.
package ai.nodeverify.snapshot;

/**
 * Thrown when diagnostic data does not have the expected shape.
 *
 * @author nodeverify
 */
public class MalformedSnapshotException extends RuntimeException {

    public MalformedSnapshotException(String message) {
        super(message);
    }

    public MalformedSnapshotException(String message, Throwable cause) {
        super(message, cause);
    }

}
