// Copyright Vespa.ai. Licensed under the terms of the Apache 2.0 license. See LICENSE in the project root.
package ai.nodeverify.client;

/**
 * Exception class used when a verification cannot be set up, e.g. because the snapshot is unreadable.
 *
 * @author nodeverify
 */
public class VerificationException extends Exception {

    public VerificationException(String message) {
        super(message);
    }

    public VerificationException(String message, Throwable cause) {
        super(message, cause);
    }

}
