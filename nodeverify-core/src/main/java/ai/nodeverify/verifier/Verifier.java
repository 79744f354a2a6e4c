// Copyright Vespa.ai. Licensed under the terms of the Apache 2.0 license. See LICENSE in the project root.
package ai.nodeverify.verifier;

import ai.nodeverify.result.Result;

/**
 * Verifies whether a lifecycle operation is safe to run on a set of units.
 *
 * @author nodeverify
 */
public interface Verifier {

    /** Returns the outcome of verifying that the target units can be rebooted */
    Result verifyReboot();

    /** Returns the outcome of verifying that the target units can be shut down */
    Result verifyShutdown();

    default Result verify(Operation operation) {
        return switch (operation) {
            case REBOOT -> verifyReboot();
            case SHUTDOWN -> verifyShutdown();
        };
    }

}
