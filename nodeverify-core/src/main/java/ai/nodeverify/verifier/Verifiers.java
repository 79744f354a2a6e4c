// Copyright Vespa.ai. Licensed under the terms of the Apache 2.0 license. See LICENSE in the project root.
package ai.nodeverify.verifier;

import ai.nodeverify.snapshot.VerificationSnapshot;

/**
 * Creates the verifier of a role.
 *
 * @author nodeverify
 */
public class Verifiers {

    private Verifiers() { }

    /**
     * Returns a verifier of the target units of the given snapshot.
     *
     * @throws IllegalArgumentException if the snapshot has no targets
     */
    public static Verifier create(Role role, VerificationSnapshot snapshot, VerificationPolicy policy) {
        if (snapshot.targets().isEmpty())
            throw new IllegalArgumentException("No units to verify");

        return switch (role) {
            case STORAGE_NODE -> new StorageNodeVerifier(snapshot, policy);
            case MONITOR -> new MonitorVerifier(snapshot, policy);
        };
    }

}
