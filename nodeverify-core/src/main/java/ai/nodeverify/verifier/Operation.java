// Copyright Vespa.ai. Licensed under the terms of the Apache 2.0 license. See LICENSE in the project root.
package ai.nodeverify.verifier;

import java.util.Arrays;
import java.util.stream.Collectors;

/**
 * A lifecycle operation which may be verified before it is run.
 *
 * @author nodeverify
 */
public enum Operation {

    REBOOT("reboot"),
    SHUTDOWN("shutdown");

    private final String value;

    Operation(String value) {
        this.value = value;
    }

    public String value() { return value; }

    public static Operation fromValue(String value) {
        return Arrays.stream(values())
                     .filter(operation -> operation.value.equals(value))
                     .findFirst()
                     .orElseThrow(() -> new IllegalArgumentException(
                             "Unknown operation '" + value + "', must be one of " +
                             Arrays.stream(values()).map(Operation::value).collect(Collectors.joining(", "))));
    }

    @Override
    public String toString() { return value; }

}
