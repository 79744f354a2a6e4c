// Copyright Vespa.ai. Licensed under the terms of the Apache 2.0 license. See LICENSE in the project root.
package ai.nodeverify.result;

import java.util.function.Supplier;

/**
 * A named verification step producing a {@link Result}.
 *
 * @author nodeverify
 */
public interface Check {

    /** The name identifying this check in results and logs */
    String name();

    /** Evaluates this check. Unsafe conditions are reported in the result, not thrown. */
    Result run();

    /** Returns a check with the given name which evaluates the given supplier */
    static Check of(String name, Supplier<Result> evaluation) {
        return new Check() {
            @Override public String name() { return name; }
            @Override public Result run() { return evaluation.get(); }
            @Override public String toString() { return "check '" + name + "'"; }
        };
    }

}
