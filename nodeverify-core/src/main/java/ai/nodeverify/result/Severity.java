// Copyright Vespa.ai. Licensed under the terms of the Apache 2.0 license. See LICENSE in the project root.
package ai.nodeverify.result;

/**
 * The severity of a verification outcome. Declaration order is significant: a later constant dominates an earlier.
 *
 * @author nodeverify
 */
public enum Severity {

    OK,
    WARN,
    FAIL;

    /** Returns the dominant of this and the given severity */
    public Severity max(Severity other) {
        return compareTo(other) >= 0 ? this : other;
    }

}
