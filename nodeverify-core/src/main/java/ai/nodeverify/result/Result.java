// Copyright Vespa.ai. Licensed under the terms of the Apache 2.0 license. See LICENSE in the project root.
package ai.nodeverify.result;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import static java.util.Objects.requireNonNull;

/**
 * The graded outcome of one or more verification checks, as an ordered list of partial results.
 * <p>
 * The severity of a result is the dominant severity among its partials, and {@link Severity#OK} when it has none.
 * Results combine by concatenating their partials, so combination is associative and an empty result is the identity.
 * <p>
 * The only mutator is {@link #addPartial}. A result is meant to be filled by a single check and then only combined.
 *
 * @author nodeverify
 */
public class Result {

    private final List<Partial> partials = new ArrayList<>();

    /** Creates an empty result, which is successful with severity OK */
    public Result() { }

    /** Creates a result with a single partial */
    public Result(Severity severity, String message) {
        addPartial(severity, message);
    }

    private Result(List<Partial> partials) {
        this.partials.addAll(partials);
    }

    /** Appends a partial result, and returns this for chaining */
    public Result addPartial(Severity severity, String message) {
        partials.add(new Partial(severity, message));
        return this;
    }

    /** Returns a new result holding the partials of this followed by those of the given result */
    public Result plus(Result other) {
        List<Partial> combined = new ArrayList<>(partials.size() + other.partials.size());
        combined.addAll(partials);
        combined.addAll(other.partials);
        return new Result(combined);
    }

    /** Returns a new result holding the partials of a followed by those of b */
    public static Result combine(Result a, Result b) {
        return a.plus(b);
    }

    /** Returns the dominant severity of the partials, or OK if there are none */
    public Severity severity() {
        Severity severity = Severity.OK;
        for (Partial partial : partials)
            severity = severity.max(partial.severity());
        return severity;
    }

    /** Returns whether no partial has severity FAIL */
    public boolean success() {
        return severity() != Severity.FAIL;
    }

    /** Returns whether no partial has been added to this */
    public boolean isEmpty() {
        return partials.isEmpty();
    }

    /** Returns an unmodifiable view of the partials, in the order they were added */
    public List<Partial> partials() {
        return List.copyOf(partials);
    }

    /** Returns a multi-line, human readable summary of this */
    public String format() {
        StringBuilder b = new StringBuilder("Checks:\n");
        for (Partial partial : partials)
            b.append(partial).append('\n');
        b.append('\n').append("Overall result: ").append(severity());
        switch (severity()) {
            case OK -> b.append(" (All checks passed)");
            case WARN -> b.append(" (Checks passed with warnings)");
            case FAIL -> b.append(" (Checks failed)");
        }
        return b.toString();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return partials.equals(((Result) o).partials);
    }

    @Override
    public int hashCode() {
        return Objects.hash(partials);
    }

    @Override
    public String toString() {
        return severity() + " " + partials;
    }

    /** A single graded message contributing to a result */
    public record Partial(Severity severity, String message) {

        public Partial {
            requireNonNull(severity, "severity cannot be null");
            requireNonNull(message, "message cannot be null");
        }

        @Override
        public String toString() {
            return "[" + severity + "] " + message;
        }

    }

}
