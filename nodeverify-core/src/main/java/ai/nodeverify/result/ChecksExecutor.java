// Copyright Vespa.ai. Licensed under the terms of the Apache 2.0 license. See LICENSE in the project root.
package ai.nodeverify.result;

import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Runs checks in order and folds their results into one.
 * <p>
 * A check which throws contributes a FAIL partial naming it, and the remaining checks still run,
 * so the returned result describes every problem found rather than only the first.
 *
 * @author nodeverify
 */
public class ChecksExecutor {

    private static final Logger log = Logger.getLogger(ChecksExecutor.class.getName());

    private ChecksExecutor() { }

    public static Result run(Check... checks) {
        return run(List.of(checks));
    }

    public static Result run(List<Check> checks) {
        Result result = new Result();
        for (Check check : checks)
            result = result.plus(runIsolated(check));
        return result;
    }

    private static Result runIsolated(Check check) {
        try {
            log.log(Level.FINE, () -> "Running " + check.name() + " check");
            Result result = check.run();
            if (result == null)
                throw new IllegalStateException("No result was returned");
            return result;
        } catch (RuntimeException e) {
            String message = check.name() + " check failed: " + messageOf(e);
            log.log(Level.WARNING, message);
            log.log(Level.FINE, "Failure of the " + check.name() + " check", e);
            return new Result(Severity.FAIL, message);
        }
    }

    /** Returns the messages of the exception and its causes, skipping repetitions */
    static String messageOf(Throwable t) {
        StringBuilder b = new StringBuilder();
        String lastMessage = null;
        for (; t != null; t = t.getCause()) {
            String message = messageOfSingle(t);
            if (message == null || message.equals(lastMessage)) continue;
            if (b.length() > 0) b.append(": ");
            b.append(message);
            lastMessage = message;
        }
        return b.toString();
    }

    private static String messageOfSingle(Throwable t) {
        String message = t.getMessage();
        Throwable cause = t.getCause();
        if (cause == null) return message == null ? t.getClass().getSimpleName() : message;
        if (message == null || message.equals(cause.getClass().getName() + ": " + cause.getMessage())) return null;
        return message;
    }

}
