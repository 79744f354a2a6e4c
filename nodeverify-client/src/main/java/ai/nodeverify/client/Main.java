// Copyright Vespa.ai. Licensed under the terms of the Apache 2.0 license. See LICENSE in the project root.
package ai.nodeverify.client;

import ai.nodeverify.result.Result;
import ai.nodeverify.snapshot.VerificationSnapshot;
import ai.nodeverify.verifier.Verifier;
import ai.nodeverify.verifier.Verifiers;

import java.io.InputStream;
import java.io.PrintStream;
import java.io.PrintWriter;
import java.util.logging.ConsoleHandler;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Main application class. Exits with status 0 if the operation is safe, 1 if it is not,
 * and 2 if the verification could not be run.
 *
 * @author nodeverify
 */
public class Main {

    static final int SAFE = 0;
    static final int UNSAFE = 1;
    static final int ERROR = 2;

    private Main() {
    }

    public static void main(String[] args) {
        System.exit(run(args, System.in, System.out, System.err));
    }

    static int run(String[] args, InputStream in, PrintStream out, PrintStream err) {
        Logger.getLogger("").setLevel(Level.WARNING);
        CommandLineOptions options = new CommandLineOptions();
        ClientParameters params;
        try {
            params = options.parseCommandLineArguments(args);
        } catch (IllegalArgumentException e) {
            err.printf("Failed to parse command line arguments: %s.\n", e.getMessage());
            return ERROR;
        }
        if (params.help) {
            options.printHelp(new PrintWriter(out, true));
            return SAFE;
        }
        if (params.verbose)
            enableVerboseLogging();

        try {
            VerificationSnapshot snapshot = new SnapshotReader(in).read(params.snapshotPath);
            Verifier verifier = Verifiers.create(params.role, snapshot, params.policy());
            Result result = verifier.verify(params.operation);
            out.println(result.format());
            return result.success() ? SAFE : UNSAFE;
        } catch (VerificationException | IllegalArgumentException e) {
            err.println(e.getMessage());
            return ERROR;
        }
    }

    private static void enableVerboseLogging() {
        Logger root = Logger.getLogger("");
        root.setLevel(Level.FINE);
        for (Handler handler : root.getHandlers())
            if (handler instanceof ConsoleHandler)
                handler.setLevel(Level.FINE);
    }

}
