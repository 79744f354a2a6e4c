// Copyright Vespa.ai. Licensed under the terms of the Apache 2.0 license. See LICENSE in the project root.
package ai.nodeverify.client;

import ai.nodeverify.snapshot.AgentVersion;
import ai.nodeverify.topology.NodeType;
import ai.nodeverify.verifier.Operation;
import ai.nodeverify.verifier.Role;
import ai.nodeverify.verifier.VerificationPolicy;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.CommandLineParser;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Option;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;

import java.io.PrintWriter;

/**
 * Responsible for parsing the command line arguments and presenting the help page
 *
 * @author nodeverify
 */
public class CommandLineOptions {

    private static final String HELP_OPTION = "help";
    private static final String VERBOSE_OPTION = "verbose";
    private static final String ROLE_OPTION = "role";
    private static final String OPERATION_OPTION = "operation";
    private static final String SNAPSHOT_OPTION = "snapshot";
    private static final String FAILURE_DOMAIN_OPTION = "failure-domain";
    private static final String MIN_AGENT_VERSION_OPTION = "min-agent-version";

    private final Options options = createOptions();

    private static Options createOptions() {
        Options options = new Options();

        options.addOption(Option.builder("h")
                .hasArg(false)
                .desc("Show this syntax page.")
                .longOpt(HELP_OPTION)
                .build());

        options.addOption(Option.builder("v")
                .hasArg(false)
                .desc("Log details of the checks to standard error.")
                .longOpt(VERBOSE_OPTION)
                .build());

        options.addOption(Option.builder("r")
                .hasArg(true)
                .desc("Role of the units to verify: '" + Role.STORAGE_NODE + "' or '" + Role.MONITOR + "'.")
                .argName("role")
                .longOpt(ROLE_OPTION)
                .build());

        options.addOption(Option.builder("o")
                .hasArg(true)
                .desc("Operation to verify: '" + Operation.REBOOT + "' or '" + Operation.SHUTDOWN +
                      "'. If not provided, '" + Operation.REBOOT + "' is used.")
                .argName("operation")
                .longOpt(OPERATION_OPTION)
                .build());

        options.addOption(Option.builder("s")
                .hasArg(true)
                .desc("Snapshot document with the units and diagnostic data of the cluster, or '-' to read it from standard input.")
                .argName("file")
                .longOpt(SNAPSHOT_OPTION)
                .build());

        options.addOption(Option.builder("f")
                .hasArg(true)
                .desc("Failure domain of the replication rule. If not provided, '" +
                      VerificationPolicy.defaults().failureDomain() + "' is used.")
                .argName("type")
                .longOpt(FAILURE_DOMAIN_OPTION)
                .build());

        options.addOption(Option.builder("m")
                .hasArg(true)
                .desc("Lowest agent version accepted on monitor units. If not provided, '" +
                      VerificationPolicy.defaults().minimumAgentVersion() + "' is used.")
                .argName("version")
                .longOpt(MIN_AGENT_VERSION_OPTION)
                .build());

        return options;
    }

    public void printHelp() {
        printHelp(new PrintWriter(System.out, true));
    }

    public void printHelp(PrintWriter out) {
        HelpFormatter formatter = new HelpFormatter();
        formatter.printHelp(out, formatter.getWidth(), "nodeverify [options]",
                            "Verify that it is safe to reboot or shut down the target units of a Ceph cluster.",
                            options, formatter.getLeftPadding(), formatter.getDescPadding(), "", false);
        out.flush();
    }

    public ClientParameters parseCommandLineArguments(String[] args) {
        try {
            CommandLineParser clp = new DefaultParser();
            CommandLine cl = clp.parse(options, args);
            ClientParameters.Builder builder = new ClientParameters.Builder();

            builder.setHelp(cl.hasOption(HELP_OPTION));
            builder.setVerbose(cl.hasOption(VERBOSE_OPTION));
            if (cl.hasOption(HELP_OPTION))
                return builder.build();

            if ( ! cl.hasOption(ROLE_OPTION))
                throw new IllegalArgumentException("Must specify the role of the units with --" + ROLE_OPTION);
            if ( ! cl.hasOption(SNAPSHOT_OPTION))
                throw new IllegalArgumentException("Must specify a snapshot with --" + SNAPSHOT_OPTION);

            builder.setRole(Role.fromApplicationName(cl.getOptionValue(ROLE_OPTION)));
            builder.setSnapshotPath(cl.getOptionValue(SNAPSHOT_OPTION));
            if (cl.hasOption(OPERATION_OPTION))
                builder.setOperation(Operation.fromValue(cl.getOptionValue(OPERATION_OPTION)));
            if (cl.hasOption(FAILURE_DOMAIN_OPTION))
                builder.setFailureDomain(NodeType.fromName(cl.getOptionValue(FAILURE_DOMAIN_OPTION)));
            if (cl.hasOption(MIN_AGENT_VERSION_OPTION))
                builder.setMinimumAgentVersion(AgentVersion.fromString(cl.getOptionValue(MIN_AGENT_VERSION_OPTION)));

            return builder.build();
        } catch (ParseException e) {
            throw new IllegalArgumentException(e.getMessage(), e);
        }
    }

}
