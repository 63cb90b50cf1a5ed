package com.yourmail;

import com.yourmail.main.ServerCLI;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Options;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.Arrays;
import java.util.LinkedList;
import java.util.List;
import java.util.Optional;

/**
 * Main runnable.
 *
 * <p>This implements the commandline --server option.
 * <p>Further CLI options are implemented within {@link ServerCLI}.
 */
public class Main {

    /**
     * Application jar name.
     */
    private static final String NAME = "yourmail.jar";

    /**
     * Application jar usage.
     */
    public static final String USAGE = "java -jar " + NAME;

    /**
     * Application description.
     */
    public static final String DESCRIPTION = "Mail server with session protocol, HTTP API and relay";

    private String[] args;

    /**
     * Main runnable.
     *
     * @param args String array.
     */
    public static void main(String[] args) {
        new Main(args);
    }

    /**
     * Constructs a new Main instance.
     *
     * @param args String array.
     */
    Main(String[] args) {
        this.args = args;

        // Parse options.
        Optional<CommandLine> opt = parseArgs(options());

        if (opt.isPresent() && opt.get().hasOption("server")) {
            purgeArg("--server");
            ServerCLI.main(this);
        }

        // Show usage.
        else if (opt.isPresent()) {
            optionsUsage(options());
        }
    }

    /**
     * CLI options.
     *
     * @return Options instance.
     */
    private Options options() {
        Options options = new Options();
        options.addOption(null, "server", false, "Run as server");
        return options;
    }

    /**
     * CLI usage.
     *
     * @param options Options instance.
     */
    public void optionsUsage(Options options) {
        log(USAGE);
        log(" " + DESCRIPTION);
        log("");

        StringWriter out = new StringWriter();
        try (PrintWriter pw = new PrintWriter(out)) {
            HelpFormatter formatter = new HelpFormatter();
            formatter.printHelp(pw, formatter.getWidth(), " ", "", options,
                    formatter.getLeftPadding(), formatter.getDescPadding(), "", true);
        }

        log(out.toString());
    }

    /**
     * Parser for CLI arguments.
     *
     * @param options Options instance.
     * @return Optional of CommandLine.
     */
    public Optional<CommandLine> parseArgs(Options options) {
        CommandLine cmd = null;

        try {
            cmd = new DefaultParser().parse(options, args, true);
        } catch (Exception e) {
            log("Options error: " + e.getMessage());
            log("");
            optionsUsage(options);
        }

        return Optional.ofNullable(cmd);
    }

    /**
     * Remove entry from string array.
     *
     * @param entry Entry string.
     */
    private void purgeArg(String entry) {
        List<String> list = new LinkedList<>(Arrays.asList(args));
        list.remove(entry);
        args = list.toArray(new String[0]);
    }

    /**
     * Gets args.
     *
     * @return String array.
     */
    public String[] getArgs() {
        return args;
    }

    /**
     * Logging wrapper.
     *
     * @param string String.
     */
    public void log(String string) {
        System.out.println(string);
    }
}
