package com.yourmail.main;

import com.yourmail.Main;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.Options;

import javax.naming.ConfigurationException;
import java.util.Optional;

/**
 * Server runnable.
 *
 * <p>Takes the configuration directory as the only argument.
 */
public class ServerCLI {

    /**
     * Default configuration directory.
     */
    static final String DEFAULT_PATH = "cfg/";

    /**
     * Protected constructor.
     */
    private ServerCLI() {
        throw new IllegalStateException("Static class");
    }

    /**
     * Runs the server from the command line.
     *
     * @param main Main instance holding remaining arguments.
     */
    public static void main(Main main) {
        Options options = options();
        Optional<CommandLine> opt = main.parseArgs(options);
        if (opt.isEmpty()) {
            return;
        }

        CommandLine cmd = opt.get();
        if (cmd.hasOption("help")) {
            main.optionsUsage(options);
            return;
        }

        String path = cmd.getArgList().isEmpty() ? DEFAULT_PATH : cmd.getArgList().get(0);
        try {
            Server.run(path);
        } catch (ConfigurationException e) {
            main.log("Startup failed: " + e.getMessage());
        }
    }

    /**
     * CLI options.
     *
     * @return Options instance.
     */
    private static Options options() {
        Options options = new Options();
        options.addOption("h", "help", false, "Show usage");
        return options;
    }
}
