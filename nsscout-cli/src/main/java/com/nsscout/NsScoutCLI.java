package com.nsscout;

import ch.qos.logback.classic.Level;
import com.nsscout.cli.DocCommand;
import com.nsscout.cli.ListCommand;
import com.nsscout.cli.PathCommand;
import com.nsscout.cli.ScanCommand;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

/**
 * Main CLI entry point for NsScout.
 *
 * <p>NsScout finds Clojure namespace declarations in source directories and jar files
 * without loading any code.
 *
 * <p><b>Commands:</b>
 * <ul>
 *   <li>{@code list} - List namespaces on a classpath</li>
 *   <li>{@code scan} - Scan classpath entries and report per-entry statistics</li>
 *   <li>{@code path} - Print the source path of a namespace</li>
 *   <li>{@code doc} - Print the docstring of a source file's namespace</li>
 * </ul>
 *
 * <p><b>Global Options:</b>
 * <ul>
 *   <li>{@code -v, --verbose} - Enable verbose output</li>
 *   <li>{@code -q, --quiet} - Suppress all output except errors</li>
 *   <li>{@code --help} - Show help information</li>
 *   <li>{@code --version} - Show version information</li>
 * </ul>
 *
 * <p><b>Example Usage:</b>
 * <pre>{@code
 * # Namespaces under my.app in src and a dependency jar
 * nsscout list --classpath src:lib/dep.jar --prefix my.app
 *
 * # Every ns and in-ns form, with debug logging
 * nsscout -v list --all --forms
 *
 * # Where does my-app.core live?
 * nsscout path my-app.core
 * }</pre>
 *
 * <p><b>Exit codes:</b> 0 on success, 1 when a scan fails, 2 on usage errors.
 */
@Command(
    name = "nsscout",
    mixinStandardHelpOptions = true,
    version = "NsScout 1.0.0-SNAPSHOT",
    description = "Finds Clojure namespace declarations in directories and jar files",
    subcommands = {
        ListCommand.class,
        ScanCommand.class,
        PathCommand.class,
        DocCommand.class
    }
)
public class NsScoutCLI implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(NsScoutCLI.class);

    @Option(names = {"-v", "--verbose"}, description = "Enable verbose output (DEBUG level)")
    private boolean verbose;

    @Option(names = {"-q", "--quiet"}, description = "Suppress all output except errors")
    private boolean quiet;

    @Override
    public void run() {
        if (quiet) {
            return; // Suppress banner in quiet mode
        }

        System.out.println("NsScout - Clojure namespace finder");
        System.out.println("Version: 1.0.0-SNAPSHOT");
        System.out.println();
        System.out.println("Use 'nsscout --help' to see available commands");
        System.out.println("Use 'nsscout <command> --help' for command-specific help");
    }

    /**
     * Configures logging level based on global options.
     */
    void configureLogging() {
        ch.qos.logback.classic.Logger root =
            (ch.qos.logback.classic.Logger) LoggerFactory.getLogger(Logger.ROOT_LOGGER_NAME);

        if (quiet) {
            root.setLevel(Level.ERROR);
        } else if (verbose) {
            root.setLevel(Level.DEBUG);
        } else {
            root.setLevel(Level.INFO);
        }
        log.debug("Logging configured (verbose={}, quiet={})", verbose, quiet);
    }

    /**
     * Builds the command line; global options are applied before the selected
     * subcommand runs.
     *
     * @return configured command line
     */
    public static CommandLine commandLine() {
        NsScoutCLI cli = new NsScoutCLI();
        CommandLine commandLine = new CommandLine(cli);
        commandLine.setExecutionStrategy(parseResult -> {
            cli.configureLogging();
            return new CommandLine.RunLast().execute(parseResult);
        });
        return commandLine;
    }

    /**
     * Main entry point.
     *
     * @param args command-line arguments
     */
    public static void main(String[] args) {
        int exitCode = commandLine().execute(args);
        System.exit(exitCode);
    }
}
