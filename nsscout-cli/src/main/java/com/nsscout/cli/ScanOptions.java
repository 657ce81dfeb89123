package com.nsscout.cli;

import com.nsscout.core.config.ConfigLoader;
import com.nsscout.core.config.ProjectConfig;
import com.nsscout.core.reader.ExtractionMode;
import com.nsscout.core.reader.ReaderConfig;
import com.nsscout.core.scanner.ScanContext;
import picocli.CommandLine.Option;

import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Scan options shared by the {@code list} and {@code scan} commands.
 *
 * <p>Options given on the command line override {@code nsscout.yaml}.
 */
public class ScanOptions {

    @Option(
        names = {"-p", "--prefix"},
        description = "Only namespaces whose name starts with this prefix"
    )
    String prefix;

    @Option(
        names = {"--strict"},
        description = "Fail on unreadable source files instead of skipping them"
    )
    boolean strict;

    @Option(
        names = {"-a", "--all"},
        description = "Read every ns/in-ns form of each file, not just the first"
    )
    boolean all;

    @Option(
        names = {"-c", "--config"},
        description = "Configuration file (default: nsscout.yaml when present)"
    )
    Path configPath;

    /**
     * Loads the configuration file: the one given with {@code --config}, else
     * {@code nsscout.yaml} in the working directory if there is one.
     *
     * @return project configuration
     */
    ProjectConfig loadConfig() {
        if (configPath != null) {
            return ConfigLoader.load(configPath);
        }
        Path defaultPath = Path.of(ConfigLoader.DEFAULT_FILE_NAME);
        return Files.exists(defaultPath) ? ConfigLoader.load(defaultPath) : ProjectConfig.defaults();
    }

    /**
     * Builds the scan context from the configuration and the command-line flags.
     *
     * @param config project configuration
     * @return scan context
     */
    ScanContext toScanContext(ProjectConfig config) {
        ScanContext context = config.toScanContext(ReaderConfig.environment());
        if (prefix != null) {
            context = context.withPrefix(prefix);
        }
        if (strict) {
            context = context.strict();
        }
        if (all) {
            context = context.withExtractionMode(ExtractionMode.ALL);
        }
        return context;
    }
}
