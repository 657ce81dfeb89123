package com.nsscout.cli;

import com.nsscout.core.util.NamespacePaths;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.util.concurrent.Callable;

/**
 * Command to print the classpath-relative source path of a namespace.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * nsscout path my-app.core            # my_app/core.clj
 * nsscout path my-app.core -e cljc    # my_app/core.cljc
 * }</pre>
 */
@Command(
    name = "path",
    description = "Print the source path of a namespace",
    mixinStandardHelpOptions = true
)
public class PathCommand implements Callable<Integer> {

    @Spec
    CommandSpec spec;

    @Parameters(index = "0", paramLabel = "NAMESPACE", description = "Namespace name, e.g. my-app.core")
    private String namespace;

    @Option(
        names = {"-e", "--extension"},
        description = "File extension (default: ${DEFAULT-VALUE})",
        defaultValue = NamespacePaths.DEFAULT_EXTENSION
    )
    private String extension;

    @Override
    public Integer call() {
        spec.commandLine().getOut().println(NamespacePaths.pathFor(namespace, extension));
        spec.commandLine().getOut().flush();
        return 0;
    }
}
