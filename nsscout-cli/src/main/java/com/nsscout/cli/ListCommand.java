package com.nsscout.cli;

import com.nsscout.core.NamespaceFinder;
import com.nsscout.core.config.ProjectConfig;
import com.nsscout.core.model.NamespaceForm;
import com.nsscout.core.scanner.ClasspathResolver;
import com.nsscout.core.scanner.NamespaceScanException;
import com.nsscout.core.scanner.ScanContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * Command to list the namespaces on a classpath.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * # Namespaces on the classpath given in nsscout.yaml, or the JVM classpath
 * nsscout list
 *
 * # Namespaces under my.app in src and a jar, printing whole forms
 * nsscout list --classpath src:lib/dep.jar --prefix my.app --forms
 * }</pre>
 */
@Command(
    name = "list",
    description = "List namespaces found on a classpath",
    mixinStandardHelpOptions = true
)
public class ListCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ListCommand.class);

    @Spec
    CommandSpec spec;

    @Mixin
    ScanOptions scanOptions;

    @Option(
        names = {"--classpath", "--cp"},
        description = "Classpath to scan (default: configured classpath, else the JVM classpath)"
    )
    private String classpath;

    @Option(
        names = {"-f", "--forms"},
        description = "Print whole namespace forms instead of names"
    )
    private boolean forms;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        try {
            ProjectConfig config = scanOptions.loadConfig();
            ScanContext context = scanOptions.toScanContext(config);
            List<Path> entries = classpath != null
                ? ClasspathResolver.toPaths(classpath)
                : config.classpathEntries();
            log.debug("Listing namespaces in {} classpath entries", entries.size());

            NamespaceFinder finder = new NamespaceFinder(context.readerConfig());
            List<NamespaceForm> found = finder.namespaceFormsOnClasspath(entries, context);
            for (NamespaceForm form : found) {
                out.println(forms ? form.toString() : form.namespace());
            }
            out.flush();
            return 0;
        } catch (NamespaceScanException e) {
            log.debug("List failed", e);
            spec.commandLine().getErr().println("✗ " + e.getMessage());
            return 1;
        } catch (IllegalArgumentException e) {
            spec.commandLine().getErr().println("✗ Invalid configuration: " + e.getMessage());
            return 1;
        }
    }
}
