package com.nsscout.cli;

import com.nsscout.core.NamespaceFinder;
import com.nsscout.core.model.NamespaceForm;
import com.nsscout.core.scanner.NamespaceScanException;
import com.nsscout.core.util.NamespaceDocs;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.nio.file.Path;
import java.util.Optional;
import java.util.concurrent.Callable;

/**
 * Command to print the docstring of a source file's namespace.
 *
 * <p>The docstring is taken from the file's first namespace form without evaluating
 * anything. Nothing is printed when the namespace has no docstring.
 */
@Command(
    name = "doc",
    description = "Print the docstring of a source file's namespace",
    mixinStandardHelpOptions = true
)
public class DocCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(DocCommand.class);

    @Spec
    CommandSpec spec;

    @Parameters(index = "0", paramLabel = "FILE", description = "Clojure source file")
    private Path file;

    @Override
    public Integer call() {
        try {
            Optional<NamespaceForm> form = NamespaceFinder.create().namespaceFormInFile(file, false);
            if (form.isEmpty()) {
                spec.commandLine().getErr().println("✗ No namespace form in " + file);
                return 1;
            }
            NamespaceDocs.docString(form.get()).ifPresent(spec.commandLine().getOut()::println);
            spec.commandLine().getOut().flush();
            return 0;
        } catch (NamespaceScanException e) {
            log.debug("Doc lookup failed", e);
            spec.commandLine().getErr().println("✗ " + e.getMessage());
            return 1;
        }
    }
}
