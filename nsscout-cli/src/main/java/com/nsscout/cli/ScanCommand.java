package com.nsscout.cli;

import com.nsscout.core.NamespaceFinder;
import com.nsscout.core.model.NamespaceForm;
import com.nsscout.core.scanner.NamespaceScanException;
import com.nsscout.core.scanner.ScanContext;
import com.nsscout.core.scanner.ScanResult;
import com.nsscout.core.scanner.ScanStatistics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * Command to scan individual classpath entries and report what each one holds.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * nsscout scan src lib/dep.jar
 * nsscout scan --all --strict src
 * }</pre>
 */
@Command(
    name = "scan",
    description = "Scan directories and archives, reporting namespaces and statistics per entry",
    mixinStandardHelpOptions = true
)
public class ScanCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ScanCommand.class);

    @Spec
    CommandSpec spec;

    @Mixin
    ScanOptions scanOptions;

    @Parameters(
        arity = "1..*",
        paramLabel = "ENTRY",
        description = "Directories or jar/zip files to scan"
    )
    private List<Path> entries;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();
        try {
            ScanContext context = scanOptions.toScanContext(scanOptions.loadConfig());
            NamespaceFinder finder = new NamespaceFinder(context.readerConfig());

            ScanStatistics total = ScanStatistics.empty();
            int namespaces = 0;
            for (Path entry : entries) {
                ScanResult result = finder.scanEntry(entry, context);
                printResult(out, err, result);
                total = total.plus(result.statistics());
                namespaces += result.forms().size();
            }

            out.println();
            out.printf("✓ %d namespace form(s) in %d entr%s%n", namespaces, entries.size(),
                entries.size() == 1 ? "y" : "ies");
            out.println("  " + total.getSummary());
            out.flush();
            return 0;
        } catch (NamespaceScanException e) {
            log.debug("Scan failed", e);
            out.flush();
            err.println("✗ Scan failed: " + e.getMessage());
            return 1;
        } catch (IllegalArgumentException e) {
            err.println("✗ Invalid configuration: " + e.getMessage());
            return 1;
        }
    }

    private void printResult(PrintWriter out, PrintWriter err, ScanResult result) {
        out.printf("%s (%s): %d namespace form(s)%n", result.entry(), result.scannerId(), result.forms().size());
        for (NamespaceForm form : result.forms()) {
            out.println("  " + form.namespace());
        }
        for (String warning : result.warnings()) {
            err.println("  ! " + warning);
        }
    }
}
