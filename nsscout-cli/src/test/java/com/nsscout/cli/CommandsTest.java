package com.nsscout.cli;

import com.nsscout.NsScoutCLI;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.File;
import java.io.IOException;
import java.io.OutputStream;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.zip.ZipEntry;
import java.util.zip.ZipOutputStream;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Functional tests for the {@code list}, {@code scan}, {@code path} and {@code doc} commands.
 */
class CommandsTest {

    @TempDir
    Path tempDir;

    private final StringWriter out = new StringWriter();
    private final StringWriter err = new StringWriter();

    private int run(String... args) {
        CommandLine cmd = NsScoutCLI.commandLine();
        cmd.setOut(new PrintWriter(out));
        cmd.setErr(new PrintWriter(err));
        return cmd.execute(args);
    }

    private Path createFile(String relativePath, String content) throws IOException {
        Path file = tempDir.resolve(relativePath);
        Files.createDirectories(file.getParent());
        return Files.writeString(file, content);
    }

    private Path createJar(String relativePath, String entryName, String content) throws IOException {
        Path jar = tempDir.resolve(relativePath);
        Files.createDirectories(jar.getParent());
        try (OutputStream stream = Files.newOutputStream(jar);
             ZipOutputStream zip = new ZipOutputStream(stream)) {
            zip.putNextEntry(new ZipEntry(entryName));
            zip.write(content.getBytes(StandardCharsets.UTF_8));
            zip.closeEntry();
        }
        return jar;
    }

    private String classpath(Path... entries) {
        StringBuilder sb = new StringBuilder();
        for (Path entry : entries) {
            if (sb.length() > 0) {
                sb.append(File.pathSeparator);
            }
            sb.append(entry);
        }
        return sb.toString();
    }

    @Test
    void list_printsNamespacesInEntryOrder() throws IOException {
        createFile("src/app/main.clj", "(ns app.main)");
        Path jar = createJar("lib/dep.jar", "dep/core.clj", "(ns dep.core)");

        int exitCode = run("list", "--classpath", classpath(tempDir.resolve("src"), jar));

        assertThat(exitCode).isZero();
        assertThat(out.toString().lines()).containsExactly("app.main", "dep.core");
    }

    @Test
    void list_allAndFormsWithPrefix_printsEveryForm() throws IOException {
        createFile("src/a/b.clj", "(ns a.b \"Doc.\")\n(in-ns 'a.c)");
        createFile("src/z/other.clj", "(ns z.other)");

        int exitCode = run("list", "--classpath", tempDir.resolve("src").toString(),
            "--prefix", "a", "--all", "--forms");

        assertThat(exitCode).isZero();
        assertThat(out.toString().lines()).containsExactly("(ns a.b \"Doc.\")", "(in-ns a.c)");
    }

    @Test
    void list_usesConfigFile() throws IOException {
        createFile("src/cfg/core.clj", "(ns cfg.core)");
        Path config = createFile("nsscout.yaml", "classpath:\n  - " + tempDir.resolve("src") + "\n");

        int exitCode = run("list", "-c", config.toString());

        assertThat(exitCode).isZero();
        assertThat(out.toString().lines()).containsExactly("cfg.core");
    }

    @Test
    void list_corruptJar_returnsOne() throws IOException {
        Path jar = createFile("lib/broken.jar", "not a zip");

        int exitCode = run("list", "--classpath", jar.toString());

        assertThat(exitCode).isEqualTo(1);
        assertThat(err.toString()).contains("archive file corrupt").contains(jar.toString());
    }

    @Test
    void list_strictWithUnreadableFile_returnsOne() throws IOException {
        createFile("src/bad.clj", "(ns bad");

        int exitCode = run("list", "--classpath", tempDir.resolve("src").toString(), "--strict");

        assertThat(exitCode).isEqualTo(1);
        assertThat(err.toString()).contains("bad.clj");
    }

    @Test
    void scan_printsPerEntryResultsAndSummary() throws IOException {
        createFile("src/app/main.clj", "(ns app.main)");
        createFile("src/app/bad.clj", "(ns");

        int exitCode = run("scan", tempDir.resolve("src").toString());

        assertThat(exitCode).isZero();
        assertThat(out.toString())
            .contains("(directory): 1 namespace form(s)")
            .contains("  app.main")
            .contains("Unreadable: 1");
        assertThat(err.toString()).contains("bad.clj");
    }

    @Test
    void scan_withoutEntries_isUsageError() {
        assertThat(run("scan")).isEqualTo(2);
    }

    @Test
    void path_printsRelativePath() {
        assertThat(run("path", "my-app.core", "--extension", "cljc")).isZero();
        assertThat(out.toString().trim()).isEqualTo("my_app/core.cljc");
    }

    @Test
    void doc_printsDocstring() throws IOException {
        Path file = createFile("src/a/b.clj", "(ns a.b \"Namespace docs.\")");

        assertThat(run("doc", file.toString())).isZero();
        assertThat(out.toString().trim()).isEqualTo("Namespace docs.");
    }

    @Test
    void doc_fileWithoutNamespace_returnsOne() throws IOException {
        Path file = createFile("src/script.clj", "(println 1)");

        assertThat(run("doc", file.toString())).isEqualTo(1);
        assertThat(err.toString()).contains("No namespace form");
    }
}
