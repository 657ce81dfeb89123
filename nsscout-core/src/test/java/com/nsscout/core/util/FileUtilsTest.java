package com.nsscout.core.util;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link FileUtils}.
 */
class FileUtilsTest {

    @TempDir
    Path tempDir;

    @ParameterizedTest
    @CsvSource({
        "core.clj, true",
        "core.cljc, true",
        "core.cljs, false",
        "core.edn, false",
        "clj, false",
        "dir/nested/core.clj, true"
    })
    void isSourceFileName_matchesCljAndCljcOnly(String name, boolean expected) {
        assertThat(FileUtils.isSourceFileName(name)).isEqualTo(expected);
    }

    @Test
    void findSourceFiles_mixedTree_returnsOnlySourceFiles() throws IOException {
        Path clj = tempDir.resolve("a/core.clj");
        Path cljc = tempDir.resolve("a/b/shared.cljc");
        Files.createDirectories(cljc.getParent());
        Files.writeString(clj, "(ns a.core)");
        Files.writeString(cljc, "(ns a.b.shared)");
        Files.writeString(tempDir.resolve("a/notes.txt"), "(ns not.me)");
        Files.writeString(tempDir.resolve("a/client.cljs"), "(ns not.me.either)");
        Files.createDirectories(tempDir.resolve("a/dir.clj"));

        List<Path> files = FileUtils.findSourceFiles(tempDir);

        assertThat(files).containsExactlyInAnyOrder(clj, cljc);
    }

    @Test
    void findSourceFiles_emptyDirectory_returnsEmptyList() throws IOException {
        assertThat(FileUtils.findSourceFiles(tempDir)).isEmpty();
    }

    @Test
    void openSource_replacesMalformedBytesInsteadOfFailing() throws IOException {
        Path file = Files.write(tempDir.resolve("latin1.clj"), new byte[] {'(', 'n', 's', ' ', 'x', ')', (byte) 0xE9});

        try (BufferedReader reader = FileUtils.openSource(file)) {
            assertThat(reader.readLine()).isEqualTo("(ns x)\uFFFD");
        }
    }

    @Test
    void isArchive_detectsJarAndZipFiles() throws IOException {
        Path jar = Files.writeString(tempDir.resolve("lib.jar"), "");
        Path zip = Files.writeString(tempDir.resolve("lib.ZIP"), "");
        Path txt = Files.writeString(tempDir.resolve("lib.txt"), "");
        Path dirNamedJar = Files.createDirectories(tempDir.resolve("classes.jar"));

        assertThat(FileUtils.isArchive(jar)).isTrue();
        assertThat(FileUtils.isArchive(zip)).isTrue();
        assertThat(FileUtils.isArchive(txt)).isFalse();
        assertThat(FileUtils.isArchive(dirNamedJar)).isFalse();
    }

    @Test
    void getExtension_returnsExtensionWithoutDot() {
        assertThat(FileUtils.getExtension(Path.of("src/core.cljc"))).isEqualTo("cljc");
        assertThat(FileUtils.getExtension(Path.of("Makefile"))).isEmpty();
        assertThat(FileUtils.getExtension(Path.of(".hidden"))).isEmpty();
    }
}
