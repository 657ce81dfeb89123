package com.nsscout.core.scanner.impl;

import com.nsscout.core.model.NamespaceForm;
import com.nsscout.core.reader.ExtractionMode;
import com.nsscout.core.scanner.CorruptArchiveException;
import com.nsscout.core.scanner.ScanResult;
import com.nsscout.core.scanner.ScannerTestBase;
import com.nsscout.core.scanner.UnreadableSourceException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Functional tests for {@link ArchiveEntryScanner}.
 */
class ArchiveEntryScannerTest extends ScannerTestBase {

    private ArchiveEntryScanner scanner;

    @BeforeEach
    void setUpScanner() {
        scanner = new ArchiveEntryScanner();
    }

    @Test
    void appliesTo_jarAndZipFiles() throws IOException {
        Path jar = createJar("lib/dep.jar", entries("a.clj", "(ns a)"));
        Path zip = createJar("lib/dep.zip", entries("a.clj", "(ns a)"));

        assertThat(scanner.appliesTo(jar)).isTrue();
        assertThat(scanner.appliesTo(zip)).isTrue();
        assertThat(scanner.appliesTo(createDirectory("classes"))).isFalse();
        assertThat(scanner.appliesTo(createFile("notes.txt", ""))).isFalse();
    }

    @Test
    void scan_mixedEntries_onlySourceEntriesContribute() throws IOException {
        Path jar = createJar("lib/dep.jar", entries(
            "META-INF/MANIFEST.MF", "Manifest-Version: 1.0\n",
            "lib/", "",
            "lib/core.clj", "(ns lib.core)",
            "lib/util.cljc", "(ns lib.util)",
            "lib/client.cljs", "(ns lib.client)",
            "lib/Helper.class", "binary",
            "lib/data.edn", "{}"
        ));

        ScanResult result = scanner.scan(jar, context);

        assertThat(result.scannerId()).isEqualTo("archive");
        assertThat(result.forms()).extracting(NamespaceForm::namespace).containsExactly("lib.core", "lib.util");
        assertThat(result.statistics().filesDiscovered()).isEqualTo(2);
    }

    @Test
    void scan_withPrefix_keepsNamesStartingWithLiteralPrefix() throws IOException {
        Path jar = createJar("lib/dep.jar", entries(
            "my_app/core.clj", "(ns my-app.core)",
            "my_app_extras/x.clj", "(ns my-app-extras.x)",
            "other/core.clj", "(ns other.core)"
        ));

        ScanResult result = scanner.scan(jar, context.withPrefix("my-app"));

        assertThat(result.forms()).extracting(NamespaceForm::namespace)
            .containsExactly("my-app.core", "my-app-extras.x");
    }

    @Test
    void scan_allMode_readsEveryDeclaration() throws IOException {
        Path jar = createJar("lib/dep.jar", entries("a/b.clj", "(ns a.b \"Doc.\") (in-ns 'a.c)"));

        ScanResult result = scanner.scan(jar, context.withExtractionMode(ExtractionMode.ALL));

        assertThat(result.forms()).extracting(NamespaceForm::toString)
            .containsExactly("(ns a.b \"Doc.\")", "(in-ns a.c)");
    }

    @Test
    void scan_corruptArchive_throwsEvenWhenLenient() throws IOException {
        Path jar = createCorruptJar("lib/broken.jar");

        assertThatThrownBy(() -> scanner.scan(jar, context))
            .isInstanceOf(CorruptArchiveException.class)
            .hasMessage("archive file corrupt: " + jar)
            .satisfies(e -> assertThat(((CorruptArchiveException) e).getArchive()).isEqualTo(jar));
    }

    @Test
    void scan_unreadableEntryLenient_isSkipped() throws IOException {
        Path jar = createJar("lib/dep.jar", entries(
            "bad.clj", "(ns bad",
            "good.clj", "(ns good)"
        ));

        ScanResult result = scanner.scan(jar, context);

        assertThat(result.forms()).extracting(NamespaceForm::namespace).containsExactly("good");
        assertThat(result.warnings()).singleElement().asString().contains("bad.clj");
    }

    @Test
    void scan_unreadableEntryStrict_throwsNamingEntry() throws IOException {
        Path jar = createJar("lib/dep.jar", entries("bad.clj", "(ns bad"));

        assertThatThrownBy(() -> scanner.scan(jar, context.strict()))
            .isInstanceOf(UnreadableSourceException.class)
            .hasMessageContaining(jar + "!/bad.clj");
    }
}
