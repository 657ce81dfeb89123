package com.nsscout.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.nsscout.core.reader.ExtractionMode;
import com.nsscout.core.reader.ReaderConditionalMode;
import com.nsscout.core.reader.ReaderConfig;
import com.nsscout.core.scanner.ClasspathResolver;
import com.nsscout.core.scanner.ScanContext;

import java.nio.file.Path;
import java.util.LinkedHashSet;
import java.util.List;

/**
 * Scan settings for a project.
 *
 * <p>Loaded from {@code nsscout.yaml}. Every field is optional; unset fields leave the
 * corresponding setting at its default.
 *
 * <p><b>Example YAML:</b>
 * <pre>{@code
 * classpath:
 *   - src
 *   - lib/dep.jar
 * prefix: "my.app"
 * lenient: true
 * extraction: first-only   # or all
 * reader:
 *   conditionals: allow    # preserve, disallow
 *   features: [clj]
 * }</pre>
 *
 * @param classpath classpath entries, relative to the working directory
 * @param prefix namespace prefix to narrow the scan
 * @param lenient skip unreadable files instead of failing
 * @param extraction {@code first-only} or {@code all}
 * @param reader reader settings
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ProjectConfig(
    @JsonProperty("classpath") List<String> classpath,
    @JsonProperty("prefix") String prefix,
    @JsonProperty("lenient") Boolean lenient,
    @JsonProperty("extraction") String extraction,
    @JsonProperty("reader") ReaderSettings reader
) {
    /**
     * Creates a configuration with nothing set.
     *
     * @return default configuration
     */
    public static ProjectConfig defaults() {
        return new ProjectConfig(null, null, null, null, null);
    }

    /**
     * Returns the configured classpath entries.
     *
     * @return entries, or the JVM classpath if none are configured
     */
    public List<Path> classpathEntries() {
        if (classpath == null || classpath.isEmpty()) {
            return ClasspathResolver.defaultClasspath();
        }
        return ClasspathResolver.toPaths(classpath);
    }

    public boolean hasClasspath() {
        return classpath != null && !classpath.isEmpty();
    }

    /**
     * Applies the reader settings on top of {@code base}.
     *
     * @param base settings to fall back on
     * @return reader config
     * @throws IllegalArgumentException if the conditional mode is not recognized
     */
    public ReaderConfig toReaderConfig(ReaderConfig base) {
        if (reader == null) {
            return base;
        }
        ReaderConfig config = base;
        if (reader.conditionals() != null) {
            config = config.withConditionalMode(ReaderConditionalMode.parse(reader.conditionals()));
        }
        if (reader.features() != null && !reader.features().isEmpty()) {
            LinkedHashSet<String> features = new LinkedHashSet<>();
            reader.features().forEach(f -> features.addAll(ReaderConfig.parseFeatures(f)));
            config = config.withFeatures(features);
        }
        return config;
    }

    /**
     * Builds the scan context these settings describe.
     *
     * @param base reader settings to fall back on
     * @return scan context, lenient and first-only unless configured otherwise
     * @throws IllegalArgumentException if the extraction or conditional mode is not recognized
     */
    public ScanContext toScanContext(ReaderConfig base) {
        return new ScanContext(
            toReaderConfig(base),
            prefix,
            lenient == null || lenient,
            extraction == null ? ExtractionMode.FIRST_ONLY : ExtractionMode.parse(extraction)
        );
    }

    /**
     * Reader settings.
     *
     * @param conditionals {@code allow}, {@code preserve} or {@code disallow}
     * @param features platform features for {@code allow} mode
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ReaderSettings(
        @JsonProperty("conditionals") String conditionals,
        @JsonProperty("features") List<String> features
    ) {}
}
