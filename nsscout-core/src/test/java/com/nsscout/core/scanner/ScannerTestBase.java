package com.nsscout.core.scanner;

import com.nsscout.core.reader.ReaderConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.zip.ZipEntry;
import java.util.zip.ZipOutputStream;

/**
 * Base class for scanner functional tests.
 *
 * <p>Provides common test infrastructure including:
 * <ul>
 *   <li>Temporary directory creation for source trees and archives</li>
 *   <li>Helper methods for creating source files and jars</li>
 *   <li>ScanContext creation with sensible defaults</li>
 * </ul>
 */
public abstract class ScannerTestBase {

    @TempDir
    protected Path tempDir;

    protected ScanContext context;

    @BeforeEach
    void setUp() {
        context = ScanContext.defaults(ReaderConfig.defaults());
    }

    /**
     * Creates a file in the temp directory with the given content.
     *
     * @param relativePath path relative to tempDir (e.g., "src/my_app/core.clj")
     * @param content file content
     * @return the created file path
     * @throws IOException if file cannot be created
     */
    protected Path createFile(String relativePath, String content) throws IOException {
        Path filePath = tempDir.resolve(relativePath);
        Files.createDirectories(filePath.getParent());
        Files.writeString(filePath, content);
        return filePath;
    }

    /**
     * Creates a file in the temp directory with raw byte content.
     *
     * @param relativePath path relative to tempDir
     * @param content file bytes, written as is
     * @return the created file path
     * @throws IOException if file cannot be created
     */
    protected Path createFile(String relativePath, byte[] content) throws IOException {
        Path filePath = tempDir.resolve(relativePath);
        Files.createDirectories(filePath.getParent());
        Files.write(filePath, content);
        return filePath;
    }

    /**
     * Source bytes declaring {@code a.b} followed by a comment holding a
     * Latin-1 encoded {@code é}, which is not valid UTF-8.
     *
     * @return the raw source bytes
     */
    protected static byte[] latin1CommentSource() {
        byte[] head = "(ns a.b)\n; caf".getBytes(StandardCharsets.US_ASCII);
        byte[] source = new byte[head.length + 2];
        System.arraycopy(head, 0, source, 0, head.length);
        source[head.length] = (byte) 0xE9;
        source[head.length + 1] = '\n';
        return source;
    }

    /**
     * Creates a directory in the temp directory.
     *
     * @param relativePath path relative to tempDir
     * @return the created directory path
     * @throws IOException if directory cannot be created
     */
    protected Path createDirectory(String relativePath) throws IOException {
        Path dirPath = tempDir.resolve(relativePath);
        Files.createDirectories(dirPath);
        return dirPath;
    }

    /**
     * Creates a jar in the temp directory holding the given entries, in map order.
     * Entry names ending in {@code /} become directory entries.
     *
     * @param relativePath path relative to tempDir (e.g., "lib/dep.jar")
     * @param entries map of entry name to content
     * @return the created archive path
     * @throws IOException if the archive cannot be written
     */
    protected Path createJar(String relativePath, Map<String, String> entries) throws IOException {
        Path jarPath = tempDir.resolve(relativePath);
        Files.createDirectories(jarPath.getParent());
        try (OutputStream out = Files.newOutputStream(jarPath);
             ZipOutputStream zip = new ZipOutputStream(out, StandardCharsets.UTF_8)) {
            for (Map.Entry<String, String> entry : entries.entrySet()) {
                zip.putNextEntry(new ZipEntry(entry.getKey()));
                if (!entry.getKey().endsWith("/")) {
                    zip.write(entry.getValue().getBytes(StandardCharsets.UTF_8));
                }
                zip.closeEntry();
            }
        }
        return jarPath;
    }

    /**
     * Creates a jar in the temp directory with a single entry of raw bytes.
     *
     * @param relativePath path relative to tempDir
     * @param entryName entry name inside the jar
     * @param content entry bytes, written as is
     * @return the created jar path
     * @throws IOException if the jar cannot be written
     */
    protected Path createJar(String relativePath, String entryName, byte[] content) throws IOException {
        Path jarPath = tempDir.resolve(relativePath);
        Files.createDirectories(jarPath.getParent());
        try (OutputStream out = Files.newOutputStream(jarPath);
             ZipOutputStream zip = new ZipOutputStream(out, StandardCharsets.UTF_8)) {
            zip.putNextEntry(new ZipEntry(entryName));
            zip.write(content);
            zip.closeEntry();
        }
        return jarPath;
    }

    /**
     * Ordered entry map for {@link #createJar(String, Map)}.
     *
     * @param nameAndContent alternating entry names and contents
     * @return entry map preserving argument order
     */
    protected static Map<String, String> entries(String... nameAndContent) {
        Map<String, String> entries = new LinkedHashMap<>();
        for (int i = 0; i < nameAndContent.length; i += 2) {
            entries.put(nameAndContent[i], nameAndContent[i + 1]);
        }
        return entries;
    }

    /**
     * Creates a file with a {@code .jar} name that is not a zip archive.
     *
     * @param relativePath path relative to tempDir
     * @return the created file path
     * @throws IOException if file cannot be created
     */
    protected Path createCorruptJar(String relativePath) throws IOException {
        return createFile(relativePath, "this is not a zip file");
    }
}
