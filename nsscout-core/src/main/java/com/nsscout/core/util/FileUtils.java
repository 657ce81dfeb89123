package com.nsscout.core.util;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileVisitOption;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Utility class for file operations.
 */
public final class FileUtils {

    private static final Logger log = LoggerFactory.getLogger(FileUtils.class);

    /** Clojure source names: {@code .clj} and the portable {@code .cljc}. */
    public static final Pattern SOURCE_FILE_PATTERN = Pattern.compile(".*\\.cljc?");

    /** Zip-based archive suffixes accepted as classpath entries. */
    public static final Set<String> ARCHIVE_EXTENSIONS = Set.of("jar", "zip");

    private FileUtils() {
        // Utility class
    }

    /**
     * Checks whether a file or archive entry name is a Clojure source name.
     *
     * @param name file name or archive entry path
     * @return true for names ending in {@code .clj} or {@code .cljc}
     */
    public static boolean isSourceFileName(String name) {
        return SOURCE_FILE_PATTERN.matcher(name).matches();
    }

    /**
     * Checks whether a path is a readable regular file with a Clojure source name.
     *
     * @param path path to check
     * @return true if the file should be scanned
     */
    public static boolean isSourceFile(Path path) {
        return Files.isRegularFile(path)
            && Files.isReadable(path)
            && isSourceFileName(path.getFileName().toString());
    }

    /**
     * Checks whether a path is a regular file with an archive extension.
     *
     * @param path path to check
     * @return true for {@code .jar} and {@code .zip} files
     */
    public static boolean isArchive(Path path) {
        return Files.isRegularFile(path)
            && ARCHIVE_EXTENSIONS.contains(getExtension(path).toLowerCase(Locale.ROOT));
    }

    /**
     * Finds Clojure source files under a root directory in traversal order.
     *
     * <p>The walk is depth-first in directory listing order and is not sorted.
     * Symbolic links are followed. Directories that cannot be listed are skipped.
     *
     * @param rootPath root directory to search from
     * @return matching readable source files
     * @throws IOException if the root itself cannot be walked
     */
    public static List<Path> findSourceFiles(Path rootPath) throws IOException {
        List<Path> found = new ArrayList<>();
        Files.walkFileTree(rootPath, EnumSet.of(FileVisitOption.FOLLOW_LINKS), Integer.MAX_VALUE,
            new SimpleFileVisitor<>() {
                @Override
                public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                    if (attrs.isRegularFile() && isSourceFile(file)) {
                        found.add(file);
                    }
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult visitFileFailed(Path file, IOException e) {
                    log.debug("Skipping unreachable path {}: {}", file, e.getMessage());
                    return FileVisitResult.CONTINUE;
                }
            });
        return found;
    }

    /**
     * Opens a source file as UTF-8 text. Malformed bytes decode to the
     * replacement character instead of failing the read, matching how
     * archive entries are decoded.
     *
     * @param path source file
     * @return buffered reader over the file
     * @throws IOException if the file cannot be opened
     */
    public static BufferedReader openSource(Path path) throws IOException {
        return new BufferedReader(new InputStreamReader(Files.newInputStream(path), StandardCharsets.UTF_8));
    }

    /**
     * Gets the file extension.
     *
     * @param path file path
     * @return file extension without dot, or empty string if no extension
     */
    public static String getExtension(Path path) {
        Path fileName = path.getFileName();
        if (fileName == null) {
            return "";
        }
        String name = fileName.toString();
        int lastDot = name.lastIndexOf('.');
        return lastDot > 0 ? name.substring(lastDot + 1) : "";
    }
}
