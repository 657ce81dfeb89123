package com.nsscout.core.scanner;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.net.URISyntaxException;
import java.net.URL;
import java.net.URLClassLoader;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Turns classpath descriptions into ordered lists of entry paths.
 */
public final class ClasspathResolver {

    private static final Logger log = LoggerFactory.getLogger(ClasspathResolver.class);

    public static final String CLASSPATH_PROPERTY = "java.class.path";

    private ClasspathResolver() {
        // Utility class
    }

    /**
     * Splits a classpath string on the platform path separator. Empty elements are dropped.
     *
     * @param classpath e.g. {@code src:lib/a.jar}
     * @return entries in order
     */
    public static List<Path> toPaths(String classpath) {
        if (classpath == null || classpath.isEmpty()) {
            return List.of();
        }
        return Arrays.stream(classpath.split(Pattern.quote(File.pathSeparator)))
            .filter(element -> !element.isEmpty())
            .map(Path::of)
            .toList();
    }

    /**
     * Converts a collection of {@link Path}, {@link File}, {@link URL} or {@link String} elements.
     *
     * @param classpath classpath elements in order
     * @return entries in order
     * @throws IllegalArgumentException for elements of any other type
     */
    public static List<Path> toPaths(Collection<?> classpath) {
        List<Path> paths = new ArrayList<>(classpath.size());
        for (Object element : classpath) {
            if (element instanceof Path path) {
                paths.add(path);
            } else if (element instanceof File file) {
                paths.add(file.toPath());
            } else if (element instanceof String string) {
                paths.add(Path.of(string));
            } else if (element instanceof URL url) {
                toPath(url).ifPresent(paths::add);
            } else {
                throw new IllegalArgumentException("Unsupported classpath element: " + element
                    + (element == null ? "" : " (" + element.getClass().getName() + ")"));
            }
        }
        return paths;
    }

    /**
     * Reads {@code java.class.path} at call time.
     *
     * @return entries of the JVM classpath
     */
    public static List<Path> defaultClasspath() {
        return toPaths(System.getProperty(CLASSPATH_PROPERTY, ""));
    }

    /**
     * Collects the file URLs of every {@link URLClassLoader} in a loader's hierarchy,
     * parents first. Falls back to {@link #defaultClasspath()} when the hierarchy
     * exposes no URLs, as the JDK application class loader does.
     *
     * @param loader class loader to inspect, may be null
     * @return classpath entries without duplicates
     */
    public static List<Path> classpathOf(ClassLoader loader) {
        Deque<ClassLoader> hierarchy = new ArrayDeque<>();
        for (ClassLoader current = loader; current != null; current = current.getParent()) {
            hierarchy.push(current);
        }

        Set<Path> paths = new LinkedHashSet<>();
        for (ClassLoader current : hierarchy) {
            if (current instanceof URLClassLoader urlLoader) {
                for (URL url : urlLoader.getURLs()) {
                    toPath(url).ifPresent(paths::add);
                }
            }
        }

        if (paths.isEmpty()) {
            log.debug("No URL class loaders found, using {}", CLASSPATH_PROPERTY);
            return defaultClasspath();
        }
        return List.copyOf(paths);
    }

    private static Optional<Path> toPath(URL url) {
        if (!"file".equals(url.getProtocol())) {
            log.debug("Skipping non-file classpath URL: {}", url);
            return Optional.empty();
        }
        try {
            return Optional.of(Path.of(url.toURI()));
        } catch (URISyntaxException | IllegalArgumentException e) {
            log.debug("Skipping malformed classpath URL {}: {}", url, e.getMessage());
            return Optional.empty();
        }
    }
}
