package com.nsscout.core.util;

import com.nsscout.core.model.SymbolForm;

/**
 * Conversions between namespace names and classpath-relative file paths.
 *
 * <p>Dots separate path segments and dashes become underscores:
 * {@code my-app.core} lives at {@code my_app/core.clj}.
 */
public final class NamespacePaths {

    public static final String DEFAULT_EXTENSION = "clj";

    private NamespacePaths() {
        // Utility class
    }

    public static String pathFor(SymbolForm namespace) {
        return pathFor(namespace.fullName(), DEFAULT_EXTENSION);
    }

    public static String pathFor(String namespace) {
        return pathFor(namespace, DEFAULT_EXTENSION);
    }

    public static String pathFor(SymbolForm namespace, String extension) {
        return pathFor(namespace.fullName(), extension);
    }

    /**
     * Returns the path of a namespace relative to a classpath root, using {@code /}
     * as separator.
     *
     * @param namespace namespace name such as {@code my-app.core}
     * @param extension file extension without the dot
     * @return relative path such as {@code my_app/core.clj}
     */
    public static String pathFor(String namespace, String extension) {
        return prefixDirectory(namespace) + "." + extension;
    }

    /**
     * Returns the directory that holds every namespace starting with {@code prefix}.
     *
     * @param prefix namespace name prefix such as {@code my-app.web}
     * @return relative directory such as {@code my_app/web}
     */
    public static String prefixDirectory(String prefix) {
        return prefix.replace('-', '_').replace('.', '/');
    }

    /**
     * Inverse of {@link #pathFor(String, String)}: strips the extension and maps
     * {@code /} back to dots and {@code _} back to dashes.
     *
     * @param relativePath path relative to a classpath root
     * @return namespace name
     */
    public static String namespaceFor(String relativePath) {
        String path = relativePath.replace('\\', '/');
        int slash = path.lastIndexOf('/');
        int dot = path.lastIndexOf('.');
        if (dot > slash + 1) {
            path = path.substring(0, dot);
        }
        return path.replace('/', '.').replace('_', '-');
    }
}
