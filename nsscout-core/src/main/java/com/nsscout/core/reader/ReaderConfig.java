package com.nsscout.core.reader;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;
import java.util.function.UnaryOperator;
import java.util.stream.Collectors;

/**
 * Immutable reader settings passed into every parse.
 *
 * <p>The process-wide value is resolved once from the environment by
 * {@link #environment()}:
 * <ul>
 *   <li>system property {@code nsscout.read-cond}, else environment variable
 *       {@code NSSCOUT_READ_COND}: {@code allow} (default), {@code preserve} or {@code disallow}</li>
 *   <li>system property {@code nsscout.features}, else environment variable
 *       {@code NSSCOUT_FEATURES}: comma-separated platform features, default {@code clj}</li>
 * </ul>
 *
 * @param conditionalMode reader conditional handling
 * @param features feature names (without the colon) selected in {@code ALLOW} mode
 */
public record ReaderConfig(ReaderConditionalMode conditionalMode, Set<String> features) {

    public static final String READ_COND_PROPERTY = "nsscout.read-cond";
    public static final String READ_COND_ENV = "NSSCOUT_READ_COND";
    public static final String FEATURES_PROPERTY = "nsscout.features";
    public static final String FEATURES_ENV = "NSSCOUT_FEATURES";

    public static final Set<String> DEFAULT_FEATURES = Set.of("clj");

    private static final Logger log = LoggerFactory.getLogger(ReaderConfig.class);

    public ReaderConfig {
        Objects.requireNonNull(conditionalMode, "conditionalMode must not be null");
        features = features == null || features.isEmpty()
            ? DEFAULT_FEATURES
            : Set.copyOf(features);
    }

    /**
     * Default settings: conditionals allowed with the {@code clj} feature.
     *
     * @return default config
     */
    public static ReaderConfig defaults() {
        return new ReaderConfig(ReaderConditionalMode.ALLOW, DEFAULT_FEATURES);
    }

    /**
     * Returns the process-wide config, resolved on first use and fixed afterwards.
     *
     * @return environment config
     */
    public static ReaderConfig environment() {
        return EnvironmentHolder.CONFIG;
    }

    /**
     * Resolves a config from property and environment lookups.
     *
     * @param properties system property lookup
     * @param environment environment variable lookup
     * @return resolved config, defaults for anything unset
     * @throws IllegalArgumentException if the conditional mode is not recognized
     */
    public static ReaderConfig resolve(UnaryOperator<String> properties, UnaryOperator<String> environment) {
        String mode = firstNonBlank(properties.apply(READ_COND_PROPERTY), environment.apply(READ_COND_ENV));
        String features = firstNonBlank(properties.apply(FEATURES_PROPERTY), environment.apply(FEATURES_ENV));

        return new ReaderConfig(
            mode == null ? ReaderConditionalMode.ALLOW : ReaderConditionalMode.parse(mode),
            features == null ? DEFAULT_FEATURES : parseFeatures(features)
        );
    }

    /**
     * Parses a comma-separated feature list, ignoring blanks and leading colons.
     *
     * @param features e.g. {@code "clj, :cljs"}
     * @return feature names in order
     */
    public static Set<String> parseFeatures(String features) {
        return Arrays.stream(features.split(","))
            .map(String::trim)
            .map(f -> f.startsWith(":") ? f.substring(1) : f)
            .filter(f -> !f.isEmpty())
            .collect(Collectors.toCollection(LinkedHashSet::new));
    }

    public boolean hasFeature(String feature) {
        return features.contains(feature);
    }

    public ReaderConfig withConditionalMode(ReaderConditionalMode mode) {
        return new ReaderConfig(mode, features);
    }

    public ReaderConfig withFeatures(Set<String> newFeatures) {
        return new ReaderConfig(conditionalMode, newFeatures);
    }

    private static String firstNonBlank(String first, String second) {
        if (first != null && !first.isBlank()) {
            return first;
        }
        return second != null && !second.isBlank() ? second : null;
    }

    private static final class EnvironmentHolder {
        static final ReaderConfig CONFIG = load();

        private static ReaderConfig load() {
            try {
                ReaderConfig config = resolve(System::getProperty, System::getenv);
                log.debug("Reader config from environment: {}", config);
                return config;
            } catch (IllegalArgumentException e) {
                log.warn("Ignoring invalid reader settings: {}. Using defaults.", e.getMessage());
                return defaults();
            }
        }
    }
}
