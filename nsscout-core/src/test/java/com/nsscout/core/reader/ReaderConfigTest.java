package com.nsscout.core.reader;

import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link ReaderConfig}.
 */
class ReaderConfigTest {

    @Test
    void resolve_nothingSet_returnsDefaults() {
        ReaderConfig config = ReaderConfig.resolve(key -> null, key -> null);

        assertThat(config).isEqualTo(ReaderConfig.defaults());
        assertThat(config.conditionalMode()).isEqualTo(ReaderConditionalMode.ALLOW);
        assertThat(config.features()).containsExactly("clj");
    }

    @Test
    void resolve_propertyWinsOverEnvironment() {
        Map<String, String> properties = Map.of(ReaderConfig.READ_COND_PROPERTY, "preserve");
        Map<String, String> environment = Map.of(
            ReaderConfig.READ_COND_ENV, "disallow",
            ReaderConfig.FEATURES_ENV, ":cljs, bb");

        ReaderConfig config = ReaderConfig.resolve(properties::get, environment::get);

        assertThat(config.conditionalMode()).isEqualTo(ReaderConditionalMode.PRESERVE);
        assertThat(config.features()).containsExactlyInAnyOrder("cljs", "bb");
    }

    @Test
    void resolve_blankProperty_fallsBackToEnvironment() {
        Map<String, String> properties = Map.of(ReaderConfig.READ_COND_PROPERTY, "  ");
        Map<String, String> environment = Map.of(ReaderConfig.READ_COND_ENV, "DISALLOW");

        assertThat(ReaderConfig.resolve(properties::get, environment::get).conditionalMode())
            .isEqualTo(ReaderConditionalMode.DISALLOW);
    }

    @Test
    void resolve_unknownMode_throws() {
        Map<String, String> properties = Map.of(ReaderConfig.READ_COND_PROPERTY, "sometimes");

        assertThatThrownBy(() -> ReaderConfig.resolve(properties::get, key -> null))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("sometimes");
    }

    @Test
    void parseFeatures_ignoresBlanksAndColons() {
        assertThat(ReaderConfig.parseFeatures(" :clj ,, cljr ,")).containsExactly("clj", "cljr");
    }

    @Test
    void withFeatures_empty_restoresDefaultFeatures() {
        ReaderConfig config = ReaderConfig.defaults().withFeatures(Set.of());

        assertThat(config.features()).isEqualTo(ReaderConfig.DEFAULT_FEATURES);
    }

    @Test
    void extractionMode_parse_acceptsDashedNames() {
        assertThat(ExtractionMode.parse("first-only")).isEqualTo(ExtractionMode.FIRST_ONLY);
        assertThat(ExtractionMode.parse("ALL")).isEqualTo(ExtractionMode.ALL);
        assertThatThrownBy(() -> ExtractionMode.parse("some"))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
