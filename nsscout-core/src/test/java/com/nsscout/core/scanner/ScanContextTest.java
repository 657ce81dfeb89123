package com.nsscout.core.scanner;

import com.nsscout.core.reader.ExtractionMode;
import com.nsscout.core.reader.ReaderConfig;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link ScanContext}.
 */
class ScanContextTest {

    @Test
    void defaults_lenientFirstOnlyWithoutPrefix() {
        ScanContext context = ScanContext.defaults(ReaderConfig.defaults());

        assertThat(context.lenient()).isTrue();
        assertThat(context.extractionMode()).isEqualTo(ExtractionMode.FIRST_ONLY);
        assertThat(context.hasPrefix()).isFalse();
    }

    @Test
    void withPrefix_emptyPrefix_meansNoPrefix() {
        ScanContext context = ScanContext.defaults(ReaderConfig.defaults()).withPrefix("");

        assertThat(context.prefix()).isNull();
        assertThat(context.hasPrefix()).isFalse();
    }

    @Test
    void copyHelpers_changeOnlyTheirField() {
        ScanContext base = ScanContext.defaults(ReaderConfig.defaults());

        ScanContext changed = base.withPrefix("a.b").strict().withExtractionMode(ExtractionMode.ALL);

        assertThat(changed).isEqualTo(new ScanContext(ReaderConfig.defaults(), "a.b", false, ExtractionMode.ALL));
        assertThat(base.lenient()).isTrue();
    }
}
