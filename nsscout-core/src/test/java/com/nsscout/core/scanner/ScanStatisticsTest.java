package com.nsscout.core.scanner;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link ScanStatistics}.
 */
class ScanStatisticsTest {

    @Test
    void builder_countsFilesAndErrors() {
        ScanStatistics stats = new ScanStatistics.Builder()
            .filesDiscovered(4)
            .incrementFilesScanned()
            .incrementFilesScanned()
            .incrementFilesScanned()
            .incrementFilesScanned()
            .incrementFilesWithNamespaces()
            .incrementFilesUnreadable()
            .addError("syntax", "a.clj: EOF while reading")
            .build();

        assertThat(stats.filesDiscovered()).isEqualTo(4);
        assertThat(stats.filesScanned()).isEqualTo(4);
        assertThat(stats.filesWithNamespaces()).isEqualTo(1);
        assertThat(stats.errorCounts()).containsExactly(Map.entry("syntax", 1));
        assertThat(stats.topErrors()).containsExactly("a.clj: EOF while reading");
        assertThat(stats.getUnreadableRate()).isEqualTo(25.0);
        assertThat(stats.hasFailures()).isTrue();
    }

    @Test
    void builder_keepsAtMostTenTopErrors() {
        ScanStatistics.Builder builder = new ScanStatistics.Builder();
        for (int i = 0; i < 15; i++) {
            builder.addError("io", "error " + i);
        }

        ScanStatistics stats = builder.build();

        assertThat(stats.topErrors()).hasSize(ScanStatistics.MAX_TOP_ERRORS);
        assertThat(stats.errorCounts()).containsEntry("io", 15);
    }

    @Test
    void compactConstructor_clampsNegativesAndNulls() {
        ScanStatistics stats = new ScanStatistics(-1, -2, -3, -4, null, null);

        assertThat(stats).isEqualTo(ScanStatistics.empty());
    }

    @Test
    void plus_addsCountsAndMergesErrors() {
        ScanStatistics a = new ScanStatistics(2, 2, 1, 1, Map.of("syntax", 1), List.of("a"));
        ScanStatistics b = new ScanStatistics(3, 3, 2, 1, Map.of("syntax", 1, "io", 2), List.of("b"));

        ScanStatistics sum = a.plus(b);

        assertThat(sum.filesDiscovered()).isEqualTo(5);
        assertThat(sum.filesScanned()).isEqualTo(5);
        assertThat(sum.filesWithNamespaces()).isEqualTo(3);
        assertThat(sum.filesUnreadable()).isEqualTo(2);
        assertThat(sum.errorCounts()).containsEntry("syntax", 2).containsEntry("io", 2);
        assertThat(sum.topErrors()).containsExactly("a", "b");
    }

    @Test
    void getSummary_noFilesScanned_reportsZeroRate() {
        assertThat(ScanStatistics.empty().getUnreadableRate()).isZero();
        assertThat(ScanStatistics.empty().getSummary()).contains("Discovered: 0").contains("Unreadable: 0");
    }
}
