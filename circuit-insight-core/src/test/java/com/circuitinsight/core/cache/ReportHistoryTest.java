package com.circuitinsight.core.cache;

import com.circuitinsight.core.model.ComplexityReport;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link ReportHistory}.
 */
class ReportHistoryTest {

    @Test
    void previous_needsTwoReports() {
        ReportHistory history = new ReportHistory(3);
        assertThat(history.previous()).isEmpty();

        history.record(report(1));
        assertThat(history.previous()).isEmpty();
        assertThat(history.latest()).contains(report(1));

        history.record(report(2));
        assertThat(history.previous()).contains(report(1));
    }

    @Test
    void record_beyondDepth_evictsOldestFirst() {
        ReportHistory history = new ReportHistory(3);
        for (int i = 1; i <= 5; i++) {
            history.record(report(i));
        }

        assertThat(history.snapshot()).containsExactly(report(3), report(4), report(5));
    }

    @Test
    void setDepth_shrinksRetainedReports() {
        ReportHistory history = new ReportHistory();
        for (int i = 1; i <= 4; i++) {
            history.record(report(i));
        }

        history.setDepth(2);

        assertThat(history.getDepth()).isEqualTo(2);
        assertThat(history.snapshot()).containsExactly(report(3), report(4));
        assertThatThrownBy(() -> history.setDepth(0)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void clear_removesEverything() {
        ReportHistory history = new ReportHistory();
        history.record(report(1));

        history.clear();

        assertThat(history.size()).isZero();
    }

    private static ComplexityReport report(int second) {
        return new ComplexityReport(List.of(), second, 0, 0, List.of(), List.of(), Instant.ofEpochSecond(second));
    }
}
