package com.circuitinsight.core.parser;

import org.junit.jupiter.api.Test;

import static com.circuitinsight.core.ProfileFixtures.svg;
import static com.circuitinsight.core.ProfileFixtures.title;
import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link ParsedCostRecords}.
 */
class ParsedCostRecordsTest {

    private final CostRecordParser parser = new CostRecordParser();

    @Test
    void index_multipleFiles_keepsSameLineDistinct() {
        ParsedCostRecords records = parser.index(svg(
            title("main.nr", 3, 5, "lib::hash(x)", 7, 70.0),
            title("lib.nr", 3, 9, "poseidon(x)", 2, 20.0),
            title("lib.nr", 4, 1, "y + 1", 1, 10.0)
        ));

        assertThat(records.fileNames()).containsExactly("main.nr", "lib.nr");
        assertThat(records.forLine(3, "main.nr")).singleElement()
            .satisfies(record -> assertThat(record.expression()).isEqualTo("lib::hash(x)"));
        assertThat(records.forLine(3, "lib.nr")).singleElement()
            .satisfies(record -> assertThat(record.expression()).isEqualTo("poseidon(x)"));
        assertThat(records.forLine(3)).hasSize(2);
        assertThat(records.forFile("lib.nr")).hasSize(2);
        assertThat(records.forFile("missing.nr")).isEmpty();
    }

    @Test
    void lineLookups_sumAndListExpressions() {
        ParsedCostRecords records = parser.index(svg(
            title("main.nr", 6, 20, "b * c", 3, 30.0),
            title("main.nr", 6, 9, "a + b", 2, 20.0),
            title("main.nr", 8, 1, "assert(a)", 5, 50.0)
        ));

        assertThat(records.totalCostForLine(6, "main.nr")).isEqualTo(5);
        assertThat(records.expressionsForLine(6, "main.nr")).containsExactly("a + b", "b * c");
        assertThat(records.lineNumbers("main.nr")).containsExactly(6, 8);
        assertThat(records.lineNumbers(null)).containsExactly(6, 8);
        assertThat(records.size()).isEqualTo(3);
    }

    @Test
    void index_emptyText_isEmpty() {
        ParsedCostRecords records = parser.index("");

        assertThat(records.isEmpty()).isTrue();
        assertThat(records.fileNames()).isEmpty();
        assertThat(records.totalCostForLine(1, null)).isZero();
    }
}
