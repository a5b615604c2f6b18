package com.formrules.generator.codegen.model.form;

import static org.assertj.core.api.Assertions.*;

import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;

/**
 * Unit tests for GridPosition.
 */
class GridPositionTest {

    @ParameterizedTest
    @CsvSource({
            "1A, 1, 1",
            "3A, 3, 1",
            "2b, 2, 2",
            "12C, 12, 3",
            "4AA, 4, 27",
            "7, 7, 1",
            "' 5B ', 5, 2",
            "2ZZZZ, 2, 475254",
            "3ABCDEFGHIJKLMNOPQRSTUVWXYZ, 3, 1",
            "6ZZZZZZZZZZZZZZZZ, 6, 1"
    })
    void testParse(String raw, int row, int column) {
        GridPosition position = GridPosition.parse(raw);

        assertThat(position.getRow()).isEqualTo(row);
        assertThat(position.getColumn()).isEqualTo(column);
    }

    @ParameterizedTest
    @NullAndEmptySource
    @ValueSource(strings = { "  ", "A1", "x", "99999999999A" })
    void testUnparseableDefaultsToFirstRow(String raw) {
        assertThat(GridPosition.parse(raw)).isEqualTo(GridPosition.DEFAULT);
    }
}
