package com.formrules.generator.codegen.model.form;

import java.util.Locale;

import lombok.Value;

/**
 * Row/column placement of a control, parsed from values such as {@code "3A"}.
 * Missing or unparseable rows default to row 1. Columns longer than
 * {@value #MAX_COLUMN_LETTERS} letters fall back to column 1.
 */
@Value
public class GridPosition {

    public static final GridPosition DEFAULT = new GridPosition(1, 1);

    static final int MAX_COLUMN_LETTERS = 4;

    int row;
    int column;

    public static GridPosition parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return DEFAULT;
        }
        String value = raw.trim().toUpperCase(Locale.ROOT);

        int i = 0;
        while (i < value.length() && Character.isDigit(value.charAt(i))) {
            i++;
        }
        if (i == 0) {
            return DEFAULT;
        }

        int row;
        try {
            row = Integer.parseInt(value.substring(0, i));
        } catch (NumberFormatException e) {
            return DEFAULT;
        }
        if (row <= 0) {
            row = 1;
        }

        int column = 0;
        for (int j = i; j < value.length(); j++) {
            char c = value.charAt(j);
            if (c < 'A' || c > 'Z') {
                break;
            }
            if (j - i == MAX_COLUMN_LETTERS) {
                column = 0;
                break;
            }
            column = column * 26 + (c - 'A' + 1);
        }
        return new GridPosition(row, column == 0 ? 1 : column);
    }
}
