package com.formrules.generator.codegen.rules.graph;

import java.util.ArrayList;
import java.util.List;

import lombok.Builder;
import lombok.Getter;
import lombok.NonNull;

/**
 * Form-level aggregate expression feeding a calculated field.
 */
@Getter
@Builder
public class Expression {

    public static final String LIST_SUM = "ListSum";

    @NonNull
    private final String id;

    @NonNull
    private final String name;

    private final String displayValue;

    @NonNull
    @Builder.Default
    private final String function = LIST_SUM;

    /** Calculated field the expression was named after. */
    private final String representativeField;

    @Builder.Default
    private final List<String> sourceFields = new ArrayList<>();

    @Builder.Default
    private final List<ListSumItem> items = new ArrayList<>();

    public void addItem(ListSumItem item) {
        items.add(item);
    }
}
