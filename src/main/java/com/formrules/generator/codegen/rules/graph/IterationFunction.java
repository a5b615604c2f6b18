package com.formrules.generator.codegen.rules.graph;

import java.util.List;

import lombok.NonNull;
import lombok.Value;

/**
 * Row iteration over a list view: the items select the view and the row state
 * to visit, e.g. rows in state {@code Added}.
 */
@Value
public class IterationFunction {

    public static final String NAME = "ViewItemsCollection";
    public static final String ADDED_STATE = "Added";

    @NonNull
    String name;

    @NonNull
    String instanceId;

    @NonNull
    List<IterationItem> items;

    public static IterationFunction addedRows(String listViewId, String listInstanceId) {
        return new IterationFunction(NAME, listInstanceId, List.of(
                new IterationItem(BindingType.VIEW, listViewId, "Guid"),
                new IterationItem(BindingType.ITEM_STATE, ADDED_STATE, "Text")));
    }
}
