package com.formrules.generator.codegen.model.form;

import java.util.List;

import lombok.NonNull;
import lombok.Value;

/**
 * A run of controls that are either all outside any repeating group or all
 * inside the same one.
 */
@Value
public class Segment {

    @NonNull
    SegmentKind kind;

    String groupName;

    @NonNull
    List<Control> controls;

    public static Segment regular(List<Control> controls) {
        return new Segment(SegmentKind.REGULAR, null, List.copyOf(controls));
    }

    public static Segment group(String groupName, List<Control> controls) {
        return new Segment(SegmentKind.REPEATING_GROUP, groupName, List.copyOf(controls));
    }

    public boolean isGroup() {
        return kind == SegmentKind.REPEATING_GROUP;
    }

    public int getFirstRow() {
        return controls.isEmpty() ? 1 : controls.get(0).getRow();
    }

    public int getLastRow() {
        return controls.isEmpty() ? 1 : controls.get(controls.size() - 1).getRow();
    }
}
