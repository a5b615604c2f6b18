package com.formrules.generator.codegen.model.form;

import java.util.List;
import java.util.TreeSet;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

/**
 * A derived field whose value aggregates one or more source fields.
 */
@Value
@Builder(toBuilder = true)
public class CalculationField {

    @NonNull
    String fieldName;

    @NonNull
    String type;

    String label;

    @NonNull
    String viewName;

    @NonNull
    String controlId;

    @Singular
    List<SourceField> sourceFields;

    /**
     * Sorted distinct source names joined with a comma. Candidates with equal keys
     * share one expression.
     */
    public String getSourceKey() {
        TreeSet<String> names = new TreeSet<>();
        sourceFields.forEach(s -> names.add(s.getFieldName()));
        return String.join(",", names);
    }
}
