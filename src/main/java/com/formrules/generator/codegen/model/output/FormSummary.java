package com.formrules.generator.codegen.model.output;

import java.util.List;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

/**
 * Per-form outcome of a generation run, as shown in the report.
 */
@Value
@Builder(toBuilder = true)
public class FormSummary {

    @NonNull
    String formName;

    String displayName;

    boolean generated;

    /** Reason the form was aborted, {@code null} when generated. */
    String failureReason;

    int viewCount;
    int viewPairCount;
    int eventCount;
    int handlerCount;
    int expressionCount;
    int validationIssues;

    /** One line per repeating group, e.g. {@code LineItems (depth 1, parent MAIN_FORM)}. */
    @Singular
    List<String> groupLines;

    public static FormSummary failed(String formName, String displayName, String reason) {
        return FormSummary.builder()
                .formName(formName)
                .displayName(displayName)
                .generated(false)
                .failureReason(reason)
                .build();
    }
}
