package com.formrules.generator.codegen.model.form;

import lombok.NonNull;
import lombok.Value;

/**
 * Runtime identifiers of a deployed view.
 */
@Value
public class ViewIdentifiers {

    @NonNull
    String viewId;

    String instanceId;

    /** Instance id, or the view id when the runtime assigned none. */
    public String getEffectiveInstanceId() {
        return instanceId == null || instanceId.isBlank() ? viewId : instanceId;
    }
}
