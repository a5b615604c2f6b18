package com.formrules.generator.codegen.model.form;

import java.util.Optional;

import lombok.Builder;
import lombok.Value;

/**
 * Button identifiers registered for a view. Any of them may be absent.
 */
@Value
@Builder(toBuilder = true)
public class ViewButtons {

    String addId;
    String addName;
    String deleteId;
    String deleteName;
    String cancelId;
    String cancelName;

    public Optional<String> getAddId() {
        return Optional.ofNullable(addId).filter(s -> !s.isBlank());
    }

    public Optional<String> getDeleteId() {
        return Optional.ofNullable(deleteId).filter(s -> !s.isBlank());
    }

    public Optional<String> getCancelId() {
        return Optional.ofNullable(cancelId).filter(s -> !s.isBlank());
    }
}
