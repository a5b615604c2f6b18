package com.formrules.generator.codegen.heuristics;

import java.util.List;
import java.util.Map;

import com.formrules.generator.codegen.model.form.Control;
import com.formrules.generator.codegen.model.form.ControlInstance;

/**
 * Naming-convention rules the generators rely on. Each rule can be replaced
 * without touching the generators, e.g. by explicit input annotations.
 */
public interface FormHeuristics {

    /** Container markers carry no renderable content and are dropped before segmentation. */
    boolean isContainerMarker(String controlType);

    /** Structural controls (labels, buttons) are rendered but never bound to data. */
    boolean isStructural(String controlType);

    /**
     * Canonical spelling of a repeating group name, so that two spellings of the
     * same group collapse into one. Returns {@code null} for blank input.
     */
    String normalizeGroupName(String rawName);

    /** Child group name to parent group name, overriding the input document. */
    Map<String, String> nestingOverrides();

    /** Whether the control is a derived, aggregate-valued field. */
    boolean isCalculationCandidate(Control control);

    /** Names of the fields a calculation candidate aggregates; empty when none apply. */
    List<String> sourceFieldNames(Control candidate);

    /** Whether a control is an occurrence of the given source field. */
    boolean isSourceControl(Control control, String sourceFieldName);

    /**
     * Whether an instance should be left out of a sum because the field name is
     * shared by semantically different controls. Only consulted when the
     * instances span more than one view.
     */
    boolean excludeSourceInstance(ControlInstance instance, List<ControlInstance> allInstances);
}
