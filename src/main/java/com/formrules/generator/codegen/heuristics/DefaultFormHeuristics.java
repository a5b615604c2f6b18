package com.formrules.generator.codegen.heuristics;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.formrules.generator.codegen.model.form.Control;
import com.formrules.generator.codegen.model.form.ControlInstance;

/**
 * Default rules:
 * <ul>
 * <li>container markers: {@code section}, {@code optionalsection}, {@code repeatingtable},
 * {@code repeatingsection}</li>
 * <li>structural types: {@code label}, {@code button}</li>
 * <li>group names: {@code TABLECTRL42} becomes {@code Table_CTRL42}, a {@code Table_CTRL}
 * prefix is kept, anything else has whitespace replaced by underscores</li>
 * <li>calculation candidates: non-editable {@code TextField} whose name contains
 * TOTAL, SUBTOTAL, SUM or CALC</li>
 * <li>sources: totals and subtotals aggregate {@code AMOUNT} text fields inside repeating groups</li>
 * <li>exclusion: an {@code AMOUNT} outside any repeating group is dropped when
 * group instances exist</li>
 * </ul>
 */
public class DefaultFormHeuristics implements FormHeuristics {

    private static final Set<String> CONTAINER_TYPES =
            Set.of("section", "optionalsection", "repeatingtable", "repeatingsection");

    private static final Set<String> STRUCTURAL_TYPES = Set.of("label", "button");

    private static final List<String> CALCULATION_TOKENS = List.of("TOTAL", "SUBTOTAL", "SUM", "CALC");

    private static final List<String> SOURCE_BEARING_TOKENS = List.of("TOTAL", "SUBTOTAL");

    private static final List<String> SOURCE_FIELD_NAMES = List.of("AMOUNT");

    private static final Set<String> GROUP_ONLY_SOURCE_FIELDS = Set.of("AMOUNT");

    private static final String TEXT_FIELD = "TextField";

    private static final Pattern TABLE_CTRL = Pattern.compile("^TABLECTRL(\\d+)$", Pattern.CASE_INSENSITIVE);

    private final Map<String, String> nestingOverrides;

    public DefaultFormHeuristics() {
        this(Map.of());
    }

    public DefaultFormHeuristics(Map<String, String> nestingOverrides) {
        Map<String, String> normalized = new LinkedHashMap<>();
        if (nestingOverrides != null) {
            nestingOverrides.forEach((child, parent) -> {
                String c = normalizeGroupName(child);
                String p = normalizeGroupName(parent);
                if (c != null && p != null) {
                    normalized.put(c, p);
                }
            });
        }
        this.nestingOverrides = Map.copyOf(normalized);
    }

    @Override
    public boolean isContainerMarker(String controlType) {
        return controlType != null && CONTAINER_TYPES.contains(controlType.toLowerCase(Locale.ROOT));
    }

    @Override
    public boolean isStructural(String controlType) {
        return controlType == null || STRUCTURAL_TYPES.contains(controlType.toLowerCase(Locale.ROOT));
    }

    @Override
    public String normalizeGroupName(String rawName) {
        if (rawName == null || rawName.isBlank()) {
            return null;
        }
        String name = rawName.trim();
        Matcher m = TABLE_CTRL.matcher(name);
        if (m.matches()) {
            return "Table_CTRL" + m.group(1);
        }
        if (name.startsWith("Table_CTRL")) {
            return name;
        }
        return name.replaceAll("\\s+", "_");
    }

    @Override
    public Map<String, String> nestingOverrides() {
        return nestingOverrides;
    }

    @Override
    public boolean isCalculationCandidate(Control control) {
        if (control.isStructural() || control.isEditable() || !TEXT_FIELD.equalsIgnoreCase(control.getType())) {
            return false;
        }
        String upper = control.getName().toUpperCase(Locale.ROOT);
        return CALCULATION_TOKENS.stream().anyMatch(upper::contains);
    }

    @Override
    public List<String> sourceFieldNames(Control candidate) {
        String upper = candidate.getName().toUpperCase(Locale.ROOT);
        if (SOURCE_BEARING_TOKENS.stream().anyMatch(upper::contains)) {
            return SOURCE_FIELD_NAMES;
        }
        return List.of();
    }

    @Override
    public boolean isSourceControl(Control control, String sourceFieldName) {
        return control.isInGroup()
                && !control.isStructural()
                && TEXT_FIELD.equalsIgnoreCase(control.getType())
                && control.getName().equalsIgnoreCase(sourceFieldName);
    }

    @Override
    public boolean excludeSourceInstance(ControlInstance instance, List<ControlInstance> allInstances) {
        if (!GROUP_ONLY_SOURCE_FIELDS.contains(instance.getFieldName().toUpperCase(Locale.ROOT))) {
            return false;
        }
        boolean groupInstancesExist = allInstances.stream().anyMatch(i -> i.getGroupName().isPresent());
        return groupInstancesExist && instance.getGroupName().isEmpty();
    }
}
