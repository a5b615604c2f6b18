package com.formrules.generator.codegen.mapping;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.formrules.generator.codegen.model.core.context.DiagnosticKind;
import com.formrules.generator.codegen.model.core.context.ToolDiagnostics;
import com.formrules.generator.codegen.model.form.ControlBinding;
import com.formrules.generator.codegen.model.form.FieldMapping;

/**
 * Matches the item view and list view of a view pair by field name.
 *
 * A mapping is produced for every field present on both sides, in the item
 * view's order. One-sided fields are reported as missing mappings and left out.
 */
public class FieldMappingBuilder {

    private static final Logger log = LoggerFactory.getLogger(FieldMappingBuilder.class);

    public List<FieldMapping> build(String groupName,
                                    Map<String, ControlBinding> itemControls,
                                    Map<String, ControlBinding> listControls,
                                    ToolDiagnostics diagnostics,
                                    String formName) {
        List<FieldMapping> mappings = new ArrayList<>();

        for (Map.Entry<String, ControlBinding> entry : itemControls.entrySet()) {
            String fieldName = entry.getKey();
            ControlBinding item = entry.getValue();
            ControlBinding list = listControls.get(fieldName);

            if (list == null) {
                log.warn("Field {} exists in item view but NOT in list view of group {}", fieldName, groupName);
                diagnostics.report(DiagnosticKind.MISSING_MAPPING, formName,
                        "Field " + fieldName + " of group " + groupName + " exists only in the item view");
                continue;
            }

            mappings.add(new FieldMapping(fieldName,
                    item.getControlId(), item.getControlName(),
                    list.getControlId(), list.getControlName()));
        }

        for (String fieldName : listControls.keySet()) {
            if (!itemControls.containsKey(fieldName)) {
                log.warn("Field {} exists in list view but NOT in item view of group {}", fieldName, groupName);
                diagnostics.report(DiagnosticKind.MISSING_MAPPING, formName,
                        "Field " + fieldName + " of group " + groupName + " exists only in the list view");
            }
        }

        log.info("Group {}: {} field mapping(s)", groupName, mappings.size());
        return mappings;
    }
}
