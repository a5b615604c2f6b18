package com.formrules.generator.codegen.rules;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.formrules.generator.codegen.model.core.context.DiagnosticKind;
import com.formrules.generator.codegen.model.core.context.ToolDiagnostics;
import com.formrules.generator.codegen.rules.graph.ActionKind;
import com.formrules.generator.codegen.rules.graph.ActionParameter;
import com.formrules.generator.codegen.rules.graph.BindingType;
import com.formrules.generator.codegen.rules.graph.LayoutItem;
import com.formrules.generator.codegen.rules.graph.RuleAction;
import com.formrules.generator.codegen.rules.graph.RuleEvent;
import com.formrules.generator.codegen.rules.graph.RuleGraph;

/**
 * Post-generation consistency checks. Findings are reported as warnings; the
 * graph is never modified.
 */
public class RuleGraphValidator {

    private static final Logger log = LoggerFactory.getLogger(RuleGraphValidator.class);

    /**
     * @return number of issues found
     */
    public int validate(RuleGraph graph, ToolDiagnostics diagnostics, String formName) {
        List<String> issues = new ArrayList<>();

        for (RuleEvent event : graph.events().toList()) {
            String label = event.propertyValue(RuleNodeFactory.PROP_FRIENDLY_NAME).orElse(event.getSourceName());
            if (!event.hasProperty(RuleNodeFactory.PROP_FRIENDLY_NAME)) {
                issues.add("Event on " + event.getSourceName() + " has no " + RuleNodeFactory.PROP_FRIENDLY_NAME);
            }
            if (!event.hasProperty(RuleNodeFactory.PROP_LOCATION)) {
                issues.add("Event '" + label + "' has no " + RuleNodeFactory.PROP_LOCATION);
            }
            if (!event.hasProperty(RuleNodeFactory.PROP_VIEW_ID) && !event.hasProperty(RuleNodeFactory.PROP_FORM_ID)) {
                issues.add("Event '" + label + "' has neither " + RuleNodeFactory.PROP_VIEW_ID
                        + " nor " + RuleNodeFactory.PROP_FORM_ID);
            }
        }

        Set<String> layoutInstances = graph.getLayout().stream()
                .map(LayoutItem::getInstanceId)
                .collect(Collectors.toSet());

        for (RuleAction action : graph.actions().toList()) {
            if (action.getInstanceId() != null && !layoutInstances.contains(action.getInstanceId())) {
                issues.add(action.getType().getWireName() + " action " + action.getId()
                        + " targets instance " + action.getInstanceId() + " outside the form layout");
            }
            if (action.getType() == ActionKind.TRANSFER) {
                for (ActionParameter parameter : action.getParameters()) {
                    if (parameter.getTargetType() == BindingType.VIEW_PROPERTY
                            && RuleNodeFactory.DISPLAY_TARGET.equals(parameter.getTargetName())
                            && (parameter.getTargetInstanceId() == null || parameter.getTargetInstanceId().isBlank())) {
                        issues.add("Visibility action " + action.getId() + " has no target instance id");
                    }
                }
            }
        }

        for (String issue : issues) {
            log.warn("Validation: {}", issue);
            diagnostics.report(DiagnosticKind.VALIDATION, formName, issue);
        }
        if (issues.isEmpty()) {
            log.debug("Rule graph of {} passed validation", formName);
        }
        return issues.size();
    }
}
