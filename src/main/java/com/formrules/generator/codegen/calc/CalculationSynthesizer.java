package com.formrules.generator.codegen.calc;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.formrules.generator.codegen.heuristics.FormHeuristics;
import com.formrules.generator.codegen.model.core.context.DiagnosticKind;
import com.formrules.generator.codegen.model.core.context.GenerationContext;
import com.formrules.generator.codegen.model.form.CalculationField;
import com.formrules.generator.codegen.model.form.Control;
import com.formrules.generator.codegen.model.form.ControlInstance;
import com.formrules.generator.codegen.model.form.Form;
import com.formrules.generator.codegen.model.form.SourceField;
import com.formrules.generator.codegen.model.form.View;
import com.formrules.generator.codegen.model.form.ViewKind;
import com.formrules.generator.codegen.registry.ViewControlRegistry;
import com.formrules.generator.codegen.rules.graph.ActionParameter;
import com.formrules.generator.codegen.rules.graph.BindingType;
import com.formrules.generator.codegen.rules.graph.Expression;
import com.formrules.generator.codegen.rules.graph.ListSumItem;
import com.formrules.generator.codegen.rules.graph.RuleGraph;
import com.formrules.generator.codegen.util.NamingUtil;

/**
 * Emits one {@code ListSum} expression per distinct set of source fields feeding
 * calculated fields.
 *
 * Runs after the submit rule: source control instances are collected from the
 * action parameters already in the graph, so a field only contributes the controls
 * that are actually persisted.
 */
public class CalculationSynthesizer {

    private static final Logger log = LoggerFactory.getLogger(CalculationSynthesizer.class);

    public List<Expression> synthesize(Form form, RuleGraph graph, GenerationContext context) {
        List<CalculationField> candidates = findCalculationFields(form, context);
        if (candidates.isEmpty()) {
            log.debug("Form {}: no calculated fields", form.getName());
            return List.of();
        }

        Map<String, List<CalculationField>> bySources = new LinkedHashMap<>();
        for (CalculationField candidate : candidates) {
            bySources.computeIfAbsent(candidate.getSourceKey(), k -> new ArrayList<>()).add(candidate);
        }

        List<Expression> expressions = new ArrayList<>();
        for (List<CalculationField> sharing : bySources.values()) {
            Expression expression = buildExpression(form, graph, sharing.get(0), context);
            graph.getOrCreateExpressions().add(expression);
            expressions.add(expression);
            if (sharing.size() > 1) {
                log.info("Expression '{}' shared by {} calculated fields", expression.getName(), sharing.size());
            }
        }

        log.info("Form {}: {} calculation expression(s) from {} calculated field(s)",
                form.getName(), expressions.size(), candidates.size());
        return expressions;
    }

    /**
     * Candidates of the main and item views, one per field name. Candidates without any
     * source field are dropped.
     */
    List<CalculationField> findCalculationFields(Form form, GenerationContext context) {
        FormHeuristics heuristics = context.getHeuristics();
        List<Control> groupControls = form.getGroups().stream()
                .flatMap(g -> g.getControls().stream())
                .toList();

        Map<String, CalculationField> byField = new LinkedHashMap<>();
        for (View view : form.getViews()) {
            if (view.getKind() == ViewKind.DETAIL_LIST) {
                continue;
            }
            for (Control control : view.getDataControls()) {
                if (!heuristics.isCalculationCandidate(control) || byField.containsKey(control.getName())) {
                    continue;
                }
                Set<SourceField> sources = new LinkedHashSet<>();
                for (String sourceName : heuristics.sourceFieldNames(control)) {
                    groupControls.stream()
                            .filter(c -> heuristics.isSourceControl(c, sourceName))
                            .forEach(c -> sources.add(new SourceField(c.getName(), c.getGroupName().orElseThrow())));
                }
                if (sources.isEmpty()) {
                    log.info("Calculated field {} has no source fields; skipped", control.getName());
                    context.getDiagnostics().info(form.getName(),
                            "Calculated field " + control.getName() + " has no source fields");
                    continue;
                }
                byField.put(control.getName(), CalculationField.builder()
                        .fieldName(control.getName())
                        .type(control.getType())
                        .label(control.getLabel())
                        .viewName(view.getName())
                        .controlId(control.getId())
                        .sourceFields(sources)
                        .build());
            }
        }
        return new ArrayList<>(byField.values());
    }

    private Expression buildExpression(Form form, RuleGraph graph, CalculationField representative,
                                       GenerationContext context) {
        List<String> sourceNames = representative.getSourceFields().stream()
                .map(SourceField::getFieldName)
                .distinct()
                .sorted()
                .toList();
        String controlNames = sourceNames.stream()
                .map(s -> NamingUtil.toControlName(s, "TextField"))
                .collect(Collectors.joining(", "));

        Expression expression = Expression.builder()
                .id(context.newId())
                .name("Sum of all " + String.join(", ", sourceNames) + " fields")
                .displayValue("List Sum( " + controlNames + " )")
                .representativeField(representative.getFieldName())
                .sourceFields(new ArrayList<>(sourceNames))
                .build();

        for (String sourceName : sourceNames) {
            List<ControlInstance> instances = findInstances(graph, sourceName, context.getControlRegistry(), form);
            if (instances.isEmpty()) {
                log.warn("No control instance of {} in the rules of {}; left out of '{}'",
                        sourceName, form.getName(), expression.getName());
                context.report(DiagnosticKind.MISSING_MAPPING, form.getName(),
                        "Calculation source " + sourceName + " has no control instance, omitted from "
                                + expression.getName());
                continue;
            }

            List<ControlInstance> kept = instances;
            if (spansSeveralViews(instances)) {
                kept = instances.stream()
                        .filter(i -> !context.getHeuristics().excludeSourceInstance(i, instances))
                        .toList();
                log.debug("Source {}: {} of {} instance(s) kept", sourceName, kept.size(), instances.size());
            }

            for (ControlInstance instance : kept) {
                String entity = instance.getGroupName().orElse(form.getName());
                expression.addItem(new ListSumItem(BindingType.CONTROL,
                        instance.getViewInstanceId(),
                        instance.getControlId(),
                        instance.getControlName(),
                        context.lookupFieldDataType(entity, instance.getFieldName())));
            }
        }
        return expression;
    }

    /** Control parameters of emitted actions that bind the field, one per control id. */
    List<ControlInstance> findInstances(RuleGraph graph, String fieldName, ViewControlRegistry registry, Form form) {
        Map<String, ControlInstance> byControlId = new LinkedHashMap<>();
        graph.actions()
                .flatMap(a -> a.getParameters().stream())
                .filter(p -> p.getSourceType() == BindingType.CONTROL)
                .filter(p -> p.getSourceId() != null && p.getSourceInstanceId() != null)
                .filter(p -> bindsField(p, fieldName))
                .forEach(p -> byControlId.computeIfAbsent(p.getSourceId(), id -> {
                    String viewName = registry.findViewByInstanceId(p.getSourceInstanceId()).orElse(null);
                    String groupName = form.getViews().stream()
                            .filter(v -> v.getName().equals(viewName))
                            .findFirst()
                            .flatMap(View::getGroupName)
                            .orElse(null);
                    return new ControlInstance(fieldName, id, p.getSourceName(), p.getSourceInstanceId(),
                            viewName, groupName);
                }));
        return new ArrayList<>(byControlId.values());
    }

    private static boolean bindsField(ActionParameter parameter, String fieldName) {
        return fieldName.equalsIgnoreCase(parameter.getTargetId())
                || fieldName.equalsIgnoreCase(parameter.getTargetName());
    }

    private static boolean spansSeveralViews(List<ControlInstance> instances) {
        return instances.stream().map(ControlInstance::getViewInstanceId).distinct().count() > 1;
    }
}
