package com.formrules.generator.codegen.rules;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.formrules.generator.codegen.model.core.context.DiagnosticKind;
import com.formrules.generator.codegen.model.core.context.GenerationContext;
import com.formrules.generator.codegen.model.form.ControlBinding;
import com.formrules.generator.codegen.model.form.Form;
import com.formrules.generator.codegen.model.form.VisibilityKind;
import com.formrules.generator.codegen.model.form.VisibilityRule;
import com.formrules.generator.codegen.rules.graph.Condition;
import com.formrules.generator.codegen.rules.graph.Handler;
import com.formrules.generator.codegen.rules.graph.LayoutItem;
import com.formrules.generator.codegen.rules.graph.RuleEvent;
import com.formrules.generator.codegen.rules.graph.RuleGraph;

/**
 * Show/hide rules driven by a trigger field. For every view holding the trigger
 * and at least one target, one OnChange event on the trigger with two guarded
 * handlers: show the targets, hide the targets.
 * <ul>
 * <li>{@link VisibilityKind#CHECKED}: trigger equals {@code True} / {@code False}</li>
 * <li>{@link VisibilityKind#NOT_EMPTY}: trigger not empty / empty</li>
 * </ul>
 * A trigger gets at most one event per view and kind. Targets outside the
 * trigger's view are not toggled from it.
 */
public class VisibilityRuleGenerator {

    private static final Logger log = LoggerFactory.getLogger(VisibilityRuleGenerator.class);

    static final String CHECKED_VALUE = "True";
    static final String UNCHECKED_VALUE = "False";

    private final RuleGraphAssembler assembler;
    private final RuleNodeFactory nodes;

    public VisibilityRuleGenerator(RuleGraphAssembler assembler, RuleNodeFactory nodes) {
        this.assembler = assembler;
        this.nodes = nodes;
    }

    /**
     * @return number of events emitted
     */
    public int generate(Form form, RuleGraph graph, GenerationContext context) {
        Set<String> emittedTriggers = new HashSet<>();
        int emitted = 0;

        for (VisibilityRule rule : form.getVisibilityRules()) {
            boolean matched = false;
            for (LayoutItem view : graph.getLayout()) {
                Map<String, ControlBinding> controls = context.getControlRegistry().getControls(view.getViewName());
                ControlBinding trigger = controls.get(rule.getTriggerField());
                if (trigger == null) {
                    continue;
                }
                List<ControlBinding> targets = targetsIn(rule, controls);
                if (targets.isEmpty()) {
                    continue;
                }
                matched = true;
                if (!emittedTriggers.add(rule.getKind() + "|" + view.getViewName() + "|" + trigger.getFieldName())) {
                    log.debug("Visibility rule for {} on {} already emitted", trigger.getFieldName(), view.getViewName());
                    continue;
                }

                RuleEvent event = nodes.controlChangeEvent(view, trigger)
                        .addHandler(toggleHandler(rule.getKind(), view, trigger, targets, true))
                        .addHandler(toggleHandler(rule.getKind(), view, trigger, targets, false));
                assembler.addEvent(graph, event);
                emitted++;
                log.debug("Visibility rule on {}: {} toggles {} control(s)",
                        view.getViewName(), trigger.getFieldName(), targets.size());
            }

            if (!matched) {
                log.warn("Visibility rule on {} skipped: trigger and targets share no view", rule.getTriggerField());
                context.report(DiagnosticKind.UNRESOLVED_CONTROL, form.getName(),
                        "Visibility rule on " + rule.getTriggerField() + describe(rule)
                                + ": trigger and targets share no view, rule skipped");
            }
        }

        log.info("Form {}: {} visibility event(s)", form.getName(), emitted);
        return emitted;
    }

    private Handler toggleHandler(VisibilityKind kind, LayoutItem view, ControlBinding trigger,
                                  List<ControlBinding> targets, boolean show) {
        Condition condition;
        if (kind == VisibilityKind.CHECKED) {
            condition = nodes.condition(Condition.EQUALS, view, trigger, show ? CHECKED_VALUE : UNCHECKED_VALUE);
        } else {
            condition = nodes.condition(show ? Condition.NOT_EMPTY : Condition.EMPTY, view, trigger, null);
        }

        Handler handler = nodes.conditionalHandler(condition);
        for (ControlBinding target : targets) {
            handler.addAction(nodes.controlVisibility(view, target, show));
        }
        return handler;
    }

    private static List<ControlBinding> targetsIn(VisibilityRule rule, Map<String, ControlBinding> controls) {
        List<ControlBinding> targets = new ArrayList<>();
        for (String field : rule.getTargetFields()) {
            ControlBinding target = controls.get(field);
            if (target != null && !field.equals(rule.getTriggerField())) {
                targets.add(target);
            }
        }
        return targets;
    }

    private static String describe(VisibilityRule rule) {
        return rule.getDescription() == null ? "" : " (" + rule.getDescription() + ")";
    }
}
