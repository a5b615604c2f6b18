package com.formrules.generator.codegen.rules;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.formrules.generator.codegen.model.core.context.DiagnosticKind;
import com.formrules.generator.codegen.model.core.context.GenerationContext;
import com.formrules.generator.codegen.model.form.Form;
import com.formrules.generator.codegen.model.form.FormButtons;
import com.formrules.generator.codegen.rules.graph.ExecutionType;
import com.formrules.generator.codegen.rules.graph.Handler;
import com.formrules.generator.codegen.rules.graph.LayoutItem;
import com.formrules.generator.codegen.rules.graph.RuleAction;
import com.formrules.generator.codegen.rules.graph.RuleEvent;
import com.formrules.generator.codegen.rules.graph.RuleGraph;

/**
 * Clear Form Button rule: one Clear action per view of the form layout.
 */
public class ClearRuleGenerator {

    private static final Logger log = LoggerFactory.getLogger(ClearRuleGenerator.class);

    private final RuleGraphAssembler assembler;
    private final RuleNodeFactory nodes;

    public ClearRuleGenerator(RuleGraphAssembler assembler, RuleNodeFactory nodes) {
        this.assembler = assembler;
        this.nodes = nodes;
    }

    /**
     * @return the emitted event, empty when the form has no clear button
     */
    public Optional<RuleEvent> generate(Form form, RuleGraph graph, GenerationContext context) {
        Optional<FormButtons> buttons = context.getButtonRegistry().getFormButtons(form.getName());
        Optional<String> clearId = buttons.flatMap(FormButtons::getClearId);
        if (clearId.isEmpty()) {
            log.warn("No clear button registered for form {}; clear rule skipped", form.getName());
            context.report(DiagnosticKind.MISSING_BUTTON, form.getName(), "No clear button, clear rule skipped");
            return Optional.empty();
        }

        String buttonName = buttons.get().getClearName() == null ? FormButtons.CLEAR_NAME : buttons.get().getClearName();
        Handler handler = nodes.handler("then");
        clearActions(graph, ExecutionType.PARALLEL).forEach(handler::addAction);

        RuleEvent event = nodes.formButtonEvent(graph.getFormId(), graph.getFormName(), clearId.get(), buttonName)
                .addHandler(handler);
        assembler.addEvent(graph, event);

        log.info("Form {}: clear rule covers {} view(s)", form.getName(), handler.getActions().size());
        return Optional.of(event);
    }

    /** Clear actions for every view of the layout, main and detail views alike. */
    public List<RuleAction> clearActions(RuleGraph graph, ExecutionType executionType) {
        List<RuleAction> actions = new ArrayList<>();
        for (LayoutItem view : graph.getLayout()) {
            actions.add(nodes.execute(view, "Clear", "Clear", executionType));
        }
        return actions;
    }
}
