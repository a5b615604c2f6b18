package com.formrules.generator.codegen.rules;

import java.util.List;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.formrules.generator.codegen.collab.IdentifierSource;
import com.formrules.generator.codegen.model.form.Form;
import com.formrules.generator.codegen.model.form.FormButtons;
import com.formrules.generator.codegen.model.form.View;
import com.formrules.generator.codegen.model.form.ViewIdentifiers;
import com.formrules.generator.codegen.model.form.ViewKind;
import com.formrules.generator.codegen.registry.ViewControlRegistry;
import com.formrules.generator.codegen.rules.graph.FormControl;
import com.formrules.generator.codegen.rules.graph.FormParameter;
import com.formrules.generator.codegen.rules.graph.LayoutItem;
import com.formrules.generator.codegen.rules.graph.RuleEvent;
import com.formrules.generator.codegen.rules.graph.RuleGraph;
import com.formrules.generator.codegen.rules.graph.State;

/**
 * Creates the rule graph root of a form and owns the get-or-create accessors for
 * its structural anchors. Repeated calls return the existing anchor.
 */
public class RuleGraphAssembler {

    private static final Logger log = LoggerFactory.getLogger(RuleGraphAssembler.class);

    static final String BASE_STATE_NAME = "Base State";

    private final IdentifierSource ids;

    public RuleGraphAssembler(IdentifierSource ids) {
        this.ids = ids;
    }

    /**
     * Builds the graph root: the {@code ID} form parameter, the form buttons and
     * the layout of every deployed view. Item views start hidden.
     *
     * @throws StructuralGapException when the form has no identifier or no deployed view
     */
    public RuleGraph createGraph(Form form, String formId, ViewControlRegistry registry) {
        if (formId == null || formId.isBlank()) {
            throw new StructuralGapException(form.getName(), "Form " + form.getName() + " has no identifier");
        }

        RuleGraph graph = new RuleGraph(formId, form.getName(), form.getDisplayName());

        for (View view : form.getViews()) {
            Optional<ViewIdentifiers> identifiers = registry.getIdentifiers(view.getName());
            if (identifiers.isEmpty()) {
                log.debug("View {} not deployed; left out of the layout", view.getName());
                continue;
            }
            graph.getLayout().add(new LayoutItem(view.getName(),
                    identifiers.get().getViewId(),
                    identifiers.get().getEffectiveInstanceId(),
                    view.getKind(),
                    view.getGroupName().orElse(null),
                    view.getKind() != ViewKind.DETAIL_ITEM));
        }
        if (graph.getLayout().isEmpty()) {
            throw new StructuralGapException(form.getName(),
                    "Form " + form.getName() + " has no deployed view to attach rules to");
        }

        getOrCreateIdParameter(graph);

        form.getFormButtons().ifPresent(buttons -> {
            buttons.getSubmitId().ifPresent(id ->
                    graph.getControls().add(new FormControl(id, nameOr(buttons.getSubmitName(), FormButtons.SUBMIT_NAME), "Button")));
            buttons.getClearId().ifPresent(id ->
                    graph.getControls().add(new FormControl(id, nameOr(buttons.getClearName(), FormButtons.CLEAR_NAME), "Button")));
        });

        log.debug("Created rule graph for form {} with {} layout item(s)", form.getName(), graph.getLayout().size());
        return graph;
    }

    public FormParameter getOrCreateIdParameter(RuleGraph graph) {
        return graph.findParameter(FormParameter.ID).orElseGet(() -> {
            FormParameter parameter = new FormParameter(ids.newId(), FormParameter.ID, "Text", "");
            graph.getParameters().add(parameter);
            return parameter;
        });
    }

    public List<State> getOrCreateStates(RuleGraph graph) {
        return graph.getOrCreateStates();
    }

    public State getBaseState(RuleGraph graph) {
        List<State> states = getOrCreateStates(graph);
        return states.stream().filter(State::isBase).findFirst().orElseGet(() -> {
            State base = State.builder().id(ids.newId()).name(BASE_STATE_NAME).base(true).build();
            states.add(base);
            return base;
        });
    }

    public List<RuleEvent> getOrCreateEvents(RuleGraph graph) {
        return getBaseState(graph).getEvents();
    }

    /** Appends an event to the base state. */
    public RuleEvent addEvent(RuleGraph graph, RuleEvent event) {
        getOrCreateEvents(graph).add(event);
        return event;
    }

    private static String nameOr(String name, String fallback) {
        return name == null || name.isBlank() ? fallback : name;
    }
}
