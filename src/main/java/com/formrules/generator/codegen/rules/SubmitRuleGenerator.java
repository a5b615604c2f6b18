package com.formrules.generator.codegen.rules;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.formrules.generator.codegen.model.core.context.DiagnosticKind;
import com.formrules.generator.codegen.model.core.context.GenerationContext;
import com.formrules.generator.codegen.model.form.ControlBinding;
import com.formrules.generator.codegen.model.form.Form;
import com.formrules.generator.codegen.model.form.FormButtons;
import com.formrules.generator.codegen.model.form.RepeatingGroup;
import com.formrules.generator.codegen.model.form.ViewPair;
import com.formrules.generator.codegen.rules.graph.ActionParameter;
import com.formrules.generator.codegen.rules.graph.BindingType;
import com.formrules.generator.codegen.rules.graph.ExecutionType;
import com.formrules.generator.codegen.rules.graph.FormParameter;
import com.formrules.generator.codegen.rules.graph.Handler;
import com.formrules.generator.codegen.rules.graph.IterationFunction;
import com.formrules.generator.codegen.rules.graph.LayoutItem;
import com.formrules.generator.codegen.rules.graph.RuleAction;
import com.formrules.generator.codegen.rules.graph.RuleEvent;
import com.formrules.generator.codegen.rules.graph.RuleGraph;
import com.formrules.generator.codegen.util.NamingUtil;

/**
 * Submit button rule. Handlers, in order:
 * <ol>
 * <li>create the root record and keep its id in the {@code ID} form parameter</li>
 * <li>per repeating group, by ascending depth: create a record for every row in state
 * {@code Added}. Children of the root take their parent id from the form parameter,
 * children of a group iterate the parent group's rows and take the parent row's id.</li>
 * <li>optional confirmation message</li>
 * <li>clear the form through the clear rule</li>
 * </ol>
 * A group whose parent group cannot be located is skipped; the other handlers are
 * still emitted.
 */
public class SubmitRuleGenerator {

    private static final Logger log = LoggerFactory.getLogger(SubmitRuleGenerator.class);

    static final String LIST_ROW_HANDLER = "ForEachListViewRowHandler";
    static final String PARENT_RECORD_HANDLER = "ForEachParentRecordHandler";
    static final String CLEAR_HANDLER = RuleNodeFactory.IF_HANDLER;
    static final String PARENT_ID = "ParentID";
    static final String RECORD_ID = "ID";

    private final RuleGraphAssembler assembler;
    private final RuleNodeFactory nodes;
    private final ClearRuleGenerator clearRules;

    public SubmitRuleGenerator(RuleGraphAssembler assembler, RuleNodeFactory nodes, ClearRuleGenerator clearRules) {
        this.assembler = assembler;
        this.nodes = nodes;
        this.clearRules = clearRules;
    }

    public Optional<RuleEvent> generate(Form form, RuleGraph graph, GenerationContext context,
                                        Optional<RuleEvent> clearEvent) {
        Optional<FormButtons> buttons = context.getButtonRegistry().getFormButtons(form.getName());
        Optional<String> submitId = buttons.flatMap(FormButtons::getSubmitId);
        if (submitId.isEmpty()) {
            log.warn("No submit button registered for form {}; submit rule skipped", form.getName());
            context.report(DiagnosticKind.MISSING_BUTTON, form.getName(), "No submit button, submit rule skipped");
            return Optional.empty();
        }

        String buttonName = buttons.get().getSubmitName() == null ? FormButtons.SUBMIT_NAME : buttons.get().getSubmitName();
        RuleEvent event = nodes.formButtonEvent(graph.getFormId(), graph.getFormName(), submitId.get(), buttonName);
        FormParameter idParameter = assembler.getOrCreateIdParameter(graph);

        rootCreateHandler(form, graph, context, idParameter).ifPresent(event::addHandler);

        for (RepeatingGroup group : inDependencyOrder(form.getGroups())) {
            groupHandler(form, graph, group, context, idParameter).ifPresent(event::addHandler);
        }

        if (context.getFlags().isSubmitMessage()) {
            event.addHandler(nodes.handler("then")
                    .addAction(nodes.message("Success", form.getDisplayName() + " was submitted successfully.")));
        }

        Handler clear = nodes.handler(CLEAR_HANDLER);
        if (clearEvent.isPresent()) {
            clear.addAction(nodes.executeEvent(clearEvent.get()));
        } else {
            clearRules.clearActions(graph, ExecutionType.SYNCHRONOUS).forEach(clear::addAction);
        }
        event.addHandler(clear);

        assembler.addEvent(graph, event);
        log.info("Form {}: submit rule with {} handler(s)", form.getName(), event.getHandlers().size());
        return Optional.of(event);
    }

    /** Ascending depth; groups of equal depth keep their discovery order. */
    static List<RepeatingGroup> inDependencyOrder(List<RepeatingGroup> groups) {
        List<RepeatingGroup> ordered = new ArrayList<>(groups);
        ordered.sort(Comparator.comparingInt(RepeatingGroup::getDepth));
        return ordered;
    }

    private Optional<Handler> rootCreateHandler(Form form, RuleGraph graph, GenerationContext context,
                                                FormParameter idParameter) {
        List<LayoutItem> mainViews = graph.getLayout().stream().filter(l -> !l.getKind().isDetail()).toList();
        if (mainViews.isEmpty()) {
            log.info("Form {} has no main view; root create skipped", form.getName());
            context.getDiagnostics().info(form.getName(), "No main view, root record create skipped");
            return Optional.empty();
        }

        RuleAction create = nodes.execute(mainViews.get(0), "Create", "Create", ExecutionType.SYNCHRONOUS);
        for (LayoutItem view : mainViews) {
            fieldParameters(context.getControlRegistry().getControls(view.getViewName()), view)
                    .forEach(create::addParameter);
        }
        create.addResult(ActionParameter.builder()
                .sourceType(BindingType.OBJECT_PROPERTY)
                .sourceId(RECORD_ID)
                .sourceName(RECORD_ID)
                .sourceDisplayName(RECORD_ID)
                .targetType(BindingType.FORM_PARAMETER)
                .targetId(idParameter.getId())
                .targetName(idParameter.getName())
                .targetDisplayName(idParameter.getName())
                .build());

        return Optional.of(nodes.handler("then").addAction(create));
    }

    private Optional<Handler> groupHandler(Form form, RuleGraph graph, RepeatingGroup group,
                                           GenerationContext context, FormParameter idParameter) {
        Optional<ViewPair> pair = form.findViewPair(group.getName());
        Optional<LayoutItem> list = pair.flatMap(p -> graph.findLayoutItem(p.getListViewName()));
        if (pair.isEmpty() || !pair.get().isDeployed() || list.isEmpty()) {
            log.warn("Submit handler skipped for group {}: list view not deployed", group.getName());
            return Optional.empty();
        }
        String listViewId = pair.get().getListIdentifiers().getViewId();

        if (group.hasGroupParent()) {
            return nestedHandler(form, graph, group, list.get(), listViewId, context);
        }

        IterationFunction rows = IterationFunction.addedRows(listViewId, list.get().getInstanceId());
        RuleAction create = nodes.execute(list.get(), "Create", "Create", ExecutionType.SYNCHRONOUS);
        if (group.getDepth() > 0) {
            create.addParameter(ActionParameter.builder()
                    .sourceType(BindingType.FORM_PARAMETER)
                    .sourceId(idParameter.getId())
                    .sourceName(idParameter.getName())
                    .sourceDisplayName(idParameter.getName())
                    .targetType(BindingType.OBJECT_PROPERTY)
                    .targetId(PARENT_ID)
                    .targetName(PARENT_ID)
                    .targetDisplayName("Parent ID")
                    .build());
        }
        fieldParameters(context.getControlRegistry().getControls(list.get().getViewName()), list.get())
                .forEach(create::addParameter);

        log.info("Group {} (depth {}): rows created under the root record", group.getName(), group.getDepth());
        return Optional.of(nodes.forEachHandler(LIST_ROW_HANDLER, rows).addAction(create));
    }

    /** For each Added parent row, for each Added row of this group: create with the parent row's id. */
    private Optional<Handler> nestedHandler(Form form, RuleGraph graph, RepeatingGroup group, LayoutItem list,
                                            String listViewId, GenerationContext context) {
        String parentName = group.getParentName().orElseThrow();
        Optional<ViewPair> parentPair = form.findViewPair(parentName);
        Optional<LayoutItem> parentList = parentPair.flatMap(p -> graph.findLayoutItem(p.getListViewName()));
        if (form.findGroup(parentName).isEmpty() || parentPair.isEmpty()
                || !parentPair.get().isDeployed() || parentList.isEmpty()) {
            log.warn("Parent group {} of {} not found; submit handler skipped", parentName, group.getName());
            context.report(DiagnosticKind.UNRESOLVED_PARENT, form.getName(),
                    "Parent group " + parentName + " of " + group.getName() + " not found, submit handler skipped");
            return Optional.empty();
        }

        IterationFunction parentRows = IterationFunction.addedRows(
                parentPair.get().getListIdentifiers().getViewId(), parentList.get().getInstanceId());
        IterationFunction ownRows = IterationFunction.addedRows(listViewId, list.getInstanceId());

        RuleAction create = nodes.execute(list, "Create", "Create", ExecutionType.SYNCHRONOUS);
        create.addParameter(ActionParameter.builder()
                .sourceType(BindingType.OBJECT_PROPERTY)
                .sourceId(RECORD_ID)
                .sourceName(RECORD_ID)
                .sourceDisplayName("Parent Record ID")
                .sourceInstanceId(parentList.get().getInstanceId())
                .targetType(BindingType.OBJECT_PROPERTY)
                .targetId(PARENT_ID)
                .targetName(PARENT_ID)
                .targetDisplayName("Parent ID")
                .build());
        fieldParameters(context.getControlRegistry().getControls(list.getViewName()), list)
                .forEach(create::addParameter);

        RuleAction forEachRow = nodes.forEach(list, ownRows).addAction(create);

        log.info("Group {} (depth {}): rows created under {} rows", group.getName(), group.getDepth(), parentName);
        return Optional.of(nodes.forEachHandler(PARENT_RECORD_HANDLER, parentRows).addAction(forEachRow));
    }

    private static List<ActionParameter> fieldParameters(Map<String, ControlBinding> controls, LayoutItem view) {
        List<ActionParameter> parameters = new ArrayList<>(controls.size());
        for (ControlBinding binding : controls.values()) {
            parameters.add(ActionParameter.builder()
                    .sourceType(BindingType.CONTROL)
                    .sourceId(binding.getControlId())
                    .sourceName(binding.getControlName())
                    .sourceDisplayName(binding.getControlName())
                    .sourceInstanceId(view.getInstanceId())
                    .targetType(BindingType.OBJECT_PROPERTY)
                    .targetId(binding.getFieldName().toUpperCase(Locale.ROOT))
                    .targetName(binding.getFieldName())
                    .targetDisplayName(NamingUtil.toDisplayName(binding.getFieldName()))
                    .build());
        }
        return parameters;
    }
}
