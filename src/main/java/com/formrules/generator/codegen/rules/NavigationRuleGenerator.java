package com.formrules.generator.codegen.rules;

import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.formrules.generator.codegen.model.core.context.DiagnosticKind;
import com.formrules.generator.codegen.model.core.context.GenerationContext;
import com.formrules.generator.codegen.model.form.FieldMapping;
import com.formrules.generator.codegen.model.form.Form;
import com.formrules.generator.codegen.model.form.ViewButtons;
import com.formrules.generator.codegen.model.form.ViewPair;
import com.formrules.generator.codegen.rules.graph.ActionParameter;
import com.formrules.generator.codegen.rules.graph.BindingType;
import com.formrules.generator.codegen.rules.graph.ExecutionType;
import com.formrules.generator.codegen.rules.graph.Handler;
import com.formrules.generator.codegen.rules.graph.LayoutItem;
import com.formrules.generator.codegen.rules.graph.RuleAction;
import com.formrules.generator.codegen.rules.graph.RuleEvent;
import com.formrules.generator.codegen.rules.graph.RuleGraph;

/**
 * Show/hide and row commit rules of every view pair:
 * <ul>
 * <li>Add on the list view: hide list, show item</li>
 * <li>Cancel on the item view: hide item, show list</li>
 * <li>Add on the item view: append a row, transfer the mapped fields, accept the row,
 * clear the item view, hide item, show list</li>
 * </ul>
 * Each rule is skipped on its own when its button is not registered.
 */
public class NavigationRuleGenerator {

    private static final Logger log = LoggerFactory.getLogger(NavigationRuleGenerator.class);

    private static final String THEN = "then";

    private final RuleGraphAssembler assembler;
    private final RuleNodeFactory nodes;

    public NavigationRuleGenerator(RuleGraphAssembler assembler, RuleNodeFactory nodes) {
        this.assembler = assembler;
        this.nodes = nodes;
    }

    /**
     * @return number of events emitted
     */
    public int generate(Form form, RuleGraph graph, GenerationContext context) {
        int emitted = 0;
        for (ViewPair pair : form.getViewPairs()) {
            Optional<LayoutItem> item = graph.findLayoutItem(pair.getItemViewName());
            Optional<LayoutItem> list = graph.findLayoutItem(pair.getListViewName());
            if (!pair.isDeployed() || item.isEmpty() || list.isEmpty()) {
                log.warn("Navigation rules skipped for group {}: view pair not deployed", pair.getGroupName());
                continue;
            }
            emitted += generateForPair(form, graph, pair, item.get(), list.get(), context);
        }
        log.info("Form {}: {} navigation event(s)", form.getName(), emitted);
        return emitted;
    }

    int generateForPair(Form form, RuleGraph graph, ViewPair pair, LayoutItem item, LayoutItem list,
                        GenerationContext context) {
        int emitted = 0;
        Optional<ViewButtons> listButtons = context.getButtonRegistry().getViewButtons(pair.getListViewName());
        Optional<ViewButtons> itemButtons = context.getButtonRegistry().getViewButtons(pair.getItemViewName());

        Optional<String> listAdd = listButtons.flatMap(ViewButtons::getAddId);
        if (listAdd.isPresent()) {
            String name = nameOr(listButtons.get().getAddName(), "Add ToolBar Button");
            RuleEvent event = nodes.viewButtonEvent(list, listAdd.get(), name)
                    .addHandler(nodes.handler(THEN)
                            .addAction(nodes.visibility(list, false))
                            .addAction(nodes.visibility(item, true)));
            assembler.addEvent(graph, event);
            emitted++;
        } else {
            skip(context, form, pair, "Add", pair.getListViewName());
        }

        Optional<String> itemAdd = itemButtons.flatMap(ViewButtons::getAddId);
        if (itemAdd.isPresent()) {
            String name = nameOr(itemButtons.get().getAddName(), "Add Button");
            RuleEvent event = nodes.viewButtonEvent(item, itemAdd.get(), name)
                    .addHandler(commitHandler(graph, pair, item, list));
            assembler.addEvent(graph, event);
            emitted++;
        } else {
            skip(context, form, pair, "Add", pair.getItemViewName());
        }

        Optional<String> itemCancel = itemButtons.flatMap(ViewButtons::getCancelId);
        if (itemCancel.isPresent()) {
            String name = nameOr(itemButtons.get().getCancelName(), "Cancel");
            RuleEvent event = nodes.viewButtonEvent(item, itemCancel.get(), name)
                    .addHandler(nodes.handler(THEN)
                            .addAction(nodes.visibility(item, false))
                            .addAction(nodes.visibility(list, true)));
            assembler.addEvent(graph, event);
            emitted++;
        } else {
            skip(context, form, pair, "Cancel", pair.getItemViewName());
        }

        return emitted;
    }

    /** Steps 1-4 depend on each other and run synchronously; the two toggles run in parallel. */
    private Handler commitHandler(RuleGraph graph, ViewPair pair, LayoutItem item, LayoutItem list) {
        Handler handler = nodes.handler(THEN);
        handler.addAction(nodes.listMethod(list, "AddItem", "Add item"));

        if (!pair.getFieldMappings().isEmpty()) {
            RuleAction transfer = nodes.transfer(graph.getFormId(), graph.getFormName());
            for (FieldMapping mapping : pair.getFieldMappings()) {
                transfer.addParameter(ActionParameter.builder()
                        .sourceType(BindingType.CONTROL)
                        .sourceId(mapping.getItemControlId())
                        .sourceName(mapping.getItemControlName())
                        .sourceInstanceId(item.getInstanceId())
                        .targetType(BindingType.CONTROL)
                        .targetId(mapping.getListControlId())
                        .targetName(mapping.getListControlName())
                        .targetInstanceId(list.getInstanceId())
                        .build());
            }
            handler.addAction(transfer);
        } else {
            log.warn("Group {} has no field mappings; commit rule transfers no data", pair.getGroupName());
        }

        handler.addAction(nodes.listMethod(list, "AcceptItem", "Accept item"));
        handler.addAction(nodes.execute(item, "Clear", "Clear", ExecutionType.SYNCHRONOUS));
        handler.addAction(nodes.visibility(item, false));
        handler.addAction(nodes.visibility(list, true));
        return handler;
    }

    private void skip(GenerationContext context, Form form, ViewPair pair, String button, String viewName) {
        log.warn("No {} button registered for view {}; rule skipped", button, viewName);
        context.report(DiagnosticKind.MISSING_BUTTON, form.getName(),
                "Group " + pair.getGroupName() + ": no " + button + " button on view " + viewName + ", rule skipped");
    }

    private static String nameOr(String name, String fallback) {
        return name == null || name.isBlank() ? fallback : name;
    }
}
