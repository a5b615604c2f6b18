package com.formrules.generator.codegen.rules;

import com.formrules.generator.codegen.collab.IdentifierSource;
import com.formrules.generator.codegen.model.form.ControlBinding;
import com.formrules.generator.codegen.rules.graph.ActionKind;
import com.formrules.generator.codegen.rules.graph.ActionParameter;
import com.formrules.generator.codegen.rules.graph.BindingType;
import com.formrules.generator.codegen.rules.graph.Condition;
import com.formrules.generator.codegen.rules.graph.ExecutionType;
import com.formrules.generator.codegen.rules.graph.Handler;
import com.formrules.generator.codegen.rules.graph.IterationFunction;
import com.formrules.generator.codegen.rules.graph.LayoutItem;
import com.formrules.generator.codegen.rules.graph.RuleAction;
import com.formrules.generator.codegen.rules.graph.RuleEvent;
import com.formrules.generator.codegen.rules.graph.RuleProperty;

/**
 * Builders for the recurring node shapes. Every node gets a fresh id and a fresh
 * definition id, even when an equivalent node was emitted before.
 */
public class RuleNodeFactory {

    public static final String PROP_VIEW_ID = "ViewID";
    public static final String PROP_FORM_ID = "FormID";
    public static final String PROP_FRIENDLY_NAME = "RuleFriendlyName";
    public static final String PROP_LOCATION = "Location";
    public static final String PROP_HANDLER_NAME = "HandlerName";
    public static final String PROP_METHOD = "Method";
    public static final String PROP_EVENT_ID = "EventID";
    public static final String PROP_CONTROL_ID = "ControlID";
    public static final String PROP_NAME = "Name";

    public static final String DISPLAY_TARGET = "display";
    public static final String SHOW = "Show";
    public static final String HIDE = "Hide";
    public static final String IS_VISIBLE_TARGET = "isvisible";
    public static final String IF_HANDLER = "IfLogicalHandler";

    private final IdentifierSource ids;

    public RuleNodeFactory(IdentifierSource ids) {
        this.ids = ids;
    }

    /** Click event of a button inside a view. */
    public RuleEvent viewButtonEvent(LayoutItem view, String buttonId, String buttonName) {
        return RuleEvent.builder()
                .id(ids.newId())
                .definitionId(ids.newId())
                .sourceId(buttonId)
                .sourceName(buttonName)
                .sourceDisplayName(buttonName)
                .instanceId(view.getInstanceId())
                .build()
                .addProperty(RuleProperty.of(PROP_VIEW_ID, view.getViewId(), view.getViewName()))
                .addProperty(RuleProperty.of(PROP_FRIENDLY_NAME,
                        "On " + view.getViewName() + ", when " + buttonName + " is Clicked"))
                .addProperty(RuleProperty.of(PROP_LOCATION, view.getViewName()));
    }

    /** Click event of a form-level button. */
    public RuleEvent formButtonEvent(String formId, String formName, String buttonId, String buttonName) {
        return RuleEvent.builder()
                .id(ids.newId())
                .definitionId(ids.newId())
                .sourceId(buttonId)
                .sourceName(buttonName)
                .sourceDisplayName(buttonName)
                .build()
                .addProperty(RuleProperty.of(PROP_FORM_ID, formId, formName))
                .addProperty(RuleProperty.of(PROP_FRIENDLY_NAME, "When " + buttonName + " is Clicked"))
                .addProperty(RuleProperty.of(PROP_LOCATION, formName));
    }

    /** Change event of a data control inside a view. */
    public RuleEvent controlChangeEvent(LayoutItem view, ControlBinding control) {
        return RuleEvent.builder()
                .id(ids.newId())
                .definitionId(ids.newId())
                .name("OnChange")
                .sourceId(control.getControlId())
                .sourceName(control.getFieldName())
                .sourceDisplayName(control.getControlName())
                .instanceId(view.getInstanceId())
                .build()
                .addProperty(RuleProperty.of(PROP_VIEW_ID, view.getViewId(), view.getViewName()))
                .addProperty(RuleProperty.of(PROP_FRIENDLY_NAME,
                        "On " + view.getViewName() + ", when " + control.getFieldName() + " is Changed"))
                .addProperty(RuleProperty.of(PROP_LOCATION, view.getViewName()));
    }

    public Handler handler(String handlerName) {
        return Handler.builder()
                .id(ids.newId())
                .definitionId(ids.newId())
                .build()
                .addProperty(RuleProperty.of(PROP_HANDLER_NAME, handlerName))
                .addProperty(RuleProperty.of(PROP_LOCATION, "form"));
    }

    public Handler forEachHandler(String handlerName, IterationFunction function) {
        return Handler.builder()
                .id(ids.newId())
                .definitionId(ids.newId())
                .type(Handler.FOR_EACH)
                .function(function)
                .build()
                .addProperty(RuleProperty.of(PROP_HANDLER_NAME, handlerName))
                .addProperty(RuleProperty.of(PROP_LOCATION, "form"));
    }

    /** {@code IfLogicalHandler} scoped to a view; its actions run only when the condition holds. */
    public Handler conditionalHandler(Condition condition) {
        return Handler.builder()
                .id(ids.newId())
                .definitionId(ids.newId())
                .build()
                .addProperty(RuleProperty.of(PROP_HANDLER_NAME, IF_HANDLER))
                .addProperty(RuleProperty.of(PROP_LOCATION, "view"))
                .addCondition(condition);
    }

    /**
     * Tests a control of a view. {@code value} is the compared value for
     * {@link Condition#EQUALS}, {@code null} for the empty checks.
     */
    public Condition condition(String conditionName, LayoutItem view, ControlBinding control, String value) {
        Condition condition = Condition.builder()
                .id(ids.newId())
                .definitionId(ids.newId())
                .build()
                .addProperty(RuleProperty.of(PROP_LOCATION, "View"))
                .addProperty(RuleProperty.of(PROP_NAME, conditionName))
                .addOperand(ActionParameter.builder()
                        .sourceType(BindingType.CONTROL)
                        .sourceId(control.getControlId())
                        .sourceName(control.getFieldName())
                        .sourceDisplayName(control.getControlName())
                        .sourceInstanceId(view.getInstanceId())
                        .build());
        if (value != null) {
            condition.addOperand(ActionParameter.builder()
                    .sourceType(BindingType.VALUE)
                    .sourceValue(value)
                    .build());
        }
        return condition;
    }

    /** Shows or hides a single control through its {@code isvisible} control property. */
    public RuleAction controlVisibility(LayoutItem view, ControlBinding control, boolean show) {
        return RuleAction.builder()
                .id(ids.newId())
                .definitionId(ids.newId())
                .type(ActionKind.TRANSFER)
                .executionType(ExecutionType.PARALLEL)
                .instanceId(view.getInstanceId())
                .build()
                .addProperty(RuleProperty.of(PROP_LOCATION, "View"))
                .addProperty(RuleProperty.of(PROP_CONTROL_ID, control.getControlId(), control.getControlName()))
                .addProperty(RuleProperty.of(PROP_VIEW_ID, view.getViewId(), view.getViewName()))
                .addParameter(ActionParameter.builder()
                        .sourceType(BindingType.VALUE)
                        .sourceValue(Boolean.toString(show))
                        .targetType(BindingType.CONTROL_PROPERTY)
                        .targetId(IS_VISIBLE_TARGET)
                        .targetName(control.getControlName())
                        .targetDisplayName(control.getControlName())
                        .targetInstanceId(view.getInstanceId())
                        .build());
    }

    /** Shows or hides a view through its {@code display} view property. */
    public RuleAction visibility(LayoutItem view, boolean show) {
        return RuleAction.builder()
                .id(ids.newId())
                .definitionId(ids.newId())
                .type(ActionKind.TRANSFER)
                .executionType(ExecutionType.PARALLEL)
                .instanceId(view.getInstanceId())
                .build()
                .addProperty(RuleProperty.of(PROP_LOCATION, "Form"))
                .addProperty(RuleProperty.of(PROP_VIEW_ID, view.getViewId(), view.getViewName()))
                .addParameter(ActionParameter.builder()
                        .sourceType(BindingType.VALUE)
                        .sourceValue(show ? SHOW : HIDE)
                        .targetType(BindingType.VIEW_PROPERTY)
                        .targetId(DISPLAY_TARGET)
                        .targetName(DISPLAY_TARGET)
                        .targetInstanceId(view.getInstanceId())
                        .build());
    }

    /** Calls a view method, e.g. {@code Clear} or {@code Create}. */
    public RuleAction execute(LayoutItem view, String method, String methodDisplay, ExecutionType executionType) {
        return RuleAction.builder()
                .id(ids.newId())
                .definitionId(ids.newId())
                .type(ActionKind.EXECUTE)
                .executionType(executionType)
                .instanceId(view.getInstanceId())
                .build()
                .addProperty(RuleProperty.of(PROP_METHOD, method, methodDisplay))
                .addProperty(RuleProperty.of(PROP_VIEW_ID, view.getViewId(), view.getViewName()));
    }

    /** Calls a list view row method, e.g. {@code AddItem}. */
    public RuleAction listMethod(LayoutItem listView, String method, String methodDisplay) {
        return RuleAction.builder()
                .id(ids.newId())
                .definitionId(ids.newId())
                .type(ActionKind.LIST)
                .executionType(ExecutionType.SYNCHRONOUS)
                .instanceId(listView.getInstanceId())
                .build()
                .addProperty(RuleProperty.of(PROP_METHOD, method, methodDisplay))
                .addProperty(RuleProperty.of(PROP_VIEW_ID, listView.getViewId(), listView.getViewName()));
    }

    public RuleAction transfer(String formId, String formName) {
        return RuleAction.builder()
                .id(ids.newId())
                .definitionId(ids.newId())
                .type(ActionKind.TRANSFER)
                .executionType(ExecutionType.SYNCHRONOUS)
                .build()
                .addProperty(RuleProperty.of(PROP_FORM_ID, formId, formName));
    }

    /** Runs the handlers of another event, referenced by its definition id. */
    public RuleAction executeEvent(RuleEvent target) {
        return RuleAction.builder()
                .id(ids.newId())
                .definitionId(ids.newId())
                .type(ActionKind.EXECUTE)
                .executionType(ExecutionType.SYNCHRONOUS)
                .build()
                .addProperty(RuleProperty.of(PROP_EVENT_ID, target.getDefinitionId(),
                        target.propertyValue(PROP_FRIENDLY_NAME).orElse(target.getSourceName())));
    }

    public RuleAction forEach(LayoutItem listView, IterationFunction function) {
        return RuleAction.builder()
                .id(ids.newId())
                .definitionId(ids.newId())
                .type(ActionKind.FOR_EACH)
                .executionType(ExecutionType.SYNCHRONOUS)
                .instanceId(listView.getInstanceId())
                .function(function)
                .build();
    }

    public RuleAction message(String title, String body) {
        return RuleAction.builder()
                .id(ids.newId())
                .definitionId(ids.newId())
                .type(ActionKind.POPUP)
                .executionType(ExecutionType.SYNCHRONOUS)
                .build()
                .addProperty(RuleProperty.of(PROP_METHOD, "ShowMessage", "Show a message"))
                .addProperty(RuleProperty.of("Title", title))
                .addProperty(RuleProperty.of("Body", body))
                .addProperty(RuleProperty.of("MessageBoxType", "Information"));
    }
}
