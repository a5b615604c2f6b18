package com.formrules.generator.codegen.view;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.formrules.generator.codegen.collab.NameCanonicalizer;
import com.formrules.generator.codegen.heuristics.FormHeuristics;
import com.formrules.generator.codegen.model.core.context.DiagnosticKind;
import com.formrules.generator.codegen.model.core.context.GenerationContext;
import com.formrules.generator.codegen.model.form.Control;
import com.formrules.generator.codegen.model.form.ControlBinding;
import com.formrules.generator.codegen.model.form.Form;
import com.formrules.generator.codegen.model.form.FormButtons;
import com.formrules.generator.codegen.model.form.GridPosition;
import com.formrules.generator.codegen.model.form.RepeatingGroup;
import com.formrules.generator.codegen.model.form.Segment;
import com.formrules.generator.codegen.model.form.View;
import com.formrules.generator.codegen.model.form.ViewButtons;
import com.formrules.generator.codegen.model.form.ViewKind;
import com.formrules.generator.codegen.model.form.ViewPair;
import com.formrules.generator.codegen.model.form.VisibilityKind;
import com.formrules.generator.codegen.model.form.VisibilityRule;
import com.formrules.generator.codegen.model.input.ControlDefinition;
import com.formrules.generator.codegen.model.input.DynamicSection;
import com.formrules.generator.codegen.model.input.FormDocument;
import com.formrules.generator.codegen.model.input.ViewDefinition;
import com.formrules.generator.codegen.segment.ControlSegmenter;
import com.formrules.generator.codegen.util.NamingUtil;

/**
 * Turns the input views of one form into generated views.
 *
 * An input view without repeating groups becomes one primary view. Otherwise every
 * regular segment becomes a part view and every group an item/list view pair. Buttons
 * and data control bindings of every generated view are registered in the context
 * before any rule is generated.
 *
 * Form names are unique per run: a display name that canonicalizes to an already
 * planned form gets a {@code _2}, {@code _3}, ... suffix. Dynamic sections and
 * conditional visibility entries are resolved to visibility rules by field name.
 */
public class ViewPlanner {

    private static final Logger log = LoggerFactory.getLogger(ViewPlanner.class);

    static final String ITEM_ADD_BUTTON = "Add Button";
    static final String ITEM_CANCEL_BUTTON = "Cancel";
    static final String LIST_ADD_BUTTON = "Add ToolBar Button";
    static final String LIST_DELETE_BUTTON = "Delete ToolBar Button";

    private final ControlSegmenter segmenter;

    public ViewPlanner() {
        this(new ControlSegmenter());
    }

    public ViewPlanner(ControlSegmenter segmenter) {
        this.segmenter = segmenter;
    }

    public Form plan(FormDocument document, GenerationContext context) {
        NameCanonicalizer canonicalizer = context.getCanonicalizer();
        String formName = uniqueFormName(canonicalizer.canonicalize(document.getDisplayName()), document, context);

        Form.FormBuilder form = Form.builder()
                .name(formName)
                .displayName(document.getDisplayName());

        Map<String, RepeatingGroup> groups = new LinkedHashMap<>();
        Map<String, String> fieldsByControlId = new LinkedHashMap<>();

        for (ViewDefinition definition : document.getViews()) {
            String viewBase = formName + "_" + canonicalizer.canonicalize(definition.getViewName());
            List<Control> controls = readControls(definition, context);
            controls.forEach(c -> fieldsByControlId.putIfAbsent(c.getId(), c.getName()));
            List<Segment> segments = segmenter.segment(controls);

            boolean hasGroups = segments.stream().anyMatch(Segment::isGroup);
            if (!hasGroups) {
                View primary = View.builder()
                        .name(viewBase)
                        .title(NamingUtil.toDisplayName(definition.getViewName()))
                        .kind(ViewKind.PRIMARY)
                        .sourceViewName(definition.getViewName())
                        .controls(controls)
                        .build();
                addMainView(form, primary, context);
                continue;
            }

            int part = 1;
            for (Segment segment : segments) {
                if (!segment.isGroup()) {
                    View partView = View.builder()
                            .name(viewBase + "_Part" + part)
                            .title(NamingUtil.toDisplayName(definition.getViewName()) + " " + part)
                            .kind(ViewKind.PART)
                            .sourceViewName(definition.getViewName())
                            .controls(segment.getControls())
                            .build();
                    part++;
                    addMainView(form, partView, context);
                    continue;
                }

                String groupName = segment.getGroupName();
                if (groups.containsKey(groupName)) {
                    log.info("Group {} already generated from view {}; skipping its copy in {}",
                            groupName, groups.get(groupName).getSourceViewName(), definition.getViewName());
                    context.getDiagnostics().info(formName, "Group " + groupName + " appears in more than one view; "
                            + "generated once from " + groups.get(groupName).getSourceViewName());
                    continue;
                }

                RepeatingGroup group = RepeatingGroup.builder()
                        .name(groupName)
                        .sourceViewName(definition.getViewName())
                        .controls(segment.getControls())
                        .declaredParent(segment.getControls().stream()
                                .map(c -> c.getDeclaredParentGroup().orElse(null))
                                .filter(p -> p != null)
                                .findFirst()
                                .orElse(null))
                        .build();
                groups.put(groupName, group);

                ViewPair pair = createViewPair(viewBase, group, context);
                form.view(pair.getItemView());
                form.view(pair.getListView());
                form.viewPair(pair);
            }
        }

        form.groups(groups.values());
        form.formButtons(registerFormButtons(formName, context));
        form.visibilityRules(visibilityRules(document, formName, fieldsByControlId, context));

        Form result = form.build();
        log.info("Planned form {}: {} view(s), {} repeating group(s), {} visibility rule(s)",
                formName, result.getViews().size(), result.getGroups().size(), result.getVisibilityRules().size());
        return result;
    }

    private String uniqueFormName(String baseName, FormDocument document, GenerationContext context) {
        String name = baseName;
        for (int suffix = 2; context.getButtonRegistry().getFormButtons(name).isPresent(); suffix++) {
            name = baseName + "_" + suffix;
        }
        if (!name.equals(baseName)) {
            log.warn("Form '{}' canonicalizes to {}, which is already taken; renamed to {}",
                    document.getDisplayName(), baseName, name);
            context.report(DiagnosticKind.NAME_COLLISION, name, "Form '" + document.getDisplayName()
                    + "' collides with an earlier form named " + baseName + "; generated as " + name);
        }
        return name;
    }

    /**
     * Dynamic sections reference controls by id; the trigger falls back to the
     * condition field, with an {@code is} prefix dropped when only the bare name
     * exists. Conditional visibility entries reference fields by name.
     */
    private List<VisibilityRule> visibilityRules(FormDocument document, String formName,
                                                 Map<String, String> fieldsByControlId, GenerationContext context) {
        NameCanonicalizer canonicalizer = context.getCanonicalizer();
        Collection<String> knownFields = fieldsByControlId.values();
        List<VisibilityRule> rules = new ArrayList<>();

        for (DynamicSection section : document.getDynamicSections()) {
            String description = firstNonBlank(section.getCaption(), section.getMode(), section.getCtrlId());
            String trigger = section.getCtrlId() == null ? null : fieldsByControlId.get(section.getCtrlId());
            if (trigger == null && section.getConditionField() != null && !section.getConditionField().isBlank()) {
                trigger = canonicalizer.canonicalize(section.getConditionField());
                if (!knownFields.contains(trigger) && trigger.startsWith("is") && trigger.length() > 2
                        && knownFields.contains(trigger.substring(2))) {
                    trigger = trigger.substring(2);
                }
            }
            if (trigger == null) {
                log.warn("Dynamic section {} has no resolvable trigger; skipped", description);
                context.report(DiagnosticKind.UNRESOLVED_CONTROL, formName,
                        "Dynamic section " + description + " has no resolvable trigger control, skipped");
                continue;
            }

            Set<String> targets = new LinkedHashSet<>();
            for (String controlId : section.getControls()) {
                String field = fieldsByControlId.get(controlId);
                if (field == null) {
                    log.debug("Dynamic section {}: control {} not found", description, controlId);
                } else {
                    targets.add(field);
                }
            }
            if (targets.isEmpty()) {
                log.warn("Dynamic section {} toggles no known control; skipped", description);
                context.report(DiagnosticKind.UNRESOLVED_CONTROL, formName,
                        "Dynamic section " + description + " toggles no known control, skipped");
                continue;
            }
            rules.add(VisibilityRule.builder()
                    .kind(VisibilityKind.CHECKED)
                    .triggerField(trigger)
                    .targetFields(targets)
                    .description(description)
                    .build());
        }

        document.getVisibilityTriggers().forEach((field, targetNames) -> {
            Set<String> targets = new LinkedHashSet<>();
            targetNames.forEach(t -> targets.add(canonicalizer.canonicalize(t)));
            if (targets.isEmpty()) {
                log.debug("Conditional visibility on {} lists no controls; skipped", field);
                return;
            }
            rules.add(VisibilityRule.builder()
                    .kind(VisibilityKind.NOT_EMPTY)
                    .triggerField(canonicalizer.canonicalize(field))
                    .targetFields(targets)
                    .build());
        });
        return rules;
    }

    private List<Control> readControls(ViewDefinition definition, GenerationContext context) {
        FormHeuristics heuristics = context.getHeuristics();
        NameCanonicalizer canonicalizer = context.getCanonicalizer();

        List<Control> controls = new ArrayList<>();
        for (ControlDefinition raw : definition.getControls()) {
            if (heuristics.isContainerMarker(raw.getType())) {
                log.debug("Skipping container marker {} ({})", raw.getName(), raw.getType());
                continue;
            }

            String rawName = firstNonBlank(raw.getName(), raw.getLabel(), raw.getCtrlId());
            String name = canonicalizer.canonicalize(rawName);
            String type = raw.getType() == null || raw.getType().isBlank() ? "Label" : raw.getType();
            String groupName = raw.isInRepeatingSection()
                    ? heuristics.normalizeGroupName(raw.getRepeatingSectionName())
                    : null;

            controls.add(Control.builder()
                    .id(raw.getCtrlId() == null || raw.getCtrlId().isBlank() ? context.newId() : raw.getCtrlId())
                    .name(name)
                    .type(type)
                    .label(raw.getLabel())
                    .controlName(NamingUtil.toControlName(name, type))
                    .gridPosition(GridPosition.parse(raw.getGridPosition()))
                    .groupName(groupName)
                    .declaredParentGroup(groupName == null ? null
                            : heuristics.normalizeGroupName(raw.getParentRepeatingSectionName()))
                    .structural(heuristics.isStructural(type))
                    .editable(!raw.isDisableEditing())
                    .build());
        }
        return controls;
    }

    private void addMainView(Form.FormBuilder form, View view, GenerationContext context) {
        form.view(view);
        form.rootControls(view.getDataControls());
        registerControls(view, context);
    }

    private ViewPair createViewPair(String viewBase, RepeatingGroup group, GenerationContext context) {
        String groupTitle = NamingUtil.toDisplayName(group.getName());

        ViewButtons itemButtons = ViewButtons.builder()
                .addId(context.newId())
                .addName(ITEM_ADD_BUTTON)
                .cancelId(context.newId())
                .cancelName(ITEM_CANCEL_BUTTON)
                .build();

        View itemView = View.builder()
                .name(viewBase + "_" + group.getName() + "_Item")
                .title(groupTitle)
                .kind(ViewKind.DETAIL_ITEM)
                .sourceViewName(group.getSourceViewName())
                .groupName(group.getName())
                .controls(copyControls(group.getControls(), true, context))
                .buttons(itemButtons)
                .build();

        ViewButtons listButtons = ViewButtons.builder()
                .addId(context.newId())
                .addName(LIST_ADD_BUTTON)
                .deleteId(context.newId())
                .deleteName(LIST_DELETE_BUTTON)
                .build();

        View listView = View.builder()
                .name(viewBase + "_" + group.getName() + "_List")
                .title(groupTitle + " List")
                .kind(ViewKind.DETAIL_LIST)
                .sourceViewName(group.getSourceViewName())
                .groupName(group.getName())
                .controls(copyControls(group.getControls(), false, context))
                .buttons(listButtons)
                .build();

        registerControls(itemView, context);
        registerControls(listView, context);
        context.getButtonRegistry().registerViewButtons(itemView.getName(), itemButtons);
        context.getButtonRegistry().registerViewButtons(listView.getName(), listButtons);

        log.debug("Created view pair {} / {}", itemView.getName(), listView.getName());
        return ViewPair.builder()
                .groupName(group.getName())
                .itemView(itemView)
                .listView(listView)
                .build();
    }

    /** Each detail view gets its own control identifiers; list views carry data controls only. */
    private List<Control> copyControls(List<Control> source, boolean includeStructural, GenerationContext context) {
        List<Control> copies = new ArrayList<>(source.size());
        for (Control control : source) {
            if (control.isStructural() && !includeStructural) {
                continue;
            }
            copies.add(control.toBuilder().id(context.newId()).build());
        }
        return copies;
    }

    private void registerControls(View view, GenerationContext context) {
        for (Control control : view.getDataControls()) {
            context.getControlRegistry().registerControl(view.getName(),
                    new ControlBinding(control.getName(), control.getId(), control.getControlName(), control.getType()));
        }
    }

    private FormButtons registerFormButtons(String formName, GenerationContext context) {
        FormButtons buttons = FormButtons.builder()
                .submitId(context.newId())
                .submitName(FormButtons.SUBMIT_NAME)
                .clearId(context.newId())
                .clearName(FormButtons.CLEAR_NAME)
                .build();
        context.getButtonRegistry().registerFormButtons(formName, buttons);
        return buttons;
    }

    private static String firstNonBlank(String... values) {
        for (String value : values) {
            if (value != null && !value.isBlank()) {
                return value;
            }
        }
        return null;
    }
}
