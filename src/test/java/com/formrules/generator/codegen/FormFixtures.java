package com.formrules.generator.codegen;

import java.util.List;
import java.util.Map;

import com.formrules.generator.codegen.collab.DataColumnFieldMetadataService;
import com.formrules.generator.codegen.collab.DefaultNameCanonicalizer;
import com.formrules.generator.codegen.collab.DeploymentException;
import com.formrules.generator.codegen.collab.IdentifierSource;
import com.formrules.generator.codegen.collab.LocalViewDeploymentClient;
import com.formrules.generator.codegen.collab.SequentialIdentifierSource;
import com.formrules.generator.codegen.heuristics.DefaultFormHeuristics;
import com.formrules.generator.codegen.mapping.FieldMappingBuilder;
import com.formrules.generator.codegen.model.core.context.GenerationContext;
import com.formrules.generator.codegen.model.core.context.GenerationFlags;
import com.formrules.generator.codegen.model.core.context.GeneratorConfig;
import com.formrules.generator.codegen.model.form.Form;
import com.formrules.generator.codegen.model.form.RepeatingGroup;
import com.formrules.generator.codegen.model.form.View;
import com.formrules.generator.codegen.model.form.ViewPair;
import com.formrules.generator.codegen.model.input.ControlDefinition;
import com.formrules.generator.codegen.model.input.DataColumn;
import com.formrules.generator.codegen.model.input.FormDocument;
import com.formrules.generator.codegen.model.input.ViewDefinition;
import com.formrules.generator.codegen.nesting.NestingResolver;
import com.formrules.generator.codegen.view.ViewPlanner;

/**
 * Form documents and prepared forms shared by the rule generator tests.
 *
 * The purchase order form has one view:
 * row 1 CustomerName, row 2 LineItems(Description, Amount), row 3 LineItemDetails(DetailNote)
 * when nested, last row Total (read-only).
 */
public final class FormFixtures {

    public static final String FORM = "Purchase_Order";
    public static final String ITEM_VIEW = "Purchase_Order_Main_LineItems_Item";
    public static final String LIST_VIEW = "Purchase_Order_Main_LineItems_List";
    public static final String DETAIL_ITEM_VIEW = "Purchase_Order_Main_LineItemDetails_Item";
    public static final String DETAIL_LIST_VIEW = "Purchase_Order_Main_LineItemDetails_List";

    private FormFixtures() {
    }

    public static GenerationContext context() {
        return context(GeneratorConfig.builder().build(), new SequentialIdentifierSource());
    }

    public static GenerationContext context(GeneratorConfig config, IdentifierSource ids) {
        return GenerationContext.builder()
                .config(config)
                .flags(GenerationFlags.from(config))
                .heuristics(new DefaultFormHeuristics(config.getNestingOverrides()))
                .canonicalizer(new DefaultNameCanonicalizer())
                .identifiers(ids)
                .deploymentClient(new LocalViewDeploymentClient(ids))
                .build();
    }

    public static ControlDefinition field(String name, String type, String grid) {
        return ControlDefinition.builder()
                .name(name)
                .ctrlId("ctrl-" + name)
                .type(type)
                .label(name)
                .gridPosition(grid)
                .build();
    }

    public static ControlDefinition grouped(String name, String grid, String group) {
        return field(name, "TextField", grid).toBuilder()
                .ctrlId("ctrl-" + group + "-" + name)
                .inRepeatingSection(true)
                .repeatingSectionName(group)
                .build();
    }

    public static FormDocument lineItems() {
        return FormDocument.builder()
                .displayName("Purchase Order")
                .view(ViewDefinition.builder()
                        .viewName("Main")
                        .control(field("CustomerName", "TextField", "1A"))
                        .control(field("LineItemsTable", "repeatingtable", "2A"))
                        .control(grouped("Description", "2A", "LineItems"))
                        .control(grouped("Amount", "2B", "LineItems"))
                        .control(field("Total", "TextField", "4A").toBuilder().disableEditing(true).build())
                        .build())
                .dataColumn(DataColumn.builder()
                        .columnName("Amount")
                        .repeating(true)
                        .repeatingSectionName("LineItems")
                        .dataType("Decimal")
                        .build())
                .build();
    }

    public static FormDocument nestedLineItems() {
        FormDocument base = lineItems();
        ViewDefinition main = base.getViews().get(0);
        ViewDefinition.ViewDefinitionBuilder view = ViewDefinition.builder().viewName(main.getViewName());
        for (ControlDefinition control : main.getControls()) {
            if ("Total".equals(control.getName())) {
                view.control(grouped("DetailNote", "3A", "LineItemDetails"));
            }
            view.control(control);
        }
        return base.toBuilder().clearViews().view(view.build()).build();
    }

    public static GeneratorConfig nestedConfig() {
        return GeneratorConfig.builder()
                .nestingOverrides(Map.of("LineItemDetails", "LineItems"))
                .build();
    }

    /**
     * Plans, resolves nesting, deploys every view and builds the field mappings,
     * the way the generator does before any rule is emitted.
     */
    public static Form prepare(FormDocument document, GenerationContext context) {
        Form planned = new ViewPlanner().plan(document, context);
        List<RepeatingGroup> groups = new NestingResolver().resolve(planned.getGroups(),
                context.getHeuristics().nestingOverrides(), !planned.getRootControls().isEmpty(),
                context.getDiagnostics(), planned.getName());
        Form form = planned.toBuilder().clearGroups().groups(groups).build();

        for (View view : form.getViews()) {
            try {
                context.getControlRegistry().registerIdentifiers(view.getName(),
                        context.getDeploymentClient().resolveViewIdentifiers(view.getName()));
            } catch (DeploymentException e) {
                throw new IllegalStateException(e);
            }
        }
        FieldMappingBuilder mappings = new FieldMappingBuilder();
        for (ViewPair pair : form.getViewPairs()) {
            pair.setItemIdentifiers(context.getControlRegistry().getIdentifiers(pair.getItemViewName()).orElseThrow());
            pair.setListIdentifiers(context.getControlRegistry().getIdentifiers(pair.getListViewName()).orElseThrow());
            pair.setFieldMappings(mappings.build(pair.getGroupName(),
                    context.getControlRegistry().getControls(pair.getItemViewName()),
                    context.getControlRegistry().getControls(pair.getListViewName()),
                    context.getDiagnostics(), form.getName()));
        }
        return form;
    }

    public static GenerationContext withMetadata(GenerationContext context, FormDocument document) {
        return context.toBuilder()
                .fieldMetadata(new DataColumnFieldMetadataService(document.getDataColumns(), context.getCanonicalizer()))
                .build();
    }
}
