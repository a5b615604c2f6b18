package com.formrules.generator.codegen.rules;

import static com.formrules.generator.codegen.FormFixtures.*;
import static org.assertj.core.api.Assertions.*;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.junit.jupiter.api.Test;

import com.formrules.generator.codegen.collab.SequentialIdentifierSource;
import com.formrules.generator.codegen.model.core.context.DiagnosticKind;
import com.formrules.generator.codegen.model.core.context.GenerationContext;
import com.formrules.generator.codegen.model.core.context.GeneratorConfig;
import com.formrules.generator.codegen.model.form.Form;
import com.formrules.generator.codegen.model.form.RepeatingGroup;
import com.formrules.generator.codegen.model.form.ViewIdentifiers;
import com.formrules.generator.codegen.model.input.FormDocument;
import com.formrules.generator.codegen.model.input.ViewDefinition;
import com.formrules.generator.codegen.rules.graph.ActionKind;
import com.formrules.generator.codegen.rules.graph.ActionParameter;
import com.formrules.generator.codegen.rules.graph.BindingType;
import com.formrules.generator.codegen.rules.graph.FormParameter;
import com.formrules.generator.codegen.rules.graph.Handler;
import com.formrules.generator.codegen.rules.graph.RuleAction;
import com.formrules.generator.codegen.rules.graph.RuleEvent;
import com.formrules.generator.codegen.rules.graph.RuleGraph;

/**
 * Unit tests for SubmitRuleGenerator.
 */
class SubmitRuleGeneratorTest {

    private final SequentialIdentifierSource ids = new SequentialIdentifierSource();
    private final RuleGraphAssembler assembler = new RuleGraphAssembler(ids);
    private final RuleNodeFactory nodes = new RuleNodeFactory(ids);
    private final ClearRuleGenerator clearRules = new ClearRuleGenerator(assembler, nodes);
    private final SubmitRuleGenerator submitRules = new SubmitRuleGenerator(assembler, nodes, clearRules);

    @Test
    void testHandlerOrderRootCreateThenGroupRowsThenClear() {
        GenerationContext context = context(GeneratorConfig.builder().submitMessage(false).build(), ids);
        Form form = prepare(lineItems(), context);
        RuleGraph graph = assembler.createGraph(form, "form-1", context.getControlRegistry());
        Optional<RuleEvent> clear = clearRules.generate(form, graph, context);

        RuleEvent submit = submitRules.generate(form, graph, context, clear).orElseThrow();

        assertThat(submit.getHandlers()).extracting(Handler::handlerName)
                .containsExactly("then", SubmitRuleGenerator.LIST_ROW_HANDLER, SubmitRuleGenerator.CLEAR_HANDLER);
        assertThat(submit.propertyValue(RuleNodeFactory.PROP_FRIENDLY_NAME)).contains("When Submit is Clicked");

        RuleAction clearCall = submit.getHandlers().get(2).getActions().get(0);
        assertThat(clearCall.propertyValue(RuleNodeFactory.PROP_EVENT_ID)).contains(clear.get().getDefinitionId());
    }

    @Test
    void testRootCreateStoresRecordIdInFormParameter() {
        GenerationContext context = context(GeneratorConfig.builder().build(), ids);
        Form form = prepare(lineItems(), context);
        RuleGraph graph = assembler.createGraph(form, "form-1", context.getControlRegistry());

        RuleEvent submit = submitRules.generate(form, graph, context, Optional.empty()).orElseThrow();

        RuleAction create = submit.getHandlers().get(0).getActions().get(0);
        assertThat(create.getType()).isEqualTo(ActionKind.EXECUTE);
        assertThat(create.propertyValue(RuleNodeFactory.PROP_METHOD)).contains("Create");
        assertThat(create.getParameters()).extracting(ActionParameter::getTargetId)
                .containsExactly("CUSTOMERNAME", "TOTAL");

        FormParameter id = graph.findParameter(FormParameter.ID).orElseThrow();
        assertThat(create.getResults()).singleElement().satisfies(result -> {
            assertThat(result.getTargetType()).isEqualTo(BindingType.FORM_PARAMETER);
            assertThat(result.getTargetId()).isEqualTo(id.getId());
        });
    }

    @Test
    void testTopLevelGroupRowsTakeRootRecordId() {
        GenerationContext context = context(GeneratorConfig.builder().build(), ids);
        Form form = prepare(lineItems(), context);
        RuleGraph graph = assembler.createGraph(form, "form-1", context.getControlRegistry());
        String listViewId = form.findViewPair("LineItems").orElseThrow().getListIdentifiers().getViewId();

        RuleEvent submit = submitRules.generate(form, graph, context, Optional.empty()).orElseThrow();

        Handler rows = submit.getHandlers().get(1);
        assertThat(rows.getType()).isEqualTo(Handler.FOR_EACH);
        assertThat(rows.getFunction().getItems().get(0).getSourceId()).isEqualTo(listViewId);
        assertThat(rows.getFunction().getItems().get(1).getSourceId()).isEqualTo("Added");

        RuleAction create = rows.getActions().get(0);
        ActionParameter parentId = create.getParameters().get(0);
        assertThat(parentId.getTargetId()).isEqualTo(SubmitRuleGenerator.PARENT_ID);
        assertThat(parentId.getSourceType()).isEqualTo(BindingType.FORM_PARAMETER);
        assertThat(create.getParameters()).extracting(ActionParameter::getTargetName)
                .containsExactly("ParentID", "Description", "Amount");
    }

    @Test
    void testRootCollectionRowsCreatedWithoutParentId() {
        GenerationContext context = context(GeneratorConfig.builder().submitMessage(false).build(), ids);
        FormDocument document = FormDocument.builder()
                .displayName("Purchase Order")
                .view(ViewDefinition.builder()
                        .viewName("Main")
                        .control(grouped("Description", "1A", "LineItems"))
                        .control(grouped("Amount", "1B", "LineItems"))
                        .build())
                .build();
        Form form = prepare(document, context);
        RepeatingGroup lines = form.findGroup("LineItems").orElseThrow();
        assertThat(lines.getDepth()).isZero();
        assertThat(lines.getParentName()).isEmpty();
        RuleGraph graph = assembler.createGraph(form, "form-1", context.getControlRegistry());

        RuleEvent submit = submitRules.generate(form, graph, context, Optional.empty()).orElseThrow();

        assertThat(submit.getHandlers()).extracting(Handler::handlerName)
                .containsExactly(SubmitRuleGenerator.LIST_ROW_HANDLER, SubmitRuleGenerator.CLEAR_HANDLER);
        RuleAction create = submit.getHandlers().get(0).getActions().get(0);
        assertThat(create.getParameters()).extracting(ActionParameter::getTargetName)
                .containsExactly("Description", "Amount");
        assertThat(create.getParameters())
                .noneMatch(p -> p.getSourceType() == BindingType.FORM_PARAMETER);
        assertThat(create.getResults()).isEmpty();
    }

    @Test
    void testNestedGroupUsesParentRowIdNotRootId() {
        GenerationContext context = context(nestedConfig(), ids);
        Form form = prepare(nestedLineItems(), context);
        RuleGraph graph = assembler.createGraph(form, "form-1", context.getControlRegistry());
        ViewIdentifiers parentList = form.findViewPair("LineItems").orElseThrow().getListIdentifiers();
        ViewIdentifiers detailList = form.findViewPair("LineItemDetails").orElseThrow().getListIdentifiers();

        RuleEvent submit = submitRules.generate(form, graph, context, Optional.empty()).orElseThrow();

        assertThat(submit.getHandlers()).extracting(Handler::handlerName).containsSubsequence(
                "then", SubmitRuleGenerator.LIST_ROW_HANDLER, SubmitRuleGenerator.PARENT_RECORD_HANDLER);

        Handler nested = submit.getHandlers().stream()
                .filter(h -> SubmitRuleGenerator.PARENT_RECORD_HANDLER.equals(h.handlerName()))
                .findFirst().orElseThrow();
        assertThat(nested.getFunction().getItems().get(0).getSourceId()).isEqualTo(parentList.getViewId());

        RuleAction forEachDetail = nested.getActions().get(0);
        assertThat(forEachDetail.getType()).isEqualTo(ActionKind.FOR_EACH);
        assertThat(forEachDetail.getFunction().getItems().get(0).getSourceId()).isEqualTo(detailList.getViewId());

        RuleAction create = forEachDetail.getActions().get(0);
        ActionParameter parentId = create.getParameters().get(0);
        assertThat(parentId.getTargetId()).isEqualTo(SubmitRuleGenerator.PARENT_ID);
        assertThat(parentId.getSourceType()).isEqualTo(BindingType.OBJECT_PROPERTY);
        assertThat(parentId.getSourceInstanceId()).isEqualTo(parentList.getEffectiveInstanceId());
        assertThat(create.getParameters())
                .noneMatch(p -> p.getSourceType() == BindingType.FORM_PARAMETER);
    }

    @Test
    void testUnresolvedParentSkipsOnlyThatGroup() {
        GenerationContext context = context(GeneratorConfig.builder()
                .nestingOverrides(Map.of("LineItemDetails", "Missing")).build(), ids);
        Form form = prepare(nestedLineItems(), context);
        RepeatingGroup detail = form.findGroup("LineItemDetails").orElseThrow();
        assertThat(detail.getDepth()).isEqualTo(2);
        RuleGraph graph = assembler.createGraph(form, "form-1", context.getControlRegistry());

        RuleEvent submit = submitRules.generate(form, graph, context, Optional.empty()).orElseThrow();

        assertThat(submit.getHandlers()).extracting(Handler::handlerName)
                .doesNotContain(SubmitRuleGenerator.PARENT_RECORD_HANDLER)
                .contains(SubmitRuleGenerator.LIST_ROW_HANDLER, SubmitRuleGenerator.CLEAR_HANDLER);
        assertThat(context.getDiagnostics().ofKind(DiagnosticKind.UNRESOLVED_PARENT)).isNotEmpty();
    }

    @Test
    void testSubmitMessageBeforeClear() {
        GenerationContext context = context(GeneratorConfig.builder().build(), ids);
        Form form = prepare(lineItems(), context);
        RuleGraph graph = assembler.createGraph(form, "form-1", context.getControlRegistry());

        RuleEvent submit = submitRules.generate(form, graph, context, Optional.empty()).orElseThrow();

        List<Handler> handlers = submit.getHandlers();
        assertThat(handlers).hasSize(4);
        assertThat(handlers.get(2).getActions().get(0).getType()).isEqualTo(ActionKind.POPUP);
        assertThat(handlers.get(3).handlerName()).isEqualTo(SubmitRuleGenerator.CLEAR_HANDLER);
        assertThat(handlers.get(3).getActions()).hasSize(graph.getLayout().size());
    }

    @Test
    void testInDependencyOrderSortsByDepthStably() {
        RepeatingGroup b = RepeatingGroup.builder().name("B").sourceViewName("v").depth(2).build();
        RepeatingGroup a = RepeatingGroup.builder().name("A").sourceViewName("v").depth(1).build();
        RepeatingGroup c = RepeatingGroup.builder().name("C").sourceViewName("v").depth(1).build();

        assertThat(SubmitRuleGenerator.inDependencyOrder(List.of(b, a, c)))
                .extracting(RepeatingGroup::getName)
                .containsExactly("A", "C", "B");
    }
}
