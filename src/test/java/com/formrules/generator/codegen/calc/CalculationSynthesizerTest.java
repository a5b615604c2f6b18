package com.formrules.generator.codegen.calc;

import static com.formrules.generator.codegen.FormFixtures.*;
import static org.assertj.core.api.Assertions.*;

import java.util.List;
import java.util.Optional;

import org.junit.jupiter.api.Test;

import com.formrules.generator.codegen.collab.SequentialIdentifierSource;
import com.formrules.generator.codegen.heuristics.DefaultFormHeuristics;
import com.formrules.generator.codegen.model.core.context.DiagnosticKind;
import com.formrules.generator.codegen.model.core.context.GenerationContext;
import com.formrules.generator.codegen.model.core.context.GeneratorConfig;
import com.formrules.generator.codegen.model.form.CalculationField;
import com.formrules.generator.codegen.model.form.ControlBinding;
import com.formrules.generator.codegen.model.form.ControlInstance;
import com.formrules.generator.codegen.model.form.Form;
import com.formrules.generator.codegen.model.input.FormDocument;
import com.formrules.generator.codegen.model.input.ViewDefinition;
import com.formrules.generator.codegen.rules.ClearRuleGenerator;
import com.formrules.generator.codegen.rules.NavigationRuleGenerator;
import com.formrules.generator.codegen.rules.RuleGraphAssembler;
import com.formrules.generator.codegen.rules.RuleNodeFactory;
import com.formrules.generator.codegen.rules.SubmitRuleGenerator;
import com.formrules.generator.codegen.rules.graph.Expression;
import com.formrules.generator.codegen.rules.graph.ListSumItem;
import com.formrules.generator.codegen.rules.graph.RuleGraph;

/**
 * Unit tests for CalculationSynthesizer.
 */
class CalculationSynthesizerTest {

    private final SequentialIdentifierSource ids = new SequentialIdentifierSource();
    private final RuleGraphAssembler assembler = new RuleGraphAssembler(ids);
    private final RuleNodeFactory nodes = new RuleNodeFactory(ids);
    private final CalculationSynthesizer synthesizer = new CalculationSynthesizer();

    private RuleGraph rules(Form form, GenerationContext context) {
        RuleGraph graph = assembler.createGraph(form, "form-1", context.getControlRegistry());
        new NavigationRuleGenerator(assembler, nodes).generate(form, graph, context);
        ClearRuleGenerator clear = new ClearRuleGenerator(assembler, nodes);
        new SubmitRuleGenerator(assembler, nodes, clear).generate(form, graph, context, clear.generate(form, graph, context));
        return graph;
    }

    @Test
    void testTotalSumsGroupAmountInstances() {
        FormDocument document = lineItems();
        GenerationContext context = withMetadata(context(GeneratorConfig.builder().build(), ids), document);
        Form form = prepare(document, context);
        RuleGraph graph = rules(form, context);
        ControlBinding listAmount = context.getControlRegistry().getControls(LIST_VIEW).get("Amount");
        String listInstance = form.findViewPair("LineItems").orElseThrow().getListIdentifiers().getEffectiveInstanceId();

        List<Expression> expressions = synthesizer.synthesize(form, graph, context);

        assertThat(expressions).singleElement().satisfies(e -> {
            assertThat(e.getName()).isEqualTo("Sum of all Amount fields");
            assertThat(e.getDisplayValue()).isEqualTo("List Sum( Amount Text Box )");
            assertThat(e.getFunction()).isEqualTo(Expression.LIST_SUM);
            assertThat(e.getRepresentativeField()).isEqualTo("Total");
            assertThat(e.getSourceFields()).containsExactly("Amount");
            assertThat(e.getItems()).singleElement().satisfies(item -> {
                assertThat(item.getSourceId()).isEqualTo(listAmount.getControlId());
                assertThat(item.getSourceInstanceId()).isEqualTo(listInstance);
                assertThat(item.getDataType()).isEqualTo("Decimal");
            });
        });
        assertThat(graph.getExpressions()).containsExactlyElementsOf(expressions);
    }

    @Test
    void testCandidatesSharingSourcesProduceOneExpression() {
        FormDocument base = lineItems();
        ViewDefinition main = base.getViews().get(0);
        FormDocument document = base.toBuilder().clearViews()
                .view(main.toBuilder()
                        .control(field("SubTotal", "TextField", "5A").toBuilder().disableEditing(true).build())
                        .build())
                .build();
        GenerationContext context = context(GeneratorConfig.builder().build(), ids);
        Form form = prepare(document, context);

        List<CalculationField> candidates = synthesizer.findCalculationFields(form, context);
        List<Expression> expressions = synthesizer.synthesize(form, rules(form, context), context);

        assertThat(candidates).extracting(CalculationField::getFieldName).containsExactly("Total", "SubTotal");
        assertThat(candidates).extracting(CalculationField::getSourceKey).containsOnly("Amount");
        assertThat(expressions).hasSize(1);
    }

    @Test
    void testEditableTotalIsNotACandidate() {
        FormDocument base = lineItems();
        ViewDefinition main = base.getViews().get(0);
        ViewDefinition.ViewDefinitionBuilder view = ViewDefinition.builder().viewName(main.getViewName());
        main.getControls().forEach(c -> view.control("Total".equals(c.getName()) ? c.toBuilder().disableEditing(false).build() : c));
        GenerationContext context = context(GeneratorConfig.builder().build(), ids);
        Form form = prepare(base.toBuilder().clearViews().view(view.build()).build(), context);

        assertThat(synthesizer.findCalculationFields(form, context)).isEmpty();
    }

    @Test
    void testSourceWithoutInstancesIsReportedAndExpressionKept() {
        GenerationContext context = context(GeneratorConfig.builder().build(), ids);
        Form form = prepare(lineItems(), context);
        RuleGraph graph = assembler.createGraph(form, "form-1", context.getControlRegistry());

        List<Expression> expressions = synthesizer.synthesize(form, graph, context);

        assertThat(expressions).singleElement()
                .satisfies(e -> assertThat(e.getItems()).isEmpty());
        assertThat(context.getDiagnostics().ofKind(DiagnosticKind.MISSING_MAPPING))
                .anySatisfy(d -> assertThat(d.getMessage()).contains("Amount"));
    }

    @Test
    void testInstancesAreDeduplicatedByControlId() {
        GenerationContext context = context(GeneratorConfig.builder().build(), ids);
        Form form = prepare(lineItems(), context);
        RuleGraph graph = rules(form, context);
        // a second submit binds the same list controls again
        ClearRuleGenerator clear = new ClearRuleGenerator(assembler, nodes);
        new SubmitRuleGenerator(assembler, nodes, clear).generate(form, graph, context, Optional.empty());

        List<ControlInstance> instances = synthesizer.findInstances(graph, "Amount", context.getControlRegistry(), form);

        assertThat(instances).singleElement().satisfies(i -> {
            assertThat(i.getViewName()).isEqualTo(LIST_VIEW);
            assertThat(i.getGroupName()).contains("LineItems");
        });
    }

    @Test
    void testRootAmountExcludedWhenGroupInstancesExist() {
        FormDocument base = lineItems();
        ViewDefinition main = base.getViews().get(0);
        FormDocument document = base.toBuilder().clearViews()
                .view(main.toBuilder().control(field("Amount", "TextField", "5A")).build())
                .build();
        GenerationContext context = context(GeneratorConfig.builder().build(), ids);
        Form form = prepare(document, context);
        RuleGraph graph = rules(form, context);

        assertThat(synthesizer.findInstances(graph, "Amount", context.getControlRegistry(), form)).hasSize(2);

        Expression expression = synthesizer.synthesize(form, graph, context).get(0);

        String listInstance = form.findViewPair("LineItems").orElseThrow().getListIdentifiers().getEffectiveInstanceId();
        assertThat(expression.getItems()).extracting(ListSumItem::getSourceInstanceId).containsExactly(listInstance);
    }

    @Test
    void testExclusionRuleOnlyAppliesToAmount() {
        DefaultFormHeuristics heuristics = new DefaultFormHeuristics();
        ControlInstance root = new ControlInstance("Amount", "c1", "Amount Text Box", "i1", "Main", null);
        ControlInstance grouped = new ControlInstance("Amount", "c2", "Amount Text Box", "i2", "List", "LineItems");
        ControlInstance rootQty = new ControlInstance("Quantity", "c3", "Quantity Text Box", "i1", "Main", null);

        assertThat(heuristics.excludeSourceInstance(root, List.of(root, grouped))).isTrue();
        assertThat(heuristics.excludeSourceInstance(grouped, List.of(root, grouped))).isFalse();
        assertThat(heuristics.excludeSourceInstance(root, List.of(root))).isFalse();
        assertThat(heuristics.excludeSourceInstance(rootQty, List.of(rootQty, grouped))).isFalse();
    }
}
