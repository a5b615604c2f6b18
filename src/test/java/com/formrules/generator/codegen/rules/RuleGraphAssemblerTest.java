package com.formrules.generator.codegen.rules;

import static com.formrules.generator.codegen.FormFixtures.*;
import static org.assertj.core.api.Assertions.*;

import org.junit.jupiter.api.Test;

import com.formrules.generator.codegen.collab.SequentialIdentifierSource;
import com.formrules.generator.codegen.model.core.context.GenerationContext;
import com.formrules.generator.codegen.model.form.Form;
import com.formrules.generator.codegen.model.form.ViewKind;
import com.formrules.generator.codegen.registry.ViewControlRegistry;
import com.formrules.generator.codegen.rules.graph.FormParameter;
import com.formrules.generator.codegen.rules.graph.LayoutItem;
import com.formrules.generator.codegen.rules.graph.RuleGraph;
import com.formrules.generator.codegen.rules.graph.State;

/**
 * Unit tests for RuleGraphAssembler.
 */
class RuleGraphAssemblerTest {

    private final RuleGraphAssembler assembler = new RuleGraphAssembler(new SequentialIdentifierSource());

    @Test
    void testLayoutListsDeployedViewsWithItemViewsHidden() {
        GenerationContext context = context();
        Form form = prepare(lineItems(), context);

        RuleGraph graph = assembler.createGraph(form, "form-1", context.getControlRegistry());

        assertThat(graph.getLayout()).extracting(LayoutItem::getViewName).containsExactly(
                "Purchase_Order_Main_Part1", ITEM_VIEW, LIST_VIEW, "Purchase_Order_Main_Part2");
        assertThat(graph.getLayout()).filteredOn(l -> l.getKind() == ViewKind.DETAIL_ITEM)
                .extracting(LayoutItem::isVisible).containsOnly(false);
        assertThat(graph.getControls()).hasSize(2);
    }

    @Test
    void testAccessorsAreIdempotent() {
        GenerationContext context = context();
        Form form = prepare(lineItems(), context);
        RuleGraph graph = assembler.createGraph(form, "form-1", context.getControlRegistry());

        FormParameter first = assembler.getOrCreateIdParameter(graph);
        FormParameter second = assembler.getOrCreateIdParameter(graph);
        State base = assembler.getBaseState(graph);

        assertThat(second).isSameAs(first);
        assertThat(graph.getParameters()).hasSize(1);
        assertThat(assembler.getBaseState(graph)).isSameAs(base);
        assertThat(base.isBase()).isTrue();
        assertThat(assembler.getOrCreateStates(graph)).hasSize(1);
    }

    @Test
    void testMissingFormIdIsStructuralGap() {
        GenerationContext context = context();
        Form form = prepare(lineItems(), context);

        assertThatThrownBy(() -> assembler.createGraph(form, " ", context.getControlRegistry()))
                .isInstanceOf(StructuralGapException.class)
                .hasMessageContaining("no identifier");
    }

    @Test
    void testFormWithoutDeployedViewsIsStructuralGap() {
        GenerationContext context = context();
        Form form = prepare(lineItems(), context);

        assertThatThrownBy(() -> assembler.createGraph(form, "form-1", new ViewControlRegistry()))
                .isInstanceOf(StructuralGapException.class)
                .hasMessageContaining("no deployed view");
    }
}
