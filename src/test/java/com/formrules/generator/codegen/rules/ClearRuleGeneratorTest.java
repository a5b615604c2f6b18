package com.formrules.generator.codegen.rules;

import static com.formrules.generator.codegen.FormFixtures.*;
import static org.assertj.core.api.Assertions.*;

import org.junit.jupiter.api.Test;

import com.formrules.generator.codegen.collab.SequentialIdentifierSource;
import com.formrules.generator.codegen.model.core.context.DiagnosticKind;
import com.formrules.generator.codegen.model.core.context.GenerationContext;
import com.formrules.generator.codegen.model.core.context.GeneratorConfig;
import com.formrules.generator.codegen.model.form.Form;
import com.formrules.generator.codegen.model.form.FormButtons;
import com.formrules.generator.codegen.rules.graph.ExecutionType;
import com.formrules.generator.codegen.rules.graph.LayoutItem;
import com.formrules.generator.codegen.rules.graph.RuleAction;
import com.formrules.generator.codegen.rules.graph.RuleEvent;
import com.formrules.generator.codegen.rules.graph.RuleGraph;

class ClearRuleGeneratorTest {

    private final SequentialIdentifierSource ids = new SequentialIdentifierSource();
    private final RuleGraphAssembler assembler = new RuleGraphAssembler(ids);
    private final ClearRuleGenerator clearRules = new ClearRuleGenerator(assembler, new RuleNodeFactory(ids));

    @Test
    void testClearsEveryLayoutViewInParallel() {
        GenerationContext context = context(GeneratorConfig.builder().build(), ids);
        Form form = prepare(lineItems(), context);
        RuleGraph graph = assembler.createGraph(form, "form-1", context.getControlRegistry());

        RuleEvent clear = clearRules.generate(form, graph, context).orElseThrow();

        assertThat(clear.getSourceName()).isEqualTo(FormButtons.CLEAR_NAME);
        assertThat(clear.propertyValue(RuleNodeFactory.PROP_FORM_ID)).contains("form-1");
        assertThat(clear.getHandlers().get(0).getActions())
                .extracting(RuleAction::getInstanceId)
                .containsExactlyElementsOf(graph.getLayout().stream().map(LayoutItem::getInstanceId).toList());
        assertThat(clear.getHandlers().get(0).getActions())
                .extracting(RuleAction::getExecutionType)
                .containsOnly(ExecutionType.PARALLEL);
    }

    @Test
    void testMissingClearButtonIsReported() {
        GenerationContext context = context(GeneratorConfig.builder().build(), ids);
        Form form = prepare(lineItems(), context);
        context.getButtonRegistry().registerFormButtons(form.getName(),
                FormButtons.builder().submitId("submit").submitName(FormButtons.SUBMIT_NAME).build());
        RuleGraph graph = assembler.createGraph(form, "form-1", context.getControlRegistry());

        assertThat(clearRules.generate(form, graph, context)).isEmpty();
        assertThat(context.getDiagnostics().ofKind(DiagnosticKind.MISSING_BUTTON)).hasSize(1);
        assertThat(graph.events()).isEmpty();
    }
}
