package com.formrules.generator.codegen.heuristics;

import static org.assertj.core.api.Assertions.*;

import java.util.Map;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import com.formrules.generator.codegen.model.form.Control;

/**
 * Unit tests for DefaultFormHeuristics.
 */
class DefaultFormHeuristicsTest {

    private final DefaultFormHeuristics heuristics = new DefaultFormHeuristics();

    private static Control.ControlBuilder control(String name) {
        return Control.builder().id("id-" + name).name(name).type("TextField").controlName(name + " Text Box");
    }

    @ParameterizedTest
    @CsvSource({
            "TABLECTRL42, Table_CTRL42",
            "tablectrl7, Table_CTRL7",
            "Table_CTRL3_Rows, Table_CTRL3_Rows",
            "Line Items, Line_Items",
            "'  LineItems ', LineItems"
    })
    void testNormalizeGroupName(String raw, String expected) {
        assertThat(heuristics.normalizeGroupName(raw)).isEqualTo(expected);
    }

    @Test
    void testBlankGroupNameNormalizesToNull() {
        assertThat(heuristics.normalizeGroupName("  ")).isNull();
        assertThat(heuristics.normalizeGroupName(null)).isNull();
    }

    @Test
    void testNestingOverridesAreNormalized() {
        DefaultFormHeuristics withOverrides = new DefaultFormHeuristics(Map.of("TABLECTRL5", "Line Items"));

        assertThat(withOverrides.nestingOverrides()).containsExactly(entry("Table_CTRL5", "Line_Items"));
    }

    @Test
    void testContainerAndStructuralTypes() {
        assertThat(heuristics.isContainerMarker("RepeatingTable")).isTrue();
        assertThat(heuristics.isContainerMarker("section")).isTrue();
        assertThat(heuristics.isContainerMarker("TextField")).isFalse();
        assertThat(heuristics.isStructural("Label")).isTrue();
        assertThat(heuristics.isStructural("button")).isTrue();
        assertThat(heuristics.isStructural("TextField")).isFalse();
    }

    @Test
    void testCalculationCandidateNeedsReadOnlyTextFieldWithToken() {
        assertThat(heuristics.isCalculationCandidate(control("GrandTotal").editable(false).build())).isTrue();
        assertThat(heuristics.isCalculationCandidate(control("CalcValue").editable(false).build())).isTrue();
        assertThat(heuristics.isCalculationCandidate(control("GrandTotal").build())).isFalse();
        assertThat(heuristics.isCalculationCandidate(control("Customer").editable(false).build())).isFalse();
        assertThat(heuristics.isCalculationCandidate(control("Total").type("DropDown").editable(false).build()))
                .isFalse();
    }

    @Test
    void testOnlyTotalsHaveSourceFields() {
        assertThat(heuristics.sourceFieldNames(control("SubTotal").build())).containsExactly("AMOUNT");
        assertThat(heuristics.sourceFieldNames(control("CalcValue").build())).isEmpty();
    }

    @Test
    void testSourceControlMustBeGroupedTextField() {
        assertThat(heuristics.isSourceControl(control("Amount").groupName("LineItems").build(), "AMOUNT")).isTrue();
        assertThat(heuristics.isSourceControl(control("Amount").build(), "AMOUNT")).isFalse();
        assertThat(heuristics.isSourceControl(control("Amount").groupName("LineItems").type("Label")
                .structural(true).build(), "AMOUNT")).isFalse();
        assertThat(heuristics.isSourceControl(control("Price").groupName("LineItems").build(), "AMOUNT")).isFalse();
    }
}
