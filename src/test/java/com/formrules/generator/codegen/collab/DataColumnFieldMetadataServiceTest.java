package com.formrules.generator.codegen.collab;

import static org.assertj.core.api.Assertions.*;

import java.util.List;

import org.junit.jupiter.api.Test;

import com.formrules.generator.codegen.model.input.DataColumn;

/**
 * Unit tests for DataColumnFieldMetadataService and DefaultNameCanonicalizer.
 */
class DataColumnFieldMetadataServiceTest {

    private final NameCanonicalizer canonicalizer = new DefaultNameCanonicalizer();

    private final DataColumnFieldMetadataService service = new DataColumnFieldMetadataService(List.of(
            DataColumn.builder().columnName("Amount").repeating(true)
                    .repeatingSectionName("Line Items").dataType("Decimal").build(),
            DataColumn.builder().columnName("Amount").dataType("Currency").build(),
            DataColumn.builder().columnName("Due Date").dataType("Date").build(),
            DataColumn.builder().columnName("Untyped").build()), canonicalizer);

    @Test
    void testLookupPrefersEntitySpecificType() {
        assertThat(service.lookupFieldDataType("Line_Items", "Amount")).isEqualTo("Decimal");
        assertThat(service.lookupFieldDataType("line_items", "AMOUNT")).isEqualTo("Decimal");
    }

    @Test
    void testLookupFallsBackToFieldName() {
        assertThat(service.lookupFieldDataType("Purchase_Order", "Due_Date")).isEqualTo("Date");
        assertThat(service.lookupFieldDataType(null, "Due_Date")).isEqualTo("Date");
    }

    @Test
    void testRootColumnIsTheFieldNameFallback() {
        assertThat(service.lookupFieldDataType("Purchase_Order", "Amount")).isEqualTo("Currency");
        assertThat(service.lookupFieldDataType("Line_Items", "Amount")).isEqualTo("Decimal");
    }

    @Test
    void testUnknownOrUntypedFieldsUseDefault() {
        assertThat(service.lookupFieldDataType("Purchase_Order", "Untyped")).isEqualTo(FieldMetadataService.DEFAULT_DATA_TYPE);
        assertThat(service.lookupFieldDataType("Purchase_Order", "Missing")).isEqualTo("Text");
        assertThat(service.lookupFieldDataType("Purchase_Order", null)).isEqualTo("Text");
    }

    @Test
    void testCanonicalize() {
        assertThat(canonicalizer.canonicalize("Purchase Order")).isEqualTo("Purchase_Order");
        assertThat(canonicalizer.canonicalize("  Main.xsl ")).isEqualTo("Main_xsl");
        assertThat(canonicalizer.canonicalize("a -- b__c")).isEqualTo("a_b_c");
        assertThat(canonicalizer.canonicalize("***")).isEqualTo("Unnamed");
        assertThat(canonicalizer.canonicalize(null)).isEqualTo("Unnamed");
    }
}
