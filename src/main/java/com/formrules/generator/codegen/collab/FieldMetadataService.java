package com.formrules.generator.codegen.collab;

/**
 * Data type lookup for entity fields.
 */
public interface FieldMetadataService {

    String DEFAULT_DATA_TYPE = "Text";

    /**
     * @param entityName repeating group name, or the form name for root fields
     * @param fieldName canonical field name
     * @return the data type, never {@code null}
     */
    String lookupFieldDataType(String entityName, String fieldName);
}
