package com.formrules.generator.codegen.collab;

import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import com.formrules.generator.codegen.model.input.DataColumn;

/**
 * Field metadata backed by the form's {@code Data} section. Columns without a
 * declared type, and unknown fields, resolve to {@link #DEFAULT_DATA_TYPE}.
 */
public class DataColumnFieldMetadataService implements FieldMetadataService {

    private final Map<String, String> typesByKey = new HashMap<>();

    public DataColumnFieldMetadataService(List<DataColumn> columns, NameCanonicalizer canonicalizer) {
        for (DataColumn column : columns) {
            if (column.getColumnName() == null || column.getDataType() == null || column.getDataType().isBlank()) {
                continue;
            }
            String entity = column.isRepeating() && column.getRepeatingSectionName() != null
                    ? canonicalizer.canonicalize(column.getRepeatingSectionName())
                    : "";
            typesByKey.put(key(entity, canonicalizer.canonicalize(column.getColumnName())), column.getDataType());
            // Fallback lookup by field name only
            typesByKey.putIfAbsent(key("", canonicalizer.canonicalize(column.getColumnName())), column.getDataType());
        }
    }

    @Override
    public String lookupFieldDataType(String entityName, String fieldName) {
        if (fieldName == null) {
            return DEFAULT_DATA_TYPE;
        }
        String type = typesByKey.get(key(entityName == null ? "" : entityName, fieldName));
        if (type == null) {
            type = typesByKey.get(key("", fieldName));
        }
        return type != null ? type : DEFAULT_DATA_TYPE;
    }

    private static String key(String entity, String field) {
        return entity.toUpperCase(Locale.ROOT) + "." + field.toUpperCase(Locale.ROOT);
    }
}
