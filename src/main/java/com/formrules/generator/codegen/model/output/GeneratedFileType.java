package com.formrules.generator.codegen.model.output;

/**
 * Categories of generated artifacts.
 */
public enum GeneratedFileType {
    /** View document of one generated view. */
    VIEW,
    /** Serialized rule graph of one form. */
    RULES,
    /** Run report. */
    REPORT
}
