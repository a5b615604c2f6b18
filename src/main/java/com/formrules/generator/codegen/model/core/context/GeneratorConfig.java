package com.formrules.generator.codegen.model.core.context;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

import lombok.Builder;
import lombok.Data;

/**
 * Configuration for a generation run.
 */
@Data
@Builder
public class GeneratorConfig {

    /**
     * JSON form definition document.
     */
    private Path inputFile;

    /**
     * Directory receiving view documents, rule graphs and the run report.
     */
    private Path outputDir;

    /**
     * Whether an existing output directory may be written into.
     */
    private boolean force;

    /**
     * Whether this is a dry run (no files written).
     */
    private boolean dryRun;

    /**
     * Explicit child group to parent group declarations, applied on top of the
     * parents declared in the input document.
     */
    @Builder.Default
    private Map<String, String> nestingOverrides = new LinkedHashMap<>();

    /**
     * Whether the submit rule shows a confirmation message before clearing the form.
     */
    @Builder.Default
    private boolean submitMessage = true;
}
