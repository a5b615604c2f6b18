package com.formrules.generator.codegen.model.core.context;

import com.formrules.generator.codegen.collab.FieldMetadataService;
import com.formrules.generator.codegen.collab.IdentifierSource;
import com.formrules.generator.codegen.collab.NameCanonicalizer;
import com.formrules.generator.codegen.collab.ViewDeploymentClient;
import com.formrules.generator.codegen.heuristics.FormHeuristics;
import com.formrules.generator.codegen.registry.ViewButtonRegistry;
import com.formrules.generator.codegen.registry.ViewControlRegistry;

import lombok.Builder;
import lombok.Getter;
import lombok.NonNull;

/**
 * State shared by the pipeline stages of one run. The registries are written
 * while views are planned and deployed, and only read by the rule generators.
 */
@Getter
@Builder(toBuilder = true)
public final class GenerationContext {

    @NonNull
    private final GeneratorConfig config;

    @NonNull
    private final GenerationFlags flags;

    @NonNull
    private final FormHeuristics heuristics;

    @NonNull
    private final NameCanonicalizer canonicalizer;

    @NonNull
    private final IdentifierSource identifiers;

    @NonNull
    private final ViewDeploymentClient deploymentClient;

    /** Per-form metadata service; replaced for each form via {@code toBuilder()}. */
    private final FieldMetadataService fieldMetadata;

    @NonNull
    @Builder.Default
    private final ViewButtonRegistry buttonRegistry = new ViewButtonRegistry();

    @NonNull
    @Builder.Default
    private final ViewControlRegistry controlRegistry = new ViewControlRegistry();

    @NonNull
    @Builder.Default
    private final ToolDiagnostics diagnostics = new ToolDiagnostics();

    public String newId() {
        return identifiers.newId();
    }

    public String lookupFieldDataType(String entityName, String fieldName) {
        if (fieldMetadata == null) {
            return FieldMetadataService.DEFAULT_DATA_TYPE;
        }
        return fieldMetadata.lookupFieldDataType(entityName, fieldName);
    }

    public void report(DiagnosticKind kind, String formName, String message) {
        diagnostics.report(kind, formName, message);
    }
}
