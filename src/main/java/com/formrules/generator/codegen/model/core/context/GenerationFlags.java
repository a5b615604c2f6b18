package com.formrules.generator.codegen.model.core.context;

import lombok.Builder;
import lombok.Value;

/**
 * Boolean switches that influence generation behavior.
 */
@Value
@Builder(toBuilder = true)
public class GenerationFlags {

    boolean writeFiles;
    boolean overwriteExisting;
    boolean submitMessage;

    public static GenerationFlags from(GeneratorConfig config) {
        return GenerationFlags.builder()
                .writeFiles(!config.isDryRun())
                .overwriteExisting(config.isForce())
                .submitMessage(config.isSubmitMessage())
                .build();
    }
}
