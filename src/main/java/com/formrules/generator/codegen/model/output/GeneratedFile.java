package com.formrules.generator.codegen.model.output;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

import java.nio.file.Path;

/**
 * A rendered output artifact (path + contents), written by the driver unless
 * the run is a dry run.
 *
 * Pure structure only.
 */
@Value
@Builder(toBuilder = true)
public class GeneratedFile {

    @NonNull
    Path path;

    @NonNull
    String contents;

    @NonNull
    GeneratedFileType type;

    /** Form the artifact belongs to, {@code null} for run-level files. */
    String formName;
}
