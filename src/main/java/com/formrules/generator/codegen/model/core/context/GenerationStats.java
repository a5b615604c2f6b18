package com.formrules.generator.codegen.model.core.context;

import lombok.Builder;
import lombok.Value;

/**
 * Aggregated statistics for a generation run.
 */
@Value
@Builder(toBuilder = true)
public class GenerationStats {

    int formCount;
    int formsFailed;
    int viewCount;
    int viewPairCount;
    int eventCount;
    int handlerCount;
    int expressionCount;
    int fileCount;

    long generationTimeMillis;
}
