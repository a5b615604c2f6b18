package com.formrules.generator.codegen.output;

import java.io.IOException;
import java.nio.file.Path;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.formrules.generator.codegen.model.output.GeneratedFile;
import com.formrules.generator.codegen.model.output.GeneratedFileType;
import com.formrules.generator.codegen.rules.graph.RuleGraph;

/**
 * Serializes a rule graph to indented JSON. Null fields are omitted.
 */
public class RuleGraphWriter {

    private final ObjectMapper mapper;

    public RuleGraphWriter() {
        this(defaultMapper());
    }

    public RuleGraphWriter(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public static ObjectMapper defaultMapper() {
        return new ObjectMapper()
                .setSerializationInclusion(JsonInclude.Include.NON_NULL)
                .disable(SerializationFeature.FAIL_ON_EMPTY_BEANS);
    }

    public String toJson(RuleGraph graph) throws IOException {
        return mapper.writerWithDefaultPrettyPrinter().writeValueAsString(graph);
    }

    public GeneratedFile render(RuleGraph graph, Path formDir) throws IOException {
        return GeneratedFile.builder()
                .path(formDir.resolve(graph.getFormName() + ".rules.json"))
                .contents(toJson(graph))
                .type(GeneratedFileType.RULES)
                .formName(graph.getFormName())
                .build();
    }
}
