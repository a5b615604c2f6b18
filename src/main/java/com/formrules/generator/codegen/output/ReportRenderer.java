package com.formrules.generator.codegen.output;

import java.io.IOException;
import java.io.StringWriter;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.formrules.generator.codegen.model.core.context.Diagnostic;
import com.formrules.generator.codegen.model.core.context.GenerationStats;
import com.formrules.generator.codegen.model.output.FormSummary;
import com.formrules.generator.codegen.model.output.GeneratedFile;
import com.formrules.generator.codegen.model.output.GeneratedFileType;

import freemarker.template.Configuration;
import freemarker.template.TemplateException;

/**
 * Renders {@code generation-report.md}: per-form counts, repeating groups and
 * every diagnostic of the run.
 */
public class ReportRenderer {

    static final String TEMPLATE = "generation-report.md.ftl";
    public static final String REPORT_FILE = "generation-report.md";

    private final Configuration freemarkerConfig;

    public ReportRenderer(Configuration freemarkerConfig) {
        this.freemarkerConfig = freemarkerConfig;
    }

    public GeneratedFile render(Path inputFile, Path outputDir, List<FormSummary> forms,
                                List<Diagnostic> diagnostics, GenerationStats stats) throws IOException {
        Map<String, Object> model = new LinkedHashMap<>();
        model.put("inputFile", String.valueOf(inputFile));
        model.put("stats", statsModel(stats));

        List<Map<String, Object>> formModels = new ArrayList<>();
        for (FormSummary form : forms) {
            Map<String, Object> f = new LinkedHashMap<>();
            f.put("name", form.getFormName());
            f.put("displayName", form.getDisplayName() == null ? form.getFormName() : form.getDisplayName());
            f.put("generated", form.isGenerated());
            f.put("failureReason", form.getFailureReason() == null ? "" : form.getFailureReason());
            f.put("viewCount", form.getViewCount());
            f.put("viewPairCount", form.getViewPairCount());
            f.put("eventCount", form.getEventCount());
            f.put("handlerCount", form.getHandlerCount());
            f.put("expressionCount", form.getExpressionCount());
            f.put("validationIssues", form.getValidationIssues());
            f.put("groups", form.getGroupLines());
            formModels.add(f);
        }
        model.put("forms", formModels);

        List<Map<String, Object>> diagnosticModels = new ArrayList<>();
        for (Diagnostic diagnostic : diagnostics) {
            Map<String, Object> d = new LinkedHashMap<>();
            d.put("severity", diagnostic.getSeverity().name());
            d.put("kind", diagnostic.getKind().name());
            d.put("form", diagnostic.getFormName() == null ? "-" : diagnostic.getFormName());
            d.put("message", diagnostic.getMessage());
            diagnosticModels.add(d);
        }
        model.put("diagnostics", diagnosticModels);

        StringWriter out = new StringWriter();
        try {
            freemarkerConfig.getTemplate(TEMPLATE).process(model, out);
        } catch (TemplateException e) {
            throw new IOException("Failed to render the generation report: " + e.getMessage(), e);
        }

        return GeneratedFile.builder()
                .path(outputDir.resolve(REPORT_FILE))
                .contents(out.toString())
                .type(GeneratedFileType.REPORT)
                .build();
    }

    private static Map<String, Object> statsModel(GenerationStats stats) {
        Map<String, Object> s = new LinkedHashMap<>();
        s.put("formCount", stats.getFormCount());
        s.put("formsFailed", stats.getFormsFailed());
        s.put("viewCount", stats.getViewCount());
        s.put("viewPairCount", stats.getViewPairCount());
        s.put("eventCount", stats.getEventCount());
        s.put("handlerCount", stats.getHandlerCount());
        s.put("expressionCount", stats.getExpressionCount());
        s.put("fileCount", stats.getFileCount());
        s.put("generationTimeMillis", stats.getGenerationTimeMillis());
        return s;
    }
}
