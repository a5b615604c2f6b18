package com.formrules.generator.codegen.output;

import java.io.IOException;
import java.io.StringWriter;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.formrules.generator.codegen.model.form.Control;
import com.formrules.generator.codegen.model.form.View;
import com.formrules.generator.codegen.model.form.ViewButtons;
import com.formrules.generator.codegen.model.form.ViewIdentifiers;
import com.formrules.generator.codegen.model.output.GeneratedFile;
import com.formrules.generator.codegen.model.output.GeneratedFileType;

import freemarker.template.Configuration;
import freemarker.template.Template;
import freemarker.template.TemplateException;

/**
 * Renders the XML document of a generated view from {@code view.ftlx}.
 */
public class ViewDocumentRenderer {

    private static final Logger log = LoggerFactory.getLogger(ViewDocumentRenderer.class);

    static final String TEMPLATE = "view.ftlx";

    private final Configuration freemarkerConfig;

    public ViewDocumentRenderer(Configuration freemarkerConfig) {
        this.freemarkerConfig = freemarkerConfig;
    }

    /**
     * @param identifiers runtime identifiers, empty when the view was not deployed
     * @param formDir directory of the form's output
     */
    public GeneratedFile render(String formName, View view, Optional<ViewIdentifiers> identifiers, Path formDir)
            throws IOException {
        Map<String, Object> model = new LinkedHashMap<>();
        model.put("formName", formName);
        model.put("view", viewModel(view, identifiers));

        Template template = freemarkerConfig.getTemplate(TEMPLATE);
        StringWriter out = new StringWriter();
        try {
            template.process(model, out);
        } catch (TemplateException e) {
            throw new IOException("Failed to render view " + view.getName() + ": " + e.getMessage(), e);
        }

        log.debug("Rendered view document for {}", view.getName());
        return GeneratedFile.builder()
                .path(formDir.resolve("views").resolve(view.getName() + ".xml"))
                .contents(out.toString())
                .type(GeneratedFileType.VIEW)
                .formName(formName)
                .build();
    }

    private static Map<String, Object> viewModel(View view, Optional<ViewIdentifiers> identifiers) {
        Map<String, Object> model = new LinkedHashMap<>();
        model.put("name", view.getName());
        model.put("title", view.getTitle());
        model.put("kind", view.getKind().name());
        model.put("sourceViewName", view.getSourceViewName());
        view.getGroupName().ifPresent(g -> model.put("groupName", g));
        identifiers.ifPresent(ids -> {
            model.put("viewId", ids.getViewId());
            model.put("instanceId", ids.getEffectiveInstanceId());
        });

        List<Map<String, Object>> controls = new ArrayList<>();
        for (Control control : view.getControls()) {
            Map<String, Object> c = new LinkedHashMap<>();
            c.put("id", control.getId());
            c.put("name", control.getName());
            c.put("type", control.getType());
            c.put("controlName", control.getControlName());
            c.put("row", control.getGridPosition().getRow());
            c.put("column", control.getGridPosition().getColumn());
            c.put("editable", control.isEditable());
            c.put("structural", control.isStructural());
            if (control.getLabel() != null) {
                c.put("label", control.getLabel());
            }
            controls.add(c);
        }
        model.put("controls", controls);

        List<Map<String, Object>> buttons = new ArrayList<>();
        view.getButtons().ifPresent(b -> addButtons(b, buttons));
        model.put("buttons", buttons);
        return model;
    }

    private static void addButtons(ViewButtons source, List<Map<String, Object>> target) {
        source.getAddId().ifPresent(id -> target.add(button(id, source.getAddName(), "Add")));
        source.getDeleteId().ifPresent(id -> target.add(button(id, source.getDeleteName(), "Delete")));
        source.getCancelId().ifPresent(id -> target.add(button(id, source.getCancelName(), "Cancel")));
    }

    private static Map<String, Object> button(String id, String name, String role) {
        Map<String, Object> b = new LinkedHashMap<>();
        b.put("id", id);
        b.put("name", name == null ? role : name);
        b.put("role", role);
        return b;
    }
}
