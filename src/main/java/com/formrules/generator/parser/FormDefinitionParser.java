package com.formrules.generator.parser;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.formrules.generator.codegen.model.input.ControlDefinition;
import com.formrules.generator.codegen.model.input.DataColumn;
import com.formrules.generator.codegen.model.input.DynamicSection;
import com.formrules.generator.codegen.model.input.FormDocument;
import com.formrules.generator.codegen.model.input.ViewDefinition;
import com.formrules.generator.codegen.parsing.exception.FormDefinitionParseException;

/**
 * Reads the JSON form definition document. The root object is keyed by form
 * display name; each entry holds a {@code FormDefinition} object (or the
 * definition itself).
 *
 * Parsing only: no normalization beyond stripping {@code .xsl} view suffixes.
 */
public class FormDefinitionParser {

    private static final Logger log = LoggerFactory.getLogger(FormDefinitionParser.class);

    private static final String XSL_SUFFIX = ".xsl";

    private final ObjectMapper mapper;

    public FormDefinitionParser() {
        this(new ObjectMapper());
    }

    public FormDefinitionParser(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public List<FormDocument> parse(Path inputFile) throws IOException {
        log.debug("Reading form definitions from {}", inputFile);
        return parse(Files.readString(inputFile));
    }

    public List<FormDocument> parse(String json) throws IOException {
        JsonNode root = mapper.readTree(json);
        if (root == null || !root.isObject()) {
            throw new FormDefinitionParseException("Form definition document must be a JSON object keyed by form name");
        }

        List<FormDocument> forms = new ArrayList<>();
        Iterator<Map.Entry<String, JsonNode>> fields = root.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> entry = fields.next();
            forms.add(parseForm(entry.getKey(), entry.getValue()));
        }
        log.info("Parsed {} form definition(s)", forms.size());
        return forms;
    }

    private FormDocument parseForm(String displayName, JsonNode node) {
        if (node == null || !node.isObject()) {
            throw new FormDefinitionParseException("Form '" + displayName + "' is not a JSON object");
        }
        JsonNode definition = node.has("FormDefinition") ? node.get("FormDefinition") : node;

        FormDocument.FormDocumentBuilder form = FormDocument.builder().displayName(displayName);

        for (JsonNode view : array(definition, "Views")) {
            form.view(parseView(view));
        }
        for (JsonNode column : array(definition, "Data")) {
            form.dataColumn(parseDataColumn(column));
        }
        for (JsonNode section : array(definition, "DynamicSections")) {
            form.dynamicSection(parseDynamicSection(section));
        }
        JsonNode visibility = definition.get("ConditionalVisibility");
        if (visibility != null && visibility.isObject()) {
            Iterator<Map.Entry<String, JsonNode>> triggers = visibility.fields();
            while (triggers.hasNext()) {
                Map.Entry<String, JsonNode> trigger = triggers.next();
                form.visibilityTrigger(trigger.getKey(), strings(trigger.getValue()));
            }
        }

        FormDocument result = form.build();
        log.debug("Form '{}': {} view(s), {} data column(s), {} dynamic section(s), {} visibility trigger(s)",
                displayName, result.getViews().size(), result.getDataColumns().size(),
                result.getDynamicSections().size(), result.getVisibilityTriggers().size());
        return result;
    }

    private DynamicSection parseDynamicSection(JsonNode node) {
        return DynamicSection.builder()
                .mode(text(node, "Mode"))
                .ctrlId(text(node, "CtrlId"))
                .caption(text(node, "Caption"))
                .conditionField(text(node, "ConditionField"))
                .conditionValue(text(node, "ConditionValue"))
                .controls(strings(node.get("Controls")))
                .build();
    }

    private ViewDefinition parseView(JsonNode node) {
        String viewName = text(node, "ViewName");
        if (viewName == null || viewName.isBlank()) {
            throw new FormDefinitionParseException("View without ViewName: " + node);
        }
        if (viewName.toLowerCase(Locale.ROOT).endsWith(XSL_SUFFIX)) {
            viewName = viewName.substring(0, viewName.length() - XSL_SUFFIX.length());
        }

        ViewDefinition.ViewDefinitionBuilder view = ViewDefinition.builder().viewName(viewName);
        for (JsonNode control : array(node, "Controls")) {
            view.control(parseControl(control));
        }
        return view.build();
    }

    private ControlDefinition parseControl(JsonNode node) {
        ControlDefinition.ControlDefinitionBuilder control = ControlDefinition.builder()
                .name(text(node, "Name"))
                .ctrlId(text(node, "CtrlId"))
                .type(text(node, "Type"))
                .label(text(node, "Label"))
                .gridPosition(text(node, "GridPosition"));

        // Group membership may be declared at the control root or in RepeatingSectionInfo
        String sectionName = text(node, "RepeatingSectionName");
        boolean inSection = sectionName != null && !sectionName.isBlank();

        JsonNode info = node.get("RepeatingSectionInfo");
        if (info != null && info.isObject()) {
            boolean flagged = flag(info, "IsInRepeatingSection");
            String infoName = text(info, "RepeatingSectionName");
            if (flagged && infoName != null && !infoName.isBlank()) {
                sectionName = infoName;
                inSection = true;
            }
            control.parentRepeatingSectionName(text(info, "ParentRepeatingSectionName"));
        }
        control.inRepeatingSection(inSection).repeatingSectionName(inSection ? sectionName : null);

        JsonNode dataOptions = node.get("DataOptions");
        if (dataOptions != null && dataOptions.isObject()) {
            control.disableEditing(flag(dataOptions, "disableEditing"));
        }
        return control.build();
    }

    private DataColumn parseDataColumn(JsonNode node) {
        return DataColumn.builder()
                .columnName(text(node, "ColumnName"))
                .repeating(flag(node, "IsRepeating"))
                .repeatingSectionName(text(node, "RepeatingSectionName"))
                .dataType(text(node, "DataType"))
                .build();
    }

    private static Iterable<JsonNode> array(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || !value.isArray()) {
            return List.of();
        }
        return value;
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        return value.isValueNode() ? value.asText() : value.toString();
    }

    /** Accepts JSON booleans as well as "yes"/"true"/"1" strings. */
    private static boolean flag(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return false;
        }
        if (value.isBoolean()) {
            return value.booleanValue();
        }
        String text = value.asText().trim().toLowerCase(Locale.ROOT);
        return text.equals("yes") || text.equals("true") || text.equals("1");
    }

    /** Non-blank text elements of an array; anything else yields an empty list. */
    private static List<String> strings(JsonNode node) {
        if (node == null || !node.isArray()) {
            return List.of();
        }
        List<String> values = new ArrayList<>();
        for (JsonNode element : node) {
            if (element.isValueNode() && !element.isNull() && !element.asText().isBlank()) {
                values.add(element.asText());
            }
        }
        return values;
    }
}
