package com.formrules.generator.codegen.util;

import java.util.Arrays;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Utility for the display names used in generated views and rules.
 */
public class NamingUtil {

    private static final Map<String, String> CONTROL_SUFFIXES = Map.of(
            "textfield", "Text Box",
            "textarea", "Text Area",
            "richtext", "Text Area",
            "dropdown", "Drop-Down List",
            "checkbox", "Check Box",
            "datepicker", "Calendar Picker",
            "radiobutton", "Radio Button List",
            "label", "Label",
            "button", "Button");

    private NamingUtil() {
        // Utility class
    }

    /**
     * Converts LINE_ITEM_ID, line-item-id or LineItemId to "Line Item ID".
     */
    public static String toDisplayName(String name) {
        if (name == null || name.isEmpty()) {
            return name;
        }
        String spaced = name.replaceAll("([a-z0-9])([A-Z])", "$1 $2");
        return Arrays.stream(spaced.split("[-_\\s]+"))
                .filter(s -> !s.isEmpty())
                .map(NamingUtil::displayWord)
                .collect(Collectors.joining(" "));
    }

    /**
     * Name of a field's control inside a view, e.g. "Amount Text Box".
     */
    public static String toControlName(String fieldName, String controlType) {
        String suffix = controlType == null ? null : CONTROL_SUFFIXES.get(controlType.toLowerCase(Locale.ROOT));
        String base = toDisplayName(fieldName);
        return suffix == null ? base : base + " " + suffix;
    }

    private static String displayWord(String word) {
        if (word.equalsIgnoreCase("id")) {
            return "ID";
        }
        return word.substring(0, 1).toUpperCase(Locale.ROOT) + word.substring(1).toLowerCase(Locale.ROOT);
    }
}
