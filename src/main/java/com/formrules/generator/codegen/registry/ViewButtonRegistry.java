package com.formrules.generator.codegen.registry;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.formrules.generator.codegen.model.form.FormButtons;
import com.formrules.generator.codegen.model.form.ViewButtons;

/**
 * Button identifiers per generated view (and per form for the form action
 * buttons). Written while views are planned, read by the rule generators.
 */
public class ViewButtonRegistry {

    private static final Logger log = LoggerFactory.getLogger(ViewButtonRegistry.class);

    private final Map<String, ViewButtons> buttonsByView = new LinkedHashMap<>();
    private final Map<String, FormButtons> buttonsByForm = new LinkedHashMap<>();

    public void registerViewButtons(String viewName, ViewButtons buttons) {
        if (viewName == null || viewName.isBlank() || buttons == null) {
            return;
        }
        ViewButtons previous = buttonsByView.put(viewName, buttons);
        if (previous != null) {
            log.warn("Buttons for view {} registered twice; later registration wins", viewName);
        }
        log.debug("Registered buttons for view {}: {}", viewName, buttons);
    }

    public Optional<ViewButtons> getViewButtons(String viewName) {
        return Optional.ofNullable(buttonsByView.get(viewName));
    }

    public void registerFormButtons(String formName, FormButtons buttons) {
        if (formName == null || formName.isBlank() || buttons == null) {
            return;
        }
        buttonsByForm.put(formName, buttons);
        log.debug("Registered form buttons for {}: {}", formName, buttons);
    }

    public Optional<FormButtons> getFormButtons(String formName) {
        return Optional.ofNullable(buttonsByForm.get(formName));
    }
}
