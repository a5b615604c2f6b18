package com.formrules.generator.codegen.registry;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

import com.formrules.generator.codegen.model.form.ControlBinding;
import com.formrules.generator.codegen.model.form.ViewIdentifiers;

/**
 * Per generated view: field name to control binding, plus the runtime
 * identifiers once the view has been deployed.
 */
public class ViewControlRegistry {

    private final Map<String, Map<String, ControlBinding>> controlsByView = new LinkedHashMap<>();
    private final Map<String, ViewIdentifiers> identifiersByView = new LinkedHashMap<>();

    public void registerControl(String viewName, ControlBinding binding) {
        controlsByView.computeIfAbsent(viewName, k -> new LinkedHashMap<>())
                .putIfAbsent(binding.getFieldName(), binding);
    }

    /** Field name to binding, in registration order. Empty for unknown views. */
    public Map<String, ControlBinding> getControls(String viewName) {
        Map<String, ControlBinding> controls = controlsByView.get(viewName);
        return controls == null ? Map.of() : Collections.unmodifiableMap(controls);
    }

    public void registerIdentifiers(String viewName, ViewIdentifiers identifiers) {
        identifiersByView.put(viewName, identifiers);
    }

    public Optional<ViewIdentifiers> getIdentifiers(String viewName) {
        return Optional.ofNullable(identifiersByView.get(viewName));
    }

    /** Reverse lookup of a view name by its instance id. */
    public Optional<String> findViewByInstanceId(String instanceId) {
        if (instanceId == null) {
            return Optional.empty();
        }
        return identifiersByView.entrySet().stream()
                .filter(e -> instanceId.equals(e.getValue().getEffectiveInstanceId()))
                .map(Map.Entry::getKey)
                .findFirst();
    }
}
