package com.formrules.generator.codegen.collab;

import java.util.HashMap;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.formrules.generator.codegen.model.form.ViewIdentifiers;

/**
 * Offline deployment: assigns view and instance identifiers locally. Repeated
 * lookups of the same view return the same identifiers.
 */
public class LocalViewDeploymentClient implements ViewDeploymentClient {

    private static final Logger log = LoggerFactory.getLogger(LocalViewDeploymentClient.class);

    private final IdentifierSource identifiers;
    private final Map<String, ViewIdentifiers> assigned = new HashMap<>();

    public LocalViewDeploymentClient(IdentifierSource identifiers) {
        this.identifiers = identifiers;
    }

    @Override
    public ViewIdentifiers resolveViewIdentifiers(String viewName) throws DeploymentException {
        if (viewName == null || viewName.isBlank()) {
            throw new DeploymentException(viewName, "View name is blank");
        }
        return assigned.computeIfAbsent(viewName, name -> {
            ViewIdentifiers ids = new ViewIdentifiers(identifiers.newId(), identifiers.newId());
            log.debug("Assigned local identifiers for view {}: {}", name, ids);
            return ids;
        });
    }
}
