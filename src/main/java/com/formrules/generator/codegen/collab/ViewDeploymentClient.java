package com.formrules.generator.codegen.collab;

import com.formrules.generator.codegen.model.form.ViewIdentifiers;

/**
 * Deploys a generated view to the target runtime and returns the identifiers the
 * runtime assigned to it.
 */
public interface ViewDeploymentClient {

    ViewIdentifiers resolveViewIdentifiers(String viewName) throws DeploymentException;
}
