package com.formrules.generator.codegen.collab;

/**
 * Raised by a {@link ViewDeploymentClient} when a view cannot be deployed or its
 * identifiers cannot be resolved.
 */
public class DeploymentException extends Exception {

    private static final long serialVersionUID = 1L;

    private final String viewName;

    public DeploymentException(String viewName, String message) {
        super(message);
        this.viewName = viewName;
    }

    public DeploymentException(String viewName, String message, Throwable cause) {
        super(message, cause);
        this.viewName = viewName;
    }

    public String getViewName() {
        return viewName;
    }
}
