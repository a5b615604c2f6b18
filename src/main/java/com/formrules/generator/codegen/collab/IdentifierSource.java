package com.formrules.generator.codegen.collab;

/**
 * Supplies identifiers for generated nodes. Every call must return a value never
 * returned before within the run.
 */
@FunctionalInterface
public interface IdentifierSource {

    String newId();
}
