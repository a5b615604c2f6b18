package com.formrules.generator.codegen.collab;

/**
 * Canonicalizes raw form, view and field names. Implementations must be total
 * and stable: the same input always yields the same output within a run.
 */
@FunctionalInterface
public interface NameCanonicalizer {

    String canonicalize(String raw);
}
