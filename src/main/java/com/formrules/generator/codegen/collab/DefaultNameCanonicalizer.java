package com.formrules.generator.codegen.collab;

/**
 * Collapses every run of characters outside {@code [A-Za-z0-9_]} into a single
 * underscore and trims leading/trailing underscores. Blank input yields
 * {@code "Unnamed"}.
 */
public class DefaultNameCanonicalizer implements NameCanonicalizer {

    @Override
    public String canonicalize(String raw) {
        if (raw == null || raw.isBlank()) {
            return "Unnamed";
        }
        String name = raw.trim()
                .replaceAll("[^A-Za-z0-9_]+", "_")
                .replaceAll("_{2,}", "_")
                .replaceAll("^_+|_+$", "");
        return name.isEmpty() ? "Unnamed" : name;
    }
}
