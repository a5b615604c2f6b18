package com.formrules.generator.codegen.collab;

import java.util.UUID;

/**
 * Random UUID identifiers, the format the target runtime expects.
 */
public class RandomIdentifierSource implements IdentifierSource {

    @Override
    public String newId() {
        return UUID.randomUUID().toString();
    }
}
