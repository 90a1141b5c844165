package com.openapi.simpleSDK.generator.parsing;

/**
 * Thrown when the top-level document is malformed. This is the only parsing failure that
 * aborts a run.
 */
public class SpecStructureException extends RuntimeException {
    public SpecStructureException(String message) {
        super(message);
    }
}
