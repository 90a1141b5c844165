package com.openapi.simpleSDK.generator.parsing;

/**
 * A recovered problem found while parsing. The run continues and the warning is reported with
 * the result.
 */
public record ParseWarning(Kind kind, String message) {

    public enum Kind {
        UNRESOLVABLE_REFERENCE,
        CYCLE_DETECTED,
        MAX_DEPTH_EXCEEDED,
        AMBIGUOUS_TYPE_DECLARATION,
        COMPOSITION_PROCESSING_FAILURE,
        VALIDATION,
        OPERATION_SKIPPED
    }

    @Override
    public String toString() {
        return message;
    }
}
