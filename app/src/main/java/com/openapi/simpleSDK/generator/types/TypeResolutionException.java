package com.openapi.simpleSDK.generator.types;

/**
 * Thrown when a schema carries an explicit reference that the schema registry cannot resolve.
 */
public class TypeResolutionException extends RuntimeException {
    public TypeResolutionException(String message) {
        super(message);
    }
}
