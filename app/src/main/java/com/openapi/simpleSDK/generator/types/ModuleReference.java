package com.openapi.simpleSDK.generator.types;

/**
 * @param path import path relative to the current module, e.g. {@code .pet}
 * @param forwardRef true if the target must not be imported at module level
 */
public record ModuleReference(String path, boolean forwardRef) {}
