package com.openapi.simpleSDK.generator.ir;

/**
 * @param in one of path, query, header, cookie
 */
public record IRParameter(
    String name,
    String in,
    boolean required,
    IRSchema schema,
    String description
) {}
