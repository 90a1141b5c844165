package com.openapi.simpleSDK.generator.ir;

import java.util.Map;

/**
 * @param content media type to body schema, in document order
 */
public record IRRequestBody(
    boolean required,
    Map<String, IRSchema> content,
    String description
) {}
