package com.openapi.simpleSDK.generator.ir;

import java.util.Map;

/**
 * @param statusCode HTTP status code or "default"
 * @param content media type to response schema, in document order
 * @param stream true when the response is delivered as a byte or event stream
 * @param streamFormat the streaming media type, or null
 */
public record IRResponse(
    String statusCode,
    String description,
    Map<String, IRSchema> content,
    boolean stream,
    String streamFormat
) {}
