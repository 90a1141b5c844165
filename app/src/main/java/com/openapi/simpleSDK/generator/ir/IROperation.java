package com.openapi.simpleSDK.generator.ir;

import java.util.List;

public record IROperation(
    String operationId,
    HttpMethod method,
    String path,
    String summary,
    String description,
    List<IRParameter> parameters,
    IRRequestBody requestBody,
    List<IRResponse> responses,
    List<String> tags
) {}
