package com.openapi.simpleSDK.generator.ir;

import java.util.Locale;
import java.util.Optional;

public enum HttpMethod {
    GET, PUT, POST, DELETE, OPTIONS, HEAD, PATCH, TRACE;

    /** Maps a path item key to a method; non-method keys such as "parameters" yield empty. */
    public static Optional<HttpMethod> fromPathItemKey(String key) {
        if (key == null) {
            return Optional.empty();
        }
        try {
            return Optional.of(HttpMethod.valueOf(key.toUpperCase(Locale.ROOT)));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }
}
