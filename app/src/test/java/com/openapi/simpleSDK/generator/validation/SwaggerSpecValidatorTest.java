package com.openapi.simpleSDK.generator.validation;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class SwaggerSpecValidatorTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final SwaggerSpecValidator validator = new SwaggerSpecValidator();

    @Test
    void testValidDocumentHasNoMessages() throws Exception {
        List<String> messages = validator.validate(objectMapper.readTree("""
            {
              "openapi": "3.0.3",
              "info": {"title": "Minimal", "version": "1.0.0"},
              "paths": {
                "/ping": {"get": {"responses": {"200": {"description": "pong"}}}}
              }
            }
            """));

        assertThat(messages).isEmpty();
    }

    @Test
    void testInvalidDocumentReportsMessages() throws Exception {
        List<String> messages = validator.validate(objectMapper.readTree("""
            {"openapi": "3.0.3", "paths": {"/ping": {"get": {"responses": "nope"}}}}
            """));

        assertThat(messages).isNotEmpty();
        assertThat(messages).anySatisfy(message -> assertThat(message).contains("info"));
    }
}
