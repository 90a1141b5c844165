package com.openapi.simpleSDK.generator.validation;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;

/**
 * Optional compliance check of a whole document. Messages are reported as warnings; a
 * validator never aborts a run.
 */
public interface SpecValidator {

    /** @return validation messages, empty when the document is valid */
    List<String> validate(JsonNode document);
}
