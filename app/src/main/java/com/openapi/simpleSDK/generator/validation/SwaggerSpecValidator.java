package com.openapi.simpleSDK.generator.validation;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.swagger.v3.parser.OpenAPIV3Parser;
import io.swagger.v3.parser.core.models.ParseOptions;
import io.swagger.v3.parser.core.models.SwaggerParseResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Validates documents with swagger-parser. References are not resolved; only the messages of
 * the structural parse are reported.
 */
public class SwaggerSpecValidator implements SpecValidator {
    private static final Logger logger = LoggerFactory.getLogger(SwaggerSpecValidator.class);

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Override
    public List<String> validate(JsonNode document) {
        String contents;
        try {
            contents = objectMapper.writeValueAsString(document);
        } catch (JsonProcessingException e) {
            logger.warn("Could not serialize document for validation", e);
            return List.of("Could not serialize document for validation: " + e.getOriginalMessage());
        }

        ParseOptions options = new ParseOptions();
        options.setResolve(false);
        SwaggerParseResult result = new OpenAPIV3Parser().readContents(contents, null, options);

        List<String> messages = new ArrayList<>();
        if (result.getMessages() != null) {
            messages.addAll(result.getMessages());
        }
        logger.debug("Validation produced {} messages", messages.size());
        return messages;
    }
}
