package com.openapi.simpleSDK.generator.parser;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.openapi.simpleSDK.generator.SpecLoader;
import com.openapi.simpleSDK.generator.SpecReader;
import com.openapi.simpleSDK.generator.ir.HttpMethod;
import com.openapi.simpleSDK.generator.ir.IROperation;
import com.openapi.simpleSDK.generator.ir.IRParameter;
import com.openapi.simpleSDK.generator.ir.IRResponse;
import com.openapi.simpleSDK.generator.ir.IRSpec;
import com.openapi.simpleSDK.generator.parsing.ParseWarning;
import com.openapi.simpleSDK.generator.parsing.ParsingContext;
import com.openapi.simpleSDK.generator.parsing.ParsingOptions;
import com.openapi.simpleSDK.generator.parsing.SchemaParser;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class OperationParserTest {

    private ParsingContext context;
    private List<IROperation> operations;

    @BeforeEach
    void setUp() throws Exception {
        JsonNode document = new ObjectMapper().readTree("""
            {
              "openapi": "3.0.3",
              "paths": {
                "/items/{id}": {
                  "parameters": [
                    {"name": "id", "in": "path", "schema": {"type": "string"}},
                    {"name": "verbose", "in": "query", "schema": {"type": "boolean"}}
                  ],
                  "get": {
                    "operationId": "getItem",
                    "parameters": [
                      {"name": "verbose", "in": "query", "required": true, "schema": {"type": "integer"}},
                      {"name": "page", "in": "query", "type": "integer", "format": "int32"},
                      {"$ref": "#/components/parameters/Nope"}
                    ],
                    "responses": {
                      "200": {"description": "events", "content": {"text/event-stream": {"schema": {"type": "string"}}}}
                    }
                  },
                  "put": {
                    "operationId": "updateItem",
                    "responses": {
                      "200": {
                        "description": "updated",
                        "content": {
                          "application/json": {"schema": {"type": "object", "properties": {"ok": {"type": "boolean"}}}},
                          "application/xml": {"schema": {"type": "object", "properties": {"ok": {"type": "boolean"}}}}
                        }
                      },
                      "default": {"$ref": "#/components/responses/Missing"}
                    }
                  }
                },
                "/broken": {
                  "get": "not an operation"
                }
              },
              "components": {}
            }
            """);
        context = new ParsingContext(document, ParsingOptions.defaults());
        operations = new OperationParser(context, new SchemaParser(context)).parseOperations(document.get("paths"));
    }

    @Test
    @DisplayName("Operation parameters override path parameters with the same name and location")
    void testParameterMerging() {
        IROperation getItem = operations.get(0);

        assertThat(getItem.parameters()).extracting(IRParameter::name).containsExactly("id", "verbose", "page");
        IRParameter id = getItem.parameters().get(0);
        assertThat(id.required()).isTrue();
        IRParameter verbose = getItem.parameters().get(1);
        assertThat(verbose.required()).isTrue();
        assertThat(verbose.schema().getType()).isEqualTo("integer");
        IRParameter page = getItem.parameters().get(2);
        assertThat(page.required()).isFalse();
        assertThat(page.schema().getType()).isEqualTo("integer");
        assertThat(page.schema().getFormat()).isEqualTo("int32");
    }

    @Test
    void testStreamingResponse() {
        IRResponse response = operations.get(0).responses().get(0);

        assertThat(response.stream()).isTrue();
        assertThat(response.streamFormat()).isEqualTo("text/event-stream");
    }

    @Test
    void testInlineResponseIsRegisteredOnce() {
        IROperation updateItem = operations.get(1);
        IRResponse response = updateItem.responses().get(0);

        assertThat(updateItem.method()).isEqualTo(HttpMethod.PUT);
        assertThat(context.getSchemas()).containsOnlyKeys("UpdateItemResponse");
        assertThat(response.content().get("application/json")).isSameAs(context.getSchema("UpdateItemResponse"));
        assertThat(response.content().get("application/xml")).isSameAs(context.getSchema("UpdateItemResponse"));
        assertThat(response.stream()).isFalse();
        assertThat(updateItem.responses()).hasSize(1);
    }

    @Test
    void testBrokenPartsAreSkippedWithWarnings() {
        assertThat(operations).extracting(IROperation::operationId).containsExactly("getItem", "updateItem");
        assertThat(context.getWarnings()).extracting(ParseWarning::kind).containsExactlyInAnyOrder(
            ParseWarning.Kind.UNRESOLVABLE_REFERENCE,
            ParseWarning.Kind.UNRESOLVABLE_REFERENCE,
            ParseWarning.Kind.OPERATION_SKIPPED);
        assertThat(context.getWarningMessages())
            .contains("Skipping operation GET /broken: operation must be an object, found STRING")
            .contains("Could not resolve response default of operation updateItem");
    }

    @Test
    void testPetstoreOperations() throws Exception {
        JsonNode document = new SpecReader().read(Path.of(getClass().getResource("/specs/petstore.json").toURI()));
        IRSpec spec = new SpecLoader(document).load().spec();

        assertThat(spec.operations()).extracting(IROperation::operationId)
            .containsExactly("listPets", "createPet", "get_pets_pet_id", "downloadPhoto");

        IROperation listPets = spec.operations().get(0);
        IRParameter limit = listPets.parameters().get(0);
        assertThat(limit.name()).isEqualTo("limit");
        assertThat(limit.in()).isEqualTo("query");
        assertThat(limit.required()).isFalse();
        assertThat(limit.schema().getDefaultValue()).isEqualTo(20);
        assertThat(listPets.tags()).containsExactly("pets");
        assertThat(listPets.responses().get(0).content().get("application/json"))
            .isSameAs(spec.schemas().get("PetListResponse"));

        IROperation createPet = spec.operations().get(1);
        assertThat(createPet.requestBody().required()).isTrue();
        assertThat(createPet.requestBody().content().get("application/json"))
            .isSameAs(spec.schemas().get("CreatePetRequest"));

        IROperation getPet = spec.operations().get(2);
        assertThat(getPet.parameters()).singleElement().satisfies(petId -> {
            assertThat(petId.name()).isEqualTo("petId");
            assertThat(petId.required()).isTrue();
            assertThat(petId.schema().getFormat()).isEqualTo("uuid");
        });
        assertThat(getPet.responses()).extracting(IRResponse::statusCode).containsExactly("200", "404");
        assertThat(getPet.responses().get(1).content().get("application/json")).isSameAs(spec.schemas().get("Error"));

        IRResponse photo = spec.operations().get(3).responses().get(0);
        assertThat(photo.stream()).isTrue();
        assertThat(photo.streamFormat()).isEqualTo("application/octet-stream");
    }
}
