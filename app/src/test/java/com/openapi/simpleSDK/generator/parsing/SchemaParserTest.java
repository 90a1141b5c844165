package com.openapi.simpleSDK.generator.parsing;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.openapi.simpleSDK.generator.ir.IRSchema;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class SchemaParserTest {

    private static final ObjectMapper objectMapper = new ObjectMapper();

    static ParsingContext contextWithSchemas(String schemasJson, ParsingOptions options) throws Exception {
        JsonNode document = objectMapper.readTree("""
            {"openapi": "3.0.3", "info": {"title": "t", "version": "1"}, "paths": {},
             "components": {"schemas": %s}}
            """.formatted(schemasJson));
        return new ParsingContext(document, options);
    }

    static ParsingContext contextWithSchemas(String schemasJson) throws Exception {
        return contextWithSchemas(schemasJson, ParsingOptions.defaults());
    }

    @Test
    @DisplayName("Inline object property is promoted to a named schema")
    void testInlineObjectPromotion() throws Exception {
        ParsingContext context = contextWithSchemas("{}");
        SchemaParser parser = new SchemaParser(context);
        JsonNode node = objectMapper.readTree("""
            {"type": "object",
             "properties": {
               "details": {
                 "type": "object",
                 "properties": {"fieldA": {"type": "string"}},
                 "required": ["fieldA"]
               }
             }}
            """);

        IRSchema outer = parser.parseSchema("OuterSchema", node, true);

        IRSchema promoted = context.getSchema("DetailData");
        assertThat(promoted).isNotNull();
        assertThat(promoted.getName()).isEqualTo("DetailData");
        assertThat(promoted.getProperties()).containsOnlyKeys("fieldA");
        assertThat(promoted.getProperties().get("fieldA").getType()).isEqualTo("string");
        assertThat(promoted.getRequired()).containsExactly("fieldA");

        IRSchema slot = outer.getProperties().get("details");
        assertThat(slot.getType()).isEqualTo("DetailData");
        assertThat(slot.getRefersToSchema()).isSameAs(promoted);
        assertThat(context.getSchema("OuterSchema")).isSameAs(outer);
    }

    @Test
    void testPromotionNameCollisionFallsBackToParentName() throws Exception {
        ParsingContext context = contextWithSchemas("""
            {
              "First": {"type": "object", "properties": {"details": {"type": "object", "properties": {"a": {"type": "string"}}}}},
              "Second": {"type": "object", "properties": {"details": {"type": "object", "properties": {"b": {"type": "string"}}}}}
            }
            """);
        SchemaParser parser = new SchemaParser(context);

        parser.resolveNamed("First");
        IRSchema second = parser.resolveNamed("Second");

        assertThat(context.getSchema("DetailData").getProperties()).containsOnlyKeys("a");
        assertThat(context.getSchema("SecondDetailData").getProperties()).containsOnlyKeys("b");
        assertThat(second.getProperties().get("details").getType()).isEqualTo("SecondDetailData");
    }

    @Test
    void testPromotionDoesNotTakeNameOfLaterComponent() throws Exception {
        ParsingContext context = contextWithSchemas("""
            {
              "Order": {"type": "object", "properties": {"user": {"type": "object", "properties": {"id": {"type": "string"}}}}},
              "User": {"type": "object", "properties": {
                "id": {"type": "string"}, "email": {"type": "string"}, "age": {"type": "integer"}}}
            }
            """);
        SchemaParser parser = new SchemaParser(context);

        IRSchema order = parser.resolveNamed("Order");
        IRSchema user = parser.resolveNamed("User");

        assertThat(user.getName()).isEqualTo("User");
        assertThat(user.getProperties()).containsOnlyKeys("id", "email", "age");
        IRSchema promoted = context.getSchema("OrderUser");
        assertThat(promoted).isNotNull().isNotSameAs(user);
        assertThat(promoted.getProperties()).containsOnlyKeys("id");
        assertThat(order.getProperties().get("user").getRefersToSchema()).isSameAs(promoted);
        assertThat(context.getSchemas()).containsOnlyKeys("Order", "OrderUser", "User");
    }

    @Test
    void testEntityLikeObjectKeepsPlainName() throws Exception {
        ParsingContext context = contextWithSchemas("{}");
        SchemaParser parser = new SchemaParser(context);
        JsonNode node = objectMapper.readTree("""
            {"type": "object", "properties": {"owner": {"type": "object", "properties": {"id": {"type": "string"}}}}}
            """);

        parser.parseSchema("Pet", node, true);

        assertThat(context.getSchema("Owner")).isNotNull();
    }

    @Test
    void testFreeFormMapIsNotPromoted() throws Exception {
        ParsingContext context = contextWithSchemas("{}");
        SchemaParser parser = new SchemaParser(context);
        JsonNode node = objectMapper.readTree("""
            {"type": "object", "properties": {"meta": {"type": "object", "additionalProperties": {"type": "string"}}}}
            """);

        IRSchema schema = parser.parseSchema("Holder", node, true);

        IRSchema meta = schema.getProperties().get("meta");
        assertThat(meta.getType()).isEqualTo("object");
        assertThat(meta.getAdditionalPropertiesSchema().getType()).isEqualTo("string");
        assertThat(context.getSchemas()).containsOnlyKeys("Holder");
    }

    @Test
    @DisplayName("Self-referencing schema resolves to one shared instance")
    void testSelfReferenceReturnsIdenticalInstance() throws Exception {
        ParsingContext context = contextWithSchemas("""
            {"Node": {"type": "object", "properties": {
                "id": {"type": "string"},
                "parent": {"$ref": "#/components/schemas/Node"}}}}
            """);
        SchemaParser parser = new SchemaParser(context);

        IRSchema first = parser.resolveNamed("Node");
        IRSchema second = parser.resolveNamed("Node");

        assertThat(second).isSameAs(first);
        assertThat(first.getProperties().get("parent")).isSameAs(first);
        assertThat(first.isCircularRef()).isTrue();
        assertThat(first.getCircularRefPath()).isEqualTo("Node -> Node");
        assertThat(first.getProperties()).containsOnlyKeys("id", "parent");
        assertThat(context.isCycleDetected()).isTrue();
        assertThat(context.getWarnings())
            .extracting(ParseWarning::kind)
            .containsExactly(ParseWarning.Kind.CYCLE_DETECTED);
        assertThat(context.getRecursionStack()).isEmpty();
        assertThat(context.getCurrentDepth()).isZero();
    }

    @Test
    void testMutualReferenceSharesCanonicalInstances() throws Exception {
        ParsingContext context = contextWithSchemas("""
            {"A": {"type": "object", "properties": {"b": {"$ref": "#/components/schemas/B"}}},
             "B": {"type": "object", "properties": {"a": {"$ref": "#/components/schemas/A"}}}}
            """);
        SchemaParser parser = new SchemaParser(context);

        IRSchema a = parser.resolveNamed("A");
        IRSchema b = parser.resolveNamed("B");

        assertThat(a.getProperties().get("b")).isSameAs(b);
        assertThat(b.getProperties().get("a")).isSameAs(a);
        assertThat(context.getWarningMessages()).containsExactly("Circular reference detected: A -> B -> A");
    }

    @Test
    @DisplayName("Arrays nested beyond the depth limit end in a bounded placeholder")
    void testDeepArrayIsBoundedByMaxDepth() throws Exception {
        ParsingOptions options = ParsingOptions.defaults().withMaxDepth(10);

        ParsingContext shallowContext = contextWithSchemas("{}", options);
        IRSchema shallow = new SchemaParser(shallowContext).parseSchema("Deep", nestedArrays(40), true);
        ParsingContext deepContext = contextWithSchemas("{}", options);
        new SchemaParser(deepContext).parseSchema("Deep", nestedArrays(400), true);

        assertThat(shallowContext.getMaxDepthReached()).isLessThanOrEqualTo(11);
        assertThat(deepContext.getMaxDepthReached()).isEqualTo(shallowContext.getMaxDepthReached());

        IRSchema current = shallow;
        IRSchema placeholder = null;
        while (current != null) {
            if (current.isCircularRef()) {
                placeholder = current;
                break;
            }
            current = current.getItems();
        }
        assertThat(placeholder).isNotNull();
        assertThat(placeholder.isMaxDepthExceeded()).isTrue();
        assertThat(placeholder.getCircularRefPath()).endsWith("MAX_DEPTH_EXCEEDED");
        assertThat(shallowContext.getWarnings())
            .extracting(ParseWarning::kind)
            .contains(ParseWarning.Kind.MAX_DEPTH_EXCEEDED);
    }

    @Test
    void testUnresolvableReferenceYieldsPlaceholder() throws Exception {
        ParsingContext context = contextWithSchemas("""
            {"Holder": {"type": "object", "properties": {"ghost": {"$ref": "#/components/schemas/Ghost"}}}}
            """);
        SchemaParser parser = new SchemaParser(context);

        IRSchema holder = parser.resolveNamed("Holder");

        IRSchema ghost = holder.getProperties().get("ghost");
        assertThat(ghost.isFromUnresolvedRef()).isTrue();
        assertThat(ghost.getName()).isEqualTo("Ghost");
        assertThat(context.hasSchema("Ghost")).isFalse();
        assertThat(context.getWarnings())
            .extracting(ParseWarning::kind)
            .containsExactly(ParseWarning.Kind.UNRESOLVABLE_REFERENCE);
    }

    @Test
    void testExternalReferenceIsUnsupported() throws Exception {
        ParsingContext context = contextWithSchemas("{}");
        SchemaParser parser = new SchemaParser(context);

        IRSchema schema = parser.parseSchema(null, objectMapper.readTree("{\"$ref\": \"common.json#/Pet\"}"), false);

        assertThat(schema.isFromUnresolvedRef()).isTrue();
        assertThat(context.getWarningMessages().get(0)).contains("unsupported reference format");
    }

    @Test
    void testMissingListResponseFallsBackToListOfBase() throws Exception {
        ParsingContext context = contextWithSchemas("""
            {"Pet": {"type": "object", "properties": {"name": {"type": "string"}}},
             "Holder": {"type": "object", "properties": {
                "pets": {"$ref": "#/components/schemas/PetListResponse"},
                "created": {"$ref": "#/components/schemas/PetCreate"}}}}
            """);
        SchemaParser parser = new SchemaParser(context);

        IRSchema holder = parser.resolveNamed("Holder");
        IRSchema pet = parser.resolveNamed("Pet");

        IRSchema pets = holder.getProperties().get("pets");
        assertThat(pets.getName()).isEqualTo("PetListResponse");
        assertThat(pets.getType()).isEqualTo("array");
        assertThat(pets.getItems()).isSameAs(pet);

        IRSchema created = holder.getProperties().get("created");
        assertThat(created.getName()).isEqualTo("PetCreate");
        assertThat(created).isNotSameAs(pet);
        assertThat(created.getProperties()).containsOnlyKeys("name");
        assertThat(context.getSchemas()).containsKeys("PetListResponse", "PetCreate");
    }

    @Test
    void testPointerEscapesInReferenceNames() throws Exception {
        ParsingContext context = contextWithSchemas("""
            {"a/b": {"type": "string"},
             "Holder": {"type": "object", "properties": {"x": {"$ref": "#/components/schemas/a~1b"}}}}
            """);
        SchemaParser parser = new SchemaParser(context);

        IRSchema holder = parser.resolveNamed("Holder");

        assertThat(holder.getProperties().get("x")).isSameAs(context.getSchema("a/b"));
        assertThat(context.getWarnings()).isEmpty();
    }

    @Test
    void testNullMemberIsExtractedFromAnyOf() throws Exception {
        ParsingContext context = contextWithSchemas("{}");
        SchemaParser parser = new SchemaParser(context);

        IRSchema schema = parser.parseSchema("MaybeName",
            objectMapper.readTree("{\"anyOf\": [{\"type\": \"string\"}, {\"type\": \"null\"}]}"), true);

        assertThat(schema.isNullable()).isTrue();
        assertThat(schema.getAnyOf()).hasSize(1);
        assertThat(schema.getAnyOf().get(0).getType()).isEqualTo("string");
    }

    @Test
    void testOpenApi31NullableTypeArray() throws Exception {
        ParsingContext context = contextWithSchemas("{}");
        SchemaParser parser = new SchemaParser(context);

        IRSchema schema = parser.parseSchema(null, objectMapper.readTree("{\"type\": [\"string\", \"null\"]}"), false);
        IRSchema ambiguous = parser.parseSchema("Mixed", objectMapper.readTree("{\"type\": [\"string\", \"integer\"]}"), true);

        assertThat(schema.getType()).isEqualTo("string");
        assertThat(schema.isNullable()).isTrue();
        assertThat(ambiguous.getType()).isEqualTo("string");
        assertThat(context.getWarnings())
            .extracting(ParseWarning::kind)
            .containsExactly(ParseWarning.Kind.AMBIGUOUS_TYPE_DECLARATION);
    }

    @Test
    void testRequiredIsLimitedToDeclaredProperties() throws Exception {
        ParsingContext context = contextWithSchemas("{}");
        SchemaParser parser = new SchemaParser(context);

        IRSchema schema = parser.parseSchema("Envelope", objectMapper.readTree("""
            {"type": "object", "properties": {"data": {"type": "string"}}, "required": ["data", "missing"]}
            """), true);

        assertThat(schema.getRequired()).containsExactly("data");
        assertThat(schema.isDataWrapper()).isTrue();
    }

    @Test
    void testScalarAttributesAreCopied() throws Exception {
        ParsingContext context = contextWithSchemas("{}");
        SchemaParser parser = new SchemaParser(context);

        IRSchema schema = parser.parseSchema("Created", objectMapper.readTree("""
            {"type": "string", "format": "date-time", "title": "Creation time", "description": "When",
             "default": "2024-01-01T00:00:00Z", "example": "2024-05-05T10:00:00Z", "nullable": true}
            """), true);

        assertThat(schema.getFormat()).isEqualTo("date-time");
        assertThat(schema.getTitle()).isEqualTo("Creation time");
        assertThat(schema.getDescription()).isEqualTo("When");
        assertThat(schema.getDefaultValue()).isEqualTo("2024-01-01T00:00:00Z");
        assertThat(schema.getExample()).isEqualTo("2024-05-05T10:00:00Z");
        assertThat(schema.isNullable()).isTrue();
    }

    @Test
    void testEnumTypeIsInferredFromValues() throws Exception {
        ParsingContext context = contextWithSchemas("{}");
        SchemaParser parser = new SchemaParser(context);

        IRSchema schema = parser.parseSchema("Level", objectMapper.readTree("{\"enum\": [1, 2, null]}"), true);

        assertThat(schema.getType()).isEqualTo("integer");
        assertThat(schema.getEnumValues()).containsExactly(1, 2);
        assertThat(schema.isNullable()).isTrue();
    }

    private static JsonNode nestedArrays(int depth) {
        ObjectNode node = JsonNodeFactory.instance.objectNode().put("type", "string");
        for (int i = 0; i < depth; i++) {
            ObjectNode array = JsonNodeFactory.instance.objectNode();
            array.put("type", "array");
            array.set("items", node);
            node = array;
        }
        return node;
    }
}
