package com.openapi.simpleSDK.generator.parsing;

import com.openapi.simpleSDK.generator.ir.IRSchema;
import org.junit.jupiter.api.Test;

import static com.openapi.simpleSDK.generator.parsing.SchemaParserTest.contextWithSchemas;
import static org.assertj.core.api.Assertions.assertThat;

class InlineArrayItemExtractorTest {

    @Test
    void testItemName() {
        assertThat(InlineArrayItemExtractor.itemName("UserListResponse", "data")).isEqualTo("UserListItem");
        assertThat(InlineArrayItemExtractor.itemName("UserListResponse", "errors")).isEqualTo("UserListResponseErrorsItem");
        assertThat(InlineArrayItemExtractor.itemName("Order", "lines")).isEqualTo("OrderLinesItem");
    }

    @Test
    void testComplexItemsAreRegistered() throws Exception {
        ParsingContext context = contextWithSchemas("""
            {
              "Order": {
                "type": "object",
                "properties": {
                  "lines": {"type": "array", "items": {"type": "object", "properties": {
                    "sku": {"type": "string"},
                    "parts": {"type": "array", "items": {"type": "object", "properties": {"code": {"type": "string"}}}}
                  }}},
                  "notes": {"type": "array", "items": {"type": "string"}},
                  "variants": {"type": "array", "items": {"oneOf": [{"type": "string"}, {"type": "integer"}]}},
                  "owners": {"type": "array", "items": {"$ref": "#/components/schemas/Owner"}}
                }
              },
              "Owner": {"type": "object", "properties": {"id": {"type": "string"}}}
            }
            """);
        SchemaParser parser = new SchemaParser(context);
        parser.resolveNamed("Order");

        int extracted = new InlineArrayItemExtractor(context).extract();

        assertThat(extracted).isEqualTo(3);
        IRSchema lines = context.getSchema("Order").getProperties().get("lines");
        assertThat(context.getSchema("OrderLinesItem")).isSameAs(lines.getItems());
        assertThat(lines.getItems().getName()).isEqualTo("OrderLinesItem");
        assertThat(context.getSchema("OrderLinesItemPartsItem").getProperties()).containsOnlyKeys("code");
        assertThat(context.getSchema("OrderVariantsItem").getOneOf()).hasSize(2);
        assertThat(context.getSchemas()).doesNotContainKeys("OrderNotesItem", "OrderOwnersItem");
    }

    @Test
    void testItemNameCollisionGetsCounter() throws Exception {
        ParsingContext context = contextWithSchemas("""
            {
              "UserListResponse": {"type": "object", "properties": {
                "data": {"type": "array", "items": {"type": "object", "properties": {"name": {"type": "string"}}}}}},
              "UserListItem": {"type": "object", "properties": {"other": {"type": "string"}}}
            }
            """);
        SchemaParser parser = new SchemaParser(context);
        parser.resolveNamed("UserListResponse");
        parser.resolveNamed("UserListItem");

        new InlineArrayItemExtractor(context).extract();

        assertThat(context.getSchema("UserListItem").getProperties()).containsOnlyKeys("other");
        assertThat(context.getSchema("UserListItem1").getProperties()).containsOnlyKeys("name");
    }
}
