package com.openapi.simpleSDK.generator.parsing;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.openapi.simpleSDK.generator.ir.IRSchema;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ParsingContextTest {

    private ParsingContext context;

    @BeforeEach
    void setUp() throws Exception {
        context = new ParsingContext(new ObjectMapper().readTree("""
            {"openapi": "3.0.0", "paths": {}, "components": {"schemas": {"Pet": {"type": "object"}}}}
            """), ParsingOptions.defaults().withMaxCycles(2));
    }

    @Test
    void testRawSchemaAccess() {
        assertThat(context.getRawSchema("Pet").path("type").asText()).isEqualTo("object");
        assertThat(context.getRawSchema("Missing")).isNull();
        assertThat(context.getRawSchemas().size()).isEqualTo(1);
    }

    @Test
    void testRecursionStackReportsCyclePath() {
        assertThat(context.enterSchema("A").cycle()).isFalse();
        assertThat(context.enterSchema("B").cycle()).isFalse();

        ParsingContext.CycleCheck check = context.enterSchema("A");

        assertThat(check.cycle()).isTrue();
        assertThat(check.path()).isEqualTo("A -> B -> A");
        assertThat(context.getRecursionStack()).containsExactly("A", "B");
        assertThat(context.isCycleDetected()).isTrue();

        context.exitSchema("B");
        context.exitSchema("A");
        assertThat(context.getRecursionStack()).isEmpty();
        assertThat(context.currentPath()).isEmpty();
    }

    @Test
    void testCycleLimit() {
        context.recordCycle("A -> A");
        context.recordCycle("B -> B");

        assertThatThrownBy(() -> context.recordCycle("C -> C"))
            .isInstanceOf(CycleLimitExceededException.class)
            .hasMessageContaining("limit is 2")
            .hasMessageContaining("C -> C");
        assertThat(context.getCycleCount()).isEqualTo(3);
    }

    @Test
    void testDepthTracking() {
        context.enterDepth();
        context.enterDepth();
        context.exitDepth();
        context.exitDepth();
        context.exitDepth();

        assertThat(context.getCurrentDepth()).isZero();
        assertThat(context.getMaxDepthReached()).isEqualTo(2);
    }

    @Test
    void testUniqueSchemaName() {
        IRSchema pet = new IRSchema("Pet", "object");
        context.registerSchema("Pet", pet);
        context.registerSchema("Pet1", new IRSchema("Pet1", "object"));

        assertThat(context.uniqueSchemaName("Pet", null)).isEqualTo("Pet2");
        assertThat(context.uniqueSchemaName("Pet", pet)).isEqualTo("Pet");
        assertThat(context.uniqueSchemaName("Owner", null)).isEqualTo("Owner");
    }

    @Test
    void testIsRegisteredComparesIdentity() {
        IRSchema pet = new IRSchema("Pet", "object");
        context.registerSchema("Pet", pet);

        assertThat(context.isRegistered(pet)).isTrue();
        assertThat(context.isRegistered(new IRSchema("Pet", "object"))).isFalse();
        assertThat(context.isRegistered(new IRSchema())).isFalse();
    }

    @Test
    void testWarningsAreDeduplicated() {
        context.addWarning(ParseWarning.Kind.CYCLE_DETECTED, "Circular reference detected: A -> A");
        context.addWarning(ParseWarning.Kind.CYCLE_DETECTED, "Circular reference detected: A -> A");
        context.addWarning(ParseWarning.Kind.VALIDATION, "Validation: broken");

        assertThat(context.getWarningMessages())
            .containsExactly("Circular reference detected: A -> A", "Validation: broken");
    }

    @Test
    void testDiscriminatorPropertyMarks() {
        context.markDiscriminatorProperty("Cat", "petType");

        assertThat(context.isDiscriminatorProperty("Cat", "petType")).isTrue();
        assertThat(context.isDiscriminatorProperty("Dog", "petType")).isFalse();
    }

    @Test
    void testReset() {
        context.registerSchema("Pet", new IRSchema("Pet"));
        context.enterSchema("Pet");
        context.enterDepth();
        context.addWarning(ParseWarning.Kind.VALIDATION, "x");

        context.reset();

        assertThat(context.getSchemas()).isEmpty();
        assertThat(context.getRecursionStack()).isEmpty();
        assertThat(context.getCurrentDepth()).isZero();
        assertThat(context.getWarnings()).isEmpty();
        assertThat(context.isCycleDetected()).isFalse();
    }
}
