package br.edu.ifba.graphmemory.schema;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class EntityTypeRegistryTest {

    private final EntityTypeRegistry registry = EntityTypeRegistry.defaults();

    @Nested
    @DisplayName("type labels")
    class TypeLabels {

        @Test
        @DisplayName("declared types match case-insensitively and keep their declared spelling")
        void testCanonicalType() {
            assertEquals("Person", registry.canonicalType("person"));
            assertEquals("Organization", registry.canonicalType(" ORGANIZATION "));
        }

        @Test
        @DisplayName("blank types fall back to Entity")
        void testBlankType() {
            assertEquals(EntityTypeRegistry.DEFAULT_TYPE, registry.canonicalType(null));
            assertEquals(EntityTypeRegistry.DEFAULT_TYPE, registry.canonicalType("  "));
        }

        @Test
        void testUndeclaredTypeKept() {
            assertEquals("Spaceship", registry.canonicalType("Spaceship"));
        }
    }

    @Nested
    @DisplayName("attribute validation")
    class Validation {

        @Test
        @DisplayName("a numeric string is coerced for an INTEGER attribute")
        void testIntegerCoercion() {
            AttributeValidation result = registry.validate("Person", "Alice", Map.of("age", "34"));

            assertEquals(34L, result.values().get("age"));
            assertTrue(result.warnings().isEmpty());
        }

        @Test
        @DisplayName("undeclared attributes are dropped with a warning")
        void testUndeclaredAttributeDropped() {
            AttributeValidation result = registry.validate("Person", "Alice", Map.of("shoe_size", 38));

            assertTrue(result.values().isEmpty());
            assertEquals(1, result.warnings().size());
            assertTrue(result.warnings().get(0).contains("shoe_size"));
        }

        @Test
        @DisplayName("ill-typed values are dropped with a warning")
        void testIllTypedValueDropped() {
            AttributeValidation result = registry.validate("Person", "Alice", Map.of("age", "thirty"));

            assertTrue(result.values().isEmpty());
            assertTrue(result.warnings().get(0).contains("not a valid INTEGER"));
        }

        @Test
        @DisplayName("attributes of an undeclared type are all dropped")
        void testUndeclaredType() {
            Map<String, Object> raw = new HashMap<>();
            raw.put("speed", 3);
            raw.put("crew", 12);
            AttributeValidation result = registry.validate("Spaceship", "Enterprise", raw);

            assertEquals("Spaceship", result.type());
            assertTrue(result.values().isEmpty());
            assertEquals(1, result.warnings().size());
        }

        @Test
        @DisplayName("caller types extend the defaults and win on clashes")
        void testDefaultsWith() {
            EntityTypeRegistry custom = EntityTypeRegistry.defaultsWith(List.of(
                EntityTypeDefinition.builder("Person").attribute("badge", AttributeType.INTEGER).build()));

            AttributeValidation result = custom.validate("Person", "Alice", Map.of("badge", 7, "age", 30));

            assertEquals(7L, result.values().get("badge"));
            assertNull(result.values().get("age"));
        }
    }

    @ParameterizedTest(name = "{0} as {1} -> {2}")
    @CsvSource({
        "120,     INTEGER, 120",
        "1.5,     NUMBER,  1.5",
        "yes,     BOOLEAN, true",
        "'a, b',  STRING_LIST, '[a, b]'",
        "2024-01-01T00:00:00Z, DATE_TIME, 2024-01-01T00:00:00Z"
    })
    @DisplayName("string values are coerced where safe")
    void testCoercion(String raw, AttributeType type, String expected) {
        assertEquals(expected, String.valueOf(type.coerce(raw)));
    }

    @ParameterizedTest
    @CsvSource({
        "1.5,       INTEGER",
        "maybe,     BOOLEAN",
        "yesterday, DATE_TIME",
        "'  ',      STRING"
    })
    @DisplayName("values that do not fit coerce to null")
    void testRejectedCoercion(String raw, AttributeType type) {
        assertNull(type.coerce(raw));
    }
}
