package io.surfworks.convmarkup.block;

import io.surfworks.convmarkup.block.ElaborationException.ErrorKind;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.LinkedHashMap;
import java.util.Map;

import static io.surfworks.convmarkup.block.AttributeSpec.optionalInt;
import static io.surfworks.convmarkup.block.AttributeSpec.optionalReal;
import static io.surfworks.convmarkup.block.AttributeSpec.requiredInt;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class AttributeSchemaTest {

    private final AttributeSchema schema = AttributeSchema.of(
            requiredInt("w", 1),
            optionalInt("s", 1, 1),
            optionalInt("k", 0),
            optionalReal("scale", 2.5));

    private ElaborationException invalid(Map<String, Double> attrs) {
        return assertThrows(ElaborationException.class, () -> schema.validate("Test", attrs));
    }

    @Test
    void appliesDeclaredDefaults() {
        AttributeSchema.Values values = schema.validate("Test", Map.of("w", 4.0));
        assertEquals(4, values.getInt("w"));
        assertEquals(1, values.getInt("s"));
        assertEquals(2.5, values.getReal("scale"));
        assertFalse(values.has("s"));
    }

    @Test
    void fallbackOnlyAppliesWithoutDefault() {
        AttributeSchema.Values values = schema.validate("Test", Map.of("w", 4.0));
        assertEquals(9, values.getInt("k", 9));
        assertEquals(1, values.getInt("s", 9));
        assertEquals(3, schema.validate("Test", Map.of("w", 4.0, "k", 3.0)).getInt("k", 9));
    }

    @Test
    void realAttributesMayBeFractionalAndNegative() {
        AttributeSchema.Values values = schema.validate("Test", Map.of("w", 1.0, "scale", -0.125));
        assertEquals(-0.125, values.getReal("scale"));
        assertTrue(values.has("scale"));
    }

    @Test
    void checksRunInFixedOrder() {
        Map<String, Double> attrs = new LinkedHashMap<>();
        attrs.put("s", 0.5);
        attrs.put("zz", 1.0);
        assertEquals(ErrorKind.UNKNOWN_ATTRIBUTE, invalid(attrs).getKind());

        attrs.remove("zz");
        assertEquals(ErrorKind.MISSING_ATTRIBUTE, invalid(attrs).getKind());

        attrs.put("w", 0.0);
        ElaborationException e = invalid(attrs);
        assertEquals(ErrorKind.NON_INTEGER_ATTRIBUTE, e.getKind());
        assertEquals("s", e.getAttribute().orElseThrow());
    }

    @ParameterizedTest
    @ValueSource(doubles = {1.5, 0.001, -2.5, 3e10})
    void rejectsValuesThatAreNotIntegers(double value) {
        ElaborationException e = invalid(Map.of("w", value));
        assertEquals(ErrorKind.NON_INTEGER_ATTRIBUTE, e.getKind());
        assertEquals("w", e.getAttribute().orElseThrow());
    }

    @Test
    void reportsMinimumInMessage() {
        ElaborationException e = invalid(Map.of("w", -3.0));
        assertEquals(ErrorKind.ATTRIBUTE_BELOW_MINIMUM, e.getKind());
        assertEquals("Test: attribute w must be at least 1", e.getMessage());
    }

    @Test
    void emptySchemaRejectsEverything() {
        assertThrows(ElaborationException.class, () -> AttributeSchema.none().validate("ReLU", Map.of("a", 1.0)));
        AttributeSchema.none().validate("ReLU", Map.of());
    }

    @Test
    void duplicateSpecsAreRejected() {
        assertThrows(IllegalArgumentException.class,
                () -> AttributeSchema.of(requiredInt("w", 1), optionalInt("w", 0, 0)));
    }
}
