package io.jobgtm.store;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

class FieldRulesTest {

    @Test
    void placeholdersBecomeNull() {
        for (String v : new String[]{"N/A", "na", "NULL", "None", "unknown", "  ", "", null}) {
            assertNull(FieldRules.nullable(v, 100), "value: " + v);
        }
    }

    @Test
    void requiredFieldsFallBackToNotAvailable() {
        assertEquals("N/A", FieldRules.required(null, 255));
        assertEquals("N/A", FieldRules.required("unknown", 255));
        assertEquals("Acme", FieldRules.required("  Acme ", 255));
    }

    @Test
    void textIsTruncatedToColumnLength() {
        assertEquals("abc", FieldRules.nullable("abcdef", 3));
        assertEquals("abcdef", FieldRules.nullable("abcdef", 0));
    }

    @Test
    void decimalsOutsideColumnRangeAreDropped() {
        assertEquals(99_999_999.0, FieldRules.decimal(99_999_999.0, 10, 2));
        assertNull(FieldRules.decimal(100_000_000.0, 10, 2));
        assertNull(FieldRules.decimal(Double.NaN, 10, 2));
    }

    @Test
    void clampBoundsConfidence() {
        assertEquals(1.0, FieldRules.clamp(1.7, 0.0, 1.0));
        assertEquals(0.0, FieldRules.clamp(-0.2, 0.0, 1.0));
        assertNull(FieldRules.clamp(null, 0.0, 1.0));
    }
}
