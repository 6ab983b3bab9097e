package org.formlite.dsl;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Number display format")
class NumberLiteralTest {

    @Test
    @DisplayName("Integral values print without fraction")
    void testIntegral() {
        assertEquals("3", NumberLiteral.format(3.0));
        assertEquals("-12", NumberLiteral.format(-12.0));
        assertEquals("0", NumberLiteral.format(-0.0));
        assertEquals("512", new NumberLiteral(512).toString());
    }

    @Test
    @DisplayName("Fractional values print in plain decimal notation")
    void testFractional() {
        assertEquals("2.5", NumberLiteral.format(2.5));
        assertEquals("-0.25", NumberLiteral.format(-0.25));
        assertEquals("0.30000000000000004", NumberLiteral.format(0.1 + 0.2));
        assertEquals("0.0000001", NumberLiteral.format(1e-7));
    }

    @Test
    @DisplayName("NaN and infinities")
    void testSpecialValues() {
        assertEquals("NaN", NumberLiteral.format(Double.NaN));
        assertEquals("inf", NumberLiteral.format(Double.POSITIVE_INFINITY));
        assertEquals("-inf", NumberLiteral.format(Double.NEGATIVE_INFINITY));
    }

    @Test
    @DisplayName("Integral values beyond the long range saturate")
    void testSaturation() {
        assertEquals(Long.toString(Long.MAX_VALUE), NumberLiteral.format(1e20));
    }
}
