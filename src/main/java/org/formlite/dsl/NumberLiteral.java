package org.formlite.dsl;

import java.math.BigDecimal;

/**
 * Double-precision numeric literal.
 *
 * Integral values print without a fraction (3, not 3.0); other finite values
 * print in plain decimal notation.
 */
public record NumberLiteral(double value) implements FormExpression {

    public static final NumberLiteral ZERO = new NumberLiteral(0.0);
    public static final NumberLiteral ONE = new NumberLiteral(1.0);

    public boolean isZero() {
        return value == 0.0;
    }

    public boolean isOne() {
        return value == 1.0;
    }

    @Override
    public String toString() {
        return format(value);
    }

    public static String format(double value) {
        if (Double.isNaN(value)) {
            return "NaN";
        }
        if (Double.isInfinite(value)) {
            return value > 0 ? "inf" : "-inf";
        }
        if (value % 1.0 == 0.0) {
            return Long.toString((long) value);
        }
        return new BigDecimal(Double.toString(value)).stripTrailingZeros().toPlainString();
    }
}
