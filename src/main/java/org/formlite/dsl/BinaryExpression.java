package org.formlite.dsl;

import java.util.Objects;

/**
 * Binary arithmetic expression: left op right (e.g., x + 1, a ^ b)
 */
public record BinaryExpression(
        BinaryOperator operator,
        FormExpression left,
        FormExpression right) implements FormExpression {

    public BinaryExpression {
        Objects.requireNonNull(operator, "Operator cannot be null");
        Objects.requireNonNull(left, "Left operand cannot be null");
        Objects.requireNonNull(right, "Right operand cannot be null");
    }

    public static BinaryExpression add(FormExpression left, FormExpression right) {
        return new BinaryExpression(BinaryOperator.ADD, left, right);
    }

    public static BinaryExpression sub(FormExpression left, FormExpression right) {
        return new BinaryExpression(BinaryOperator.SUB, left, right);
    }

    public static BinaryExpression mul(FormExpression left, FormExpression right) {
        return new BinaryExpression(BinaryOperator.MUL, left, right);
    }

    public static BinaryExpression div(FormExpression left, FormExpression right) {
        return new BinaryExpression(BinaryOperator.DIV, left, right);
    }

    public static BinaryExpression pow(FormExpression left, FormExpression right) {
        return new BinaryExpression(BinaryOperator.POW, left, right);
    }

    @Override
    public String toString() {
        return "(" + left + " " + operator.symbol() + " " + right + ")";
    }
}
