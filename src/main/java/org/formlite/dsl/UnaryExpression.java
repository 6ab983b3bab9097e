package org.formlite.dsl;

import java.util.Objects;

/**
 * Unary expression: op expr (e.g., -x)
 */
public record UnaryExpression(
        Operator operator,
        FormExpression operand) implements FormExpression {

    public enum Operator {
        NEG
    }

    public UnaryExpression {
        Objects.requireNonNull(operator, "Operator cannot be null");
        Objects.requireNonNull(operand, "Operand cannot be null");
    }

    public static UnaryExpression negate(FormExpression operand) {
        return new UnaryExpression(Operator.NEG, operand);
    }

    @Override
    public String toString() {
        return "(-" + operand + ")";
    }
}
