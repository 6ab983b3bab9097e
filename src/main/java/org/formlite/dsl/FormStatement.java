package org.formlite.dsl;

import java.util.List;
import java.util.Objects;

/**
 * A single parsed FORM statement.
 *
 * Each statement renders back to its source form through {@link #toString()}.
 */
public sealed interface FormStatement {

    /**
     * Symbols x, y, z
     */
    record SymbolsDecl(List<String> names) implements FormStatement {
        public SymbolsDecl {
            names = List.copyOf(names);
        }

        @Override
        public String toString() {
            return "Symbols " + String.join(", ", names);
        }
    }

    /**
     * Expression e = (x + 1) * (x - 1)
     */
    record ExpressionDecl(String name, FormExpression expression) implements FormStatement {
        public ExpressionDecl {
            Objects.requireNonNull(name, "Name cannot be null");
            Objects.requireNonNull(expression, "Expression cannot be null");
        }

        @Override
        public String toString() {
            return "Expression " + name + " = " + expression;
        }
    }

    /**
     * Local a = x + 1. Behaves exactly like {@link ExpressionDecl}.
     */
    record LocalDecl(String name, FormExpression expression) implements FormStatement {
        public LocalDecl {
            Objects.requireNonNull(name, "Name cannot be null");
            Objects.requireNonNull(expression, "Expression cannot be null");
        }

        @Override
        public String toString() {
            return "Local " + name + " = " + expression;
        }
    }

    /**
     * id pattern = replacement
     */
    record IdRule(FormExpression pattern, FormExpression replacement) implements FormStatement {
        public IdRule {
            Objects.requireNonNull(pattern, "Pattern cannot be null");
            Objects.requireNonNull(replacement, "Replacement cannot be null");
        }

        @Override
        public String toString() {
            return "id " + pattern + " = " + replacement;
        }
    }

    /**
     * Print e
     */
    record Print(String name) implements FormStatement {
        public Print {
            Objects.requireNonNull(name, "Name cannot be null");
        }

        @Override
        public String toString() {
            return "Print " + name;
        }
    }

    /**
     * .sort
     */
    record Sort() implements FormStatement {
        @Override
        public String toString() {
            return ".sort";
        }
    }

    /**
     * A bare expression to simplify and display.
     */
    record EvalExpr(FormExpression expression) implements FormStatement {
        public EvalExpr {
            Objects.requireNonNull(expression, "Expression cannot be null");
        }

        @Override
        public String toString() {
            return expression.toString();
        }
    }
}
