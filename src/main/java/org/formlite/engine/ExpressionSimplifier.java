package org.formlite.engine;

import org.eclipse.collections.api.factory.Sets;
import org.eclipse.collections.api.map.MapIterable;
import org.eclipse.collections.api.set.MutableSet;
import org.formlite.dsl.BinaryExpression;
import org.formlite.dsl.BinaryOperator;
import org.formlite.dsl.FormExpression;
import org.formlite.dsl.FunctionCall;
import org.formlite.dsl.NumberLiteral;
import org.formlite.dsl.SymbolRef;
import org.formlite.dsl.UnaryExpression;

import java.util.ArrayList;
import java.util.List;

/**
 * Simplifies expressions by constant folding and a fixed set of algebraic
 * identities.
 *
 * Symbols bound in the expression table are replaced by their (simplified)
 * stored value. Identities, tried in order when the operands are not both
 * numeric:
 * <pre>
 * x + 0 = x    0 + x = x
 * x * 0 = 0    0 * x = 0
 * x * 1 = x    1 * x = x
 * x ^ 0 = 1    x ^ 1 = x
 * </pre>
 * Built-in functions sin, cos, exp and log (natural) fold when called with a
 * single numeric argument.
 */
public final class ExpressionSimplifier {

    private final MapIterable<String, FormExpression> expressions;

    // Names whose stored value is being resolved, to report cyclic bindings
    private final MutableSet<String> resolving = Sets.mutable.empty();

    public ExpressionSimplifier(MapIterable<String, FormExpression> expressions) {
        this.expressions = expressions;
    }

    /**
     * Simplifies an expression.
     *
     * @throws DivisionByZeroException      on a literal division by 0
     * @throws RecursiveDefinitionException if a stored expression refers to itself
     */
    public FormExpression simplify(FormExpression expr) {
        if (expr instanceof NumberLiteral) {
            return expr;
        }
        if (expr instanceof SymbolRef symbol) {
            return resolveSymbol(symbol);
        }
        if (expr instanceof BinaryExpression binary) {
            return simplifyBinary(binary);
        }
        if (expr instanceof UnaryExpression unary) {
            FormExpression operand = simplify(unary.operand());
            if (operand instanceof NumberLiteral number) {
                return new NumberLiteral(-number.value());
            }
            return new UnaryExpression(unary.operator(), operand);
        }
        if (expr instanceof FunctionCall call) {
            return simplifyCall(call);
        }
        throw new IllegalStateException("Unknown expression type: " + expr.getClass().getSimpleName());
    }

    private FormExpression resolveSymbol(SymbolRef symbol) {
        FormExpression bound = expressions.get(symbol.name());
        if (bound == null) {
            return symbol;
        }
        if (!resolving.add(symbol.name())) {
            throw new RecursiveDefinitionException(symbol.name());
        }
        try {
            return simplify(bound);
        } finally {
            resolving.remove(symbol.name());
        }
    }

    private FormExpression simplifyBinary(BinaryExpression binary) {
        FormExpression left = simplify(binary.left());
        FormExpression right = simplify(binary.right());

        if (left instanceof NumberLiteral l && right instanceof NumberLiteral r) {
            return new NumberLiteral(fold(binary.operator(), l.value(), r.value()));
        }

        switch (binary.operator()) {
            case ADD -> {
                if (isZero(right)) {
                    return left;
                }
                if (isZero(left)) {
                    return right;
                }
            }
            case MUL -> {
                if (isZero(right) || isZero(left)) {
                    return NumberLiteral.ZERO;
                }
                if (isOne(right)) {
                    return left;
                }
                if (isOne(left)) {
                    return right;
                }
            }
            case POW -> {
                if (isZero(right)) {
                    return NumberLiteral.ONE;
                }
                if (isOne(right)) {
                    return left;
                }
            }
            default -> {
                // no identities for SUB and DIV
            }
        }

        return new BinaryExpression(binary.operator(), left, right);
    }

    private static double fold(BinaryOperator operator, double l, double r) {
        return switch (operator) {
            case ADD -> l + r;
            case SUB -> l - r;
            case MUL -> l * r;
            case DIV -> {
                if (r == 0.0) {
                    throw new DivisionByZeroException();
                }
                yield l / r;
            }
            case POW -> Math.pow(l, r);
        };
    }

    private FormExpression simplifyCall(FunctionCall call) {
        List<FormExpression> arguments = new ArrayList<>(call.arguments().size());
        for (FormExpression argument : call.arguments()) {
            arguments.add(simplify(argument));
        }

        if (arguments.size() == 1 && arguments.get(0) instanceof NumberLiteral number) {
            Double folded = applyBuiltin(call.functionName(), number.value());
            if (folded != null) {
                return new NumberLiteral(folded);
            }
        }

        return new FunctionCall(call.functionName(), arguments);
    }

    private static Double applyBuiltin(String name, double argument) {
        return switch (name) {
            case "sin" -> Math.sin(argument);
            case "cos" -> Math.cos(argument);
            case "exp" -> Math.exp(argument);
            case "log" -> Math.log(argument);
            default -> null;
        };
    }

    private static boolean isZero(FormExpression expr) {
        return expr instanceof NumberLiteral number && number.isZero();
    }

    private static boolean isOne(FormExpression expr) {
        return expr instanceof NumberLiteral number && number.isOne();
    }
}
