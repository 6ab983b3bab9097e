package org.formlite.engine;

import org.eclipse.collections.api.factory.Maps;
import org.eclipse.collections.api.map.MapIterable;
import org.eclipse.collections.api.map.MutableMap;
import org.formlite.dsl.BinaryExpression;
import org.formlite.dsl.FormExpression;
import org.formlite.dsl.FunctionCall;
import org.formlite.dsl.NumberLiteral;
import org.formlite.dsl.SymbolRef;
import org.formlite.dsl.UnaryExpression;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Structural matching of expressions against rule patterns.
 *
 * A pattern symbol only matches a symbol with the same name; it is not a
 * variable and binds nothing, so the binding map of a successful match is
 * normally empty. Numbers match within {@link #TOLERANCE}. Binary nodes match
 * when the operators agree and both children match. Unary nodes and function
 * calls never match.
 */
public final class PatternMatcher {

    public static final double TOLERANCE = 1e-10;

    private PatternMatcher() {
        // Static utility class
    }

    /**
     * Matches a candidate expression against a pattern.
     *
     * @return the bindings of the match, or empty if the candidate does not match
     */
    public static Optional<MutableMap<String, FormExpression>> match(FormExpression candidate,
                                                                      FormExpression pattern) {
        if (candidate instanceof SymbolRef symbol && pattern instanceof SymbolRef patternSymbol) {
            return symbol.name().equals(patternSymbol.name())
                    ? Optional.of(Maps.mutable.empty())
                    : Optional.empty();
        }

        if (candidate instanceof NumberLiteral number && pattern instanceof NumberLiteral patternNumber) {
            return Math.abs(number.value() - patternNumber.value()) < TOLERANCE
                    ? Optional.of(Maps.mutable.empty())
                    : Optional.empty();
        }

        if (candidate instanceof BinaryExpression binary && pattern instanceof BinaryExpression patternBinary) {
            if (binary.operator() != patternBinary.operator()) {
                return Optional.empty();
            }
            Optional<MutableMap<String, FormExpression>> left = match(binary.left(), patternBinary.left());
            if (left.isEmpty()) {
                return Optional.empty();
            }
            Optional<MutableMap<String, FormExpression>> right = match(binary.right(), patternBinary.right());
            if (right.isEmpty()) {
                return Optional.empty();
            }
            return merge(left.get(), right.get());
        }

        return Optional.empty();
    }

    private static Optional<MutableMap<String, FormExpression>> merge(MutableMap<String, FormExpression> bindings,
                                                                      MutableMap<String, FormExpression> other) {
        for (String name : other.keysView()) {
            FormExpression value = other.get(name);
            FormExpression existing = bindings.get(name);
            if (existing != null && !existing.equals(value)) {
                return Optional.empty();
            }
            bindings.put(name, value);
        }
        return Optional.of(bindings);
    }

    /**
     * Replaces every symbol bound in {@code bindings} inside a replacement template.
     */
    public static FormExpression substitute(FormExpression template, MapIterable<String, FormExpression> bindings) {
        if (template instanceof SymbolRef symbol) {
            FormExpression bound = bindings.get(symbol.name());
            return bound != null ? bound : template;
        }
        if (template instanceof BinaryExpression binary) {
            return new BinaryExpression(binary.operator(),
                    substitute(binary.left(), bindings),
                    substitute(binary.right(), bindings));
        }
        if (template instanceof UnaryExpression unary) {
            return new UnaryExpression(unary.operator(), substitute(unary.operand(), bindings));
        }
        if (template instanceof FunctionCall call) {
            List<FormExpression> arguments = new ArrayList<>(call.arguments().size());
            for (FormExpression argument : call.arguments()) {
                arguments.add(substitute(argument, bindings));
            }
            return new FunctionCall(call.functionName(), arguments);
        }
        return template;
    }
}
