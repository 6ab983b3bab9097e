package org.formlite.engine;

import org.eclipse.collections.api.list.ListIterable;
import org.eclipse.collections.api.map.MutableMap;
import org.formlite.dsl.BinaryExpression;
import org.formlite.dsl.FormExpression;
import org.formlite.dsl.FunctionCall;
import org.formlite.dsl.UnaryExpression;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Applies the ordered rule list to an expression.
 *
 * Rewriting works in two phases:
 * <ol>
 * <li>The whole expression is matched against the rules in declaration order;
 * the first match is substituted and the scan restarts from the first rule.
 * This repeats until no rule matches or {@link #MAX_ITERATIONS} is reached.</li>
 * <li>If the loop ended without a match, every child is rewritten bottom-up:
 * a node's children are rewritten first, then the first matching rule is
 * applied once to the rebuilt node.</li>
 * </ol>
 * The result is simplified once more before it is returned.
 */
public final class RewriteEngine {

    public static final int MAX_ITERATIONS = 100;

    private final ListIterable<RewriteRule> rules;
    private final ExpressionSimplifier simplifier;

    public RewriteEngine(ListIterable<RewriteRule> rules, ExpressionSimplifier simplifier) {
        this.rules = rules;
        this.simplifier = simplifier;
    }

    /**
     * Rewrites an expression until no top-level rule applies (or the iteration
     * cap is hit), rewrites its subterms, and simplifies the result.
     */
    public FormExpression rewrite(FormExpression expr) {
        FormExpression result = expr;

        for (int iteration = 0; iteration < MAX_ITERATIONS; iteration++) {
            Optional<FormExpression> rewritten = applyFirstMatch(result);
            if (rewritten.isPresent()) {
                result = rewritten.get();
                continue;
            }
            result = rewriteChildren(result);
            break;
        }

        return simplifier.simplify(result);
    }

    private FormExpression rewriteSubterm(FormExpression expr) {
        FormExpression rebuilt = rewriteChildren(expr);
        return applyFirstMatch(rebuilt).orElse(rebuilt);
    }

    private FormExpression rewriteChildren(FormExpression expr) {
        if (expr instanceof BinaryExpression binary) {
            return new BinaryExpression(binary.operator(),
                    rewriteSubterm(binary.left()),
                    rewriteSubterm(binary.right()));
        }
        if (expr instanceof UnaryExpression unary) {
            return new UnaryExpression(unary.operator(), rewriteSubterm(unary.operand()));
        }
        if (expr instanceof FunctionCall call) {
            List<FormExpression> arguments = new ArrayList<>(call.arguments().size());
            for (FormExpression argument : call.arguments()) {
                arguments.add(rewriteSubterm(argument));
            }
            return new FunctionCall(call.functionName(), arguments);
        }
        return expr;
    }

    private Optional<FormExpression> applyFirstMatch(FormExpression expr) {
        for (RewriteRule rule : rules) {
            Optional<MutableMap<String, FormExpression>> bindings = PatternMatcher.match(expr, rule.pattern());
            if (bindings.isPresent()) {
                return Optional.of(PatternMatcher.substitute(rule.replacement(), bindings.get()));
            }
        }
        return Optional.empty();
    }
}
