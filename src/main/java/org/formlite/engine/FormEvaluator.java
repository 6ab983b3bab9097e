package org.formlite.engine;

import org.eclipse.collections.api.factory.Lists;
import org.eclipse.collections.api.factory.Maps;
import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.api.map.ImmutableMap;
import org.eclipse.collections.api.map.MutableMap;
import org.formlite.dsl.FormExpression;
import org.formlite.dsl.FormStatement;
import org.formlite.dsl.SymbolRef;

/**
 * Executes FORM statements against the session tables.
 *
 * The evaluator owns three tables:
 * - symbols: declared symbol names
 * - expressions: named expressions, stored in simplified form
 * - rules: rewrite rules in declaration order
 *
 * A table is only changed once the statement has been evaluated
 * successfully. A statement that throws leaves every table as it was.
 */
public final class FormEvaluator {

    private final MutableMap<String, SymbolRef> symbols = Maps.mutable.empty();
    private final MutableMap<String, FormExpression> expressions = Maps.mutable.empty();
    private final MutableList<RewriteRule> rules = Lists.mutable.empty();

    /**
     * Evaluates a statement and returns the text to display.
     *
     * @throws FormEvalException if the statement fails
     */
    public String evaluate(FormStatement statement) {
        if (statement instanceof FormStatement.SymbolsDecl decl) {
            for (String name : decl.names()) {
                symbols.put(name, new SymbolRef(name));
            }
            return "Symbols declared";
        }
        if (statement instanceof FormStatement.ExpressionDecl decl) {
            return store(decl.name(), decl.expression());
        }
        // Local is stored exactly like Expression
        if (statement instanceof FormStatement.LocalDecl decl) {
            return store(decl.name(), decl.expression());
        }
        if (statement instanceof FormStatement.IdRule rule) {
            RewriteRule added = new RewriteRule(rule.pattern(), rule.replacement());
            rules.add(added);
            return "Rule added: " + added;
        }
        if (statement instanceof FormStatement.Print print) {
            FormExpression value = expressions.get(print.name());
            if (value == null) {
                throw new UndefinedPrintTargetException(print.name());
            }
            return print.name() + " = " + value;
        }
        if (statement instanceof FormStatement.Sort) {
            sort();
            return "Sorted and rules applied";
        }
        if (statement instanceof FormStatement.EvalExpr eval) {
            return simplify(eval.expression()).toString();
        }
        throw new IllegalStateException("Unknown statement type: " + statement.getClass().getSimpleName());
    }

    /**
     * Simplifies an expression against the current expression table.
     */
    public FormExpression simplify(FormExpression expr) {
        return new ExpressionSimplifier(expressions).simplify(expr);
    }

    /**
     * Empties all three tables.
     */
    public void clear() {
        symbols.clear();
        expressions.clear();
        rules.clear();
    }

    private String store(String name, FormExpression expr) {
        FormExpression simplified = simplify(expr);
        expressions.put(name, simplified);
        return name + " = " + simplified;
    }

    /**
     * Rewrites every stored expression. All results are computed against the
     * table as it was before the sort, then swapped in together.
     */
    private void sort() {
        RewriteEngine engine = new RewriteEngine(rules, new ExpressionSimplifier(expressions));
        MutableMap<String, FormExpression> rewritten = Maps.mutable.empty();
        expressions.forEachKeyValue((name, expr) -> rewritten.put(name, engine.rewrite(expr)));

        expressions.clear();
        expressions.putAll(rewritten);
    }

    // ==================== Table snapshots ====================

    public ImmutableMap<String, SymbolRef> symbols() {
        return symbols.toImmutable();
    }

    public ImmutableMap<String, FormExpression> expressions() {
        return expressions.toImmutable();
    }

    public ImmutableList<RewriteRule> rules() {
        return rules.toImmutable();
    }
}
