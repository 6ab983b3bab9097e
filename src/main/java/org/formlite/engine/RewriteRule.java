package org.formlite.engine;

import org.formlite.dsl.FormExpression;

import java.util.Objects;

/**
 * A rewrite rule declared with {@code id pattern = replacement}.
 *
 * @param pattern     Expression matched structurally against stored terms
 * @param replacement Template substituted for a matching term
 */
public record RewriteRule(FormExpression pattern, FormExpression replacement) {
    public RewriteRule {
        Objects.requireNonNull(pattern, "Pattern cannot be null");
        Objects.requireNonNull(replacement, "Replacement cannot be null");
    }

    @Override
    public String toString() {
        return pattern + " -> " + replacement;
    }
}
