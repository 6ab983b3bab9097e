package org.formlite.dsl;

/**
 * Sealed interface representing expressions in the FORM language AST.
 *
 * Type hierarchy:
 * FormExpression
 * ├── NumberLiteral (3, 2.5)
 * ├── SymbolRef (x)
 * ├── BinaryExpression (x + 1, a ^ b)
 * ├── UnaryExpression (-x)
 * └── FunctionCall (sin(x), f(a, b))
 *
 * Expressions are immutable trees; every node owns its children and no node
 * is shared between two parents. {@link Object#toString()} renders the
 * display form used in all output.
 */
public sealed interface FormExpression
        permits NumberLiteral, SymbolRef, BinaryExpression, UnaryExpression, FunctionCall {
}
