package org.formlite.dsl;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Function call expression: funcName(arg1, arg2, ...)
 */
public record FunctionCall(
        String functionName,
        List<FormExpression> arguments) implements FormExpression {

    public FunctionCall {
        arguments = List.copyOf(arguments);
    }

    @Override
    public String toString() {
        return arguments.stream()
                .map(FormExpression::toString)
                .collect(Collectors.joining(", ", functionName + "(", ")"));
    }
}
