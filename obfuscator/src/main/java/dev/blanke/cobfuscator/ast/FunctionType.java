package dev.blanke.cobfuscator.ast;

import java.util.List;
import java.util.Objects;

/**
 * A function type.
 *
 * @param returnType The declared return type.
 *
 * @param parameters The declared parameters, which is empty for both {@code f(void)} and {@code f()}.
 *
 * @param variadic Whether the parameter list ends with an ellipsis.
 *
 * @param prototype Whether the parameter list is a prototype. Only {@code false} for the old-style empty parameter
 *                  list {@code f()}, which is written as {@code f(void)} if it is a prototype.
 */
public record FunctionType(CType returnType, List<Parameter> parameters, boolean variadic, boolean prototype)
        implements CType {

    public FunctionType {
        Objects.requireNonNull(returnType);
        parameters = List.copyOf(parameters);
        if (!prototype && (variadic || !parameters.isEmpty()))
            throw new IllegalArgumentException("Only empty parameter lists may lack a prototype");
    }

    public FunctionType withParameters(final List<Parameter> parameters) {
        return new FunctionType(returnType, parameters, variadic, true);
    }
}
