package org.dynamis.exprtree.resolve;

import org.dynamis.exprtree.expressions.BinaryOperatorKind;
import org.dynamis.exprtree.types.OperatorMethod;

import java.util.Objects;

/**
 * Outcome of operator resolution: the result type and, for a user-defined operator, its method.
 */
public record ResolvedOperator(BinaryOperatorKind kind, Class<?> resultType, OperatorMethod method) {

    public ResolvedOperator {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(resultType, "resultType");
    }

    static ResolvedOperator builtIn(BinaryOperatorKind kind, Class<?> resultType) {
        return new ResolvedOperator(kind, resultType, null);
    }

    public boolean isBuiltIn() {
        return method == null;
    }
}
