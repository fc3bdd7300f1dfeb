package org.dynamis.exprtree;

import org.dynamis.exprtree.expressions.BinaryOperatorKind;

/**
 * Raised when a node cannot be built from the supplied operands. Carries the operator kind
 * being constructed, or {@code null} when the failure is not tied to an operator.
 */
public class NodeConstructionException extends ExpressionTreeException {

    private final BinaryOperatorKind kind;

    public NodeConstructionException(String message, BinaryOperatorKind kind) {
        super(message);
        this.kind = kind;
    }

    public NodeConstructionException(String message, BinaryOperatorKind kind, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public BinaryOperatorKind getKind() {
        return kind;
    }
}
