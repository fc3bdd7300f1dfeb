package org.dynamis.exprtree.expressions;

import org.dynamis.exprtree.syntax.NodeRenderer;
import org.dynamis.exprtree.types.OperatorMethod;

/**
 * A binary operation. The concrete shape is chosen by {@link NodeFactory} and is not part of the
 * contract: callers see only the kind, the operands, the result type, the operator method and the
 * coalesce conversion.
 */
public abstract sealed class BinaryNode implements Node
        permits SimpleBinaryNode, LogicalBinaryNode, AssignBinaryNode, CoalesceConversionBinaryNode {

    private final Node left;
    private final Node right;

    BinaryNode(Node left, Node right) {
        this.left = left;
        this.right = right;
    }

    public abstract BinaryOperatorKind getKind();

    public Node getLeft() {
        return left;
    }

    public Node getRight() {
        return right;
    }

    /** The user-defined operator backing this node, or {@code null} for a built-in operation. */
    public OperatorMethod getMethod() {
        return null;
    }

    /** The explicit null-to-value conversion of a coalesce, or {@code null}. */
    public LambdaNode getConversion() {
        return null;
    }

    /** Only compound assignments reduce. */
    public boolean canReduce() {
        return getKind().isCompoundAssignment();
    }

    @Override
    public final NodeType getNodeType() {
        return NodeType.BINARY;
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitBinary(this);
    }

    @Override
    public String toString() {
        return NodeRenderer.render(this);
    }

    static BinaryNode create(BinaryOperatorKind kind, Node left, Node right, Class<?> type,
                             OperatorMethod method, LambdaNode conversion) {
        if (kind == BinaryOperatorKind.ASSIGN) {
            return new AssignBinaryNode(left, right);
        }
        if (conversion != null) {
            return new CoalesceConversionBinaryNode(left, right, conversion);
        }
        if (method != null) {
            return new MethodBinaryNode(kind, left, right, type, method);
        }
        if (type == boolean.class && isLogical(kind)) {
            return new LogicalBinaryNode(kind, left, right);
        }
        return new SimpleBinaryNode(kind, left, right, type);
    }

    private static boolean isLogical(BinaryOperatorKind kind) {
        return switch (kind.getCategory()) {
            case CONDITIONAL, COMPARISON, EQUALITY -> true;
            default -> false;
        };
    }
}
