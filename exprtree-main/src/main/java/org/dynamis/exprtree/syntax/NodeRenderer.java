package org.dynamis.exprtree.syntax;

import com.github.javaparser.ast.NodeList;
import com.github.javaparser.ast.body.Parameter;
import com.github.javaparser.ast.expr.ArrayAccessExpr;
import com.github.javaparser.ast.expr.AssignExpr;
import com.github.javaparser.ast.expr.BinaryExpr;
import com.github.javaparser.ast.expr.BooleanLiteralExpr;
import com.github.javaparser.ast.expr.CharLiteralExpr;
import com.github.javaparser.ast.expr.ConditionalExpr;
import com.github.javaparser.ast.expr.DoubleLiteralExpr;
import com.github.javaparser.ast.expr.EnclosedExpr;
import com.github.javaparser.ast.expr.Expression;
import com.github.javaparser.ast.expr.FieldAccessExpr;
import com.github.javaparser.ast.expr.IntegerLiteralExpr;
import com.github.javaparser.ast.expr.LambdaExpr;
import com.github.javaparser.ast.expr.LongLiteralExpr;
import com.github.javaparser.ast.expr.MethodCallExpr;
import com.github.javaparser.ast.expr.NameExpr;
import com.github.javaparser.ast.expr.NullLiteralExpr;
import com.github.javaparser.ast.expr.StringLiteralExpr;
import com.github.javaparser.ast.expr.VariableDeclarationExpr;
import com.github.javaparser.ast.stmt.BlockStmt;
import com.github.javaparser.ast.stmt.ExpressionStmt;
import com.github.javaparser.ast.stmt.ReturnStmt;
import com.github.javaparser.ast.stmt.Statement;
import com.github.javaparser.ast.type.ArrayType;
import com.github.javaparser.ast.type.ClassOrInterfaceType;
import com.github.javaparser.ast.type.PrimitiveType;
import com.github.javaparser.ast.type.Type;
import com.github.javaparser.ast.type.VoidType;
import org.dynamis.exprtree.expressions.BinaryNode;
import org.dynamis.exprtree.expressions.BinaryOperatorKind;
import org.dynamis.exprtree.expressions.BlockNode;
import org.dynamis.exprtree.expressions.CallNode;
import org.dynamis.exprtree.expressions.ConstantNode;
import org.dynamis.exprtree.expressions.IndexNode;
import org.dynamis.exprtree.expressions.LambdaNode;
import org.dynamis.exprtree.expressions.MemberNode;
import org.dynamis.exprtree.expressions.Node;
import org.dynamis.exprtree.expressions.NodeVisitor;
import org.dynamis.exprtree.expressions.VariableNode;
import org.dynamis.exprtree.types.OperatorMethod;

import java.util.List;
import java.util.Locale;

/**
 * Renders a node tree as a JavaParser AST, for {@code toString()} and diagnostics. The output reads
 * as Java but is not meant to compile: user-defined operators print as static calls, overflow-checked
 * arithmetic as {@code Math.*Exact}, coalesce as a conditional and indexers as array access.
 * A block prints as a statement block, or as a lambda when nested inside an expression.
 */
public final class NodeRenderer implements NodeVisitor<Expression> {

    private static final NodeRenderer INSTANCE = new NodeRenderer();

    private NodeRenderer() {}

    public static String render(Node node) {
        if (node instanceof BlockNode block) {
            return INSTANCE.toBlockStmt(block, false).toString();
        }
        return toExpression(node).toString();
    }

    public static Expression toExpression(Node node) {
        return node.accept(INSTANCE);
    }

    @Override
    public Expression visitBinary(BinaryNode node) {
        BinaryOperatorKind kind = node.getKind();
        OperatorMethod method = node.getMethod();
        if (kind == BinaryOperatorKind.ASSIGN) {
            return new AssignExpr(toExpression(node.getLeft()), toExpression(node.getRight()), AssignExpr.Operator.ASSIGN);
        }
        if (kind.isCompoundAssignment()) {
            Expression target = toExpression(node.getLeft());
            AssignExpr.Operator operator = JavaOperators.toAssignOperator(kind);
            if (operator != null) {
                return new AssignExpr(target, toExpression(node.getRight()), operator);
            }
            // **= has no Java operator
            return new AssignExpr(target, call(method, node.getLeft(), node.getRight()), AssignExpr.Operator.ASSIGN);
        }

        Expression left = operand(node.getLeft());
        switch (kind) {
            case COALESCE -> {
                Expression value = node.getConversion() == null
                                   ? left
                                   : new MethodCallExpr(new EnclosedExpr(visitLambda(node.getConversion())), "apply",
                                                        NodeList.nodeList(toExpression(node.getLeft())));
                return new ConditionalExpr(new BinaryExpr(left, new NullLiteralExpr(), BinaryExpr.Operator.NOT_EQUALS),
                                           value, operand(node.getRight()));
            }
            case ELEMENT_ACCESS -> {
                return new ArrayAccessExpr(left, toExpression(node.getRight()));
            }
            default -> {
                if (method != null) {
                    return call(method, node.getLeft(), node.getRight());
                }
                if (kind.isChecked()) {
                    return new MethodCallExpr(new NameExpr("Math"), exactMethodName(kind),
                                              NodeList.nodeList(toExpression(node.getLeft()), toExpression(node.getRight())));
                }
                return new BinaryExpr(left, operand(node.getRight()), JavaOperators.toBinaryOperator(kind));
            }
        }
    }

    private static String exactMethodName(BinaryOperatorKind kind) {
        return switch (kind) {
            case ADD_CHECKED -> "addExact";
            case SUBTRACT_CHECKED -> "subtractExact";
            case MULTIPLY_CHECKED -> "multiplyExact";
            default -> throw new IllegalStateException(kind + " has no exact arithmetic method");
        };
    }

    private static Expression call(OperatorMethod method, Node left, Node right) {
        return new MethodCallExpr(new NameExpr(simpleName(method.getDeclaringType())), method.getName(),
                                  NodeList.nodeList(toExpression(left), toExpression(right)));
    }

    @Override
    public Expression visitConstant(ConstantNode node) {
        Object value = node.getValue();
        if (value == null) {
            return new NullLiteralExpr();
        }
        if (value instanceof Integer || value instanceof Short || value instanceof Byte) {
            return new IntegerLiteralExpr(value.toString());
        }
        if (value instanceof Long) {
            return new LongLiteralExpr(value + "L");
        }
        if (value instanceof Double) {
            return new DoubleLiteralExpr(value.toString());
        }
        if (value instanceof Float) {
            return new DoubleLiteralExpr(value + "f");
        }
        if (value instanceof Boolean b) {
            return new BooleanLiteralExpr(b);
        }
        if (value instanceof Character c) {
            return new CharLiteralExpr(c);
        }
        if (value instanceof String s) {
            return new StringLiteralExpr().setString(s);
        }
        if (value instanceof Enum<?> e) {
            return new FieldAccessExpr(new NameExpr(simpleName(e.getDeclaringClass())), e.name());
        }
        return new MethodCallExpr(null, "constant", NodeList.nodeList(new StringLiteralExpr().setString(value.toString())));
    }

    @Override
    public Expression visitVariable(VariableNode node) {
        return new NameExpr(node.getName());
    }

    @Override
    public Expression visitMember(MemberNode node) {
        Expression scope = node.getReceiver() == null
                           ? new NameExpr(simpleName(node.getMember().getDeclaringType()))
                           : operand(node.getReceiver());
        return new FieldAccessExpr(scope, node.getMember().getName());
    }

    @Override
    public Expression visitIndex(IndexNode node) {
        Expression expression = operand(node.getObject());
        for (Node argument : node.getArguments()) {
            expression = new ArrayAccessExpr(expression, toExpression(argument));
        }
        return expression;
    }

    @Override
    public Expression visitCall(CallNode node) {
        Expression scope = node.getTarget() == null
                           ? new NameExpr(simpleName(node.getMethod().getDeclaringClass()))
                           : operand(node.getTarget());
        NodeList<Expression> arguments = new NodeList<>();
        node.getArguments().forEach(argument -> arguments.add(toExpression(argument)));
        return new MethodCallExpr(scope, node.getMethod().getName(), arguments);
    }

    @Override
    public Expression visitBlock(BlockNode node) {
        return new LambdaExpr(new NodeList<>(), toBlockStmt(node, true));
    }

    @Override
    public Expression visitLambda(LambdaNode node) {
        NodeList<Parameter> parameters = new NodeList<>();
        node.getParameters().forEach(p -> parameters.add(new Parameter(typeOf(p.getType()), p.getName())));
        LambdaExpr lambda = node.getBody() instanceof BlockNode block
                            ? new LambdaExpr(parameters, toBlockStmt(block, node.getReturnType() != void.class))
                            : new LambdaExpr(parameters, toExpression(node.getBody()));
        return lambda.setEnclosingParameters(true);
    }

    private BlockStmt toBlockStmt(BlockNode block, boolean returnsValue) {
        NodeList<Statement> statements = new NodeList<>();
        for (VariableNode variable : block.getVariables()) {
            statements.add(new ExpressionStmt(new VariableDeclarationExpr(typeOf(variable.getType()), variable.getName())));
        }
        List<Node> expressions = block.getExpressions();
        for (int i = 0; i < expressions.size(); i++) {
            Expression expression = toExpression(expressions.get(i));
            boolean last = i == expressions.size() - 1;
            statements.add(last && returnsValue ? new ReturnStmt(expression) : new ExpressionStmt(expression));
        }
        return new BlockStmt(statements);
    }

    private static Expression operand(Node node) {
        Expression expression = toExpression(node);
        if (expression.isBinaryExpr() || expression.isAssignExpr() || expression.isConditionalExpr()
            || expression.isLambdaExpr()) {
            return new EnclosedExpr(expression);
        }
        return expression;
    }

    static Type typeOf(Class<?> type) {
        if (type.isArray()) {
            return new ArrayType(typeOf(type.getComponentType()));
        }
        if (type == void.class) {
            return new VoidType();
        }
        if (type.isPrimitive()) {
            return new PrimitiveType(PrimitiveType.Primitive.valueOf(type.getName().toUpperCase(Locale.ROOT)));
        }
        return new ClassOrInterfaceType(null, simpleName(type));
    }

    private static String simpleName(Class<?> type) {
        String simpleName = type.getSimpleName();
        return simpleName.isEmpty() ? type.getName() : simpleName;
    }
}
