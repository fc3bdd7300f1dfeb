package org.dynamis.exprtree.test;

import org.dynamis.exprtree.expressions.BinaryNode;
import org.dynamis.exprtree.expressions.BinaryOperatorKind;
import org.dynamis.exprtree.expressions.BlockNode;
import org.dynamis.exprtree.expressions.CallNode;
import org.dynamis.exprtree.expressions.ConstantNode;
import org.dynamis.exprtree.expressions.IndexNode;
import org.dynamis.exprtree.expressions.LambdaNode;
import org.dynamis.exprtree.expressions.MemberNode;
import org.dynamis.exprtree.expressions.MemberRef;
import org.dynamis.exprtree.expressions.Node;
import org.dynamis.exprtree.expressions.NodeVisitor;
import org.dynamis.exprtree.expressions.VariableNode;
import org.dynamis.exprtree.types.OperatorMethod;
import org.dynamis.exprtree.types.ReflectionTypeIntrospector;
import org.dynamis.exprtree.types.TypeIntrospector;

import java.lang.reflect.Array;
import java.lang.reflect.Field;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;

/**
 * Evaluates reduced trees by reflection so tests can observe evaluation order and counts.
 * Compound assignments must be reduced before evaluation.
 */
public final class TreeInterpreter implements NodeVisitor<Object> {

    private final Map<VariableNode, Object> variables = new HashMap<>();
    private final TypeIntrospector types;

    public TreeInterpreter() {
        this(ReflectionTypeIntrospector.instance());
    }

    public TreeInterpreter(TypeIntrospector types) {
        this.types = types;
    }

    public TreeInterpreter set(VariableNode variable, Object value) {
        variables.put(variable, value);
        return this;
    }

    public Object get(VariableNode variable) {
        if (!variables.containsKey(variable)) {
            throw new IllegalStateException("Unbound variable " + variable.getName());
        }
        return variables.get(variable);
    }

    public Object evaluate(Node node) {
        return node.accept(this);
    }

    @Override
    public Object visitBinary(BinaryNode node) {
        BinaryOperatorKind kind = node.getKind();
        if (kind.isCompoundAssignment()) {
            throw new IllegalStateException("Compound assignment must be reduced before evaluation: " + node);
        }
        return switch (kind) {
            case ASSIGN -> assign(node.getLeft(), node.getRight());
            case COALESCE -> coalesce(node);
            case ELEMENT_ACCESS -> Array.get(evaluate(node.getLeft()), (Integer) evaluate(node.getRight()));
            case AND_ALSO, OR_ELSE -> shortCircuit(node);
            default -> node.getMethod() != null ? invokeOperator(node) : builtIn(node);
        };
    }

    private Object assign(Node target, Node valueNode) {
        switch (target.getNodeType()) {
            case VARIABLE -> {
                Object value = coerce(target.getType(), evaluate(valueNode));
                variables.put((VariableNode) target, value);
                return value;
            }
            case MEMBER -> {
                MemberNode member = (MemberNode) target;
                Object receiver = member.getReceiver() == null ? null : evaluate(member.getReceiver());
                Object value = coerce(target.getType(), evaluate(valueNode));
                setMember(member.getMember(), receiver, value);
                return value;
            }
            case INDEX -> {
                IndexNode index = (IndexNode) target;
                Object object = evaluate(index.getObject());
                List<Object> arguments = evaluateAll(index.getArguments());
                Object value = coerce(target.getType(), evaluate(valueNode));
                if (index.getIndexer() == null) {
                    Array.set(object, (Integer) arguments.get(0), value);
                } else {
                    arguments.add(value);
                    invoke(index.getIndexer().getSetter(), object, arguments.toArray());
                }
                return value;
            }
            default -> throw new IllegalStateException("Not assignable: " + target);
        }
    }

    private Object coalesce(BinaryNode node) {
        Object left = evaluate(node.getLeft());
        if (left == null) {
            return evaluate(node.getRight());
        }
        if (node.getConversion() != null) {
            @SuppressWarnings("unchecked")
            Function<Object[], Object> conversion = (Function<Object[], Object>) evaluate(node.getConversion());
            return conversion.apply(new Object[] {left});
        }
        return left;
    }

    private Object shortCircuit(BinaryNode node) {
        boolean andAlso = node.getKind() == BinaryOperatorKind.AND_ALSO;
        Object left = evaluate(node.getLeft());
        OperatorMethod method = node.getMethod();
        if (method != null) {
            OperatorMethod test = types.findBooleanOperator(method.getDeclaringType(), andAlso ? "isFalse" : "isTrue");
            if ((Boolean) test.invoke(left)) {
                return left;
            }
            return method.invoke(left, evaluate(node.getRight()));
        }
        if (left != null && (Boolean) left != andAlso) {
            return left;
        }
        Object right = evaluate(node.getRight());
        if (left == null) {
            return right != null && (Boolean) right != andAlso ? right : null;
        }
        return right;
    }

    private Object invokeOperator(BinaryNode node) {
        OperatorMethod method = node.getMethod();
        Object left = evaluate(node.getLeft());
        Object right = evaluate(node.getRight());
        if ((left == null || right == null) && method.getParameters().get(0).type().isPrimitive()) {
            return null;
        }
        return method.invoke(left, right);
    }

    private Object builtIn(BinaryNode node) {
        BinaryOperatorKind kind = node.getKind();
        Object left = evaluate(node.getLeft());
        Object right = evaluate(node.getRight());
        if (kind == BinaryOperatorKind.EQUAL) {
            return Objects.equals(left, right);
        }
        if (kind == BinaryOperatorKind.NOT_EQUAL) {
            return !Objects.equals(left, right);
        }
        if (left == null || right == null) {
            return null;
        }
        Class<?> operandType = types.nonNullable(node.getLeft().getType());
        if (operandType == boolean.class) {
            return logical(kind, (Boolean) left, (Boolean) right);
        }
        if (operandType == double.class || operandType == float.class) {
            return coerce(operandType, floating(kind, ((Number) left).doubleValue(), ((Number) right).doubleValue()));
        }
        if (operandType == long.class) {
            return integral(kind, ((Number) left).longValue(), ((Number) right).longValue());
        }
        Object result = integer(kind, ((Number) left).intValue(), ((Number) right).intValue());
        return result instanceof Boolean ? result : coerce(operandType, result);
    }

    private static Object logical(BinaryOperatorKind kind, boolean left, boolean right) {
        return switch (kind) {
            case AND -> left & right;
            case OR -> left | right;
            case EXCLUSIVE_OR -> left ^ right;
            default -> throw new IllegalStateException(kind + " on boolean");
        };
    }

    private static Object floating(BinaryOperatorKind kind, double left, double right) {
        return switch (kind) {
            case ADD, ADD_CHECKED -> left + right;
            case SUBTRACT, SUBTRACT_CHECKED -> left - right;
            case MULTIPLY, MULTIPLY_CHECKED -> left * right;
            case DIVIDE -> left / right;
            case MODULO -> left % right;
            case LESS_THAN -> left < right;
            case LESS_THAN_OR_EQUAL -> left <= right;
            case GREATER_THAN -> left > right;
            case GREATER_THAN_OR_EQUAL -> left >= right;
            default -> throw new IllegalStateException(kind + " on floating point");
        };
    }

    private static Object integer(BinaryOperatorKind kind, int left, int right) {
        return switch (kind) {
            case ADD -> left + right;
            case ADD_CHECKED -> Math.addExact(left, right);
            case SUBTRACT -> left - right;
            case SUBTRACT_CHECKED -> Math.subtractExact(left, right);
            case MULTIPLY -> left * right;
            case MULTIPLY_CHECKED -> Math.multiplyExact(left, right);
            case DIVIDE -> left / right;
            case MODULO -> left % right;
            case AND -> left & right;
            case OR -> left | right;
            case EXCLUSIVE_OR -> left ^ right;
            case LEFT_SHIFT -> left << right;
            case RIGHT_SHIFT -> left >> right;
            case LESS_THAN -> left < right;
            case LESS_THAN_OR_EQUAL -> left <= right;
            case GREATER_THAN -> left > right;
            case GREATER_THAN_OR_EQUAL -> left >= right;
            default -> throw new IllegalStateException(kind + " on int");
        };
    }

    private static Object integral(BinaryOperatorKind kind, long left, long right) {
        return switch (kind) {
            case ADD -> left + right;
            case ADD_CHECKED -> Math.addExact(left, right);
            case SUBTRACT -> left - right;
            case SUBTRACT_CHECKED -> Math.subtractExact(left, right);
            case MULTIPLY -> left * right;
            case MULTIPLY_CHECKED -> Math.multiplyExact(left, right);
            case DIVIDE -> left / right;
            case MODULO -> left % right;
            case AND -> left & right;
            case OR -> left | right;
            case EXCLUSIVE_OR -> left ^ right;
            case LEFT_SHIFT -> left << right;
            case RIGHT_SHIFT -> left >> right;
            case LESS_THAN -> left < right;
            case LESS_THAN_OR_EQUAL -> left <= right;
            case GREATER_THAN -> left > right;
            case GREATER_THAN_OR_EQUAL -> left >= right;
            default -> throw new IllegalStateException(kind + " on long");
        };
    }

    // narrows or widens a built-in numeric result to the static type it is stored as
    private Object coerce(Class<?> type, Object value) {
        if (!(value instanceof Number number)) {
            return value;
        }
        Class<?> target = types.nonNullable(type);
        if (target == int.class) {
            return number.intValue();
        } else if (target == long.class) {
            return number.longValue();
        } else if (target == double.class) {
            return number.doubleValue();
        } else if (target == float.class) {
            return number.floatValue();
        } else if (target == short.class) {
            return number.shortValue();
        } else if (target == byte.class) {
            return number.byteValue();
        }
        return value;
    }

    @Override
    public Object visitConstant(ConstantNode node) {
        return node.getValue();
    }

    @Override
    public Object visitVariable(VariableNode node) {
        return get(node);
    }

    @Override
    public Object visitMember(MemberNode node) {
        Object receiver = node.getReceiver() == null ? null : evaluate(node.getReceiver());
        MemberRef member = node.getMember();
        Field field = member.getField();
        if (field != null) {
            try {
                field.setAccessible(true);
                return field.get(receiver);
            } catch (IllegalAccessException e) {
                throw new IllegalStateException(e);
            }
        }
        return invoke(member.getGetter(), receiver);
    }

    private void setMember(MemberRef member, Object receiver, Object value) {
        Field field = member.getField();
        if (field != null) {
            try {
                field.setAccessible(true);
                field.set(receiver, value);
            } catch (IllegalAccessException e) {
                throw new IllegalStateException(e);
            }
            return;
        }
        invoke(member.getSetter(), receiver, value);
    }

    @Override
    public Object visitIndex(IndexNode node) {
        Object object = evaluate(node.getObject());
        List<Object> arguments = evaluateAll(node.getArguments());
        if (node.getIndexer() == null) {
            return Array.get(object, (Integer) arguments.get(0));
        }
        return invoke(node.getIndexer().getGetter(), object, arguments.toArray());
    }

    @Override
    public Object visitCall(CallNode node) {
        Object target = node.getTarget() == null ? null : evaluate(node.getTarget());
        return invoke(node.getMethod(), target, evaluateAll(node.getArguments()).toArray());
    }

    @Override
    public Object visitBlock(BlockNode node) {
        for (VariableNode variable : node.getVariables()) {
            Class<?> type = variable.getType();
            variables.put(variable, type.isPrimitive() ? Array.get(Array.newInstance(type, 1), 0) : null);
        }
        Object result = null;
        for (Node expression : node.getExpressions()) {
            result = evaluate(expression);
        }
        return result;
    }

    @Override
    public Object visitLambda(LambdaNode node) {
        Function<Object[], Object> function = arguments -> {
            List<VariableNode> parameters = node.getParameters();
            for (int i = 0; i < parameters.size(); i++) {
                variables.put(parameters.get(i), arguments[i]);
            }
            return evaluate(node.getBody());
        };
        return function;
    }

    private List<Object> evaluateAll(List<Node> nodes) {
        List<Object> values = new ArrayList<>(nodes.size());
        for (Node node : nodes) {
            values.add(evaluate(node));
        }
        return values;
    }

    private static Object invoke(Method method, Object target, Object... arguments) {
        try {
            method.setAccessible(true);
            return method.invoke(target, arguments);
        } catch (InvocationTargetException e) {
            if (e.getCause() instanceof RuntimeException re) {
                throw re;
            }
            throw new IllegalStateException(e.getCause());
        } catch (IllegalAccessException e) {
            throw new IllegalStateException(e);
        }
    }
}
