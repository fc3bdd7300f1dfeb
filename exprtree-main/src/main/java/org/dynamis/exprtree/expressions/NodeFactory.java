package org.dynamis.exprtree.expressions;

import org.dynamis.exprtree.AssignmentTypeMismatchException;
import org.dynamis.exprtree.IncorrectIndexCountException;
import org.dynamis.exprtree.InvalidCoalesceTargetException;
import org.dynamis.exprtree.InvalidIndexTypeException;
import org.dynamis.exprtree.NodeConstructionException;
import org.dynamis.exprtree.NotAnArrayException;
import org.dynamis.exprtree.NotReadableException;
import org.dynamis.exprtree.NotWritableException;
import org.dynamis.exprtree.UnsupportedConversionShapeException;
import org.dynamis.exprtree.resolve.OperatorResolver;
import org.dynamis.exprtree.resolve.ResolvedOperator;
import org.dynamis.exprtree.types.OperatorMethod;
import org.dynamis.exprtree.types.Primitives;
import org.dynamis.exprtree.types.ReflectionTypeIntrospector;
import org.dynamis.exprtree.types.TypeIntrospector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Builds expression tree nodes. Binary operators check operand roles, resolve the operator against
 * the operand types and pick the node shape; every failure is reported as a
 * {@link NodeConstructionException} at the call that detects it.
 * <pre>{@code
 * NodeFactory f = NodeFactory.create();
 * VariableNode total = f.variable(int.class, "total");
 * BinaryNode node = f.addAssign(total, f.constant(5));
 * }</pre>
 */
public final class NodeFactory {

    private static final Logger LOG = LoggerFactory.getLogger(NodeFactory.class);

    private final TypeIntrospector types;
    private final OperatorResolver resolver;

    private NodeFactory(TypeIntrospector types) {
        this.types = types;
        this.resolver = new OperatorResolver(types);
    }

    public static NodeFactory create() {
        return new NodeFactory(ReflectionTypeIntrospector.instance());
    }

    public static NodeFactory create(TypeIntrospector types) {
        return new NodeFactory(Objects.requireNonNull(types, "types"));
    }

    public TypeIntrospector getTypes() {
        return types;
    }

    // ---- arithmetic ----

    public BinaryNode add(Node left, Node right) {
        return add(left, right, null);
    }

    public BinaryNode add(Node left, Node right, OperatorMethod method) {
        return operator(BinaryOperatorKind.ADD, left, right, method, true);
    }

    /** Addition with overflow checking. */
    public BinaryNode addChecked(Node left, Node right) {
        return addChecked(left, right, null);
    }

    public BinaryNode addChecked(Node left, Node right, OperatorMethod method) {
        return operator(BinaryOperatorKind.ADD_CHECKED, left, right, method, true);
    }

    public BinaryNode subtract(Node left, Node right) {
        return subtract(left, right, null);
    }

    public BinaryNode subtract(Node left, Node right, OperatorMethod method) {
        return operator(BinaryOperatorKind.SUBTRACT, left, right, method, true);
    }

    public BinaryNode subtractChecked(Node left, Node right) {
        return subtractChecked(left, right, null);
    }

    public BinaryNode subtractChecked(Node left, Node right, OperatorMethod method) {
        return operator(BinaryOperatorKind.SUBTRACT_CHECKED, left, right, method, true);
    }

    public BinaryNode multiply(Node left, Node right) {
        return multiply(left, right, null);
    }

    public BinaryNode multiply(Node left, Node right, OperatorMethod method) {
        return operator(BinaryOperatorKind.MULTIPLY, left, right, method, true);
    }

    public BinaryNode multiplyChecked(Node left, Node right) {
        return multiplyChecked(left, right, null);
    }

    public BinaryNode multiplyChecked(Node left, Node right, OperatorMethod method) {
        return operator(BinaryOperatorKind.MULTIPLY_CHECKED, left, right, method, true);
    }

    public BinaryNode divide(Node left, Node right) {
        return divide(left, right, null);
    }

    public BinaryNode divide(Node left, Node right, OperatorMethod method) {
        return operator(BinaryOperatorKind.DIVIDE, left, right, method, true);
    }

    public BinaryNode modulo(Node left, Node right) {
        return modulo(left, right, null);
    }

    public BinaryNode modulo(Node left, Node right, OperatorMethod method) {
        return operator(BinaryOperatorKind.MODULO, left, right, method, true);
    }

    /**
     * Exponentiation. Without an explicit method this calls {@link Math#pow(double, double)}.
     */
    public BinaryNode power(Node left, Node right) {
        return power(left, right, null);
    }

    public BinaryNode power(Node left, Node right, OperatorMethod method) {
        return operator(BinaryOperatorKind.POWER, left, right, method, true);
    }

    // ---- bitwise, short-circuit and shift ----

    public BinaryNode and(Node left, Node right) {
        return and(left, right, null);
    }

    public BinaryNode and(Node left, Node right, OperatorMethod method) {
        return operator(BinaryOperatorKind.AND, left, right, method, true);
    }

    public BinaryNode or(Node left, Node right) {
        return or(left, right, null);
    }

    public BinaryNode or(Node left, Node right, OperatorMethod method) {
        return operator(BinaryOperatorKind.OR, left, right, method, true);
    }

    public BinaryNode exclusiveOr(Node left, Node right) {
        return exclusiveOr(left, right, null);
    }

    public BinaryNode exclusiveOr(Node left, Node right, OperatorMethod method) {
        return operator(BinaryOperatorKind.EXCLUSIVE_OR, left, right, method, true);
    }

    /**
     * Short-circuit and. On a user type this uses its {@code and} operator, which requires static
     * {@code isTrue} and {@code isFalse} tests on the declaring type.
     */
    public BinaryNode andAlso(Node left, Node right) {
        return andAlso(left, right, null);
    }

    public BinaryNode andAlso(Node left, Node right, OperatorMethod method) {
        return operator(BinaryOperatorKind.AND_ALSO, left, right, method, false);
    }

    public BinaryNode orElse(Node left, Node right) {
        return orElse(left, right, null);
    }

    public BinaryNode orElse(Node left, Node right, OperatorMethod method) {
        return operator(BinaryOperatorKind.OR_ELSE, left, right, method, false);
    }

    public BinaryNode leftShift(Node left, Node right) {
        return leftShift(left, right, null);
    }

    public BinaryNode leftShift(Node left, Node right, OperatorMethod method) {
        return operator(BinaryOperatorKind.LEFT_SHIFT, left, right, method, true);
    }

    public BinaryNode rightShift(Node left, Node right) {
        return rightShift(left, right, null);
    }

    public BinaryNode rightShift(Node left, Node right, OperatorMethod method) {
        return operator(BinaryOperatorKind.RIGHT_SHIFT, left, right, method, true);
    }

    // ---- comparison and equality ----

    public BinaryNode lessThan(Node left, Node right) {
        return lessThan(left, right, false, null);
    }

    public BinaryNode lessThan(Node left, Node right, boolean liftToNull, OperatorMethod method) {
        return operator(BinaryOperatorKind.LESS_THAN, left, right, method, liftToNull);
    }

    public BinaryNode lessThanOrEqual(Node left, Node right) {
        return lessThanOrEqual(left, right, false, null);
    }

    public BinaryNode lessThanOrEqual(Node left, Node right, boolean liftToNull, OperatorMethod method) {
        return operator(BinaryOperatorKind.LESS_THAN_OR_EQUAL, left, right, method, liftToNull);
    }

    public BinaryNode greaterThan(Node left, Node right) {
        return greaterThan(left, right, false, null);
    }

    public BinaryNode greaterThan(Node left, Node right, boolean liftToNull, OperatorMethod method) {
        return operator(BinaryOperatorKind.GREATER_THAN, left, right, method, liftToNull);
    }

    public BinaryNode greaterThanOrEqual(Node left, Node right) {
        return greaterThanOrEqual(left, right, false, null);
    }

    public BinaryNode greaterThanOrEqual(Node left, Node right, boolean liftToNull, OperatorMethod method) {
        return operator(BinaryOperatorKind.GREATER_THAN_OR_EQUAL, left, right, method, liftToNull);
    }

    /**
     * Equality. Comparing a nullable operand with the null constant is always allowed, even when
     * the operand type defines no equality.
     *
     * @param liftToNull whether nullable operands produce a {@code Boolean} rather than a {@code boolean}
     */
    public BinaryNode equal(Node left, Node right, boolean liftToNull, OperatorMethod method) {
        return operator(BinaryOperatorKind.EQUAL, left, right, method, liftToNull);
    }

    public BinaryNode equal(Node left, Node right) {
        return equal(left, right, false, null);
    }

    public BinaryNode notEqual(Node left, Node right) {
        return notEqual(left, right, false, null);
    }

    public BinaryNode notEqual(Node left, Node right, boolean liftToNull, OperatorMethod method) {
        return operator(BinaryOperatorKind.NOT_EQUAL, left, right, method, liftToNull);
    }

    // ---- coalesce and element access ----

    public BinaryNode coalesce(Node left, Node right) {
        return coalesce(left, right, null);
    }

    /**
     * {@code left ?? right}. The conversion, when given, maps a non-null left value to the type of
     * {@code right}, which is then the type of the node.
     */
    public BinaryNode coalesce(Node left, Node right, LambdaNode conversion) {
        requiresCanRead(left, "left");
        requiresCanRead(right, "right");
        Class<?> leftType = left.getType();
        Class<?> rightType = right.getType();
        if (conversion == null) {
            Class<?> resultType = resolver.resolveCoalesce(leftType, rightType);
            return build(BinaryOperatorKind.COALESCE, left, right, resultType, null, null);
        }
        if (types.isValueType(leftType) && !types.isNullable(leftType)) {
            throw new InvalidCoalesceTargetException(leftType);
        }
        if (conversion.getReturnType() == void.class) {
            throw new UnsupportedConversionShapeException(conversion, "the conversion must return a value");
        }
        if (conversion.getParameters().size() != 1) {
            throw new UnsupportedConversionShapeException(conversion, "the conversion must take exactly one parameter");
        }
        if (conversion.getReturnType() != rightType) {
            throw new UnsupportedConversionShapeException(conversion, "the conversion must return " + rightType.getName());
        }
        Class<?> parameterType = conversion.getParameterTypes().get(0);
        if (!types.isReferenceAssignable(parameterType, types.nonNullable(leftType))
            && !types.isReferenceAssignable(parameterType, leftType)) {
            throw new UnsupportedConversionShapeException(conversion, "the conversion parameter must accept " + leftType.getName());
        }
        return build(BinaryOperatorKind.COALESCE, left, right, rightType, null, conversion);
    }

    /**
     * Single-dimensional element access {@code array[index]} with an {@code int} index.
     */
    public BinaryNode elementAccess(Node array, Node index) {
        requiresCanRead(array, "array");
        requiresCanRead(index, "index");
        if (index.getType() != int.class) {
            throw new InvalidIndexTypeException(index.getType());
        }
        Class<?> arrayType = array.getType();
        if (!types.isArray(arrayType)) {
            throw new NotAnArrayException(arrayType);
        }
        int rank = types.arrayRank(arrayType);
        if (rank != 1) {
            throw new IncorrectIndexCountException(arrayType, rank, 1);
        }
        return build(BinaryOperatorKind.ELEMENT_ACCESS, array, index, types.elementType(arrayType), null, null);
    }

    // ---- assignment ----

    public BinaryNode assign(Node left, Node right) {
        requiresCanWrite(left, "left");
        requiresCanRead(right, "right");
        Class<?> target = left.getType();
        Class<?> value = right.getType();
        if (!types.isReferenceAssignable(target, value) && !types.isImplicitNumericConversion(value, target)) {
            throw new AssignmentTypeMismatchException(target, value);
        }
        return build(BinaryOperatorKind.ASSIGN, left, right, target, null, null);
    }

    public BinaryNode addAssign(Node left, Node right) {
        return addAssign(left, right, null);
    }

    public BinaryNode addAssign(Node left, Node right, OperatorMethod method) {
        return operator(BinaryOperatorKind.ADD_ASSIGN, left, right, method, true);
    }

    public BinaryNode addAssignChecked(Node left, Node right) {
        return addAssignChecked(left, right, null);
    }

    public BinaryNode addAssignChecked(Node left, Node right, OperatorMethod method) {
        return operator(BinaryOperatorKind.ADD_ASSIGN_CHECKED, left, right, method, true);
    }

    public BinaryNode subtractAssign(Node left, Node right) {
        return subtractAssign(left, right, null);
    }

    public BinaryNode subtractAssign(Node left, Node right, OperatorMethod method) {
        return operator(BinaryOperatorKind.SUBTRACT_ASSIGN, left, right, method, true);
    }

    public BinaryNode subtractAssignChecked(Node left, Node right) {
        return subtractAssignChecked(left, right, null);
    }

    public BinaryNode subtractAssignChecked(Node left, Node right, OperatorMethod method) {
        return operator(BinaryOperatorKind.SUBTRACT_ASSIGN_CHECKED, left, right, method, true);
    }

    public BinaryNode multiplyAssign(Node left, Node right) {
        return multiplyAssign(left, right, null);
    }

    public BinaryNode multiplyAssign(Node left, Node right, OperatorMethod method) {
        return operator(BinaryOperatorKind.MULTIPLY_ASSIGN, left, right, method, true);
    }

    public BinaryNode multiplyAssignChecked(Node left, Node right) {
        return multiplyAssignChecked(left, right, null);
    }

    public BinaryNode multiplyAssignChecked(Node left, Node right, OperatorMethod method) {
        return operator(BinaryOperatorKind.MULTIPLY_ASSIGN_CHECKED, left, right, method, true);
    }

    public BinaryNode divideAssign(Node left, Node right) {
        return divideAssign(left, right, null);
    }

    public BinaryNode divideAssign(Node left, Node right, OperatorMethod method) {
        return operator(BinaryOperatorKind.DIVIDE_ASSIGN, left, right, method, true);
    }

    public BinaryNode moduloAssign(Node left, Node right) {
        return moduloAssign(left, right, null);
    }

    public BinaryNode moduloAssign(Node left, Node right, OperatorMethod method) {
        return operator(BinaryOperatorKind.MODULO_ASSIGN, left, right, method, true);
    }

    public BinaryNode powerAssign(Node left, Node right) {
        return powerAssign(left, right, null);
    }

    public BinaryNode powerAssign(Node left, Node right, OperatorMethod method) {
        return operator(BinaryOperatorKind.POWER_ASSIGN, left, right, method, true);
    }

    public BinaryNode andAssign(Node left, Node right) {
        return andAssign(left, right, null);
    }

    public BinaryNode andAssign(Node left, Node right, OperatorMethod method) {
        return operator(BinaryOperatorKind.AND_ASSIGN, left, right, method, true);
    }

    public BinaryNode orAssign(Node left, Node right) {
        return orAssign(left, right, null);
    }

    public BinaryNode orAssign(Node left, Node right, OperatorMethod method) {
        return operator(BinaryOperatorKind.OR_ASSIGN, left, right, method, true);
    }

    public BinaryNode exclusiveOrAssign(Node left, Node right) {
        return exclusiveOrAssign(left, right, null);
    }

    public BinaryNode exclusiveOrAssign(Node left, Node right, OperatorMethod method) {
        return operator(BinaryOperatorKind.EXCLUSIVE_OR_ASSIGN, left, right, method, true);
    }

    public BinaryNode leftShiftAssign(Node left, Node right) {
        return leftShiftAssign(left, right, null);
    }

    public BinaryNode leftShiftAssign(Node left, Node right, OperatorMethod method) {
        return operator(BinaryOperatorKind.LEFT_SHIFT_ASSIGN, left, right, method, true);
    }

    public BinaryNode rightShiftAssign(Node left, Node right) {
        return rightShiftAssign(left, right, null);
    }

    public BinaryNode rightShiftAssign(Node left, Node right, OperatorMethod method) {
        return operator(BinaryOperatorKind.RIGHT_SHIFT_ASSIGN, left, right, method, true);
    }

    // ---- generic entry point ----

    public BinaryNode makeBinary(BinaryOperatorKind kind, Node left, Node right) {
        return makeBinary(kind, left, right, false, null, null);
    }

    public BinaryNode makeBinary(BinaryOperatorKind kind, Node left, Node right, boolean liftToNull, OperatorMethod method) {
        return makeBinary(kind, left, right, liftToNull, method, null);
    }

    /**
     * Builds a binary node of any kind. {@code liftToNull} applies to comparison and equality
     * kinds only, and {@code conversion} to {@link BinaryOperatorKind#COALESCE} only.
     */
    public BinaryNode makeBinary(BinaryOperatorKind kind, Node left, Node right, boolean liftToNull,
                                 OperatorMethod method, LambdaNode conversion) {
        Objects.requireNonNull(kind, "kind");
        return switch (kind) {
            case ADD -> add(left, right, method);
            case ADD_CHECKED -> addChecked(left, right, method);
            case SUBTRACT -> subtract(left, right, method);
            case SUBTRACT_CHECKED -> subtractChecked(left, right, method);
            case MULTIPLY -> multiply(left, right, method);
            case MULTIPLY_CHECKED -> multiplyChecked(left, right, method);
            case DIVIDE -> divide(left, right, method);
            case MODULO -> modulo(left, right, method);
            case POWER -> power(left, right, method);
            case AND -> and(left, right, method);
            case OR -> or(left, right, method);
            case EXCLUSIVE_OR -> exclusiveOr(left, right, method);
            case AND_ALSO -> andAlso(left, right, method);
            case OR_ELSE -> orElse(left, right, method);
            case LEFT_SHIFT -> leftShift(left, right, method);
            case RIGHT_SHIFT -> rightShift(left, right, method);
            case LESS_THAN -> lessThan(left, right, liftToNull, method);
            case LESS_THAN_OR_EQUAL -> lessThanOrEqual(left, right, liftToNull, method);
            case GREATER_THAN -> greaterThan(left, right, liftToNull, method);
            case GREATER_THAN_OR_EQUAL -> greaterThanOrEqual(left, right, liftToNull, method);
            case EQUAL -> equal(left, right, liftToNull, method);
            case NOT_EQUAL -> notEqual(left, right, liftToNull, method);
            case COALESCE -> coalesce(left, right, conversion);
            case ELEMENT_ACCESS -> elementAccess(left, right);
            case ASSIGN -> assign(left, right);
            case ADD_ASSIGN -> addAssign(left, right, method);
            case ADD_ASSIGN_CHECKED -> addAssignChecked(left, right, method);
            case SUBTRACT_ASSIGN -> subtractAssign(left, right, method);
            case SUBTRACT_ASSIGN_CHECKED -> subtractAssignChecked(left, right, method);
            case MULTIPLY_ASSIGN -> multiplyAssign(left, right, method);
            case MULTIPLY_ASSIGN_CHECKED -> multiplyAssignChecked(left, right, method);
            case DIVIDE_ASSIGN -> divideAssign(left, right, method);
            case MODULO_ASSIGN -> moduloAssign(left, right, method);
            case POWER_ASSIGN -> powerAssign(left, right, method);
            case AND_ASSIGN -> andAssign(left, right, method);
            case OR_ASSIGN -> orAssign(left, right, method);
            case EXCLUSIVE_OR_ASSIGN -> exclusiveOrAssign(left, right, method);
            case LEFT_SHIFT_ASSIGN -> leftShiftAssign(left, right, method);
            case RIGHT_SHIFT_ASSIGN -> rightShiftAssign(left, right, method);
        };
    }

    /**
     * Whether the operation applies a non-nullable operator to nullable operands, producing null
     * when an operand is null.
     */
    public boolean isLifted(BinaryNode node) {
        BinaryOperatorKind kind = node.getKind();
        if (kind == BinaryOperatorKind.COALESCE || kind == BinaryOperatorKind.ASSIGN) {
            return false;
        }
        Class<?> leftType = node.getLeft().getType();
        if (!types.isNullable(leftType)) {
            return false;
        }
        OperatorMethod method = node.getMethod();
        return method == null || method.getParameters().get(0).type() != leftType;
    }

    public boolean isLiftedToNull(BinaryNode node) {
        return isLifted(node) && types.isNullable(node.getType());
    }

    private BinaryNode operator(BinaryOperatorKind kind, Node left, Node right, OperatorMethod method, boolean liftToNull) {
        requiresCanRead(left, "left");
        if (kind.isCompoundAssignment()) {
            requiresCanWrite(left, "left");
        }
        requiresCanRead(right, "right");
        boolean nullComparison = kind.getCategory() == BinaryOperatorKind.Category.EQUALITY && isNullComparison(left, right);
        ResolvedOperator resolved = resolver.resolve(kind, left.getType(), right.getType(), method, liftToNull, nullComparison);
        return build(kind, left, right, resolved.resultType(), resolved.method(), null);
    }

    private BinaryNode build(BinaryOperatorKind kind, Node left, Node right, Class<?> type,
                             OperatorMethod method, LambdaNode conversion) {
        BinaryNode node = BinaryNode.create(kind, left, right, type, method, conversion);
        LOG.debug("Built {} node of type {}", kind, type.getSimpleName());
        return node;
    }

    // x == null, x != null, null == x and null != x with x nullable but not the null constant
    private boolean isNullComparison(Node left, Node right) {
        if (isNullConstant(left) && !isNullConstant(right) && types.isNullable(right.getType())) {
            return true;
        }
        return isNullConstant(right) && !isNullConstant(left) && types.isNullable(left.getType());
    }

    private static boolean isNullConstant(Node node) {
        return node instanceof ConstantNode constant && constant.isNull();
    }

    private static void requiresCanRead(Node node, String operand) {
        Objects.requireNonNull(node, operand);
        if (!node.canRead()) {
            throw new NotReadableException(operand);
        }
    }

    private static void requiresCanWrite(Node node, String operand) {
        Objects.requireNonNull(node, operand);
        if (!node.canWrite()) {
            throw new NotWritableException(operand);
        }
    }

    // ---- supporting nodes ----

    /** A constant typed by its value, unboxing wrappers: {@code constant(5)} has type {@code int}. */
    public ConstantNode constant(Object value) {
        if (value == null) {
            return new ConstantNode(null, Object.class);
        }
        Class<?> primitive = Primitives.unbox(value.getClass());
        return new ConstantNode(value, primitive != null ? primitive : value.getClass());
    }

    public ConstantNode constant(Object value, Class<?> type) {
        Objects.requireNonNull(type, "type");
        if (value == null) {
            if (type.isPrimitive()) {
                throw new IllegalArgumentException("A null constant cannot have primitive type " + type.getName());
            }
        } else if (!boxed(type).isInstance(value)) {
            throw new IllegalArgumentException("Value " + value + " is not of type " + type.getName());
        }
        return new ConstantNode(value, type);
    }

    public VariableNode variable(Class<?> type, String name) {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(name, "name");
        if (type == void.class) {
            throw new IllegalArgumentException("Variable '" + name + "' cannot be void");
        }
        return new VariableNode(name, type);
    }

    public MemberNode field(Node receiver, String name) {
        Objects.requireNonNull(receiver, "receiver");
        return member(receiver, MemberRef.field(receiver.getType(), name));
    }

    /** A static field. */
    public MemberNode field(Class<?> declaringType, String name) {
        return member(null, MemberRef.field(declaringType, name));
    }

    public MemberNode property(Node receiver, String name) {
        Objects.requireNonNull(receiver, "receiver");
        return member(receiver, MemberRef.property(receiver.getType(), name));
    }

    /** A static property. */
    public MemberNode property(Class<?> declaringType, String name) {
        return member(null, MemberRef.property(declaringType, name));
    }

    /**
     * Member access; {@code receiver} must be {@code null} exactly when the member is static.
     */
    public MemberNode member(Node receiver, MemberRef member) {
        Objects.requireNonNull(member, "member");
        if (member.isStatic()) {
            if (receiver != null) {
                throw new IllegalArgumentException("Static member " + member + " cannot have a receiver");
            }
        } else {
            if (receiver == null) {
                throw new IllegalArgumentException("Instance member " + member + " needs a receiver");
            }
            requiresCanRead(receiver, "receiver");
            if (!member.getDeclaringType().isAssignableFrom(receiver.getType())) {
                throw new IllegalArgumentException("Member " + member + " is not defined on " + receiver.getType().getName());
            }
        }
        return new MemberNode(receiver, member);
    }

    /** Indexer access through the conventional {@code get}/{@code set} pair of the object type. */
    public IndexNode index(Node object, Node... arguments) {
        Objects.requireNonNull(object, "object");
        Class<?>[] indexTypes = Arrays.stream(arguments).map(Node::getType).toArray(Class<?>[]::new);
        return index(object, IndexerRef.of(object.getType(), indexTypes), List.of(arguments));
    }

    public IndexNode index(Node object, IndexerRef indexer, List<Node> arguments) {
        requiresCanRead(object, "object");
        Objects.requireNonNull(indexer, "indexer");
        if (arguments.size() != indexer.getIndexCount()) {
            throw new IncorrectIndexCountException(object.getType(), indexer.getIndexCount(), arguments.size());
        }
        Class<?>[] indexTypes = indexer.getIndexTypes();
        for (int i = 0; i < indexTypes.length; i++) {
            Node argument = arguments.get(i);
            requiresCanRead(argument, "argument " + i);
            if (!isArgumentAssignable(indexTypes[i], argument.getType())) {
                throw new InvalidIndexTypeException(argument.getType());
            }
        }
        return new IndexNode(object, indexer, arguments, indexer.getElementType());
    }

    /** Java array access, the only array form that is also writable. */
    public IndexNode arrayAccess(Node array, Node... indexes) {
        requiresCanRead(array, "array");
        Class<?> arrayType = array.getType();
        if (!arrayType.isArray()) {
            throw new NotAnArrayException(arrayType);
        }
        if (indexes.length != 1) {
            throw new IncorrectIndexCountException(arrayType, 1, indexes.length);
        }
        requiresCanRead(indexes[0], "index");
        if (indexes[0].getType() != int.class) {
            throw new InvalidIndexTypeException(indexes[0].getType());
        }
        return new IndexNode(array, null, List.of(indexes), arrayType.getComponentType());
    }

    public CallNode call(Node target, Method method, Node... arguments) {
        Objects.requireNonNull(method, "method");
        boolean isStatic = Modifier.isStatic(method.getModifiers());
        if (isStatic != (target == null)) {
            throw new IllegalArgumentException(isStatic
                    ? "Static method " + method.getName() + " cannot have a target"
                    : "Instance method " + method.getName() + " needs a target");
        }
        if (target != null) {
            requiresCanRead(target, "target");
        }
        Class<?>[] parameterTypes = method.getParameterTypes();
        if (parameterTypes.length != arguments.length) {
            throw new IllegalArgumentException("Method " + method.getName() + " takes " + parameterTypes.length
                                               + " argument(s), got " + arguments.length);
        }
        for (int i = 0; i < arguments.length; i++) {
            requiresCanRead(arguments[i], "argument " + i);
            if (!isArgumentAssignable(parameterTypes[i], arguments[i].getType())) {
                throw new IllegalArgumentException("Argument " + i + " of type " + arguments[i].getType().getName()
                                                   + " does not match " + parameterTypes[i].getName());
            }
        }
        return new CallNode(target, method, List.of(arguments));
    }

    /** A static method call. */
    public CallNode call(Method method, Node... arguments) {
        return call(null, method, arguments);
    }

    public BlockNode block(List<VariableNode> variables, Node... expressions) {
        return block(variables, List.of(expressions));
    }

    public BlockNode block(List<VariableNode> variables, List<Node> expressions) {
        if (expressions.isEmpty()) {
            throw new IllegalArgumentException("A block needs at least one expression");
        }
        return new BlockNode(variables, expressions);
    }

    public LambdaNode lambda(Node body, VariableNode... parameters) {
        Objects.requireNonNull(body, "body");
        return lambda(body.getType(), body, List.of(parameters));
    }

    public LambdaNode lambda(Class<?> returnType, Node body, List<VariableNode> parameters) {
        Objects.requireNonNull(returnType, "returnType");
        Objects.requireNonNull(body, "body");
        if (returnType != void.class && !isArgumentAssignable(returnType, body.getType())) {
            throw new IllegalArgumentException("Lambda body of type " + body.getType().getName()
                                               + " does not match return type " + returnType.getName());
        }
        return new LambdaNode(parameters, body, returnType);
    }

    private boolean isArgumentAssignable(Class<?> parameterType, Class<?> argumentType) {
        return types.isReferenceAssignable(parameterType, argumentType)
               || types.isImplicitlyConvertible(argumentType, parameterType);
    }

    private static Class<?> boxed(Class<?> type) {
        Class<?> box = Primitives.box(type);
        return box != null ? box : type;
    }
}
