package org.dynamis.exprtree.resolve;

import org.dynamis.exprtree.InconsistentOperatorTypesException;
import org.dynamis.exprtree.InvalidAssignmentReturnTypeException;
import org.dynamis.exprtree.InvalidCoalesceTargetException;
import org.dynamis.exprtree.MethodArityMismatchException;
import org.dynamis.exprtree.MethodIsGenericException;
import org.dynamis.exprtree.MethodNotStaticException;
import org.dynamis.exprtree.MethodVoidReturnException;
import org.dynamis.exprtree.MissingBooleanTestOperatorsException;
import org.dynamis.exprtree.OperandTypeMismatchException;
import org.dynamis.exprtree.OperatorNotDefinedException;
import org.dynamis.exprtree.expressions.BinaryOperatorKind;
import org.dynamis.exprtree.expressions.BinaryOperatorKind.Category;
import org.dynamis.exprtree.types.OperatorMethod;
import org.dynamis.exprtree.types.OperatorParameter;
import org.dynamis.exprtree.types.TypeIntrospector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;

/**
 * Decides how a binary operator applies to a pair of operand types: as a built-in operation on
 * primitive (or lifted nullable) types, as a call to a user-defined static operator method, or not
 * at all. Failures are thrown as the named {@code NodeConstructionException} subtypes.
 * <p>
 * User-defined operators are looked up by {@link BinaryOperatorKind#getOperatorName()} on the
 * non-nullable left operand type, then on the non-nullable right operand type when the two differ,
 * with parameter types matching the operand types exactly. When both operands are nullable and
 * nothing matches, the lookup is retried on the non-nullable types and the result is lifted.
 */
public final class OperatorResolver {

    private static final Logger LOG = LoggerFactory.getLogger(OperatorResolver.class);

    static final String TRUE_OPERATOR = "isTrue";
    static final String FALSE_OPERATOR = "isFalse";

    /** Default implementation of {@code POWER}, exempt from operator method shape validation. */
    public static final OperatorMethod POWER_METHOD = OperatorMethod.of(Math.class, "pow", double.class, double.class);

    private final TypeIntrospector types;

    public OperatorResolver(TypeIntrospector types) {
        this.types = Objects.requireNonNull(types, "types");
    }

    public TypeIntrospector getTypes() {
        return types;
    }

    /**
     * Resolves an arithmetic, bitwise, shift, short-circuit, comparison, equality or compound
     * assignment operator.
     *
     * @param method         explicit operator method, or {@code null} to resolve by type
     * @param liftToNull     whether comparisons and equality on nullable operands produce a nullable boolean
     * @param nullComparison whether one operand is the null constant and the other nullable
     */
    public ResolvedOperator resolve(BinaryOperatorKind kind, Class<?> left, Class<?> right, OperatorMethod method,
                                    boolean liftToNull, boolean nullComparison) {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(left, "left");
        Objects.requireNonNull(right, "right");

        BinaryOperatorKind operation = kind.isCompoundAssignment() ? kind.toNonCompound() : kind;
        ResolvedOperator resolved = switch (operation.getCategory()) {
            case ARITHMETIC -> operation == BinaryOperatorKind.POWER
                               ? resolvePower(kind, left, right, method)
                               : resolveArithmetic(kind, left, right, method);
            case BITWISE -> resolveBitwise(kind, left, right, method);
            case SHIFT -> resolveShift(kind, left, right, method);
            case CONDITIONAL -> resolveConditional(kind, left, right, method);
            case COMPARISON -> resolveComparison(kind, left, right, method, liftToNull);
            case EQUALITY -> resolveEquality(kind, left, right, method, liftToNull, nullComparison);
            case STRUCTURAL, ASSIGNMENT, COMPOUND_ASSIGNMENT ->
                    throw new IllegalArgumentException(kind + " is not resolved by operator lookup");
        };

        if (kind.isCompoundAssignment() && !resolved.isBuiltIn()
            && !types.isReferenceAssignable(left, resolved.resultType())) {
            throw new InvalidAssignmentReturnTypeException(kind, resolved.method());
        }
        if (LOG.isDebugEnabled()) {
            LOG.debug("Resolved {}({}, {}) as {} returning {}", kind, left.getSimpleName(), right.getSimpleName(),
                      resolved.isBuiltIn() ? "built-in" : resolved.method(), resolved.resultType().getSimpleName());
        }
        return resolved;
    }

    /**
     * Result type of a coalesce without a conversion: the non-nullable left type when the right
     * operand converts to it, else the left type, else the right type.
     */
    public Class<?> resolveCoalesce(Class<?> left, Class<?> right) {
        Class<?> leftStripped = types.nonNullable(left);
        if (types.isValueType(left) && !types.isNullable(left)) {
            throw new InvalidCoalesceTargetException(left);
        }
        if (types.isNullable(left) && types.isImplicitlyConvertible(right, leftStripped)) {
            return leftStripped;
        }
        if (types.isImplicitlyConvertible(right, left)) {
            return left;
        }
        if (types.isImplicitlyConvertible(leftStripped, right)) {
            return right;
        }
        throw new OperatorNotDefinedException(BinaryOperatorKind.COALESCE, left, right);
    }

    private ResolvedOperator resolveArithmetic(BinaryOperatorKind kind, Class<?> left, Class<?> right, OperatorMethod method) {
        if (method != null) {
            return resolveMethodBased(kind, left, right, method, true, true);
        }
        if (left == right && types.isArithmetic(left)) {
            return ResolvedOperator.builtIn(kind, left);
        }
        return resolveUserDefinedOrThrow(kind, left, right, true);
    }

    private ResolvedOperator resolveBitwise(BinaryOperatorKind kind, Class<?> left, Class<?> right, OperatorMethod method) {
        if (method != null) {
            return resolveMethodBased(kind, left, right, method, true, true);
        }
        if (left == right && types.isIntegerOrBoolean(left)) {
            return ResolvedOperator.builtIn(kind, left);
        }
        return resolveUserDefinedOrThrow(kind, left, right, true);
    }

    private ResolvedOperator resolveShift(BinaryOperatorKind kind, Class<?> left, Class<?> right, OperatorMethod method) {
        if (method != null) {
            return resolveMethodBased(kind, left, right, method, true, true);
        }
        if (isSimpleShift(left, right)) {
            return ResolvedOperator.builtIn(kind, left);
        }
        return resolveUserDefinedOrThrow(kind, left, right, true);
    }

    // integer on the left, int on the right, both or neither nullable
    private boolean isSimpleShift(Class<?> left, Class<?> right) {
        return types.isInteger(left)
               && types.nonNullable(right) == int.class
               && types.isNullable(left) == types.isNullable(right);
    }

    private ResolvedOperator resolvePower(BinaryOperatorKind kind, Class<?> left, Class<?> right, OperatorMethod method) {
        if (method == null) {
            return resolveMethodBased(kind, left, right, POWER_METHOD, true, false);
        }
        return resolveMethodBased(kind, left, right, method, true, true);
    }

    private ResolvedOperator resolveComparison(BinaryOperatorKind kind, Class<?> left, Class<?> right,
                                               OperatorMethod method, boolean liftToNull) {
        if (method != null) {
            return resolveMethodBased(kind, left, right, method, liftToNull, true);
        }
        if (left == right && types.isNumeric(left)) {
            return builtInBoolean(kind, left, liftToNull);
        }
        return resolveUserDefinedOrThrow(kind, left, right, liftToNull);
    }

    private ResolvedOperator resolveEquality(BinaryOperatorKind kind, Class<?> left, Class<?> right,
                                             OperatorMethod method, boolean liftToNull, boolean nullComparison) {
        if (method != null) {
            return resolveMethodBased(kind, left, right, method, liftToNull, true);
        }
        if (left == right && (types.isNumeric(left) || left == Object.class || types.isBoolean(left) || types.isEnum(left))) {
            return builtInBoolean(kind, left, liftToNull);
        }
        ResolvedOperator userDefined = resolveUserDefined(kind, left, right, liftToNull);
        if (userDefined != null) {
            return userDefined;
        }
        if (types.hasBuiltInEquality(left, right) || nullComparison) {
            return builtInBoolean(kind, left, liftToNull);
        }
        throw new OperatorNotDefinedException(kind, left, right);
    }

    private ResolvedOperator builtInBoolean(BinaryOperatorKind kind, Class<?> left, boolean liftToNull) {
        if (types.isNullable(left) && liftToNull) {
            return ResolvedOperator.builtIn(kind, Boolean.class);
        }
        return ResolvedOperator.builtIn(kind, boolean.class);
    }

    private ResolvedOperator resolveConditional(BinaryOperatorKind kind, Class<?> left, Class<?> right, OperatorMethod method) {
        if (method == null) {
            if (left == right) {
                if (left == boolean.class) {
                    return ResolvedOperator.builtIn(kind, boolean.class);
                }
                if (left == Boolean.class) {
                    return ResolvedOperator.builtIn(kind, Boolean.class);
                }
            }
            method = findUserDefinedMethod(kind, left, right);
            if (method == null) {
                throw new OperatorNotDefinedException(kind, left, right);
            }
        }
        validateConditionalOperator(kind, left, right, method);
        Class<?> returnType = types.isNullable(left) && method.getReturnType() == types.nonNullable(left)
                              ? left
                              : method.getReturnType();
        return new ResolvedOperator(kind, returnType, method);
    }

    private void validateConditionalOperator(BinaryOperatorKind kind, Class<?> left, Class<?> right, OperatorMethod method) {
        validateOperator(method);
        List<OperatorParameter> parameters = method.getParameters();
        if (parameters.size() != 2) {
            throw new MethodArityMismatchException(method, 2);
        }
        if (!isParameterCompatible(parameters.get(0), left)) {
            throw new OperandTypeMismatchException(kind, method, 0);
        }
        if (!isParameterCompatible(parameters.get(1), right)) {
            throw new OperandTypeMismatchException(kind, method, 1);
        }
        Class<?> parameterType = parameters.get(0).type();
        if (parameterType != parameters.get(1).type() || method.getReturnType() != parameterType) {
            throw new InconsistentOperatorTypesException(kind, method);
        }
        if (left == right && types.isNullable(right) && parameters.get(1).type() == types.nonNullable(right)) {
            // the lifted operand type is taken from the left side for both operands
            LOG.debug("Lifting {} over {} for both operands", method, types.nonNullable(left).getSimpleName());
        }
        OperatorMethod isTrue = types.findBooleanOperator(method.getDeclaringType(), TRUE_OPERATOR);
        OperatorMethod isFalse = types.findBooleanOperator(method.getDeclaringType(), FALSE_OPERATOR);
        if (isTrue == null || isTrue.getReturnType() != boolean.class
            || isFalse == null || isFalse.getReturnType() != boolean.class) {
            throw new MissingBooleanTestOperatorsException(kind, method);
        }
    }

    private boolean isParameterCompatible(OperatorParameter parameter, Class<?> operand) {
        return isParameterAssignable(parameter, operand)
               || (types.isNullable(operand) && isParameterAssignable(parameter, types.nonNullable(operand)));
    }

    private ResolvedOperator resolveMethodBased(BinaryOperatorKind kind, Class<?> left, Class<?> right,
                                                OperatorMethod method, boolean liftToNull, boolean validate) {
        List<OperatorParameter> parameters = method.getParameters();
        if (validate) {
            validateOperator(method);
            if (parameters.size() != 2) {
                throw new MethodArityMismatchException(method, 2);
            }
        }
        OperatorParameter first = parameters.get(0);
        OperatorParameter second = parameters.get(1);
        if (isParameterAssignable(first, left) && isParameterAssignable(second, right)) {
            validateParameterWithOperand(kind, method, first, left, 0);
            validateParameterWithOperand(kind, method, second, right, 1);
            return new ResolvedOperator(kind, method.getReturnType(), method);
        }
        Class<?> returnType = method.getReturnType();
        if (types.isNullable(left) && types.isNullable(right)
            && isParameterAssignable(first, types.nonNullable(left))
            && isParameterAssignable(second, types.nonNullable(right))
            && types.isValueType(returnType) && !types.isNullable(returnType)) {
            return lifted(kind, method, liftToNull);
        }
        int operandIndex = isParameterCompatible(first, left) ? 1 : 0;
        throw new OperandTypeMismatchException(kind, method, operandIndex);
    }

    private ResolvedOperator resolveUserDefinedOrThrow(BinaryOperatorKind kind, Class<?> left, Class<?> right, boolean liftToNull) {
        ResolvedOperator resolved = resolveUserDefined(kind, left, right, liftToNull);
        if (resolved == null) {
            throw new OperatorNotDefinedException(kind, left, right);
        }
        List<OperatorParameter> parameters = resolved.method().getParameters();
        validateParameterWithOperand(kind, resolved.method(), parameters.get(0), left, 0);
        validateParameterWithOperand(kind, resolved.method(), parameters.get(1), right, 1);
        return resolved;
    }

    private ResolvedOperator resolveUserDefined(BinaryOperatorKind kind, Class<?> left, Class<?> right, boolean liftToNull) {
        OperatorMethod method = findUserDefinedMethod(kind, left, right);
        if (method != null) {
            return new ResolvedOperator(kind, method.getReturnType(), method);
        }
        if (types.isNullable(left) && types.isNullable(right)) {
            method = findUserDefinedMethod(kind, types.nonNullable(left), types.nonNullable(right));
            if (method != null && types.isValueType(method.getReturnType()) && !types.isNullable(method.getReturnType())) {
                return lifted(kind, method, liftToNull);
            }
        }
        return null;
    }

    private ResolvedOperator lifted(BinaryOperatorKind kind, OperatorMethod method, boolean liftToNull) {
        Class<?> returnType = method.getReturnType();
        if (returnType != boolean.class || liftToNull) {
            LOG.debug("Lifted {} to return {}", method, types.nullable(returnType).getSimpleName());
            return new ResolvedOperator(kind, types.nullable(returnType), method);
        }
        return new ResolvedOperator(kind, boolean.class, method);
    }

    private OperatorMethod findUserDefinedMethod(BinaryOperatorKind kind, Class<?> left, Class<?> right) {
        String name = kind.getOperatorName();
        Class<?> nnLeft = types.nonNullable(left);
        Class<?> nnRight = types.nonNullable(right);
        OperatorMethod method = types.findStaticMethod(nnLeft, name, left, right);
        if (method == null && left != right) {
            method = types.findStaticMethod(nnRight, name, left, right);
        }
        if (method == null && kind.getCategory() == Category.CONDITIONAL
            && types.isNullable(left) && types.isNullable(right)) {
            method = findUserDefinedMethod(kind, nnLeft, nnRight);
        }
        return method;
    }

    private boolean isParameterAssignable(OperatorParameter parameter, Class<?> operand) {
        return types.isReferenceAssignable(parameter.type(), operand);
    }

    private void validateParameterWithOperand(BinaryOperatorKind kind, OperatorMethod method, OperatorParameter parameter,
                                              Class<?> operand, int operandIndex) {
        if (types.isNullable(parameter.type()) && !types.isNullable(operand)) {
            throw new OperandTypeMismatchException(kind, method, operandIndex);
        }
    }

    private static void validateOperator(OperatorMethod method) {
        if (method.isGeneric()) {
            throw new MethodIsGenericException(method);
        }
        if (!method.isStatic()) {
            throw new MethodNotStaticException(method);
        }
        if (method.isVoid()) {
            throw new MethodVoidReturnException(method);
        }
    }
}
