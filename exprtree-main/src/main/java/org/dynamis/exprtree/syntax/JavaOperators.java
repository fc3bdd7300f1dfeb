package org.dynamis.exprtree.syntax;

import com.github.javaparser.ast.expr.AssignExpr;
import com.github.javaparser.ast.expr.BinaryExpr;
import org.dynamis.exprtree.expressions.BinaryOperatorKind;

import java.util.Map;

/**
 * Maps front-end operator tokens onto {@link BinaryOperatorKind}: JavaParser's
 * {@link BinaryExpr.Operator} and {@link AssignExpr.Operator}, and operator text as written in
 * source, including the non-Java {@code **}, {@code **=} and {@code ??}.
 */
public final class JavaOperators {

    private JavaOperators() {}

    private static final Map<String, BinaryOperatorKind> OPERATOR_MAP = Map.ofEntries(
            Map.entry("+", BinaryOperatorKind.ADD),
            Map.entry("-", BinaryOperatorKind.SUBTRACT),
            Map.entry("*", BinaryOperatorKind.MULTIPLY),
            Map.entry("/", BinaryOperatorKind.DIVIDE),
            Map.entry("%", BinaryOperatorKind.MODULO),
            Map.entry("**", BinaryOperatorKind.POWER),
            Map.entry("&", BinaryOperatorKind.AND),
            Map.entry("|", BinaryOperatorKind.OR),
            Map.entry("^", BinaryOperatorKind.EXCLUSIVE_OR),
            Map.entry("&&", BinaryOperatorKind.AND_ALSO),
            Map.entry("||", BinaryOperatorKind.OR_ELSE),
            Map.entry("<<", BinaryOperatorKind.LEFT_SHIFT),
            Map.entry(">>", BinaryOperatorKind.RIGHT_SHIFT),
            Map.entry("<", BinaryOperatorKind.LESS_THAN),
            Map.entry("<=", BinaryOperatorKind.LESS_THAN_OR_EQUAL),
            Map.entry(">", BinaryOperatorKind.GREATER_THAN),
            Map.entry(">=", BinaryOperatorKind.GREATER_THAN_OR_EQUAL),
            Map.entry("==", BinaryOperatorKind.EQUAL),
            Map.entry("!=", BinaryOperatorKind.NOT_EQUAL),
            Map.entry("??", BinaryOperatorKind.COALESCE),
            Map.entry("=", BinaryOperatorKind.ASSIGN),
            Map.entry("+=", BinaryOperatorKind.ADD_ASSIGN),
            Map.entry("-=", BinaryOperatorKind.SUBTRACT_ASSIGN),
            Map.entry("*=", BinaryOperatorKind.MULTIPLY_ASSIGN),
            Map.entry("/=", BinaryOperatorKind.DIVIDE_ASSIGN),
            Map.entry("%=", BinaryOperatorKind.MODULO_ASSIGN),
            Map.entry("**=", BinaryOperatorKind.POWER_ASSIGN),
            Map.entry("&=", BinaryOperatorKind.AND_ASSIGN),
            Map.entry("|=", BinaryOperatorKind.OR_ASSIGN),
            Map.entry("^=", BinaryOperatorKind.EXCLUSIVE_OR_ASSIGN),
            Map.entry("<<=", BinaryOperatorKind.LEFT_SHIFT_ASSIGN),
            Map.entry(">>=", BinaryOperatorKind.RIGHT_SHIFT_ASSIGN)
    );

    public static BinaryOperatorKind fromText(String operatorText) {
        BinaryOperatorKind kind = OPERATOR_MAP.get(operatorText);
        if (kind == null) {
            throw new IllegalArgumentException("Unknown binary operator: " + operatorText);
        }
        return kind;
    }

    public static BinaryOperatorKind toKind(BinaryExpr.Operator operator) {
        return toKind(operator, false);
    }

    /**
     * @param checked whether {@code +}, {@code -} and {@code *} map to their overflow-checked kinds
     */
    public static BinaryOperatorKind toKind(BinaryExpr.Operator operator, boolean checked) {
        return switch (operator) {
            case PLUS -> checked ? BinaryOperatorKind.ADD_CHECKED : BinaryOperatorKind.ADD;
            case MINUS -> checked ? BinaryOperatorKind.SUBTRACT_CHECKED : BinaryOperatorKind.SUBTRACT;
            case MULTIPLY -> checked ? BinaryOperatorKind.MULTIPLY_CHECKED : BinaryOperatorKind.MULTIPLY;
            case DIVIDE -> BinaryOperatorKind.DIVIDE;
            case REMAINDER -> BinaryOperatorKind.MODULO;
            case BINARY_AND -> BinaryOperatorKind.AND;
            case BINARY_OR -> BinaryOperatorKind.OR;
            case XOR -> BinaryOperatorKind.EXCLUSIVE_OR;
            case AND -> BinaryOperatorKind.AND_ALSO;
            case OR -> BinaryOperatorKind.OR_ELSE;
            case LEFT_SHIFT -> BinaryOperatorKind.LEFT_SHIFT;
            case SIGNED_RIGHT_SHIFT -> BinaryOperatorKind.RIGHT_SHIFT;
            case LESS -> BinaryOperatorKind.LESS_THAN;
            case LESS_EQUALS -> BinaryOperatorKind.LESS_THAN_OR_EQUAL;
            case GREATER -> BinaryOperatorKind.GREATER_THAN;
            case GREATER_EQUALS -> BinaryOperatorKind.GREATER_THAN_OR_EQUAL;
            case EQUALS -> BinaryOperatorKind.EQUAL;
            case NOT_EQUALS -> BinaryOperatorKind.NOT_EQUAL;
            default -> throw new IllegalArgumentException("No binary operator kind for " + operator.asString());
        };
    }

    public static BinaryOperatorKind toKind(AssignExpr.Operator operator) {
        return toKind(operator, false);
    }

    public static BinaryOperatorKind toKind(AssignExpr.Operator operator, boolean checked) {
        return switch (operator) {
            case ASSIGN -> BinaryOperatorKind.ASSIGN;
            case PLUS -> checked ? BinaryOperatorKind.ADD_ASSIGN_CHECKED : BinaryOperatorKind.ADD_ASSIGN;
            case MINUS -> checked ? BinaryOperatorKind.SUBTRACT_ASSIGN_CHECKED : BinaryOperatorKind.SUBTRACT_ASSIGN;
            case MULTIPLY -> checked ? BinaryOperatorKind.MULTIPLY_ASSIGN_CHECKED : BinaryOperatorKind.MULTIPLY_ASSIGN;
            case DIVIDE -> BinaryOperatorKind.DIVIDE_ASSIGN;
            case REMAINDER -> BinaryOperatorKind.MODULO_ASSIGN;
            case BINARY_AND -> BinaryOperatorKind.AND_ASSIGN;
            case BINARY_OR -> BinaryOperatorKind.OR_ASSIGN;
            case XOR -> BinaryOperatorKind.EXCLUSIVE_OR_ASSIGN;
            case LEFT_SHIFT -> BinaryOperatorKind.LEFT_SHIFT_ASSIGN;
            case SIGNED_RIGHT_SHIFT -> BinaryOperatorKind.RIGHT_SHIFT_ASSIGN;
            default -> throw new IllegalArgumentException("No binary operator kind for " + operator.asString());
        };
    }

    /**
     * The JavaParser operator written for {@code kind}, or {@code null} when Java has none
     * ({@code POWER}, {@code COALESCE}, {@code ELEMENT_ACCESS} and the assignments).
     */
    public static BinaryExpr.Operator toBinaryOperator(BinaryOperatorKind kind) {
        return switch (kind) {
            case ADD, ADD_CHECKED -> BinaryExpr.Operator.PLUS;
            case SUBTRACT, SUBTRACT_CHECKED -> BinaryExpr.Operator.MINUS;
            case MULTIPLY, MULTIPLY_CHECKED -> BinaryExpr.Operator.MULTIPLY;
            case DIVIDE -> BinaryExpr.Operator.DIVIDE;
            case MODULO -> BinaryExpr.Operator.REMAINDER;
            case AND -> BinaryExpr.Operator.BINARY_AND;
            case OR -> BinaryExpr.Operator.BINARY_OR;
            case EXCLUSIVE_OR -> BinaryExpr.Operator.XOR;
            case AND_ALSO -> BinaryExpr.Operator.AND;
            case OR_ELSE -> BinaryExpr.Operator.OR;
            case LEFT_SHIFT -> BinaryExpr.Operator.LEFT_SHIFT;
            case RIGHT_SHIFT -> BinaryExpr.Operator.SIGNED_RIGHT_SHIFT;
            case LESS_THAN -> BinaryExpr.Operator.LESS;
            case LESS_THAN_OR_EQUAL -> BinaryExpr.Operator.LESS_EQUALS;
            case GREATER_THAN -> BinaryExpr.Operator.GREATER;
            case GREATER_THAN_OR_EQUAL -> BinaryExpr.Operator.GREATER_EQUALS;
            case EQUAL -> BinaryExpr.Operator.EQUALS;
            case NOT_EQUAL -> BinaryExpr.Operator.NOT_EQUALS;
            default -> null;
        };
    }

    /**
     * The JavaParser assignment operator written for {@code kind}, or {@code null} when Java has
     * none ({@code POWER_ASSIGN} and the non-assignment kinds).
     */
    public static AssignExpr.Operator toAssignOperator(BinaryOperatorKind kind) {
        return switch (kind) {
            case ASSIGN -> AssignExpr.Operator.ASSIGN;
            case ADD_ASSIGN, ADD_ASSIGN_CHECKED -> AssignExpr.Operator.PLUS;
            case SUBTRACT_ASSIGN, SUBTRACT_ASSIGN_CHECKED -> AssignExpr.Operator.MINUS;
            case MULTIPLY_ASSIGN, MULTIPLY_ASSIGN_CHECKED -> AssignExpr.Operator.MULTIPLY;
            case DIVIDE_ASSIGN -> AssignExpr.Operator.DIVIDE;
            case MODULO_ASSIGN -> AssignExpr.Operator.REMAINDER;
            case AND_ASSIGN -> AssignExpr.Operator.BINARY_AND;
            case OR_ASSIGN -> AssignExpr.Operator.BINARY_OR;
            case EXCLUSIVE_OR_ASSIGN -> AssignExpr.Operator.XOR;
            case LEFT_SHIFT_ASSIGN -> AssignExpr.Operator.LEFT_SHIFT;
            case RIGHT_SHIFT_ASSIGN -> AssignExpr.Operator.SIGNED_RIGHT_SHIFT;
            default -> null;
        };
    }
}
