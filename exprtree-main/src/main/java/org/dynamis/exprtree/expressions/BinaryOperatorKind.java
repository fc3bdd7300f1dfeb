package org.dynamis.exprtree.expressions;

/**
 * Operator kinds of binary nodes. Each kind carries its category and, where user-defined operators
 * can back it, the conventional name of the static operator method looked up on the operand types.
 */
public enum BinaryOperatorKind {

    ADD(Category.ARITHMETIC, "add"),
    ADD_CHECKED(Category.ARITHMETIC, "add"),
    SUBTRACT(Category.ARITHMETIC, "subtract"),
    SUBTRACT_CHECKED(Category.ARITHMETIC, "subtract"),
    MULTIPLY(Category.ARITHMETIC, "multiply"),
    MULTIPLY_CHECKED(Category.ARITHMETIC, "multiply"),
    DIVIDE(Category.ARITHMETIC, "divide"),
    MODULO(Category.ARITHMETIC, "remainder"),
    POWER(Category.ARITHMETIC, "pow"),

    AND(Category.BITWISE, "and"),
    OR(Category.BITWISE, "or"),
    EXCLUSIVE_OR(Category.BITWISE, "xor"),
    AND_ALSO(Category.CONDITIONAL, "and"),
    OR_ELSE(Category.CONDITIONAL, "or"),

    LEFT_SHIFT(Category.SHIFT, "shiftLeft"),
    RIGHT_SHIFT(Category.SHIFT, "shiftRight"),

    LESS_THAN(Category.COMPARISON, "lessThan"),
    LESS_THAN_OR_EQUAL(Category.COMPARISON, "lessThanOrEqual"),
    GREATER_THAN(Category.COMPARISON, "greaterThan"),
    GREATER_THAN_OR_EQUAL(Category.COMPARISON, "greaterThanOrEqual"),

    EQUAL(Category.EQUALITY, "equalTo"),
    NOT_EQUAL(Category.EQUALITY, "notEqualTo"),

    COALESCE(Category.STRUCTURAL, null),
    ELEMENT_ACCESS(Category.STRUCTURAL, null),
    ASSIGN(Category.ASSIGNMENT, null),

    ADD_ASSIGN(Category.COMPOUND_ASSIGNMENT, null),
    ADD_ASSIGN_CHECKED(Category.COMPOUND_ASSIGNMENT, null),
    SUBTRACT_ASSIGN(Category.COMPOUND_ASSIGNMENT, null),
    SUBTRACT_ASSIGN_CHECKED(Category.COMPOUND_ASSIGNMENT, null),
    MULTIPLY_ASSIGN(Category.COMPOUND_ASSIGNMENT, null),
    MULTIPLY_ASSIGN_CHECKED(Category.COMPOUND_ASSIGNMENT, null),
    DIVIDE_ASSIGN(Category.COMPOUND_ASSIGNMENT, null),
    MODULO_ASSIGN(Category.COMPOUND_ASSIGNMENT, null),
    POWER_ASSIGN(Category.COMPOUND_ASSIGNMENT, null),
    AND_ASSIGN(Category.COMPOUND_ASSIGNMENT, null),
    OR_ASSIGN(Category.COMPOUND_ASSIGNMENT, null),
    EXCLUSIVE_OR_ASSIGN(Category.COMPOUND_ASSIGNMENT, null),
    LEFT_SHIFT_ASSIGN(Category.COMPOUND_ASSIGNMENT, null),
    RIGHT_SHIFT_ASSIGN(Category.COMPOUND_ASSIGNMENT, null);

    public enum Category {
        ARITHMETIC,
        BITWISE,
        CONDITIONAL,
        SHIFT,
        COMPARISON,
        EQUALITY,
        STRUCTURAL,
        ASSIGNMENT,
        COMPOUND_ASSIGNMENT
    }

    private final Category category;
    private final String operatorName;

    BinaryOperatorKind(Category category, String operatorName) {
        this.category = category;
        this.operatorName = operatorName;
    }

    public Category getCategory() {
        return category;
    }

    /**
     * Conventional name of the static method implementing this operator on a user type. Compound
     * kinds answer the name of their plain counterpart; structural kinds answer {@code null}.
     */
    public String getOperatorName() {
        return isCompoundAssignment() ? toNonCompound().operatorName : operatorName;
    }

    public boolean isCompoundAssignment() {
        return category == Category.COMPOUND_ASSIGNMENT;
    }

    /** True for the overflow-checked arithmetic kinds and their compound forms. */
    public boolean isChecked() {
        return switch (this) {
            case ADD_CHECKED, SUBTRACT_CHECKED, MULTIPLY_CHECKED,
                 ADD_ASSIGN_CHECKED, SUBTRACT_ASSIGN_CHECKED, MULTIPLY_ASSIGN_CHECKED -> true;
            default -> false;
        };
    }

    /**
     * Maps a compound-assignment kind to the plain operator it combines with assignment.
     *
     * @throws IllegalStateException if this kind is not a compound assignment
     */
    public BinaryOperatorKind toNonCompound() {
        return switch (this) {
            case ADD_ASSIGN -> ADD;
            case ADD_ASSIGN_CHECKED -> ADD_CHECKED;
            case SUBTRACT_ASSIGN -> SUBTRACT;
            case SUBTRACT_ASSIGN_CHECKED -> SUBTRACT_CHECKED;
            case MULTIPLY_ASSIGN -> MULTIPLY;
            case MULTIPLY_ASSIGN_CHECKED -> MULTIPLY_CHECKED;
            case DIVIDE_ASSIGN -> DIVIDE;
            case MODULO_ASSIGN -> MODULO;
            case POWER_ASSIGN -> POWER;
            case AND_ASSIGN -> AND;
            case OR_ASSIGN -> OR;
            case EXCLUSIVE_OR_ASSIGN -> EXCLUSIVE_OR;
            case LEFT_SHIFT_ASSIGN -> LEFT_SHIFT;
            case RIGHT_SHIFT_ASSIGN -> RIGHT_SHIFT;
            case ADD, ADD_CHECKED, SUBTRACT, SUBTRACT_CHECKED, MULTIPLY, MULTIPLY_CHECKED, DIVIDE, MODULO, POWER,
                 AND, OR, EXCLUSIVE_OR, AND_ALSO, OR_ELSE, LEFT_SHIFT, RIGHT_SHIFT,
                 LESS_THAN, LESS_THAN_OR_EQUAL, GREATER_THAN, GREATER_THAN_OR_EQUAL, EQUAL, NOT_EQUAL,
                 COALESCE, ELEMENT_ACCESS, ASSIGN -> throw new IllegalStateException(this + " is not a compound assignment");
        };
    }
}
