package org.dynamis.exprtree;

public class NotReadableException extends NodeConstructionException {

    private final String operand;

    public NotReadableException(String operand) {
        super("Operand '" + operand + "' must be readable", null);
        this.operand = operand;
    }

    public String getOperand() {
        return operand;
    }
}
