package org.dynamis.exprtree;

public class NotWritableException extends NodeConstructionException {

    private final String operand;

    public NotWritableException(String operand) {
        super("Operand '" + operand + "' must be writable", null);
        this.operand = operand;
    }

    public String getOperand() {
        return operand;
    }
}
