package org.dynamis.exprtree;

import org.dynamis.exprtree.types.OperatorMethod;

public class MethodArityMismatchException extends OperatorMethodException {

    private final int expectedCount;

    public MethodArityMismatchException(OperatorMethod method, int expectedCount) {
        super("Operator method '" + method + "' takes " + method.getParameters().size()
              + " parameter(s), expected " + expectedCount, null, method);
        this.expectedCount = expectedCount;
    }

    public int getExpectedCount() {
        return expectedCount;
    }

    public int getActualCount() {
        return getMethod().getParameters().size();
    }
}
