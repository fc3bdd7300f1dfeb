package org.dynamis.exprtree;

import org.dynamis.exprtree.expressions.BinaryOperatorKind;
import org.dynamis.exprtree.expressions.LambdaNode;

public class UnsupportedConversionShapeException extends NodeConstructionException {

    private final LambdaNode conversion;

    public UnsupportedConversionShapeException(LambdaNode conversion, String reason) {
        super("Unsupported coalesce conversion '" + conversion + "': " + reason, BinaryOperatorKind.COALESCE);
        this.conversion = conversion;
    }

    public LambdaNode getConversion() {
        return conversion;
    }
}
