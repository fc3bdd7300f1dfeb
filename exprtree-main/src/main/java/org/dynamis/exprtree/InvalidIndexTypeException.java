package org.dynamis.exprtree;

import org.dynamis.exprtree.expressions.BinaryOperatorKind;

public class InvalidIndexTypeException extends NodeConstructionException {

    private final Class<?> indexType;

    public InvalidIndexTypeException(Class<?> indexType) {
        super("Array index must be of type int, found '" + indexType.getName() + "'",
              BinaryOperatorKind.ELEMENT_ACCESS);
        this.indexType = indexType;
    }

    public Class<?> getIndexType() {
        return indexType;
    }
}
