package org.dynamis.exprtree;

import org.dynamis.exprtree.expressions.BinaryOperatorKind;

public class IncorrectIndexCountException extends NodeConstructionException {

    private final Class<?> arrayType;
    private final int rank;
    private final int indexCount;

    public IncorrectIndexCountException(Class<?> arrayType, int rank, int indexCount) {
        super("Incorrect number of indexes for '" + arrayType.getName() + "': rank " + rank
              + ", got " + indexCount, BinaryOperatorKind.ELEMENT_ACCESS);
        this.arrayType = arrayType;
        this.rank = rank;
        this.indexCount = indexCount;
    }

    public Class<?> getArrayType() {
        return arrayType;
    }

    public int getRank() {
        return rank;
    }

    public int getIndexCount() {
        return indexCount;
    }
}
