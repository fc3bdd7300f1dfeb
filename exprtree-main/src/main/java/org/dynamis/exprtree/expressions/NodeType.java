package org.dynamis.exprtree.expressions;

public enum NodeType {
    BINARY,
    CONSTANT,
    VARIABLE,
    MEMBER,
    INDEX,
    CALL,
    BLOCK,
    LAMBDA
}
