package org.dynamis.exprtree.types;

/**
 * Invocation hook for operator methods declared by a host symbol table rather than backed by
 * a reflective {@link java.lang.reflect.Method}.
 */
@FunctionalInterface
public interface OperatorInvoker {

    Object invoke(Object[] arguments);
}
