package org.dynamis.exprtree.types;

import org.dynamis.exprtree.ExpressionTreeException;

import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Reference to an operator implementation: a static method taking the operands and returning the
 * result. Either backed by a reflective {@link Method} or declared by a host symbol table.
 * Two references are equal when they name the same method on the same declaring type with the
 * same parameter types.
 */
public final class OperatorMethod {

    private final Class<?> declaringType;
    private final String name;
    private final Method method;
    private final List<OperatorParameter> declaredParameters;
    private final Class<?> returnType;
    private final boolean isStatic;
    private final boolean generic;
    private final OperatorInvoker invoker;

    private OperatorMethod(Method method) {
        this.declaringType = method.getDeclaringClass();
        this.name = method.getName();
        this.method = method;
        this.declaredParameters = null;
        this.returnType = method.getReturnType();
        this.isStatic = Modifier.isStatic(method.getModifiers());
        this.generic = method.getTypeParameters().length > 0;
        this.invoker = null;
    }

    private OperatorMethod(Builder builder) {
        this.declaringType = builder.declaringType;
        this.name = builder.name;
        this.method = null;
        this.declaredParameters = List.copyOf(builder.parameters);
        this.returnType = builder.returnType;
        this.isStatic = builder.isStatic;
        this.generic = builder.generic;
        this.invoker = builder.invoker;
    }

    public static OperatorMethod of(Method method) {
        return new OperatorMethod(Objects.requireNonNull(method, "method"));
    }

    /**
     * Looks up a declared method by exact parameter types.
     *
     * @throws IllegalArgumentException if no such method is declared on {@code declaringType}
     */
    public static OperatorMethod of(Class<?> declaringType, String name, Class<?>... parameterTypes) {
        try {
            return new OperatorMethod(declaringType.getDeclaredMethod(name, parameterTypes));
        } catch (NoSuchMethodException e) {
            throw new IllegalArgumentException("No method " + name + " on " + declaringType.getName(), e);
        }
    }

    public static Builder declared(Class<?> declaringType, String name) {
        return new Builder(declaringType, name);
    }

    public Class<?> getDeclaringType() {
        return declaringType;
    }

    public String getName() {
        return name;
    }

    /** The reflective method, or {@code null} for a declared operator. */
    public Method getMethod() {
        return method;
    }

    public List<OperatorParameter> getParameters() {
        if (method != null) {
            return ParameterCache.shared().getParameters(method);
        }
        return declaredParameters;
    }

    public Class<?> getReturnType() {
        return returnType;
    }

    public boolean isStatic() {
        return isStatic;
    }

    public boolean isGeneric() {
        return generic;
    }

    public boolean isVoid() {
        return returnType == void.class;
    }

    public Object invoke(Object... arguments) {
        if (method != null) {
            try {
                method.setAccessible(true);
                return method.invoke(null, arguments);
            } catch (InvocationTargetException e) {
                Throwable cause = e.getCause();
                if (cause instanceof RuntimeException re) {
                    throw re;
                }
                if (cause instanceof Error err) {
                    throw err;
                }
                throw new ExpressionTreeException("Operator method " + this + " failed", cause);
            } catch (IllegalAccessException e) {
                throw new ExpressionTreeException("Operator method " + this + " is not accessible", e);
            }
        }
        if (invoker == null) {
            throw new ExpressionTreeException("Declared operator method " + this + " has no invoker");
        }
        return invoker.invoke(arguments);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof OperatorMethod other)) {
            return false;
        }
        return declaringType == other.declaringType
               && name.equals(other.name)
               && getParameters().equals(other.getParameters());
    }

    @Override
    public int hashCode() {
        return Objects.hash(declaringType, name, getParameters());
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append(declaringType.getSimpleName()).append('.').append(name).append('(');
        List<OperatorParameter> parameters = getParameters();
        for (int i = 0; i < parameters.size(); i++) {
            if (i > 0) {
                sb.append(", ");
            }
            sb.append(parameters.get(i));
        }
        return sb.append(')').toString();
    }

    public static final class Builder {

        private final Class<?> declaringType;
        private final String name;
        private final List<OperatorParameter> parameters = new ArrayList<>();
        private Class<?> returnType = void.class;
        private boolean isStatic = true;
        private boolean generic;
        private OperatorInvoker invoker;

        private Builder(Class<?> declaringType, String name) {
            this.declaringType = Objects.requireNonNull(declaringType, "declaringType");
            this.name = Objects.requireNonNull(name, "name");
        }

        public Builder parameter(Class<?> type) {
            parameters.add(OperatorParameter.of(type));
            return this;
        }

        public Builder byReferenceParameter(Class<?> type) {
            parameters.add(OperatorParameter.byReference(type));
            return this;
        }

        public Builder returns(Class<?> type) {
            this.returnType = Objects.requireNonNull(type, "type");
            return this;
        }

        public Builder instance() {
            this.isStatic = false;
            return this;
        }

        public Builder generic() {
            this.generic = true;
            return this;
        }

        public Builder invoker(OperatorInvoker invoker) {
            this.invoker = invoker;
            return this;
        }

        public OperatorMethod build() {
            return new OperatorMethod(this);
        }
    }
}
