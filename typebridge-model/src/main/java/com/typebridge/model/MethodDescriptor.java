package com.typebridge.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 方法。
 * <p>
 * 泛型方法定义持有方法级类型参数；{@link #makeGenericMethod} 得到的实例持有实参，
 * 并通过 {@link #getGenericMethodDefinition()} 指回定义。
 */
public class MethodDescriptor extends MemberDescriptor {

    private final List<ParameterInfo> parameters;
    private final TypeDescriptor returnType;
    private final boolean isStatic;
    private final boolean isPublic;
    private final List<GenericParameterType> genericParameters;
    private final MethodDescriptor genericDefinition;
    private final List<TypeDescriptor> genericArguments;
    private final MemberInvoker invoker;

    public MethodDescriptor(TypeDescriptor declaringType, String name, List<? extends ParameterInfo> parameters,
                            TypeDescriptor returnType, boolean isStatic, boolean isPublic,
                            List<GenericParameterType> genericParameters, MemberInvoker invoker) {
        this(declaringType, name, parameters, returnType, isStatic, isPublic,
                genericParameters, null, Collections.emptyList(), invoker);
    }

    public MethodDescriptor(TypeDescriptor declaringType, String name, List<? extends ParameterInfo> parameters,
                            TypeDescriptor returnType, boolean isStatic, boolean isPublic, MemberInvoker invoker) {
        this(declaringType, name, parameters, returnType, isStatic, isPublic,
                Collections.emptyList(), null, Collections.emptyList(), invoker);
    }

    private MethodDescriptor(TypeDescriptor declaringType, String name, List<? extends ParameterInfo> parameters,
                             TypeDescriptor returnType, boolean isStatic, boolean isPublic,
                             List<GenericParameterType> genericParameters, MethodDescriptor genericDefinition,
                             List<TypeDescriptor> genericArguments, MemberInvoker invoker) {
        super(name, declaringType);
        this.parameters = Collections.unmodifiableList(new ArrayList<>(parameters));
        this.returnType = returnType;
        this.isStatic = isStatic;
        this.isPublic = isPublic;
        this.genericParameters = genericParameters != null
                ? Collections.unmodifiableList(new ArrayList<>(genericParameters))
                : Collections.emptyList();
        this.genericDefinition = genericDefinition;
        this.genericArguments = Collections.unmodifiableList(new ArrayList<>(genericArguments));
        this.invoker = invoker;
    }

    public List<ParameterInfo> getParameters() {
        return parameters;
    }

    public List<TypeDescriptor> getParameterTypes() {
        List<TypeDescriptor> types = new ArrayList<>(parameters.size());
        for (ParameterInfo p : parameters) {
            types.add(p.getType());
        }
        return types;
    }

    public TypeDescriptor getReturnType() {
        return returnType;
    }

    public MemberInvoker getInvoker() {
        return invoker;
    }

    @Override
    public Kind getMemberKind() {
        return Kind.METHOD;
    }

    @Override
    public boolean isStatic() {
        return isStatic;
    }

    @Override
    public boolean isPublic() {
        return isPublic;
    }

    // ==================== 泛型方法 ====================

    public boolean isGenericMethod() {
        return !genericParameters.isEmpty() || genericDefinition != null;
    }

    public boolean isGenericMethodDefinition() {
        return !genericParameters.isEmpty() && genericDefinition == null;
    }

    public MethodDescriptor getGenericMethodDefinition() {
        if (genericDefinition != null) return genericDefinition;
        if (!genericParameters.isEmpty()) return this;
        throw new IllegalStateException("Method '" + this + "' is not generic");
    }

    /**
     * 定义返回其类型参数，实例返回实参。
     */
    public List<TypeDescriptor> getGenericArguments() {
        if (genericDefinition != null) return genericArguments;
        return new ArrayList<>(genericParameters);
    }

    public MethodDescriptor makeGenericMethod(List<TypeDescriptor> typeArguments) {
        if (!isGenericMethodDefinition()) {
            throw new IllegalStateException("Method '" + this + "' is not a generic method definition");
        }
        if (typeArguments.size() != genericParameters.size()) {
            throw new IllegalArgumentException("Method '" + this + "' expects " + genericParameters.size()
                    + " type arguments but got " + typeArguments.size());
        }
        TypeSubstitution s = TypeSubstitution.forMethod(typeArguments);
        return new MethodDescriptor(getDeclaringType(), getName(), s.applyParameters(parameters),
                s.apply(returnType), isStatic, isPublic, Collections.emptyList(), this, typeArguments, invoker);
    }

    protected MethodDescriptor instantiate(TypeDescriptor declaringType, TypeSubstitution substitution) {
        if (genericDefinition != null) {
            MethodDescriptor def = genericDefinition.instantiate(declaringType, substitution);
            return def.makeGenericMethod(substitution.applyAll(genericArguments));
        }
        return new MethodDescriptor(declaringType, getName(), substitution.applyParameters(parameters),
                substitution.apply(returnType), isStatic, isPublic, genericParameters, invoker);
    }

    static String joinTypes(List<TypeDescriptor> types) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < types.size(); i++) {
            if (i > 0) sb.append(", ");
            sb.append(types.get(i));
        }
        return sb.toString();
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append(returnType).append(' ').append(super.toString());
        List<TypeDescriptor> typeArgs = getGenericArguments();
        if (!typeArgs.isEmpty()) {
            sb.append('<').append(joinTypes(typeArgs)).append('>');
        }
        return sb.append('(').append(joinTypes(getParameterTypes())).append(')').toString();
    }
}
