package com.typebridge.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 构造器。名称固定为 &lt;init&gt;。
 */
public class ConstructorDescriptor extends MemberDescriptor {

    public static final String NAME = "<init>";

    private final List<ParameterInfo> parameters;
    private final boolean isPublic;
    private final MemberInvoker invoker;

    public ConstructorDescriptor(TypeDescriptor declaringType, List<? extends ParameterInfo> parameters,
                                 boolean isPublic, MemberInvoker invoker) {
        super(NAME, declaringType);
        this.parameters = Collections.unmodifiableList(new ArrayList<>(parameters));
        this.isPublic = isPublic;
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

    public MemberInvoker getInvoker() {
        return invoker;
    }

    @Override
    public Kind getMemberKind() {
        return Kind.CONSTRUCTOR;
    }

    @Override
    public boolean isStatic() {
        return false;
    }

    @Override
    public boolean isPublic() {
        return isPublic;
    }

    protected ConstructorDescriptor instantiate(TypeDescriptor declaringType, TypeSubstitution substitution) {
        return new ConstructorDescriptor(declaringType, substitution.applyParameters(parameters), isPublic, invoker);
    }

    @Override
    public String toString() {
        return getDeclaringType() + "(" + MethodDescriptor.joinTypes(getParameterTypes()) + ")";
    }
}
