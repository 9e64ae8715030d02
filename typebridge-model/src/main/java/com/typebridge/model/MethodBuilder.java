package com.typebridge.model;

import java.util.ArrayList;
import java.util.List;

/**
 * 方法构建器，由 {@link TypeBuilder#method(String)} 创建，{@link #add()} 结束。
 * 泛型方法需先声明类型参数，再用 {@link #typeParameter(int)} 引用它们。
 */
public final class MethodBuilder {

    private final TypeBuilder owner;
    private final String name;
    private final List<ParameterInfo> parameters = new ArrayList<>();
    private final List<GenericParameterType> typeParameters = new ArrayList<>();
    private TypeDescriptor returnType = PrimitiveType.VOID;
    private boolean isStatic;
    private boolean isPublic = true;
    private MemberInvoker invoker;

    MethodBuilder(TypeBuilder owner, String name) {
        this.owner = owner;
        this.name = name;
    }

    public MethodBuilder typeParameters(String... names) {
        if (!parameters.isEmpty()) {
            throw new IllegalStateException("Type parameters of '" + name + "' must be declared before parameters");
        }
        for (String n : names) {
            typeParameters.add(new GenericParameterType(n, typeParameters.size(), true));
        }
        return this;
    }

    public GenericParameterType typeParameter(int position) {
        return typeParameters.get(position);
    }

    public MethodBuilder parameter(String parameterName, TypeDescriptor type) {
        parameters.add(new ParameterInfo(parameterName, type));
        return this;
    }

    public MethodBuilder returns(TypeDescriptor type) {
        this.returnType = type;
        return this;
    }

    public MethodBuilder asStatic() {
        this.isStatic = true;
        return this;
    }

    public MethodBuilder nonPublic() {
        this.isPublic = false;
        return this;
    }

    public MethodBuilder invoker(MemberInvoker invoker) {
        this.invoker = invoker;
        return this;
    }

    public TypeBuilder add() {
        owner.type().addMethod(new MethodDescriptor(owner.type(), name, parameters, returnType,
                isStatic, isPublic, typeParameters, invoker));
        return owner;
    }
}
