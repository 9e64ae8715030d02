package com.typebridge.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 泛型参数替换：类型级参数 !n 换成类型实参，方法级参数 !!n 换成方法实参。
 */
public final class TypeSubstitution {

    private final List<TypeDescriptor> typeArguments;
    private final List<TypeDescriptor> methodArguments;

    private TypeSubstitution(List<TypeDescriptor> typeArguments, List<TypeDescriptor> methodArguments) {
        this.typeArguments = typeArguments;
        this.methodArguments = methodArguments;
    }

    public static TypeSubstitution forType(List<TypeDescriptor> typeArguments) {
        return new TypeSubstitution(typeArguments, Collections.emptyList());
    }

    public static TypeSubstitution forMethod(List<TypeDescriptor> methodArguments) {
        return new TypeSubstitution(Collections.emptyList(), methodArguments);
    }

    public TypeDescriptor apply(TypeDescriptor type) {
        if (type == null) return null;
        if (type.isGenericParameter() && type instanceof GenericParameterType) {
            GenericParameterType gp = (GenericParameterType) type;
            List<TypeDescriptor> args = gp.isMethodParameter() ? methodArguments : typeArguments;
            return gp.getPosition() < args.size() ? args.get(gp.getPosition()) : type;
        }
        if (type.isGenericType() && !type.isGenericTypeDefinition()) {
            return type.getGenericTypeDefinition().makeGenericType(applyAll(type.getGenericArguments()));
        }
        if (type.isArray()) return apply(type.getElementType()).makeArrayType(type.getArrayRank());
        if (type.isByRef()) return apply(type.getElementType()).makeByRefType();
        if (type.isPointer()) return apply(type.getElementType()).makePointerType();
        if (type.isTuple()) return TupleType.of(applyAll(type.getTupleElements()));
        return type;
    }

    public List<TypeDescriptor> applyAll(List<TypeDescriptor> types) {
        List<TypeDescriptor> result = new ArrayList<>(types.size());
        for (TypeDescriptor t : types) {
            result.add(apply(t));
        }
        return result;
    }

    public List<ParameterInfo> applyParameters(List<ParameterInfo> parameters) {
        List<ParameterInfo> result = new ArrayList<>(parameters.size());
        for (ParameterInfo p : parameters) {
            result.add(new ParameterInfo(p.getName(), apply(p.getType())));
        }
        return result;
    }
}
