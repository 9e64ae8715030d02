package com.typebridge.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 属性：读写通过 getter/setter 方法完成。静态性和可见性由访问器推出。
 */
public class PropertyDescriptor extends MemberDescriptor {

    private final TypeDescriptor propertyType;
    private final MethodDescriptor getter;
    private final MethodDescriptor setter;
    private final List<ParameterInfo> indexParameters;

    public PropertyDescriptor(TypeDescriptor declaringType, String name, TypeDescriptor propertyType,
                              MethodDescriptor getter, MethodDescriptor setter,
                              List<? extends ParameterInfo> indexParameters) {
        super(name, declaringType);
        this.propertyType = propertyType;
        this.getter = getter;
        this.setter = setter;
        this.indexParameters = indexParameters != null
                ? Collections.unmodifiableList(new ArrayList<>(indexParameters))
                : Collections.emptyList();
    }

    public TypeDescriptor getPropertyType() {
        return propertyType;
    }

    public MethodDescriptor getGetter() {
        return getter;
    }

    public MethodDescriptor getSetter() {
        return setter;
    }

    public boolean canRead() {
        return getter != null;
    }

    public boolean canWrite() {
        return setter != null;
    }

    public List<ParameterInfo> getIndexParameters() {
        return indexParameters;
    }

    @Override
    public Kind getMemberKind() {
        return Kind.PROPERTY;
    }

    @Override
    public boolean isStatic() {
        return (getter != null && getter.isStatic()) || (setter != null && setter.isStatic());
    }

    @Override
    public boolean isPublic() {
        return (getter != null && getter.isPublic()) || (setter != null && setter.isPublic());
    }

    protected PropertyDescriptor instantiate(TypeDescriptor declaringType, TypeSubstitution substitution) {
        return new PropertyDescriptor(declaringType, getName(), substitution.apply(propertyType),
                getter != null ? getter.instantiate(declaringType, substitution) : null,
                setter != null ? setter.instantiate(declaringType, substitution) : null,
                substitution.applyParameters(indexParameters));
    }

    @Override
    public String toString() {
        return propertyType + " " + super.toString();
    }
}
