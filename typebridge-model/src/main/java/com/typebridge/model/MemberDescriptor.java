package com.typebridge.model;

/**
 * 成员描述符基类：属性、字段、方法、构造器。
 */
public abstract class MemberDescriptor {

    public enum Kind { FIELD, PROPERTY, METHOD, CONSTRUCTOR }

    private final String name;
    private TypeDescriptor declaringType;

    protected MemberDescriptor(String name, TypeDescriptor declaringType) {
        this.name = name;
        this.declaringType = declaringType;
    }

    public String getName() {
        return name;
    }

    public TypeDescriptor getDeclaringType() {
        return declaringType;
    }

    /**
     * 先创建、后挂到类型上的成员（provided 声明）使用。
     */
    protected void setDeclaringType(TypeDescriptor declaringType) {
        this.declaringType = declaringType;
    }

    public abstract Kind getMemberKind();

    public abstract boolean isStatic();

    public abstract boolean isPublic();

    public boolean isHostDefined() {
        return false;
    }

    @Override
    public String toString() {
        return (declaringType != null ? declaringType + "." : "") + name;
    }
}
