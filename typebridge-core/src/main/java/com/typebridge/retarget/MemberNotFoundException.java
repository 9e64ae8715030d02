package com.typebridge.retarget;

import com.typebridge.model.MemberDescriptor;
import com.typebridge.model.TypeDescriptor;

/**
 * 已解析的声明类型上找不到对应成员（属性、字段、方法或构造器）。
 */
public class MemberNotFoundException extends RetargetException {

    private final MemberDescriptor member;
    private final TypeDescriptor resolvedDeclaringType;

    public MemberNotFoundException(Direction direction, MemberDescriptor member, TypeDescriptor resolvedDeclaringType) {
        super(direction, message(member, resolvedDeclaringType));
        this.member = member;
        this.resolvedDeclaringType = resolvedDeclaringType;
    }

    private static String message(MemberDescriptor member, TypeDescriptor declaringType) {
        switch (member.getMemberKind()) {
            case PROPERTY:
                return "Property '" + member + "' of type '" + declaringType + "' not found";
            case FIELD:
                return "Field '" + member + "' of type '" + declaringType + "' not found";
            case CONSTRUCTOR:
                return "Constructor '" + member + "' not found in type '" + declaringType + "'";
            default:
                return "Method '" + member + "' not found in type '" + declaringType + "'";
        }
    }

    public MemberDescriptor getMember() {
        return member;
    }

    public MemberDescriptor.Kind getMemberKind() {
        return member.getMemberKind();
    }

    public TypeDescriptor getResolvedDeclaringType() {
        return resolvedDeclaringType;
    }
}
