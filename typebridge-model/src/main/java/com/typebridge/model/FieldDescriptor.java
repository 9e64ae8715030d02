package com.typebridge.model;

/**
 * 字段。
 */
public class FieldDescriptor extends MemberDescriptor {

    private final TypeDescriptor fieldType;
    private final boolean isStatic;
    private final boolean isPublic;

    public FieldDescriptor(TypeDescriptor declaringType, String name, TypeDescriptor fieldType,
                           boolean isStatic, boolean isPublic) {
        super(name, declaringType);
        this.fieldType = fieldType;
        this.isStatic = isStatic;
        this.isPublic = isPublic;
    }

    public TypeDescriptor getFieldType() {
        return fieldType;
    }

    @Override
    public Kind getMemberKind() {
        return Kind.FIELD;
    }

    @Override
    public boolean isStatic() {
        return isStatic;
    }

    @Override
    public boolean isPublic() {
        return isPublic;
    }

    protected FieldDescriptor instantiate(TypeDescriptor declaringType, TypeSubstitution substitution) {
        return new FieldDescriptor(declaringType, getName(), substitution.apply(fieldType), isStatic, isPublic);
    }
}
