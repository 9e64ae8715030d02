package com.typebridge.model;

import java.util.Collections;
import java.util.EnumSet;

/**
 * 联合/记录类型的预计算查询：用例构造方法、记录构造器、标签访问成员。
 */
public final class DataTypeReflection {

    private DataTypeReflection() {
    }

    public static boolean isUnion(TypeDescriptor type) {
        return type != null && type.getUnionInfo() != null;
    }

    public static boolean isRecord(TypeDescriptor type) {
        return type != null && type.getRecordInfo() != null;
    }

    /**
     * 用例的静态构造方法（New&lt;Case&gt;）。
     */
    public static MethodDescriptor precomputeUnionConstructor(UnionCaseInfo unionCase) {
        TypeDescriptor declaring = unionCase.getDeclaringType();
        MethodDescriptor ctor = declaring.getMethod(unionCase.getConstructorName(), unionCase.getFieldTypes());
        if (ctor == null || !ctor.isStatic()) {
            throw new IllegalArgumentException("Union case '" + unionCase + "' has no static constructor method '"
                    + unionCase.getConstructorName() + "'");
        }
        return ctor;
    }

    public static ConstructorDescriptor precomputeRecordConstructor(TypeDescriptor recordType) {
        RecordInfo info = recordType.getRecordInfo();
        if (info == null) {
            throw new IllegalArgumentException("Type '" + recordType + "' is not a record type");
        }
        ConstructorDescriptor ctor = recordType.getConstructor(info.getFieldTypes());
        if (ctor == null) {
            throw new IllegalArgumentException("Record type '" + recordType + "' has no constructor taking its fields");
        }
        return ctor;
    }

    /**
     * 读取标签的成员：属性、方法（静态或实例）或字段，取决于联合类型的声明方式。
     */
    public static MemberDescriptor precomputeUnionTagMember(TypeDescriptor unionType) {
        UnionInfo info = unionType.getUnionInfo();
        if (info == null) {
            throw new IllegalArgumentException("Type '" + unionType + "' is not a union type");
        }
        String name = info.getTagMemberName();
        MemberDescriptor member;
        switch (info.getTagAccessorKind()) {
            case INSTANCE_PROPERTY:
                member = unionType.getProperty(name, EnumSet.of(BindingFlag.PUBLIC, BindingFlag.INSTANCE));
                break;
            case STATIC_METHOD:
                member = unionType.getMethod(name, Collections.singletonList(unionType));
                break;
            case INSTANCE_METHOD:
                member = unionType.getMethod(name, Collections.emptyList());
                break;
            case FIELD:
                member = unionType.getField(name, EnumSet.of(BindingFlag.PUBLIC, BindingFlag.INSTANCE));
                break;
            default:
                throw new IllegalStateException("Unknown tag accessor kind: " + info.getTagAccessorKind());
        }
        if (member == null) {
            throw new IllegalArgumentException("Union type '" + unionType + "' has no tag member '" + name + "'");
        }
        return member;
    }
}
