package com.typebridge.model;

import com.typebridge.model.runtime.ObjectValue;
import com.typebridge.model.runtime.UnionValue;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * 内存类型构建器。
 * <p>
 * 联合类型在 {@link #build()} 时生成 New&lt;Case&gt; 静态构造方法和标签访问成员；
 * 记录类型生成按字段顺序的构造器和只读属性。生成的成员都带可执行实现。
 */
public final class TypeBuilder {

    private final DefinedType type;

    private TagAccessorKind tagAccessorKind;
    private final List<String> caseNames = new ArrayList<>();
    private final List<List<ParameterInfo>> caseFields = new ArrayList<>();
    private List<ParameterInfo> recordFields;

    TypeBuilder(DefinedType type) {
        this.type = type;
    }

    public DefinedType type() {
        return type;
    }

    /**
     * 以自身类型参数实例化的类型，用于成员签名中引用自己。
     */
    public TypeDescriptor self() {
        return type.getSelfType();
    }

    public GenericParameterType typeParameter(int position) {
        return type.getGenericParameter(position);
    }

    public TypeBuilder baseType(TypeDescriptor baseType) {
        type.setBaseType(baseType);
        return this;
    }

    public TypeBuilder implement(TypeDescriptor iface) {
        type.addInterface(iface);
        return this;
    }

    // ==================== 字段 ====================

    public TypeBuilder field(String name, TypeDescriptor fieldType) {
        return field(name, fieldType, false, true);
    }

    public TypeBuilder staticField(String name, TypeDescriptor fieldType) {
        return field(name, fieldType, true, true);
    }

    public TypeBuilder field(String name, TypeDescriptor fieldType, boolean isStatic, boolean isPublic) {
        type.addField(new FieldDescriptor(type, name, fieldType, isStatic, isPublic));
        return this;
    }

    // ==================== 属性 ====================

    public TypeBuilder property(String name, TypeDescriptor propertyType, MemberInvoker getter) {
        return property(name, propertyType, false, true, getter, null);
    }

    public TypeBuilder staticProperty(String name, TypeDescriptor propertyType, MemberInvoker getter) {
        return property(name, propertyType, true, true, getter, null);
    }

    /**
     * 由同名对象字段支撑的可读写实例属性。
     */
    public TypeBuilder autoProperty(String name, TypeDescriptor propertyType) {
        return property(name, propertyType, false, true,
                (target, args) -> ((ObjectValue) target).getField(name),
                (target, args) -> {
                    ((ObjectValue) target).setField(name, args.get(args.size() - 1));
                    return null;
                });
    }

    public TypeBuilder property(String name, TypeDescriptor propertyType, boolean isStatic, boolean isPublic,
                                MemberInvoker getter, MemberInvoker setter) {
        MethodDescriptor get = getter == null ? null : new MethodDescriptor(type, "get_" + name,
                Collections.emptyList(), propertyType, isStatic, isPublic, getter);
        MethodDescriptor set = setter == null ? null : new MethodDescriptor(type, "set_" + name,
                Collections.singletonList(new ParameterInfo("value", propertyType)),
                PrimitiveType.VOID, isStatic, isPublic, setter);
        type.addProperty(new PropertyDescriptor(type, name, propertyType, get, set, Collections.emptyList()));
        return this;
    }

    // ==================== 方法 / 构造器 ====================

    public MethodBuilder method(String name) {
        return new MethodBuilder(this, name);
    }

    public TypeBuilder constructor(MemberInvoker invoker, ParameterInfo... parameters) {
        type.addConstructor(new ConstructorDescriptor(type, Arrays.asList(parameters), true, invoker));
        return this;
    }

    // ==================== 联合 / 记录 ====================

    public TypeBuilder union(TagAccessorKind tagAccessorKind) {
        this.tagAccessorKind = tagAccessorKind;
        return this;
    }

    /**
     * 追加用例，标签号按声明顺序从 0 开始。
     */
    public TypeBuilder unionCase(String name, ParameterInfo... fields) {
        if (tagAccessorKind == null) {
            throw new IllegalStateException("Call union(...) before declaring cases of '" + type + "'");
        }
        caseNames.add(name);
        caseFields.add(Arrays.asList(fields));
        return this;
    }

    public TypeBuilder record(ParameterInfo... fields) {
        this.recordFields = Arrays.asList(fields);
        return this;
    }

    public DefinedType build() {
        if (tagAccessorKind != null) buildUnion();
        if (recordFields != null) buildRecord();
        return type;
    }

    private void buildUnion() {
        TypeDescriptor self = self();
        List<UnionCaseInfo> cases = new ArrayList<>();
        for (int i = 0; i < caseNames.size(); i++) {
            final String caseName = caseNames.get(i);
            final int tag = i;
            UnionCaseInfo info = new UnionCaseInfo(type, caseName, tag, caseFields.get(i));
            cases.add(info);
            type.addMethod(new MethodDescriptor(type, info.getConstructorName(), caseFields.get(i), self,
                    true, true, (target, args) -> new UnionValue(caseName, tag, args)));
        }
        String tagName;
        switch (tagAccessorKind) {
            case INSTANCE_PROPERTY:
                tagName = "Tag";
                property(tagName, PrimitiveType.INT, (target, args) -> ((UnionValue) target).getTag());
                break;
            case STATIC_METHOD:
                tagName = "GetTag";
                method(tagName).asStatic().parameter("value", self).returns(PrimitiveType.INT)
                        .invoker((target, args) -> ((UnionValue) args.get(0)).getTag())
                        .add();
                break;
            case INSTANCE_METHOD:
                tagName = "GetTag";
                method(tagName).returns(PrimitiveType.INT)
                        .invoker((target, args) -> ((UnionValue) target).getTag())
                        .add();
                break;
            case FIELD:
                tagName = "Tag";
                field(tagName, PrimitiveType.INT);
                break;
            default:
                throw new IllegalStateException("Unknown tag accessor kind: " + tagAccessorKind);
        }
        type.setUnionInfo(new UnionInfo(cases, tagAccessorKind, tagName));
    }

    private void buildRecord() {
        final List<ParameterInfo> fields = recordFields;
        final String typeName = type.getFullName();
        type.addConstructor(new ConstructorDescriptor(type, fields, true, (target, args) -> {
            ObjectValue value = new ObjectValue(typeName);
            for (int i = 0; i < fields.size(); i++) {
                value.setField(fields.get(i).getName(), args.get(i));
            }
            return value;
        }));
        for (ParameterInfo f : fields) {
            final String fieldName = f.getName();
            property(fieldName, f.getType(), (target, args) -> ((ObjectValue) target).getField(fieldName));
        }
        type.setRecordInfo(new RecordInfo(type, fields));
    }
}
