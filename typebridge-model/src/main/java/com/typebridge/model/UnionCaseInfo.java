package com.typebridge.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 联合类型的一个用例：名称、标签号、字段和构造方法名。
 */
public final class UnionCaseInfo {

    private final TypeDescriptor declaringType;
    private final String name;
    private final int tag;
    private final List<ParameterInfo> fields;

    public UnionCaseInfo(TypeDescriptor declaringType, String name, int tag, List<? extends ParameterInfo> fields) {
        this.declaringType = declaringType;
        this.name = name;
        this.tag = tag;
        this.fields = Collections.unmodifiableList(new ArrayList<>(fields));
    }

    public TypeDescriptor getDeclaringType() {
        return declaringType;
    }

    public String getName() {
        return name;
    }

    public int getTag() {
        return tag;
    }

    public List<ParameterInfo> getFields() {
        return fields;
    }

    public List<TypeDescriptor> getFieldTypes() {
        List<TypeDescriptor> types = new ArrayList<>(fields.size());
        for (ParameterInfo f : fields) {
            types.add(f.getType());
        }
        return types;
    }

    /**
     * 用例构造方法名：New + 用例名。
     */
    public String getConstructorName() {
        return "New" + name;
    }

    UnionCaseInfo instantiate(TypeDescriptor declaringType, TypeSubstitution substitution) {
        return new UnionCaseInfo(declaringType, name, tag, substitution.applyParameters(fields));
    }

    @Override
    public String toString() {
        return declaringType + "." + name;
    }
}
