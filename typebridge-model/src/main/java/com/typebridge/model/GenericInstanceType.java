package com.typebridge.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 泛型实例：定义 + 类型实参。
 * 成员、联合用例和记录字段都以替换后的签名暴露，首次访问时生成。
 */
public final class GenericInstanceType extends TypeDescriptor {

    private final TypeDescriptor definition;
    private final List<TypeDescriptor> arguments;
    private final TypeSubstitution substitution;

    private List<FieldDescriptor> fields;
    private List<PropertyDescriptor> properties;
    private List<MethodDescriptor> methods;
    private List<ConstructorDescriptor> constructors;
    private UnionInfo unionInfo;
    private RecordInfo recordInfo;

    GenericInstanceType(TypeDescriptor definition, List<? extends TypeDescriptor> arguments) {
        this.definition = definition;
        this.arguments = Collections.unmodifiableList(new ArrayList<>(arguments));
        this.substitution = TypeSubstitution.forType(this.arguments);
    }

    @Override
    public String getName() {
        return definition.getName();
    }

    @Override
    public String getNamespace() {
        return definition.getNamespace();
    }

    @Override
    public ModuleHandle getModule() {
        return definition.getModule();
    }

    @Override
    public boolean isGenericType() {
        return true;
    }

    @Override
    public TypeDescriptor getGenericTypeDefinition() {
        return definition;
    }

    @Override
    public List<TypeDescriptor> getGenericArguments() {
        return arguments;
    }

    @Override
    public TypeDescriptor getBaseType() {
        return substitution.apply(definition.getBaseType());
    }

    @Override
    public List<TypeDescriptor> getInterfaces() {
        return substitution.applyAll(definition.getInterfaces());
    }

    @Override
    public List<FieldDescriptor> getFields() {
        if (fields == null) {
            List<FieldDescriptor> result = new ArrayList<>();
            for (FieldDescriptor f : definition.getFields()) {
                result.add(f.instantiate(this, substitution));
            }
            fields = Collections.unmodifiableList(result);
        }
        return fields;
    }

    @Override
    public List<PropertyDescriptor> getProperties() {
        if (properties == null) {
            List<PropertyDescriptor> result = new ArrayList<>();
            for (PropertyDescriptor p : definition.getProperties()) {
                result.add(p.instantiate(this, substitution));
            }
            properties = Collections.unmodifiableList(result);
        }
        return properties;
    }

    @Override
    public List<MethodDescriptor> getMethods() {
        if (methods == null) {
            List<MethodDescriptor> result = new ArrayList<>();
            for (MethodDescriptor m : definition.getMethods()) {
                result.add(m.instantiate(this, substitution));
            }
            methods = Collections.unmodifiableList(result);
        }
        return methods;
    }

    @Override
    public List<ConstructorDescriptor> getConstructors() {
        if (constructors == null) {
            List<ConstructorDescriptor> result = new ArrayList<>();
            for (ConstructorDescriptor c : definition.getConstructors()) {
                result.add(c.instantiate(this, substitution));
            }
            constructors = Collections.unmodifiableList(result);
        }
        return constructors;
    }

    @Override
    public UnionInfo getUnionInfo() {
        if (unionInfo == null && definition.getUnionInfo() != null) {
            unionInfo = definition.getUnionInfo().instantiate(this, substitution);
        }
        return unionInfo;
    }

    @Override
    public RecordInfo getRecordInfo() {
        if (recordInfo == null && definition.getRecordInfo() != null) {
            recordInfo = definition.getRecordInfo().instantiate(this, substitution);
        }
        return recordInfo;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof GenericInstanceType)) return false;
        GenericInstanceType other = (GenericInstanceType) o;
        return definition.equals(other.definition) && arguments.equals(other.arguments);
    }

    @Override
    public int hashCode() {
        return definition.hashCode() * 31 + arguments.hashCode();
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(definition.getFullName());
        sb.append('<');
        for (int i = 0; i < arguments.size(); i++) {
            if (i > 0) sb.append(", ");
            sb.append(arguments.get(i));
        }
        return sb.append('>').toString();
    }
}
