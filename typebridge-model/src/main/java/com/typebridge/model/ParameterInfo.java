package com.typebridge.model;

/**
 * 参数（或联合用例/记录字段）的名称与类型。
 */
public class ParameterInfo {

    private final String name;
    private final TypeDescriptor type;

    public ParameterInfo(String name, TypeDescriptor type) {
        this.name = name;
        this.type = type;
    }

    public static ParameterInfo of(String name, TypeDescriptor type) {
        return new ParameterInfo(name, type);
    }

    public String getName() {
        return name;
    }

    public TypeDescriptor getType() {
        return type;
    }

    @Override
    public String toString() {
        return name + ": " + type;
    }
}
