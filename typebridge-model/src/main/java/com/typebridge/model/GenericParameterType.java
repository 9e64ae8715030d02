package com.typebridge.model;

/**
 * 未绑定的泛型参数。
 * <p>
 * 与签名编码（!0 / !!0）一致：按"类型级还是方法级"加位置比较，名称只用于显示。
 */
public final class GenericParameterType extends TypeDescriptor {

    private final String name;
    private final int position;
    private final boolean methodParameter;

    public GenericParameterType(String name, int position, boolean methodParameter) {
        this.name = name;
        this.position = position;
        this.methodParameter = methodParameter;
    }

    @Override
    public String getName() {
        return name;
    }

    public int getPosition() {
        return position;
    }

    public boolean isMethodParameter() {
        return methodParameter;
    }

    @Override
    public boolean isGenericParameter() {
        return true;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof GenericParameterType)) return false;
        GenericParameterType other = (GenericParameterType) o;
        return position == other.position && methodParameter == other.methodParameter;
    }

    @Override
    public int hashCode() {
        return position * 31 + (methodParameter ? 1 : 0);
    }
}
