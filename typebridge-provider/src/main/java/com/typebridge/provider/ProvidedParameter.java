package com.typebridge.provider;

import com.typebridge.model.ParameterInfo;
import com.typebridge.model.TypeDescriptor;

/**
 * 合成成员的参数，可带默认值。
 */
public class ProvidedParameter extends ParameterInfo {

    private final boolean optional;
    private final Object defaultValue;

    public ProvidedParameter(String name, TypeDescriptor type) {
        super(name, type);
        this.optional = false;
        this.defaultValue = null;
    }

    public ProvidedParameter(String name, TypeDescriptor type, Object defaultValue) {
        super(name, type);
        this.optional = true;
        this.defaultValue = defaultValue;
    }

    public boolean isOptional() {
        return optional;
    }

    public Object getDefaultValue() {
        return defaultValue;
    }

    @Override
    public String toString() {
        return optional ? "?" + super.toString() : super.toString();
    }
}
