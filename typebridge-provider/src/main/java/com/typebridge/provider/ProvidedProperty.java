package com.typebridge.provider;

import com.typebridge.model.PrimitiveType;
import com.typebridge.model.PropertyDescriptor;
import com.typebridge.model.TypeDescriptor;

import java.util.Collections;

/**
 * 合成属性。getter/setter 是名为 get_X / set_X 的 {@link ProvidedMethod}。
 */
public class ProvidedProperty extends PropertyDescriptor implements ProvidedMember {

    public ProvidedProperty(String name, TypeDescriptor propertyType, boolean isStatic, InvokeCode getterCode) {
        this(name, propertyType, isStatic, getterCode, null);
    }

    public ProvidedProperty(String name, TypeDescriptor propertyType, boolean isStatic,
                            InvokeCode getterCode, InvokeCode setterCode) {
        super(null, name, propertyType,
                getterCode == null ? null : new ProvidedMethod("get_" + name,
                        Collections.<ProvidedParameter>emptyList(), propertyType, isStatic, getterCode),
                setterCode == null ? null : new ProvidedMethod("set_" + name,
                        Collections.singletonList(new ProvidedParameter("value", propertyType)),
                        PrimitiveType.VOID, isStatic, setterCode),
                null);
        if (getterCode == null && setterCode == null) {
            throw new IllegalArgumentException("Provided property '" + name + "' needs a getter or a setter");
        }
    }

    public ProvidedMethod getProvidedGetter() {
        return (ProvidedMethod) getGetter();
    }

    public ProvidedMethod getProvidedSetter() {
        return (ProvidedMethod) getSetter();
    }

    @Override
    public boolean isHostDefined() {
        return true;
    }

    @Override
    public void attachTo(TypeDescriptor owner) {
        setDeclaringType(owner);
        if (getGetter() != null) getProvidedGetter().attachTo(owner);
        if (getSetter() != null) getProvidedSetter().attachTo(owner);
    }
}
