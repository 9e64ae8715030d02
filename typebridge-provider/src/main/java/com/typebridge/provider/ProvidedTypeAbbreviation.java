package com.typebridge.provider;

import com.typebridge.model.ConstructorDescriptor;
import com.typebridge.model.FieldDescriptor;
import com.typebridge.model.MethodDescriptor;
import com.typebridge.model.PropertyDescriptor;
import com.typebridge.model.TypeDescriptor;

import java.util.List;

/**
 * 类型缩写：给已有类型起的别名。跨宇宙改写时原样通过，成员查询转发给被缩写的类型。
 */
public class ProvidedTypeAbbreviation extends TypeDescriptor {

    private final String namespace;
    private final String name;
    private final TypeDescriptor abbreviated;

    public ProvidedTypeAbbreviation(String namespace, String name, TypeDescriptor abbreviated) {
        if (abbreviated == null) {
            throw new IllegalArgumentException("Abbreviation '" + name + "' needs an abbreviated type");
        }
        this.namespace = namespace;
        this.name = name;
        this.abbreviated = abbreviated;
    }

    public TypeDescriptor getAbbreviatedType() {
        return abbreviated;
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public String getNamespace() {
        return namespace;
    }

    @Override
    public boolean isTypeAbbreviation() {
        return true;
    }

    @Override
    public TypeDescriptor getBaseType() {
        return abbreviated.getBaseType();
    }

    @Override
    public List<FieldDescriptor> getFields() {
        return abbreviated.getFields();
    }

    @Override
    public List<PropertyDescriptor> getProperties() {
        return abbreviated.getProperties();
    }

    @Override
    public List<MethodDescriptor> getMethods() {
        return abbreviated.getMethods();
    }

    @Override
    public List<ConstructorDescriptor> getConstructors() {
        return abbreviated.getConstructors();
    }
}
