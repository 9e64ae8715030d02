package com.typebridge.model.runtime;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 对象实例：类型名 + 字段表。记录值也用它表示。
 */
public final class ObjectValue {

    private final String typeName;
    private final Map<String, Object> fields = new LinkedHashMap<>();

    public ObjectValue(String typeName) {
        this.typeName = typeName;
    }

    public String getTypeName() {
        return typeName;
    }

    public Object getField(String name) {
        if (!fields.containsKey(name)) {
            throw new IllegalStateException("Object of type '" + typeName + "' has no field '" + name + "'");
        }
        return fields.get(name);
    }

    public void setField(String name, Object value) {
        fields.put(name, value);
    }

    public boolean hasField(String name) {
        return fields.containsKey(name);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ObjectValue)) return false;
        ObjectValue other = (ObjectValue) o;
        return typeName.equals(other.typeName) && fields.equals(other.fields);
    }

    @Override
    public int hashCode() {
        return typeName.hashCode() * 31 + fields.hashCode();
    }

    @Override
    public String toString() {
        return typeName + fields;
    }
}
