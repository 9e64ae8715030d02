package com.typebridge.model.runtime;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 联合类型的值：用例名、标签号和字段值。
 */
public final class UnionValue {

    private final String caseName;
    private final int tag;
    private final List<Object> fields;

    public UnionValue(String caseName, int tag, List<Object> fields) {
        this.caseName = caseName;
        this.tag = tag;
        this.fields = Collections.unmodifiableList(new ArrayList<>(fields));
    }

    public String getCaseName() {
        return caseName;
    }

    public int getTag() {
        return tag;
    }

    public List<Object> getFields() {
        return fields;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof UnionValue)) return false;
        UnionValue other = (UnionValue) o;
        return tag == other.tag && caseName.equals(other.caseName) && fields.equals(other.fields);
    }

    @Override
    public int hashCode() {
        return (caseName.hashCode() * 31 + tag) * 31 + fields.hashCode();
    }

    @Override
    public String toString() {
        return fields.isEmpty() ? caseName : caseName + fields;
    }
}
