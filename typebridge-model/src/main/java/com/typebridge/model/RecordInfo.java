package com.typebridge.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 记录类型元数据：按声明顺序的字段。
 */
public final class RecordInfo {

    private final TypeDescriptor declaringType;
    private final List<ParameterInfo> fields;

    public RecordInfo(TypeDescriptor declaringType, List<? extends ParameterInfo> fields) {
        this.declaringType = declaringType;
        this.fields = Collections.unmodifiableList(new ArrayList<>(fields));
    }

    public TypeDescriptor getDeclaringType() {
        return declaringType;
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

    RecordInfo instantiate(TypeDescriptor declaringType, TypeSubstitution substitution) {
        return new RecordInfo(declaringType, substitution.applyParameters(fields));
    }
}
