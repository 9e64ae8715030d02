package com.typebridge.provider;

import com.typebridge.model.TypeDescriptor;

/**
 * 先创建、后挂到 {@link ProvidedTypeDefinition} 上的合成成员。
 */
public interface ProvidedMember {

    void attachTo(TypeDescriptor owner);
}
