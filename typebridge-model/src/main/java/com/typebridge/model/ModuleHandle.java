package com.typebridge.model;

import java.util.List;

/**
 * 模块句柄：类型/成员解析服务的能力接口。
 * <p>
 * 只要求两种查询："枚举模块中的全部类型" 和 "按全限定名取类型"。
 * 内存实现见 {@link InMemoryModule}，字节码实现见 typebridge-loader。
 */
public interface ModuleHandle {

    String getName();

    /**
     * 模块中定义的全部类型。
     */
    List<TypeDescriptor> getTypes();

    /**
     * 按全限定名查找类型，找不到返回 null。
     */
    TypeDescriptor findType(String fullName);
}
