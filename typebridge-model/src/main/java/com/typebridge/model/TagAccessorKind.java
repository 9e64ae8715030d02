package com.typebridge.model;

/**
 * 联合类型读取用例标签的方式。
 */
public enum TagAccessorKind {
    /** 实例属性，如 x.Tag */
    INSTANCE_PROPERTY,
    /** 静态方法，如 Option.GetTag(x)；用 null 表示用例的联合类型只能这样取标签 */
    STATIC_METHOD,
    /** 实例方法，如 x.GetTag() */
    INSTANCE_METHOD,
    /** 公共实例字段 */
    FIELD
}
