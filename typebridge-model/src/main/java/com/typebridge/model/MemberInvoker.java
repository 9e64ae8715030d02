package com.typebridge.model;

import java.util.List;

/**
 * 成员的可执行实现，供参考求值器调用。静态成员的 target 为 null。
 */
@FunctionalInterface
public interface MemberInvoker {

    Object invoke(Object target, List<Object> args);
}
