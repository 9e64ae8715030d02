package com.typebridge.model.runtime;

import java.util.List;

/**
 * 委托值：一次接收全部参数。
 */
@FunctionalInterface
public interface DelegateValue {

    Object invoke(List<Object> args);
}
