package com.typebridge.model.runtime;

/**
 * 一等函数值（单参数，柯里化形式）。
 */
@FunctionalInterface
public interface FunctionValue {

    Object apply(Object argument);
}
