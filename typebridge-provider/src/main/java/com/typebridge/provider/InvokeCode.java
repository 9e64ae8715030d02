package com.typebridge.provider;

import com.typebridge.expr.Expr;

import java.util.List;

/**
 * 声明体：由实参表达式生成结果表达式。实例成员的第一个实参是 this。
 */
@FunctionalInterface
public interface InvokeCode {

    Expr generate(List<Expr> args);
}
