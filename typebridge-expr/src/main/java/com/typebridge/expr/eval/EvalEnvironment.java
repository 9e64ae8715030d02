package com.typebridge.expr.eval;

import com.typebridge.expr.Var;

/**
 * 求值环境：不可变的绑定链，每个绑定的值可被 VarSet 原地修改。
 * 闭包捕获的是链本身，因此能看到之后对可变变量的赋值。
 */
public final class EvalEnvironment {

    private static final EvalEnvironment EMPTY = new EvalEnvironment(null, null, null);

    private final EvalEnvironment parent;
    private final Var var;
    private Object value;

    private EvalEnvironment(EvalEnvironment parent, Var var, Object value) {
        this.parent = parent;
        this.var = var;
        this.value = value;
    }

    public static EvalEnvironment empty() {
        return EMPTY;
    }

    public EvalEnvironment bind(Var var, Object value) {
        return new EvalEnvironment(this, var, value);
    }

    public Object lookup(Var var) {
        return find(var).value;
    }

    public void assign(Var var, Object value) {
        find(var).value = value;
    }

    public boolean isBound(Var var) {
        for (EvalEnvironment e = this; e != EMPTY; e = e.parent) {
            if (e.var == var) return true;
        }
        return false;
    }

    private EvalEnvironment find(Var var) {
        for (EvalEnvironment e = this; e != EMPTY; e = e.parent) {
            if (e.var == var) return e;
        }
        throw new EvaluationException("Unbound variable '" + var.getName() + "' (#" + var.getStamp() + ")");
    }
}
