package com.typebridge.expr;

import com.typebridge.expr.node.OperationExpr.Operator;
import com.typebridge.model.DefinedType;
import com.typebridge.model.InMemoryModule;
import com.typebridge.model.MethodDescriptor;
import com.typebridge.model.PrimitiveType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Collections;

import static org.assertj.core.api.Assertions.*;

@DisplayName("Exprs / UncheckedExprs 测试")
class ExprsTest {

    private final SampleTypes types = new SampleTypes();

    private MethodDescriptor twice() {
        return types.math.getMethod("Twice", Collections.singletonList(PrimitiveType.INT));
    }

    @Test
    @DisplayName("静态方法不能带 target")
    void staticCallWithTarget() {
        assertThatThrownBy(() -> Exprs.call(Exprs.value(1), twice(), Exprs.value(2)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("must not have a target");
    }

    @Test
    @DisplayName("参数个数不符")
    void argumentCount() {
        assertThatThrownBy(() -> Exprs.callStatic(twice()))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("expects 1 arguments, got 0");
    }

    @Test
    @DisplayName("参数类型不可赋值")
    void argumentType() {
        assertThatThrownBy(() -> Exprs.callStatic(twice(), Exprs.value(true)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("expected 'int', got 'boolean'");
    }

    @Test
    @DisplayName("另一个宇宙的同名类型被校验拒绝，原始构造照样接受")
    void foreignUniverse() {
        InMemoryModule foreign = new InMemoryModule("foreign");
        DefinedType foreignPoint = foreign.defineType("demo.Point").build();
        DefinedType takesPoint = types.module.defineType("demo.Canvas").method("Draw").asStatic()
                .parameter("p", types.point).add().build();
        MethodDescriptor draw = takesPoint.getMethods().get(0);
        Var p = new Var("p", foreignPoint);

        assertThatThrownBy(() -> Exprs.callStatic(draw, Exprs.var(p)))
                .isInstanceOf(IllegalArgumentException.class);
        Expr raw = UncheckedExprs.call(null, draw, Collections.singletonList(Exprs.var(p)));
        assertThat(raw.getType()).isEqualTo(PrimitiveType.VOID);
    }

    @Test
    @DisplayName("不可变变量不能赋值")
    void immutableAssignment() {
        Var x = new Var("x", PrimitiveType.INT);
        assertThatThrownBy(() -> Exprs.varSet(x, Exprs.value(1)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("not mutable");
    }

    @Test
    @DisplayName("比较运算结果为 boolean，算术运算沿用操作数类型")
    void operationTypes() {
        assertThat(Exprs.operation(Operator.LESS, Exprs.value(1), Exprs.value(2)).getType())
                .isEqualTo(PrimitiveType.BOOLEAN);
        assertThat(Exprs.operation(Operator.ADD, Exprs.value(1), Exprs.value(2)).getType())
                .isEqualTo(PrimitiveType.INT);
        assertThatThrownBy(() -> Exprs.operation(Operator.ADD, Exprs.value(1), Exprs.value(true)))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("函数应用的类型取自 Invoke 返回类型")
    void applicationType() {
        Var f = new Var("f", types.funcOf(PrimitiveType.INT, PrimitiveType.BOOLEAN));
        Expr app = Exprs.application(Exprs.var(f), Exprs.value(3));
        assertThat(app.getType()).isEqualTo(PrimitiveType.BOOLEAN);
        assertThat(app.getKind()).isEqualTo(ExprKind.APPLICATION);
    }

    @Test
    @DisplayName("元组投影取元素类型")
    void tupleGet() {
        Expr tuple = Exprs.newTuple(Exprs.value(1), Exprs.value(true));
        assertThat(Exprs.tupleGet(tuple, 1).getType()).isEqualTo(PrimitiveType.BOOLEAN);
        assertThatThrownBy(() -> Exprs.tupleGet(tuple, 2)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("打印形式稳定")
    void printing() {
        Var x = new Var("x", PrimitiveType.INT);
        Expr e = Exprs.let(x, Exprs.value(5), Exprs.callStatic(twice(), Exprs.var(x)));
        assertThat(e.toString()).isEqualTo("Let(x, Value(5), Call(demo.Math.Twice, [x]))");
        assertThat(Exprs.operation(Operator.NOT, Exprs.value(true)).toString()).isEqualTo("(not Value(true))");
    }
}
