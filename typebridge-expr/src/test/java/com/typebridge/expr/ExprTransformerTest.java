package com.typebridge.expr;

import com.typebridge.expr.node.CallExpr;
import com.typebridge.expr.node.IfThenElseExpr;
import com.typebridge.expr.node.LetExpr;
import com.typebridge.expr.node.OperationExpr.Operator;
import com.typebridge.expr.node.SequentialExpr;
import com.typebridge.expr.node.VarSetExpr;
import com.typebridge.model.MethodDescriptor;
import com.typebridge.model.PrimitiveType;
import com.typebridge.model.TypeDescriptor;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

@DisplayName("ExprTransformer 测试")
class ExprTransformerTest {

    private final SampleTypes types = new SampleTypes();

    private MethodDescriptor twice() {
        return types.math.getMethod("Twice", Collections.singletonList(PrimitiveType.INT));
    }

    /** 把每个变量换成同名的新变量。 */
    private static final class Renamer extends ExprTransformer {
        final Map<Var, Var> renamed = new HashMap<>();

        @Override
        protected Var transformVar(Var var) {
            return renamed.computeIfAbsent(var, v -> new Var(v.getName() + "'", v.getType(), v.isMutable()));
        }
    }

    @Test
    @DisplayName("无变化时返回原节点")
    void identity() {
        Var x = new Var("x", PrimitiveType.INT);
        Expr e = Exprs.let(x, Exprs.value(1),
                Exprs.ifThenElse(Exprs.operation(Operator.GREATER, Exprs.var(x), Exprs.value(0)),
                        Exprs.callStatic(twice(), Exprs.var(x)), Exprs.value(0)));
        assertThat(new ExprTransformer().transform(e)).isSameAs(e);
    }

    @Test
    @DisplayName("只重建发生变化的路径")
    void copyOnChange() {
        Var x = new Var("x", PrimitiveType.INT);
        Expr untouched = Exprs.callStatic(twice(), Exprs.value(3));
        Expr e = Exprs.ifThenElse(Exprs.value(true), Exprs.var(x), untouched);

        IfThenElseExpr result = (IfThenElseExpr) new Renamer().transform(e);
        assertThat(result).isNotSameAs(e);
        assertThat(result.getElseExpr()).isSameAs(untouched);
        assertThat(result.getCondition()).isSameAs(((IfThenElseExpr) e).getCondition());
    }

    @Test
    @DisplayName("同一变量的所有引用改写成同一个新变量")
    void consistentVariables() {
        Var x = new Var("x", PrimitiveType.INT, true);
        Expr e = Exprs.let(x, Exprs.value(1), Exprs.sequential(Exprs.varSet(x, Exprs.value(2)), Exprs.var(x)));

        Renamer renamer = new Renamer();
        LetExpr result = (LetExpr) renamer.transform(e);
        Var renamed = renamer.renamed.get(x);
        assertThat(result.getVar()).isSameAs(renamed);
        assertThat(result.toString()).isEqualTo("Let(x', Value(1), Sequential(VarSet(x', Value(2)), x'))");
        VarSetExpr set = (VarSetExpr) ((SequentialExpr) result.getBody()).getFirst();
        assertThat(set.getVar()).isSameAs(renamed);
    }

    @Test
    @DisplayName("成员钩子替换方法引用")
    void methodHook() {
        MethodDescriptor replacement = types.module.defineType("demo.Other").method("Twice").asStatic()
                .parameter("x", PrimitiveType.INT).returns(PrimitiveType.LONG).add().build().getMethods().get(0);
        ExprTransformer swap = new ExprTransformer() {
            @Override
            protected MethodDescriptor transformMethod(MethodDescriptor method) {
                return method == twice() ? replacement : method;
            }
        };
        CallExpr result = (CallExpr) swap.transform(Exprs.callStatic(twice(), Exprs.value(3)));
        assertThat(result.getMethod()).isSameAs(replacement);
        assertThat(result.getType()).isEqualTo(PrimitiveType.LONG);
    }

    @Test
    @DisplayName("类型钩子作用于强转和数组元素类型")
    void typeHook() {
        ExprTransformer widen = new ExprTransformer() {
            @Override
            protected TypeDescriptor transformType(TypeDescriptor type) {
                return type == PrimitiveType.INT ? PrimitiveType.LONG : type;
            }
        };
        Expr coerce = widen.transform(Exprs.coerce(Exprs.value(1), PrimitiveType.INT));
        Expr array = widen.transform(Exprs.newArray(PrimitiveType.INT, Exprs.value(1)));
        assertThat(coerce.getType()).isEqualTo(PrimitiveType.LONG);
        assertThat(array.getType()).isEqualTo(PrimitiveType.LONG.makeArrayType());
    }
}
