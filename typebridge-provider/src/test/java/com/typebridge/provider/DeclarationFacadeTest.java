package com.typebridge.provider;

import com.typebridge.expr.Expr;
import com.typebridge.expr.Exprs;
import com.typebridge.expr.UncheckedExprs;
import com.typebridge.expr.Var;
import com.typebridge.expr.eval.ExprEvaluator;
import com.typebridge.expr.node.NewObjectExpr;
import com.typebridge.expr.node.VarExpr;
import com.typebridge.model.DefinedType;
import com.typebridge.model.InMemoryModule;
import com.typebridge.model.MemberDescriptor;
import com.typebridge.model.PrimitiveType;
import com.typebridge.model.runtime.ObjectValue;
import com.typebridge.retarget.Direction;
import com.typebridge.retarget.RetargetException;
import com.typebridge.retarget.TypeNotFoundException;
import com.typebridge.retarget.UniverseReplacer;
import com.typebridge.retarget.UnsupportedConstructException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

@DisplayName("DeclarationFacade 测试")
class DeclarationFacadeTest {

    private ProviderFixture f;
    private UniverseReplacer replacer;
    private DeclarationFacade facade;
    private ExprEvaluator evaluator;

    @BeforeEach
    void setUp() {
        f = new ProviderFixture();
        replacer = f.replacer();
        facade = new DeclarationFacade(replacer);
        evaluator = new ExprEvaluator();
    }

    private static List<Expr> noArgs() {
        return Collections.emptyList();
    }

    private Expr splice(Expr expr) {
        return new ProvidedCodeSplicer().transform(expr);
    }

    @Nested
    @DisplayName("签名")
    class Signatures {

        @Test
        @DisplayName("参数、结果、属性类型都正向改写")
        void signatureTypesAreRetargeted() {
            ProvidedParameter p = facade.parameter("p", f.designTime.point);
            ProvidedMethod m = facade.method("Mirror", Collections.singletonList(p),
                    f.designTime.list.makeGenericType(f.designTime.point), true, args -> args.get(0));
            ProvidedProperty prop = facade.property("Origin", f.designTime.point, true,
                    args -> Exprs.newRecord(f.designTime.point, Exprs.value(0), Exprs.value(0)));

            assertThat(p.getType()).isSameAs(f.runtime.point);
            assertThat(p.isOptional()).isFalse();
            assertThat(m.getReturnType()).isEqualTo(f.runtime.list.makeGenericType(f.runtime.point));
            assertThat(m.isStatic()).isTrue();
            assertThat(m.isHostDefined()).isTrue();
            assertThat(prop.getPropertyType()).isSameAs(f.runtime.point);
            assertThat(prop.getGetter().getName()).isEqualTo("get_Origin");
            assertThat(prop.isStatic()).isTrue();
            assertThat(prop.canWrite()).isFalse();
        }

        @Test
        @DisplayName("可选参数保留默认值")
        void optionalParameter() {
            ProvidedParameter p = facade.optionalParameter("count", PrimitiveType.INT, 10);
            assertThat(p.isOptional()).isTrue();
            assertThat(p.getDefaultValue()).isEqualTo(10);
            assertThat(p.getType()).isSameAs(PrimitiveType.INT);
        }

        @Test
        @DisplayName("类型定义的基类在目标宇宙")
        void typeDefinitions() {
            InMemoryModule generated = new InMemoryModule("generated");
            ProvidedTypeDefinition t = facade.typeDefinition(generated, "demo.generated", "Shapes",
                    f.designTime.object, true, true);
            ProvidedTypeDefinition nested = facade.typeDefinition("Inner", f.designTime.point, false, false);

            assertThat(t.getBaseType()).isSameAs(f.runtime.object);
            assertThat(t.getModule()).isSameAs(generated);
            assertThat(t.getFullName()).isEqualTo("demo.generated.Shapes");
            assertThat(t.isHideObjectMethods()).isTrue();
            assertThat(t.isNonNullable()).isTrue();
            assertThat(nested.getBaseType()).isSameAs(f.runtime.point);
            assertThat(nested.getFullName()).isEqualTo("Inner");
            assertThat(nested.getModule()).isNull();
        }

        @Test
        @DisplayName("签名中的类型在目标宇宙缺失时声明即失败")
        void missingSignatureType() {
            DefinedType local = f.designTime.module.defineType("demo.DesignOnly").build();
            assertThatThrownBy(() -> facade.parameter("x", local))
                    .isInstanceOf(TypeNotFoundException.class)
                    .hasMessageContaining("demo.DesignOnly");
        }
    }

    @Nested
    @DisplayName("声明体")
    class Bodies {

        @Test
        @DisplayName("实参先反向改写，结果再正向改写")
        void argumentsAndResultCrossTheBoundary() {
            List<Var> seen = new ArrayList<>();
            ProvidedMethod m = facade.method("Pass", Collections.singletonList(
                    facade.parameter("p", f.designTime.point)), f.designTime.point, true, args -> {
                        seen.add(((VarExpr) args.get(0)).getVar());
                        return args.get(0);
                    });
            Var p = new Var("p", f.runtime.point);
            Expr result = m.generateCode(Collections.singletonList(Exprs.var(p)));

            assertThat(seen).hasSize(1);
            assertThat(seen.get(0)).isNotSameAs(p);
            assertThat(seen.get(0).getType()).isSameAs(f.designTime.point);
            assertThat(((VarExpr) result).getVar()).isSameAs(p);
        }

        @Test
        @DisplayName("每次展开给用户代码新的变量")
        void freshVariablesPerInvocation() {
            List<Var> seen = new ArrayList<>();
            ProvidedMethod m = facade.method("Pass", Collections.singletonList(
                    facade.parameter("n", PrimitiveType.INT)), PrimitiveType.INT, true, args -> {
                        seen.add(((VarExpr) args.get(0)).getVar());
                        return args.get(0);
                    });
            Var n = new Var("n", PrimitiveType.INT);
            m.generateCode(Collections.singletonList(Exprs.var(n)));
            m.generateCode(Collections.singletonList(Exprs.var(n)));

            assertThat(seen.get(0)).isNotSameAs(seen.get(1));
            assertThat(replacer.rewriteVar(Direction.FORWARD, seen.get(1))).isSameAs(n);
        }

        @Test
        @DisplayName("静态方法展开后在目标宇宙求值")
        void staticMethodSplicedAndEvaluated() {
            ProvidedMethod diagonal = facade.method("Diagonal", Collections.singletonList(
                    facade.parameter("n", PrimitiveType.INT)), f.designTime.point, true,
                    args -> Exprs.newRecord(f.designTime.point, args.get(0), args.get(0)));

            Expr spliced = splice(UncheckedExprs.call(null, diagonal, Collections.singletonList(Exprs.value(7))));

            assertThat(spliced).isInstanceOf(NewObjectExpr.class);
            assertThat(((NewObjectExpr) spliced).getConstructor().getDeclaringType()).isSameAs(f.runtime.point);
            ObjectValue point = (ObjectValue) evaluator.evaluate(spliced);
            assertThat(point.getField("X")).isEqualTo(7);
            assertThat(point.getField("Y")).isEqualTo(7);
        }

        @Test
        @DisplayName("实例成员的 this 是合成类型，原样往返")
        void thisPassesThrough() {
            ProvidedTypeDefinition t = facade.typeDefinition("Shapes", f.designTime.object, false, false);
            ProvidedMethod self = facade.method("Self", Collections.<ProvidedParameter>emptyList(), t, false,
                    args -> args.get(0));
            t.addMember(self);
            Expr thisExpr = Exprs.var(new Var("this", t));

            assertThat(self.getReturnType()).isSameAs(t);
            assertThat(self.generateCode(Collections.singletonList(thisExpr))).isSameAs(thisExpr);
        }

        @Test
        @DisplayName("属性 getter 与构造器展开")
        void propertyAndConstructor() {
            ProvidedTypeDefinition t = facade.typeDefinition("Points", f.designTime.object, true, false);
            ProvidedProperty origin = facade.property("Origin", f.designTime.point, true,
                    args -> Exprs.newRecord(f.designTime.point, Exprs.value(0), Exprs.value(0)));
            ProvidedConstructor ctor = facade.constructor(
                    Collections.singletonList(facade.parameter("seed", PrimitiveType.INT)),
                    args -> Exprs.newRecord(f.designTime.point, args.get(0), Exprs.value(1)));
            t.addMember(origin).addMember(ctor);

            Object atOrigin = evaluator.evaluate(splice(
                    UncheckedExprs.propertyGet(null, origin, noArgs())));
            Object seeded = evaluator.evaluate(splice(
                    UncheckedExprs.newObject(ctor, Collections.singletonList(Exprs.value(3)))));

            assertThat(((ObjectValue) atOrigin).getField("X")).isEqualTo(0);
            assertThat(((ObjectValue) seeded).getField("X")).isEqualTo(3);
            assertThat(((ObjectValue) seeded).getField("Y")).isEqualTo(1);
        }

        @Test
        @DisplayName("嵌套的合成调用一并展开")
        void nestedProvidedCalls() {
            ProvidedMethod inner = facade.method("Inner", Collections.singletonList(
                    facade.parameter("n", PrimitiveType.INT)), f.designTime.point, true,
                    args -> Exprs.newRecord(f.designTime.point, args.get(0), Exprs.value(2)));
            ProvidedMethod outer = facade.method("Outer", Collections.<ProvidedParameter>emptyList(),
                    f.designTime.point, true,
                    args -> UncheckedExprs.call(null, inner, Collections.singletonList(Exprs.value(9))));

            Object value = evaluator.evaluate(splice(UncheckedExprs.call(null, outer, noArgs())));
            assertThat(((ObjectValue) value).getField("X")).isEqualTo(9);
        }

        @Test
        @DisplayName("自我递归的声明体被截断")
        void selfRecursionDetected() {
            ProvidedMethod[] holder = new ProvidedMethod[1];
            holder[0] = facade.method("Loop", Collections.<ProvidedParameter>emptyList(), PrimitiveType.INT, true,
                    args -> UncheckedExprs.call(null, holder[0], noArgs()));

            assertThatThrownBy(() -> splice(UncheckedExprs.call(null, holder[0], noArgs())))
                    .isInstanceOf(IllegalStateException.class)
                    .hasMessageContaining("self-recursive");
        }

        @Test
        @DisplayName("声明体中的 lambda 在展开时被拒绝")
        void lambdaInBody() {
            ProvidedMethod m = facade.method("Curried", Collections.<ProvidedParameter>emptyList(),
                    PrimitiveType.INT, true, args -> {
                        Var x = new Var("x", PrimitiveType.INT);
                        Var g = new Var("g", f.designTime.list.makeGenericType(PrimitiveType.INT));
                        return Exprs.let(g, UncheckedExprs.lambda(x, Exprs.var(x), g.getType()), Exprs.value(0));
                    });

            assertThatThrownBy(() -> m.generateCode(noArgs()))
                    .isInstanceOf(UnsupportedConstructException.class)
                    .satisfies(e -> assertThat(((RetargetException) e).getDirection()).isEqualTo(Direction.FORWARD));
        }
    }

    @Nested
    @DisplayName("合成类型")
    class ProvidedTypes {

        @Test
        @DisplayName("隐藏对象身份方法")
        void hideObjectMethods() {
            ProvidedTypeDefinition hidden = facade.typeDefinition("Hidden", f.designTime.object, true, false);
            hidden.addMember(facade.method("Area", Collections.<ProvidedParameter>emptyList(),
                    PrimitiveType.INT, false, args -> Exprs.value(1)));

            assertThat(names(hidden.getPresentedMembers())).containsExactly("Area", "Describe");

            ProvidedTypeDefinition shown = facade.typeDefinition("Shown", f.designTime.object, false, false);
            assertThat(names(shown.getPresentedMembers()))
                    .containsExactly("ToString", "Equals", "GetHashCode", "Describe");
        }

        @Test
        @DisplayName("自身成员遮蔽基类同签名方法")
        void ownMembersShadowInherited() {
            ProvidedTypeDefinition t = facade.typeDefinition("Custom", f.designTime.object, false, false);
            t.addMember(facade.method("ToString", Collections.<ProvidedParameter>emptyList(),
                    f.designTime.object, false, args -> args.get(0)));

            List<MemberDescriptor> presented = t.getPresentedMembers();
            assertThat(names(presented)).containsExactly("ToString", "Equals", "GetHashCode", "Describe");
            assertThat(presented.get(0).getDeclaringType()).isSameAs(t);
        }

        @Test
        @DisplayName("合成类型与类型缩写跨宇宙原样通过")
        void hostDefinedTypesPassThrough() {
            ProvidedTypeDefinition t = facade.typeDefinition("Shapes", f.designTime.object, true, false);
            ProvidedTypeAbbreviation alias = new ProvidedTypeAbbreviation("demo", "Coordinates", f.designTime.point);

            assertThat(replacer.typeToTarget(t)).isSameAs(t);
            assertThat(replacer.typeToOrigin(t)).isSameAs(t);
            assertThat(replacer.typeToTarget(alias)).isSameAs(alias);
            assertThat(replacer.typeToTarget(f.designTime.list.makeGenericType(t)))
                    .isEqualTo(f.runtime.list.makeGenericType(t));
            assertThat(alias.getProperties()).isEqualTo(f.designTime.point.getProperties());
            assertThat(alias.getFullName()).isEqualTo("demo.Coordinates");
        }

        @Test
        @DisplayName("挂载成员时设置声明类型")
        void attachSetsDeclaringType() {
            ProvidedTypeDefinition t = facade.typeDefinition("Holder", f.designTime.object, false, false);
            ProvidedProperty p = facade.property("Size", PrimitiveType.INT, args -> Exprs.value(4));
            t.addMembers(Arrays.<ProvidedMember>asList(p, facade.constructor(Collections.<ProvidedParameter>emptyList(),
                    args -> Exprs.value(0))));

            assertThat(p.getDeclaringType()).isSameAs(t);
            assertThat(p.getGetter().getDeclaringType()).isSameAs(t);
            assertThat(t.getConstructors()).hasSize(1);
            assertThat(t.getConstructors().get(0).getDeclaringType()).isSameAs(t);
        }

        @Test
        @DisplayName("属性至少需要一个访问器")
        void propertyNeedsAccessor() {
            assertThatThrownBy(() -> new ProvidedProperty("Empty", PrimitiveType.INT, false, null, null))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("getter or a setter");
        }
    }

    private static List<String> names(List<MemberDescriptor> members) {
        List<String> names = new ArrayList<>();
        for (MemberDescriptor m : members) {
            names.add(m.getName());
        }
        return names;
    }
}
