package com.typebridge.model;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.EnumSet;

import static org.assertj.core.api.Assertions.*;

@DisplayName("TypeDescriptor 测试")
class TypeDescriptorTest {

    private InMemoryModule core;
    private DefinedType list;
    private DefinedType map;

    @BeforeEach
    void setUp() {
        core = new InMemoryModule("core");
        TypeBuilder listBuilder = core.defineType("demo.collections.List", "T");
        listBuilder.method("Get").parameter("index", PrimitiveType.INT).returns(listBuilder.typeParameter(0)).add()
                .property("Count", PrimitiveType.INT, (target, args) -> 0);
        list = listBuilder.build();
        map = core.defineType("demo.collections.Map", "K", "V").build();
    }

    @Nested
    @DisplayName("名称")
    class Names {

        @Test
        @DisplayName("全名由命名空间和简单名组成")
        void fullName() {
            assertThat(list.getNamespace()).isEqualTo("demo.collections");
            assertThat(list.getName()).isEqualTo("List");
            assertThat(list.getFullName()).isEqualTo("demo.collections.List");
        }

        @Test
        @DisplayName("数组保留秩，多维数组带逗号")
        void arrayNames() {
            assertThat(PrimitiveType.INT.makeArrayType().getFullName()).isEqualTo("int[]");
            assertThat(PrimitiveType.INT.makeArrayType(2).getFullName()).isEqualTo("int[,]");
            assertThat(PrimitiveType.INT.makeArrayType(3).getArrayRank()).isEqualTo(3);
        }

        @Test
        @DisplayName("泛型实例打印实参")
        void genericInstanceName() {
            TypeDescriptor t = list.makeGenericType(map.makeGenericType(PrimitiveType.INT, PrimitiveType.LONG));
            assertThat(t.toString()).isEqualTo("demo.collections.List<demo.collections.Map<int, long>>");
        }

        @Test
        @DisplayName("元组打印元素类型")
        void tupleName() {
            assertThat(TupleType.of(PrimitiveType.INT, PrimitiveType.BOOLEAN).getFullName())
                    .isEqualTo("(int, boolean)");
        }
    }

    @Nested
    @DisplayName("相等性")
    class Equality {

        @Test
        @DisplayName("构造类型按结构比较")
        void constructedTypesAreStructural() {
            assertThat(list.makeGenericType(PrimitiveType.INT)).isEqualTo(list.makeGenericType(PrimitiveType.INT));
            assertThat(list.makeArrayType(2)).isEqualTo(list.makeArrayType(2));
            assertThat(list.makeArrayType(2)).isNotEqualTo(list.makeArrayType(1));
            assertThat(PrimitiveType.INT.makeByRefType()).isEqualTo(PrimitiveType.INT.makeByRefType());
            assertThat(PrimitiveType.INT.makePointerType()).isNotEqualTo(PrimitiveType.INT.makeByRefType());
        }

        @Test
        @DisplayName("同名定义按引用比较")
        void definitionsAreIdentity() {
            InMemoryModule other = new InMemoryModule("other");
            DefinedType twin = other.defineType("demo.collections.List", "T").build();
            assertThat(twin.getFullName()).isEqualTo(list.getFullName());
            assertThat(twin).isNotEqualTo(list);
            assertThat(twin.makeGenericType(PrimitiveType.INT)).isNotEqualTo(list.makeGenericType(PrimitiveType.INT));
        }

        @Test
        @DisplayName("泛型参数按种类和位置比较")
        void genericParametersArePositional() {
            assertThat(new GenericParameterType("T", 0, false)).isEqualTo(new GenericParameterType("U", 0, false));
            assertThat(new GenericParameterType("T", 0, false)).isNotEqualTo(new GenericParameterType("T", 0, true));
        }
    }

    @Nested
    @DisplayName("泛型")
    class Generics {

        @Test
        @DisplayName("实例成员签名替换类型参数")
        void instanceMembersAreSubstituted() {
            TypeDescriptor listOfInt = list.makeGenericType(PrimitiveType.INT);
            MethodDescriptor get = listOfInt.getMethod("Get", Collections.singletonList(PrimitiveType.INT));
            assertThat(get).isNotNull();
            assertThat(get.getReturnType()).isEqualTo(PrimitiveType.INT);
            assertThat(get.getDeclaringType()).isEqualTo(listOfInt);
        }

        @Test
        @DisplayName("实参个数不符时拒绝实例化")
        void arityMismatch() {
            assertThatThrownBy(() -> map.makeGenericType(PrimitiveType.INT))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("expects 2 type arguments");
        }

        @Test
        @DisplayName("非泛型类型没有泛型定义")
        void nonGenericDefinition() {
            assertThatThrownBy(PrimitiveType.INT::getGenericTypeDefinition)
                    .isInstanceOf(IllegalStateException.class);
        }

        @Test
        @DisplayName("泛型方法实例化替换方法级参数")
        void genericMethod() {
            TypeBuilder util = core.defineType("demo.Util");
            MethodBuilder id = util.method("Id").asStatic().typeParameters("A");
            id.parameter("value", id.typeParameter(0)).returns(id.typeParameter(0)).add();
            MethodDescriptor definition = util.build().getMethods().get(0);

            MethodDescriptor instance = definition.makeGenericMethod(Collections.singletonList(PrimitiveType.LONG));
            assertThat(definition.isGenericMethodDefinition()).isTrue();
            assertThat(instance.isGenericMethodDefinition()).isFalse();
            assertThat(instance.getGenericMethodDefinition()).isSameAs(definition);
            assertThat(instance.getParameterTypes()).containsExactly(PrimitiveType.LONG);
            assertThat(instance.getReturnType()).isEqualTo(PrimitiveType.LONG);
        }
    }

    @Nested
    @DisplayName("成员查找")
    class Lookup {

        @Test
        @DisplayName("属性按绑定标志过滤")
        void propertyBindingFlags() {
            assertThat(list.getProperty("Count", EnumSet.of(BindingFlag.PUBLIC, BindingFlag.INSTANCE))).isNotNull();
            assertThat(list.getProperty("Count", EnumSet.of(BindingFlag.PUBLIC, BindingFlag.STATIC))).isNull();
        }

        @Test
        @DisplayName("同层多个精确匹配视为找不到")
        void ambiguousMethodIsNotFound() {
            TypeBuilder b = core.defineType("demo.Twice");
            b.method("Run").add().method("Run").add();
            assertThat(b.build().getMethod("Run", Collections.emptyList())).isNull();
        }

        @Test
        @DisplayName("沿基类链查找字段并判断可赋值")
        void baseChain() {
            DefinedType base = core.defineType("demo.Base").field("Id", PrimitiveType.INT).build();
            DefinedType derived = core.defineType("demo.Derived").baseType(base).build();
            assertThat(derived.getField("Id", EnumSet.of(BindingFlag.PUBLIC, BindingFlag.INSTANCE))).isNotNull();
            assertThat(base.isAssignableFrom(derived)).isTrue();
            assertThat(derived.isAssignableFrom(base)).isFalse();
        }

        @Test
        @DisplayName("构造器按参数类型精确匹配")
        void constructorLookup() {
            DefinedType point = core.defineType("demo.Point")
                    .constructor((t, a) -> null, ParameterInfo.of("x", PrimitiveType.INT), ParameterInfo.of("y", PrimitiveType.INT))
                    .build();
            assertThat(point.getConstructor(Arrays.asList(PrimitiveType.INT, PrimitiveType.INT))).isNotNull();
            assertThat(point.getConstructor(Collections.singletonList(PrimitiveType.INT))).isNull();
        }
    }

    @Test
    @DisplayName("模块拒绝重复定义")
    void duplicateType() {
        assertThatThrownBy(() -> core.defineType("demo.collections.List"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("already defines");
        assertThat(core.findType("demo.collections.Map")).isSameAs(map);
        assertThat(core.findType("demo.Missing")).isNull();
    }

    @Test
    @DisplayName("宇宙按模块顺序查找并列出模块")
    void universe() {
        InMemoryModule extra = new InMemoryModule("extra");
        TypeUniverse universe = TypeUniverse.of("origin", core, extra);
        assertThat(universe.findType("demo.collections.List")).isSameAs(list);
        assertThat(universe.describeModules()).isEqualTo("[core; extra]");
    }

    @Test
    @DisplayName("成员按需初始化，只运行一次")
    void lazyMembers() {
        DefinedType lazy = new DefinedType(core, "demo", "Lazy");
        int[] runs = {0};
        lazy.setMemberInitializer(t -> {
            runs[0]++;
            t.addField(new FieldDescriptor(t, "Value", PrimitiveType.INT, false, true));
        });
        assertThat(runs[0]).isZero();
        assertThat(lazy.getFields()).hasSize(1);
        assertThat(lazy.getFields()).hasSize(1);
        assertThat(runs[0]).isEqualTo(1);
    }
}
