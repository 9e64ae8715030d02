package com.typebridge.retarget;

import com.typebridge.model.DefinedType;
import com.typebridge.model.GenericParameterType;
import com.typebridge.model.InMemoryModule;
import com.typebridge.model.PrimitiveType;
import com.typebridge.model.TupleType;
import com.typebridge.model.TypeDescriptor;
import com.typebridge.model.TypeUniverse;
import com.typebridge.retarget.cache.CacheStats;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

@DisplayName("TypeUniverseResolver 测试")
class TypeUniverseResolverTest {

    private MirroredUniverses u;
    private TypeUniverseResolver resolver;

    @BeforeEach
    void setUp() {
        u = new MirroredUniverses();
        resolver = new TypeUniverseResolver(u.originUniverse, u.targetUniverse, ReplacerOptions.defaults());
    }

    @Nested
    @DisplayName("类型分解")
    class Decomposition {

        @Test
        @DisplayName("定义类型按全名映射到目标宇宙的对象")
        void definedType() {
            assertThat(resolver.resolve(Direction.FORWARD, u.origin.string)).isSameAs(u.target.string);
            assertThat(resolver.resolve(Direction.BACKWARD, u.target.string)).isSameAs(u.origin.string);
        }

        @Test
        @DisplayName("List<Map<String, int>> 逐层解析定义和实参")
        void nestedGenericInstance() {
            TypeDescriptor source = u.origin.listOf(u.origin.mapOf(u.origin.string, PrimitiveType.INT));
            TypeDescriptor resolved = resolver.resolve(Direction.FORWARD, source);

            assertThat(resolved).isEqualTo(u.target.listOf(u.target.mapOf(u.target.string, PrimitiveType.INT)));
            assertThat(resolved.getGenericTypeDefinition()).isSameAs(u.target.list);
            assertThat(resolved.getGenericArguments().get(0).getGenericTypeDefinition()).isSameAs(u.target.map);
            assertThat(resolved).isNotEqualTo(source);
        }

        @Test
        @DisplayName("往返得到同一类型")
        void roundTrip() {
            TypeDescriptor source = u.origin.listOf(u.origin.mapOf(u.origin.string, u.origin.point))
                    .makeArrayType(2);
            TypeDescriptor back = resolver.resolve(Direction.BACKWARD, resolver.resolve(Direction.FORWARD, source));
            assertThat(back).isEqualTo(source);
            assertThat(back.getFullName()).isEqualTo(source.getFullName());
        }

        @Test
        @DisplayName("数组保持秩，引用和指针保持修饰")
        void elementTypes() {
            assertThat(resolver.resolve(Direction.FORWARD, u.origin.string.makeArrayType()))
                    .isEqualTo(u.target.string.makeArrayType());
            TypeDescriptor rank3 = resolver.resolve(Direction.FORWARD, u.origin.point.makeArrayType(3));
            assertThat(rank3.getArrayRank()).isEqualTo(3);
            assertThat(rank3.getElementType()).isSameAs(u.target.point);
            assertThat(resolver.resolve(Direction.FORWARD, u.origin.point.makeByRefType()))
                    .isEqualTo(u.target.point.makeByRefType());
            assertThat(resolver.resolve(Direction.FORWARD, u.origin.point.makePointerType()))
                    .isEqualTo(u.target.point.makePointerType());
        }

        @Test
        @DisplayName("元组逐元素解析")
        void tuple() {
            TypeDescriptor resolved = resolver.resolve(Direction.FORWARD,
                    TupleType.of(u.origin.string, PrimitiveType.BOOLEAN, u.origin.point));
            assertThat(resolved).isEqualTo(TupleType.of(u.target.string, PrimitiveType.BOOLEAN, u.target.point));
        }

        @Test
        @DisplayName("泛型参数和基元类型原样通过")
        void fixedPoints() {
            GenericParameterType t = u.origin.list.getGenericParameter(0);
            assertThat(resolver.resolve(Direction.FORWARD, t)).isSameAs(t);
            assertThat(resolver.resolve(Direction.FORWARD, PrimitiveType.LONG)).isSameAs(PrimitiveType.LONG);
            assertThat(resolver.resolve(Direction.BACKWARD, PrimitiveType.DOUBLE)).isSameAs(PrimitiveType.DOUBLE);
        }
    }

    @Nested
    @DisplayName("void")
    class VoidType {

        @Test
        @DisplayName("void 在两个方向上都是不动点")
        void fixedPoint() {
            assertThat(resolver.resolve(Direction.FORWARD, PrimitiveType.VOID)).isSameAs(PrimitiveType.VOID);
            assertThat(resolver.resolve(Direction.BACKWARD, PrimitiveType.VOID)).isSameAs(PrimitiveType.VOID);
        }

        @Test
        @DisplayName("按配置的名称识别 void")
        void customName() {
            InMemoryModule legacy = new InMemoryModule("legacy");
            DefinedType systemVoid = legacy.defineType("System.Void").build();
            TypeUniverseResolver r = new TypeUniverseResolver(TypeUniverse.of("origin", legacy),
                    u.targetUniverse, ReplacerOptions.custom().voidTypeName("System.Void").build());

            assertThat(r.resolve(Direction.FORWARD, systemVoid)).isSameAs(PrimitiveType.VOID);
        }
    }

    @Nested
    @DisplayName("查找失败")
    class Failures {

        @Test
        @DisplayName("正向找不到时指向目标模块集")
        void forwardNotFound() {
            DefinedType missing = u.origin.module.defineType("demo.OnlyAtDesignTime").build();
            assertThatThrownBy(() -> resolver.resolve(Direction.FORWARD, missing))
                    .isInstanceOf(TypeNotFoundException.class)
                    .hasMessageContaining("'demo.OnlyAtDesignTime'")
                    .hasMessageContaining("target module set [runtime.core]")
                    .hasMessageContaining("reduced profile")
                    .satisfies(e -> assertThat(((RetargetException) e).getDirection()).isEqualTo(Direction.FORWARD));
        }

        @Test
        @DisplayName("反向找不到时请求报告问题")
        void backwardNotFound() {
            DefinedType missing = u.target.module.defineType("demo.OnlyAtRuntime").build();
            assertThatThrownBy(() -> resolver.resolve(Direction.BACKWARD, missing))
                    .isInstanceOf(TypeNotFoundException.class)
                    .hasMessageContaining("origin module set [designtime.core]")
                    .hasMessageContaining("report this problem");
        }

        @Test
        @DisplayName("泛型实参找不到时整体失败")
        void missingArgument() {
            DefinedType missing = u.origin.module.defineType("demo.Local").build();
            assertThatThrownBy(() -> resolver.resolve(Direction.FORWARD, u.origin.listOf(missing)))
                    .isInstanceOf(TypeNotFoundException.class)
                    .hasMessageContaining("demo.Local");
        }

        @Test
        @DisplayName("多个模块都定义同名类型时报歧义")
        void ambiguous() {
            InMemoryModule extra = new InMemoryModule("runtime.extra");
            extra.defineType("sys.String").build();
            TypeUniverseResolver r = new TypeUniverseResolver(u.originUniverse,
                    TypeUniverse.of("target", u.target.module, extra), ReplacerOptions.defaults());

            assertThatThrownBy(() -> r.resolve(Direction.FORWARD, u.origin.string))
                    .isInstanceOf(AmbiguousTypeException.class)
                    .hasMessageContaining("multiple modules")
                    .hasMessageContaining("[runtime.core; runtime.extra]")
                    .satisfies(e -> assertThat(((AmbiguousTypeException) e).getCandidates()).hasSize(2));
        }

        @Test
        @DisplayName("同一模块重复出现不算歧义")
        void duplicateModuleIsNotAmbiguous() {
            TypeUniverseResolver r = new TypeUniverseResolver(u.originUniverse,
                    TypeUniverse.of("target", u.target.module, u.target.module), ReplacerOptions.defaults());
            assertThat(r.resolve(Direction.FORWARD, u.origin.string)).isSameAs(u.target.string);
        }
    }

    @Nested
    @DisplayName("交互式宿主")
    class Interactive {

        @Test
        @DisplayName("交互式模块取字典序最后的版本且不缓存")
        void lexicographicallyLastAndNotCached() {
            InMemoryModule session = new InMemoryModule("REPL-MODULE-3");
            DefinedType second = session.defineType("REPL_0002.demo.Widget").build();
            session.defineType("REPL_0001.demo.Widget").build();
            DefinedType widget = u.origin.module.defineType("demo.Widget").build();
            TypeUniverseResolver r = new TypeUniverseResolver(u.originUniverse,
                    TypeUniverse.of("target", u.target.module, session), ReplacerOptions.defaults());

            assertThat(r.resolve(Direction.FORWARD, widget)).isSameAs(second);
            assertThat(r.isCached(Direction.FORWARD, widget)).isFalse();

            DefinedType third = session.defineType("REPL_0003.demo.Widget").build();
            assertThat(r.resolve(Direction.FORWARD, widget)).isSameAs(third);
        }

        @Test
        @DisplayName("去掉交互式命名空间前缀后查找")
        void namespacePrefixStripped() {
            InMemoryModule session = new InMemoryModule("fsi-session");
            DefinedType scripted = session.defineType("REPL_0007.demo.Point").build();
            TypeUniverseResolver r = new TypeUniverseResolver(TypeUniverse.of("origin", session),
                    u.targetUniverse, ReplacerOptions.defaults());

            assertThat(r.resolve(Direction.FORWARD, scripted)).isSameAs(u.target.point);
            assertThat(r.isCached(Direction.FORWARD, scripted)).isTrue();
        }

        @Test
        @DisplayName("前缀可配置")
        void customPrefixes() {
            InMemoryModule session = new InMemoryModule("SCRATCH-1");
            DefinedType scratch = session.defineType("SCRATCH_1.demo.Point").build();
            ReplacerOptions options = ReplacerOptions.custom()
                    .interactiveNamespacePrefix("SCRATCH_")
                    .interactiveModulePrefix("SCRATCH-")
                    .build();
            TypeUniverseResolver r = new TypeUniverseResolver(u.targetUniverse,
                    TypeUniverse.of("scratch", session), options);

            assertThat(r.resolve(Direction.FORWARD, u.target.point)).isSameAs(scratch);
            assertThat(r.isCached(Direction.FORWARD, u.target.point)).isFalse();
        }
    }

    @Nested
    @DisplayName("缓存")
    class Caching {

        @Test
        @DisplayName("稳定匹配按方向缓存")
        void stableMatchesCachedPerDirection() {
            resolver.resolve(Direction.FORWARD, u.origin.point);
            assertThat(resolver.isCached(Direction.FORWARD, u.origin.point)).isTrue();
            assertThat(resolver.isCached(Direction.BACKWARD, u.origin.point)).isFalse();
            assertThat(resolver.isCached(Direction.BACKWARD, u.target.point)).isFalse();
        }

        @Test
        @DisplayName("构造类型只缓存其中的定义")
        void onlyDefinitionsCached() {
            TypeDescriptor listOfPoint = u.origin.listOf(u.origin.point);
            resolver.resolve(Direction.FORWARD, listOfPoint);
            assertThat(resolver.isCached(Direction.FORWARD, u.origin.list)).isTrue();
            assertThat(resolver.isCached(Direction.FORWARD, u.origin.point)).isTrue();
            assertThat(resolver.isCached(Direction.FORWARD, listOfPoint)).isFalse();
        }

        @Test
        @DisplayName("开启统计后记录命中")
        void stats() {
            TypeUniverseResolver r = new TypeUniverseResolver(u.originUniverse, u.targetUniverse,
                    ReplacerOptions.custom().recordStats(true).build());
            r.resolve(Direction.FORWARD, u.origin.point);
            r.resolve(Direction.FORWARD, u.origin.point);
            r.resolve(Direction.FORWARD, u.origin.point);

            CacheStats stats = r.getCacheStats(Direction.FORWARD);
            assertThat(stats.getMissCount()).isEqualTo(1);
            assertThat(stats.getHitCount()).isEqualTo(2);
            assertThat(stats.getSize()).isEqualTo(1);
        }
    }
}
