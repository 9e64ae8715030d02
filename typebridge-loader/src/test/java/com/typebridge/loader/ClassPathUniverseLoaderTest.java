package com.typebridge.loader;

import com.typebridge.model.DefinedType;
import com.typebridge.model.TypeDescriptor;
import com.typebridge.model.TypeUniverse;
import com.typebridge.retarget.Direction;
import com.typebridge.retarget.TypeNotFoundException;
import com.typebridge.retarget.UniverseReplacer;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.File;
import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Arrays;
import java.util.Collections;

import static org.assertj.core.api.Assertions.*;

@DisplayName("ClassPathUniverseLoader 测试")
class ClassPathUniverseLoaderTest {

    @TempDir
    Path dir;

    private Path lib() throws IOException {
        return SampleClasses.writeDirectory(dir.resolve("lib"),
                Collections.singletonMap("demo/Base.class", SampleClasses.base()));
    }

    private Path app() throws IOException {
        return SampleClasses.writeJar(dir.resolve("app.jar"),
                Collections.singletonMap("demo/Box.class", SampleClasses.box()));
    }

    @Test
    @DisplayName("每个条目一个模块，跳过不存在的条目")
    void modulesPerEntry() throws IOException {
        TypeUniverse universe = ClassPathUniverseLoader.load("runtime",
                Arrays.asList(lib(), dir.resolve("missing"), app()));

        assertThat(universe.describeModules()).isEqualTo("[lib; app]");
        assertThat(universe.getLabel()).isEqualTo("runtime");
    }

    @Test
    @DisplayName("类型引用跨模块解析")
    void crossModuleReferences() throws IOException {
        TypeUniverse universe = ClassPathUniverseLoader.fromClassPath("runtime",
                lib() + File.pathSeparator + app() + File.pathSeparator);

        DefinedType box = (DefinedType) universe.findType("demo.Box");
        TypeDescriptor base = universe.findType("demo.Base");
        assertThat(box.getModule().getName()).isEqualTo("app");
        assertThat(box.getBaseType()).isSameAs(base);
        assertThat(base.getModule().getName()).isEqualTo("lib");
    }

    @Test
    @DisplayName("模块名取自文件名")
    void moduleNames() {
        assertThat(ClassPathUniverseLoader.moduleName(Paths.get("libs", "widgets.jar"))).isEqualTo("widgets");
        assertThat(ClassPathUniverseLoader.moduleName(Paths.get("build", "classes"))).isEqualTo("classes");
    }

    @Test
    @DisplayName("两套类路径之间改写类型与方法")
    void retargetBetweenClassPaths() throws IOException {
        TypeUniverse design = ClassPathUniverseLoader.load("design", Collections.singletonList(
                SampleClasses.writeDirectory(dir.resolve("design"), SampleClasses.all())));
        TypeUniverse runtime = ClassPathUniverseLoader.load("runtime", Arrays.asList(lib(), app()));
        UniverseReplacer replacer = new UniverseReplacer(design, runtime);

        DefinedType designBox = (DefinedType) design.findType("demo.Box");
        DefinedType runtimeBox = (DefinedType) runtime.findType("demo.Box");
        assertThat(replacer.typeToTarget(designBox.makeGenericType(design.findType("demo.Base"))))
                .isEqualTo(runtimeBox.makeGenericType(runtime.findType("demo.Base")));
        assertThat(replacer.resolveMethod(Direction.FORWARD, designBox.getMethod("compareTo")))
                .isSameAs(runtimeBox.getMethod("compareTo"));
    }

    @Test
    @DisplayName("占位类型按名字参与解析")
    void placeholdersResolveByName() throws IOException {
        TypeUniverse design = ClassPathUniverseLoader.load("design", Collections.singletonList(
                SampleClasses.writeDirectory(dir.resolve("design"), SampleClasses.all())));
        TypeUniverse runtime = ClassPathUniverseLoader.load("runtime", Arrays.asList(lib(), app()));
        UniverseReplacer replacer = new UniverseReplacer(design, runtime);
        DefinedType designBox = (DefinedType) design.findType("demo.Box");

        assertThatThrownBy(() -> replacer.resolveMethod(Direction.FORWARD, designBox.getMethod("wild")))
                .isInstanceOf(TypeNotFoundException.class)
                .hasMessageContaining("java.util.List");
    }
}
