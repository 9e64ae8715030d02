package com.typebridge.loader;

import com.typebridge.model.TypeUniverse;

import java.io.File;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

/**
 * 由类路径条目（目录或 JAR）构建类型宇宙，每个条目一个 {@link ClassFileModule}。
 * 模块之间的类型引用按条目顺序在整个宇宙中解析。
 */
public final class ClassPathUniverseLoader {

    private static final Logger LOG = Logger.getLogger(ClassPathUniverseLoader.class.getName());

    private ClassPathUniverseLoader() {
    }

    /**
     * @param classPath 以 {@link File#pathSeparator} 分隔的类路径
     */
    public static TypeUniverse fromClassPath(String label, String classPath) {
        List<Path> entries = new ArrayList<>();
        for (String entry : classPath.split(File.pathSeparator)) {
            if (!entry.trim().isEmpty()) {
                entries.add(Paths.get(entry.trim()));
            }
        }
        return load(label, entries);
    }

    public static TypeUniverse load(String label, List<Path> entries) {
        List<ClassFileModule> modules = new ArrayList<>();
        for (Path entry : entries) {
            if (!Files.exists(entry)) {
                LOG.fine("Skipping missing class path entry: " + entry);
                continue;
            }
            modules.add(new ClassFileModule(moduleName(entry), entry));
        }
        TypeUniverse universe = new TypeUniverse(label, modules);
        for (ClassFileModule module : modules) {
            module.setTypeResolver(universe::findType);
        }
        return universe;
    }

    static String moduleName(Path entry) {
        String fileName = entry.getFileName() != null ? entry.getFileName().toString() : entry.toString();
        return fileName.endsWith(".jar") ? fileName.substring(0, fileName.length() - 4) : fileName;
    }
}
