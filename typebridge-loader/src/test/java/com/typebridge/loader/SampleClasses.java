package com.typebridge.loader;

import org.objectweb.asm.ClassWriter;
import org.objectweb.asm.Opcodes;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.jar.JarEntry;
import java.util.jar.JarOutputStream;

/**
 * 用 ASM 生成测试用的 class 文件，只有声明没有方法体。
 */
final class SampleClasses implements Opcodes {

    private SampleClasses() {
    }

    /**
     * public class demo.Base { public String describe(); }
     */
    static byte[] base() {
        ClassWriter cw = new ClassWriter(0);
        cw.visit(V1_8, ACC_PUBLIC | ACC_SUPER, "demo/Base", null, "java/lang/Object", null);
        cw.visitMethod(ACC_PUBLIC, "<init>", "()V", null, null).visitEnd();
        cw.visitMethod(ACC_PUBLIC, "describe", "()Ljava/lang/String;", null, null).visitEnd();
        cw.visitEnd();
        return cw.toByteArray();
    }

    /**
     * <pre>
     * public abstract class demo.Box&lt;T&gt; extends demo.Base implements Comparable&lt;Box&lt;T&gt;&gt; {
     *     public T value;
     *     private static int count;
     *     public Box();
     *     public abstract T get();
     *     public static &lt;U&gt; Box&lt;U&gt; of(U item);
     *     public int[][] items();
     *     public int compareTo(Box&lt;T&gt; other);   // 另有桥方法 compareTo(Object)
     *     public void wild(java.util.List&lt;? extends Base&gt; items);
     * }
     * </pre>
     */
    static byte[] box() {
        ClassWriter cw = new ClassWriter(0);
        cw.visit(V1_8, ACC_PUBLIC | ACC_SUPER | ACC_ABSTRACT, "demo/Box",
                "<T:Ljava/lang/Object;>Ldemo/Base;Ljava/lang/Comparable<Ldemo/Box<TT;>;>;",
                "demo/Base", new String[]{"java/lang/Comparable"});
        cw.visitField(ACC_PUBLIC, "value", "Ljava/lang/Object;", "TT;", null).visitEnd();
        cw.visitField(ACC_PRIVATE | ACC_STATIC, "count", "I", null, null).visitEnd();
        cw.visitField(ACC_STATIC | ACC_FINAL | ACC_SYNTHETIC, "$assertionsDisabled", "Z", null, null).visitEnd();
        cw.visitMethod(ACC_STATIC, "<clinit>", "()V", null, null).visitEnd();
        cw.visitMethod(ACC_PUBLIC, "<init>", "()V", null, null).visitEnd();
        cw.visitMethod(ACC_PUBLIC | ACC_ABSTRACT, "get", "()Ljava/lang/Object;", "()TT;", null).visitEnd();
        cw.visitMethod(ACC_PUBLIC | ACC_STATIC, "of", "(Ljava/lang/Object;)Ldemo/Box;",
                "<U:Ljava/lang/Object;>(TU;)Ldemo/Box<TU;>;", null).visitEnd();
        cw.visitMethod(ACC_PUBLIC, "items", "()[[I", null, null).visitEnd();
        cw.visitMethod(ACC_PUBLIC, "compareTo", "(Ldemo/Box;)I", "(Ldemo/Box<TT;>;)I", null).visitEnd();
        cw.visitMethod(ACC_PUBLIC | ACC_BRIDGE | ACC_SYNTHETIC, "compareTo", "(Ljava/lang/Object;)I", null, null)
                .visitEnd();
        cw.visitMethod(ACC_PUBLIC, "wild", "(Ljava/util/List;)V", "(Ljava/util/List<+Ldemo/Base;>;)V", null)
                .visitEnd();
        cw.visitEnd();
        return cw.toByteArray();
    }

    static Map<String, byte[]> all() {
        Map<String, byte[]> classes = new LinkedHashMap<>();
        classes.put("demo/Base.class", base());
        classes.put("demo/Box.class", box());
        return classes;
    }

    static Path writeDirectory(Path root, Map<String, byte[]> classes) throws IOException {
        for (Map.Entry<String, byte[]> e : classes.entrySet()) {
            Path file = root.resolve(e.getKey());
            Files.createDirectories(file.getParent());
            Files.write(file, e.getValue());
        }
        return root;
    }

    static Path writeJar(Path jar, Map<String, byte[]> classes) throws IOException {
        try (OutputStream os = Files.newOutputStream(jar);
             JarOutputStream out = new JarOutputStream(os)) {
            for (Map.Entry<String, byte[]> e : classes.entrySet()) {
                out.putNextEntry(new JarEntry(e.getKey()));
                out.write(e.getValue());
                out.closeEntry();
            }
        }
        return jar;
    }
}
