package com.typebridge.loader;

import com.typebridge.model.GenericParameterType;
import com.typebridge.model.PrimitiveType;
import com.typebridge.model.TupleType;
import com.typebridge.model.TypeDescriptor;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * 类型引用文本解析器。
 * <p>
 * 语法：
 * <pre>
 * type    := primary suffix*
 * primary := '(' type (',' type)* ')'        元组
 *          | '!' index | '!!' index          类型级 / 方法级泛型参数
 *          | name ('&lt;' type (',' type)* '&gt;')?
 * suffix  := '[' ','* ']' | '&amp;' | '*'
 * </pre>
 * 名字先查作用域（泛型参数名），再查基本类型关键字，最后交给 lookup。
 */
public final class TypeNameParser {

    private final Function<String, TypeDescriptor> lookup;
    private final Map<String, TypeDescriptor> scope;

    private String text;
    private int pos;

    public TypeNameParser(Function<String, TypeDescriptor> lookup) {
        this(lookup, Collections.<String, TypeDescriptor>emptyMap());
    }

    private TypeNameParser(Function<String, TypeDescriptor> lookup, Map<String, TypeDescriptor> scope) {
        this.lookup = lookup;
        this.scope = scope;
    }

    /**
     * 返回附加了名字作用域的新解析器，作用域中的名字优先于 lookup。
     */
    public TypeNameParser withScope(Map<String, ? extends TypeDescriptor> names) {
        Map<String, TypeDescriptor> merged = new HashMap<>(scope);
        merged.putAll(names);
        return new TypeNameParser(lookup, merged);
    }

    /**
     * 解析完整的类型引用。
     *
     * @throws IllegalArgumentException 语法错误或名字无法解析
     */
    public TypeDescriptor parse(String typeName) {
        if (typeName == null || typeName.trim().isEmpty()) {
            throw new IllegalArgumentException("Empty type reference");
        }
        TypeNameParser p = new TypeNameParser(lookup, scope);
        p.text = typeName;
        p.pos = 0;
        TypeDescriptor result = p.parseType();
        p.skipSpaces();
        if (p.pos != p.text.length()) {
            throw p.error("unexpected '" + p.text.charAt(p.pos) + "'");
        }
        return result;
    }

    // ==================== 递归下降 ====================

    private TypeDescriptor parseType() {
        TypeDescriptor t = parsePrimary();
        while (true) {
            skipSpaces();
            if (peek('[')) {
                pos++;
                int rank = 1;
                skipSpaces();
                while (peek(',')) {
                    rank++;
                    pos++;
                    skipSpaces();
                }
                expect(']');
                t = rank == 1 ? t.makeArrayType() : t.makeArrayType(rank);
            } else if (peek('&')) {
                pos++;
                t = t.makeByRefType();
            } else if (peek('*')) {
                pos++;
                t = t.makePointerType();
            } else {
                return t;
            }
        }
    }

    private TypeDescriptor parsePrimary() {
        skipSpaces();
        if (peek('(')) {
            pos++;
            List<TypeDescriptor> elements = parseList(')');
            if (elements.size() < 2) {
                throw error("a tuple needs at least two elements");
            }
            return TupleType.of(elements);
        }
        if (peek('!')) {
            pos++;
            boolean methodLevel = false;
            if (peek('!')) {
                pos++;
                methodLevel = true;
            }
            int position = parseIndex();
            return new GenericParameterType((methodLevel ? "!!" : "!") + position, position, methodLevel);
        }
        String name = parseName();
        skipSpaces();
        if (peek('<')) {
            pos++;
            List<TypeDescriptor> arguments = parseList('>');
            TypeDescriptor definition = resolveName(name);
            if (!definition.isGenericTypeDefinition()) {
                throw error("'" + name + "' is not a generic type definition");
            }
            return definition.makeGenericType(arguments);
        }
        return resolveName(name);
    }

    private List<TypeDescriptor> parseList(char close) {
        List<TypeDescriptor> items = new ArrayList<>();
        items.add(parseType());
        skipSpaces();
        while (peek(',')) {
            pos++;
            items.add(parseType());
            skipSpaces();
        }
        expect(close);
        return items;
    }

    private String parseName() {
        int start = pos;
        while (pos < text.length()) {
            char c = text.charAt(pos);
            if (Character.isLetterOrDigit(c) || c == '_' || c == '$' || c == '`' || c == '.' || c == '-') {
                pos++;
            } else {
                break;
            }
        }
        if (start == pos) {
            throw error(pos < text.length() ? "unexpected '" + text.charAt(pos) + "'" : "unexpected end");
        }
        return text.substring(start, pos);
    }

    private int parseIndex() {
        int start = pos;
        while (pos < text.length() && Character.isDigit(text.charAt(pos))) pos++;
        if (start == pos) {
            throw error("generic parameter index expected");
        }
        return Integer.parseInt(text.substring(start, pos));
    }

    private TypeDescriptor resolveName(String name) {
        TypeDescriptor scoped = scope.get(name);
        if (scoped != null) return scoped;
        PrimitiveType primitive = PrimitiveType.forKeyword(name);
        if (primitive != null) return primitive;
        TypeDescriptor found = lookup.apply(name);
        if (found == null) {
            throw new IllegalArgumentException("Unknown type '" + name + "' in '" + text + "'");
        }
        return found;
    }

    // ==================== 词法 ====================

    private void skipSpaces() {
        while (pos < text.length() && text.charAt(pos) == ' ') pos++;
    }

    private boolean peek(char c) {
        return pos < text.length() && text.charAt(pos) == c;
    }

    private void expect(char c) {
        skipSpaces();
        if (!peek(c)) {
            throw error("'" + c + "' expected");
        }
        pos++;
    }

    private IllegalArgumentException error(String message) {
        return new IllegalArgumentException("Malformed type reference '" + text + "' at " + pos + ": " + message);
    }
}
