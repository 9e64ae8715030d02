package com.typebridge.loader;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.typebridge.model.GenericParameterType;
import com.typebridge.model.InMemoryModule;
import com.typebridge.model.MethodBuilder;
import com.typebridge.model.ParameterInfo;
import com.typebridge.model.PrimitiveType;
import com.typebridge.model.TagAccessorKind;
import com.typebridge.model.TypeBuilder;
import com.typebridge.model.TypeDescriptor;
import com.typebridge.model.TypeUniverse;
import com.typebridge.model.runtime.ObjectValue;

import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.logging.Logger;

/**
 * 从 JSON 清单构建由 {@link InMemoryModule} 组成的类型宇宙。
 *
 * <pre>
 * {
 *   "label": "runtime",
 *   "modules": [{
 *     "name": "runtime.core",
 *     "types": [{
 *       "name": "coll.List", "genericParameters": ["T"], "baseType": "sys.Object",
 *       "fields":       [{"name": "count", "type": "int", "static": false, "public": false}],
 *       "properties":   [{"name": "Count", "type": "int", "writable": false}],
 *       "methods":      [{"name": "Get", "parameters": [{"name": "index", "type": "int"}], "returns": "T"}],
 *       "constructors": [{"parameters": []}],
 *       "union":  {"tag": "instance_property", "cases": [{"name": "None", "fields": []}]},
 *       "record": {"fields": [{"name": "X", "type": "int"}]}
 *     }]
 *   }]
 * }
 * </pre>
 *
 * 所有类型先声明后填充，类型引用（{@link TypeNameParser} 语法）可以前向引用，
 * 按宇宙中模块的顺序查找。
 */
public final class UniverseManifestLoader {

    private static final Logger LOG = Logger.getLogger(UniverseManifestLoader.class.getName());

    private static final String DEFAULT_LABEL = "manifest";

    public TypeUniverse load(Path manifest) throws IOException {
        try (Reader reader = Files.newBufferedReader(manifest, StandardCharsets.UTF_8)) {
            return load(reader);
        }
    }

    public TypeUniverse loadString(String json) {
        return load(new StringReader(json));
    }

    public TypeUniverse load(Reader reader) {
        JsonObject root;
        try {
            JsonElement parsed = JsonParser.parseReader(reader);
            if (!parsed.isJsonObject()) {
                throw new ManifestException("Manifest root must be a JSON object");
            }
            root = parsed.getAsJsonObject();
        } catch (JsonParseException e) {
            throw new ManifestException("Malformed manifest JSON: " + e.getMessage(), e);
        }

        String label = root.has("label") ? root.get("label").getAsString() : DEFAULT_LABEL;
        List<InMemoryModule> modules = new ArrayList<>();
        List<PendingType> pending = new ArrayList<>();
        for (JsonElement m : array(root, "modules", "manifest")) {
            JsonObject moduleJson = object(m, "module");
            InMemoryModule module = new InMemoryModule(string(moduleJson, "name", "module"));
            modules.add(module);
            for (JsonElement t : array(moduleJson, "types", "module '" + module.getName() + "'")) {
                pending.add(declare(module, object(t, "type")));
            }
        }

        TypeUniverse universe = new TypeUniverse(label, modules);
        TypeNameParser parser = new TypeNameParser(universe::findType);
        for (PendingType p : pending) {
            populate(p, parser);
        }
        LOG.info("Loaded manifest universe " + universe + ": " + pending.size() + " types");
        return universe;
    }

    // ==================== 声明 ====================

    private static final class PendingType {
        final TypeBuilder builder;
        final JsonObject json;
        final String context;

        PendingType(TypeBuilder builder, JsonObject json, String context) {
            this.builder = builder;
            this.json = json;
            this.context = context;
        }
    }

    private PendingType declare(InMemoryModule module, JsonObject json) {
        String name = string(json, "name", "type in module '" + module.getName() + "'");
        List<String> genericNames = new ArrayList<>();
        if (json.has("genericParameters")) {
            for (JsonElement g : json.getAsJsonArray("genericParameters")) {
                genericNames.add(g.getAsString());
            }
        }
        try {
            TypeBuilder builder = module.defineType(name, genericNames.toArray(new String[0]));
            return new PendingType(builder, json, "type '" + name + "'");
        } catch (IllegalArgumentException e) {
            throw new ManifestException(e.getMessage(), e);
        }
    }

    // ==================== 填充 ====================

    private void populate(PendingType p, TypeNameParser baseParser) {
        TypeBuilder b = p.builder;
        JsonObject json = p.json;
        Map<String, TypeDescriptor> typeScope = new HashMap<>();
        for (GenericParameterType g : b.type().getGenericParameters()) {
            typeScope.put(g.getName(), g);
        }
        TypeNameParser parser = baseParser.withScope(typeScope);

        if (json.has("baseType")) {
            b.baseType(type(parser, json.get("baseType").getAsString(), p.context));
        }
        for (JsonElement i : optionalArray(json, "interfaces")) {
            b.implement(type(parser, i.getAsString(), p.context));
        }
        for (JsonElement f : optionalArray(json, "fields")) {
            JsonObject field = object(f, "field of " + p.context);
            b.field(string(field, "name", p.context), type(parser, string(field, "type", p.context), p.context),
                    flag(field, "static", false), flag(field, "public", true));
        }
        for (JsonElement e : optionalArray(json, "properties")) {
            addProperty(b, parser, object(e, "property of " + p.context), p.context);
        }
        for (JsonElement e : optionalArray(json, "methods")) {
            addMethod(b, parser, object(e, "method of " + p.context), p.context);
        }
        for (JsonElement e : optionalArray(json, "constructors")) {
            JsonObject ctor = object(e, "constructor of " + p.context);
            final List<ParameterInfo> params = parameters(parser, ctor, "parameters", p.context);
            final String typeName = b.type().getFullName();
            b.constructor((target, args) -> {
                ObjectValue value = new ObjectValue(typeName);
                for (int i = 0; i < params.size(); i++) {
                    value.setField(params.get(i).getName(), args.get(i));
                }
                return value;
            }, params.toArray(new ParameterInfo[0]));
        }
        if (json.has("union")) {
            JsonObject union = object(json.get("union"), "union of " + p.context);
            b.union(tagKind(string(union, "tag", "union of " + p.context), p.context));
            for (JsonElement c : array(union, "cases", "union of " + p.context)) {
                JsonObject unionCase = object(c, "union case of " + p.context);
                b.unionCase(string(unionCase, "name", p.context),
                        parameters(parser, unionCase, "fields", p.context).toArray(new ParameterInfo[0]));
            }
        }
        if (json.has("record")) {
            JsonObject record = object(json.get("record"), "record of " + p.context);
            b.record(parameters(parser, record, "fields", p.context).toArray(new ParameterInfo[0]));
        }
        b.build();
    }

    private void addProperty(TypeBuilder b, TypeNameParser parser, JsonObject json, String context) {
        final String name = string(json, "name", context);
        TypeDescriptor type = type(parser, string(json, "type", context), context);
        if (flag(json, "static", false)) {
            final Object constant = json.has("value") ? constant(json.get("value"), type) : null;
            b.staticProperty(name, type, (target, args) -> constant);
        } else if (flag(json, "writable", false)) {
            b.autoProperty(name, type);
        } else {
            b.property(name, type, (target, args) -> ((ObjectValue) target).getField(name));
        }
    }

    private void addMethod(TypeBuilder b, TypeNameParser parser, JsonObject json, String context) {
        String name = string(json, "name", context);
        MethodBuilder m = b.method(name);
        Map<String, TypeDescriptor> methodScope = new HashMap<>();
        if (json.has("genericParameters")) {
            List<String> names = new ArrayList<>();
            for (JsonElement g : json.getAsJsonArray("genericParameters")) {
                names.add(g.getAsString());
            }
            m.typeParameters(names.toArray(new String[0]));
            for (int i = 0; i < names.size(); i++) {
                methodScope.put(names.get(i), m.typeParameter(i));
            }
        }
        TypeNameParser scoped = parser.withScope(methodScope);
        String methodContext = "method '" + name + "' of " + context;
        for (ParameterInfo param : parameters(scoped, json, "parameters", methodContext)) {
            m.parameter(param.getName(), param.getType());
        }
        if (json.has("returns")) {
            m.returns(type(scoped, json.get("returns").getAsString(), methodContext));
        }
        if (flag(json, "static", false)) m.asStatic();
        if (!flag(json, "public", true)) m.nonPublic();
        m.add();
    }

    private List<ParameterInfo> parameters(TypeNameParser parser, JsonObject json, String member, String context) {
        List<ParameterInfo> result = new ArrayList<>();
        for (JsonElement e : optionalArray(json, member)) {
            JsonObject param = object(e, "parameter of " + context);
            result.add(ParameterInfo.of(string(param, "name", context),
                    type(parser, string(param, "type", context), context)));
        }
        return result;
    }

    private static TagAccessorKind tagKind(String text, String context) {
        try {
            return TagAccessorKind.valueOf(text.toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new ManifestException("Unknown union tag accessor '" + text + "' in " + context, e);
        }
    }

    private static Object constant(JsonElement value, TypeDescriptor type) {
        if (value.isJsonNull()) return null;
        if (type == PrimitiveType.INT) return value.getAsInt();
        if (type == PrimitiveType.LONG) return value.getAsLong();
        if (type == PrimitiveType.DOUBLE) return value.getAsDouble();
        if (type == PrimitiveType.BOOLEAN) return value.getAsBoolean();
        return value.getAsString();
    }

    // ==================== JSON 访问 ====================

    private static TypeDescriptor type(TypeNameParser parser, String text, String context) {
        try {
            return parser.parse(text);
        } catch (IllegalArgumentException e) {
            throw new ManifestException(e.getMessage() + " (in " + context + ")", e);
        }
    }

    private static JsonObject object(JsonElement element, String what) {
        if (element == null || !element.isJsonObject()) {
            throw new ManifestException("Expected a JSON object for " + what);
        }
        return element.getAsJsonObject();
    }

    private static JsonArray array(JsonObject json, String member, String context) {
        JsonElement element = json.get(member);
        if (element == null || !element.isJsonArray()) {
            throw new ManifestException("Missing array '" + member + "' in " + context);
        }
        return element.getAsJsonArray();
    }

    private static JsonArray optionalArray(JsonObject json, String member) {
        JsonElement element = json.get(member);
        if (element == null || element.isJsonNull()) return new JsonArray();
        if (!element.isJsonArray()) {
            throw new ManifestException("'" + member + "' must be an array");
        }
        return element.getAsJsonArray();
    }

    private static String string(JsonObject json, String member, String context) {
        JsonElement element = json.get(member);
        if (element == null || !element.isJsonPrimitive()) {
            throw new ManifestException("Missing '" + member + "' in " + context);
        }
        return element.getAsString();
    }

    private static boolean flag(JsonObject json, String member, boolean defaultValue) {
        return json.has(member) ? json.get(member).getAsBoolean() : defaultValue;
    }
}
