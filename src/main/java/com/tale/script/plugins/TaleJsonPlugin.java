package com.tale.script.plugins;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.util.DefaultIndenter;
import com.fasterxml.jackson.core.util.DefaultPrettyPrinter;
import com.fasterxml.jackson.core.util.MinimalPrettyPrinter;
import com.fasterxml.jackson.core.util.Separators;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.tale.script.diagnostics.TaleException;
import com.tale.script.parser.Value;
import com.tale.script.sandbox.CapabilityTable;
import com.tale.script.sandbox.SandboxContext;

/**
 * TaleJsonPlugin
 *
 * The {@code json} module ({@code dumps}, {@code loads}) and the file helpers
 * {@code read_json(path)} / {@code write_json(data, path)}, which work on the
 * run's in-memory file workspace.
 */
public final class TaleJsonPlugin {

    private static final ObjectMapper om = new ObjectMapper();
    private static final JsonNodeFactory nodes = JsonNodeFactory.instance;

    private TaleJsonPlugin() {}

    public static void register(CapabilityTable.Builder builder) {

        builder.module("json")
                .function("dumps", (ctx, args) -> {
                    Args.requireBetween("json.dumps", args, 1, 2);
                    Integer indent = args.size() == 2 && !args.get(1).isNull()
                            ? (int) Args.whole("json.dumps", args, 1) : null;
                    String out = dumps(args.get(0), indent);
                    ctx.checkText(out.length());
                    return Value.text(out);
                })
                .function("loads", (ctx, args) -> {
                    Args.require("json.loads", args, 1);
                    return loads(ctx, Args.text("json.loads", args, 0));
                });

        builder.function("read_json", (ctx, args) -> {
            Args.require("read_json", args, 1);
            return loads(ctx, ctx.files().readAll(Args.text("read_json", args, 0)));
        });

        builder.function("write_json", (ctx, args) -> {
            Args.require("write_json", args, 2);
            ctx.files().writeAll(Args.text("write_json", args, 1), dumps(args.get(0), 2));
            return Value.nil();
        });
    }

    // ===================== CONVERSION =====================

    static String dumps(Value v, Integer indent) {
        JsonNode tree = toJson(v);
        try {
            if (indent == null) return om.writer(new SpacedPrinter()).writeValueAsString(tree);
            DefaultIndenter indenter = new DefaultIndenter(" ".repeat(Math.max(0, indent)), "\n");
            DefaultPrettyPrinter pp = new DefaultPrettyPrinter()
                    .withSeparators(Separators.createDefaultInstance()
                            .withObjectFieldValueSpacing(Separators.Spacing.AFTER));
            pp.indentObjectsWith(indenter);
            pp.indentArraysWith(indenter);
            return om.writer(pp).writeValueAsString(tree);
        } catch (JsonProcessingException e) {
            throw TaleException.runtime("Could not write JSON: " + e.getOriginalMessage());
        }
    }

    static Value loads(SandboxContext ctx, String text) {
        JsonNode tree;
        try {
            tree = om.readTree(text);
        } catch (JsonProcessingException e) {
            throw TaleException.runtime("Invalid JSON: " + e.getOriginalMessage());
        }
        if (tree == null || tree.isMissingNode()) throw TaleException.runtime("Invalid JSON: nothing to read");
        return fromJson(ctx, tree);
    }

    static JsonNode toJson(Value v) {
        switch (v.type) {
            case NULL: return nodes.nullNode();
            case BOOL: return nodes.booleanNode(v.asBool());
            case INT: return nodes.numberNode(v.asInt());
            case DECIMAL: return nodes.numberNode(v.asDouble());
            case TEXT: return nodes.textNode(v.asText());
            case LIST:
            case TUPLE: {
                ArrayNode arr = nodes.arrayNode();
                for (Value item : v.asList()) arr.add(toJson(item));
                return arr;
            }
            case MAP: {
                ObjectNode obj = nodes.objectNode();
                for (Map.Entry<Value, Value> e : v.asMap().entrySet()) {
                    obj.set(key(e.getKey()), toJson(e.getValue()));
                }
                return obj;
            }
            default:
                throw TaleException.runtime("A " + v.typeName() + " cannot be written as JSON");
        }
    }

    private static String key(Value k) {
        switch (k.type) {
            case TEXT: return k.asText();
            case INT: case DECIMAL: case BOOL: return k.repr();
            case NULL: return "null";
            default: throw TaleException.runtime("JSON keys must be text or numbers, not " + k.typeName());
        }
    }

    static Value fromJson(SandboxContext ctx, JsonNode n) {
        if (n.isNull()) return Value.nil();
        if (n.isBoolean()) return Value.bool(n.booleanValue());
        if (n.isIntegralNumber() && n.canConvertToLong()) return Value.integer(n.longValue());
        if (n.isNumber()) return Value.decimal(n.doubleValue());
        if (n.isTextual()) return Value.text(n.textValue());
        if (n.isArray()) {
            List<Value> out = new ArrayList<>(n.size());
            for (JsonNode item : n) out.add(fromJson(ctx, item));
            ctx.checkSize(out.size());
            return Value.list(out);
        }
        if (n.isObject()) {
            Map<Value, Value> out = new LinkedHashMap<>();
            Iterator<Map.Entry<String, JsonNode>> fields = n.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> f = fields.next();
                out.put(Value.text(f.getKey()), fromJson(ctx, f.getValue()));
            }
            ctx.checkSize(out.size());
            return Value.map(out);
        }
        throw TaleException.runtime("Unsupported JSON value: " + n.getNodeType());
    }

    /** Single-line output with a space after ':' and ','. */
    private static final class SpacedPrinter extends MinimalPrettyPrinter {
        private static final long serialVersionUID = 1L;

        @Override
        public void writeObjectFieldValueSeparator(JsonGenerator g) throws IOException {
            g.writeRaw(": ");
        }

        @Override
        public void writeObjectEntrySeparator(JsonGenerator g) throws IOException {
            g.writeRaw(", ");
        }

        @Override
        public void writeArrayValueSeparator(JsonGenerator g) throws IOException {
            g.writeRaw(", ");
        }
    }
}
