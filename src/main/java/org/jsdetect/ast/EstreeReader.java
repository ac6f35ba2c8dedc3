package org.jsdetect.ast;

import com.google.gson.*;
import org.jsdetect.error.GraphSizeExceededException;
import org.jsdetect.error.ParseFailureException;

import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;

/**
 * 读取解析器导出的 ESTree / Esprima JSON（带 range、tokens、comments），
 * 转成 {@link AstNode} 树。
 * <p>
 * 嵌套的 JSON 对象 / 数组按键的顺序生成子节点，键名作为子节点的 role；
 * 其它标量键保存为属性。构建过程不递归，很深的表达式链也不会爆栈。
 */
public class EstreeReader {

    private static final Set<String> COMMENT_KEYS = Set.of("leadingComments", "trailingComments", "innerComments");
    // 这些键下面的对象不是 AST 节点
    private static final Set<String> NON_NODE_KEYS = Set.of("loc", "regex", "value");

    private final int maxNodes;

    public EstreeReader() {
        this(Integer.MAX_VALUE);
    }

    /**
     * @param maxNodes 允许的最大节点数，超过后抛出 {@link GraphSizeExceededException}
     */
    public EstreeReader(int maxNodes) {
        this.maxNodes = maxNodes;
    }

    public ParsedScript read(Path file) throws IOException {
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            return read(reader);
        }
    }

    public ParsedScript read(String json) {
        return read(new StringReader(json));
    }

    public ParsedScript read(Reader reader) {
        JsonElement element;
        try {
            element = JsonParser.parseReader(reader);
        } catch (JsonParseException e) {
            throw new ParseFailureException("Malformed AST JSON: " + e.getMessage(), e);
        }
        if (!element.isJsonObject()) {
            throw new ParseFailureException("AST JSON root is not an object");
        }
        JsonObject program = element.getAsJsonObject();
        String type = typeOf(program);
        if (!"Program".equals(type)) {
            throw new ParseFailureException("AST root must be a Program, got " + type);
        }

        List<AstNode> nodes = new ArrayList<>();
        AstNode root = build(program, nodes);
        List<Token> tokens = readTokens(program.get("tokens"));
        List<Comment> comments = readComments(program.get("comments"));
        String sourceType = program.has("sourceType") && program.get("sourceType").isJsonPrimitive()
                ? program.get("sourceType").getAsString() : "script";
        return new ParsedScript(root, nodes, tokens, comments, sourceType);
    }

    private record Pending(JsonObject json, String role, AstNode parent) {
    }

    private AstNode build(JsonObject program, List<AstNode> nodes) {
        Deque<Pending> stack = new ArrayDeque<>();
        stack.push(new Pending(program, null, null));
        AstNode root = null;

        while (!stack.isEmpty()) {
            Pending p = stack.pop();
            if (nodes.size() >= maxNodes) {
                throw new GraphSizeExceededException("AST nodes", nodes.size() + 1L, maxNodes);
            }
            AstNode node = new AstNode(nodes.size(), typeOf(p.json), p.role);
            nodes.add(node);
            if (p.parent == null) {
                root = node;
            } else {
                node.parent = p.parent;
                p.parent.children.add(node);
            }

            // 子节点逆序压栈，保证出栈顺序即源码顺序，id 仍是前序编号
            List<Pending> childList = new ArrayList<>();
            for (Map.Entry<String, JsonElement> entry : p.json.entrySet()) {
                String key = entry.getKey();
                JsonElement value = entry.getValue();
                if (p.parent == null && (key.equals("tokens") || key.equals("comments"))) {
                    continue;
                }
                readEntry(node, key, value, childList);
            }
            for (int i = childList.size() - 1; i >= 0; i--) {
                stack.push(childList.get(i));
            }
            if (node.kind == NodeKind.LITERAL) {
                node.attributes.put("literalType", literalType(node, p.json.get("value")));
            }
        }
        return root;
    }

    private void readEntry(AstNode node, String key, JsonElement value, List<Pending> childList) {
        switch (key) {
            case "type":
                return;
            case "range":
                node.range = readRange(value);
                return;
            case "regex":
                if (value.isJsonObject()) {
                    JsonObject regex = value.getAsJsonObject();
                    node.attributes.put("pattern", stringOf(regex.get("pattern")));
                    node.attributes.put("flags", stringOf(regex.get("flags")));
                }
                return;
            default:
                break;
        }
        if (COMMENT_KEYS.contains(key)) {
            node.comments.addAll(readComments(value));
            return;
        }

        if (value.isJsonObject()) {
            JsonObject obj = value.getAsJsonObject();
            if (obj.has("type")) {
                childList.add(new Pending(obj, key, node));
            } else if (key.equals("value")) {
                // TemplateElement 的 {raw, cooked}；正则字面量序列化后的空对象
                for (Map.Entry<String, JsonElement> e : obj.entrySet()) {
                    if (e.getValue().isJsonPrimitive()) {
                        node.attributes.put(e.getKey(), e.getValue().getAsString());
                    }
                }
            } else if (!NON_NODE_KEYS.contains(key)) {
                throw new ParseFailureException("Node object without type under '" + key + "' in " + node);
            }
        } else if (value.isJsonArray()) {
            for (JsonElement el : value.getAsJsonArray()) {
                if (el.isJsonObject()) {
                    JsonObject obj = el.getAsJsonObject();
                    if (!obj.has("type")) {
                        throw new ParseFailureException("Node object without type in list '" + key + "' of " + node);
                    }
                    childList.add(new Pending(obj, key, node));
                }
                // null 元素是数组空位，例如 [, a]
            }
        } else if (value.isJsonPrimitive()) {
            node.attributes.put(key, value.getAsString());
        } else if (value.isJsonNull() && key.equals("value")) {
            node.attributes.put(key, "null");
        }
    }

    /**
     * 与原始特征提取一致的字面量类型：String / Int / Numeric / Bool / Null / RegExp
     */
    static String literalType(AstNode node, JsonElement value) {
        if (node.attributes.containsKey("pattern")) {
            return "RegExp";
        }
        if (value == null || value.isJsonNull()) {
            return "Null";
        }
        if (value.isJsonPrimitive()) {
            JsonPrimitive p = value.getAsJsonPrimitive();
            if (p.isBoolean()) {
                return "Bool";
            }
            if (p.isString()) {
                return "String";
            }
            if (p.isNumber()) {
                String raw = node.attr("raw") != null ? node.attr("raw") : p.getAsString();
                if (raw.startsWith("0x") || raw.startsWith("0X") || raw.startsWith("0o")
                        || raw.startsWith("0O") || raw.startsWith("0b") || raw.startsWith("0B")) {
                    return "Int";
                }
                double d = p.getAsDouble();
                boolean integral = !Double.isInfinite(d) && d == Math.rint(d);
                if (integral && raw.indexOf('.') < 0 && raw.indexOf('e') < 0 && raw.indexOf('E') < 0) {
                    return "Int";
                }
                return "Numeric";
            }
        }
        return "RegExp";
    }

    private static SourceRange readRange(JsonElement value) {
        if (value.isJsonArray() && value.getAsJsonArray().size() >= 2) {
            JsonArray arr = value.getAsJsonArray();
            return new SourceRange(arr.get(0).getAsInt(), arr.get(1).getAsInt());
        }
        if (value.isJsonObject()) {
            // leadingComments 里出现过 {0: begin, 1: end} 的写法
            JsonObject obj = value.getAsJsonObject();
            if (obj.has("0") && obj.has("1")) {
                return new SourceRange(obj.get("0").getAsInt(), obj.get("1").getAsInt());
            }
        }
        return SourceRange.UNKNOWN;
    }

    private static List<Token> readTokens(JsonElement element) {
        List<Token> tokens = new ArrayList<>();
        if (element == null || !element.isJsonArray()) {
            return tokens;
        }
        for (JsonElement el : element.getAsJsonArray()) {
            if (!el.isJsonObject()) {
                continue;
            }
            JsonObject obj = el.getAsJsonObject();
            SourceRange range = obj.has("range") ? readRange(obj.get("range")) : SourceRange.UNKNOWN;
            tokens.add(new Token(stringOf(obj.get("type")), stringOf(obj.get("value")), range));
        }
        return tokens;
    }

    private static List<Comment> readComments(JsonElement element) {
        List<Comment> comments = new ArrayList<>();
        if (element == null || !element.isJsonArray()) {
            return comments;
        }
        for (JsonElement el : element.getAsJsonArray()) {
            if (!el.isJsonObject()) {
                continue;
            }
            JsonObject obj = el.getAsJsonObject();
            SourceRange range = obj.has("range") ? readRange(obj.get("range")) : SourceRange.UNKNOWN;
            comments.add(new Comment(stringOf(obj.get("type")), stringOf(obj.get("value")), range));
        }
        return comments;
    }

    private static String typeOf(JsonObject obj) {
        JsonElement t = obj.get("type");
        if (t == null || !t.isJsonPrimitive()) {
            throw new ParseFailureException("Node object without type");
        }
        return t.getAsString();
    }

    private static String stringOf(JsonElement element) {
        return element == null || element.isJsonNull() ? null : element.getAsString();
    }
}
