package org.jsdetect.ast;

import java.util.*;
import java.util.function.Consumer;

/**
 * 规范化后的 AST 节点。
 * <p>
 * 子节点由父节点持有（有序）；parent 只是查找作用域用的非持有引用，不参与序列化。
 * id 是文件内的前序编号，同时也是 {@link ParsedScript#nodes} 中的下标。
 */
public class AstNode {
    public final int id;
    public final NodeKind kind;
    public final String type;        // 原始 ESTree 类型名，UNSUPPORTED 时用于标签
    public final String role;        // 在父节点中的属性名：body / test / consequent ...
    public SourceRange range = SourceRange.UNKNOWN;
    public final List<AstNode> children = new ArrayList<>();
    public final Map<String, String> attributes = new LinkedHashMap<>();
    public final List<Comment> comments = new ArrayList<>();

    public transient AstNode parent;

    public AstNode(int id, String type, String role) {
        this.id = id;
        this.type = type;
        this.kind = NodeKind.fromType(type);
        this.role = role;
    }

    public String attr(String key) {
        return attributes.get(key);
    }

    public boolean flag(String key) {
        return "true".equals(attributes.get(key));
    }

    /**
     * @return Identifier 的名称；其它节点为 null
     */
    public String name() {
        return kind == NodeKind.IDENTIFIER ? attributes.get("name") : null;
    }

    /**
     * 按角色取第一个子节点，例如 child("test")
     */
    public AstNode child(String childRole) {
        for (AstNode c : children) {
            if (childRole.equals(c.role)) {
                return c;
            }
        }
        return null;
    }

    /**
     * 按角色取全部子节点，例如 children("body") 取块中的语句
     */
    public List<AstNode> children(String childRole) {
        List<AstNode> result = new ArrayList<>();
        for (AstNode c : children) {
            if (childRole.equals(c.role)) {
                result.add(c);
            }
        }
        return result;
    }

    public boolean is(NodeKind k) {
        return kind == k;
    }

    /**
     * 前序遍历整棵子树（包含自身）
     */
    public void walk(Consumer<AstNode> visitor) {
        Deque<AstNode> stack = new ArrayDeque<>();
        stack.push(this);
        while (!stack.isEmpty()) {
            AstNode n = stack.pop();
            visitor.accept(n);
            for (int i = n.children.size() - 1; i >= 0; i--) {
                stack.push(n.children.get(i));
            }
        }
    }

    @Override
    public String toString() {
        String n = name();
        return type + "#" + id + (n != null ? "(" + n + ")" : "");
    }
}
