package org.jsdetect.feature;

import org.jsdetect.ast.AstNode;
import org.jsdetect.ast.NodeKind;
import org.jsdetect.ast.Token;

import java.util.*;

/**
 * (上下文, 值) 特征：
 * 字面量产生 "字面量类型:值"，其它子树中含有标识符的节点产生 "节点类型:第一个标识符名"，
 * 词法单元层级对标识符和字面量单元产生 "单元类型:值"。
 */
public class ValueFeatureSource implements Iterable<String> {

    private static final Set<String> VALUE_TOKENS = Set.of(
            "Identifier", "String", "Numeric", "Boolean", "Null", "RegularExpression", "Template");

    private final List<AstNode> roots;
    private final List<Token> tokens;
    private final boolean enterFunctions;
    private final int maxValueLength;

    private ValueFeatureSource(List<AstNode> roots, List<Token> tokens, boolean enterFunctions, int maxValueLength) {
        this.roots = roots;
        this.tokens = tokens;
        this.enterFunctions = enterFunctions;
        this.maxValueLength = maxValueLength;
    }

    /**
     * @param enterFunctions 是否进入嵌套函数（语句项层级上嵌套函数有自己的语句项）
     */
    public static ValueFeatureSource ofNodes(List<AstNode> roots, boolean enterFunctions, int maxValueLength) {
        return new ValueFeatureSource(List.copyOf(roots), null, enterFunctions, maxValueLength);
    }

    public static ValueFeatureSource ofTokens(List<Token> tokens, int maxValueLength) {
        return new ValueFeatureSource(null, List.copyOf(tokens), true, maxValueLength);
    }

    @Override
    public Iterator<String> iterator() {
        return tokens != null ? tokenFeatures() : new NodeIterator();
    }

    private Iterator<String> tokenFeatures() {
        return tokens.stream()
                .filter(t -> VALUE_TOKENS.contains(t.type()) && t.value() != null)
                .map(t -> t.type() + ":" + cut(t.value()))
                .iterator();
    }

    private String cut(String value) {
        return value.length() > maxValueLength ? value.substring(0, maxValueLength) : value;
    }

    private boolean skipped(AstNode node) {
        return !enterFunctions && node.kind.isFunction();
    }

    /**
     * 前序遍历，逐个节点产生特征
     */
    private final class NodeIterator implements Iterator<String> {
        private final Deque<AstNode> stack = new ArrayDeque<>();
        private final Map<AstNode, AstNode> firstIdentifier = new IdentityHashMap<>();
        private String next;

        NodeIterator() {
            for (int i = roots.size() - 1; i >= 0; i--) {
                stack.push(roots.get(i));
            }
        }

        @Override
        public boolean hasNext() {
            while (next == null && !stack.isEmpty()) {
                AstNode n = stack.pop();
                if (skipped(n)) {
                    continue;
                }
                for (int i = n.children.size() - 1; i >= 0; i--) {
                    stack.push(n.children.get(i));
                }
                next = feature(n);
            }
            return next != null;
        }

        @Override
        public String next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            String f = next;
            next = null;
            return f;
        }

        private String feature(AstNode n) {
            if (n.is(NodeKind.LITERAL)) {
                String value = n.attr("value") != null ? n.attr("value") : n.attr("raw");
                if (value == null) {
                    return null;
                }
                return n.attr("literalType") + ":" + cut(value);
            }
            AstNode id = first(n);
            return id != null ? n.type + ":" + cut(id.name()) : null;
        }

        /**
         * 子树中按前序第一个标识符；结果按节点缓存
         */
        private AstNode first(AstNode root) {
            if (firstIdentifier.containsKey(root)) {
                return firstIdentifier.get(root);
            }
            Deque<AstNode> work = new ArrayDeque<>();
            work.push(root);
            AstNode found = null;
            while (!work.isEmpty() && found == null) {
                AstNode n = work.pop();
                if (n != root && firstIdentifier.containsKey(n)) {
                    found = firstIdentifier.get(n);
                    if (found == null) {
                        continue;
                    }
                    break;
                }
                if (skipped(n)) {
                    continue;
                }
                if (n.is(NodeKind.IDENTIFIER) && n.name() != null) {
                    found = n;
                    break;
                }
                for (int i = n.children.size() - 1; i >= 0; i--) {
                    work.push(n.children.get(i));
                }
            }
            firstIdentifier.put(root, found);
            return found;
        }
    }
}
