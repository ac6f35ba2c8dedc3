package org.jsdetect.graph;

import org.jsdetect.ast.AstNode;
import org.jsdetect.ast.NodeKind;
import org.jsdetect.scope.Binding;
import org.jsdetect.scope.Patterns;
import org.jsdetect.scope.ScopeAnalysis;
import org.jsdetect.scope.ScopeKind;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * 收集一个语句项定义和使用的变量。不进入嵌套函数，只把它们记到 {@link StmtNode#functions}。
 */
public class DefUseCollector {

    private final ScopeAnalysis scopes;
    private final StmtNode item;

    private DefUseCollector(ScopeAnalysis scopes, StmtNode item) {
        this.scopes = scopes;
        this.item = item;
    }

    public static void collect(StmtNode item, ScopeAnalysis scopes) {
        new DefUseCollector(scopes, item).collect();
    }

    private void collect() {
        AstNode anchor = item.astNode;
        if (item.entry) {
            // 参数本身由入口定义产生，这里只收集默认值和计算属性名中的使用
            for (AstNode param : item.parts) {
                for (AstNode expr : Patterns.embeddedExpressions(param)) {
                    analyze(expr);
                }
            }
            return;
        }

        switch (anchor.kind) {
            case FOR_IN_STATEMENT, FOR_OF_STATEMENT -> {
                AstNode left = anchor.child("left");
                if (left != null && left.is(NodeKind.VARIABLE_DECLARATION)) {
                    for (AstNode decl : left.children("declarations")) {
                        definePattern(decl.child("id"));
                    }
                } else {
                    definePattern(left);
                }
                analyze(anchor.child("right"));
                return;
            }
            case CATCH_CLAUSE -> {
                definePattern(anchor.child("param"));
                return;
            }
            case FUNCTION_DECLARATION -> {
                item.functions.add(anchor);
                // 块内的函数声明没有提升到函数入口，由声明项自己定义
                AstNode id = anchor.child("id");
                Binding b = id != null ? scopes.declaration(id) : null;
                if (b != null && b.scope.kind != ScopeKind.FUNCTION && b.scope.kind != ScopeKind.GLOBAL) {
                    item.defs.add(b);
                }
                return;
            }
            case TRY_STATEMENT -> {
                return;
            }
            default -> {
                break;
            }
        }

        // 其它语句项：被求值的子树整体分析
        for (AstNode part : item.parts) {
            analyze(part);
        }
    }

    private void analyze(AstNode root) {
        if (root == null) {
            return;
        }
        Deque<AstNode> stack = new ArrayDeque<>();
        stack.push(root);
        while (!stack.isEmpty()) {
            AstNode n = stack.pop();

            // 1) 嵌套函数：只记录，不进入
            if (n.kind.isFunction()) {
                item.functions.add(n);
                continue;
            }

            switch (n.kind) {
                case IDENTIFIER -> {
                    Binding b = scopes.reference(n);
                    if (b != null) {
                        item.uses.add(b);
                    }
                }
                // 2) 变量声明：有初始值才算定义
                case VARIABLE_DECLARATOR -> {
                    AstNode init = n.child("init");
                    if (init != null) {
                        definePattern(n.child("id"));
                        push(stack, init);
                    } else {
                        pushAll(stack, Patterns.embeddedExpressions(n.child("id")));
                    }
                }
                // 3) 赋值左值：def；复合赋值同时也是 use
                case ASSIGNMENT_EXPRESSION -> {
                    AstNode left = n.child("left");
                    if (!"=".equals(n.attr("operator"))) {
                        useTargets(left);
                    }
                    definePattern(left);
                    push(stack, n.child("right"));
                }
                case UPDATE_EXPRESSION -> {
                    AstNode arg = n.child("argument");
                    if (arg != null && arg.is(NodeKind.IDENTIFIER)) {
                        useTargets(arg);
                        definePattern(arg);
                    } else {
                        push(stack, arg);
                    }
                }
                case CLASS_DECLARATION -> {
                    AstNode id = n.child("id");
                    Binding b = id != null ? scopes.declaration(id) : null;
                    if (b != null) {
                        item.defs.add(b);
                    }
                    push(stack, n.child("body"));
                    push(stack, n.child("superClass"));
                }
                default -> {
                    for (int i = n.children.size() - 1; i >= 0; i--) {
                        stack.push(n.children.get(i));
                    }
                }
            }
        }
    }

    /**
     * 模式中绑定的名字记为 def，其余部分（默认值、计算属性名、成员表达式）按 use 分析
     */
    private void definePattern(AstNode pattern) {
        if (pattern == null) {
            return;
        }
        for (AstNode id : Patterns.boundIdentifiers(pattern)) {
            Binding b = scopes.declaration(id);
            if (b == null) {
                b = scopes.reference(id);
            }
            if (b != null) {
                item.defs.add(b);
            }
        }
        for (AstNode expr : Patterns.embeddedExpressions(pattern)) {
            analyze(expr);
        }
    }

    private void useTargets(AstNode target) {
        if (target == null) {
            return;
        }
        for (AstNode id : Patterns.boundIdentifiers(target)) {
            Binding b = scopes.reference(id);
            if (b != null) {
                item.uses.add(b);
            }
        }
    }

    private static void push(Deque<AstNode> stack, AstNode node) {
        if (node != null) {
            stack.push(node);
        }
    }

    private static void pushAll(Deque<AstNode> stack, Iterable<AstNode> nodes) {
        for (AstNode n : nodes) {
            stack.push(n);
        }
    }
}
