package org.jsdetect.scope;

import org.jsdetect.ast.AstNode;
import org.jsdetect.ast.NodeKind;
import org.jsdetect.ast.ParsedScript;
import org.jsdetect.error.Deadline;

import java.util.*;

/**
 * 作用域分析器：一次自顶向下的遍历，建立作用域链并解析每个标识符引用。
 * <p>
 * 进入函数时先把参数、var 和函数声明登记到函数作用域（提升），
 * 进入块时登记 let / const / class；之后再访问语句，
 * 因此引用解析与访问顺序无关。
 */
public class ScopeAnalyzer {

    private final ScopeAnalysis result;
    private final Deadline deadline;
    private int scopeCounter = 0;
    private int bindingCounter = 0;

    private ScopeAnalyzer(AstNode program, Deadline deadline) {
        this.deadline = deadline;
        this.result = new ScopeAnalysis(new Scope(scopeCounter++, ScopeKind.GLOBAL, null, program));
    }

    public static ScopeAnalysis analyze(ParsedScript script) {
        return analyze(script, Deadline.none());
    }

    public static ScopeAnalysis analyze(ParsedScript script, Deadline deadline) {
        ScopeAnalyzer analyzer = new ScopeAnalyzer(script.root, deadline);
        analyzer.visitProgram(script.root);
        return analyzer.result;
    }

    private void visitProgram(AstNode program) {
        Scope global = result.global;
        result.scopes.put(program, global);
        List<AstNode> body = program.children("body");
        hoist(program, body, global);
        declareLexical(body, global);
        for (AstNode stmt : body) {
            visit(stmt, global);
        }
    }

    // ---------------------------------------------------------------- 遍历

    private void visit(AstNode node, Scope scope) {
        if (node == null) {
            return;
        }
        if (node.kind.isStatement()) {
            deadline.checkpoint();
        }
        switch (node.kind) {
            case FUNCTION_DECLARATION, FUNCTION_EXPRESSION, ARROW_FUNCTION_EXPRESSION -> visitFunction(node, scope);
            case CLASS_DECLARATION, CLASS_EXPRESSION -> visitClass(node, scope);
            case BLOCK_STATEMENT -> {
                Scope block = newScope(ScopeKind.BLOCK, scope, node);
                List<AstNode> body = node.children("body");
                declareLexical(body, block);
                visitAll(body, block);
            }
            case FOR_STATEMENT, FOR_IN_STATEMENT, FOR_OF_STATEMENT -> {
                AstNode head = node.child(node.is(NodeKind.FOR_STATEMENT) ? "init" : "left");
                Scope loopScope = scope;
                if (isLexicalDeclaration(head)) {
                    loopScope = newScope(ScopeKind.BLOCK, scope, node);
                    declareLexical(List.of(head), loopScope);
                }
                visitAll(node.children, loopScope);
            }
            case SWITCH_STATEMENT -> {
                visit(node.child("discriminant"), scope);
                Scope switchScope = newScope(ScopeKind.BLOCK, scope, node);
                List<AstNode> consequents = new ArrayList<>();
                for (AstNode c : node.children("cases")) {
                    consequents.addAll(c.children("consequent"));
                }
                declareLexical(consequents, switchScope);
                visitAll(node.children("cases"), switchScope);
            }
            case CATCH_CLAUSE -> {
                Scope catchScope = newScope(ScopeKind.CATCH, scope, node);
                AstNode param = node.child("param");
                if (param != null) {
                    for (AstNode id : Patterns.boundIdentifiers(param)) {
                        declare(id, BindingKind.CATCH_PARAM, catchScope);
                    }
                    visitAll(Patterns.embeddedExpressions(param), catchScope);
                }
                visit(node.child("body"), catchScope);
            }
            case IDENTIFIER -> {
                if (!result.declarations.containsKey(node) && Patterns.isReference(node)) {
                    resolve(node, scope);
                }
            }
            default -> visitAll(node.children, scope);
        }
    }

    private void visitAll(List<AstNode> nodes, Scope scope) {
        for (AstNode n : nodes) {
            visit(n, scope);
        }
    }

    private void visitFunction(AstNode fn, Scope scope) {
        Scope outer = scope;
        AstNode id = fn.child("id");
        if (fn.is(NodeKind.FUNCTION_EXPRESSION) && id != null) {
            // 具名函数表达式：名字只在函数自身内部可见
            outer = newScope(ScopeKind.FUNCTION_NAME, scope, fn);
            Binding self = declare(id, BindingKind.FUNCTION_NAME, outer);
            addHoisted(fn, self);
        }
        Scope fnScope = new Scope(scopeCounter++, ScopeKind.FUNCTION, outer, fn);
        result.scopes.put(fn, fnScope);

        List<AstNode> params = fn.children("params");
        for (AstNode param : params) {
            for (AstNode pid : Patterns.boundIdentifiers(param)) {
                addHoisted(fn, declare(pid, BindingKind.PARAM, fnScope));
            }
        }
        for (AstNode param : params) {
            visitAll(Patterns.embeddedExpressions(param), fnScope);
        }

        AstNode body = fn.child("body");
        if (body == null) {
            return;
        }
        if (body.is(NodeKind.BLOCK_STATEMENT)) {
            // 函数体与参数共用函数作用域
            List<AstNode> statements = body.children("body");
            hoist(fn, statements, fnScope);
            declareLexical(statements, fnScope);
            visitAll(statements, fnScope);
        } else {
            visit(body, fnScope);
        }
    }

    private void visitClass(AstNode cls, Scope scope) {
        Scope inner = scope;
        AstNode id = cls.child("id");
        if (cls.is(NodeKind.CLASS_EXPRESSION) && id != null) {
            inner = newScope(ScopeKind.CLASS, scope, cls);
            declare(id, BindingKind.CLASS, inner);
        }
        visit(cls.child("superClass"), scope);
        visit(cls.child("body"), inner);
    }

    // ---------------------------------------------------------------- 声明

    /**
     * var、顶层函数声明和 import 提升到函数作用域；不进入嵌套函数
     */
    private void hoist(AstNode fn, List<AstNode> statements, Scope fnScope) {
        Deque<AstNode> stack = new ArrayDeque<>();
        for (int i = statements.size() - 1; i >= 0; i--) {
            stack.push(statements.get(i));
        }
        while (!stack.isEmpty()) {
            AstNode n = stack.pop();
            if (n.is(NodeKind.FUNCTION_DECLARATION)) {
                if (isTopLevel(n, statements) && n.child("id") != null) {
                    addHoisted(fn, declare(n.child("id"), BindingKind.FUNCTION, fnScope));
                }
                continue;
            }
            if (n.kind.isFunction() || n.is(NodeKind.CLASS_DECLARATION) || n.is(NodeKind.CLASS_EXPRESSION)) {
                continue;
            }
            if (n.is(NodeKind.VARIABLE_DECLARATION) && "var".equals(n.attr("kind"))) {
                for (AstNode decl : n.children("declarations")) {
                    for (AstNode id : Patterns.boundIdentifiers(decl.child("id"))) {
                        addHoisted(fn, declare(id, BindingKind.VAR, fnScope));
                    }
                }
            } else if (n.is(NodeKind.IMPORT_DECLARATION)) {
                for (AstNode spec : n.children("specifiers")) {
                    AstNode local = spec.child("local");
                    if (local != null) {
                        addHoisted(fn, declare(local, BindingKind.IMPORT, fnScope));
                    }
                }
                continue;
            }
            for (int i = n.children.size() - 1; i >= 0; i--) {
                stack.push(n.children.get(i));
            }
        }
    }

    /**
     * 块入口登记 let / const / class；块内（非函数体顶层）的函数声明也登记在块上
     */
    private void declareLexical(List<AstNode> statements, Scope scope) {
        boolean functionLevel = scope.kind == ScopeKind.FUNCTION || scope.kind == ScopeKind.GLOBAL;
        for (AstNode stmt : statements) {
            AstNode decl = unwrapExport(stmt);
            if (decl == null) {
                continue;
            }
            if (isLexicalDeclaration(decl)) {
                BindingKind kind = "const".equals(decl.attr("kind")) ? BindingKind.CONST : BindingKind.LET;
                for (AstNode d : decl.children("declarations")) {
                    for (AstNode id : Patterns.boundIdentifiers(d.child("id"))) {
                        declare(id, kind, scope);
                    }
                }
            } else if (decl.is(NodeKind.CLASS_DECLARATION) && decl.child("id") != null) {
                declare(decl.child("id"), BindingKind.CLASS, scope);
            } else if (decl.is(NodeKind.FUNCTION_DECLARATION) && !functionLevel && decl.child("id") != null) {
                declare(decl.child("id"), BindingKind.FUNCTION, scope);
            }
        }
    }

    private Binding declare(AstNode id, BindingKind kind, Scope scope) {
        String name = id.name();
        Binding existing = scope.own(name);
        if (existing != null) {
            // 重复声明（var x; var x; 或 function f 与 var f）共用同一个 Binding
            result.declarations.put(id, existing);
            return existing;
        }
        Binding binding = new Binding(bindingCounter++, name, kind, scope, id);
        scope.put(binding);
        result.bindings.add(binding);
        result.declarations.put(id, binding);
        return binding;
    }

    private void addHoisted(AstNode fn, Binding binding) {
        List<Binding> list = result.hoisted.computeIfAbsent(fn, k -> new ArrayList<>());
        if (!list.contains(binding)) {
            list.add(binding);
        }
    }

    // ---------------------------------------------------------------- 引用

    private void resolve(AstNode id, Scope scope) {
        String name = id.name();
        if (name == null) {
            return;
        }
        Binding binding = scope.lookup(name);
        if (binding == null) {
            binding = new Binding(bindingCounter++, name, BindingKind.IMPLICIT_GLOBAL, result.global, null);
            result.global.put(binding);
            result.bindings.add(binding);
        } else if (binding.kind.isLexical()
                && binding.scope.functionScope() == scope.functionScope()
                && id.range.isKnown() && binding.position >= 0
                && id.range.start() < binding.position) {
            result.unbound.add(new UnboundReference(name, id.range, binding.declaration.range));
            return;
        }
        result.references.put(id, binding);
    }

    // ---------------------------------------------------------------- 工具

    private Scope newScope(ScopeKind kind, Scope parent, AstNode owner) {
        Scope scope = new Scope(scopeCounter++, kind, parent, owner);
        if (kind != ScopeKind.FUNCTION_NAME) {
            result.scopes.put(owner, scope);
        }
        return scope;
    }

    private static boolean isLexicalDeclaration(AstNode node) {
        if (node == null || !node.is(NodeKind.VARIABLE_DECLARATION)) {
            return false;
        }
        String kind = node.attr("kind");
        return "let".equals(kind) || "const".equals(kind);
    }

    private static AstNode unwrapExport(AstNode stmt) {
        if (stmt.is(NodeKind.EXPORT_NAMED_DECLARATION) || stmt.is(NodeKind.EXPORT_DEFAULT_DECLARATION)) {
            return stmt.child("declaration");
        }
        return stmt;
    }

    private static boolean isTopLevel(AstNode fnDecl, List<AstNode> statements) {
        for (AstNode stmt : statements) {
            if (stmt == fnDecl || unwrapExport(stmt) == fnDecl) {
                return true;
            }
        }
        return false;
    }
}
