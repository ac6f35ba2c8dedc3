package org.jsdetect.scope;

import org.jsdetect.ast.AstNode;

import java.util.*;

/**
 * 作用域分析的结果，对 AST 只做附加标注，不修改树本身
 */
public class ScopeAnalysis {
    public final Scope global;

    // 创建作用域的节点 -> 作用域（函数节点对应其函数作用域）
    public final Map<AstNode, Scope> scopes = new IdentityHashMap<>();

    // 引用处的 Identifier -> 解析到的声明；暂时性死区里的引用不在此表中
    public final Map<AstNode, Binding> references = new IdentityHashMap<>();

    // 声明处的 Identifier（变量名、参数、函数名、类名、catch 参数、import）-> 声明
    public final Map<AstNode, Binding> declarations = new IdentityHashMap<>();

    // 函数节点（含 Program）-> 提升到该函数作用域的声明：参数、var、函数声明、import
    public final Map<AstNode, List<Binding>> hoisted = new IdentityHashMap<>();

    public final List<UnboundReference> unbound = new ArrayList<>();

    public final List<Binding> bindings = new ArrayList<>();

    public ScopeAnalysis(Scope global) {
        this.global = global;
    }

    public Binding reference(AstNode identifier) {
        return references.get(identifier);
    }

    public Binding declaration(AstNode identifier) {
        return declarations.get(identifier);
    }

    public List<Binding> hoistedIn(AstNode function) {
        return hoisted.getOrDefault(function, Collections.emptyList());
    }

    /**
     * @return 包含该节点的最内层作用域
     */
    public Scope scopeOf(AstNode node) {
        for (AstNode n = node; n != null; n = n.parent) {
            Scope s = scopes.get(n);
            if (s != null) {
                return s;
            }
        }
        return global;
    }
}
