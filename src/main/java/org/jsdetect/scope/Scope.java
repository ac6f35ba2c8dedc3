package org.jsdetect.scope;

import org.jsdetect.ast.AstNode;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 词法作用域：名字到声明的映射，链接到外层作用域
 */
public class Scope {
    public final int id;
    public final ScopeKind kind;
    public final Scope parent;
    public final AstNode owner;   // 创建该作用域的节点：Program / 函数 / 块 / catch ...

    private final Map<String, Binding> bindings = new LinkedHashMap<>();

    public Scope(int id, ScopeKind kind, Scope parent, AstNode owner) {
        this.id = id;
        this.kind = kind;
        this.parent = parent;
        this.owner = owner;
    }

    public Binding own(String name) {
        return bindings.get(name);
    }

    public Collection<Binding> bindings() {
        return Collections.unmodifiableCollection(bindings.values());
    }

    void put(Binding binding) {
        bindings.put(binding.name, binding);
    }

    /**
     * 沿作用域链查找
     */
    public Binding lookup(String name) {
        for (Scope s = this; s != null; s = s.parent) {
            Binding b = s.bindings.get(name);
            if (b != null) {
                return b;
            }
        }
        return null;
    }

    /**
     * @return 最近的函数级作用域（全局作用域也算）
     */
    public Scope functionScope() {
        Scope s = this;
        while (s.kind != ScopeKind.FUNCTION && s.kind != ScopeKind.GLOBAL) {
            s = s.parent;
        }
        return s;
    }

    /**
     * @return 拥有该作用域的函数节点（Program 或函数）
     */
    public AstNode functionNode() {
        return functionScope().owner;
    }

    @Override
    public String toString() {
        return kind + "#" + id + bindings.keySet();
    }
}
