package org.jsdetect.scope;

import org.jsdetect.ast.AstNode;

/**
 * 作用域中的一个名字。
 * <p>
 * 不重写 equals：同名变量在不同作用域里是不同的 Binding，集合中按引用区分。
 */
public class Binding {
    public final int id;
    public final String name;
    public final BindingKind kind;
    public final Scope scope;
    public final AstNode declaration;   // 声明处的 Identifier，隐式全局变量为 null
    public final int position;          // 声明在源码中的偏移，用于暂时性死区判断

    public Binding(int id, String name, BindingKind kind, Scope scope, AstNode declaration) {
        this.id = id;
        this.name = name;
        this.kind = kind;
        this.scope = scope;
        this.declaration = declaration;
        this.position = declaration != null ? declaration.range.start() : -1;
    }

    @Override
    public String toString() {
        return name + "@" + kind + "#" + id;
    }
}
