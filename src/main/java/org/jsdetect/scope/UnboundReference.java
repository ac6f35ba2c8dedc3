package org.jsdetect.scope;

import org.jsdetect.ast.SourceRange;

/**
 * 在 let / const / class 声明之前使用了该名字。
 * 只作记录，不中断分析；该引用不会得到任何数据依赖边。
 */
public record UnboundReference(String name, SourceRange range, SourceRange declaredAt) {

    @Override
    public String toString() {
        return "UnboundReference(" + name + " at " + range.start() + ", declared at " + declaredAt.start() + ")";
    }
}
