package org.jsdetect.graph;

import org.jsdetect.ast.AstNode;
import org.jsdetect.scope.Binding;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * 图中的一个语句项：一条语句，或控制结构被求值的那一部分（条件、循环头、case 测试等）
 */
public class StmtNode {
    public final int id;                 // 文件内编号，也是 ProgramGraph.items 的下标
    public final String label;           // 锚点的 ESTree 类型名
    public final int function;           // 所属函数 CFG 的下标
    public final int block;              // 所属基本块 id
    public final boolean entry;          // 函数的合成入口项

    public final Set<Binding> defs = new LinkedHashSet<>(); // 定义的变量
    public final Set<Binding> uses = new LinkedHashSet<>(); // 使用的变量

    // AST 引用，不参与 JSON 序列化
    public final transient AstNode astNode;
    public final transient List<AstNode> parts;               // 该项实际求值的子树
    public final transient List<AstNode> functions = new ArrayList<>(); // 该项创建的嵌套函数

    public StmtNode(int id, AstNode astNode, List<AstNode> parts, int function, int block, boolean entry) {
        this.id = id;
        this.label = astNode.type;
        this.astNode = astNode;
        this.parts = List.copyOf(parts);
        this.function = function;
        this.block = block;
        this.entry = entry;
    }

    @Override
    public String toString() {
        return id + ":" + label;
    }
}
