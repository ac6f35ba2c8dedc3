package org.jsdetect.graph;

import java.util.ArrayList;
import java.util.List;

/**
 * 基本块：一串没有内部分支的语句项
 */
public class BasicBlock {
    public final int id;          // 文件内唯一
    public final int index;       // 在所属 CFG 中的下标
    public final int function;    // 所属函数 CFG 的下标
    public final List<StmtNode> items = new ArrayList<>();
    public boolean entry;
    public boolean exit;

    public BasicBlock(int id, int index, int function) {
        this.id = id;
        this.index = index;
        this.function = function;
    }

    public boolean isEmpty() {
        return items.isEmpty();
    }

    public StmtNode first() {
        return items.isEmpty() ? null : items.get(0);
    }

    public StmtNode last() {
        return items.isEmpty() ? null : items.get(items.size() - 1);
    }

    @Override
    public String toString() {
        return "B" + id + (entry ? "(entry)" : "") + (exit ? "(exit)" : "") + items;
    }
}
