package org.jsdetect.graph;

import org.jsdetect.ast.AstNode;
import org.jsdetect.scope.ScopeAnalysis;
import org.jsdetect.scope.UnboundReference;

import java.util.*;

/**
 * 存放一个文件的所有语句项 + 每个函数的 CFG + 语句级控制边 + 数据边
 */
public class ProgramGraph {
    // 按创建顺序收集的语句项，下标即 id
    public final List<StmtNode> items = new ArrayList<>();

    // 所有基本块，下标即 id
    public final List<BasicBlock> blocks = new ArrayList<>();

    // 每个函数一个 CFG，下标 0 是顶层脚本
    public final List<ControlFlowGraph> functions = new ArrayList<>();

    // 语句级控制流后继：id -> 后继 id（有序）
    public final Map<Integer, SortedSet<Integer>> cfgSucc = new TreeMap<>();

    // 数据流边：定义项 -> 使用项
    public final SortedSet<DataEdge> dataEdges = new TreeSet<>();

    public final List<UnboundReference> unbound = new ArrayList<>();

    public final transient ScopeAnalysis scopes;

    // 函数节点 -> 其 CFG（内部使用）
    private final transient Map<AstNode, ControlFlowGraph> byFunction = new IdentityHashMap<>();

    public ProgramGraph(ScopeAnalysis scopes) {
        this.scopes = scopes;
        this.unbound.addAll(scopes.unbound);
    }

    ControlFlowGraph newFunction(AstNode function) {
        ControlFlowGraph cfg = new ControlFlowGraph(functions.size(), function);
        functions.add(cfg);
        byFunction.put(function, cfg);
        return cfg;
    }

    BasicBlock newBlock(ControlFlowGraph cfg) {
        BasicBlock block = new BasicBlock(blocks.size(), cfg.blocks.size(), cfg.index);
        blocks.add(block);
        cfg.blocks.add(block);
        return block;
    }

    StmtNode newItem(AstNode anchor, List<AstNode> parts, BasicBlock block, boolean entry) {
        StmtNode item = new StmtNode(items.size(), anchor, parts, block.function, block.id, entry);
        items.add(item);
        block.items.add(item);
        return item;
    }

    public ControlFlowGraph cfgOf(AstNode function) {
        return byFunction.get(function);
    }

    public StmtNode item(int id) {
        return items.get(id);
    }

    void addControl(StmtNode from, StmtNode to) {
        cfgSucc.computeIfAbsent(from.id, k -> new TreeSet<>()).add(to.id);
    }

    /**
     * 把块级控制边展开成语句级：块内相邻项相连，块的最后一项连到每个后继块的第一项，
     * 空块（例如合成出口）向后跳过。
     */
    void linkItems(ControlFlowGraph cfg) {
        for (BasicBlock b : cfg.blocks) {
            for (int i = 0; i + 1 < b.items.size(); i++) {
                addControl(b.items.get(i), b.items.get(i + 1));
            }
            StmtNode last = b.last();
            if (last == null) {
                continue;
            }
            for (StmtNode next : firstItemsAfter(cfg, b)) {
                addControl(last, next);
            }
        }
    }

    private List<StmtNode> firstItemsAfter(ControlFlowGraph cfg, BasicBlock b) {
        List<StmtNode> result = new ArrayList<>();
        Set<Integer> visited = new HashSet<>();
        Deque<BasicBlock> work = new ArrayDeque<>();
        for (ControlEdge e : cfg.successors(b)) {
            work.add(cfg.block(e.to()));
        }
        while (!work.isEmpty()) {
            BasicBlock next = work.poll();
            if (!visited.add(next.id)) {
                continue;
            }
            if (!next.isEmpty()) {
                result.add(next.first());
                continue;
            }
            for (ControlEdge e : cfg.successors(next)) {
                work.add(cfg.block(e.to()));
            }
        }
        return result;
    }
}
