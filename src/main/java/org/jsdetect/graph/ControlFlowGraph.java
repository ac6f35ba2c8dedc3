package org.jsdetect.graph;

import org.jsdetect.ast.AstNode;

import java.util.*;

/**
 * 一个函数（或顶层脚本）的控制流图：一个入口块，一个合成的出口块
 */
public class ControlFlowGraph {
    public final int index;
    public final transient AstNode function;
    public final List<BasicBlock> blocks = new ArrayList<>();
    public final List<ControlEdge> edges = new ArrayList<>();

    public BasicBlock entry;
    public BasicBlock exit;
    public StmtNode entryItem;

    private final transient Set<ControlEdge> edgeSet = new HashSet<>();
    private final transient Map<Integer, List<ControlEdge>> succ = new HashMap<>();
    private final transient Map<Integer, List<ControlEdge>> pred = new HashMap<>();

    public ControlFlowGraph(int index, AstNode function) {
        this.index = index;
        this.function = function;
    }

    /**
     * 同一对块之间同类型的边只保留一条
     */
    void addEdge(BasicBlock from, BasicBlock to, EdgeKind kind) {
        ControlEdge edge = new ControlEdge(from.id, to.id, kind);
        if (edgeSet.add(edge)) {
            edges.add(edge);
            succ.computeIfAbsent(from.id, k -> new ArrayList<>()).add(edge);
            pred.computeIfAbsent(to.id, k -> new ArrayList<>()).add(edge);
        }
    }

    public List<ControlEdge> successors(BasicBlock block) {
        return succ.getOrDefault(block.id, Collections.emptyList());
    }

    public List<ControlEdge> predecessors(BasicBlock block) {
        return pred.getOrDefault(block.id, Collections.emptyList());
    }

    /**
     * 块 id 在本 CFG 中的块；不属于本 CFG 时返回 null
     */
    public BasicBlock block(int blockId) {
        int local = blockId - blocks.get(0).id;
        if (local < 0 || local >= blocks.size()) {
            return null;
        }
        return blocks.get(local);
    }

    /**
     * @return 从入口沿控制边可达的块 id
     */
    public Set<Integer> reachableBlocks() {
        Set<Integer> visited = new HashSet<>();
        Deque<BasicBlock> work = new ArrayDeque<>();
        work.push(entry);
        visited.add(entry.id);
        while (!work.isEmpty()) {
            BasicBlock b = work.pop();
            for (ControlEdge e : successors(b)) {
                if (visited.add(e.to())) {
                    work.push(block(e.to()));
                }
            }
        }
        return visited;
    }
}
