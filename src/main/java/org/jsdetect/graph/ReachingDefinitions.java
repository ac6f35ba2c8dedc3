package org.jsdetect.graph;

import org.jsdetect.error.Deadline;
import org.jsdetect.scope.Binding;

import java.util.*;

/**
 * 一个函数上的到达定值分析。
 * <p>
 * 每个块一对 IN / OUT 位集，OUT[B] = GEN[B] ∪ (IN[B] − KILL[B])，
 * 以块顺序作为初始工作表迭代到不动点。入口项一次性产生参数、提升的函数、import
 * 和从外层捕获的定义，它们之间互不杀死。
 */
public class ReachingDefinitions {

    private final ControlFlowGraph cfg;
    private final List<Definition> definitions = new ArrayList<>();
    private final Map<Binding, BitSet> byBinding = new IdentityHashMap<>();
    // 语句项 id -> 它产生的定义
    private final Map<Integer, BitSet> generatedBy = new HashMap<>();
    // 每个语句项处的 IN（该项执行之前）
    private final Map<Integer, BitSet> itemIn = new HashMap<>();

    private BitSet[] in;
    private BitSet[] out;

    /**
     * @param entryDefinitions 由入口项产生的定义
     */
    public ReachingDefinitions(ControlFlowGraph cfg, List<Definition> entryDefinitions) {
        this.cfg = cfg;
        for (Definition d : entryDefinitions) {
            register(d);
        }
        for (BasicBlock b : cfg.blocks) {
            for (StmtNode item : b.items) {
                if (item.entry) {
                    continue;
                }
                for (Binding binding : item.defs) {
                    register(new Definition(binding, item, item));
                }
            }
        }
    }

    private void register(Definition d) {
        byBinding.computeIfAbsent(d.binding(), k -> new BitSet()).set(definitions.size());
        generatedBy.computeIfAbsent(d.generator().id, k -> new BitSet()).set(definitions.size());
        definitions.add(d);
    }

    public List<Definition> definitions() {
        return Collections.unmodifiableList(definitions);
    }

    /**
     * 迭代计算直到不动点
     */
    public ReachingDefinitions solve(Deadline deadline) {
        int n = cfg.blocks.size();
        BitSet[] gen = new BitSet[n];
        BitSet[] kill = new BitSet[n];
        in = new BitSet[n];
        out = new BitSet[n];
        for (BasicBlock b : cfg.blocks) {
            BitSet g = new BitSet();
            BitSet k = new BitSet();
            for (StmtNode item : b.items) {
                transfer(item, g, k);
            }
            gen[b.index] = g;
            kill[b.index] = k;
            in[b.index] = new BitSet();
            out[b.index] = (BitSet) g.clone();
        }

        Deque<BasicBlock> worklist = new ArrayDeque<>(cfg.blocks);
        boolean[] queued = new boolean[n];
        Arrays.fill(queued, true);
        while (!worklist.isEmpty()) {
            deadline.checkpoint();
            BasicBlock b = worklist.poll();
            queued[b.index] = false;

            // IN[B] = 所有前驱 OUT 的并集
            BitSet newIn = new BitSet();
            for (ControlEdge e : cfg.predecessors(b)) {
                newIn.or(out[cfg.block(e.from()).index]);
            }
            BitSet newOut = (BitSet) newIn.clone();
            newOut.andNot(kill[b.index]);
            newOut.or(gen[b.index]);

            in[b.index] = newIn;
            if (!newOut.equals(out[b.index])) {
                out[b.index] = newOut;
                for (ControlEdge e : cfg.successors(b)) {
                    BasicBlock s = cfg.block(e.to());
                    if (!queued[s.index]) {
                        queued[s.index] = true;
                        worklist.add(s);
                    }
                }
            }
        }

        // 块内逐项推进，得到每个语句项处的 IN
        for (BasicBlock b : cfg.blocks) {
            BitSet current = (BitSet) in[b.index].clone();
            for (StmtNode item : b.items) {
                itemIn.put(item.id, (BitSet) current.clone());
                transfer(item, current, null);
            }
        }
        return this;
    }

    /**
     * 单个语句项的传递函数：先杀死同一变量的其它定义，再加入本项的定义
     */
    private void transfer(StmtNode item, BitSet live, BitSet kill) {
        BitSet generated = generatedBy.get(item.id);
        if (generated == null) {
            return;
        }
        if (!item.entry) {
            for (int i = generated.nextSetBit(0); i >= 0; i = generated.nextSetBit(i + 1)) {
                BitSet same = byBinding.get(definitions.get(i).binding());
                live.andNot(same);
                if (kill != null) {
                    kill.or(same);
                }
            }
        }
        live.or(generated);
    }

    /**
     * @return 在该语句项执行之前到达的定义
     */
    public List<Definition> reachingAt(StmtNode item) {
        BitSet bits = itemIn.get(item.id);
        List<Definition> result = new ArrayList<>();
        if (bits == null) {
            return result;
        }
        for (int i = bits.nextSetBit(0); i >= 0; i = bits.nextSetBit(i + 1)) {
            result.add(definitions.get(i));
        }
        return result;
    }

    /**
     * 对每个语句项使用的变量，从到达该项的同一变量的每个定义连一条数据边
     */
    public void collectDataEdges(Collection<DataEdge> sink) {
        for (BasicBlock b : cfg.blocks) {
            for (StmtNode item : b.items) {
                if (item.uses.isEmpty()) {
                    continue;
                }
                BitSet reaching = itemIn.get(item.id);
                for (Binding use : item.uses) {
                    BitSet same = byBinding.get(use);
                    if (same == null) {
                        continue;
                    }
                    BitSet hits = (BitSet) reaching.clone();
                    hits.and(same);
                    for (int i = hits.nextSetBit(0); i >= 0; i = hits.nextSetBit(i + 1)) {
                        sink.add(new DataEdge(definitions.get(i).site().id, item.id, use.name));
                    }
                }
            }
        }
    }
}
