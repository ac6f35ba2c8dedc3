package org.jsdetect.graph;

import org.jsdetect.ast.AstNode;
import org.jsdetect.ast.NodeKind;
import org.jsdetect.ast.ParsedScript;
import org.jsdetect.error.Deadline;
import org.jsdetect.scope.Binding;
import org.jsdetect.scope.ScopeAnalysis;
import org.jsdetect.scope.ScopeAnalyzer;
import org.jsdetect.scope.ScopeKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * 脚本分析器，用于分析一个 JavaScript 文件并构建程序图
 * <p>
 * 先做作用域分析，再按“外层先于内层”的顺序为顶层脚本和每个嵌套函数构建 CFG，
 * 最后按同样的顺序做到达定值分析并生成数据边。内层函数入口处带入的外层定义由
 * {@link ClosureCapturePolicy} 决定。
 */
public class ScriptAnalyzer {

    private static final Logger logger = LoggerFactory.getLogger(ScriptAnalyzer.class);

    private final ClosureCapturePolicy capturePolicy;
    private final int maxGraphNodes;

    public ScriptAnalyzer() {
        this(ClosureCapturePolicy.REACHABLE_FROM_DECLARATION, Integer.MAX_VALUE);
    }

    /**
     * @param capturePolicy 闭包捕获策略
     * @param maxGraphNodes 允许的最大语句项数
     */
    public ScriptAnalyzer(ClosureCapturePolicy capturePolicy, int maxGraphNodes) {
        this.capturePolicy = capturePolicy;
        this.maxGraphNodes = maxGraphNodes;
    }

    public ProgramGraph analyze(ParsedScript script) {
        return analyze(script, Deadline.none());
    }

    /**
     * 分析给定的脚本并构建程序图
     *
     * @param script   已读取的 AST
     * @param deadline 本文件的截止时间
     * @return 包含语句项、控制流和数据流信息的程序图
     */
    public ProgramGraph analyze(ParsedScript script, Deadline deadline) {
        ScopeAnalysis scopes = ScopeAnalyzer.analyze(script, deadline);
        ProgramGraph graph = new ProgramGraph(scopes);

        // 1. 逐个函数构建 CFG；队列保证外层先于内层
        Map<AstNode, StmtNode> declaredBy = new IdentityHashMap<>();
        Deque<AstNode> queue = new ArrayDeque<>();
        queue.add(script.root);
        while (!queue.isEmpty()) {
            AstNode fn = queue.poll();
            ControlFlowGraph cfg = new CfgBuilder(graph, deadline, maxGraphNodes).build(fn);
            for (BasicBlock b : cfg.blocks) {
                for (StmtNode item : b.items) {
                    for (AstNode inner : item.functions) {
                        if (declaredBy.putIfAbsent(inner, item) == null) {
                            queue.add(inner);
                        }
                    }
                }
            }
        }

        // 2. 到达定值 + 数据边，同样外层先于内层
        Map<AstNode, StmtNode> itemByAnchor = new IdentityHashMap<>();
        for (StmtNode item : graph.items) {
            if (!item.entry) {
                itemByAnchor.putIfAbsent(item.astNode, item);
            }
        }
        Map<AstNode, ReachingDefinitions> solved = new IdentityHashMap<>();
        for (ControlFlowGraph cfg : graph.functions) {
            List<Definition> entryDefs = entryDefinitions(cfg, graph, itemByAnchor);
            StmtNode declaration = declaredBy.get(cfg.function);
            if (declaration != null) {
                ControlFlowGraph outer = graph.functions.get(declaration.function);
                entryDefs.addAll(captured(cfg, outer, solved.get(outer.function), declaration, scopes));
            }
            ReachingDefinitions rd = new ReachingDefinitions(cfg, entryDefs).solve(deadline);
            solved.put(cfg.function, rd);
            rd.collectDataEdges(graph.dataEdges);
        }

        logger.debug("Built {} CFGs, {} items, {} data edges, {} unbound references",
                graph.functions.size(), graph.items.size(), graph.dataEdges.size(), graph.unbound.size());
        return graph;
    }

    /**
     * 入口项产生的定义：参数、具名函数表达式自身的名字、import、提升的函数声明（定义点是声明项）
     */
    private static List<Definition> entryDefinitions(ControlFlowGraph cfg, ProgramGraph graph,
                                                     Map<AstNode, StmtNode> itemByAnchor) {
        StmtNode entry = cfg.entryItem;
        List<Definition> defs = new ArrayList<>();
        for (Binding b : graph.scopes.hoistedIn(cfg.function)) {
            switch (b.kind) {
                case PARAM, IMPORT, FUNCTION_NAME -> defs.add(new Definition(b, entry, entry));
                case FUNCTION -> {
                    StmtNode site = b.declaration != null ? itemByAnchor.get(b.declaration.parent) : null;
                    defs.add(new Definition(b, site != null ? site : entry, entry));
                }
                default -> {
                    // var 在赋值之前没有值，不产生定义
                }
            }
        }
        return defs;
    }

    /**
     * 从外层函数带入内层函数入口的定义，只保留内层实际引用到的外层变量
     */
    private List<Definition> captured(ControlFlowGraph inner, ControlFlowGraph outer, ReachingDefinitions outerRd,
                                      StmtNode declaration, ScopeAnalysis scopes) {
        if (outerRd == null) {
            return Collections.emptyList();
        }
        Set<Binding> free = freeBindings(inner.function, scopes);
        if (free.isEmpty()) {
            return Collections.emptyList();
        }

        Collection<StmtNode> points;
        if (capturePolicy == ClosureCapturePolicy.DECLARATION_POINT) {
            points = List.of(declaration);
        } else {
            StmtNode start = isHoisted(inner.function, scopes) ? outer.entryItem : declaration;
            points = itemsReachableFrom(outer, start);
        }

        Map<Binding, Set<StmtNode>> seen = new IdentityHashMap<>();
        List<Definition> result = new ArrayList<>();
        for (StmtNode p : points) {
            for (Definition d : outerRd.reachingAt(p)) {
                if (!free.contains(d.binding())) {
                    continue;
                }
                if (seen.computeIfAbsent(d.binding(), k -> new HashSet<>()).add(d.site())) {
                    result.add(new Definition(d.binding(), d.site(), inner.entryItem));
                }
            }
        }
        return result;
    }

    /**
     * 函数子树中引用到、但声明在函数之外的变量（包括隐式全局变量）
     */
    static Set<Binding> freeBindings(AstNode function, ScopeAnalysis scopes) {
        Set<Binding> free = Collections.newSetFromMap(new IdentityHashMap<>());
        function.walk(n -> {
            if (n.is(NodeKind.IDENTIFIER)) {
                Binding b = scopes.reference(n);
                if (b != null && !declaredWithin(b, function)) {
                    free.add(b);
                }
            }
        });
        return free;
    }

    private static boolean declaredWithin(Binding b, AstNode function) {
        if (b.declaration == null) {
            return false;
        }
        // 函数声明自身的名字属于外层
        if (function.is(NodeKind.FUNCTION_DECLARATION) && b.declaration == function.child("id")) {
            return false;
        }
        for (AstNode n = b.declaration; n != null; n = n.parent) {
            if (n == function) {
                return true;
            }
        }
        return false;
    }

    private static boolean isHoisted(AstNode function, ScopeAnalysis scopes) {
        if (!function.is(NodeKind.FUNCTION_DECLARATION) || function.child("id") == null) {
            return false;
        }
        Binding b = scopes.declaration(function.child("id"));
        return b != null && (b.scope.kind == ScopeKind.FUNCTION || b.scope.kind == ScopeKind.GLOBAL);
    }

    /**
     * 从 start 出发（含 start）沿控制流可达的语句项
     */
    static List<StmtNode> itemsReachableFrom(ControlFlowGraph cfg, StmtNode start) {
        List<StmtNode> result = new ArrayList<>();
        BasicBlock first = cfg.block(start.block);
        int startIndex = first.items.indexOf(start);
        result.addAll(first.items.subList(startIndex, first.items.size()));

        Set<Integer> visited = new HashSet<>();
        Deque<BasicBlock> work = new ArrayDeque<>();
        for (ControlEdge e : cfg.successors(first)) {
            work.add(cfg.block(e.to()));
        }
        while (!work.isEmpty()) {
            BasicBlock b = work.poll();
            if (!visited.add(b.id)) {
                continue;
            }
            if (b == first) {
                // 经过回边再次到达起点所在的块：前半部分也可达
                result.addAll(first.items.subList(0, startIndex));
            } else {
                result.addAll(b.items);
            }
            for (ControlEdge e : cfg.successors(b)) {
                work.add(cfg.block(e.to()));
            }
        }
        return result;
    }
}
