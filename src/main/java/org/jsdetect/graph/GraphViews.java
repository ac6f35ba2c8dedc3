package org.jsdetect.graph;

import org.jsdetect.ast.AstNode;
import org.jsdetect.ast.ParsedScript;
import org.jsdetect.ast.Token;

import java.util.*;

/**
 * 按分析层级从同一个文件的分析结果取出 {@link LabeledGraph}
 */
public final class GraphViews {

    private GraphViews() {
    }

    /**
     * @param graph 程序图；tokens / ast 层级可以为 null
     */
    public static LabeledGraph view(AnalysisLevel level, ParsedScript script, ProgramGraph graph) {
        switch (level) {
            case TOKENS:
                return tokens(script);
            case AST:
                return ast(script);
            default:
                if (graph == null) {
                    throw new IllegalArgumentException("Level " + level.key() + " needs a program graph");
                }
                return items(level, graph);
        }
    }

    public static LabeledGraph tokens(ParsedScript script) {
        List<String> labels = new ArrayList<>();
        for (Token t : script.tokens) {
            labels.add(t.type());
        }
        return LabeledGraph.chain(labels);
    }

    /**
     * AST 前序序列，不含 Program 根节点
     */
    public static LabeledGraph ast(ParsedScript script) {
        List<String> labels = new ArrayList<>();
        List<Integer> ids = new ArrayList<>();
        script.root.walk(n -> {
            if (n != script.root) {
                labels.add(n.type);
                ids.add(n.id);
            }
        });
        return LabeledGraph.chain(labels, ids.stream().mapToInt(Integer::intValue).toArray());
    }

    public static LabeledGraph items(AnalysisLevel level, ProgramGraph graph) {
        List<int[]> edges = new ArrayList<>();
        if (level == AnalysisLevel.CFG || level == AnalysisLevel.PDG) {
            graph.cfgSucc.forEach((from, tos) -> {
                for (int to : tos) {
                    edges.add(new int[]{from, to});
                }
            });
        }
        if (level == AnalysisLevel.PDG_DFG || level == AnalysisLevel.PDG) {
            for (DataEdge e : graph.dataEdges) {
                edges.add(new int[]{e.from(), e.to()});
            }
        }
        return LabeledGraph.fromEdges(id -> graph.item(id).label, edges);
    }

    /**
     * @return 该层级的节点对应的 AST 子树，供值特征使用
     */
    public static List<AstNode> evaluatedParts(ProgramGraph graph, LabeledGraph view) {
        List<AstNode> parts = new ArrayList<>();
        for (int i = 0; i < view.size(); i++) {
            parts.addAll(graph.item(view.origin(i)).parts);
        }
        return parts;
    }
}
