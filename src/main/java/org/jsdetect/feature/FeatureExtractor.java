package org.jsdetect.feature;

import org.jsdetect.ast.ParsedScript;
import org.jsdetect.error.Deadline;
import org.jsdetect.graph.AnalysisLevel;
import org.jsdetect.graph.GraphViews;
import org.jsdetect.graph.LabeledGraph;
import org.jsdetect.graph.ProgramGraph;

/**
 * 按层级和特征类型从一个文件的分析结果中取特征
 */
public class FeatureExtractor {

    private final int ngramLength;
    private final long maxNgramPaths;
    private final int maxValueLength;

    public FeatureExtractor(int ngramLength, long maxNgramPaths, int maxValueLength) {
        this.ngramLength = ngramLength;
        this.maxNgramPaths = maxNgramPaths;
        this.maxValueLength = maxValueLength;
    }

    /**
     * @param graph 程序图，tokens / ast 层级可以为 null
     * @return 惰性、可重复遍历的特征键序列
     */
    public Iterable<String> source(AnalysisLevel level, FeatureKind kind, ParsedScript script,
                                   ProgramGraph graph, Deadline deadline) {
        if (kind == FeatureKind.NGRAMS) {
            LabeledGraph view = GraphViews.view(level, script, graph);
            return new NgramSource(view, ngramLength, maxNgramPaths, deadline);
        }
        switch (level) {
            case TOKENS:
                return ValueFeatureSource.ofTokens(script.tokens, maxValueLength);
            case AST:
                return ValueFeatureSource.ofNodes(script.root.children, true, maxValueLength);
            default:
                LabeledGraph view = GraphViews.view(level, script, graph);
                return ValueFeatureSource.ofNodes(GraphViews.evaluatedParts(graph, view), false, maxValueLength);
        }
    }

    public FeatureVector extract(AnalysisLevel level, FeatureKind kind, ParsedScript script,
                                 ProgramGraph graph, Deadline deadline) {
        return FeatureVector.count(source(level, kind, script, graph, deadline));
    }
}
