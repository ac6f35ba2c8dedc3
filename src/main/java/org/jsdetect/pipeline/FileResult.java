package org.jsdetect.pipeline;

import org.jsdetect.ast.ParsedScript;
import org.jsdetect.error.FileStatus;
import org.jsdetect.feature.FeatureVector;
import org.jsdetect.graph.ProgramGraph;

/**
 * 一个文件的分析结果。失败时只有 status 和 message，其它产物为 null。
 */
public class FileResult {
    public final Sample sample;
    public final FileStatus status;
    public final String message;
    public final FeatureVector vector;
    public final transient ParsedScript script;
    public final transient ProgramGraph graph;

    private FileResult(Sample sample, FileStatus status, String message,
                       FeatureVector vector, ParsedScript script, ProgramGraph graph) {
        this.sample = sample;
        this.status = status;
        this.message = message;
        this.vector = vector;
        this.script = script;
        this.graph = graph;
    }

    public static FileResult ok(Sample sample, FeatureVector vector, ParsedScript script, ProgramGraph graph) {
        return new FileResult(sample, FileStatus.OK, null, vector, script, graph);
    }

    public static FileResult failed(Sample sample, FileStatus status, String message) {
        return new FileResult(sample, status, message, null, null, null);
    }

    public boolean isOk() {
        return status == FileStatus.OK;
    }

    /**
     * @return 未绑定引用的数量，没有程序图时为 0
     */
    public int unboundReferences() {
        return graph == null ? 0 : graph.unbound.size();
    }

    @Override
    public String toString() {
        return sample.path() + ": " + status + (message != null ? " (" + message + ")" : "");
    }
}
