package org.jsdetect.pipeline;

import org.jsdetect.ast.EstreeReader;
import org.jsdetect.ast.ParsedScript;
import org.jsdetect.error.AnalysisException;
import org.jsdetect.error.Deadline;
import org.jsdetect.error.FileStatus;
import org.jsdetect.error.GraphSizeExceededException;
import org.jsdetect.feature.FeatureExtractor;
import org.jsdetect.feature.FeatureVector;
import org.jsdetect.graph.ProgramGraph;
import org.jsdetect.graph.ScriptAnalyzer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;

/**
 * 单个文件的完整流程：读 AST、建图、取特征。所有产物只属于这一次调用。
 */
public class FileAnalyzer {

    private static final Logger logger = LoggerFactory.getLogger(FileAnalyzer.class);

    private final AnalysisConfig config;
    private final EstreeReader reader;
    private final ScriptAnalyzer scriptAnalyzer;
    private final FeatureExtractor extractor;

    public FileAnalyzer(AnalysisConfig config) {
        this.config = config;
        this.reader = new EstreeReader(config.maxAstNodes);
        this.scriptAnalyzer = new ScriptAnalyzer(config.closureCapture, config.maxGraphNodes);
        this.extractor = new FeatureExtractor(config.ngramLength, config.maxNgramPaths, config.maxValueLength);
    }

    /**
     * 分析一个文件；单文件的失败都变成对应状态的结果，{@link Error} 继续向上抛
     */
    public FileResult analyze(Sample sample) {
        // 从任务开始执行时计时
        Deadline deadline = Deadline.startingNow(config.fileTimeoutMillis);
        try {
            long size = Files.size(sample.path());
            if (size > config.maxFileBytes) {
                throw new GraphSizeExceededException("file bytes", size, config.maxFileBytes);
            }
            ParsedScript script = reader.read(sample.path());
            deadline.checkpoint();
            ProgramGraph graph = config.level.needsProgramGraph() ? scriptAnalyzer.analyze(script, deadline) : null;
            FeatureVector vector = extractor.extract(config.level, config.features, script, graph, deadline);
            if (graph != null && !graph.unbound.isEmpty()) {
                logger.debug("{}: {} unbound references", sample.path(), graph.unbound.size());
            }
            return FileResult.ok(sample, vector, script, graph);
        } catch (AnalysisException e) {
            logger.warn("{}: {} ({})", sample.path(), e.getMessage(), e.status());
            return FileResult.failed(sample, e.status(), e.getMessage());
        } catch (IOException e) {
            logger.warn("{}: cannot read file: {}", sample.path(), e.toString());
            return FileResult.failed(sample, FileStatus.IO_ERROR, e.toString());
        } catch (StackOverflowError e) {
            // 极深的嵌套：按图过大处理，不影响其它文件
            logger.warn("{}: nesting too deep", sample.path());
            return FileResult.failed(sample, FileStatus.GRAPH_SIZE_EXCEEDED, "nesting too deep");
        }
    }
}
