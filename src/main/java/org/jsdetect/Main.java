package org.jsdetect;

import org.jsdetect.ensemble.Label;
import org.jsdetect.export.DotRenderer;
import org.jsdetect.export.FeatureJson;
import org.jsdetect.export.GraphJsonWriter;
import org.jsdetect.graph.GraphViews;
import org.jsdetect.pipeline.AnalysisConfig;
import org.jsdetect.pipeline.BatchAnalyzer;
import org.jsdetect.pipeline.CorpusEntry;
import org.jsdetect.pipeline.FileResult;
import org.jsdetect.pipeline.Sample;
import org.jsdetect.select.ChiSquareSelector;
import org.jsdetect.select.DocumentFrequency;
import org.jsdetect.select.FeatureStatistics;
import org.jsdetect.select.SelectedFeatures;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.SortedSet;

/**
 * 读取配置，对其中的每个语料目录：
 * - 读取 AST JSON
 * - 构建 CFG + PDG，提取特征
 * - 输出图和特征向量 JSON（可选再输出 DOT）
 * 配置了验证语料时再做卡方特征选择，输出选中的特征。
 */
public class Main {

    private static final Logger logger = LoggerFactory.getLogger(Main.class);

    public static void main(String[] args) throws Exception {
        // 1. 配置文件路径（默认当前目录下的 config.json）
        Path configFile = Path.of(args.length > 0 ? args[0] : "config.json");
        AnalysisConfig config = AnalysisConfig.load(configFile);
        logger.info("Level {}, features {}, {} workers", config.level.key(), config.features.key(), config.workers);

        BatchAnalyzer batch = new BatchAnalyzer(config);
        Path out = config.outputDir != null ? Path.of(config.outputDir) : null;

        // 2. 分析语料，统计每个标签下的文档频率
        DocumentFrequency benignDf = new DocumentFrequency();
        DocumentFrequency maliciousDf = new DocumentFrequency();
        for (CorpusEntry entry : config.corpora) {
            List<FileResult> results = batch.analyze(Sample.listFolder(entry));
            for (FileResult r : results) {
                if (!r.isOk()) {
                    continue;
                }
                if (r.sample.label() == Label.BENIGN) {
                    benignDf.add(r.vector);
                } else if (r.sample.label() == Label.MALICIOUS) {
                    maliciousDf.add(r.vector);
                }
                if (out != null) {
                    write(config, out, r);
                }
            }
        }

        // 3. 卡方特征选择
        if (config.validation.isEmpty()) {
            return;
        }
        ChiSquareSelector selector = new ChiSquareSelector(config.minDocumentFrequency, config.chiConfidence);
        SortedSet<String> candidates = selector.preselect(benignDf, maliciousDf);
        FeatureStatistics statistics = new FeatureStatistics(candidates);
        for (CorpusEntry entry : config.validation) {
            Label label = entry.label();
            batch.analyze(Sample.listFolder(entry), r -> {
                if (r.isOk()) {
                    if (label == Label.MALICIOUS) {
                        statistics.addMalicious(r.vector);
                    } else {
                        statistics.addBenign(r.vector);
                    }
                }
            });
        }
        SelectedFeatures selected = selector.select(statistics);
        if (out != null) {
            Path file = out.resolve("selected_" + config.level.key() + "_" + config.features.key() + ".json");
            FeatureJson.writeSelected(selected, file);
            logger.info("Wrote {} selected features to {}", selected.size(), file);
        } else {
            System.out.println(FeatureJson.selectedToJson(selected));
        }
    }

    private static void write(AnalysisConfig config, Path out, FileResult r) throws IOException {
        String name = r.sample.path().getFileName().toString().replaceFirst("\\.json$", "");
        String suffix = config.level.key() + "_" + config.features.key();
        FeatureJson.writeVector(r.vector, out.resolve("features").resolve(name + "." + suffix + ".json"));
        new GraphJsonWriter().write(config.level, r.script, r.graph,
                out.resolve("graphs").resolve(name + "." + config.level.key() + ".json"));
        if (config.writeDot) {
            DotRenderer.write(r.sample.path().getFileName().toString(),
                    GraphViews.view(config.level, r.script, r.graph),
                    out.resolve("graphs").resolve(name + "." + config.level.key() + ".dot"));
        }
    }

    private Main() {
    }
}
