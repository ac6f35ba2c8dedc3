package org.jsdetect.pipeline;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;
import org.jsdetect.ensemble.Classifier;
import org.jsdetect.ensemble.DetectionModule;
import org.jsdetect.ensemble.EnsembleConfig;
import org.jsdetect.feature.FeatureKind;
import org.jsdetect.graph.AnalysisLevel;
import org.jsdetect.graph.ClosureCapturePolicy;
import org.jsdetect.select.SelectedFeatures;

import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;

/**
 * 分析配置，由 JSON 读取；没有出现的字段保持这里的默认值
 */
public class AnalysisConfig {

    private static final Gson GSON = new GsonBuilder().setPrettyPrinting().create();

    public AnalysisLevel level = AnalysisLevel.PDG;
    public FeatureKind features = FeatureKind.NGRAMS;
    public int ngramLength = 4;

    // 并发与资源上限
    public int workers = 2;
    public long fileTimeoutMillis = 60_000;
    public long maxFileBytes = 10L * 1024 * 1024;
    public int maxAstNodes = 2_000_000;
    public int maxGraphNodes = 200_000;
    public long maxNgramPaths = 5_000_000;
    public int maxValueLength = 100;

    public ClosureCapturePolicy closureCapture = ClosureCapturePolicy.REACHABLE_FROM_DECLARATION;

    // 特征选择
    public int minDocumentFrequency = 10;
    public double chiConfidence = 99;

    // 集成投票
    public double unanimousThreshold = 0.9;
    public double alternativeThreshold = 0.7;
    public List<String> alternativeModules = new ArrayList<>();
    public double maliciousThreshold = 0.5;

    public List<CorpusEntry> corpora = new ArrayList<>();
    public List<CorpusEntry> validation = new ArrayList<>();
    public String outputDir;
    // 在图 JSON 旁边另写一份 Graphviz DOT
    public boolean writeDot = false;

    public static AnalysisConfig load(Path file) throws IOException {
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            return read(reader);
        }
    }

    public static AnalysisConfig fromJson(String json) {
        return read(new StringReader(json));
    }

    private static AnalysisConfig read(Reader reader) {
        AnalysisConfig config;
        try {
            config = GSON.fromJson(reader, AnalysisConfig.class);
        } catch (JsonParseException e) {
            throw new IllegalArgumentException("Invalid configuration: " + e.getMessage(), e);
        }
        if (config == null) {
            config = new AnalysisConfig();
        }
        config.validate();
        return config;
    }

    /**
     * 检查取值范围；未知的枚举值被 Gson 读成 null，在这里报错
     */
    public AnalysisConfig validate() {
        require(level != null, "level must be one of tokens, ast, cfg, pdg-dfg, pdg");
        require(features != null, "features must be ngrams or value");
        require(closureCapture != null, "closureCapture must be reachable-from-declaration or declaration-point");
        require(ngramLength >= 1, "ngramLength must be >= 1");
        require(workers >= 1, "workers must be >= 1");
        require(fileTimeoutMillis >= 0, "fileTimeoutMillis must be >= 0");
        require(maxFileBytes > 0, "maxFileBytes must be > 0");
        require(maxAstNodes > 0, "maxAstNodes must be > 0");
        require(maxGraphNodes > 0, "maxGraphNodes must be > 0");
        require(maxNgramPaths > 0, "maxNgramPaths must be > 0");
        require(maxValueLength > 0, "maxValueLength must be > 0");
        require(minDocumentFrequency >= 0, "minDocumentFrequency must be >= 0");
        require(chiConfidence > 0 && chiConfidence < 100, "chiConfidence must be in (0, 100)");
        requireProbability(unanimousThreshold, "unanimousThreshold");
        requireProbability(alternativeThreshold, "alternativeThreshold");
        requireProbability(maliciousThreshold, "maliciousThreshold");
        if (alternativeModules == null) {
            alternativeModules = new ArrayList<>();
        }
        if (corpora == null) {
            corpora = new ArrayList<>();
        }
        if (validation == null) {
            validation = new ArrayList<>();
        }
        for (CorpusEntry entry : corpora) {
            requireEntry(entry, "corpora", true);
        }
        for (CorpusEntry entry : validation) {
            requireEntry(entry, "validation", false);
        }
        return this;
    }

    public EnsembleConfig ensembleConfig() {
        return new EnsembleConfig(unanimousThreshold, alternativeThreshold, new HashSet<>(alternativeModules));
    }

    /**
     * 按当前层级、特征类型和恶意阈值组装一个检测模块
     */
    public DetectionModule module(String name, SelectedFeatures selected, Classifier classifier) {
        return new DetectionModule(name, level, features, selected, classifier, maliciousThreshold);
    }

    public String toJson() {
        return GSON.toJson(this);
    }

    private static void requireEntry(CorpusEntry entry, String field, boolean unknownAllowed) {
        require(entry != null && entry.folder != null && !entry.folder.isBlank(),
                field + " entries need a folder");
        boolean known = entry.label() != null;
        require(known || ("?".equals(entry.label) && unknownAllowed),
                field + " label must be benign or malicious" + (unknownAllowed ? " or ?" : "") + ": " + entry.label);
    }

    private static void requireProbability(double value, String name) {
        require(value >= 0 && value <= 1, name + " must be in [0, 1]");
    }

    private static void require(boolean condition, String message) {
        if (!condition) {
            throw new IllegalArgumentException(message);
        }
    }
}
