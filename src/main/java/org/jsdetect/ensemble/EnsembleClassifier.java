package org.jsdetect.ensemble;

import org.jsdetect.error.AnalysisException;
import org.jsdetect.feature.FeatureVector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.function.Function;

/**
 * 对一个样本并行运行所有检测模块，全部完成后交给 {@link EnsembleDecider}。
 * <p>
 * executor 不能是调用 classify 的那个线程池，否则固定大小的池可能互相等待。
 */
public class EnsembleClassifier {

    private static final Logger logger = LoggerFactory.getLogger(EnsembleClassifier.class);

    private final List<DetectionModule> modules;
    private final EnsembleDecider decider;
    private final Executor executor;

    public EnsembleClassifier(List<DetectionModule> modules, EnsembleDecider decider, Executor executor) {
        this.modules = List.copyOf(modules);
        this.decider = decider;
        this.executor = executor;
    }

    public List<DetectionModule> modules() {
        return modules;
    }

    /**
     * @param features 模块 -> 该模块层级和特征类型下的特征向量；返回 null 表示该模块不可用
     * @return 模块名 -> 输出，按模块顺序；不可用的模块不出现
     */
    public Map<String, ModelOutput> evaluate(Function<DetectionModule, FeatureVector> features) {
        List<CompletableFuture<ModelOutput>> futures = new ArrayList<>();
        for (DetectionModule module : modules) {
            futures.add(CompletableFuture.supplyAsync(() -> evaluate(module, features), executor));
        }
        // 汇合点：所有模块都结束之后才做决定
        try {
            CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException) {
                throw (RuntimeException) e.getCause();
            }
            if (e.getCause() instanceof Error) {
                throw (Error) e.getCause();
            }
            throw e;
        }

        Map<String, ModelOutput> outputs = new LinkedHashMap<>();
        for (int i = 0; i < modules.size(); i++) {
            ModelOutput output = futures.get(i).join();
            if (output != null) {
                outputs.put(modules.get(i).name(), output);
            }
        }
        return outputs;
    }

    public Decision classify(Function<DetectionModule, FeatureVector> features) {
        return decider.decide(evaluate(features));
    }

    private static ModelOutput evaluate(DetectionModule module, Function<DetectionModule, FeatureVector> features) {
        FeatureVector vector;
        try {
            vector = features.apply(module);
        } catch (AnalysisException e) {
            logger.warn("Module {} unavailable: {} ({})", module.name(), e.getMessage(), e.status());
            return null;
        }
        if (vector == null) {
            return null;
        }
        return module.evaluate(vector);
    }
}
