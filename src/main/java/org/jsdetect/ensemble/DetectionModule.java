package org.jsdetect.ensemble;

import org.jsdetect.feature.FeatureKind;
import org.jsdetect.feature.FeatureVector;
import org.jsdetect.graph.AnalysisLevel;
import org.jsdetect.select.ProjectedVector;
import org.jsdetect.select.SelectedFeatures;

/**
 * 一个检测模块：固定的层级和特征类型、冻结的特征集合和对应的分类器
 *
 * @param threshold 恶意概率达到该值判为恶意
 */
public record DetectionModule(String name, AnalysisLevel level, FeatureKind kind, SelectedFeatures features,
                              Classifier classifier, double threshold) {

    public ModelOutput evaluate(FeatureVector vector) {
        ProjectedVector projected = features.project(vector);
        double p = classifier.maliciousProbability(projected);
        return ModelOutput.fromProbability(p, threshold);
    }
}
