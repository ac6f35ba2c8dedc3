package org.jsdetect.select;

import org.apache.commons.math3.distribution.ChiSquaredDistribution;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * 卡方特征选择：先按文档频率预选，再保留出现与标签不独立的特征
 */
public class ChiSquareSelector {

    private static final Logger logger = LoggerFactory.getLogger(ChiSquareSelector.class);

    private final int minDocumentFrequency;
    private final double confidence;
    private final double critical;

    /**
     * @param minDocumentFrequency 预选阈值，文档频率必须严格大于它
     * @param confidence           置信度，百分数，例如 99
     */
    public ChiSquareSelector(int minDocumentFrequency, double confidence) {
        if (confidence <= 0 || confidence >= 100) {
            throw new IllegalArgumentException("Confidence must be in (0, 100): " + confidence);
        }
        this.minDocumentFrequency = minDocumentFrequency;
        this.confidence = confidence;
        this.critical = criticalValue(confidence);
    }

    /**
     * 自由度为 1 的卡方分布在给定置信度下的临界值，保留两位小数
     */
    public static double criticalValue(double confidencePercent) {
        double value = new ChiSquaredDistribution(1).inverseCumulativeProbability(confidencePercent / 100);
        return Math.round(value * 100) / 100.0;
    }

    public double critical() {
        return critical;
    }

    /**
     * 任一语料中文档频率超过阈值的特征都是候选
     */
    public SortedSet<String> preselect(DocumentFrequency benign, DocumentFrequency malicious) {
        SortedSet<String> candidates = new TreeSet<>(benign.keysAbove(minDocumentFrequency));
        candidates.addAll(malicious.keysAbove(minDocumentFrequency));
        logger.info("Preselected {} candidate features (document frequency > {})",
                candidates.size(), minDocumentFrequency);
        return candidates;
    }

    public SelectedFeatures select(FeatureStatistics statistics) {
        return select(statistics, statistics.candidates());
    }

    public SelectedFeatures select(FeatureStatistics statistics, Collection<String> candidates) {
        List<String> kept = new ArrayList<>();
        for (String key : candidates) {
            ContingencyTable table = statistics.table(key);
            if (table == null) {
                continue;
            }
            double chi = table.chiSquare();
            if (chi >= critical) {
                logger.debug("Feature '{}' depends on the label, chi2 = {}", key, chi);
                kept.add(key);
            }
        }
        logger.info("Selected {} of {} features at {}% confidence (chi2 >= {})",
                kept.size(), candidates.size(), confidence, critical);
        return new SelectedFeatures(kept);
    }
}
