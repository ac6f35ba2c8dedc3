package org.jsdetect.ensemble;

/**
 * 一个检测模块对一个样本的输出
 */
public record ModelOutput(Label label, double confidence) {

    public ModelOutput {
        if (label == null) {
            throw new IllegalArgumentException("label is required");
        }
        if (Double.isNaN(confidence) || confidence < 0 || confidence > 1) {
            throw new IllegalArgumentException("confidence must be in [0, 1]: " + confidence);
        }
    }

    /**
     * 由恶意概率得到输出：p &gt;= threshold 判为恶意，置信度为 p，否则为良性，置信度为 1 - p
     */
    public static ModelOutput fromProbability(double maliciousProbability, double threshold) {
        if (maliciousProbability >= threshold) {
            return new ModelOutput(Label.MALICIOUS, maliciousProbability);
        }
        return new ModelOutput(Label.BENIGN, 1 - maliciousProbability);
    }
}
