package org.jsdetect.ensemble;

/**
 * 有标签运行时的统计；恶意为正类。真值未知的样本不计入，延后的样本单独计数。
 */
public class ConfusionMatrix {
    private long truePositives;
    private long falsePositives;
    private long falseNegatives;
    private long trueNegatives;
    private long deferred;

    /**
     * @param truth 真值，null 表示未知
     */
    public synchronized void record(Label truth, Decision decision) {
        if (truth == null) {
            return;
        }
        if (!decision.isDecided()) {
            deferred++;
            return;
        }
        record(truth, decision.label());
    }

    public synchronized void record(Label truth, Label predicted) {
        if (truth == null) {
            return;
        }
        if (truth == Label.MALICIOUS) {
            if (predicted == Label.MALICIOUS) {
                truePositives++;
            } else {
                falseNegatives++;
            }
        } else if (predicted == Label.MALICIOUS) {
            falsePositives++;
        } else {
            trueNegatives++;
        }
    }

    public synchronized long truePositives() {
        return truePositives;
    }

    public synchronized long falsePositives() {
        return falsePositives;
    }

    public synchronized long falseNegatives() {
        return falseNegatives;
    }

    public synchronized long trueNegatives() {
        return trueNegatives;
    }

    public synchronized long deferred() {
        return deferred;
    }

    public synchronized long decided() {
        return truePositives + falsePositives + falseNegatives + trueNegatives;
    }

    /**
     * 检测率：判对的样本占已决定样本的比例
     */
    public synchronized double detectionRate() {
        return ratio(truePositives + trueNegatives, decided());
    }

    public synchronized double truePositiveRate() {
        return ratio(truePositives, truePositives + falseNegatives);
    }

    public synchronized double trueNegativeRate() {
        return ratio(trueNegatives, trueNegatives + falsePositives);
    }

    private static double ratio(long a, long b) {
        return b == 0 ? 0 : (double) a / b;
    }

    @Override
    public synchronized String toString() {
        return String.format("TP=%d FP=%d FN=%d TN=%d deferred=%d detection=%.4f TPR=%.4f TNR=%.4f",
                truePositives, falsePositives, falseNegatives, trueNegatives, deferred,
                detectionRate(), truePositiveRate(), trueNegativeRate());
    }
}
