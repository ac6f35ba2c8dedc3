package org.jsdetect.select;

/**
 * 一个特征的 2×2 出现表：[良性含有, 良性不含, 恶意含有, 恶意不含]
 */
public final class ContingencyTable {
    private long benignWith;
    private long benignWithout;
    private long maliciousWith;
    private long maliciousWithout;

    public ContingencyTable() {
    }

    public ContingencyTable(long benignWith, long benignWithout, long maliciousWith, long maliciousWithout) {
        this.benignWith = benignWith;
        this.benignWithout = benignWithout;
        this.maliciousWith = maliciousWith;
        this.maliciousWithout = maliciousWithout;
    }

    void record(boolean malicious, boolean present) {
        if (malicious) {
            if (present) {
                maliciousWith++;
            } else {
                maliciousWithout++;
            }
        } else if (present) {
            benignWith++;
        } else {
            benignWithout++;
        }
    }

    void merge(ContingencyTable other) {
        benignWith += other.benignWith;
        benignWithout += other.benignWithout;
        maliciousWith += other.maliciousWith;
        maliciousWithout += other.maliciousWithout;
    }

    public long[] cells() {
        return new long[]{benignWith, benignWithout, maliciousWith, maliciousWithout};
    }

    /**
     * 带 Yates 连续性校正的卡方统计量：每个观测值向期望值靠拢 min(0.5, |O-E|)。
     * 任一期望值为 0 时统计量无定义，按 0 处理。
     */
    public double chiSquare() {
        double[][] observed = {
                {benignWith, benignWithout},
                {maliciousWith, maliciousWithout}
        };
        double total = benignWith + benignWithout + maliciousWith + maliciousWithout;
        double[] rows = {benignWith + benignWithout, maliciousWith + maliciousWithout};
        double[] cols = {benignWith + maliciousWith, benignWithout + maliciousWithout};
        if (total == 0) {
            return 0;
        }
        double chi = 0;
        for (int r = 0; r < 2; r++) {
            for (int c = 0; c < 2; c++) {
                double expected = rows[r] * cols[c] / total;
                if (expected == 0) {
                    return 0;
                }
                double diff = observed[r][c] - expected;
                double adjusted = observed[r][c] - Math.signum(diff) * Math.min(0.5, Math.abs(diff));
                chi += (adjusted - expected) * (adjusted - expected) / expected;
            }
        }
        return chi;
    }

    @Override
    public String toString() {
        return "[" + benignWith + ", " + benignWithout + ", " + maliciousWith + ", " + maliciousWithout + "]";
    }
}
