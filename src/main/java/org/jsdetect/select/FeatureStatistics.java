package org.jsdetect.select;

import org.jsdetect.feature.FeatureVector;

import java.util.*;

/**
 * 候选特征在两个带标签验证语料上的出现统计。
 * 可以在多个分片上分别累计再合并（满足结合律和交换律）。
 */
public class FeatureStatistics {
    private final SortedMap<String, ContingencyTable> tables = new TreeMap<>();

    public FeatureStatistics(Collection<String> candidates) {
        for (String key : candidates) {
            tables.put(key, new ContingencyTable());
        }
    }

    public synchronized void addBenign(FeatureVector vector) {
        record(vector, false);
    }

    public synchronized void addMalicious(FeatureVector vector) {
        record(vector, true);
    }

    private void record(FeatureVector vector, boolean malicious) {
        for (Map.Entry<String, ContingencyTable> e : tables.entrySet()) {
            e.getValue().record(malicious, vector.contains(e.getKey()));
        }
    }

    /**
     * 合并另一个分片；两边的候选特征集合必须相同
     */
    public FeatureStatistics merge(FeatureStatistics other) {
        Map<String, long[]> snapshot = new HashMap<>();
        synchronized (other) {
            other.tables.forEach((k, t) -> snapshot.put(k, t.cells()));
        }
        synchronized (this) {
            if (!tables.keySet().equals(snapshot.keySet())) {
                throw new IllegalArgumentException("Cannot merge statistics over different candidate features");
            }
            snapshot.forEach((k, c) -> tables.get(k).merge(new ContingencyTable(c[0], c[1], c[2], c[3])));
        }
        return this;
    }

    public synchronized ContingencyTable table(String key) {
        return tables.get(key);
    }

    public synchronized SortedSet<String> candidates() {
        return new TreeSet<>(tables.keySet());
    }
}
