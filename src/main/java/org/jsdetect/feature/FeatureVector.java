package org.jsdetect.feature;

import java.util.Collections;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * 稀疏特征向量：特征键 -> 出现次数，键有序
 */
public class FeatureVector {
    private final TreeMap<String, Integer> counts = new TreeMap<>();
    private long total;

    public static FeatureVector count(Iterable<String> source) {
        FeatureVector vector = new FeatureVector();
        for (String key : source) {
            vector.add(key);
        }
        return vector;
    }

    public void add(String key) {
        add(key, 1);
    }

    public void add(String key, int times) {
        if (times <= 0) {
            return;
        }
        counts.merge(key, times, Integer::sum);
        total += times;
    }

    public int get(String key) {
        return counts.getOrDefault(key, 0);
    }

    public boolean contains(String key) {
        return counts.containsKey(key);
    }

    public SortedMap<String, Integer> counts() {
        return Collections.unmodifiableSortedMap(counts);
    }

    public int size() {
        return counts.size();
    }

    public long total() {
        return total;
    }

    public boolean isEmpty() {
        return counts.isEmpty();
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof FeatureVector other && counts.equals(other.counts);
    }

    @Override
    public int hashCode() {
        return counts.hashCode();
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("{");
        for (Map.Entry<String, Integer> e : counts.entrySet()) {
            if (sb.length() > 1) {
                sb.append(", ");
            }
            sb.append(e.getKey()).append('=').append(e.getValue());
        }
        return sb.append('}').toString();
    }
}
