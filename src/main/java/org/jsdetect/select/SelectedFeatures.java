package org.jsdetect.select;

import org.jsdetect.feature.FeatureVector;

import java.util.*;

/**
 * 冻结的特征键集合，训练和分类时共用，只读
 */
public final class SelectedFeatures {
    private final List<String> keys;
    private final Map<String, Integer> index;

    public SelectedFeatures(Collection<String> keys) {
        this.keys = List.copyOf(new TreeSet<>(keys));
        Map<String, Integer> idx = new HashMap<>();
        for (int i = 0; i < this.keys.size(); i++) {
            idx.put(this.keys.get(i), i);
        }
        this.index = Collections.unmodifiableMap(idx);
    }

    public List<String> keys() {
        return keys;
    }

    public int size() {
        return keys.size();
    }

    public int indexOf(String key) {
        return index.getOrDefault(key, -1);
    }

    /**
     * 投影到冻结的键集合上：保留已知特征的相对频率（次数 / 总次数），未知特征丢弃。
     * 没有任何特征留下时返回空向量并标记 mismatch。
     */
    public ProjectedVector project(FeatureVector vector) {
        SortedMap<Integer, Double> values = new TreeMap<>();
        double total = vector.total();
        for (Map.Entry<String, Integer> e : vector.counts().entrySet()) {
            Integer i = index.get(e.getKey());
            if (i != null) {
                values.put(i, e.getValue() / total);
            }
        }
        return new ProjectedVector(size(), values, values.isEmpty());
    }
}
