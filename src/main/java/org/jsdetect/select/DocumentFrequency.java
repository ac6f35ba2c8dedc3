package org.jsdetect.select;

import org.jsdetect.feature.FeatureVector;

import java.util.*;

/**
 * 一个语料中每个特征出现在多少个文件里
 */
public class DocumentFrequency {
    private final Map<String, Integer> frequency = new HashMap<>();
    private int documents;

    public synchronized void add(FeatureVector vector) {
        documents++;
        for (String key : vector.counts().keySet()) {
            frequency.merge(key, 1, Integer::sum);
        }
    }

    /**
     * 合并另一个分片的统计，结果与合并顺序无关
     */
    public DocumentFrequency merge(DocumentFrequency other) {
        Map<String, Integer> snapshot;
        int docs;
        synchronized (other) {
            snapshot = new HashMap<>(other.frequency);
            docs = other.documents;
        }
        synchronized (this) {
            documents += docs;
            snapshot.forEach((k, v) -> frequency.merge(k, v, Integer::sum));
        }
        return this;
    }

    public synchronized int frequency(String key) {
        return frequency.getOrDefault(key, 0);
    }

    public synchronized int documents() {
        return documents;
    }

    /**
     * @return 出现次数严格大于 threshold 的特征，按键排序
     */
    public synchronized SortedSet<String> keysAbove(int threshold) {
        SortedSet<String> keys = new TreeSet<>();
        frequency.forEach((k, v) -> {
            if (v > threshold) {
                keys.add(k);
            }
        });
        return keys;
    }
}
