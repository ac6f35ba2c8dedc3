package org.jsdetect.select;

import java.util.Collections;
import java.util.SortedMap;

/**
 * 投影后的稀疏向量：下标 -> 相对频率
 *
 * @param mismatch 没有任何特征落在冻结的键集合里
 */
public record ProjectedVector(int dimension, SortedMap<Integer, Double> values, boolean mismatch) {

    public ProjectedVector {
        values = Collections.unmodifiableSortedMap(values);
    }

    public double get(int index) {
        return values.getOrDefault(index, 0.0);
    }

    public double[] toDense() {
        double[] dense = new double[dimension];
        values.forEach((i, v) -> dense[i] = v);
        return dense;
    }
}
