package org.jsdetect.ensemble;

import org.jsdetect.select.ProjectedVector;

/**
 * 训练好的统计模型（例如随机森林），只暴露推断接口。实现必须可以被多个线程同时调用。
 */
@FunctionalInterface
public interface Classifier {

    /**
     * @return 样本为恶意的概率，[0, 1]
     */
    double maliciousProbability(ProjectedVector vector);
}
