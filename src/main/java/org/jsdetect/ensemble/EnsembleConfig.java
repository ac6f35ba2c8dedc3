package org.jsdetect.ensemble;

import java.util.Set;

/**
 * @param unanimousThreshold   第一层：每个模块都必须达到的置信度
 * @param alternativeThreshold 第二层：一票有效所需的置信度
 * @param alternativeModules   第二层参与投票的模块名；为空表示全部模块
 */
public record EnsembleConfig(double unanimousThreshold, double alternativeThreshold, Set<String> alternativeModules) {

    public EnsembleConfig {
        alternativeModules = alternativeModules == null ? Set.of() : Set.copyOf(alternativeModules);
    }
}
