package org.jsdetect.ensemble;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * 两层投票：
 * <ol>
 *     <li>全部可用模块标签一致，且每个置信度都不低于 unanimousThreshold，直接决定；</li>
 *     <li>否则在指定的模块中（未指定时为全部模块），某个标签达到 alternativeThreshold 的票数
 *     超过可用指定模块数的一半，则决定；</li>
 *     <li>否则延后。</li>
 * </ol>
 * 标签不变时提高任一置信度，结果不会变得更“延后”。
 */
public class EnsembleDecider {

    private final EnsembleConfig config;

    public EnsembleDecider(EnsembleConfig config) {
        this.config = config;
    }

    /**
     * @param outputs 模块名 -> 输出；缺失的模块视为不可用
     */
    public Decision decide(Map<String, ModelOutput> outputs) {
        if (outputs.isEmpty()) {
            return Decision.deferred();
        }

        Label unanimous = unanimous(outputs.values());
        if (unanimous != null) {
            return Decision.decided(unanimous, DecisionTier.UNANIMOUS);
        }

        List<ModelOutput> designated = new ArrayList<>();
        outputs.forEach((name, output) -> {
            if (config.alternativeModules().isEmpty() || config.alternativeModules().contains(name)) {
                designated.add(output);
            }
        });
        if (designated.isEmpty()) {
            return Decision.deferred();
        }
        for (Label label : Label.values()) {
            long votes = designated.stream()
                    .filter(o -> o.label() == label && o.confidence() >= config.alternativeThreshold())
                    .count();
            if (votes * 2 > designated.size()) {
                return Decision.decided(label, DecisionTier.ALTERNATIVE);
            }
        }
        return Decision.deferred();
    }

    private Label unanimous(Iterable<ModelOutput> outputs) {
        Label label = null;
        for (ModelOutput o : outputs) {
            if (o.confidence() < config.unanimousThreshold()) {
                return null;
            }
            if (label == null) {
                label = o.label();
            } else if (label != o.label()) {
                return null;
            }
        }
        return label;
    }
}
