package org.jsdetect.ensemble;

/**
 * 集成投票的结果。DECIDED 时 label 非空。
 */
public record Decision(DecisionState state, Label label, DecisionTier tier) {

    private static final Decision UNCLASSIFIED = new Decision(DecisionState.UNCLASSIFIED, null, DecisionTier.NONE);
    private static final Decision DEFERRED = new Decision(DecisionState.DEFERRED, null, DecisionTier.NONE);

    public static Decision unclassified() {
        return UNCLASSIFIED;
    }

    public static Decision deferred() {
        return DEFERRED;
    }

    public static Decision decided(Label label, DecisionTier tier) {
        return new Decision(DecisionState.DECIDED, label, tier);
    }

    public boolean isDecided() {
        return state == DecisionState.DECIDED;
    }
}
