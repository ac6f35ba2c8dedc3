package org.jsdetect.ensemble;

/**
 * 做出决定的那一层；越靠后越“延后”
 */
public enum DecisionTier {
    UNANIMOUS,
    ALTERNATIVE,
    NONE
}
