package org.jsdetect.ensemble;

public enum DecisionState {
    UNCLASSIFIED,
    DECIDED,
    DEFERRED
}
