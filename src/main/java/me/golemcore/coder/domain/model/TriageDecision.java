package me.golemcore.coder.domain.model;

public enum TriageDecision {
    DIRECT_RESPONSE, GRAPH
}
