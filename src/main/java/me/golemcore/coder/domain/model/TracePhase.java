package me.golemcore.coder.domain.model;

public enum TracePhase {
    TRIAGE, PLANNER, AGENT, APPROVAL, TOOLS, VERIFIER, REPORTER;

    public String getValue() {
        return name().toLowerCase(java.util.Locale.ROOT);
    }
}
