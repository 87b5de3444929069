package me.golemcore.coder.domain.model;

public enum ApprovalSource {
    SYSTEM, POLICY, USER;

    public String getValue() {
        return name().toLowerCase(java.util.Locale.ROOT);
    }
}
