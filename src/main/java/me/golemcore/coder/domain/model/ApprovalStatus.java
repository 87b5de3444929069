package me.golemcore.coder.domain.model;

public enum ApprovalStatus {
    APPROVED, FEEDBACK, DENIED;

    public String getValue() {
        return name().toLowerCase(java.util.Locale.ROOT);
    }
}
