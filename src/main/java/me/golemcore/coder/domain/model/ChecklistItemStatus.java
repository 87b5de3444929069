package me.golemcore.coder.domain.model;

public enum ChecklistItemStatus {
    PASSED, PENDING, FAILED, SKIPPED
}
