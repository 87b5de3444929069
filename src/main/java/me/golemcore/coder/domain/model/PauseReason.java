package me.golemcore.coder.domain.model;

public enum PauseReason {
    TOOL_APPROVAL, DISCUSSION
}
