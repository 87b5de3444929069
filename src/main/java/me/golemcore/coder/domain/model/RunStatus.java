package me.golemcore.coder.domain.model;

public enum RunStatus {
    /** Loop ended and the reporter produced a summary. */
    COMPLETED,
    /** Triage answered without tools. */
    DIRECT_RESPONSE,
    /** Waiting for a tool approval or a discussion answer. */
    PAUSED,
    /** Stopped by an approval denial, without a report. */
    HALTED,
    ABORTED,
    FAILED
}
