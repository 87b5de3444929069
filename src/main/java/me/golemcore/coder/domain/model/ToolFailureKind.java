package me.golemcore.coder.domain.model;

/**
 * Machine-readable classification of tool execution failures.
 *
 * <p>
 * This exists to avoid relying on string matching in tool error messages.
 */
public enum ToolFailureKind {

    /**
     * Tool execution was denied by policy (e.g. tool unknown, disabled for the
     * conversation, path outside the workspace).
     */
    POLICY_DENIED,

    /**
     * Tool execution failed during runtime (exceptions, non-zero exit, etc.).
     */
    EXECUTION_FAILED,

    /**
     * Tool execution did not finish within its time budget.
     */
    TIMEOUT
}
