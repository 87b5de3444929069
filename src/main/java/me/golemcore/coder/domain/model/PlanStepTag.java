package me.golemcore.coder.domain.model;

/**
 * Marker at the start of a plan step that controls how the loop treats it.
 */
public enum PlanStepTag {
    DISCUSS, TOOL, VERIFY
}
