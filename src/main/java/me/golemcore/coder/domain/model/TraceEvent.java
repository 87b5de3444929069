package me.golemcore.coder.domain.model;

public enum TraceEvent {
    START, END, DECISION, ERROR
}
