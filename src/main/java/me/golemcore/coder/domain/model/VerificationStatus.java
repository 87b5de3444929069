package me.golemcore.coder.domain.model;

public enum VerificationStatus {
    NOT_RUN, PASSED, FAILED
}
