package me.golemcore.coder.domain.model;

/**
 * Whether the text of the current turn was typed by the user (trusted) or came
 * from an automated or external source (untrusted). Untrusted input cannot
 * grant approvals through natural-language phrases.
 */
public enum InputTrustLevel {
    TRUSTED, UNTRUSTED
}
