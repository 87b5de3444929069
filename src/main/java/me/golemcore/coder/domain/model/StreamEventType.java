package me.golemcore.coder.domain.model;

public enum StreamEventType {
    NODE("node"),
    END("end"),
    ERROR("error"),
    TOOL_APPROVAL_REQUEST("tool_approval_request"),
    TOOL_APPROVAL_RESULT("tool_approval_result"),
    COWORK_DISCUSS_REQUEST("cowork_discuss_request"),
    COWORK_DISCUSS_RESPONSE("cowork_discuss_response");

    private final String value;

    StreamEventType(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }
}
