package me.golemcore.coder.domain.model;

/**
 * Why a pending tool call was flagged by the risk analyzer.
 */
public enum RiskReason {

    DANGEROUS_COMMAND("dangerous_command"),
    NETWORK_INSTALL_COMMAND("network_install_command"),
    SENSITIVE_FILE_CHANGE("sensitive_file_change"),
    BULK_FILE_CHANGE("bulk_file_change"),
    LARGE_FILE_WRITE("large_file_write"),
    OUTSIDE_WORKDIR_COMMAND("outside_workdir_command"),
    HTTP_REQUEST_COMMAND("http_request_command");

    private final String value;

    RiskReason(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }
}
