package com.work.mirror.app.web.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.work.mirror.core.model.ApplyResult;

import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
public class ApplyConfigResponse {

    private final boolean success;
    private final String status;
    private final String message;
    private final String configPath;
    private final String backupPath;
    private final List<String> mirrors;

    private ApplyConfigResponse(boolean success, String status, String message,
                                String configPath, String backupPath, List<String> mirrors) {
        this.success = success;
        this.status = status;
        this.message = message;
        this.configPath = configPath;
        this.backupPath = backupPath;
        this.mirrors = mirrors;
    }

    public static ApplyConfigResponse fromResult(ApplyResult result) {
        return new ApplyConfigResponse(
                result.isSuccess(),
                result.getStatus().name(),
                result.getMessage(),
                result.getConfigPath() == null ? null : result.getConfigPath().toString(),
                result.getBackupPath() == null ? null : result.getBackupPath().toString(),
                result.isSuccess() ? result.getMirrors() : null
        );
    }

    @JsonProperty("success")
    public boolean isSuccess() {
        return success;
    }

    @JsonProperty("status")
    public String getStatus() {
        return status;
    }

    @JsonProperty("message")
    public String getMessage() {
        return message;
    }

    @JsonProperty("config_path")
    public String getConfigPath() {
        return configPath;
    }

    @JsonProperty("backup_path")
    public String getBackupPath() {
        return backupPath;
    }

    @JsonProperty("mirrors")
    public List<String> getMirrors() {
        return mirrors;
    }
}
