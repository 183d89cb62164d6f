package com.work.mirror.core.model;

import java.nio.file.Path;
import java.util.Collections;
import java.util.List;

/**
 * 写入外部配置的结果。失败以值的形式返回给调用方，不抛异常。
 */
public final class ApplyResult {

    private final ApplyStatus status;
    private final String message;
    private final Path configPath;
    private final Path backupPath;
    private final List<String> mirrors;

    private ApplyResult(ApplyStatus status, String message, Path configPath, Path backupPath, List<String> mirrors) {
        this.status = status;
        this.message = message;
        this.configPath = configPath;
        this.backupPath = backupPath;
        this.mirrors = mirrors == null ? Collections.emptyList() : Collections.unmodifiableList(mirrors);
    }

    public static ApplyResult applied(Path configPath, Path backupPath, List<String> mirrors) {
        return new ApplyResult(ApplyStatus.APPLIED, "配置已更新", configPath, backupPath, mirrors);
    }

    public static ApplyResult noData(Path configPath) {
        return new ApplyResult(ApplyStatus.NO_DATA, "暂无检测数据，请先执行检测", configPath, null, null);
    }

    public static ApplyResult noAvailableMirrors(Path configPath) {
        return new ApplyResult(ApplyStatus.NO_AVAILABLE_MIRRORS, "没有可用的镜像源，跳过配置更新", configPath, null, null);
    }

    public static ApplyResult failed(Path configPath, String message) {
        return new ApplyResult(ApplyStatus.FAILED, message, configPath, null, null);
    }

    public ApplyStatus getStatus() {
        return status;
    }

    public boolean isSuccess() {
        return status == ApplyStatus.APPLIED;
    }

    public String getMessage() {
        return message;
    }

    public Path getConfigPath() {
        return configPath;
    }

    /**
     * 本次写入前原配置的备份位置；原文件不存在时为 null。
     */
    public Path getBackupPath() {
        return backupPath;
    }

    public List<String> getMirrors() {
        return mirrors;
    }
}
