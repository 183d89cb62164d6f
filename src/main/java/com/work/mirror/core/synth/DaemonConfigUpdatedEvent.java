package com.work.mirror.core.synth;

import java.nio.file.Path;
import java.util.Collections;
import java.util.List;

/**
 * 外部配置写入成功后发布。下游服务需要重新加载/重启才能生效，由监听方决定如何提示。
 */
public class DaemonConfigUpdatedEvent {

    private final Path configPath;
    private final List<String> mirrors;

    public DaemonConfigUpdatedEvent(Path configPath, List<String> mirrors) {
        this.configPath = configPath;
        this.mirrors = Collections.unmodifiableList(mirrors);
    }

    public Path getConfigPath() {
        return configPath;
    }

    public List<String> getMirrors() {
        return mirrors;
    }
}
