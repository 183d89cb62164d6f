package com.work.mirror.app.service;

import com.work.mirror.core.synth.DaemonConfigUpdatedEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * 容器内无法重启宿主机的 daemon，配置更新后只输出手动操作提示。
 */
@Component
public class DaemonConfigReloadAdvisor {

    private static final Logger log = LoggerFactory.getLogger(DaemonConfigReloadAdvisor.class);

    @EventListener
    public void onConfigUpdated(DaemonConfigUpdatedEvent event) {
        log.info("[mirror] 已配置 {} 个镜像源: {}", event.getMirrors().size(), String.join(", ", event.getMirrors()));
        log.info("[mirror] 配置已更新 {}，请手动执行以下命令使其生效: sudo systemctl daemon-reload && sudo systemctl restart docker",
                event.getConfigPath());
    }
}
