package com.work.mirror.core.support.metrics;

/**
 * 可观测性端口（不强依赖 Micrometer/Prometheus）。
 *
 * 设计目标：
 * - 核心路径只调用接口，不绑定具体 metrics 实现
 * - 宿主可通过自定义 Bean 接入 Micrometer 等实现
 */
public interface MirrorCheckMetrics {

    default void probe(String result) {
    }

    default void batch(int total, int available, int abandoned) {
    }

    default void persistFailure(String op) {
    }

    default void scheduledRun(String outcome) {
    }

    default void configApply(String status) {
    }
}
