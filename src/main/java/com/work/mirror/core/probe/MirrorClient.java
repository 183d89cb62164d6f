package com.work.mirror.core.probe;

import java.time.Duration;

/**
 * 对单个 URL 发起一次 GET 并返回 HTTP 状态码的最小客户端端口。
 *
 * <p>约定：4xx/5xx 以 {@link org.springframework.web.client.RestClientResponseException} 抛出，
 * 连接级失败（DNS、拒绝连接、超时）以其他 {@link org.springframework.web.client.RestClientException} 抛出。</p>
 */
public interface MirrorClient {

    int fetchStatus(String url, Duration timeout);
}
