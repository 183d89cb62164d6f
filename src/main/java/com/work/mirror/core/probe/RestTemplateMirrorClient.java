package com.work.mirror.core.probe;

import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestTemplate;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import static com.work.mirror.core.support.ValidationUtils.requireNonEmpty;
import static com.work.mirror.core.support.ValidationUtils.requirePositive;

/**
 * 基于 {@link RestTemplate} 的实现。超时同时作用于建连与读取；每种超时对应一个 RestTemplate，按需创建后复用。
 */
public class RestTemplateMirrorClient implements MirrorClient {

    static final String USER_AGENT = "Docker-Mirror-Checker/1.0";

    private final Map<Duration, RestTemplate> templates = new ConcurrentHashMap<>();

    @Override
    public int fetchStatus(String url, Duration timeout) {
        requireNonEmpty(url, "url");
        requirePositive(timeout, "timeout");
        RestTemplate template = templates.computeIfAbsent(timeout, RestTemplateMirrorClient::newTemplate);
        Integer status = template.execute(url, HttpMethod.GET,
                request -> request.getHeaders().set(HttpHeaders.USER_AGENT, USER_AGENT),
                response -> response.getRawStatusCode());
        return status == null ? 0 : status;
    }

    private static RestTemplate newTemplate(Duration timeout) {
        SimpleClientHttpRequestFactory factory = new SimpleClientHttpRequestFactory();
        int ms = (int) Math.min(Integer.MAX_VALUE, timeout.toMillis());
        factory.setConnectTimeout(ms);
        factory.setReadTimeout(ms);
        return new RestTemplate(factory);
    }
}
