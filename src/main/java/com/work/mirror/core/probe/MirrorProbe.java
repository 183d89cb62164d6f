package com.work.mirror.core.probe;

import com.work.mirror.core.model.ProbeResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Duration;
import java.time.Instant;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static com.work.mirror.core.support.ValidationUtils.requireNonEmpty;
import static com.work.mirror.core.support.ValidationUtils.requireNonNull;
import static com.work.mirror.core.support.ValidationUtils.requirePositive;

/**
 * 对单个镜像做一次可用性检查。
 *
 * 规则：
 * 1. 依次尝试 {@code /v2/} 与根路径，第一个可归类的响应直接返回
 * 2. 200/301/302/401/404 视为可用，403 视为可用（需要认证）
 * 3. 错误响应中 401/403/404 仍视为可用，其他错误码直接判定不可用
 * 4. 连接级失败只换下一个 URL，不重试；全部失败则 "connection failed"，状态码 0
 *
 * <p>耗时为整个多 URL 尝试过程的墙钟时间。探测本身不抛异常，网络失败一律体现为不可用结果。</p>
 */
public class MirrorProbe {

    public static final String LABEL_AVAILABLE = "available";
    public static final String LABEL_AUTH_REQUIRED = "available (auth required)";
    public static final String LABEL_CONNECTION_FAILED = "connection failed";

    private static final Logger log = LoggerFactory.getLogger(MirrorProbe.class);

    private static final Set<Integer> AVAILABLE_CODES =
            Collections.unmodifiableSet(new HashSet<>(Arrays.asList(200, 301, 302, 401, 404)));
    private static final Set<Integer> TOLERATED_ERROR_CODES =
            Collections.unmodifiableSet(new HashSet<>(Arrays.asList(401, 403, 404)));

    private final MirrorClient client;

    public MirrorProbe(MirrorClient client) {
        this.client = requireNonNull(client, "client");
    }

    public ProbeResult probe(String endpoint, Duration timeout) {
        requireNonEmpty(endpoint, "endpoint");
        requirePositive(timeout, "timeout");

        long start = System.nanoTime();
        Outcome outcome = classify(endpoint, timeout);
        double elapsedMs = round2((System.nanoTime() - start) / 1_000_000.0);

        return new ProbeResult(endpoint, outcome.available, outcome.label, outcome.code, elapsedMs, Instant.now());
    }

    private Outcome classify(String endpoint, Duration timeout) {
        for (String url : candidateUrls(endpoint)) {
            try {
                int code = client.fetchStatus(url, timeout);
                if (AVAILABLE_CODES.contains(code)) {
                    return new Outcome(true, LABEL_AVAILABLE, code);
                }
                if (code == 403) {
                    return new Outcome(true, LABEL_AUTH_REQUIRED, code);
                }
                log.debug("probe unclassified status, try next url={} code={}", url, code);
            } catch (RestClientResponseException e) {
                int code = e.getRawStatusCode();
                if (TOLERATED_ERROR_CODES.contains(code)) {
                    return new Outcome(true, "available (HTTP " + code + ")", code);
                }
                return new Outcome(false, "HTTP error: " + code, code);
            } catch (RestClientException e) {
                log.debug("probe connect failed url={} err={}", url, e.toString());
            } catch (RuntimeException e) {
                log.debug("probe unexpected failure url={} err={}", url, e.toString());
            }
        }
        return new Outcome(false, LABEL_CONNECTION_FAILED, 0);
    }

    static List<String> candidateUrls(String endpoint) {
        String base = endpoint.trim();
        while (base.endsWith("/")) {
            base = base.substring(0, base.length() - 1);
        }
        return Arrays.asList(base + "/v2/", base);
    }

    private static double round2(double value) {
        return BigDecimal.valueOf(value).setScale(2, RoundingMode.HALF_UP).doubleValue();
    }

    private static final class Outcome {
        final boolean available;
        final String label;
        final int code;

        Outcome(boolean available, String label, int code) {
            this.available = available;
            this.label = label;
            this.code = code;
        }
    }
}
