package com.work.mirror.core.support;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 参数校验工具类，统一参数校验逻辑，减少代码重复
 */
public final class ValidationUtils {

    private ValidationUtils() {
        throw new AssertionError("工具类不允许实例化");
    }

    /**
     * 校验字符串参数不为空
     */
    public static String requireNonEmpty(String value, String paramName) {
        if (value == null || value.trim().isEmpty()) {
            throw new IllegalArgumentException(paramName + " 不能为空");
        }
        return value;
    }

    /**
     * 校验对象不为null
     */
    public static <T> T requireNonNull(T value, String paramName) {
        if (value == null) {
            throw new IllegalArgumentException(paramName + " 不能为null");
        }
        return value;
    }

    /**
     * 校验Duration必须大于0
     */
    public static Duration requirePositive(Duration duration, String paramName) {
        requireNonNull(duration, paramName);
        if (duration.isNegative() || duration.isZero()) {
            throw new IllegalArgumentException(paramName + " 必须大于0");
        }
        return duration;
    }

    /**
     * 校验 int 值必须大于0
     */
    public static int requirePositive(int value, String paramName) {
        if (value <= 0) {
            throw new IllegalArgumentException(paramName + " 必须大于0");
        }
        return value;
    }

    /**
     * 校验请求体中的镜像列表：必须是 JSON 数组，且每一项都是非空字符串。
     * <p>在任何探测开始之前同步拒绝，调用方据此返回 400。</p>
     */
    public static List<String> requireEndpointList(Object value, String paramName) {
        if (!(value instanceof List)) {
            throw new IllegalArgumentException(paramName + " 必须是列表");
        }
        List<?> raw = (List<?>) value;
        List<String> endpoints = new ArrayList<>(raw.size());
        for (Object item : raw) {
            if (!(item instanceof String) || ((String) item).trim().isEmpty()) {
                throw new IllegalArgumentException(paramName + " 只能包含非空字符串");
            }
            endpoints.add(((String) item).trim());
        }
        return Collections.unmodifiableList(endpoints);
    }
}
