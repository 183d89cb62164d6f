package com.work.mirror.core.exception;

/**
 * 组件内部的统一异常类型，便于宿主侧捕获或转换为 HTTP 错误码。
 */
public class MirrorCheckException extends RuntimeException {

    public MirrorCheckException(String message) {
        super(message);
    }

    public MirrorCheckException(String message, Throwable cause) {
        super(message, cause);
    }
}
