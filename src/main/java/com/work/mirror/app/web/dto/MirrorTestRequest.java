package com.work.mirror.app.web.dto;

/**
 * 批量检测请求体。mirrors 缺省时检测配置的全部镜像；
 * 形状（必须是字符串列表）由服务层校验，以便返回统一的 400 消息。
 */
public class MirrorTestRequest {

    private Object mirrors;

    public Object getMirrors() {
        return mirrors;
    }

    public void setMirrors(Object mirrors) {
        this.mirrors = mirrors;
    }
}
