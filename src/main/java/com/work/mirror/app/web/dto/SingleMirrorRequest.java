package com.work.mirror.app.web.dto;

import javax.validation.constraints.NotBlank;

public class SingleMirrorRequest {

    @NotBlank(message = "缺少 mirror 参数")
    private String mirror;

    public String getMirror() {
        return mirror;
    }

    public void setMirror(String mirror) {
        this.mirror = mirror;
    }
}
