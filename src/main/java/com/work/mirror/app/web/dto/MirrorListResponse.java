package com.work.mirror.app.web.dto;

import java.util.List;

public class MirrorListResponse {

    private final List<String> mirrors;

    public MirrorListResponse(List<String> mirrors) {
        this.mirrors = mirrors;
    }

    public List<String> getMirrors() {
        return mirrors;
    }
}
