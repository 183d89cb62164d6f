package com.work.mirror.core.model;

public enum ApplyStatus {
    APPLIED,
    /**
     * 还没有任何检测数据
     */
    NO_DATA,
    NO_AVAILABLE_MIRRORS,
    FAILED
}
