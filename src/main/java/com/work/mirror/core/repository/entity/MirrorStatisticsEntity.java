package com.work.mirror.core.repository.entity;

import com.baomidou.mybatisplus.annotation.IdType;
import com.baomidou.mybatisplus.annotation.TableId;
import com.baomidou.mybatisplus.annotation.TableName;

import java.time.Instant;

/**
 * 镜像累计统计表实体类，mirror_url 唯一。
 */
@TableName("mirror_statistics")
public class MirrorStatisticsEntity {

    @TableId(type = IdType.AUTO)
    private Long id;

    private String mirrorUrl;

    private Long totalTests;

    private Long successCount;

    private Long failCount;

    private Double avgResponseTime;

    private Instant lastSuccessTime;

    private Instant lastFailTime;

    private Boolean currentStatus;

    private Instant updatedAt;

    public Long getId() {
        return id;
    }

    public void setId(Long id) {
        this.id = id;
    }

    public String getMirrorUrl() {
        return mirrorUrl;
    }

    public void setMirrorUrl(String mirrorUrl) {
        this.mirrorUrl = mirrorUrl;
    }

    public Long getTotalTests() {
        return totalTests;
    }

    public void setTotalTests(Long totalTests) {
        this.totalTests = totalTests;
    }

    public Long getSuccessCount() {
        return successCount;
    }

    public void setSuccessCount(Long successCount) {
        this.successCount = successCount;
    }

    public Long getFailCount() {
        return failCount;
    }

    public void setFailCount(Long failCount) {
        this.failCount = failCount;
    }

    public Double getAvgResponseTime() {
        return avgResponseTime;
    }

    public void setAvgResponseTime(Double avgResponseTime) {
        this.avgResponseTime = avgResponseTime;
    }

    public Instant getLastSuccessTime() {
        return lastSuccessTime;
    }

    public void setLastSuccessTime(Instant lastSuccessTime) {
        this.lastSuccessTime = lastSuccessTime;
    }

    public Instant getLastFailTime() {
        return lastFailTime;
    }

    public void setLastFailTime(Instant lastFailTime) {
        this.lastFailTime = lastFailTime;
    }

    public Boolean getCurrentStatus() {
        return currentStatus;
    }

    public void setCurrentStatus(Boolean currentStatus) {
        this.currentStatus = currentStatus;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    public void setUpdatedAt(Instant updatedAt) {
        this.updatedAt = updatedAt;
    }
}
