package com.work.mirror.core.repository.entity;

import com.baomidou.mybatisplus.annotation.IdType;
import com.baomidou.mybatisplus.annotation.TableId;
import com.baomidou.mybatisplus.annotation.TableName;

import java.time.Instant;

@TableName("test_batches")
public class TestBatchEntity {

    @TableId(type = IdType.AUTO)
    private Long id;

    private Instant batchTime;

    private Integer totalMirrors;

    private Integer availableCount;

    private Integer unavailableCount;

    private Instant createdAt;

    public Long getId() {
        return id;
    }

    public void setId(Long id) {
        this.id = id;
    }

    public Instant getBatchTime() {
        return batchTime;
    }

    public void setBatchTime(Instant batchTime) {
        this.batchTime = batchTime;
    }

    public Integer getTotalMirrors() {
        return totalMirrors;
    }

    public void setTotalMirrors(Integer totalMirrors) {
        this.totalMirrors = totalMirrors;
    }

    public Integer getAvailableCount() {
        return availableCount;
    }

    public void setAvailableCount(Integer availableCount) {
        this.availableCount = availableCount;
    }

    public Integer getUnavailableCount() {
        return unavailableCount;
    }

    public void setUnavailableCount(Integer unavailableCount) {
        this.unavailableCount = unavailableCount;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(Instant createdAt) {
        this.createdAt = createdAt;
    }
}
