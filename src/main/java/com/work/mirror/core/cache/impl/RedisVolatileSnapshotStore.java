package com.work.mirror.core.cache.impl;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.work.mirror.core.cache.VolatileSnapshotStore;
import com.work.mirror.core.model.CachedSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.time.Duration;
import java.util.Optional;

import static com.work.mirror.core.support.ValidationUtils.requireNonEmpty;
import static com.work.mirror.core.support.ValidationUtils.requireNonNull;
import static com.work.mirror.core.support.ValidationUtils.requirePositive;

/**
 * 基于 Redis 的 volatile tier：SET key json EX ttl。
 *
 * 特性：
 * 1. 快照整体序列化为 JSON 存入单个 key
 * 2. Redis 不可用或数据损坏时只记录日志，读路径回落到进程内快照
 */
public class RedisVolatileSnapshotStore implements VolatileSnapshotStore {

    private static final Logger LOGGER = LoggerFactory.getLogger(RedisVolatileSnapshotStore.class);

    private final StringRedisTemplate redisTemplate;
    private final ObjectMapper objectMapper;
    private final String cacheKey;

    public RedisVolatileSnapshotStore(StringRedisTemplate redisTemplate, ObjectMapper objectMapper, String cacheKey) {
        this.redisTemplate = requireNonNull(redisTemplate, "redisTemplate");
        this.objectMapper = requireNonNull(objectMapper, "objectMapper");
        this.cacheKey = requireNonEmpty(cacheKey, "cacheKey");
    }

    @Override
    public boolean save(CachedSnapshot snapshot, Duration ttl) {
        requireNonNull(snapshot, "snapshot");
        requirePositive(ttl, "ttl");
        try {
            String json = objectMapper.writeValueAsString(snapshot);
            redisTemplate.opsForValue().set(cacheKey, json, ttl);
            return true;
        } catch (Exception e) {
            LOGGER.warn("[mirror] Redis 缓存失败 key={} err={}", cacheKey, e.toString());
            return false;
        }
    }

    @Override
    public Optional<CachedSnapshot> load() {
        try {
            String json = redisTemplate.opsForValue().get(cacheKey);
            if (json == null || json.isEmpty()) {
                return Optional.empty();
            }
            return Optional.of(objectMapper.readValue(json, CachedSnapshot.class));
        } catch (Exception e) {
            LOGGER.warn("[mirror] 从 Redis 获取数据失败 key={} err={}", cacheKey, e.toString());
            return Optional.empty();
        }
    }
}
