package com.work.mirror.core.cache.impl;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Ticker;
import com.work.mirror.core.cache.VolatileSnapshotStore;
import com.work.mirror.core.model.CachedSnapshot;

import java.time.Duration;
import java.util.Optional;

/**
 * 进程内的 volatile tier 实现（无 Redis 环境使用），由 Caffeine 负责过期。
 *
 * <p>TTL 在构造时确定；{@link #save} 传入的 ttl 仅用于校验与 Redis 实现保持同一接口。</p>
 */
public class CaffeineVolatileSnapshotStore implements VolatileSnapshotStore {

    private static final String KEY = "snapshot";

    private final Cache<String, CachedSnapshot> cache;

    public CaffeineVolatileSnapshotStore(Duration ttl) {
        this(ttl, Ticker.systemTicker());
    }

    public CaffeineVolatileSnapshotStore(Duration ttl, Ticker ticker) {
        this.cache = Caffeine.newBuilder()
                .maximumSize(1)
                .expireAfterWrite(ttl)
                .ticker(ticker)
                .build();
    }

    @Override
    public boolean save(CachedSnapshot snapshot, Duration ttl) {
        cache.put(KEY, snapshot);
        return true;
    }

    @Override
    public Optional<CachedSnapshot> load() {
        return Optional.ofNullable(cache.getIfPresent(KEY));
    }
}
