package com.work.mirror.core.cache;

import com.github.benmanes.caffeine.cache.Ticker;
import com.work.mirror.core.cache.impl.CaffeineVolatileSnapshotStore;
import com.work.mirror.core.model.CachedSnapshot;
import com.work.mirror.core.model.ProbeBatch;
import com.work.mirror.core.model.ProbeResult;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.Arrays;
import java.util.Collections;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

public class TieredSnapshotCacheTest {

    private static final Duration TTL = Duration.ofHours(1);

    private static ProbeBatch batch(ProbeResult... results) {
        return ProbeBatch.of(Instant.now(), Arrays.asList(results));
    }

    private static ProbeResult ok(String endpoint, double ms) {
        return new ProbeResult(endpoint, true, "available", 200, ms, Instant.now());
    }

    @Test
    public void publish_sets_next_update_one_interval_after_last_update() {
        TieredSnapshotCache cache = new TieredSnapshotCache(new CaffeineVolatileSnapshotStore(TTL), TTL);

        CachedSnapshot snapshot = cache.publish(batch(ok("a", 10)));

        assertEquals(snapshot.getLastUpdate().plus(TTL), snapshot.getNextUpdate());
        assertSame(snapshot, cache.current().get());
    }

    @Test
    public void read_falls_back_to_last_known_when_volatile_tier_fails() {
        VolatileSnapshotStore broken = mock(VolatileSnapshotStore.class);
        when(broken.save(any(), any())).thenReturn(false);
        when(broken.load()).thenReturn(Optional.empty());
        TieredSnapshotCache cache = new TieredSnapshotCache(broken, TTL);

        CachedSnapshot published = cache.publish(batch(ok("a", 10), ok("b", 20)));

        Optional<CachedSnapshot> current = cache.current();
        assertTrue(current.isPresent());
        assertSame(published, current.get());
        assertEquals(2, current.get().getTotal());
    }

    @Test
    public void expired_volatile_entry_falls_back_to_in_process_snapshot() {
        AtomicLong nanos = new AtomicLong();
        Ticker ticker = nanos::get;
        VolatileSnapshotStore local = new CaffeineVolatileSnapshotStore(TTL, ticker);
        TieredSnapshotCache cache = new TieredSnapshotCache(local, TTL);

        CachedSnapshot published = cache.publish(batch(ok("a", 10)));
        nanos.addAndGet(TimeUnit.HOURS.toNanos(2));

        assertFalse(local.load().isPresent());
        assertSame(published, cache.current().get());
    }

    @Test
    public void empty_when_nothing_published() {
        TieredSnapshotCache cache = new TieredSnapshotCache(new CaffeineVolatileSnapshotStore(TTL), TTL);
        assertFalse(cache.current().isPresent());
    }

    @Test
    public void volatile_tier_wins_over_in_process_snapshot() {
        CachedSnapshot shared = new CachedSnapshot(Collections.singletonList(ok("shared", 5)), 1, 1, 0,
                Instant.now(), Instant.now().plus(TTL));
        VolatileSnapshotStore store = mock(VolatileSnapshotStore.class);
        when(store.save(any(), any())).thenReturn(true);
        TieredSnapshotCache cache = new TieredSnapshotCache(store, TTL);
        cache.publish(batch(ok("local", 5)));

        when(store.load()).thenReturn(Optional.of(shared));

        assertSame(shared, cache.current().get());
    }

    @Test
    public void warm_up_seeds_in_process_snapshot_once() {
        CachedSnapshot shared = new CachedSnapshot(Collections.singletonList(ok("shared", 5)), 1, 1, 0,
                Instant.now(), Instant.now().plus(TTL));
        VolatileSnapshotStore store = mock(VolatileSnapshotStore.class);
        when(store.load()).thenReturn(Optional.of(shared));
        TieredSnapshotCache cache = new TieredSnapshotCache(store, TTL);

        assertTrue(cache.warmUp());
        assertFalse(cache.warmUp());
        assertSame(shared, cache.lastKnown().get());
    }
}
