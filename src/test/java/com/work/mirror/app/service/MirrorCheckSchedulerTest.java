package com.work.mirror.app.service;

import com.work.mirror.core.aggregate.BatchAggregator;
import com.work.mirror.core.cache.DurableResultLog;
import com.work.mirror.core.cache.TieredSnapshotCache;
import com.work.mirror.core.cache.impl.CaffeineVolatileSnapshotStore;
import com.work.mirror.core.config.MirrorCheckConfig;
import com.work.mirror.core.model.ApplyResult;
import com.work.mirror.core.model.ProbeBatch;
import com.work.mirror.core.model.ProbeResult;
import com.work.mirror.core.model.RecommendedConfig;
import com.work.mirror.core.support.metrics.MirrorCheckMetrics;
import com.work.mirror.core.synth.ConfigSynthesizer;
import com.work.mirror.core.synth.DaemonConfigWriter;
import org.junit.jupiter.api.Test;

import java.nio.file.Paths;
import java.time.Duration;
import java.time.Instant;
import java.util.Arrays;
import java.util.Collections;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

public class MirrorCheckSchedulerTest {

    private static MirrorCheckConfig config(boolean autoApply) {
        return new MirrorCheckConfig(Arrays.asList("https://a.example", "https://b.example"),
                Duration.ofSeconds(5), Duration.ofSeconds(10), Duration.ofHours(1), 5, autoApply,
                Paths.get("/tmp/daemon.json"), Paths.get("/tmp/daemon.json.bak"));
    }

    private static ProbeBatch batch() {
        return ProbeBatch.of(Instant.now(), Collections.singletonList(
                new ProbeResult("https://a.example", true, "available", 200, 12, Instant.now())));
    }

    private static TieredSnapshotCache cache() {
        return new TieredSnapshotCache(new CaffeineVolatileSnapshotStore(Duration.ofHours(1)), Duration.ofHours(1));
    }

    @Test
    public void tick_runs_pipeline_and_applies_config_when_enabled() {
        BatchAggregator aggregator = mock(BatchAggregator.class);
        when(aggregator.runBatch(anyList(), any(), eq(true))).thenReturn(batch());
        DurableResultLog durableLog = mock(DurableResultLog.class);
        DaemonConfigWriter writer = mock(DaemonConfigWriter.class);
        when(writer.apply(any())).thenReturn(ApplyResult.applied(Paths.get("/tmp/daemon.json"), null,
                Collections.singletonList("https://a.example")));
        MirrorCheckMetrics metrics = mock(MirrorCheckMetrics.class);
        TieredSnapshotCache cache = cache();

        MirrorCheckScheduler scheduler = new MirrorCheckScheduler(config(true), aggregator, durableLog, cache,
                new ConfigSynthesizer(5), writer, metrics);

        assertTrue(scheduler.tick());

        verify(durableLog, times(1)).recordBatch(any());
        assertTrue(cache.current().isPresent());
        verify(writer, times(1)).apply(argThat((RecommendedConfig c) -> c.getMirrors().equals(
                Collections.singletonList("https://a.example"))));
        verify(metrics).scheduledRun(eq("success"));
        verify(metrics).configApply(eq("APPLIED"));
        assertFalse(scheduler.isRunning());
    }

    @Test
    public void auto_apply_disabled_skips_config_write() {
        BatchAggregator aggregator = mock(BatchAggregator.class);
        when(aggregator.runBatch(anyList(), any(), anyBoolean())).thenReturn(batch());
        DaemonConfigWriter writer = mock(DaemonConfigWriter.class);

        MirrorCheckScheduler scheduler = new MirrorCheckScheduler(config(false), aggregator, mock(DurableResultLog.class),
                cache(), new ConfigSynthesizer(5), writer, mock(MirrorCheckMetrics.class));

        scheduler.tick();

        verify(writer, never()).apply(any());
    }

    @Test
    public void failed_run_releases_gate_and_next_tick_runs() {
        BatchAggregator aggregator = mock(BatchAggregator.class);
        when(aggregator.runBatch(anyList(), any(), anyBoolean()))
                .thenThrow(new IllegalStateException("boom"))
                .thenReturn(batch());
        MirrorCheckMetrics metrics = mock(MirrorCheckMetrics.class);
        TieredSnapshotCache cache = cache();

        MirrorCheckScheduler scheduler = new MirrorCheckScheduler(config(false), aggregator, mock(DurableResultLog.class),
                cache, new ConfigSynthesizer(5), mock(DaemonConfigWriter.class), metrics);

        assertTrue(scheduler.tick());
        assertFalse(cache.current().isPresent());
        verify(metrics).scheduledRun(eq("error"));

        assertTrue(scheduler.tick());
        assertTrue(cache.current().isPresent());
        verify(metrics).scheduledRun(eq("success"));
    }

    @Test
    public void overlapping_tick_is_skipped_while_run_in_progress() throws Exception {
        CountDownLatch entered = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        BatchAggregator aggregator = mock(BatchAggregator.class);
        when(aggregator.runBatch(anyList(), any(), anyBoolean())).thenAnswer(inv -> {
            entered.countDown();
            assertTrue(release.await(5, TimeUnit.SECONDS));
            return batch();
        });
        MirrorCheckMetrics metrics = mock(MirrorCheckMetrics.class);

        MirrorCheckScheduler scheduler = new MirrorCheckScheduler(config(false), aggregator, mock(DurableResultLog.class),
                cache(), new ConfigSynthesizer(5), mock(DaemonConfigWriter.class), metrics);

        Thread first = new Thread(scheduler::tick, "tick-1");
        first.start();
        assertTrue(entered.await(5, TimeUnit.SECONDS));

        assertTrue(scheduler.isRunning());
        assertFalse(scheduler.tick());

        release.countDown();
        first.join(5_000);

        verify(aggregator, times(1)).runBatch(anyList(), any(), anyBoolean());
        verify(metrics).scheduledRun(eq("skipped"));
        assertFalse(scheduler.isRunning());
    }
}
