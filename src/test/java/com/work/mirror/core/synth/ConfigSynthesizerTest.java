package com.work.mirror.core.synth;

import com.work.mirror.core.model.CachedSnapshot;
import com.work.mirror.core.model.ProbeResult;
import com.work.mirror.core.model.RecommendedConfig;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class ConfigSynthesizerTest {

    private static final Instant NOW = Instant.parse("2024-05-01T00:00:00Z");

    private static ProbeResult r(String endpoint, boolean available, double ms) {
        return new ProbeResult(endpoint, available, available ? "available" : "connection failed",
                available ? 200 : 0, ms, NOW);
    }

    private static CachedSnapshot snapshot(ProbeResult... results) {
        List<ProbeResult> list = Arrays.asList(results);
        int available = (int) list.stream().filter(ProbeResult::isAvailable).count();
        return new CachedSnapshot(list, list.size(), available, list.size() - available, NOW, NOW.plus(Duration.ofHours(1)));
    }

    @Test
    public void picks_fastest_available_up_to_count() {
        List<ProbeResult> results = new ArrayList<>();
        for (int i = 0; i < 7; i++) {
            results.add(r("m" + i, true, 100 - i * 10));
        }
        results.add(r("down", false, 1));

        RecommendedConfig config = new ConfigSynthesizer(5).synthesize(snapshot(results.toArray(new ProbeResult[0])));

        assertEquals(Arrays.asList("m6", "m5", "m4", "m3", "m2"), config.getMirrors());
        assertEquals(5, config.getCount());
        assertEquals(7, config.getTotalAvailable());
        assertEquals(NOW, config.getLastUpdate());
        assertEquals(NOW.plus(Duration.ofHours(1)), config.getNextUpdate());
    }

    @Test
    public void fewer_available_than_count_returns_all_available() {
        RecommendedConfig config = new ConfigSynthesizer(5).synthesize(snapshot(
                r("a", true, 30), r("b", false, 1), r("c", true, 10)));

        assertEquals(Arrays.asList("c", "a"), config.getMirrors());
        assertFalse(config.isEmpty());
    }

    @Test
    public void no_available_mirrors_yields_empty_config() {
        RecommendedConfig config = new ConfigSynthesizer(5).synthesize(snapshot(r("a", false, 1), r("b", false, 2)));

        assertTrue(config.isEmpty());
        assertEquals(0, config.getTotalAvailable());
    }

    @Test
    public void missing_latency_sorts_last() {
        RecommendedConfig config = new ConfigSynthesizer(5).synthesize(snapshot(
                r("nan", true, Double.NaN), r("neg", true, -1), r("ok", true, 500)));

        assertEquals("ok", config.getMirrors().get(0));
    }
}
