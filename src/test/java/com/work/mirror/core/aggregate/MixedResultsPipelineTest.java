package com.work.mirror.core.aggregate;

import com.work.mirror.core.cache.DurableResultLog;
import com.work.mirror.core.cache.TieredSnapshotCache;
import com.work.mirror.core.cache.impl.CaffeineVolatileSnapshotStore;
import com.work.mirror.core.model.CachedSnapshot;
import com.work.mirror.core.model.ProbeBatch;
import com.work.mirror.core.model.ProbeResult;
import com.work.mirror.core.model.RecommendedConfig;
import com.work.mirror.core.probe.MirrorClient;
import com.work.mirror.core.probe.MirrorProbe;
import com.work.mirror.core.support.InMemoryProbeRecordRepository;
import com.work.mirror.core.support.metrics.NoopMirrorCheckMetrics;
import com.work.mirror.core.synth.ConfigSynthesizer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.HttpServerErrorException;
import org.springframework.web.client.ResourceAccessException;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * 超时 / 404 / 500 三种镜像混合时，从探测到推荐配置的完整链路。
 */
public class MixedResultsPipelineTest {

    private static final String TIMED_OUT = "https://a.example";
    private static final String NOT_FOUND = "https://b.example";
    private static final String SERVER_ERROR = "https://c.example";

    private BatchAggregator aggregator;

    @AfterEach
    public void tearDown() {
        if (aggregator != null) {
            aggregator.shutdown();
        }
    }

    @Test
    public void only_not_found_mirror_is_available_and_recommended() {
        MirrorClient client = mock(MirrorClient.class);
        when(client.fetchStatus(startsWith(TIMED_OUT), any())).thenThrow(new ResourceAccessException("Read timed out"));
        when(client.fetchStatus(startsWith(NOT_FOUND), any())).thenThrow(new HttpClientErrorException(HttpStatus.NOT_FOUND));
        when(client.fetchStatus(startsWith(SERVER_ERROR), any()))
                .thenThrow(new HttpServerErrorException(HttpStatus.INTERNAL_SERVER_ERROR));

        InMemoryProbeRecordRepository repo = new InMemoryProbeRecordRepository();
        aggregator = new BatchAggregator(new MirrorProbe(client),
                new DurableResultLog(repo, new NoopMirrorCheckMetrics(), 1000),
                new NoopMirrorCheckMetrics(), Duration.ofSeconds(10), 4);
        TieredSnapshotCache cache = new TieredSnapshotCache(
                new CaffeineVolatileSnapshotStore(Duration.ofHours(1)), Duration.ofHours(1));

        ProbeBatch batch = aggregator.runBatch(Arrays.asList(TIMED_OUT, NOT_FOUND, SERVER_ERROR),
                Duration.ofSeconds(5), true);
        CachedSnapshot snapshot = cache.publish(batch);
        RecommendedConfig config = new ConfigSynthesizer(5).synthesize(snapshot);

        List<String> available = new ArrayList<>();
        List<String> unavailable = new ArrayList<>();
        for (ProbeResult r : snapshot.getResults()) {
            (r.isAvailable() ? available : unavailable).add(r.getEndpoint());
        }
        Collections.sort(unavailable);

        assertEquals(Collections.singletonList(NOT_FOUND), available);
        assertEquals(Arrays.asList(TIMED_OUT, SERVER_ERROR), unavailable);
        assertEquals(NOT_FOUND, snapshot.getResults().get(0).getEndpoint());
        assertEquals(3, snapshot.getTotal());
        assertEquals(1, snapshot.getAvailableCount());
        assertEquals(2, snapshot.getUnavailableCount());

        ProbeResult timedOut = find(snapshot, TIMED_OUT);
        assertEquals(MirrorProbe.LABEL_CONNECTION_FAILED, timedOut.getStatusLabel());
        assertEquals(0, timedOut.getStatusCode());
        ProbeResult serverError = find(snapshot, SERVER_ERROR);
        assertEquals("HTTP error: 500", serverError.getStatusLabel());
        assertEquals(500, serverError.getStatusCode());
        assertEquals("available (HTTP 404)", find(snapshot, NOT_FOUND).getStatusLabel());

        assertEquals(Collections.singletonList(NOT_FOUND), config.getMirrors());
        assertEquals(1, config.getTotalAvailable());
        assertEquals(3, repo.findHistory(null, 100).size());
        verify(client, times(2)).fetchStatus(startsWith(TIMED_OUT), any());
    }

    private static ProbeResult find(CachedSnapshot snapshot, String endpoint) {
        for (ProbeResult r : snapshot.getResults()) {
            if (r.getEndpoint().equals(endpoint)) {
                return r;
            }
        }
        throw new AssertionError("missing result for " + endpoint);
    }
}
