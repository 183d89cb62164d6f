package com.work.mirror.core.repository.impl;

import com.work.mirror.core.model.BatchRecord;
import com.work.mirror.core.model.HistoryRecord;
import com.work.mirror.core.model.ProbeResult;
import com.work.mirror.core.model.RollingStat;
import com.work.mirror.core.repository.entity.MirrorStatisticsEntity;
import com.work.mirror.core.repository.entity.MirrorTestHistoryEntity;
import com.work.mirror.core.repository.entity.TestBatchEntity;
import com.work.mirror.core.repository.mapper.MirrorStatisticsMapper;
import com.work.mirror.core.repository.mapper.MirrorTestHistoryMapper;
import com.work.mirror.core.repository.mapper.TestBatchMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Instant;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

public class PostgresProbeRecordRepositoryTest {

    private static final Instant OBSERVED = Instant.parse("2024-05-01T10:00:00Z");

    private MirrorTestHistoryMapper historyMapper;
    private MirrorStatisticsMapper statisticsMapper;
    private TestBatchMapper batchMapper;
    private PostgresProbeRecordRepository repository;

    @BeforeEach
    public void setUp() {
        historyMapper = mock(MirrorTestHistoryMapper.class);
        statisticsMapper = mock(MirrorStatisticsMapper.class);
        batchMapper = mock(TestBatchMapper.class);
        repository = new PostgresProbeRecordRepository(historyMapper, statisticsMapper, batchMapper);
    }

    @Test
    public void successful_result_upserts_success_delta_and_last_success_time() {
        repository.recordProbe(new ProbeResult("https://m1", true, "available", 200, 123.45, OBSERVED));

        verify(statisticsMapper).upsertStatistics(eq("https://m1"), eq(1), eq(0), eq(123.45),
                eq(OBSERVED), isNull(), eq(true), eq(OBSERVED));

        ArgumentCaptor<MirrorTestHistoryEntity> captor = ArgumentCaptor.forClass(MirrorTestHistoryEntity.class);
        verify(historyMapper).insert(captor.capture());
        MirrorTestHistoryEntity row = captor.getValue();
        assertEquals("https://m1", row.getMirrorUrl());
        assertEquals(Boolean.TRUE, row.getAvailable());
        assertEquals("available", row.getStatus());
        assertEquals(Integer.valueOf(200), row.getStatusCode());
        assertEquals(Double.valueOf(123.45), row.getResponseTime());
        assertEquals(OBSERVED, row.getTestTime());
        assertNotNull(row.getCreatedAt());
    }

    @Test
    public void failed_result_upserts_fail_delta_and_last_fail_time() {
        repository.recordProbe(new ProbeResult("https://m2", false, "HTTP error: 500", 500, 80.0, OBSERVED));

        verify(statisticsMapper).upsertStatistics(eq("https://m2"), eq(0), eq(1), eq(80.0),
                isNull(), eq(OBSERVED), eq(false), eq(OBSERVED));
        verify(historyMapper, times(1)).insert(any(MirrorTestHistoryEntity.class));
    }

    @Test
    public void batch_row_carries_counts_and_time() {
        repository.recordBatch(new BatchRecord(null, OBSERVED, 19, 12, 7));

        ArgumentCaptor<TestBatchEntity> captor = ArgumentCaptor.forClass(TestBatchEntity.class);
        verify(batchMapper).insert(captor.capture());
        TestBatchEntity row = captor.getValue();
        assertEquals(OBSERVED, row.getBatchTime());
        assertEquals(Integer.valueOf(19), row.getTotalMirrors());
        assertEquals(Integer.valueOf(12), row.getAvailableCount());
        assertEquals(Integer.valueOf(7), row.getUnavailableCount());
        assertNotNull(row.getCreatedAt());
    }

    @Test
    public void null_history_columns_map_to_defaults() {
        MirrorTestHistoryEntity row = new MirrorTestHistoryEntity();
        row.setId(7L);
        row.setMirrorUrl("https://m1");
        row.setStatus("connection failed");
        row.setTestTime(OBSERVED);
        when(historyMapper.listRecent(anyInt())).thenReturn(Collections.singletonList(row));

        List<HistoryRecord> out = repository.findHistory(null, 10);

        assertEquals(1, out.size());
        assertEquals(Long.valueOf(7L), out.get(0).getId());
        ProbeResult r = out.get(0).getResult();
        assertFalse(r.isAvailable());
        assertEquals(0, r.getStatusCode());
        assertEquals(0.0, r.getResponseTimeMs());
        assertEquals(OBSERVED, r.getObservedAt());
    }

    @Test
    public void null_statistics_columns_map_to_defaults() {
        MirrorStatisticsEntity row = new MirrorStatisticsEntity();
        row.setMirrorUrl("https://m1");
        when(statisticsMapper.listRanked()).thenReturn(Collections.singletonList(row));

        List<RollingStat> out = repository.findStatistics();

        assertEquals(1, out.size());
        RollingStat s = out.get(0);
        assertEquals("https://m1", s.getEndpoint());
        assertEquals(0L, s.getTotalTests());
        assertEquals(0L, s.getSuccessCount());
        assertEquals(0L, s.getFailCount());
        assertEquals(0.0, s.getAvgResponseTimeMs());
        assertNull(s.getLastSuccessAt());
        assertNull(s.getLastFailAt());
        assertFalse(s.isCurrentStatus());
    }

    @Test
    public void blank_endpoint_lists_all_and_named_endpoint_is_trimmed() {
        when(historyMapper.listRecent(anyInt())).thenReturn(Collections.emptyList());
        when(historyMapper.listRecentByMirror(anyString(), anyInt())).thenReturn(Collections.emptyList());

        repository.findHistory("   ", 50);
        repository.findHistory("  https://m1 ", 20);

        verify(historyMapper).listRecent(eq(50));
        verify(historyMapper).listRecentByMirror(eq("https://m1"), eq(20));
    }
}
