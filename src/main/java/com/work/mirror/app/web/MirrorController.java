package com.work.mirror.app.web;

import com.work.mirror.app.service.MirrorCheckService;
import com.work.mirror.app.web.dto.ApplyConfigResponse;
import com.work.mirror.app.web.dto.BatchProgressEvent;
import com.work.mirror.app.web.dto.BatchResponse;
import com.work.mirror.app.web.dto.HistoryView;
import com.work.mirror.app.web.dto.MirrorListResponse;
import com.work.mirror.app.web.dto.MirrorTestRequest;
import com.work.mirror.app.web.dto.RecommendedConfigResponse;
import com.work.mirror.app.web.dto.SingleMirrorRequest;
import com.work.mirror.app.web.dto.StatisticsView;
import com.work.mirror.core.model.ApplyResult;
import com.work.mirror.core.model.CachedSnapshot;
import com.work.mirror.core.model.ProbeBatch;
import com.work.mirror.core.model.ProbeResult;
import com.work.mirror.core.model.RecommendedConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import javax.annotation.PreDestroy;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 镜像检测的 REST 查询面，所有规则都在 {@link MirrorCheckService} 中。
 */
@RestController
@RequestMapping("/api")
public class MirrorController {

    private static final Logger log = LoggerFactory.getLogger(MirrorController.class);

    private static final int STREAM_WORKERS = 4;

    private final MirrorCheckService mirrorCheckService;
    private final ExecutorService streamExecutor;

    public MirrorController(MirrorCheckService mirrorCheckService) {
        this.mirrorCheckService = mirrorCheckService;
        AtomicInteger seq = new AtomicInteger();
        this.streamExecutor = Executors.newFixedThreadPool(STREAM_WORKERS, r -> {
            Thread t = new Thread(r, "mirror-stream-" + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    @GetMapping("/mirrors")
    public ResponseEntity<MirrorListResponse> mirrors() {
        return ResponseEntity.ok(new MirrorListResponse(mirrorCheckService.configuredMirrors()));
    }

    @PostMapping("/test")
    public ResponseEntity<ProbeResult> testSingle(@Validated @RequestBody SingleMirrorRequest request) {
        return ResponseEntity.ok(mirrorCheckService.probeOne(request.getMirror()));
    }

    @PostMapping("/test/all")
    public ResponseEntity<BatchResponse> testAll(@RequestBody(required = false) MirrorTestRequest request) {
        ProbeBatch batch = mirrorCheckService.runOnDemand(request == null ? null : request.getMirrors());
        return ResponseEntity.ok(BatchResponse.fromBatch(batch));
    }

    /**
     * 顺序检测并以 SSE 推送进度，最后一条事件携带 done=true 与排序后的汇总。
     */
    @PostMapping("/test/batch")
    public SseEmitter testBatch(@RequestBody(required = false) MirrorTestRequest request) {
        // 形状校验在请求线程上完成，非法请求直接返回 400
        List<String> targets = mirrorCheckService.resolveEndpoints(request == null ? null : request.getMirrors());
        SseEmitter emitter = new SseEmitter(0L);
        streamExecutor.execute(() -> {
            try {
                ProbeBatch batch = mirrorCheckService.streamBatch(targets, (completed, total, result) ->
                        send(emitter, new BatchProgressEvent(completed, total, result)));
                send(emitter, BatchResponse.finished(batch));
                emitter.complete();
            } catch (Exception e) {
                log.warn("[mirror] 流式检测中断 mirrors={} err={}", targets.size(), e.toString());
                emitter.completeWithError(e);
            }
        });
        return emitter;
    }

    @GetMapping("/test/cached")
    public ResponseEntity<CachedSnapshot> cached() {
        Optional<CachedSnapshot> snapshot = mirrorCheckService.currentSnapshot();
        return ResponseEntity.ok(snapshot.orElseGet(() ->
                new CachedSnapshot(Collections.emptyList(), 0, 0, 0, null, null)));
    }

    @GetMapping("/config/recommended")
    public ResponseEntity<RecommendedConfigResponse> recommended() {
        Optional<RecommendedConfig> config = mirrorCheckService.recommendedConfig();
        if (!config.isPresent()) {
            return ResponseEntity.ok(RecommendedConfigResponse.error(RecommendedConfigResponse.NO_DATA_MESSAGE));
        }
        return ResponseEntity.ok(RecommendedConfigResponse.fromConfig(config.get()));
    }

    @PostMapping("/config/update")
    public ResponseEntity<ApplyConfigResponse> updateConfig() {
        ApplyResult result = mirrorCheckService.applyConfig();
        ApplyConfigResponse body = ApplyConfigResponse.fromResult(result);
        switch (result.getStatus()) {
            case NO_DATA:
                return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(body);
            case FAILED:
                return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(body);
            default:
                return ResponseEntity.ok(body);
        }
    }

    @GetMapping("/history")
    public ResponseEntity<Map<String, List<HistoryView>>> history(@RequestParam(value = "mirror", required = false) String mirror,
                                                                  @RequestParam(value = "limit", required = false) Integer limit) {
        int l = limit == null ? 100 : limit;
        List<HistoryView> out = new ArrayList<>();
        mirrorCheckService.history(mirror, l).forEach(r -> out.add(HistoryView.fromRecord(r)));
        return ResponseEntity.ok(Collections.singletonMap("history", out));
    }

    @GetMapping("/statistics")
    public ResponseEntity<Map<String, List<StatisticsView>>> statistics() {
        List<StatisticsView> out = new ArrayList<>();
        mirrorCheckService.statistics().forEach(s -> out.add(StatisticsView.fromStat(s)));
        return ResponseEntity.ok(Collections.singletonMap("statistics", out));
    }

    @GetMapping("/health")
    public ResponseEntity<Map<String, String>> health() {
        Map<String, String> body = new LinkedHashMap<>();
        body.put("status", "ok");
        return ResponseEntity.ok(body);
    }

    @PreDestroy
    public void shutdown() {
        streamExecutor.shutdownNow();
    }

    private void send(SseEmitter emitter, Object payload) {
        try {
            emitter.send(SseEmitter.event().data(payload));
        } catch (IOException e) {
            // 客户端断开后继续检测无意义，中断剩余探测
            throw new IllegalStateException("SSE 客户端已断开", e);
        }
    }
}
