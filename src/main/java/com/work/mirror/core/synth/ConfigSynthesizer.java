package com.work.mirror.core.synth;

import com.work.mirror.core.model.CachedSnapshot;
import com.work.mirror.core.model.ProbeResult;
import com.work.mirror.core.model.RecommendedConfig;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

import static com.work.mirror.core.support.ValidationUtils.requireNonNull;
import static com.work.mirror.core.support.ValidationUtils.requirePositive;

/**
 * 从快照中挑选最快的 N 个可用镜像。
 */
public class ConfigSynthesizer {

    /**
     * 缺失或无意义的耗时一律排到最后
     */
    static final double MISSING_LATENCY = Double.MAX_VALUE;

    private static final Comparator<ProbeResult> BY_LATENCY =
            Comparator.comparingDouble(ConfigSynthesizer::effectiveLatency);

    private final int recommendCount;

    public ConfigSynthesizer(int recommendCount) {
        this.recommendCount = requirePositive(recommendCount, "recommendCount");
    }

    public RecommendedConfig synthesize(CachedSnapshot snapshot) {
        requireNonNull(snapshot, "snapshot");

        List<ProbeResult> available = new ArrayList<>();
        for (ProbeResult r : snapshot.getResults()) {
            if (r.isAvailable()) {
                available.add(r);
            }
        }
        available.sort(BY_LATENCY);

        List<String> mirrors = new ArrayList<>(Math.min(recommendCount, available.size()));
        for (ProbeResult r : available.subList(0, Math.min(recommendCount, available.size()))) {
            mirrors.add(r.getEndpoint());
        }
        return new RecommendedConfig(mirrors, available.size(), snapshot.getLastUpdate(), snapshot.getNextUpdate());
    }

    private static double effectiveLatency(ProbeResult r) {
        double ms = r.getResponseTimeMs();
        return (Double.isNaN(ms) || ms < 0) ? MISSING_LATENCY : ms;
    }
}
