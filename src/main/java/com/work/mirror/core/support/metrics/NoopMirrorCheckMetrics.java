package com.work.mirror.core.support.metrics;

public class NoopMirrorCheckMetrics implements MirrorCheckMetrics {
}
