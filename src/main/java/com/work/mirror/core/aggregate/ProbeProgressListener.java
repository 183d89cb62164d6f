package com.work.mirror.core.aggregate;

import com.work.mirror.core.model.ProbeResult;

/**
 * 顺序模式下每完成一个探测回调一次。
 */
@FunctionalInterface
public interface ProbeProgressListener {

    void onProgress(int completed, int total, ProbeResult result);
}
