package com.aiinpocket.rankverify;

import io.github.bucket4j.TimeMeter;

import java.time.Duration;

/** 手動推進的 Bucket4j 時間來源 */
public class ManualTimeMeter implements TimeMeter {

    private long nanos;

    public void advance(Duration duration) {
        nanos += duration.toNanos();
    }

    @Override
    public long currentTimeNanos() {
        return nanos;
    }

    @Override
    public boolean isWallClockBased() {
        return false;
    }
}
