package com.aiinpocket.rankverify.model.dto;

import java.time.Instant;

/**
 * 驗證統計的唯讀快照。
 */
public record MetricsSnapshot(
        long totalVerifications,
        long successCount,
        long failureCount,
        long manualReviewCount,
        double averageConfidence,
        long confidenceSampleCount,
        long cleanupCount,
        long rateLimitHits,
        Instant lastUpdated
) {}
