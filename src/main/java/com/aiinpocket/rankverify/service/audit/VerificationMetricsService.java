package com.aiinpocket.rankverify.service.audit;

import com.aiinpocket.rankverify.config.VerificationProperties;
import com.aiinpocket.rankverify.model.dto.MetricsSnapshot;
import com.aiinpocket.rankverify.model.enums.VerificationStatus;
import jakarta.annotation.PreDestroy;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import tools.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * 驗證統計計數器。
 *
 * <p>計數器存放在記憶體，並以 JSON 檔持久化。每次更新只排程一次延遲寫入，
 * 延遲期間的多次更新合併成一次寫檔。啟動時讀檔，檔案損毀則從零開始；關閉時強制寫入。
 * 統計只來自計數器本身，不掃描事件資料表。
 */
@Service
@Slf4j
public class VerificationMetricsService {

    private final Path metricsFile;
    private final Duration flushDelay;
    private final ObjectMapper objectMapper;
    private final ScheduledExecutorService scheduler;

    private final Object lock = new Object();
    /** 序列化與寫檔一起持有，確保檔案內容永遠是最後一次序列化的結果；取得順序 writeLock → lock */
    private final Object writeLock = new Object();
    private MetricsState state;
    private ScheduledFuture<?> pendingFlush;

    @Autowired
    public VerificationMetricsService(VerificationProperties props, ObjectMapper objectMapper) {
        this(Path.of(props.audit().metricsFile()), props.audit().metricsFlushDelay(), objectMapper);
    }

    public VerificationMetricsService(Path metricsFile, Duration flushDelay, ObjectMapper objectMapper) {
        this.metricsFile = metricsFile;
        this.flushDelay = flushDelay;
        this.objectMapper = objectMapper;
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "metrics-flush");
            t.setDaemon(true);
            return t;
        });
        this.state = load();
    }

    /**
     * 記錄一次驗證結果。
     *
     * @param confidence 比對信心分數，沒有比對結果時傳 null（不列入平均）
     */
    public void recordVerification(VerificationStatus status, Double confidence) {
        synchronized (lock) {
            state.totalVerifications++;
            switch (status) {
                case SUCCESS -> state.successCount++;
                case FAILURE -> state.failureCount++;
                case MANUAL_REVIEW -> state.manualReviewCount++;
            }
            if (confidence != null) {
                state.confidenceSum += confidence;
                state.confidenceSampleCount++;
            }
            state.lastUpdated = System.currentTimeMillis();
            scheduleFlush();
        }
    }

    /** 身分組校正批次修復一位使用者 */
    public void recordCleanup() {
        synchronized (lock) {
            state.cleanupCount++;
            state.lastUpdated = System.currentTimeMillis();
            scheduleFlush();
        }
    }

    /** 外部 API 額度用完 */
    public void recordRateLimitHit() {
        synchronized (lock) {
            state.rateLimitHits++;
            state.lastUpdated = System.currentTimeMillis();
            scheduleFlush();
        }
    }

    public MetricsSnapshot getSnapshot() {
        synchronized (lock) {
            double average = state.confidenceSampleCount > 0
                    ? state.confidenceSum / state.confidenceSampleCount
                    : 0.0;
            return new MetricsSnapshot(
                    state.totalVerifications,
                    state.successCount,
                    state.failureCount,
                    state.manualReviewCount,
                    average,
                    state.confidenceSampleCount,
                    state.cleanupCount,
                    state.rateLimitHits,
                    Instant.ofEpochMilli(state.lastUpdated)
            );
        }
    }

    /** 立即寫檔（關閉時與測試使用） */
    public void flush() {
        synchronized (writeLock) {
            String json;
            synchronized (lock) {
                if (pendingFlush != null) {
                    pendingFlush.cancel(false);
                    pendingFlush = null;
                }
                json = objectMapper.writeValueAsString(state);
            }
            write(json);
        }
    }

    @PreDestroy
    public void shutdown() {
        flush();
        scheduler.shutdownNow();
    }

    private void scheduleFlush() {
        if (pendingFlush != null && !pendingFlush.isDone()) {
            return;
        }
        pendingFlush = scheduler.schedule(this::flush, flushDelay.toMillis(), TimeUnit.MILLISECONDS);
    }

    private void write(String json) {
        try {
            Path parent = metricsFile.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Path temp = metricsFile.resolveSibling(metricsFile.getFileName() + ".tmp");
            Files.writeString(temp, json);
            Files.move(temp, metricsFile, StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException e) {
            log.warn("[統計] 寫入統計檔失敗: {}", e.getMessage());
        }
    }

    private MetricsState load() {
        if (!Files.isRegularFile(metricsFile)) {
            return MetricsState.defaults();
        }
        try {
            MetricsState loaded = objectMapper.readValue(Files.readString(metricsFile), MetricsState.class);
            log.info("[統計] 已載入統計檔: total={}", loaded.totalVerifications);
            return loaded;
        } catch (IOException | RuntimeException e) {
            log.warn("[統計] 統計檔無法解析，從零開始: {}", e.getMessage());
            return MetricsState.defaults();
        }
    }

    /** 持久化格式：累計值而非平均值，重啟後平均仍然正確 */
    @Data
    @NoArgsConstructor
    static class MetricsState {
        private long totalVerifications;
        private long successCount;
        private long failureCount;
        private long manualReviewCount;
        private double confidenceSum;
        private long confidenceSampleCount;
        private long cleanupCount;
        private long rateLimitHits;
        private long lastUpdated = System.currentTimeMillis();

        static MetricsState defaults() {
            return new MetricsState();
        }
    }
}
