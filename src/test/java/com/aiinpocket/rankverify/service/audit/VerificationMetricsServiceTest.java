package com.aiinpocket.rankverify.service.audit;

import com.aiinpocket.rankverify.model.dto.MetricsSnapshot;
import com.aiinpocket.rankverify.model.enums.VerificationStatus;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import tools.jackson.databind.ObjectMapper;
import tools.jackson.databind.json.JsonMapper;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

@DisplayName("VerificationMetricsService 統計計數器")
class VerificationMetricsServiceTest {

    private final ObjectMapper objectMapper = JsonMapper.builder().build();

    @TempDir
    Path dir;

    @Test
    @DisplayName("依狀態累計，平均信心只計算有分數的樣本")
    void countsAndAverage() {
        VerificationMetricsService service =
                new VerificationMetricsService(dir.resolve("metrics.json"), Duration.ofHours(1), objectMapper);

        service.recordVerification(VerificationStatus.SUCCESS, 0.9);
        service.recordVerification(VerificationStatus.SUCCESS, 1.0);
        service.recordVerification(VerificationStatus.FAILURE, null);
        service.recordVerification(VerificationStatus.MANUAL_REVIEW, 0.8);
        service.recordCleanup();
        service.recordRateLimitHit();

        MetricsSnapshot snapshot = service.getSnapshot();
        assertThat(snapshot.totalVerifications()).isEqualTo(4);
        assertThat(snapshot.successCount()).isEqualTo(2);
        assertThat(snapshot.failureCount()).isEqualTo(1);
        assertThat(snapshot.manualReviewCount()).isEqualTo(1);
        assertThat(snapshot.confidenceSampleCount()).isEqualTo(3);
        assertThat(snapshot.averageConfidence()).isCloseTo(0.9, within(1e-9));
        assertThat(snapshot.cleanupCount()).isEqualTo(1);
        assertThat(snapshot.rateLimitHits()).isEqualTo(1);
        service.shutdown();
    }

    @Test
    @DisplayName("寫檔後重新啟動仍保留計數與平均")
    void survivesRestart() {
        Path file = dir.resolve("metrics.json");
        VerificationMetricsService first = new VerificationMetricsService(file, Duration.ofHours(1), objectMapper);
        first.recordVerification(VerificationStatus.SUCCESS, 0.7);
        first.recordVerification(VerificationStatus.SUCCESS, 0.9);
        first.shutdown();

        VerificationMetricsService restarted = new VerificationMetricsService(file, Duration.ofHours(1), objectMapper);

        assertThat(restarted.getSnapshot().successCount()).isEqualTo(2);
        assertThat(restarted.getSnapshot().averageConfidence()).isCloseTo(0.8, within(1e-9));
        restarted.shutdown();
    }

    @Test
    @DisplayName("延遲期間的多次更新合併成一次寫檔")
    void debouncedFlush() throws Exception {
        Path file = dir.resolve("metrics.json");
        VerificationMetricsService service = new VerificationMetricsService(file, Duration.ofMillis(100), objectMapper);

        service.recordVerification(VerificationStatus.SUCCESS, 1.0);
        service.recordVerification(VerificationStatus.FAILURE, null);

        long deadline = System.currentTimeMillis() + 5000;
        while (!Files.exists(file) && System.currentTimeMillis() < deadline) {
            Thread.sleep(20);
        }
        assertThat(file).exists();
        assertThat(Files.readString(file)).contains("\"totalVerifications\":2");
        service.shutdown();
    }

    @Test
    @DisplayName("統計檔損毀時從零開始")
    void corruptFileResets() throws Exception {
        Path file = dir.resolve("metrics.json");
        Files.writeString(file, "{\"totalVerifications\": \"lots\"");

        VerificationMetricsService service = new VerificationMetricsService(file, Duration.ofHours(1), objectMapper);

        assertThat(service.getSnapshot().totalVerifications()).isZero();
        service.shutdown();
    }

    @Test
    @DisplayName("多個執行緒同時寫檔時，檔案內容是最後一次的完整統計")
    void concurrentFlushesKeepLatestState() throws Exception {
        // Given
        Path file = dir.resolve("metrics.json");
        VerificationMetricsService service = new VerificationMetricsService(file, Duration.ofHours(1), objectMapper);
        int threads = 8;
        int rounds = 50;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<?>> futures = new ArrayList<>();

        // When
        for (int i = 0; i < threads; i++) {
            futures.add(pool.submit(() -> {
                start.await();
                for (int r = 0; r < rounds; r++) {
                    service.recordVerification(VerificationStatus.SUCCESS, 1.0);
                    service.flush();
                }
                return null;
            }));
        }
        start.countDown();
        for (Future<?> future : futures) {
            future.get(30, TimeUnit.SECONDS);
        }
        pool.shutdown();

        // Then
        assertThat(file.resolveSibling("metrics.json.tmp")).doesNotExist();
        VerificationMetricsService reloaded = new VerificationMetricsService(file, Duration.ofHours(1), objectMapper);
        assertThat(reloaded.getSnapshot().totalVerifications()).isEqualTo((long) threads * rounds);
        reloaded.shutdown();
        service.shutdown();
    }
}
