package com.aiinpocket.rankverify.service;

import com.aiinpocket.rankverify.exception.LockConflictException;
import com.aiinpocket.rankverify.repository.ScreenshotLockRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@SpringBootTest
@ActiveProfiles("test")
@DisplayName("ScreenshotLockService 整合測試（H2）")
class ScreenshotLockServiceIntegrationTest {

    @Autowired
    private ScreenshotLockService service;

    @Autowired
    private ScreenshotLockRepository repository;

    @BeforeEach
    void cleanUp() {
        repository.deleteAll();
    }

    @Test
    @DisplayName("同一使用者重複提交只留下一筆")
    void repeatedSubmissionIsIdempotent() {
        service.upsertLock("alice", hash('1'), "182-625-474-6");
        service.upsertLock("alice", hash('1'), "182-625-474-6");

        assertThat(repository.count()).isEqualTo(1);
        assertThat(repository.findByUniqueId("182-625-474-6")).get()
                .extracting(l -> l.getOwnerIdentity()).isEqualTo("alice");
    }

    @Test
    @DisplayName("他人已認領的截圖或遊戲 ID 無法再被認領")
    void otherOwnerConflicts() {
        service.upsertLock("alice", hash('1'), "182-625-474-6");

        assertThatThrownBy(() -> service.upsertLock("bob", hash('1'), null))
                .isInstanceOf(LockConflictException.class);
        assertThatThrownBy(() -> service.upsertLock("bob", hash('2'), "182-625-474-6"))
                .isInstanceOf(LockConflictException.class);
        assertThat(repository.count()).isEqualTo(1);
    }

    @Test
    @DisplayName("多位使用者同時認領同一張截圖時恰好一人成功")
    void concurrentClaimsHaveSingleWinner() throws Exception {
        // Given
        int threads = 8;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<Boolean>> futures = new ArrayList<>();
        for (int i = 0; i < threads; i++) {
            String identity = "user-" + i;
            Callable<Boolean> claim = () -> {
                start.await();
                try {
                    service.upsertLock(identity, hash('9'), null);
                    return true;
                } catch (LockConflictException e) {
                    return false;
                }
            };
            futures.add(pool.submit(claim));
        }

        // When
        start.countDown();
        int winners = 0;
        for (Future<Boolean> future : futures) {
            try {
                if (future.get(30, TimeUnit.SECONDS)) {
                    winners++;
                }
            } catch (ExecutionException e) {
                throw new AssertionError("非預期的例外", e.getCause());
            }
        }
        pool.shutdown();

        // Then
        assertThat(winners).isEqualTo(1);
        assertThat(repository.count()).isEqualTo(1);
    }

    @Test
    @DisplayName("管理員解除綁定後可由他人重新認領")
    void unlinkReleasesLock() {
        service.upsertLock("alice", hash('3'), "111-222-333-4");

        assertThat(service.unlinkByUniqueId("111-222-333-4")).isEqualTo(1);
        assertThat(service.unlinkByHash(hash('3'))).isZero();

        service.upsertLock("bob", hash('3'), "111-222-333-4");
        assertThat(repository.findByScreenshotHash(hash('3'))).get()
                .extracting(l -> l.getOwnerIdentity()).isEqualTo("bob");
    }

    private static String hash(char c) {
        return String.valueOf(c).repeat(64);
    }
}
