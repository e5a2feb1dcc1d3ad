package com.aiinpocket.rankverify.service;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.jdbc.core.ConnectionCallback;
import org.springframework.jdbc.core.JdbcTemplate;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

import static com.aiinpocket.rankverify.service.DistributedLockService.TRY_LOCK_SQL;
import static com.aiinpocket.rankverify.service.DistributedLockService.UNLOCK_SQL;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("DistributedLockService 排程互斥鎖")
class DistributedLockServiceTest {

    @Mock
    private JdbcTemplate jdbcTemplate;

    @Mock
    private Connection connection;

    @Mock
    private PreparedStatement tryLockStatement;

    @Mock
    private PreparedStatement unlockStatement;

    @Mock
    private ResultSet tryLockResult;

    @Mock
    private ResultSet unlockResult;

    private DistributedLockService lockService;

    @BeforeEach
    void setUp() throws Exception {
        lockService = new DistributedLockService(jdbcTemplate);
        when(jdbcTemplate.execute(any(ConnectionCallback.class)))
                .thenAnswer(inv -> inv.<ConnectionCallback<?>>getArgument(0).doInConnection(connection));
        when(connection.prepareStatement(TRY_LOCK_SQL)).thenReturn(tryLockStatement);
        when(tryLockStatement.executeQuery()).thenReturn(tryLockResult);
        when(tryLockResult.next()).thenReturn(true);
    }

    private void lockAvailable(boolean available) throws Exception {
        when(tryLockResult.getBoolean(1)).thenReturn(available);
    }

    private void unlockSucceeds() throws Exception {
        when(connection.prepareStatement(UNLOCK_SQL)).thenReturn(unlockStatement);
        when(unlockStatement.executeQuery()).thenReturn(unlockResult);
        when(unlockResult.next()).thenReturn(true);
        when(unlockResult.getBoolean(1)).thenReturn(true);
    }

    @Test
    @DisplayName("取鎖、執行、解鎖都在同一個連線上")
    void lockAndUnlockShareConnection() throws Exception {
        // Given
        lockAvailable(true);
        unlockSucceeds();

        // When
        Optional<String> result = lockService.callWithLock(42L, "task", () -> "done");

        // Then
        assertThat(result).contains("done");
        verify(jdbcTemplate, times(1)).execute(any(ConnectionCallback.class));
        verify(tryLockStatement).setLong(1, 42L);
        verify(unlockStatement).setLong(1, 42L);
        verify(connection).prepareStatement(UNLOCK_SQL);
    }

    @Test
    @DisplayName("其他 Pod 持有鎖時不執行任務也不解鎖")
    void skipsWhenHeld() throws Exception {
        lockAvailable(false);
        AtomicBoolean ran = new AtomicBoolean();

        Optional<Object> result = lockService.callWithLock(42L, "task", () -> {
            ran.set(true);
            return "x";
        });

        assertThat(result).isEmpty();
        assertThat(ran).isFalse();
        verify(connection, never()).prepareStatement(UNLOCK_SQL);
    }

    @Test
    @DisplayName("任務拋出例外時仍會在同一個連線上釋放鎖")
    void releasesOnFailure() throws Exception {
        lockAvailable(true);
        unlockSucceeds();

        assertThatThrownBy(() -> lockService.callWithLock(7L, "task", () -> {
            throw new IllegalStateException("boom");
        })).isInstanceOf(IllegalStateException.class);

        verify(unlockStatement).setLong(1, 7L);
    }
}
