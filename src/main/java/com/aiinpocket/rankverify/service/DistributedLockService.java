package com.aiinpocket.rankverify.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.ConnectionCallback;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Service;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * 排程互斥鎖。
 * 多個 Pod 同時觸發同一個 Quartz 排程（例如身分組校正）時，以 PostgreSQL Advisory Lock
 * 保證只有一個 Pod 真正呼叫 Discord API，其他 Pod 直接略過這一輪。
 *
 * <p>Advisory lock 綁定在 session 上，因此取得與釋放都在同一個借出的連線上執行，
 * 任務期間該連線不會歸還連線池。
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DistributedLockService {

    static final String TRY_LOCK_SQL = "SELECT pg_try_advisory_lock(?)";
    static final String UNLOCK_SQL = "SELECT pg_advisory_unlock(?)";

    private final JdbcTemplate jdbcTemplate;

    /**
     * 在鎖保護下執行並回傳結果。
     *
     * @return 取不到鎖時為 empty，任務本身不會被呼叫
     */
    public <T> Optional<T> callWithLock(long lockId, String taskName, Supplier<T> task) {
        return jdbcTemplate.execute((ConnectionCallback<Optional<T>>) connection -> {
            if (!queryBoolean(connection, TRY_LOCK_SQL, lockId)) {
                log.debug("[排程鎖] {} 正由其他 Pod 執行，略過 (lockId={})", taskName, lockId);
                return Optional.empty();
            }
            try {
                return Optional.ofNullable(task.get());
            } finally {
                if (!queryBoolean(connection, UNLOCK_SQL, lockId)) {
                    log.warn("[排程鎖] 釋放時未持有鎖: task={}, lockId={}", taskName, lockId);
                }
            }
        });
    }

    private static boolean queryBoolean(Connection connection, String sql, long lockId) throws SQLException {
        try (PreparedStatement statement = connection.prepareStatement(sql)) {
            statement.setLong(1, lockId);
            try (ResultSet rs = statement.executeQuery()) {
                return rs.next() && rs.getBoolean(1);
            }
        }
    }
}
