package com.aiinpocket.rankverify.service;

import com.aiinpocket.rankverify.exception.LockConflictException;
import com.aiinpocket.rankverify.model.entity.ScreenshotLock;
import com.aiinpocket.rankverify.model.enums.LockConflictReason;
import com.aiinpocket.rankverify.repository.ScreenshotLockRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * 截圖鎖服務。
 * 確保同一張截圖（內容雜湊）與同一個遊戲 ID 只能被一位使用者認領。
 *
 * <p>{@link #verifyLock} 是提交前的快速檢查，讓管線在任何副作用發生前就能拒絕；
 * {@link #upsertLock} 才是真正的提交點，並行情況下以資料表唯一約束決定誰贏，
 * 約束違反會轉成 {@link LockConflictException}。
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ScreenshotLockService {

    private final ScreenshotLockRepository lockRepository;

    /**
     * 檢查截圖與遊戲 ID 是否已被其他使用者認領（先檢查雜湊，再檢查 ID）。
     * 同一位使用者重複提交不算衝突。
     *
     * @throws LockConflictException 已被其他使用者認領
     */
    public void verifyLock(String identity, String screenshotHash, String uniqueId) {
        Optional<ScreenshotLock> byHash = lockRepository.findByScreenshotHash(screenshotHash);
        if (byHash.isPresent() && !byHash.get().getOwnerIdentity().equals(identity)) {
            throw new LockConflictException(LockConflictReason.HASH_CONFLICT, byHash.get().getOwnerIdentity());
        }

        if (uniqueId != null) {
            Optional<ScreenshotLock> byUniqueId = lockRepository.findByUniqueId(uniqueId);
            if (byUniqueId.isPresent() && !byUniqueId.get().getOwnerIdentity().equals(identity)) {
                throw new LockConflictException(LockConflictReason.UNIQUE_ID_CONFLICT, byUniqueId.get().getOwnerIdentity());
            }
        }
    }

    /**
     * 寫入（或更新）截圖鎖。重複呼叫結果相同，不會產生重複資料。
     *
     * <ul>
     *   <li>雜湊已存在且屬於本人：補上或更新遊戲 ID</li>
     *   <li>遊戲 ID 已存在且屬於本人：原地換成新的截圖雜湊</li>
     *   <li>兩者都不存在：新增一筆</li>
     * </ul>
     *
     * @throws LockConflictException 已被其他使用者認領，包含並行寫入時輸掉的一方
     */
    public ScreenshotLock upsertLock(String identity, String screenshotHash, String uniqueId) {
        try {
            return doUpsert(identity, screenshotHash, uniqueId);
        } catch (DataIntegrityViolationException e) {
            return resolveConstraintViolation(identity, screenshotHash, uniqueId, e);
        }
    }

    private ScreenshotLock doUpsert(String identity, String screenshotHash, String uniqueId) {
        Optional<ScreenshotLock> byHash = lockRepository.findByScreenshotHash(screenshotHash);
        if (byHash.isPresent()) {
            ScreenshotLock lock = byHash.get();
            if (!lock.getOwnerIdentity().equals(identity)) {
                throw new LockConflictException(LockConflictReason.HASH_CONFLICT, lock.getOwnerIdentity());
            }
            if (uniqueId == null || uniqueId.equals(lock.getUniqueId())) {
                return lock;
            }
            Optional<ScreenshotLock> byUniqueId = lockRepository.findByUniqueId(uniqueId);
            if (byUniqueId.isPresent()) {
                if (!byUniqueId.get().getOwnerIdentity().equals(identity)) {
                    throw new LockConflictException(LockConflictReason.UNIQUE_ID_CONFLICT, byUniqueId.get().getOwnerIdentity());
                }
                // 這個 ID 已由本人的另一筆鎖持有，維持原狀
                return lock;
            }
            lock.setUniqueId(uniqueId);
            log.info("[截圖鎖] 補上遊戲 ID: identity={}, uniqueId={}", identity, uniqueId);
            return lockRepository.saveAndFlush(lock);
        }

        if (uniqueId != null) {
            Optional<ScreenshotLock> byUniqueId = lockRepository.findByUniqueId(uniqueId);
            if (byUniqueId.isPresent()) {
                ScreenshotLock lock = byUniqueId.get();
                if (!lock.getOwnerIdentity().equals(identity)) {
                    throw new LockConflictException(LockConflictReason.UNIQUE_ID_CONFLICT, lock.getOwnerIdentity());
                }
                lock.setScreenshotHash(screenshotHash);
                log.info("[截圖鎖] 更新截圖雜湊: identity={}, uniqueId={}", identity, uniqueId);
                return lockRepository.saveAndFlush(lock);
            }
        }

        ScreenshotLock created = lockRepository.saveAndFlush(ScreenshotLock.builder()
                .screenshotHash(screenshotHash)
                .uniqueId(uniqueId)
                .ownerIdentity(identity)
                .build());
        log.info("[截圖鎖] 新增: identity={}, uniqueId={}, hash={}", identity, uniqueId, abbreviate(screenshotHash));
        return created;
    }

    /**
     * 唯一約束違反代表有另一筆寫入搶先提交。
     * 重新查詢目前的持有者：屬於他人則回報衝突；屬於本人（同一使用者並行提交）則視為已完成。
     */
    private ScreenshotLock resolveConstraintViolation(String identity, String screenshotHash, String uniqueId,
                                                      DataIntegrityViolationException cause) {
        Optional<ScreenshotLock> byHash = lockRepository.findByScreenshotHash(screenshotHash);
        if (byHash.isPresent() && !byHash.get().getOwnerIdentity().equals(identity)) {
            log.warn("[截圖鎖] 並行寫入衝突（截圖雜湊）: identity={}, owner={}", identity, byHash.get().getOwnerIdentity());
            throw new LockConflictException(LockConflictReason.HASH_CONFLICT, byHash.get().getOwnerIdentity());
        }
        if (uniqueId != null) {
            Optional<ScreenshotLock> byUniqueId = lockRepository.findByUniqueId(uniqueId);
            if (byUniqueId.isPresent() && !byUniqueId.get().getOwnerIdentity().equals(identity)) {
                log.warn("[截圖鎖] 並行寫入衝突（遊戲 ID）: identity={}, owner={}", identity, byUniqueId.get().getOwnerIdentity());
                throw new LockConflictException(LockConflictReason.UNIQUE_ID_CONFLICT, byUniqueId.get().getOwnerIdentity());
            }
        }
        if (byHash.isPresent()) {
            log.debug("[截圖鎖] 同一使用者並行提交，沿用已存在的鎖: identity={}", identity);
            return byHash.get();
        }
        throw cause;
    }

    /** 管理員解除綁定：依截圖雜湊 */
    public int unlinkByHash(String screenshotHash) {
        int count = lockRepository.deleteByScreenshotHash(screenshotHash);
        if (count > 0) {
            log.info("[截圖鎖] 管理員依雜湊解除綁定: hash={}, removed={}", abbreviate(screenshotHash), count);
        }
        return count;
    }

    /** 管理員解除綁定：依遊戲 ID */
    public int unlinkByUniqueId(String uniqueId) {
        int count = lockRepository.deleteByUniqueId(uniqueId);
        if (count > 0) {
            log.info("[截圖鎖] 管理員依遊戲 ID 解除綁定: uniqueId={}, removed={}", uniqueId, count);
        }
        return count;
    }

    private static String abbreviate(String hash) {
        return hash != null && hash.length() > 16 ? hash.substring(0, 16) : hash;
    }
}
