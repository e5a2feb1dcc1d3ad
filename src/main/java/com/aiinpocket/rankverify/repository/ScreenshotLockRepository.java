package com.aiinpocket.rankverify.repository;

import com.aiinpocket.rankverify.model.entity.ScreenshotLock;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.transaction.annotation.Transactional;

import java.util.Optional;

/**
 * 截圖鎖 Repository。
 * 寫入衝突以 DataIntegrityViolationException 呈現（資料表唯一約束），由 ScreenshotLockService 轉譯。
 */
public interface ScreenshotLockRepository extends JpaRepository<ScreenshotLock, Long> {

    Optional<ScreenshotLock> findByScreenshotHash(String screenshotHash);

    Optional<ScreenshotLock> findByUniqueId(String uniqueId);

    @Modifying
    @Transactional
    @Query("DELETE FROM ScreenshotLock l WHERE l.screenshotHash = :screenshotHash")
    int deleteByScreenshotHash(@Param("screenshotHash") String screenshotHash);

    @Modifying
    @Transactional
    @Query("DELETE FROM ScreenshotLock l WHERE l.uniqueId = :uniqueId")
    int deleteByUniqueId(@Param("uniqueId") String uniqueId);
}
