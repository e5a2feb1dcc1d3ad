package com.aiinpocket.rankverify.model.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

/**
 * 截圖鎖 Entity。
 * 防止同一張截圖（內容雜湊）或同一個遊戲 ID 被兩位不同的使用者認領。
 *
 * <p>screenshot_hash 與 unique_id 各自有資料庫層級的唯一約束，
 * 並行寫入時由約束決定唯一贏家，應用層的事前查詢只用來產生友善的錯誤訊息。
 * unique_id 可為 NULL（辨識不到 ID 時），PostgreSQL 允許多筆 NULL。
 */
@Entity
@Table(name = "screenshot_lock",
        uniqueConstraints = {
                @UniqueConstraint(name = "uk_screenshot_lock_hash", columnNames = "screenshot_hash"),
                @UniqueConstraint(name = "uk_screenshot_lock_unique_id", columnNames = "unique_id")
        },
        indexes = {
                @Index(name = "idx_screenshot_lock_owner", columnList = "owner_identity")
        })
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ScreenshotLock {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    /** 截圖內容的 SHA-256（小寫十六進位） */
    @Column(name = "screenshot_hash", nullable = false, length = 64)
    private String screenshotHash;

    /** 遊戲內唯一 ID（辨識不到時為 null） */
    @Column(name = "unique_id", length = 32)
    private String uniqueId;

    /** 認領者 */
    @Column(name = "owner_identity", nullable = false, length = 64)
    private String ownerIdentity;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @PrePersist
    protected void onCreate() {
        this.createdAt = Instant.now();
        this.updatedAt = Instant.now();
    }

    @PreUpdate
    protected void onUpdate() {
        this.updatedAt = Instant.now();
    }
}
