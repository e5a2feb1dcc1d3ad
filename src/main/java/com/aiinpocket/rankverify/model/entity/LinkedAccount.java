package com.aiinpocket.rankverify.model.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

/**
 * 使用者綁定的遊戲帳號 Entity。
 * 一位使用者可以綁定多個遊戲帳號，但同一時間最多只有一個主要帳號（is_primary）。
 * 每次驗證成功都會依 (owner_identity, unique_id) upsert。
 */
@Entity
@Table(name = "linked_account",
        uniqueConstraints = {
                @UniqueConstraint(name = "uk_linked_account_owner_unique", columnNames = {"owner_identity", "unique_id"}),
                @UniqueConstraint(name = "uk_linked_account_primary_owner", columnNames = {"primary_owner"})
        },
        indexes = {
                @Index(name = "idx_linked_account_primary", columnList = "is_primary, id")
        })
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class LinkedAccount {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "owner_identity", nullable = false, length = 64)
    private String ownerIdentity;

    @Column(name = "unique_id", nullable = false, length = 32)
    private String uniqueId;

    @Column(nullable = false)
    private int level;

    @Column(name = "rank_name", nullable = false, length = 64)
    private String rankName;

    @Column(name = "verified_at", nullable = false)
    private Instant verifiedAt;

    @Column(name = "is_primary", nullable = false)
    @Builder.Default
    private boolean primaryAccount = false;

    /**
     * 主要帳號時等於 owner_identity，否則為 null。
     * 唯一約束允許多個 null，藉此由資料庫保證每位使用者最多一個主要帳號。
     */
    @Setter(AccessLevel.NONE)
    @Column(name = "primary_owner", length = 64)
    private String primaryOwner;

    /** 驗證時的附加資訊（段位區間、信心分數），JSON 格式 */
    @Column(columnDefinition = "TEXT")
    private String metadata;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    public void setPrimaryAccount(boolean primaryAccount) {
        this.primaryAccount = primaryAccount;
        this.primaryOwner = primaryAccount ? ownerIdentity : null;
    }

    @PrePersist
    protected void onCreate() {
        this.primaryOwner = primaryAccount ? ownerIdentity : null;
        this.createdAt = Instant.now();
        this.updatedAt = Instant.now();
    }

    @PreUpdate
    protected void onUpdate() {
        this.primaryOwner = primaryAccount ? ownerIdentity : null;
        this.updatedAt = Instant.now();
    }
}
