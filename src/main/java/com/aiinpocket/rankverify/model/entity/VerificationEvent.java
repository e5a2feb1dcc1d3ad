package com.aiinpocket.rankverify.model.entity;

import com.aiinpocket.rankverify.model.enums.VerificationStatus;
import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.Immutable;

import java.time.Instant;

/**
 * 驗證事件 Entity（只新增、不修改、不刪除）。
 */
@Entity
@Immutable
@Table(name = "verification_event", indexes = {
        @Index(name = "idx_verification_event_owner", columnList = "owner_identity, created_at")
})
@Getter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class VerificationEvent {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "owner_identity", nullable = false, length = 64, updatable = false)
    private String ownerIdentity;

    @Column(nullable = false, length = 20, updatable = false)
    @Enumerated(EnumType.STRING)
    private VerificationStatus status;

    @Column(updatable = false)
    private Double confidence;

    @Column(name = "unique_id", length = 32, updatable = false)
    private String uniqueId;

    @Column(name = "screenshot_hash", length = 64, updatable = false)
    private String screenshotHash;

    @Column(length = 500, updatable = false)
    private String reason;

    @Column(columnDefinition = "TEXT", updatable = false)
    private String metadata;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @PrePersist
    protected void onCreate() {
        if (this.createdAt == null) {
            this.createdAt = Instant.now();
        }
    }
}
