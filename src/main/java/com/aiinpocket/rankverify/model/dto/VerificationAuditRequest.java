package com.aiinpocket.rankverify.model.dto;

import com.aiinpocket.rankverify.model.enums.VerificationStatus;
import lombok.Builder;

import java.util.Map;

/**
 * 送進稽核軌跡的一筆驗證紀錄。
 * 除了 identity 與 status 以外的欄位皆可為 null。
 */
@Builder
public record VerificationAuditRequest(
        String identity,
        VerificationStatus status,
        Double confidence,
        String uniqueId,
        String screenshotHash,
        String rankName,
        Integer level,
        Long processingTimeMs,
        String reason,
        EvidenceAttachment attachment,
        Map<String, Object> metadata
) {}
