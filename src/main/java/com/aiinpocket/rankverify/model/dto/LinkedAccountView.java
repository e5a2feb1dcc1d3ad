package com.aiinpocket.rankverify.model.dto;

import com.aiinpocket.rankverify.model.entity.LinkedAccount;

import java.time.Instant;

public record LinkedAccountView(
        Long id,
        String uniqueId,
        String displayUniqueId,
        int level,
        String rankName,
        Instant verifiedAt,
        boolean primary
) {
    public static LinkedAccountView from(LinkedAccount account) {
        return new LinkedAccountView(
                account.getId(),
                account.getUniqueId(),
                EvidenceRecord.formatUniqueId(account.getUniqueId()),
                account.getLevel(),
                account.getRankName(),
                account.getVerifiedAt(),
                account.isPrimaryAccount()
        );
    }
}
