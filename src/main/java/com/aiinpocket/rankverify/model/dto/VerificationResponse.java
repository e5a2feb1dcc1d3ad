package com.aiinpocket.rankverify.model.dto;

import com.aiinpocket.rankverify.model.enums.FailureReason;
import com.aiinpocket.rankverify.model.enums.LockConflictReason;
import com.aiinpocket.rankverify.model.enums.VerificationStatus;

/**
 * POST /api/verifications 的回應：驗證結果加上可直接顯示給使用者的訊息。
 */
public record VerificationResponse(
        VerificationStatus status,
        String rank,
        Integer level,
        String uniqueId,
        double confidence,
        FailureReason failureReason,
        LockConflictReason conflictReason,
        boolean rankRetained,
        String message
) {
    public static VerificationResponse from(VerificationOutcome outcome) {
        return new VerificationResponse(
                outcome.status(),
                outcome.rank(),
                outcome.level(),
                outcome.uniqueId(),
                outcome.confidence(),
                outcome.failureReason(),
                outcome.conflictReason(),
                outcome.rankRetained(),
                outcome.userMessage()
        );
    }
}
