package com.aiinpocket.rankverify.model.dto;

import com.aiinpocket.rankverify.model.enums.FailureReason;
import com.aiinpocket.rankverify.model.enums.LockConflictReason;
import com.aiinpocket.rankverify.model.enums.VerificationStatus;

/**
 * 驗證管線回傳給呼叫端的結果。
 *
 * @param status         SUCCESS / FAILURE / MANUAL_REVIEW
 * @param rank           比對到的段位名稱
 * @param level          採用的等級（與段位區間一致時才有值）
 * @param uniqueId       遊戲內唯一 ID
 * @param confidence     比對信心分數，沒有比對結果時為 0
 * @param failureReason  失敗原因
 * @param conflictReason 截圖鎖衝突種類（僅 ALREADY_CLAIMED 時有值）
 * @param rankRetained   已持有更高段位，本次不降級；此時 rank 為目前持有的段位
 */
public record VerificationOutcome(
        VerificationStatus status,
        String rank,
        Integer level,
        String uniqueId,
        double confidence,
        FailureReason failureReason,
        LockConflictReason conflictReason,
        boolean rankRetained
) {
    public static VerificationOutcome success(RankMatch match, String uniqueId) {
        return new VerificationOutcome(VerificationStatus.SUCCESS, match.rankName(),
                match.levelDetected(), uniqueId, match.confidence(), null, null, false);
    }

    public static VerificationOutcome failure(FailureReason reason) {
        return new VerificationOutcome(VerificationStatus.FAILURE, null, null, null, 0, reason, null, false);
    }

    public static VerificationOutcome failure(FailureReason reason, RankMatch match, String uniqueId) {
        return new VerificationOutcome(VerificationStatus.FAILURE, match.rankName(),
                match.levelDetected(), uniqueId, match.confidence(), reason, null, false);
    }

    public static VerificationOutcome conflict(LockConflictReason conflictReason, RankMatch match, String uniqueId) {
        return new VerificationOutcome(VerificationStatus.FAILURE, match.rankName(),
                match.levelDetected(), uniqueId, match.confidence(),
                FailureReason.ALREADY_CLAIMED, conflictReason, false);
    }

    public static VerificationOutcome manualReview(FailureReason reason, RankMatch match, String uniqueId) {
        return new VerificationOutcome(VerificationStatus.MANUAL_REVIEW, match.rankName(),
                match.levelDetected(), uniqueId, match.confidence(), reason, null, false);
    }

    /** 截圖段位低於目前持有的段位：不動身分組，回報目前段位 */
    public static VerificationOutcome rankRetained(RankDefinition currentRank, RankMatch match, String uniqueId) {
        return new VerificationOutcome(VerificationStatus.SUCCESS, currentRank.displayName(),
                null, uniqueId, match.confidence(), null, null, true);
    }

    /** 可直接顯示給使用者的訊息 */
    public String userMessage() {
        if (failureReason != null) {
            return failureReason.userMessage();
        }
        if (rankRetained) {
            return String.format("你已持有更高的段位：%s，身分組維持不變", rank);
        }
        return level != null
                ? String.format("段位驗證成功：%s（等級 %d）", rank, level)
                : String.format("段位驗證成功：%s", rank);
    }
}
