package com.aiinpocket.rankverify.service;

import com.aiinpocket.rankverify.exception.LockConflictException;
import com.aiinpocket.rankverify.exception.RoleConfigException;
import com.aiinpocket.rankverify.exception.RolePermissionException;
import com.aiinpocket.rankverify.model.dto.ExtractedProfile;
import com.aiinpocket.rankverify.model.dto.ImageIngestResult;
import com.aiinpocket.rankverify.model.dto.ImageSource;
import com.aiinpocket.rankverify.model.dto.RankDefinition;
import com.aiinpocket.rankverify.model.dto.RankMatch;
import com.aiinpocket.rankverify.model.dto.VerificationAuditRequest;
import com.aiinpocket.rankverify.model.dto.VerificationOutcome;
import com.aiinpocket.rankverify.model.enums.FailureReason;
import com.aiinpocket.rankverify.model.enums.LockConflictReason;
import com.aiinpocket.rankverify.model.enums.VerificationStatus;
import com.aiinpocket.rankverify.service.audit.VerificationAuditService;
import com.aiinpocket.rankverify.service.extraction.ProfileExtractionService;
import com.aiinpocket.rankverify.service.ingest.ImageIngestService;
import com.aiinpocket.rankverify.service.matching.RankMatcher;
import com.aiinpocket.rankverify.service.rank.RankConfigProvider;
import com.aiinpocket.rankverify.service.role.RankRoleAssignmentService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Map;
import java.util.Optional;

/**
 * 截圖段位驗證管線。
 *
 * <p>處理順序：
 * <ol>
 *   <li>下載截圖（大小、時限、類型限制）並計算 SHA-256</li>
 *   <li>影像辨識（先查快取）</li>
 *   <li>比對段位</li>
 *   <li>檢查截圖鎖：在任何會留下痕跡的動作之前拒絕已被他人認領的截圖</li>
 *   <li>主要帳號已是更高段位時不降級，直接回報目前段位</li>
 *   <li>切換段位身分組</li>
 *   <li>提交截圖鎖；並行競爭輸掉時撤回剛新增的身分組</li>
 *   <li>更新綁定帳號（僅在截圖鎖提交成功後；失敗不影響結果）</li>
 *   <li>寫入稽核軌跡</li>
 * </ol>
 * 每個結束路徑都恰好寫入一筆稽核紀錄。
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RankVerificationService {

    private final ImageIngestService ingestService;
    private final ProfileExtractionService extractionService;
    private final RankMatcher rankMatcher;
    private final RankConfigProvider rankConfigProvider;
    private final ScreenshotLockService lockService;
    private final RankRoleAssignmentService roleAssignmentService;
    private final LinkedAccountService linkedAccountService;
    private final VerificationAuditService auditService;

    public VerificationOutcome processAndVerify(ImageSource source, String identity) {
        long startedAt = System.currentTimeMillis();

        ImageIngestResult image = ingestService.ingest(source);
        if (!image.isSuccess()) {
            FailureReason reason = switch (image.failure()) {
                case NOT_IMAGE -> FailureReason.NOT_PROFILE_SCREENSHOT;
                case OVERSIZE -> FailureReason.IMAGE_TOO_LARGE;
                case TIMEOUT, NETWORK_ERROR -> FailureReason.IMAGE_UNAVAILABLE;
            };
            log.info("[段位驗證] 截圖下載失敗: identity={}, failure={}, detail={}",
                    identity, image.failure(), image.detail());
            auditService.record(VerificationAuditRequest.builder()
                    .identity(identity)
                    .status(VerificationStatus.FAILURE)
                    .processingTimeMs(elapsed(startedAt))
                    .reason("截圖下載失敗: " + image.failure())
                    .build());
            return VerificationOutcome.failure(reason);
        }

        try {
            return verify(image, identity, startedAt);
        } catch (RuntimeException e) {
            log.error("[段位驗證] 未預期的錯誤: identity={}", identity, e);
            auditService.record(baseAudit(identity, VerificationStatus.FAILURE, image, null, null, startedAt)
                    .reason("內部錯誤: " + e.getClass().getSimpleName())
                    .build());
            return VerificationOutcome.failure(FailureReason.INTERNAL_ERROR);
        }
    }

    private VerificationOutcome verify(ImageIngestResult image, String identity, long startedAt) {
        ExtractedProfile profile = extractionService.extract(image.data(), image.sha256(), image.contentType());
        String uniqueId = profile.uniqueId();

        Optional<RankMatch> matched = rankMatcher.matchProfile(profile, rankConfigProvider.getCurrent());
        if (matched.isEmpty()) {
            auditService.record(baseAudit(identity, VerificationStatus.FAILURE, image, null, uniqueId, startedAt)
                    .reason("無法辨識段位")
                    .metadata(Map.of("all_unknown", profile.isAllUnknown()))
                    .build());
            return VerificationOutcome.failure(FailureReason.RANK_NOT_RECOGNIZED);
        }
        RankMatch match = matched.get();

        try {
            lockService.verifyLock(identity, image.sha256(), uniqueId);
        } catch (LockConflictException e) {
            log.warn("[段位驗證] 截圖鎖衝突: identity={}, reason={}, owner={}",
                    identity, e.getReason(), e.getConflictingOwner());
            auditService.record(baseAudit(identity, VerificationStatus.FAILURE, image, match, uniqueId, startedAt)
                    .reason(conflictText(e.getReason()))
                    .build());
            return VerificationOutcome.conflict(e.getReason(), match, uniqueId);
        }

        Optional<RankDefinition> higher = currentHigherRank(identity, match);
        if (higher.isPresent()) {
            log.info("[段位驗證] 已持有更高段位，不降級: identity={}, current={}, submitted={}",
                    identity, higher.get().displayName(), match.rankName());
            auditService.record(baseAudit(identity, VerificationStatus.SUCCESS, image, match, uniqueId, startedAt)
                    .reason("已持有更高段位 " + higher.get().displayName() + "，維持不變")
                    .build());
            return VerificationOutcome.rankRetained(higher.get(), match, uniqueId);
        }

        boolean granted;
        try {
            granted = roleAssignmentService.assign(identity, match.rank());
        } catch (RoleConfigException e) {
            return manualReview(identity, image, match, uniqueId, startedAt,
                    FailureReason.ROLE_CONFIGURATION_ERROR, e.getMessage());
        } catch (RolePermissionException e) {
            return manualReview(identity, image, match, uniqueId, startedAt,
                    FailureReason.ROLE_PERMISSION_ERROR, e.getMessage());
        } catch (RuntimeException e) {
            log.error("[段位驗證] 身分組切換失敗: identity={}, rank={}", identity, match.rankName(), e);
            auditService.record(baseAudit(identity, VerificationStatus.FAILURE, image, match, uniqueId, startedAt)
                    .reason("身分組切換失敗")
                    .build());
            return VerificationOutcome.failure(FailureReason.INTERNAL_ERROR, match, uniqueId);
        }

        try {
            lockService.upsertLock(identity, image.sha256(), uniqueId);
        } catch (LockConflictException e) {
            log.warn("[段位驗證] 提交截圖鎖時被搶先: identity={}, reason={}, owner={}",
                    identity, e.getReason(), e.getConflictingOwner());
            revokeGrantedRole(identity, match, granted);
            auditService.record(baseAudit(identity, VerificationStatus.FAILURE, image, match, uniqueId, startedAt)
                    .reason(conflictText(e.getReason()) + "（並行提交）")
                    .build());
            return VerificationOutcome.conflict(e.getReason(), match, uniqueId);
        }

        int level = match.levelDetected() != null ? match.levelDetected() : match.rank().levelMin();
        if (uniqueId != null) {
            try {
                linkedAccountService.upsertAccount(identity, uniqueId, level, match.rankName(), Map.of(
                        "rank_min", match.rank().levelMin(),
                        "rank_max", match.rank().levelMax(),
                        "confidence", match.confidence()));
            } catch (RuntimeException e) {
                log.warn("[段位驗證] 綁定帳號更新失敗（不影響驗證）: identity={}, uniqueId={}, {}",
                        identity, uniqueId, e.getMessage());
            }
        }

        auditService.record(baseAudit(identity, VerificationStatus.SUCCESS, image, match, uniqueId, startedAt)
                .level(level)
                .metadata(Map.of("rank_min", match.rank().levelMin(), "rank_max", match.rank().levelMax()))
                .build());
        log.info("[段位驗證] 驗證成功: identity={}, rank={}, level={}, confidence={}",
                identity, match.rankName(), match.levelDetected(), match.confidence());
        return VerificationOutcome.success(match, uniqueId);
    }

    private VerificationOutcome manualReview(String identity, ImageIngestResult image, RankMatch match,
                                             String uniqueId, long startedAt, FailureReason reason, String detail) {
        log.error("[段位驗證] 身分組無法套用，需人工審核: identity={}, rank={}, reason={}, {}",
                identity, match.rankName(), reason, detail);
        auditService.record(baseAudit(identity, VerificationStatus.MANUAL_REVIEW, image, match, uniqueId, startedAt)
                .reason(detail)
                .build());
        return VerificationOutcome.manualReview(reason, match, uniqueId);
    }

    /**
     * 主要帳號目前的段位比這次比對到的段位高時回傳目前段位。
     * 查詢失敗時視為沒有既有段位，照常套用。
     */
    private Optional<RankDefinition> currentHigherRank(String identity, RankMatch match) {
        try {
            return linkedAccountService.findPrimary(identity)
                    .flatMap(account -> rankMatcher.findByName(account.getRankName(), rankConfigProvider.getCurrent()))
                    .filter(current -> current.levelMin() > match.rank().levelMin());
        } catch (RuntimeException e) {
            log.warn("[段位驗證] 讀取既有段位失敗，照常套用: identity={}, {}", identity, e.getMessage());
            return Optional.empty();
        }
    }

    /** 並行競爭輸掉時撤回本次新增的身分組；原本就持有的不動 */
    private void revokeGrantedRole(String identity, RankMatch match, boolean granted) {
        if (!granted) {
            return;
        }
        try {
            roleAssignmentService.remove(identity, match.rank().token());
        } catch (RuntimeException e) {
            log.error("[段位驗證] 撤回身分組失敗，需人工處理: identity={}, role={}",
                    identity, match.rank().token(), e);
        }
    }

    private static VerificationAuditRequest.VerificationAuditRequestBuilder baseAudit(
            String identity, VerificationStatus status, ImageIngestResult image,
            RankMatch match, String uniqueId, long startedAt) {
        return VerificationAuditRequest.builder()
                .identity(identity)
                .status(status)
                .confidence(match != null ? match.confidence() : null)
                .rankName(match != null ? match.rankName() : null)
                .level(match != null ? match.levelDetected() : null)
                .uniqueId(uniqueId)
                .screenshotHash(image.sha256())
                .attachment(image.toAttachment())
                .processingTimeMs(elapsed(startedAt));
    }

    private static String conflictText(LockConflictReason reason) {
        return reason == LockConflictReason.HASH_CONFLICT
                ? "截圖已綁定其他使用者"
                : "遊戲 ID 已綁定其他使用者";
    }

    private static long elapsed(long startedAt) {
        return System.currentTimeMillis() - startedAt;
    }
}
