package com.aiinpocket.rankverify.controller;

import com.aiinpocket.rankverify.model.dto.MetricsSnapshot;
import com.aiinpocket.rankverify.model.dto.RankDefinition;
import com.aiinpocket.rankverify.model.dto.ReconciliationReport;
import com.aiinpocket.rankverify.service.ScreenshotLockService;
import com.aiinpocket.rankverify.service.audit.VerificationAuditService;
import com.aiinpocket.rankverify.service.rank.RankConfigProvider;
import com.aiinpocket.rankverify.service.role.RankRoleReconciliationService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 管理員 REST API。
 * 解除截圖鎖、查詢統計、重新載入段位表、手動觸發身分組校正。
 */
@RestController
@RequestMapping("/api/admin")
@RequiredArgsConstructor
@Slf4j
public class AdminController {

    private final ScreenshotLockService lockService;
    private final VerificationAuditService auditService;
    private final RankConfigProvider rankConfigProvider;
    private final RankRoleReconciliationService reconciliationService;

    /** 解除截圖鎖，hash 與 uniqueId 擇一 */
    @DeleteMapping("/screenshot-locks")
    public ResponseEntity<Map<String, Object>> unlink(
            @RequestParam(required = false) String hash,
            @RequestParam(required = false) String uniqueId) {
        boolean hasHash = hash != null && !hash.isBlank();
        boolean hasUniqueId = uniqueId != null && !uniqueId.isBlank();
        if (hasHash == hasUniqueId) {
            return ResponseEntity.badRequest().body(Map.of("error", "hash 與 uniqueId 必須擇一提供"));
        }
        int removed = hasHash
                ? lockService.unlinkByHash(hash.trim().toLowerCase())
                : lockService.unlinkByUniqueId(uniqueId.trim());
        return ResponseEntity.ok(Map.of("removed", removed));
    }

    @GetMapping("/metrics")
    public MetricsSnapshot metrics() {
        return auditService.getMetricsSnapshot();
    }

    @GetMapping("/ranks")
    public List<RankDefinition> ranks() {
        return rankConfigProvider.getCurrent();
    }

    @PostMapping("/ranks/reload")
    public ResponseEntity<Map<String, Object>> reloadRanks() {
        boolean reloaded = rankConfigProvider.reload();
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("reloaded", reloaded);
        body.put("rankCount", rankConfigProvider.getCurrent().size());
        body.put("lastLoadedAt", rankConfigProvider.getLastLoadedAt());
        return reloaded
                ? ResponseEntity.ok(body)
                : ResponseEntity.unprocessableEntity().body(body);
    }

    @PostMapping("/role-reconciliation")
    public ReconciliationReport reconcile() {
        log.info("[管理] 手動觸發身分組校正");
        return reconciliationService.reconcile();
    }
}
