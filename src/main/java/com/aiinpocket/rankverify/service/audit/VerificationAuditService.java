package com.aiinpocket.rankverify.service.audit;

import com.aiinpocket.rankverify.model.dto.EvidenceRecord;
import com.aiinpocket.rankverify.model.dto.MetricsSnapshot;
import com.aiinpocket.rankverify.model.dto.VerificationAuditRequest;
import com.aiinpocket.rankverify.model.entity.VerificationEvent;
import com.aiinpocket.rankverify.repository.VerificationEventRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.stereotype.Service;
import tools.jackson.databind.ObjectMapper;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 驗證稽核軌跡。
 *
 * <p>每次驗證（不論成功或失敗）都會：
 * <ol>
 *   <li>寫入一筆不可修改的 VerificationEvent</li>
 *   <li>更新統計計數器</li>
 *   <li>在 auditExecutor 上非同步發送證據到管理頻道</li>
 * </ol>
 * 任何一步失敗都只記錄日誌，不影響回傳給使用者的結果。
 */
@Service
@Slf4j
public class VerificationAuditService {

    private final VerificationEventRepository eventRepository;
    private final VerificationMetricsService metricsService;
    private final EvidencePublisher evidencePublisher;
    private final TaskExecutor auditExecutor;
    private final ObjectMapper objectMapper;

    public VerificationAuditService(VerificationEventRepository eventRepository,
                                    VerificationMetricsService metricsService,
                                    EvidencePublisher evidencePublisher,
                                    @Qualifier("auditExecutor") TaskExecutor auditExecutor,
                                    ObjectMapper objectMapper) {
        this.eventRepository = eventRepository;
        this.metricsService = metricsService;
        this.evidencePublisher = evidencePublisher;
        this.auditExecutor = auditExecutor;
        this.objectMapper = objectMapper;
    }

    public void record(VerificationAuditRequest request) {
        Instant now = Instant.now();

        try {
            eventRepository.save(VerificationEvent.builder()
                    .ownerIdentity(request.identity())
                    .status(request.status())
                    .confidence(request.confidence())
                    .uniqueId(request.uniqueId())
                    .screenshotHash(request.screenshotHash())
                    .reason(truncate(request.reason(), 500))
                    .metadata(toMetadataJson(request))
                    .createdAt(now)
                    .build());
        } catch (Exception e) {
            log.error("[稽核] 驗證事件寫入失敗: identity={}, status={}", request.identity(), request.status(), e);
        }

        try {
            metricsService.recordVerification(request.status(), request.confidence());
        } catch (Exception e) {
            log.error("[稽核] 統計更新失敗: identity={}", request.identity(), e);
        }

        EvidenceRecord record = EvidenceRecord.from(request, now);
        try {
            auditExecutor.execute(() -> evidencePublisher.publish(record));
        } catch (Exception e) {
            log.warn("[稽核] 證據發送排程失敗: identity={}, {}", request.identity(), e.getMessage());
        }
    }

    public MetricsSnapshot getMetricsSnapshot() {
        return metricsService.getSnapshot();
    }

    private String toMetadataJson(VerificationAuditRequest request) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        if (request.metadata() != null) {
            metadata.putAll(request.metadata());
        }
        if (request.rankName() != null) {
            metadata.put("rank_name", request.rankName());
        }
        if (request.level() != null) {
            metadata.put("level", request.level());
        }
        if (request.processingTimeMs() != null) {
            metadata.put("processing_time_ms", request.processingTimeMs());
        }
        return metadata.isEmpty() ? null : objectMapper.writeValueAsString(metadata);
    }

    private static String truncate(String value, int max) {
        return value != null && value.length() > max ? value.substring(0, max) : value;
    }
}
