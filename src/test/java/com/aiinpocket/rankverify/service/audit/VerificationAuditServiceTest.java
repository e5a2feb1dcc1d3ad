package com.aiinpocket.rankverify.service.audit;

import com.aiinpocket.rankverify.model.dto.EvidenceAttachment;
import com.aiinpocket.rankverify.model.dto.EvidenceRecord;
import com.aiinpocket.rankverify.model.dto.VerificationAuditRequest;
import com.aiinpocket.rankverify.model.entity.VerificationEvent;
import com.aiinpocket.rankverify.model.enums.VerificationStatus;
import com.aiinpocket.rankverify.repository.VerificationEventRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.core.task.TaskExecutor;
import tools.jackson.databind.json.JsonMapper;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("VerificationAuditService 稽核軌跡")
class VerificationAuditServiceTest {

    @Mock
    private VerificationEventRepository eventRepository;

    @Mock
    private VerificationMetricsService metricsService;

    @Mock
    private EvidencePublisher evidencePublisher;

    private VerificationAuditService service;

    @BeforeEach
    void setUp() {
        TaskExecutor executor = Runnable::run;
        service = new VerificationAuditService(eventRepository, metricsService, evidencePublisher,
                executor, JsonMapper.builder().build());
    }

    private static VerificationAuditRequest successRequest() {
        return VerificationAuditRequest.builder()
                .identity("user-1")
                .status(VerificationStatus.SUCCESS)
                .confidence(0.95)
                .uniqueId("182-625-474-6")
                .screenshotHash("a".repeat(64))
                .rankName("Galactic Overlord")
                .level(618)
                .processingTimeMs(1200L)
                .attachment(new EvidenceAttachment(new byte[]{1}, "profile.png", "image/png"))
                .metadata(Map.of("rank_min", 600))
                .build();
    }

    @Test
    @DisplayName("寫入事件、更新統計並發送證據")
    void recordsEverything() {
        // When
        service.record(successRequest());

        // Then
        ArgumentCaptor<VerificationEvent> event = ArgumentCaptor.forClass(VerificationEvent.class);
        verify(eventRepository).save(event.capture());
        assertThat(event.getValue().getOwnerIdentity()).isEqualTo("user-1");
        assertThat(event.getValue().getStatus()).isEqualTo(VerificationStatus.SUCCESS);
        assertThat(event.getValue().getMetadata())
                .contains("\"rank_min\":600", "\"rank_name\":\"Galactic Overlord\"", "\"level\":618");
        assertThat(event.getValue().getCreatedAt()).isNotNull();

        verify(metricsService).recordVerification(VerificationStatus.SUCCESS, 0.95);

        ArgumentCaptor<EvidenceRecord> evidence = ArgumentCaptor.forClass(EvidenceRecord.class);
        verify(evidencePublisher).publish(evidence.capture());
        assertThat(evidence.getValue().displayUniqueId()).isEqualTo("182-625-474-6");
        assertThat(evidence.getValue().attachment().filename()).isEqualTo("profile.png");
    }

    @Test
    @DisplayName("資料庫寫入失敗不影響統計與證據發送")
    void databaseFailureIsContained() {
        when(eventRepository.save(any())).thenThrow(new IllegalStateException("db down"));

        assertThatCode(() -> service.record(successRequest())).doesNotThrowAnyException();

        verify(metricsService).recordVerification(VerificationStatus.SUCCESS, 0.95);
        verify(evidencePublisher).publish(any());
    }

    @Test
    @DisplayName("證據排程被拒時不向外拋出")
    void executorRejection() {
        TaskExecutor rejecting = task -> {
            throw new org.springframework.core.task.TaskRejectedException("full");
        };
        VerificationAuditService rejectingService = new VerificationAuditService(
                eventRepository, metricsService, evidencePublisher, rejecting, JsonMapper.builder().build());

        assertThatCode(() -> rejectingService.record(successRequest())).doesNotThrowAnyException();
        verifyNoInteractions(evidencePublisher);
    }

    @Test
    @DisplayName("過長的原因截斷為 500 字")
    void truncatesReason() {
        service.record(VerificationAuditRequest.builder()
                .identity("user-1")
                .status(VerificationStatus.FAILURE)
                .reason("x".repeat(800))
                .build());

        ArgumentCaptor<VerificationEvent> event = ArgumentCaptor.forClass(VerificationEvent.class);
        verify(eventRepository).save(event.capture());
        assertThat(event.getValue().getReason()).hasSize(500);
        assertThat(event.getValue().getMetadata()).isNull();
        verify(metricsService).recordVerification(VerificationStatus.FAILURE, null);
    }
}
