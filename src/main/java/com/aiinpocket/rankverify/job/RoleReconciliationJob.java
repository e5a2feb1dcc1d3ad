package com.aiinpocket.rankverify.job;

import com.aiinpocket.rankverify.config.VerificationProperties;
import com.aiinpocket.rankverify.service.DistributedLockService;
import com.aiinpocket.rankverify.service.role.RankRoleReconciliationService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.quartz.JobExecutionContext;
import org.springframework.scheduling.quartz.QuartzJobBean;
import org.springframework.stereotype.Component;

/**
 * 段位身分組校正任務（每個速率時間窗一次）。
 * 以 Advisory Lock 保證同一時間只有一個 Pod 呼叫 Discord API。
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class RoleReconciliationJob extends QuartzJobBean {

    private final RankRoleReconciliationService reconciliationService;
    private final DistributedLockService lockService;
    private final VerificationProperties props;

    /** Advisory lock ID: RoleReconciliationJob 專用 */
    private static final long ROLE_RECONCILIATION_LOCK_ID = 3_000_001L;

    @Override
    protected void executeInternal(JobExecutionContext context) {
        if (!props.reconciliation().enabled()) {
            return;
        }
        lockService.callWithLock(ROLE_RECONCILIATION_LOCK_ID, "RoleReconciliationJob", reconciliationService::reconcile)
                .filter(report -> report.repaired() > 0 || report.errors() > 0 || report.rateLimited())
                .ifPresent(report -> log.info(
                        "[身分組校正] examined={}, repaired={}, skipped={}, errors={}, rateLimited={}",
                        report.examined(), report.repaired(), report.skipped(), report.errors(), report.rateLimited()));
    }
}
