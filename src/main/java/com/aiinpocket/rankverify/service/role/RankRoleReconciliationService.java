package com.aiinpocket.rankverify.service.role;

import com.aiinpocket.rankverify.config.VerificationProperties;
import com.aiinpocket.rankverify.model.dto.RankDefinition;
import com.aiinpocket.rankverify.model.dto.ReconciliationReport;
import com.aiinpocket.rankverify.model.entity.LinkedAccount;
import com.aiinpocket.rankverify.repository.LinkedAccountRepository;
import com.aiinpocket.rankverify.service.audit.VerificationMetricsService;
import com.aiinpocket.rankverify.service.matching.RankMatcher;
import com.aiinpocket.rankverify.service.rank.RankConfigProvider;
import io.github.bucket4j.Bucket;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 段位身分組校正。
 *
 * <p>依 id 順序走訪每位使用者的主要帳號，確認成員恰好持有該帳號段位對應的身分組；
 * 持有零個、多個或錯誤的段位身分組時重新套用。身分組切換中途中斷留下的狀態由此修復。
 *
 * <p>每檢查一位使用者消耗一個額度，額度用完即停止並記錄一次 rate limit，
 * 下一個時間窗從游標位置繼續；走完一輪後游標歸零。
 */
@Service
@Slf4j
public class RankRoleReconciliationService {

    private final LinkedAccountRepository accountRepository;
    private final RankRoleAssignmentService assignmentService;
    private final RankConfigProvider rankConfigProvider;
    private final RankMatcher rankMatcher;
    private final VerificationMetricsService metricsService;
    private final Bucket budget;
    private final int batchSize;

    private final AtomicLong cursor = new AtomicLong(0);

    @Autowired
    public RankRoleReconciliationService(LinkedAccountRepository accountRepository,
                                         RankRoleAssignmentService assignmentService,
                                         RankConfigProvider rankConfigProvider,
                                         RankMatcher rankMatcher,
                                         VerificationMetricsService metricsService,
                                         @Qualifier("reconciliationBucket") Bucket budget,
                                         VerificationProperties props) {
        this(accountRepository, assignmentService, rankConfigProvider, rankMatcher, metricsService,
                budget, props.reconciliation().batchSize());
    }

    public RankRoleReconciliationService(LinkedAccountRepository accountRepository,
                                         RankRoleAssignmentService assignmentService,
                                         RankConfigProvider rankConfigProvider,
                                         RankMatcher rankMatcher,
                                         VerificationMetricsService metricsService,
                                         Bucket budget,
                                         int batchSize) {
        this.accountRepository = accountRepository;
        this.assignmentService = assignmentService;
        this.rankConfigProvider = rankConfigProvider;
        this.rankMatcher = rankMatcher;
        this.metricsService = metricsService;
        this.budget = budget;
        this.batchSize = batchSize;
    }

    /**
     * 執行一次校正，直到走完一輪或額度用完。
     */
    public synchronized ReconciliationReport reconcile() {
        List<RankDefinition> ranks = rankConfigProvider.getCurrent();
        int examined = 0;
        int repaired = 0;
        int skipped = 0;
        int errors = 0;

        while (true) {
            List<LinkedAccount> batch = accountRepository.findByPrimaryAccountTrueAndIdGreaterThanOrderByIdAsc(
                    cursor.get(), PageRequest.of(0, batchSize));
            if (batch.isEmpty()) {
                if (examined > 0 || cursor.get() > 0) {
                    log.info("[身分組校正] 已完成一輪: examined={}, repaired={}", examined, repaired);
                }
                cursor.set(0);
                return new ReconciliationReport(examined, repaired, skipped, errors, false);
            }

            for (LinkedAccount account : batch) {
                if (!budget.tryConsume(1)) {
                    metricsService.recordRateLimitHit();
                    log.info("[身分組校正] 本時間窗額度已用完，下次從 id > {} 繼續", cursor.get());
                    return new ReconciliationReport(examined, repaired, skipped, errors, true);
                }
                examined++;
                cursor.set(account.getId());

                Optional<RankDefinition> rank = rankMatcher.findByName(account.getRankName(), ranks);
                if (rank.isEmpty()) {
                    log.debug("[身分組校正] 段位 {} 已不在段位表中，略過: identity={}",
                            account.getRankName(), account.getOwnerIdentity());
                    skipped++;
                    continue;
                }

                try {
                    if (repair(account.getOwnerIdentity(), rank.get())) {
                        repaired++;
                        metricsService.recordCleanup();
                    }
                } catch (RuntimeException e) {
                    errors++;
                    log.warn("[身分組校正] 修復失敗: identity={}, rank={}, {}",
                            account.getOwnerIdentity(), rank.get().displayName(), e.getMessage());
                }
            }
        }
    }

    private boolean repair(String identity, RankDefinition rank) {
        Set<String> held = assignmentService.heldRankRoles(identity);
        if (held.size() == 1 && held.contains(rank.token())) {
            return false;
        }
        log.info("[身分組校正] 身分組不一致，重新套用: identity={}, rank={}, held={}",
                identity, rank.displayName(), held);
        assignmentService.assign(identity, rank);
        return true;
    }

    long getCursor() {
        return cursor.get();
    }
}
