package com.aiinpocket.rankverify.job;

import com.aiinpocket.rankverify.service.rank.RankConfigProvider;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.quartz.JobExecutionContext;
import org.springframework.scheduling.quartz.QuartzJobBean;
import org.springframework.stereotype.Component;

/**
 * 定時重新載入段位表（預設每 30 秒）。
 * 每個 Pod 各自持有一份段位表，因此不需要分散式鎖。
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class RankConfigReloadJob extends QuartzJobBean {

    private final RankConfigProvider rankConfigProvider;

    @Override
    protected void executeInternal(JobExecutionContext context) {
        log.debug("RankConfigReloadJob: 重新載入段位表");
        rankConfigProvider.reload();
    }
}
