package com.aiinpocket.rankverify.config;

import com.aiinpocket.rankverify.job.RankConfigReloadJob;
import com.aiinpocket.rankverify.job.RoleReconciliationJob;
import org.quartz.*;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class QuartzConfig {

    // RankConfigReloadJob：依 verification.ranks.reload-interval 重新讀取等級表（預設 30 秒）
    @Bean
    public JobDetail rankConfigReloadJobDetail() {
        return JobBuilder.newJob(RankConfigReloadJob.class)
                .withIdentity("rankConfigReloadJob", "verification")
                .storeDurably()
                .build();
    }

    @Bean
    public Trigger rankConfigReloadTrigger(JobDetail rankConfigReloadJobDetail, VerificationProperties props) {
        return TriggerBuilder.newTrigger()
                .forJob(rankConfigReloadJobDetail)
                .withIdentity("rankConfigReloadTrigger", "verification")
                .withSchedule(SimpleScheduleBuilder.simpleSchedule()
                        .withIntervalInMilliseconds(props.ranks().reloadInterval().toMillis())
                        .repeatForever())
                .build();
    }

    // RoleReconciliationJob：每個速率時間窗執行一次，額度用完即停，下個時間窗從游標續跑
    @Bean
    public JobDetail roleReconciliationJobDetail() {
        return JobBuilder.newJob(RoleReconciliationJob.class)
                .withIdentity("roleReconciliationJob", "verification")
                .storeDurably()
                .build();
    }

    @Bean
    public Trigger roleReconciliationTrigger(JobDetail roleReconciliationJobDetail, VerificationProperties props) {
        return TriggerBuilder.newTrigger()
                .forJob(roleReconciliationJobDetail)
                .withIdentity("roleReconciliationTrigger", "verification")
                .withSchedule(SimpleScheduleBuilder.simpleSchedule()
                        .withIntervalInMilliseconds(props.reconciliation().window().toMillis())
                        .repeatForever()
                        .withMisfireHandlingInstructionNextWithRemainingCount())
                .build();
    }
}
