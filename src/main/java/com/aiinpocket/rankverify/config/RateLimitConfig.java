package com.aiinpocket.rankverify.config;

import io.github.bucket4j.Bandwidth;
import io.github.bucket4j.Bucket;
import io.github.bucket4j.Refill;
import io.github.bucket4j.TimeMeter;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * 外部 API 額度配置（Bucket4j）。
 *
 * <p>{@code reconciliationBucket}：身分組校正每個時間窗最多呼叫 Discord API 的次數。
 * 額度在時間窗結束時一次補滿，而不是平滑補充，行為等同固定時間窗計數。
 */
@Configuration
public class RateLimitConfig {

    @Bean
    public Bucket reconciliationBucket(VerificationProperties props) {
        VerificationProperties.Reconciliation reconciliation = props.reconciliation();
        return fixedWindow(reconciliation.budgetPerWindow(), reconciliation.window(), TimeMeter.SYSTEM_MILLISECONDS);
    }

    /**
     * @param timeMeter 時間來源，測試時可替換
     */
    public static Bucket fixedWindow(int permits, Duration window, TimeMeter timeMeter) {
        Bandwidth limit = Bandwidth.classic(permits, Refill.intervally(permits, window));
        return Bucket.builder()
                .addLimit(limit)
                .withCustomTimePrecision(timeMeter)
                .build();
    }
}
