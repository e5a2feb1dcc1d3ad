package com.aiinpocket.rankverify.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * 非同步任務配置。
 *
 * <p>{@code auditExecutor} 負責把證據訊息送到 Discord 稽核頻道。
 * 與驗證主流程隔離，即使 Discord API 回應緩慢，也不會延遲回傳給使用者的結果。
 * 核心 2 線程 / 最大 4 線程，隊列容量 100；滿載時由呼叫端執行，避免證據遺失。
 */
@Configuration
public class AsyncConfig {

    @Bean
    public TaskExecutor auditExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(2);
        executor.setMaxPoolSize(4);
        executor.setQueueCapacity(100);
        executor.setThreadNamePrefix("audit-");
        executor.setRejectedExecutionHandler(new java.util.concurrent.ThreadPoolExecutor.CallerRunsPolicy());
        executor.initialize();
        return executor;
    }
}
