package com.aiinpocket.rankverify.config;

import com.github.benmanes.caffeine.cache.Caffeine;
import org.springframework.cache.CacheManager;
import org.springframework.cache.annotation.EnableCaching;
import org.springframework.cache.caffeine.CaffeineCacheManager;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * 快取配置。
 * 使用 Caffeine 本地快取，存放影像辨識結果（以截圖 SHA-256 為 key）。
 * 這是磁碟快取前面的第一層，命中時不會呼叫外部辨識服務。
 */
@Configuration
@EnableCaching
public class CacheConfig {

    public static final String PROFILE_EXTRACTION_CACHE = "profileExtraction";

    @Bean
    public CacheManager cacheManager(VerificationProperties props) {
        VerificationProperties.Vision vision = props.vision();
        CaffeineCacheManager manager = new CaffeineCacheManager(PROFILE_EXTRACTION_CACHE);
        manager.setCaffeine(Caffeine.newBuilder()
                .expireAfterWrite(vision.memoryCacheTtl())
                .maximumSize(vision.memoryCacheSize()));
        return manager;
    }
}
