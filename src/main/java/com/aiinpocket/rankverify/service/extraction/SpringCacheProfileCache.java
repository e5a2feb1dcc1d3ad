package com.aiinpocket.rankverify.service.extraction;

import com.aiinpocket.rankverify.config.CacheConfig;
import com.aiinpocket.rankverify.model.dto.ExtractedProfile;
import org.springframework.cache.Cache;
import org.springframework.cache.CacheManager;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * 記憶體快取層（Caffeine，透過 Spring CacheManager 管理容量與存活時間）。
 */
@Component
public class SpringCacheProfileCache implements ProfileCache {

    private final Cache cache;

    public SpringCacheProfileCache(CacheManager cacheManager) {
        Cache resolved = cacheManager.getCache(CacheConfig.PROFILE_EXTRACTION_CACHE);
        if (resolved == null) {
            throw new IllegalStateException("找不到快取: " + CacheConfig.PROFILE_EXTRACTION_CACHE);
        }
        this.cache = resolved;
    }

    @Override
    public Optional<ExtractedProfile> get(String contentHash) {
        return Optional.ofNullable(cache.get(contentHash, ExtractedProfile.class));
    }

    @Override
    public void put(String contentHash, ExtractedProfile profile) {
        cache.put(contentHash, profile);
    }
}
