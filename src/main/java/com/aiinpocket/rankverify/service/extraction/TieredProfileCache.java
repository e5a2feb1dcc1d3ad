package com.aiinpocket.rankverify.service.extraction;

import com.aiinpocket.rankverify.model.dto.ExtractedProfile;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Primary;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * 兩層快取：先查記憶體，再查磁碟；磁碟命中時回填記憶體。
 * 寫入時兩層都寫。
 */
@Component
@Primary
@RequiredArgsConstructor
@Slf4j
public class TieredProfileCache implements ProfileCache {

    private final SpringCacheProfileCache memory;
    private final DiskProfileCache disk;

    @Override
    public Optional<ExtractedProfile> get(String contentHash) {
        Optional<ExtractedProfile> hit = memory.get(contentHash);
        if (hit.isPresent()) {
            log.debug("[辨識快取] 記憶體命中: {}", abbreviate(contentHash));
            return hit;
        }
        hit = disk.get(contentHash);
        if (hit.isPresent()) {
            log.debug("[辨識快取] 磁碟命中，回填記憶體: {}", abbreviate(contentHash));
            memory.put(contentHash, hit.get());
        }
        return hit;
    }

    @Override
    public void put(String contentHash, ExtractedProfile profile) {
        memory.put(contentHash, profile);
        disk.put(contentHash, profile);
    }

    static String abbreviate(String hash) {
        return hash != null && hash.length() > 16 ? hash.substring(0, 16) : hash;
    }
}
