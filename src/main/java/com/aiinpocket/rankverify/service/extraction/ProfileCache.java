package com.aiinpocket.rankverify.service.extraction;

import com.aiinpocket.rankverify.model.dto.ExtractedProfile;

import java.util.Optional;

/**
 * 辨識結果快取，key 為截圖內容的 SHA-256。
 */
public interface ProfileCache {

    Optional<ExtractedProfile> get(String contentHash);

    void put(String contentHash, ExtractedProfile profile);
}
