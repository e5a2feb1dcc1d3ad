package com.aiinpocket.rankverify.service.extraction;

import com.aiinpocket.rankverify.config.VerificationProperties;
import com.aiinpocket.rankverify.model.dto.ExtractedProfile;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * 個人檔案辨識服務。
 *
 * <p>處理順序：
 * <ol>
 *   <li>以截圖 SHA-256 查兩層快取，命中則不呼叫外部服務</li>
 *   <li>mock 模式回傳固定資料（同樣寫入快取）</li>
 *   <li>呼叫外部辨識服務並解析回應，結果寫入兩層快取</li>
 * </ol>
 * 任何錯誤都回傳全 UNKNOWN 的結果，不向外拋出。
 */
@Service
@Slf4j
public class ProfileExtractionService {

    static final ExtractedProfile MOCK_PROFILE = new ExtractedProfile(618, "Galactic Overlord", "182-625-474-6");

    private final ProfileCache cache;
    private final VisionExtractionClient client;
    private final ProfileResponseParser parser;
    private final boolean mockMode;

    public ProfileExtractionService(ProfileCache cache,
                                    VisionExtractionClient client,
                                    ProfileResponseParser parser,
                                    VerificationProperties props) {
        this.cache = cache;
        this.client = client;
        this.parser = parser;
        this.mockMode = props.vision().mockMode();
        if (mockMode) {
            log.warn("[影像辨識] mock 模式已啟用，不會呼叫外部辨識服務");
        }
    }

    /**
     * @param image       截圖位元組
     * @param contentHash 截圖 SHA-256（由下載服務計算）
     * @param mimeType    截圖 MIME 類型
     */
    public ExtractedProfile extract(byte[] image, String contentHash, String mimeType) {
        try {
            Optional<ExtractedProfile> cached = cache.get(contentHash);
            if (cached.isPresent()) {
                log.info("[影像辨識] 使用快取結果（不呼叫辨識服務）: hash={}",
                        TieredProfileCache.abbreviate(contentHash));
                return cached.get();
            }

            if (mockMode) {
                cache.put(contentHash, MOCK_PROFILE);
                return MOCK_PROFILE;
            }

            String content = client.extract(image, mimeType);
            ExtractedProfile profile = parser.parse(content);
            if (content != null) {
                cache.put(contentHash, profile);
            }
            log.info("[影像辨識] 辨識完成: hash={}, level={}, rank={}, uniqueId={}",
                    TieredProfileCache.abbreviate(contentHash),
                    profile.level(), profile.rankName(), profile.uniqueId());
            return profile;
        } catch (Exception e) {
            log.error("[影像辨識] 辨識失敗，視為全部 UNKNOWN: hash={}",
                    TieredProfileCache.abbreviate(contentHash), e);
            return ExtractedProfile.unknown();
        }
    }
}
