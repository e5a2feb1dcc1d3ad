package com.aiinpocket.rankverify.service.extraction;

/**
 * 外部影像辨識服務。
 * 實作只負責送出圖片並取回模型的原始文字回應，解析交給 {@link ProfileResponseParser}。
 */
public interface VisionExtractionClient {

    /**
     * @param image    圖片位元組
     * @param mimeType 圖片 MIME 類型
     * @return 模型回傳的文字內容；回應為空時回傳 null
     */
    String extract(byte[] image, String mimeType);
}
