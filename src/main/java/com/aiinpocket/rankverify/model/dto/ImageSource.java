package com.aiinpocket.rankverify.model.dto;

/**
 * 上游訊息收集端提供的圖片參考。
 *
 * @param url                 圖片下載網址
 * @param declaredSize        上游宣告的檔案大小（可為 null，僅供預先檢查，不可信任）
 * @param declaredContentType 上游宣告的 Content-Type（可為 null）
 * @param filename            原始檔名（可為 null）
 */
public record ImageSource(
        String url,
        Long declaredSize,
        String declaredContentType,
        String filename
) {
    public static ImageSource of(String url) {
        return new ImageSource(url, null, null, null);
    }
}
