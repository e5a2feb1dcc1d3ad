package com.aiinpocket.rankverify.model.dto;

import com.aiinpocket.rankverify.model.enums.DownloadFailure;

/**
 * 圖片下載結果。成功時帶有完整位元組與 SHA-256，失敗時只帶原因。
 *
 * @param data        圖片位元組（失敗時為 null）
 * @param sha256      內容雜湊（小寫十六進位）
 * @param filename    正規化後的檔名
 * @param contentType 解析後的 Content-Type
 * @param failure     失敗原因（成功時為 null）
 * @param detail      失敗細節，僅供日誌使用
 */
public record ImageIngestResult(
        byte[] data,
        String sha256,
        String filename,
        String contentType,
        DownloadFailure failure,
        String detail
) {
    public static ImageIngestResult success(byte[] data, String sha256, String filename, String contentType) {
        return new ImageIngestResult(data, sha256, filename, contentType, null, null);
    }

    public static ImageIngestResult failed(DownloadFailure failure, String detail) {
        return new ImageIngestResult(null, null, null, null, failure, detail);
    }

    public boolean isSuccess() {
        return failure == null;
    }

    public EvidenceAttachment toAttachment() {
        return isSuccess() ? new EvidenceAttachment(data, filename, contentType) : null;
    }
}
