package com.aiinpocket.rankverify.model.enums;

/**
 * 圖片下載失敗的原因。
 * 下載器一律以此列舉回報失敗，不拋出一般例外。
 */
public enum DownloadFailure {

    /** 超過整體下載時限 */
    TIMEOUT,

    /** 宣告大小、Content-Length 或實際串流位元組超過上限 */
    OVERSIZE,

    /** 副檔名與 Content-Type 都不是圖片 */
    NOT_IMAGE,

    /** 連線失敗或 HTTP 狀態碼非 2xx */
    NETWORK_ERROR
}
