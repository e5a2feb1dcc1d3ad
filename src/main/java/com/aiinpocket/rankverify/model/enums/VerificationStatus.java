package com.aiinpocket.rankverify.model.enums;

/**
 * 驗證事件的結果狀態。
 */
public enum VerificationStatus {

    /** 等級比對成功，身分組已更新 */
    SUCCESS,

    /** 驗證失敗（非截圖、無法辨識、已被他人認領…） */
    FAILURE,

    /** 比對成功但身分組無法套用，需要管理員介入 */
    MANUAL_REVIEW
}
