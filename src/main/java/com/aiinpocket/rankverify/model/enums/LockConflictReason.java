package com.aiinpocket.rankverify.model.enums;

/**
 * 截圖鎖衝突的種類。
 */
public enum LockConflictReason {

    /** 相同內容的截圖已綁定其他使用者 */
    HASH_CONFLICT,

    /** 遊戲內唯一 ID 已綁定其他使用者 */
    UNIQUE_ID_CONFLICT
}
