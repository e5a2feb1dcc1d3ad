package com.aiinpocket.rankverify.model.enums;

/**
 * 回傳給呼叫端的失敗原因。
 * 每個原因附帶一段可直接顯示給使用者的訊息，不含任何實作細節。
 */
public enum FailureReason {

    NOT_PROFILE_SCREENSHOT("格式不正確，請上傳遊戲「個人檔案」畫面的截圖（需顯示等級、段位與統計資料）"),
    IMAGE_TOO_LARGE("圖片檔案過大，請上傳較小的截圖"),
    IMAGE_UNAVAILABLE("無法取得圖片，請稍後重新上傳"),
    RANK_NOT_RECOGNIZED("無法清楚辨識截圖中的段位，請上傳更清晰的個人檔案截圖"),
    ALREADY_CLAIMED("此截圖或遊戲 ID 已綁定其他使用者"),
    ROLE_CONFIGURATION_ERROR("段位身分組設定有誤，已通知管理員處理"),
    ROLE_PERMISSION_ERROR("機器人缺少管理身分組的權限，已通知管理員處理"),
    INTERNAL_ERROR("驗證時發生內部錯誤，請稍後重試");

    private final String userMessage;

    FailureReason(String userMessage) {
        this.userMessage = userMessage;
    }

    public String userMessage() {
        return userMessage;
    }
}
