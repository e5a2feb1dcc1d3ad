package com.aiinpocket.rankverify.model.dto;

import com.fasterxml.jackson.annotation.JsonIgnore;

/**
 * 影像辨識服務從個人檔案截圖取出的欄位。
 * 每個欄位為 null 代表 UNKNOWN（辨識不到或無法信任）。
 *
 * @param level    遊戲等級（正整數）
 * @param rankName 段位名稱（原始文字，尚未比對）
 * @param uniqueId 遊戲內唯一 ID（以連字號分隔的數字）
 */
public record ExtractedProfile(
        Integer level,
        String rankName,
        String uniqueId
) {
    public static final String UNKNOWN = "UNKNOWN";

    private static final ExtractedProfile ALL_UNKNOWN = new ExtractedProfile(null, null, null);

    public static ExtractedProfile unknown() {
        return ALL_UNKNOWN;
    }

    public boolean hasLevel() {
        return level != null;
    }

    public boolean hasRankName() {
        return rankName != null;
    }

    public boolean hasUniqueId() {
        return uniqueId != null;
    }

    @JsonIgnore
    public boolean isAllUnknown() {
        return !hasLevel() && !hasRankName() && !hasUniqueId();
    }
}
