package com.aiinpocket.rankverify.model.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * 一個段位的定義，來自 config/ranks.json。
 *
 * @param token       對應的外部身分組 ID（Discord role id）
 * @param displayName 段位顯示名稱
 * @param levelMin    等級下限（含）
 * @param levelMax    等級上限（含）
 */
public record RankDefinition(
        @JsonProperty("token") String token,
        @JsonProperty("display_name") String displayName,
        @JsonProperty("level_min") int levelMin,
        @JsonProperty("level_max") int levelMax
) {
    public boolean containsLevel(int level) {
        return level >= levelMin && level <= levelMax;
    }
}
