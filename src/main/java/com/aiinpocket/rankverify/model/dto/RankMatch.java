package com.aiinpocket.rankverify.model.dto;

/**
 * 等級比對結果。
 *
 * @param rank          比對到的段位
 * @param confidence    0~1 的信心分數
 * @param levelDetected 偵測到的等級；只有落在 {@code rank} 區間內才會保留，否則為 null
 */
public record RankMatch(
        RankDefinition rank,
        double confidence,
        Integer levelDetected
) {
    public String rankName() {
        return rank.displayName();
    }
}
