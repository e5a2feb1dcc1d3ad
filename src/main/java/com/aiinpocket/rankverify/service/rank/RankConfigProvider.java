package com.aiinpocket.rankverify.service.rank;

import com.aiinpocket.rankverify.model.dto.RankDefinition;

import java.time.Instant;
import java.util.List;
import java.util.Set;

/**
 * 段位設定來源。
 * 讀取端永遠拿到完整的一份設定（整份替換），不會看到載入到一半的狀態。
 */
public interface RankConfigProvider {

    /** 目前生效的段位表（不可修改） */
    List<RankDefinition> getCurrent();

    /**
     * 重新載入設定。失敗時保留上一份有效設定。
     *
     * @return true 如果載入成功並已替換
     */
    boolean reload();

    /** 所有段位對應的身分組 token */
    Set<String> getRankTokens();

    /** 最近一次成功載入的時間 */
    Instant getLastLoadedAt();
}
