package com.aiinpocket.rankverify.service.audit;

import com.aiinpocket.rankverify.model.dto.EvidenceRecord;

/**
 * 將驗證證據送到管理員可檢視的頻道。
 * 實作失敗時應記錄日誌並回傳，不影響驗證結果。
 */
public interface EvidencePublisher {

    void publish(EvidenceRecord record);
}
