package com.aiinpocket.rankverify.model.dto;

/**
 * 一次身分組校正批次的結果。
 *
 * @param examined     檢查過的使用者數
 * @param repaired     重新套用身分組的使用者數
 * @param skipped      段位已不在等級表中而略過的數量
 * @param errors       失敗數
 * @param rateLimited  是否因額度用完而提前停止
 */
public record ReconciliationReport(
        int examined,
        int repaired,
        int skipped,
        int errors,
        boolean rateLimited
) {}
