package com.aiinpocket.rankverify.model.dto;

/**
 * 附在證據訊息上的截圖。
 */
public record EvidenceAttachment(
        byte[] data,
        String filename,
        String contentType
) {}
