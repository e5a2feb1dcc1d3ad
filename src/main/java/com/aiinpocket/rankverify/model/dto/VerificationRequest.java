package com.aiinpocket.rankverify.model.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.PositiveOrZero;

/**
 * POST /api/verifications 的請求內容。
 */
public record VerificationRequest(
        @NotBlank String identity,
        @NotBlank String url,
        @PositiveOrZero Long size,
        String contentType,
        String filename
) {
    public ImageSource toImageSource() {
        return new ImageSource(url, size, contentType, filename);
    }
}
