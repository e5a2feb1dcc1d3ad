package com.aiinpocket.rankverify.controller;

import com.aiinpocket.rankverify.model.dto.VerificationOutcome;
import com.aiinpocket.rankverify.model.dto.VerificationRequest;
import com.aiinpocket.rankverify.model.dto.VerificationResponse;
import com.aiinpocket.rankverify.service.RankVerificationService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * 截圖驗證 REST API。
 * 由聊天平台的訊息收集端呼叫，傳入截圖網址與使用者識別碼。
 * 驗證失敗也回傳 200，結果由 status 與 failureReason 表示。
 */
@RestController
@RequestMapping("/api/verifications")
@RequiredArgsConstructor
public class VerificationController {

    private final RankVerificationService verificationService;

    @PostMapping
    public VerificationResponse verify(@Valid @RequestBody VerificationRequest request) {
        VerificationOutcome outcome = verificationService.processAndVerify(
                request.toImageSource(), request.identity());
        return VerificationResponse.from(outcome);
    }
}
