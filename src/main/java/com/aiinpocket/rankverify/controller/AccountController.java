package com.aiinpocket.rankverify.controller;

import com.aiinpocket.rankverify.model.dto.LinkedAccountView;
import com.aiinpocket.rankverify.service.LinkedAccountService;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * 綁定帳號 REST API。
 */
@RestController
@RequestMapping("/api/accounts/{identity}")
@RequiredArgsConstructor
public class AccountController {

    private final LinkedAccountService accountService;

    @GetMapping
    public List<LinkedAccountView> list(@PathVariable String identity) {
        return accountService.listAccounts(identity).stream()
                .map(LinkedAccountView::from)
                .toList();
    }

    /** 切換主要帳號 */
    @PutMapping("/primary/{accountId}")
    public LinkedAccountView setPrimary(@PathVariable String identity, @PathVariable Long accountId) {
        return LinkedAccountView.from(accountService.setPrimary(identity, accountId));
    }
}
