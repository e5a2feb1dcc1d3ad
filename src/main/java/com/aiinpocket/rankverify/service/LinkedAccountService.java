package com.aiinpocket.rankverify.service;

import com.aiinpocket.rankverify.model.entity.LinkedAccount;
import com.aiinpocket.rankverify.repository.LinkedAccountRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.PessimisticLockingFailureException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import tools.jackson.databind.ObjectMapper;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 綁定帳號服務。
 * 驗證成功後記錄使用者的遊戲帳號（等級、段位、驗證時間），並維護「主要帳號」。
 * 每位使用者的第一個帳號自動成為主要帳號；「最多一個主要帳號」由資料庫唯一約束保證。
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class LinkedAccountService {

    private final LinkedAccountRepository accountRepository;
    private final ObjectMapper objectMapper;

    /**
     * 依 (identity, uniqueId) 新增或更新帳號。
     *
     * <p>不包在外層交易中：新帳號寫入時若撞到「每人一個主要帳號」的唯一約束（同一使用者同時
     * 提交兩個新帳號），改以一般帳號重新寫入，需要全新的交易。
     *
     * @param metadata 附加資訊（可為 null），以 JSON 存放
     */
    public LinkedAccount upsertAccount(String identity, String uniqueId, int level, String rankName,
                                       Map<String, Object> metadata) {
        String metadataJson = metadata != null ? objectMapper.writeValueAsString(metadata) : null;
        Instant now = Instant.now();

        Optional<LinkedAccount> existing = accountRepository.findByOwnerIdentityAndUniqueId(identity, uniqueId);
        if (existing.isPresent()) {
            return save(update(existing.get(), level, rankName, now, metadataJson));
        }

        boolean primary = !accountRepository.existsByOwnerIdentity(identity);
        try {
            return save(LinkedAccount.builder()
                    .ownerIdentity(identity)
                    .uniqueId(uniqueId)
                    .level(level)
                    .rankName(rankName)
                    .verifiedAt(now)
                    .metadata(metadataJson)
                    .primaryAccount(primary)
                    .build());
        } catch (DataIntegrityViolationException | PessimisticLockingFailureException e) {
            log.info("[綁定帳號] 並行寫入衝突，重新讀取後再寫入: identity={}, uniqueId={}", identity, uniqueId);
            LinkedAccount retry = accountRepository.findByOwnerIdentityAndUniqueId(identity, uniqueId)
                    .map(found -> update(found, level, rankName, now, metadataJson))
                    .orElseGet(() -> LinkedAccount.builder()
                            .ownerIdentity(identity)
                            .uniqueId(uniqueId)
                            .level(level)
                            .rankName(rankName)
                            .verifiedAt(now)
                            .metadata(metadataJson)
                            .primaryAccount(false)
                            .build());
            return save(retry);
        }
    }

    private static LinkedAccount update(LinkedAccount account, int level, String rankName, Instant now,
                                        String metadataJson) {
        account.setLevel(level);
        account.setRankName(rankName);
        account.setVerifiedAt(now);
        account.setMetadata(metadataJson);
        return account;
    }

    private LinkedAccount save(LinkedAccount account) {
        LinkedAccount saved = accountRepository.saveAndFlush(account);
        log.info("[綁定帳號] 已更新: identity={}, uniqueId={}, rank={}, level={}, primary={}",
                saved.getOwnerIdentity(), saved.getUniqueId(), saved.getRankName(), saved.getLevel(),
                saved.isPrimaryAccount());
        return saved;
    }

    @Transactional(readOnly = true)
    public Optional<LinkedAccount> findPrimary(String identity) {
        return accountRepository.findFirstByOwnerIdentityAndPrimaryAccountTrue(identity);
    }

    /** 使用者的所有帳號（主要帳號在前） */
    @Transactional(readOnly = true)
    public List<LinkedAccount> listAccounts(String identity) {
        return accountRepository.findByOwnerIdentityOrderByPrimaryAccountDescLevelDesc(identity);
    }

    /**
     * 切換主要帳號。
     *
     * @throws IllegalArgumentException 帳號不存在或不屬於該使用者
     */
    @Transactional
    public LinkedAccount setPrimary(String identity, Long accountId) {
        LinkedAccount account = accountRepository.findByIdAndOwnerIdentity(accountId, identity)
                .orElseThrow(() -> new IllegalArgumentException("找不到此帳號"));
        if (account.isPrimaryAccount()) {
            return account;
        }
        accountRepository.clearPrimary(identity);
        account.setPrimaryAccount(true);
        log.info("[綁定帳號] 切換主要帳號: identity={}, accountId={}", identity, accountId);
        return accountRepository.save(account);
    }
}
