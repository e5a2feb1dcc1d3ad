package com.aiinpocket.rankverify.service.role;

import com.aiinpocket.rankverify.exception.RoleConfigException;
import com.aiinpocket.rankverify.model.dto.RankDefinition;
import com.aiinpocket.rankverify.service.rank.RankConfigProvider;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.HashSet;
import java.util.Set;

/**
 * 段位身分組切換。
 *
 * <p>切換流程：取出成員持有的段位身分組 → 全部移除 → 確認目標身分組存在 → 新增。
 * 完成後成員恰好持有一個段位身分組。目標身分組不存在時拋出 {@link RoleConfigException}，
 * 此時成員沒有任何段位身分組，等管理員修正設定後重新驗證即可恢復。
 *
 * <p>移除與新增之間若中斷，下一次驗證成功或身分組校正批次都會修復。
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RankRoleAssignmentService {

    private final RoleManagementGateway gateway;
    private final RankConfigProvider rankConfigProvider;

    /**
     * 將成員的段位身分組切換為 {@code rank}。
     *
     * @return true 如果這次呼叫新增了目標身分組；成員原本就持有時為 false
     */
    public boolean assign(String identity, RankDefinition rank) {
        Set<String> held = heldRankRoles(identity);
        boolean alreadyHeld = held.contains(rank.token());

        for (String token : held) {
            if (!token.equals(rank.token())) {
                gateway.removeRole(identity, token, "更換段位身分組");
            }
        }

        if (!gateway.roleExists(rank.token())) {
            log.error("[身分組] 段位 {} 對應的身分組 {} 不存在於伺服器", rank.displayName(), rank.token());
            throw new RoleConfigException("段位身分組不存在: " + rank.displayName() + " (" + rank.token() + ")");
        }

        if (alreadyHeld) {
            log.debug("[身分組] 成員已持有段位身分組: identity={}, rank={}", identity, rank.displayName());
            return false;
        }

        gateway.addRole(identity, rank.token(), "段位驗證: " + rank.displayName());
        log.info("[身分組] 段位切換完成: identity={}, rank={}, removed={}",
                identity, rank.displayName(), held.size());
        return true;
    }

    /** 移除單一段位身分組；成員沒有時不做事 */
    public void remove(String identity, String token) {
        if (gateway.listRoles(identity).contains(token)) {
            gateway.removeRole(identity, token, "移除段位身分組");
        }
    }

    /**
     * 移除成員所有段位身分組。
     *
     * @return 移除的數量
     */
    public int removeAll(String identity) {
        Set<String> held = heldRankRoles(identity);
        for (String token : held) {
            gateway.removeRole(identity, token, "移除所有段位身分組");
        }
        if (!held.isEmpty()) {
            log.info("[身分組] 已移除 {} 個段位身分組: identity={}", held.size(), identity);
        }
        return held.size();
    }

    /** 成員持有的身分組中，屬於目前段位表的部分 */
    public Set<String> heldRankRoles(String identity) {
        Set<String> held = new HashSet<>(gateway.listRoles(identity));
        held.retainAll(rankConfigProvider.getRankTokens());
        return held;
    }
}
