package com.aiinpocket.rankverify.service.role;

import com.aiinpocket.rankverify.config.VerificationProperties;
import com.aiinpocket.rankverify.exception.RoleConfigException;
import com.aiinpocket.rankverify.exception.RolePermissionException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.RestClient;
import tools.jackson.databind.JsonNode;
import tools.jackson.databind.ObjectMapper;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.HashSet;
import java.util.Set;

/**
 * Discord Bot API 身分組管理。
 *
 * <ul>
 *   <li>GET    /guilds/{guild}/members/{user}：成員資料（含 roles 陣列）</li>
 *   <li>GET    /guilds/{guild}/roles：伺服器身分組列表</li>
 *   <li>PUT    /guilds/{guild}/members/{user}/roles/{role}：新增身分組</li>
 *   <li>DELETE /guilds/{guild}/members/{user}/roles/{role}：移除身分組</li>
 * </ul>
 * 403 一律視為權限不足，不重試。
 */
@Component
@Slf4j
public class DiscordRoleManagementGateway implements RoleManagementGateway {

    private static final String MEMBER_URI = "/guilds/{guildId}/members/{userId}";
    private static final String ROLES_URI = "/guilds/{guildId}/roles";
    private static final String MEMBER_ROLE_URI = "/guilds/{guildId}/members/{userId}/roles/{roleId}";

    private final RestClient discordRestClient;
    private final ObjectMapper objectMapper;
    private final String guildId;

    public DiscordRoleManagementGateway(@Qualifier("discordRestClient") RestClient discordRestClient,
                                        ObjectMapper objectMapper,
                                        VerificationProperties props) {
        this.discordRestClient = discordRestClient;
        this.objectMapper = objectMapper;
        this.guildId = props.discord().guildId();
    }

    @Override
    public Set<String> listRoles(String identity) {
        try {
            String body = discordRestClient.get()
                    .uri(MEMBER_URI, guildId, identity)
                    .retrieve()
                    .body(String.class);
            Set<String> roles = new HashSet<>();
            if (body != null) {
                for (JsonNode role : objectMapper.readTree(body).path("roles")) {
                    roles.add(role.asText());
                }
            }
            return roles;
        } catch (HttpClientErrorException.Forbidden e) {
            throw new RolePermissionException("機器人無法讀取成員資料", e);
        }
    }

    @Override
    public boolean roleExists(String token) {
        try {
            String body = discordRestClient.get()
                    .uri(ROLES_URI, guildId)
                    .retrieve()
                    .body(String.class);
            if (body == null) {
                return false;
            }
            for (JsonNode role : objectMapper.readTree(body)) {
                if (token.equals(role.path("id").asText())) {
                    return true;
                }
            }
            return false;
        } catch (HttpClientErrorException.Forbidden e) {
            throw new RolePermissionException("機器人無法讀取伺服器身分組", e);
        }
    }

    @Override
    public void addRole(String identity, String token, String reason) {
        try {
            discordRestClient.put()
                    .uri(MEMBER_ROLE_URI, guildId, identity, token)
                    .header("X-Audit-Log-Reason", encodeReason(reason))
                    .retrieve()
                    .toBodilessEntity();
            log.info("[身分組] 已新增: identity={}, role={}", identity, token);
        } catch (HttpClientErrorException.Forbidden e) {
            log.error("[身分組] 權限不足，無法新增身分組: identity={}, role={}", identity, token);
            throw new RolePermissionException("機器人缺少 Manage Roles 權限或身分組順序過高", e);
        } catch (HttpClientErrorException.NotFound e) {
            throw new RoleConfigException("身分組或成員不存在: role=" + token, e);
        }
    }

    @Override
    public void removeRole(String identity, String token, String reason) {
        try {
            discordRestClient.delete()
                    .uri(MEMBER_ROLE_URI, guildId, identity, token)
                    .header("X-Audit-Log-Reason", encodeReason(reason))
                    .retrieve()
                    .toBodilessEntity();
            log.info("[身分組] 已移除: identity={}, role={}", identity, token);
        } catch (HttpClientErrorException.Forbidden e) {
            log.error("[身分組] 權限不足，無法移除身分組: identity={}, role={}", identity, token);
            throw new RolePermissionException("機器人缺少 Manage Roles 權限或身分組順序過高", e);
        } catch (HttpClientErrorException.NotFound e) {
            log.debug("[身分組] 要移除的身分組已不存在: identity={}, role={}", identity, token);
        }
    }

    private static String encodeReason(String reason) {
        return URLEncoder.encode(reason != null ? reason : "rank verification", StandardCharsets.UTF_8);
    }
}
