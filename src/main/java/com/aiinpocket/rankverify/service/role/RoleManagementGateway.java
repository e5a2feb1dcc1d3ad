package com.aiinpocket.rankverify.service.role;

import java.util.Set;

/**
 * 外部身分組管理介面（聊天平台的成員身分組 API）。
 *
 * <p>實作應將權限不足轉成 {@link com.aiinpocket.rankverify.exception.RolePermissionException}，
 * 將身分組不存在轉成 {@link com.aiinpocket.rankverify.exception.RoleConfigException}。
 */
public interface RoleManagementGateway {

    /** 成員目前持有的所有身分組 token */
    Set<String> listRoles(String identity);

    /** 伺服器上是否存在此身分組 */
    boolean roleExists(String token);

    void addRole(String identity, String token, String reason);

    void removeRole(String identity, String token, String reason);
}
