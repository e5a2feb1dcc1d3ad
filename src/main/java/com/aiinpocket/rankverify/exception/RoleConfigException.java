package com.aiinpocket.rankverify.exception;

/**
 * 等級表中的身分組在伺服器上不存在。需要管理員修正設定，重試無效。
 */
public class RoleConfigException extends RuntimeException {

    public RoleConfigException(String message) {
        super(message);
    }

    public RoleConfigException(String message, Throwable cause) {
        super(message, cause);
    }
}
