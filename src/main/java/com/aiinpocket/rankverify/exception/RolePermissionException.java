package com.aiinpocket.rankverify.exception;

/**
 * 機器人沒有管理身分組的權限（Discord 403）。
 */
public class RolePermissionException extends RuntimeException {

    public RolePermissionException(String message, Throwable cause) {
        super(message, cause);
    }
}
