package com.aiinpocket.rankverify.exception;

import com.aiinpocket.rankverify.model.enums.LockConflictReason;
import lombok.Getter;

/**
 * 截圖或遊戲 ID 已被其他使用者認領。
 */
@Getter
public class LockConflictException extends RuntimeException {

    private final LockConflictReason reason;

    /** 目前持有鎖的使用者（查不到時為 null） */
    private final String conflictingOwner;

    public LockConflictException(LockConflictReason reason, String conflictingOwner) {
        super("截圖鎖衝突: " + reason + " (owner=" + conflictingOwner + ")");
        this.reason = reason;
        this.conflictingOwner = conflictingOwner;
    }
}
