package com.aiinpocket.rankverify.controller;

import com.aiinpocket.rankverify.exception.LockConflictException;
import com.aiinpocket.rankverify.model.enums.FailureReason;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.servlet.resource.NoResourceFoundException;

import java.util.Map;

/**
 * 全域 REST API 異常處理器。
 * 攔截未被個別 Controller 處理的異常，回傳統一的 {"error": ...} 格式，不外洩堆疊追蹤。
 */
@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, String>> handleIllegalArgument(IllegalArgumentException e) {
        String msg = sanitizeMessage(e.getMessage());
        return ResponseEntity.badRequest().body(Map.of("error", msg));
    }

    @ExceptionHandler(LockConflictException.class)
    public ResponseEntity<Map<String, String>> handleLockConflict(LockConflictException e) {
        return ResponseEntity.status(409).body(Map.of("error", FailureReason.ALREADY_CLAIMED.userMessage()));
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Map<String, String>> handleValidation(MethodArgumentNotValidException e) {
        String field = e.getBindingResult().getFieldError() != null
                ? e.getBindingResult().getFieldError().getField()
                : "request";
        return ResponseEntity.badRequest().body(Map.of("error", "欄位不正確: " + field));
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<Map<String, String>> handleTypeMismatch(MethodArgumentTypeMismatchException e) {
        return ResponseEntity.badRequest().body(Map.of("error", "參數格式不正確: " + e.getName()));
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<Map<String, String>> handleBadRequest(HttpMessageNotReadableException e) {
        return ResponseEntity.badRequest().body(Map.of("error", "請求格式不正確，請檢查欄位型別"));
    }

    @ExceptionHandler(NoResourceFoundException.class)
    public ResponseEntity<Map<String, String>> handleNoResource(NoResourceFoundException e) {
        log.debug("資源不存在: {}", e.getResourcePath());
        return ResponseEntity.status(404).body(Map.of("error", "資源不存在"));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, String>> handleGeneral(Exception e) {
        log.error("[GlobalExceptionHandler] 未預期的錯誤", e);
        return ResponseEntity.internalServerError()
                .body(Map.of("error", "系統發生錯誤，請稍後重試"));
    }

    /** 過濾可能含有敏感資訊的錯誤訊息 */
    private static String sanitizeMessage(String msg) {
        if (msg == null || msg.length() > 200) return "操作失敗，請稍後重試";
        String lower = msg.toLowerCase();
        if (lower.contains("sql") || lower.contains("exception") || lower.contains("constraint")
                || lower.contains("connection") || lower.contains("timeout")
                || lower.contains("password") || lower.contains("token")) {
            return "操作失敗，請稍後重試";
        }
        return msg;
    }
}
