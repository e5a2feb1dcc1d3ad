package com.aiinpocket.rankverify.model.dto;

import com.aiinpocket.rankverify.model.enums.VerificationStatus;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * 發送到稽核頻道、供管理員人工檢視的證據紀錄。
 *
 * @param identity         驗證者
 * @param status           驗證結果
 * @param displayUniqueId  統一分組格式的遊戲 ID（例如 182-625-474-6）
 * @param confidence       比對信心分數
 * @param level            等級
 * @param rankName         段位名稱
 * @param processingTimeMs 處理耗時
 * @param reason           備註（失敗原因等）
 * @param attachment       原始截圖
 * @param timestamp        事件時間
 */
public record EvidenceRecord(
        String identity,
        VerificationStatus status,
        String displayUniqueId,
        Double confidence,
        Integer level,
        String rankName,
        Long processingTimeMs,
        String reason,
        EvidenceAttachment attachment,
        Instant timestamp
) {

    public static EvidenceRecord from(VerificationAuditRequest request, Instant timestamp) {
        return new EvidenceRecord(
                request.identity(),
                request.status(),
                request.uniqueId() != null ? formatUniqueId(request.uniqueId()) : null,
                request.confidence(),
                request.level(),
                request.rankName(),
                request.processingTimeMs(),
                request.reason(),
                request.attachment(),
                timestamp
        );
    }

    /**
     * 將遊戲 ID 重新排成一致的分組格式，不論辨識服務原本怎麼分隔。
     * 只保留數字，每 3 碼一組；剩 4 碼時拆成 3+1，其餘殘段獨立成組。
     * 例：1826254746 → 182-625-474-6。
     */
    public static String formatUniqueId(String uniqueId) {
        String digits = uniqueId.replaceAll("\\D", "");
        if (digits.length() <= 3) {
            return digits;
        }

        List<String> groups = new ArrayList<>();
        int index = 0;
        while (digits.length() - index > 4) {
            groups.add(digits.substring(index, index + 3));
            index += 3;
        }

        int remaining = digits.length() - index;
        if (remaining == 4) {
            groups.add(digits.substring(index, index + 3));
            groups.add(digits.substring(index + 3));
        } else {
            groups.add(digits.substring(index));
        }
        return String.join("-", groups);
    }

    /** Discord embed 顏色：成功綠、失敗紅、人工審核黃 */
    public int color() {
        return switch (status) {
            case SUCCESS -> 0x2ECC71;
            case FAILURE -> 0xE74C3C;
            case MANUAL_REVIEW -> 0xF1C40F;
        };
    }

    /**
     * 產生適合稽核頻道的格式化訊息文字
     */
    public String toMessageText() {
        String statusLabel = switch (status) {
            case SUCCESS -> "✅ 驗證成功";
            case FAILURE -> "❌ 驗證失敗";
            case MANUAL_REVIEW -> "⚠️ 需人工審核";
        };

        StringBuilder sb = new StringBuilder();
        sb.append("使用者: ").append(identity).append('\n');
        sb.append("狀態: ").append(statusLabel).append('\n');
        if (displayUniqueId != null) {
            sb.append("遊戲 ID: ").append(displayUniqueId).append('\n');
        }
        if (rankName != null) {
            sb.append("段位: ").append(rankName).append('\n');
        }
        if (level != null) {
            sb.append("等級: ").append(level).append('\n');
        }
        if (confidence != null) {
            sb.append("信心: ").append(Math.round(confidence * 100)).append("%\n");
        }
        if (reason != null) {
            sb.append("備註: ").append(reason).append('\n');
        }
        if (processingTimeMs != null) {
            sb.append("處理時間: ").append(processingTimeMs).append("ms\n");
        }
        sb.append("時間: ").append(timestamp);
        return sb.toString();
    }
}
