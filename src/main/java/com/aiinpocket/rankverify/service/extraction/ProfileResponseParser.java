package com.aiinpocket.rankverify.service.extraction;

import com.aiinpocket.rankverify.model.dto.ExtractedProfile;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import tools.jackson.databind.JsonNode;
import tools.jackson.databind.ObjectMapper;
import tools.jackson.databind.node.JsonNodeType;

import java.util.regex.Pattern;

/**
 * 解析辨識服務回傳的 JSON 文字。
 * 每個欄位獨立檢查型別，不合格的欄位視為 UNKNOWN；整段無法解析時三個欄位皆為 UNKNOWN。
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ProfileResponseParser {

    /** 以連字號、空白或點分隔的數字，例如 182-625-474-6 */
    private static final Pattern UNIQUE_ID_PATTERN = Pattern.compile("^\\d+(?:[-\\s.]\\d+)*$");
    private static final Pattern NUMERIC = Pattern.compile("^\\d{1,6}$");

    private final ObjectMapper objectMapper;

    public ExtractedProfile parse(String content) {
        if (content == null || content.isBlank()) {
            return ExtractedProfile.unknown();
        }

        JsonNode root;
        try {
            root = objectMapper.readTree(stripCodeFence(content));
        } catch (RuntimeException e) {
            log.warn("[影像辨識] 回應不是合法 JSON: {}", preview(content));
            return ExtractedProfile.unknown();
        }
        if (root == null || !root.isObject()) {
            log.warn("[影像辨識] 回應不是 JSON 物件: {}", preview(content));
            return ExtractedProfile.unknown();
        }

        return new ExtractedProfile(
                parseLevel(root.path("level")),
                parseText(root.path("rank")),
                parseUniqueId(root.path("uniqueId"))
        );
    }

    static String stripCodeFence(String content) {
        String cleaned = content.trim();
        if (cleaned.startsWith("```")) {
            cleaned = cleaned.replaceFirst("^```(?:json)?\\s*", "").replaceFirst("\\s*```$", "");
        }
        return cleaned;
    }

    private static Integer parseLevel(JsonNode node) {
        Integer level = null;
        if (node.isIntegralNumber() && node.canConvertToInt()) {
            level = node.intValue();
        } else if (node.getNodeType() == JsonNodeType.STRING && NUMERIC.matcher(node.asText().trim()).matches()) {
            level = Integer.parseInt(node.asText().trim());
        }
        return level != null && level > 0 ? level : null;
    }

    private static String parseText(JsonNode node) {
        if (node.getNodeType() != JsonNodeType.STRING) {
            return null;
        }
        String value = node.asText().trim();
        return value.isEmpty() || ExtractedProfile.UNKNOWN.equalsIgnoreCase(value) ? null : value;
    }

    private static String parseUniqueId(JsonNode node) {
        String value = parseText(node);
        if (value == null) {
            return null;
        }
        return UNIQUE_ID_PATTERN.matcher(value).matches() ? value : null;
    }

    private static String preview(String content) {
        return content.length() > 200 ? content.substring(0, 200) : content;
    }
}
