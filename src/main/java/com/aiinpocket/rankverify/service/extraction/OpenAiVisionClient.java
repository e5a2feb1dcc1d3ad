package com.aiinpocket.rankverify.service.extraction;

import com.aiinpocket.rankverify.config.VerificationProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import tools.jackson.databind.JsonNode;
import tools.jackson.databind.ObjectMapper;

import java.util.Base64;
import java.util.List;
import java.util.Map;

/**
 * OpenAI 相容的 Chat Completions 影像辨識客戶端。
 * 圖片以 base64 data URI 內嵌在訊息中，temperature 固定為 0。
 */
@Component
@Slf4j
public class OpenAiVisionClient implements VisionExtractionClient {

    static final String SYSTEM_PROMPT = """
            You extract structured data from game profile screenshots.
            Return ONLY a JSON object with: level, rank, uniqueId.

            Extraction rules:
            1. Level: the number inside the star icon in the Level progress section (any star color). \
            This is a 1-4 digit number, e.g. 5, 42, 618.
            2. Rank: the text that appears after 'Rank:' (e.g. 'Galactic Overlord', 'Master', 'Professional').
            3. Unique ID: the number below the country flag, formatted with hyphens (e.g. '182-625-474-6').

            If a value is unreadable or cannot be found, return 'UNKNOWN' for that field.
            Output ONLY valid JSON, no explanation, no markdown, no code blocks.
            Format: {"level": 618, "rank": "Galactic Overlord", "uniqueId": "182-625-474-6"}""";

    private final RestClient visionRestClient;
    private final ObjectMapper objectMapper;
    private final String model;

    public OpenAiVisionClient(@Qualifier("visionRestClient") RestClient visionRestClient,
                              ObjectMapper objectMapper,
                              VerificationProperties props) {
        this.visionRestClient = visionRestClient;
        this.objectMapper = objectMapper;
        this.model = props.vision().model();
    }

    @Override
    public String extract(byte[] image, String mimeType) {
        String dataUri = "data:" + mimeType + ";base64," + Base64.getEncoder().encodeToString(image);

        Map<String, Object> body = Map.of(
                "model", model,
                "temperature", 0,
                "max_tokens", 200,
                "messages", List.of(
                        Map.of("role", "system", "content", SYSTEM_PROMPT),
                        Map.of("role", "user", "content", List.of(
                                Map.of("type", "text", "text", "Here is the screenshot."),
                                Map.of("type", "image_url", "image_url", Map.of("url", dataUri))
                        ))
                )
        );

        log.info("[影像辨識] 呼叫辨識服務: model={}, imageSize={}", model, image.length);
        String response = visionRestClient.post()
                .uri("/chat/completions")
                .body(objectMapper.writeValueAsString(body))
                .retrieve()
                .body(String.class);

        if (response == null) {
            return null;
        }
        JsonNode content = objectMapper.readTree(response).path("choices").path(0).path("message").path("content");
        if (content.isMissingNode() || content.isNull()) {
            log.warn("[影像辨識] 辨識服務回傳空內容");
            return null;
        }
        return content.asText();
    }
}
