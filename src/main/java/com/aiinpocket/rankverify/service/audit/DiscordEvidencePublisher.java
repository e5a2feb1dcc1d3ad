package com.aiinpocket.rankverify.service.audit;

import com.aiinpocket.rankverify.config.VerificationProperties;
import com.aiinpocket.rankverify.model.dto.EvidenceAttachment;
import com.aiinpocket.rankverify.model.dto.EvidenceRecord;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.io.ByteArrayResource;
import org.springframework.http.MediaType;
import org.springframework.http.client.MultipartBodyBuilder;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import tools.jackson.databind.ObjectMapper;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 證據頻道發送器。
 * 以 Discord Embed 格式發送驗證紀錄；有截圖時以 multipart 一併上傳並嵌入 Embed 圖片。
 */
@Component
@Slf4j
public class DiscordEvidencePublisher implements EvidencePublisher {

    private static final String MESSAGES_URI = "/channels/{channelId}/messages";

    private final RestClient discordRestClient;
    private final ObjectMapper objectMapper;
    private final String channelId;

    public DiscordEvidencePublisher(@Qualifier("discordRestClient") RestClient discordRestClient,
                                    ObjectMapper objectMapper,
                                    VerificationProperties props) {
        this.discordRestClient = discordRestClient;
        this.objectMapper = objectMapper;
        this.channelId = props.discord().evidenceChannelId();
    }

    @Override
    public void publish(EvidenceRecord record) {
        if (channelId == null || channelId.isBlank()) {
            log.warn("[通知-證據] 未設定證據頻道，略過發送: identity={}", record.identity());
            return;
        }

        try {
            EvidenceAttachment attachment = record.attachment();
            Map<String, Object> embed = new LinkedHashMap<>();
            embed.put("title", "段位驗證紀錄");
            embed.put("description", record.toMessageText());
            embed.put("color", record.color());
            embed.put("timestamp", record.timestamp().toString());

            if (attachment == null || attachment.data() == null) {
                discordRestClient.post()
                        .uri(MESSAGES_URI, channelId)
                        .contentType(MediaType.APPLICATION_JSON)
                        .body(objectMapper.writeValueAsString(Map.of("embeds", List.of(embed))))
                        .retrieve()
                        .toBodilessEntity();
            } else {
                embed.put("image", Map.of("url", "attachment://" + attachment.filename()));
                Map<String, Object> payload = Map.of(
                        "embeds", List.of(embed),
                        "attachments", List.of(Map.of("id", 0, "filename", attachment.filename())));

                MultipartBodyBuilder parts = new MultipartBodyBuilder();
                parts.part("payload_json", objectMapper.writeValueAsString(payload), MediaType.APPLICATION_JSON);
                parts.part("files[0]", new ByteArrayResource(attachment.data()))
                        .filename(attachment.filename())
                        .contentType(MediaType.parseMediaType(attachment.contentType()));

                discordRestClient.post()
                        .uri(MESSAGES_URI, channelId)
                        .contentType(MediaType.MULTIPART_FORM_DATA)
                        .body(parts.build())
                        .retrieve()
                        .toBodilessEntity();
            }
            log.info("[通知-證據] 已發送驗證紀錄: identity={}, status={}", record.identity(), record.status());
        } catch (Exception e) {
            log.error("[通知-證據] 發送失敗: identity={}", record.identity(), e);
        }
    }
}
