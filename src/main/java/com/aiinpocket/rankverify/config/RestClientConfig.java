package com.aiinpocket.rankverify.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

/**
 * REST 客戶端配置。
 * 定義不同用途的 RestClient Bean，避免各 Service 各自建立實例。
 *
 * <ul>
 *   <li>{@code discordRestClient}：Discord Bot API 專用（身分組管理、證據頻道）</li>
 *   <li>{@code visionRestClient}：影像辨識 API 專用（有獨立的讀取時限）</li>
 * </ul>
 */
@Configuration
public class RestClientConfig {

    /** Discord Bot API 專用 RestClient，預設帶上 Bot 認證 header */
    @Bean
    public RestClient discordRestClient(VerificationProperties props) {
        VerificationProperties.Discord discord = props.discord();
        return RestClient.builder()
                .baseUrl(discord.apiBaseUrl())
                .defaultHeader("Authorization", "Bot " + discord.botToken())
                .build();
    }

    /** 影像辨識 API 專用 RestClient，讀取時限取自 verification.vision.timeout */
    @Bean
    public RestClient visionRestClient(VerificationProperties props) {
        VerificationProperties.Vision vision = props.vision();
        SimpleClientHttpRequestFactory factory = new SimpleClientHttpRequestFactory();
        factory.setConnectTimeout(vision.timeout());
        factory.setReadTimeout(vision.timeout());
        return RestClient.builder()
                .baseUrl(vision.baseUrl())
                .requestFactory(factory)
                .defaultHeader("Authorization", "Bearer " + vision.apiKey())
                .defaultHeader("Content-Type", "application/json")
                .build();
    }
}
