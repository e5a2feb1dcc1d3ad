package com.aiinpocket.rankverify.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.List;

/**
 * 截圖驗證相關設定（application.yml 的 verification.* 區塊）。
 * 各子區塊對應管線中的一個元件，數值皆可由環境變數覆寫。
 */
@ConfigurationProperties(prefix = "verification")
public record VerificationProperties(
        Download download,
        Vision vision,
        Matcher matcher,
        Ranks ranks,
        Discord discord,
        Audit audit,
        Reconciliation reconciliation
) {

    /**
     * 圖片下載限制。
     *
     * @param maxBytes          下載位元組上限（串流中逐塊檢查，不信任 header）
     * @param timeout           整體下載時限（含 header 與 body）
     * @param tempDir           下載暫存目錄
     * @param allowedExtensions 允許的副檔名（小寫、含點）
     * @param userAgent         下載時送出的 User-Agent
     */
    public record Download(
            long maxBytes,
            Duration timeout,
            String tempDir,
            List<String> allowedExtensions,
            String userAgent
    ) {}

    /**
     * 影像辨識服務設定。
     *
     * @param mockMode        true 時完全不呼叫外部服務，回傳固定資料（測試用）
     * @param baseUrl         OpenAI 相容 API 的 base URL
     * @param apiKey          API 金鑰
     * @param model           使用的模型名稱
     * @param timeout         單次呼叫時限
     * @param cacheDir        磁碟快取目錄
     * @param memoryCacheSize 記憶體快取上限筆數
     * @param memoryCacheTtl  記憶體快取存活時間
     */
    public record Vision(
            boolean mockMode,
            String baseUrl,
            String apiKey,
            String model,
            Duration timeout,
            String cacheDir,
            long memoryCacheSize,
            Duration memoryCacheTtl
    ) {}

    /**
     * 等級比對的經驗門檻。
     * 這些數值是針對單一個人檔案畫面版面調出來的，換版面時需重新調整。
     */
    public record Matcher(
            double fuzzyThreshold,
            double confidentNameThreshold,
            double crossValidatedFloor,
            double levelOnlyConfidence,
            int regionWidth
    ) {}

    /**
     * 等級表設定。
     *
     * @param location       Spring Resource 位置（classpath: 或 file:）
     * @param reloadInterval 自動重新載入間隔
     */
    public record Ranks(
            String location,
            Duration reloadInterval
    ) {}

    /** Discord Bot 連線資訊（身分組管理與證據頻道共用） */
    public record Discord(
            String apiBaseUrl,
            String botToken,
            String guildId,
            String evidenceChannelId
    ) {}

    /**
     * 稽核與統計。
     *
     * @param metricsFile       統計計數器的 JSON 檔路徑
     * @param metricsFlushDelay 合併寫入的等待時間，期間內的多次更新只寫一次檔
     */
    public record Audit(
            String metricsFile,
            Duration metricsFlushDelay
    ) {}

    /**
     * 身分組校正批次。
     *
     * @param enabled         是否啟用排程
     * @param budgetPerWindow 每個時間窗可處理的使用者數
     * @param window          時間窗長度
     * @param batchSize       每次從資料庫讀取的帳號數
     */
    public record Reconciliation(
            boolean enabled,
            int budgetPerWindow,
            Duration window,
            int batchSize
    ) {}
}
