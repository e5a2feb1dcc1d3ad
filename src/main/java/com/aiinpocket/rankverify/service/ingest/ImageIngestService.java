package com.aiinpocket.rankverify.service.ingest;

import com.aiinpocket.rankverify.config.VerificationProperties;
import com.aiinpocket.rankverify.model.dto.ImageIngestResult;
import com.aiinpocket.rankverify.model.dto.ImageSource;
import com.aiinpocket.rankverify.model.enums.DownloadFailure;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.DisposableBean;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Locale;
import java.util.OptionalLong;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 截圖下載服務。
 * 以有上限的串流方式下載圖片，邊寫暫存檔邊計算 SHA-256。
 *
 * <p>安全限制：
 * <ul>
 *   <li>副檔名與 Content-Type 都不是圖片時，不發出任何連線</li>
 *   <li>宣告大小或 Content-Length 超過上限時立即拒絕</li>
 *   <li>沒有 Content-Length 時逐塊累計位元組，超過上限即中止</li>
 *   <li>整體時限涵蓋 header 與 body，逾時由監看執行緒關閉串流</li>
 *   <li>暫存檔在任何結束路徑都會刪除</li>
 * </ul>
 *
 * <p>所有失敗都以 {@link ImageIngestResult#failed} 回報，不向外拋出例外。
 */
@Service
@Slf4j
public class ImageIngestService implements DisposableBean {

    private static final int BUFFER_SIZE = 8192;
    private static final String DEFAULT_FILENAME = "profile.png";

    private final VerificationProperties.Download props;
    private final HttpClient httpClient;
    private final ScheduledExecutorService watchdog;

    @Autowired
    public ImageIngestService(VerificationProperties props) {
        this(props.download());
    }

    public ImageIngestService(VerificationProperties.Download props) {
        this.props = props;
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(props.timeout())
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();
        this.watchdog = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "ingest-watchdog");
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * 下載並驗證一張截圖。
     *
     * @param source 圖片來源
     * @return 成功時包含位元組與雜湊；失敗時包含 {@link DownloadFailure}
     */
    public ImageIngestResult ingest(ImageSource source) {
        if (source == null || source.url() == null || source.url().isBlank()) {
            return ImageIngestResult.failed(DownloadFailure.NETWORK_ERROR, "缺少圖片網址");
        }

        String filename = normalizeFilename(source.filename() != null ? source.filename() : filenameFromUrl(source.url()));
        if (!isImage(filename, source.declaredContentType())) {
            log.info("[截圖下載] 非圖片附件，拒絕下載: filename={}, contentType={}",
                    filename, source.declaredContentType());
            return ImageIngestResult.failed(DownloadFailure.NOT_IMAGE, "副檔名與 Content-Type 皆非圖片");
        }

        if (source.declaredSize() != null && source.declaredSize() > props.maxBytes()) {
            log.info("[截圖下載] 宣告大小 {} 超過上限 {}", source.declaredSize(), props.maxBytes());
            return ImageIngestResult.failed(DownloadFailure.OVERSIZE, "宣告大小超過上限");
        }

        String contentType = resolveContentType(filename, source.declaredContentType());
        Path tempFile = null;
        try {
            Path tempDir = Path.of(props.tempDir());
            Files.createDirectories(tempDir);
            tempFile = Files.createTempFile(tempDir, "ingest-", ".tmp");
            return download(source.url(), tempFile, filename, contentType);
        } catch (IOException e) {
            log.warn("[截圖下載] 暫存檔處理失敗: {}", e.getMessage());
            return ImageIngestResult.failed(DownloadFailure.NETWORK_ERROR, e.getMessage());
        } finally {
            deleteQuietly(tempFile);
        }
    }

    private ImageIngestResult download(String url, Path tempFile, String filename, String contentType) {
        long startNanos = System.nanoTime();
        HttpRequest request;
        try {
            request = HttpRequest.newBuilder(URI.create(url))
                    .timeout(props.timeout())
                    .header("User-Agent", props.userAgent())
                    .GET()
                    .build();
        } catch (IllegalArgumentException e) {
            return ImageIngestResult.failed(DownloadFailure.NETWORK_ERROR, "網址格式不正確");
        }

        HttpResponse<InputStream> response;
        try {
            response = httpClient.sendAsync(request, HttpResponse.BodyHandlers.ofInputStream())
                    .get(props.timeout().toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            log.info("[截圖下載] 等待回應逾時: {}", url);
            return ImageIngestResult.failed(DownloadFailure.TIMEOUT, "等待回應逾時");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return ImageIngestResult.failed(DownloadFailure.NETWORK_ERROR, "下載被中斷");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            if (cause instanceof java.net.http.HttpTimeoutException) {
                return ImageIngestResult.failed(DownloadFailure.TIMEOUT, "連線逾時");
            }
            log.info("[截圖下載] 連線失敗: {}", cause.toString());
            return ImageIngestResult.failed(DownloadFailure.NETWORK_ERROR, cause.toString());
        }

        InputStream body = response.body();
        int status = response.statusCode();
        if (status < 200 || status >= 300) {
            closeQuietly(body);
            log.info("[截圖下載] HTTP 狀態碼 {}: {}", status, url);
            return ImageIngestResult.failed(DownloadFailure.NETWORK_ERROR, "HTTP " + status);
        }

        OptionalLong contentLength = response.headers().firstValueAsLong("Content-Length");
        if (contentLength.isPresent() && contentLength.getAsLong() > props.maxBytes()) {
            closeQuietly(body);
            log.info("[截圖下載] Content-Length {} 超過上限 {}", contentLength.getAsLong(), props.maxBytes());
            return ImageIngestResult.failed(DownloadFailure.OVERSIZE, "Content-Length 超過上限");
        }

        long remainingNanos = props.timeout().toNanos() - (System.nanoTime() - startNanos);
        if (remainingNanos <= 0) {
            closeQuietly(body);
            return ImageIngestResult.failed(DownloadFailure.TIMEOUT, "下載逾時");
        }

        AtomicBoolean timedOut = new AtomicBoolean(false);
        ScheduledFuture<?> deadline = watchdog.schedule(() -> {
            timedOut.set(true);
            closeQuietly(body);
        }, remainingNanos, TimeUnit.NANOSECONDS);

        try {
            return streamToFile(body, tempFile, filename, contentType, timedOut);
        } finally {
            deadline.cancel(false);
            closeQuietly(body);
        }
    }

    private ImageIngestResult streamToFile(InputStream body, Path tempFile, String filename,
                                           String contentType, AtomicBoolean timedOut) {
        MessageDigest digest = sha256();
        long total = 0;
        byte[] buffer = new byte[BUFFER_SIZE];

        try (OutputStream out = Files.newOutputStream(tempFile)) {
            int read;
            while ((read = body.read(buffer)) != -1) {
                total += read;
                if (total > props.maxBytes()) {
                    log.info("[截圖下載] 串流位元組超過上限 {}，中止下載", props.maxBytes());
                    return ImageIngestResult.failed(DownloadFailure.OVERSIZE, "串流位元組超過上限");
                }
                digest.update(buffer, 0, read);
                out.write(buffer, 0, read);
            }
        } catch (IOException e) {
            if (timedOut.get()) {
                log.info("[截圖下載] 下載逾時，已關閉串流");
                return ImageIngestResult.failed(DownloadFailure.TIMEOUT, "下載逾時");
            }
            log.info("[截圖下載] 讀取串流失敗: {}", e.getMessage());
            return ImageIngestResult.failed(DownloadFailure.NETWORK_ERROR, e.getMessage());
        }

        if (timedOut.get()) {
            return ImageIngestResult.failed(DownloadFailure.TIMEOUT, "下載逾時");
        }

        try {
            byte[] data = Files.readAllBytes(tempFile);
            String sha256 = HexFormat.of().formatHex(digest.digest());
            log.debug("[截圖下載] 下載完成: {} bytes, sha256={}", data.length, sha256);
            return ImageIngestResult.success(data, sha256, filename, contentType);
        } catch (IOException e) {
            return ImageIngestResult.failed(DownloadFailure.NETWORK_ERROR, e.getMessage());
        }
    }

    /**
     * 判斷是否為圖片：副檔名在允許清單中，或 Content-Type 為 image/*。
     */
    boolean isImage(String filename, String contentType) {
        String lower = filename.toLowerCase(Locale.ROOT);
        boolean allowedExtension = props.allowedExtensions().stream().anyMatch(lower::endsWith);
        boolean imageContentType = contentType != null
                && contentType.toLowerCase(Locale.ROOT).startsWith("image/");
        return allowedExtension || imageContentType;
    }

    /** 只保留英數、底線、點與連字號，其餘換成底線 */
    static String normalizeFilename(String filename) {
        if (filename == null || filename.isBlank()) {
            return DEFAULT_FILENAME;
        }
        String normalized = filename.trim().replaceAll("[^\\w.\\-]", "_");
        return normalized.isBlank() ? DEFAULT_FILENAME : normalized;
    }

    static String resolveContentType(String filename, String declaredContentType) {
        String lower = filename.toLowerCase(Locale.ROOT);
        if (lower.endsWith(".png")) {
            return "image/png";
        }
        if (lower.endsWith(".jpg") || lower.endsWith(".jpeg")) {
            return "image/jpeg";
        }
        if (declaredContentType != null && declaredContentType.toLowerCase(Locale.ROOT).startsWith("image/")) {
            return declaredContentType;
        }
        return "image/png";
    }

    private static String filenameFromUrl(String url) {
        try {
            String path = URI.create(url).getPath();
            if (path == null || path.isEmpty()) {
                return null;
            }
            int slash = path.lastIndexOf('/');
            return path.substring(slash + 1);
        } catch (IllegalArgumentException e) {
            return null;
        }
    }

    private static MessageDigest sha256() {
        try {
            return MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("JVM 不支援 SHA-256", e);
        }
    }

    private static void closeQuietly(InputStream in) {
        try {
            in.close();
        } catch (IOException e) {
            log.debug("[截圖下載] 關閉串流失敗: {}", e.getMessage());
        }
    }

    private static void deleteQuietly(Path file) {
        if (file == null) {
            return;
        }
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            log.warn("[截圖下載] 暫存檔刪除失敗: {}", file, e);
        }
    }

    @Override
    public void destroy() {
        watchdog.shutdownNow();
    }
}
