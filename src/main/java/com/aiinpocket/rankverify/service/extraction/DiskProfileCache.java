package com.aiinpocket.rankverify.service.extraction;

import com.aiinpocket.rankverify.config.VerificationProperties;
import com.aiinpocket.rankverify.model.dto.ExtractedProfile;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import tools.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * 磁碟快取層：每筆結果存成 {@code <cacheDir>/<hash>.json}。
 * 寫入先寫暫存檔再原子搬移，並行寫同一個 key 時以最後寫入者為準，不會讀到半個檔案。
 */
@Component
@Slf4j
public class DiskProfileCache implements ProfileCache {

    private static final Pattern HASH_PATTERN = Pattern.compile("^[0-9a-f]{16,128}$");

    private final Path cacheDir;
    private final ObjectMapper objectMapper;

    @Autowired
    public DiskProfileCache(VerificationProperties props, ObjectMapper objectMapper) {
        this(Path.of(props.vision().cacheDir()), objectMapper);
    }

    public DiskProfileCache(Path cacheDir, ObjectMapper objectMapper) {
        this.cacheDir = cacheDir;
        this.objectMapper = objectMapper;
    }

    @Override
    public Optional<ExtractedProfile> get(String contentHash) {
        Path file = resolve(contentHash);
        if (file == null || !Files.isRegularFile(file)) {
            return Optional.empty();
        }
        try {
            return Optional.of(objectMapper.readValue(Files.readString(file), ExtractedProfile.class));
        } catch (IOException | RuntimeException e) {
            log.warn("[辨識快取] 讀取磁碟快取失敗，改為重新辨識: {}", e.getMessage());
            return Optional.empty();
        }
    }

    @Override
    public void put(String contentHash, ExtractedProfile profile) {
        Path file = resolve(contentHash);
        if (file == null) {
            return;
        }
        Path temp = null;
        try {
            Files.createDirectories(cacheDir);
            temp = Files.createTempFile(cacheDir, contentHash, ".tmp");
            Files.writeString(temp, objectMapper.writeValueAsString(profile));
            try {
                Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING);
            }
            temp = null;
        } catch (IOException | RuntimeException e) {
            log.warn("[辨識快取] 寫入磁碟快取失敗（不影響驗證）: {}", e.getMessage());
        } finally {
            if (temp != null) {
                try {
                    Files.deleteIfExists(temp);
                } catch (IOException e) {
                    log.debug("[辨識快取] 暫存檔刪除失敗: {}", temp);
                }
            }
        }
    }

    /** 只接受十六進位雜湊作為檔名，避免路徑穿越 */
    private Path resolve(String contentHash) {
        if (contentHash == null || !HASH_PATTERN.matcher(contentHash).matches()) {
            log.warn("[辨識快取] 不合法的快取 key，略過");
            return null;
        }
        return cacheDir.resolve(contentHash + ".json");
    }
}
