package com.aiinpocket.rankverify.service.rank;

import com.aiinpocket.rankverify.config.VerificationProperties;
import com.aiinpocket.rankverify.model.dto.RankDefinition;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Service;
import tools.jackson.core.type.TypeReference;
import tools.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.InputStream;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Collectors;

/**
 * 從 Spring Resource（classpath: 或 file:）讀取段位表 JSON。
 *
 * <p>由 RankConfigReloadJob 定期呼叫 {@link #reload()}。解析或驗證失敗時保留上一份設定，
 * 但啟動時第一次載入失敗會直接拋出，讓服務無法在沒有段位表的情況下啟動。
 */
@Service
@Slf4j
public class ResourceRankConfigProvider implements RankConfigProvider {

    private final ResourceLoader resourceLoader;
    private final ObjectMapper objectMapper;
    private final String location;
    private final AtomicReference<Snapshot> current = new AtomicReference<>();

    public ResourceRankConfigProvider(ResourceLoader resourceLoader,
                                      ObjectMapper objectMapper,
                                      VerificationProperties props) {
        this.resourceLoader = resourceLoader;
        this.objectMapper = objectMapper;
        this.location = props.ranks().location();
        this.current.set(load());
    }

    @Override
    public List<RankDefinition> getCurrent() {
        return current.get().ranks();
    }

    @Override
    public boolean reload() {
        try {
            Snapshot next = load();
            Snapshot previous = current.getAndSet(next);
            if (!previous.ranks().equals(next.ranks())) {
                log.info("[段位設定] 段位表已更新: {} → {} 個段位", previous.ranks().size(), next.ranks().size());
            }
            return true;
        } catch (RuntimeException e) {
            log.error("[段位設定] 重新載入失敗，沿用上一份設定 ({} 個段位): {}",
                    current.get().ranks().size(), e.getMessage());
            return false;
        }
    }

    @Override
    public Set<String> getRankTokens() {
        return current.get().tokens();
    }

    @Override
    public Instant getLastLoadedAt() {
        return current.get().loadedAt();
    }

    private Snapshot load() {
        Resource resource = resourceLoader.getResource(location);
        List<RankDefinition> ranks;
        try (InputStream in = resource.getInputStream()) {
            ranks = objectMapper.readValue(in, new TypeReference<List<RankDefinition>>() {});
        } catch (IOException e) {
            throw new IllegalStateException("無法讀取段位表: " + location, e);
        }
        validate(ranks);
        List<RankDefinition> frozen = List.copyOf(ranks);
        Set<String> tokens = frozen.stream().map(RankDefinition::token).collect(Collectors.toUnmodifiableSet());
        log.debug("[段位設定] 已載入 {} 個段位 ({})", frozen.size(), location);
        return new Snapshot(frozen, tokens, Instant.now());
    }

    static void validate(List<RankDefinition> ranks) {
        if (ranks == null || ranks.isEmpty()) {
            throw new IllegalStateException("段位表為空");
        }
        Set<String> seen = new HashSet<>();
        for (int i = 0; i < ranks.size(); i++) {
            RankDefinition rank = ranks.get(i);
            if (rank == null || isBlank(rank.token()) || isBlank(rank.displayName())) {
                throw new IllegalStateException("段位表第 " + i + " 筆缺少 token 或 display_name");
            }
            if (rank.levelMin() > rank.levelMax()) {
                throw new IllegalStateException("段位 " + rank.displayName() + " 的等級區間不合法");
            }
            if (!seen.add(rank.token())) {
                throw new IllegalStateException("段位 token 重複: " + rank.token());
            }
        }

        List<RankDefinition> sorted = new ArrayList<>(ranks);
        sorted.sort(Comparator.comparingInt(RankDefinition::levelMin));
        for (int i = 1; i < sorted.size(); i++) {
            RankDefinition prev = sorted.get(i - 1);
            RankDefinition next = sorted.get(i);
            if (next.levelMin() <= prev.levelMax()) {
                throw new IllegalStateException("段位等級區間重疊: " + prev.displayName() + " / " + next.displayName());
            }
        }
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }

    private record Snapshot(List<RankDefinition> ranks, Set<String> tokens, Instant loadedAt) {}
}
