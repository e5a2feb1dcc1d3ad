package com.aiinpocket.rankverify;

import com.aiinpocket.rankverify.config.VerificationProperties;
import com.aiinpocket.rankverify.model.dto.RankDefinition;
import com.aiinpocket.rankverify.service.rank.RankConfigProvider;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * 測試共用的段位表與設定。
 */
public final class TestFixtures {

    public static final RankDefinition ROOKIE = new RankDefinition("r-rookie", "Rookie", 1, 50);
    public static final RankDefinition APPRENTICE = new RankDefinition("r-apprentice", "Apprentice", 51, 100);
    public static final RankDefinition VETERAN = new RankDefinition("r-veteran", "Veteran", 101, 200);
    public static final RankDefinition PROFESSIONAL = new RankDefinition("r-professional", "Professional", 201, 300);
    public static final RankDefinition MASTER = new RankDefinition("r-master", "Master", 401, 500);
    public static final RankDefinition GRANDMASTER = new RankDefinition("r-grandmaster", "Grandmaster", 501, 599);
    public static final RankDefinition GALACTIC_OVERLORD = new RankDefinition("r-galactic", "Galactic Overlord", 600, 699);

    public static final List<RankDefinition> RANKS = List.of(
            ROOKIE, APPRENTICE, VETERAN, PROFESSIONAL, MASTER, GRANDMASTER, GALACTIC_OVERLORD);

    public static final VerificationProperties.Matcher MATCHER = new VerificationProperties.Matcher(0.6, 0.7, 0.9, 0.8, 200);

    private TestFixtures() {
    }

    public static VerificationProperties properties(boolean mockMode, String ranksLocation) {
        return new VerificationProperties(
                new VerificationProperties.Download(20 * 1024 * 1024, Duration.ofSeconds(10),
                        System.getProperty("java.io.tmpdir"), List.of(".jpg", ".jpeg", ".png"), "test"),
                new VerificationProperties.Vision(mockMode, "http://localhost/v1", "key", "gpt-4o",
                        Duration.ofSeconds(5), System.getProperty("java.io.tmpdir"), 100, Duration.ofMinutes(5)),
                MATCHER,
                new VerificationProperties.Ranks(ranksLocation, Duration.ofSeconds(30)),
                new VerificationProperties.Discord("https://discord.test/api/v10", "token", "guild-1", "channel-1"),
                new VerificationProperties.Audit(System.getProperty("java.io.tmpdir") + "/metrics-test.json",
                        Duration.ofSeconds(2)),
                new VerificationProperties.Reconciliation(true, 10, Duration.ofSeconds(60), 50)
        );
    }

    /** 固定內容的段位表 */
    public static RankConfigProvider staticProvider(List<RankDefinition> ranks) {
        Instant loadedAt = Instant.now();
        return new RankConfigProvider() {
            @Override
            public List<RankDefinition> getCurrent() {
                return ranks;
            }

            @Override
            public boolean reload() {
                return true;
            }

            @Override
            public Set<String> getRankTokens() {
                return ranks.stream().map(RankDefinition::token).collect(Collectors.toSet());
            }

            @Override
            public Instant getLastLoadedAt() {
                return loadedAt;
            }
        };
    }
}
