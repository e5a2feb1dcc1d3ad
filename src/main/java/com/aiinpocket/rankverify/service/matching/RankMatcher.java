package com.aiinpocket.rankverify.service.matching;

import com.aiinpocket.rankverify.config.VerificationProperties;
import com.aiinpocket.rankverify.model.dto.ExtractedProfile;
import com.aiinpocket.rankverify.model.dto.RankDefinition;
import com.aiinpocket.rankverify.model.dto.RankMatch;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 段位比對器（純函式，不持有狀態）。
 *
 * <p>同時使用兩個訊號決定段位：
 * <ul>
 *   <li>等級數字：對照每個段位的等級區間</li>
 *   <li>段位名稱：完全包含 → 部分包含 → Levenshtein 模糊比對</li>
 * </ul>
 * 兩者一致時信心最高；只有一個訊號時依門檻決定是否採用。
 * 偵測到的等級只在落入最終段位區間時才保留。
 *
 * <p>文字輸入的比對只在 "Level progress" 標記附近的區域內進行，
 * 避免把勝場數、金幣等統計數字誤判為等級。
 */
@Component
@Slf4j
public class RankMatcher {

    private static final Pattern LANDMARK = Pattern.compile(
            "(?:level|evel|lvl)\\s*progre(?:ss|s|bhi|bh)?", Pattern.CASE_INSENSITIVE);
    private static final Pattern LANDMARK_FALLBACK = Pattern.compile(
            "(?:level|evel|lvl)\\s*prog", Pattern.CASE_INSENSITIVE);

    private static final List<Pattern> EXPLICIT_LEVEL = List.of(
            Pattern.compile("(?:level|evel|lvl)\\s*progress\\s*[:\\-]?\\s*(\\d+)", Pattern.CASE_INSENSITIVE),
            Pattern.compile("(?:level|evel|lvl)\\s*[:\\-]?\\s*(\\d+)", Pattern.CASE_INSENSITIVE));

    private static final List<Pattern> STAT_CONTEXTS = List.of(
            Pattern.compile("games\\s+won\\s+[\\d\\s]+\\s+of", Pattern.CASE_INSENSITIVE),
            Pattern.compile("tournaments\\s+won\\s+[\\d\\s]+\\s+of", Pattern.CASE_INSENSITIVE),
            Pattern.compile("total\\s+winnings", Pattern.CASE_INSENSITIVE),
            Pattern.compile("coins\\s+wallet", Pattern.CASE_INSENSITIVE),
            Pattern.compile("win\\s+percentage", Pattern.CASE_INSENSITIVE),
            Pattern.compile("win\\s+streak", Pattern.CASE_INSENSITIVE),
            Pattern.compile("balls\\s+potted", Pattern.CASE_INSENSITIVE));

    private static final List<String> STAT_KEYWORDS = List.of(
            "games won", "tournaments", "winnings", "wallet", "percentage", "streak", "potted");

    private static final Pattern STANDALONE_NUMBER = Pattern.compile("\\b(\\d{3,4})\\b");
    private static final Pattern LONG_DIGIT_RUN = Pattern.compile("\\d{6,}");
    private static final Pattern TRAILING_SMALL_NUMBER = Pattern.compile("\\b(\\d{1,2})\\s*$");
    private static final Pattern TRAILING_LARGE_NUMBER = Pattern.compile("\\b(\\d{4,})\\s*$");
    private static final Pattern RANK_LABEL = Pattern.compile("rank\\s*[:\\-]?\\s*([a-z\\s]+)", Pattern.CASE_INSENSITIVE);

    private static final int EXPLICIT_PRIORITY = 10;
    private static final int STANDALONE_PRIORITY = 8;
    private static final int CONTEXT_WINDOW = 30;
    private static final int WINNINGS_LOOKBEHIND = 25;

    private final VerificationProperties.Matcher thresholds;

    @Autowired
    public RankMatcher(VerificationProperties props) {
        this(props.matcher());
    }

    public RankMatcher(VerificationProperties.Matcher thresholds) {
        this.thresholds = thresholds;
    }

    // ===== 公開 API =====

    /**
     * 從整段 OCR / 辨識文字比對段位。
     *
     * @return 比對結果；沒有任何訊號達到門檻時為 empty
     */
    public Optional<RankMatch> matchRank(String text, List<RankDefinition> ranks) {
        if (text == null || text.isBlank() || ranks.isEmpty()) {
            return Optional.empty();
        }

        String region = levelProgressRegion(text);
        Integer level = extractLevel(text, region);
        NameMatch nameMatch = extractRankName(region != null ? region : text, ranks);

        Optional<RankMatch> result = combine(nameMatch, level, ranks);
        if (result.isEmpty()) {
            log.info("[等級比對] 無法從文字比對段位: level={}", level);
        }
        return result;
    }

    /**
     * 以辨識服務提供的段位名稱直接做模糊比對（不需要標記區域）。
     */
    public Optional<RankMatch> matchRankByNameHint(String hint, List<RankDefinition> ranks) {
        NameMatch nameMatch = matchName(TextSimilarity.normalize(hint), ranks, false);
        if (nameMatch == null || nameMatch.score() < thresholds.fuzzyThreshold()) {
            return Optional.empty();
        }
        return Optional.of(new RankMatch(nameMatch.rank(), nameMatch.score(), null));
    }

    /**
     * 結合結構化辨識結果的兩個訊號（段位名稱 + 等級），採用與文字比對相同的交叉驗證規則。
     */
    public Optional<RankMatch> matchProfile(ExtractedProfile profile, List<RankDefinition> ranks) {
        if (profile == null || ranks.isEmpty()) {
            return Optional.empty();
        }
        NameMatch nameMatch = profile.hasRankName()
                ? matchName(TextSimilarity.normalize(profile.rankName()), ranks, false)
                : null;
        Optional<RankMatch> result = combine(nameMatch, profile.level(), ranks);
        if (result.isPresent()) {
            log.info("[等級比對] 比對結果: rank={}, confidence={}, level={}",
                    result.get().rankName(), result.get().confidence(), result.get().levelDetected());
        } else {
            log.info("[等級比對] 無法比對段位: rankName={}, level={}", profile.rankName(), profile.level());
        }
        return result;
    }

    /** 回傳等級區間包含 {@code level} 的段位（依設定順序取第一個） */
    public Optional<RankDefinition> rankForLevel(int level, List<RankDefinition> ranks) {
        return ranks.stream().filter(r -> r.containsLevel(level)).findFirst();
    }

    /** 以正規化後完全相同的名稱查找段位（管理指令用） */
    public Optional<RankDefinition> findByName(String name, List<RankDefinition> ranks) {
        String normalized = TextSimilarity.normalize(name);
        return ranks.stream()
                .filter(r -> TextSimilarity.normalize(r.displayName()).equals(normalized))
                .findFirst();
    }

    // ===== 訊號合併 =====

    private Optional<RankMatch> combine(NameMatch nameMatch, Integer level, List<RankDefinition> ranks) {
        RankDefinition fromLevel = level != null ? rankForLevel(level, ranks).orElse(null) : null;
        RankDefinition fromName = nameMatch != null ? nameMatch.rank() : null;
        double nameScore = nameMatch != null ? nameMatch.score() : 0.0;

        RankDefinition chosen;
        double confidence;
        if (fromName != null && fromLevel != null && fromName.token().equals(fromLevel.token())) {
            chosen = fromName;
            confidence = Math.max(nameScore, thresholds.crossValidatedFloor());
        } else if (fromName != null && nameScore >= thresholds.confidentNameThreshold()) {
            chosen = fromName;
            confidence = nameScore;
        } else if (fromLevel != null) {
            chosen = fromLevel;
            confidence = thresholds.levelOnlyConfidence();
        } else if (fromName != null && nameScore >= thresholds.fuzzyThreshold()) {
            chosen = fromName;
            confidence = nameScore;
        } else {
            return Optional.empty();
        }

        Integer keptLevel = null;
        if (level != null) {
            if (chosen.containsLevel(level)) {
                keptLevel = level;
            } else {
                log.debug("[等級比對] 等級 {} 不在段位 {} 區間 [{}, {}]，捨棄",
                        level, chosen.displayName(), chosen.levelMin(), chosen.levelMax());
            }
        }
        return Optional.of(new RankMatch(chosen, confidence, keptLevel));
    }

    // ===== 段位名稱 =====

    private NameMatch extractRankName(String searchText, List<RankDefinition> ranks) {
        Matcher label = RANK_LABEL.matcher(searchText);
        String candidate = label.find()
                ? TextSimilarity.normalize(label.group(1))
                : TextSimilarity.normalize(searchText);
        NameMatch match = matchName(candidate, ranks, true);
        return match != null && match.score() >= thresholds.fuzzyThreshold() ? match : null;
    }

    /**
     * 名稱比對的優先順序：
     * 完全包含（1.0）→ 部分包含（0.95）→ 最高相似度（同分取先出現者）。
     * 前兩者有多個段位符合時取名稱最長的，避免 Grandmaster 被判成 Master。
     *
     * @param allowSubstring 候選文字是較長的區域文字時，允許以「候選包含名稱」視為完全符合
     */
    private NameMatch matchName(String candidate, List<RankDefinition> ranks, boolean allowSubstring) {
        if (candidate.isEmpty()) {
            return null;
        }

        RankDefinition exact = null;
        for (RankDefinition rank : ranks) {
            String name = TextSimilarity.normalize(rank.displayName());
            if (name.isEmpty()) {
                continue;
            }
            boolean hit = allowSubstring ? candidate.contains(name) : candidate.equals(name);
            if (hit && (exact == null
                    || name.length() > TextSimilarity.normalize(exact.displayName()).length())) {
                exact = rank;
            }
        }
        if (exact != null) {
            return new NameMatch(exact, 1.0);
        }

        RankDefinition partial = null;
        for (RankDefinition rank : ranks) {
            String name = TextSimilarity.normalize(rank.displayName());
            if (!name.isEmpty() && (name.contains(candidate) || candidate.contains(name))
                    && (partial == null || name.length() > TextSimilarity.normalize(partial.displayName()).length())) {
                partial = rank;
            }
        }
        if (partial != null) {
            return new NameMatch(partial, 0.95);
        }

        NameMatch best = null;
        for (RankDefinition rank : ranks) {
            String name = TextSimilarity.normalize(rank.displayName());
            if (name.isEmpty()) {
                continue;
            }
            double score = TextSimilarity.similarity(candidate, name);
            if (best == null || score > best.score()) {
                best = new NameMatch(rank, score);
            }
        }
        return best;
    }

    // ===== 等級數字 =====

    /** 找到 "Level progress" 標記時，回傳標記起算加上 regionWidth 字元的區域；找不到時回傳 null */
    String levelProgressRegion(String text) {
        Matcher m = LANDMARK.matcher(text);
        if (!m.find()) {
            m = LANDMARK_FALLBACK.matcher(text);
            if (!m.find()) {
                return null;
            }
        }
        int end = Math.min(text.length(), m.end() + thresholds.regionWidth());
        return text.substring(m.start(), end);
    }

    Integer extractLevel(String text, String region) {
        String searchText = region != null ? region : text;
        List<LevelCandidate> candidates = new ArrayList<>();

        for (Pattern pattern : EXPLICIT_LEVEL) {
            Matcher m = pattern.matcher(searchText);
            while (m.find()) {
                Integer level = parseBounded(m.group(1));
                if (level != null) {
                    candidates.add(new LevelCandidate(level, EXPLICIT_PRIORITY));
                }
            }
        }

        if (region != null) {
            collectStandaloneNumbers(region, candidates);
        }

        if (!candidates.isEmpty()) {
            // 同優先級時偏好 100~999（最常見的等級範圍）；List.sort 為穩定排序，其餘維持出現順序
            candidates.sort(Comparator.comparingInt(LevelCandidate::priority).reversed()
                    .thenComparingInt(c -> c.level() >= 100 && c.level() <= 999 ? 0 : 1));
            return candidates.get(0).level();
        }

        return levelBeforeTotalWinnings(text);
    }

    private void collectStandaloneNumbers(String region, List<LevelCandidate> candidates) {
        List<int[]> statRanges = new ArrayList<>();
        for (Pattern pattern : STAT_CONTEXTS) {
            Matcher m = pattern.matcher(region);
            while (m.find()) {
                statRanges.add(new int[]{m.start(), m.end()});
            }
        }

        Matcher m = STANDALONE_NUMBER.matcher(region);
        while (m.find()) {
            int index = m.start();
            int level = Integer.parseInt(m.group(1));
            if (level < 100) {
                continue;
            }
            boolean inStat = statRanges.stream().anyMatch(r -> index >= r[0] && index <= r[1]);
            if (inStat) {
                continue;
            }

            String before = region.substring(Math.max(0, index - CONTEXT_WINDOW), index);
            String after = region.substring(m.end(), Math.min(region.length(), m.end() + CONTEXT_WINDOW));
            String context = (before + m.group() + after).toLowerCase();

            // 進度條數字（例如 8612122/9401159）
            if (context.contains("/") || LONG_DIGIT_RUN.matcher(context).find()) {
                continue;
            }
            Matcher small = TRAILING_SMALL_NUMBER.matcher(before);
            if (small.find() && Integer.parseInt(small.group(1)) < 100) {
                continue;
            }
            if (TRAILING_LARGE_NUMBER.matcher(before).find()) {
                continue;
            }
            if (STAT_KEYWORDS.stream().anyMatch(context::contains)) {
                continue;
            }
            candidates.add(new LevelCandidate(level, STANDALONE_PRIORITY));
        }
    }

    private static Integer levelBeforeTotalWinnings(String text) {
        int index = text.toLowerCase().indexOf("total winnings");
        if (index <= 0) {
            return null;
        }
        String digits = text.substring(Math.max(0, index - WINNINGS_LOOKBEHIND), index).replaceAll("\\D", "");
        if (digits.length() < 2 || digits.length() > 4) {
            return null;
        }
        return parseBounded(digits);
    }

    private static Integer parseBounded(String digits) {
        if (digits.length() > 4) {
            return null;
        }
        int level = Integer.parseInt(digits);
        return level >= 1 && level <= 9999 ? level : null;
    }

    private record NameMatch(RankDefinition rank, double score) {}

    private record LevelCandidate(int level, int priority) {}
}
