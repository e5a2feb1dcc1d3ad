package com.aiinpocket.rankverify.service.matching;

import java.util.Locale;

/**
 * 文字正規化與 Levenshtein 相似度。
 */
public final class TextSimilarity {

    private TextSimilarity() {
    }

    /**
     * 轉小寫、移除非文字字元、壓縮空白。OCR 雜訊與大小寫差異不影響比對。
     */
    public static String normalize(String text) {
        if (text == null) {
            return "";
        }
        return text.toLowerCase(Locale.ROOT)
                .replaceAll("[^\\w\\s]", "")
                .replaceAll("\\s+", " ")
                .trim();
    }

    public static int levenshtein(String a, String b) {
        int[] previous = new int[b.length() + 1];
        int[] current = new int[b.length() + 1];
        for (int j = 0; j <= b.length(); j++) {
            previous[j] = j;
        }
        for (int i = 1; i <= a.length(); i++) {
            current[0] = i;
            for (int j = 1; j <= b.length(); j++) {
                int cost = a.charAt(i - 1) == b.charAt(j - 1) ? 0 : 1;
                current[j] = Math.min(Math.min(current[j - 1] + 1, previous[j] + 1), previous[j - 1] + cost);
            }
            int[] swap = previous;
            previous = current;
            current = swap;
        }
        return previous[b.length()];
    }

    /**
     * 1 - 編輯距離 / 較長字串長度；兩個空字串視為完全相同。
     */
    public static double similarity(String a, String b) {
        int maxLength = Math.max(a.length(), b.length());
        if (maxLength == 0) {
            return 1.0;
        }
        return 1.0 - (double) levenshtein(a, b) / maxLength;
    }
}
