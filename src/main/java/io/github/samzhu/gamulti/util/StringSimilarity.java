package io.github.samzhu.gamulti.util;

import java.util.Locale;

/**
 * Property 名稱的字串相似度計算。
 *
 * <p>分數只取決於正規化後的字串：
 * <ul>
 *   <li>相同字串為 1.0</li>
 *   <li>沒有任何共同字元為 0.0</li>
 *   <li>分數取「編輯距離相似度」與「包含分數」兩者較大者</li>
 * </ul>
 */
public final class StringSimilarity {

    private StringSimilarity() {
        // 工具類不允許實例化
    }

    /**
     * 轉小寫，將連續的非英數字元換成單一空白，並去除頭尾空白。
     */
    public static String normalize(String value) {
        if (value == null) {
            return "";
        }
        return value.toLowerCase(Locale.ROOT)
            .replaceAll("[^\\p{L}\\p{N}]+", " ")
            .trim();
    }

    /**
     * 正規化後移除所有空白。
     */
    public static String compact(String value) {
        return normalize(value).replace(" ", "");
    }

    /**
     * 計算查詢字串與候選名稱的相似度。
     *
     * @return 範圍 [0, 1] 的分數
     */
    public static double score(String query, String candidate) {
        String q = compact(query);
        String c = compact(candidate);
        if (q.isEmpty() || c.isEmpty()) {
            return 0.0;
        }
        if (q.equals(c)) {
            return 1.0;
        }
        if (!shareAnyCharacter(q, c)) {
            return 0.0;
        }
        return Math.max(editSimilarity(q, c), containmentScore(q, c));
    }

    /**
     * 包含分數：查詢字串為候選名稱的子字串時為 {@code 0.7 + 0.3 * |q| / |c|}，否則為 0。
     */
    public static double containmentScore(String compactQuery, String compactCandidate) {
        if (compactCandidate.isEmpty() || !compactCandidate.contains(compactQuery)) {
            return 0.0;
        }
        return 0.7 + 0.3 * compactQuery.length() / compactCandidate.length();
    }

    /**
     * 正規化的編輯距離相似度 {@code 1 - d / max(|a|, |b|)}。
     */
    public static double editSimilarity(String a, String b) {
        int maxLen = Math.max(a.length(), b.length());
        if (maxLen == 0) {
            return 1.0;
        }
        return 1.0 - (double) levenshtein(a, b) / maxLen;
    }

    /**
     * Levenshtein 編輯距離，使用兩列滾動陣列。
     */
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
                current[j] = Math.min(
                    Math.min(current[j - 1] + 1, previous[j] + 1),
                    previous[j - 1] + cost);
            }
            int[] swap = previous;
            previous = current;
            current = swap;
        }
        return previous[b.length()];
    }

    private static boolean shareAnyCharacter(String a, String b) {
        for (int i = 0; i < a.length(); i++) {
            if (b.indexOf(a.charAt(i)) >= 0) {
                return true;
            }
        }
        return false;
    }
}
