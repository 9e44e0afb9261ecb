package io.github.samzhu.gamulti.model;

/**
 * 單次解析產生的比對結果，不會被快取。
 *
 * @param property 比對到的 Property
 * @param confidence 信心分數，範圍 [0, 1]
 * @param matchedOn 比對方式
 */
public record MatchResult(
    Property property,
    double confidence,
    MatchType matchedOn
) {
    public MatchResult {
        if (confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("Confidence must be within [0, 1], got: " + confidence);
        }
    }

    /**
     * 比對方式。
     */
    public enum MatchType {
        /** 數字 ID 完全相符 */
        EXACT_ID,
        /** 使用者設定的別名 */
        ALIAS,
        /** 正規化後的顯示名稱完全相符 */
        EXACT_NAME,
        /** 查詢字串包含於顯示名稱中 */
        PARTIAL,
        /** 編輯距離相似度 */
        FUZZY
    }
}
