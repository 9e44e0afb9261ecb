package io.github.samzhu.gamulti.dto.tool;

/**
 * clear_cache 工具回應。
 *
 * @param clearedEntries 清除的項目數
 * @param pattern 比對字串，未指定時為 null
 * @param message 說明
 */
public record CacheClearResponse(
    int clearedEntries,
    String pattern,
    String message
) {
    public static CacheClearResponse of(int clearedEntries, String pattern) {
        String message = "Cleared " + clearedEntries + " cache entries"
            + (pattern == null || pattern.isEmpty() ? "" : " matching '" + pattern + "'");
        return new CacheClearResponse(clearedEntries, pattern, message);
    }
}
