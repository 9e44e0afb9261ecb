package io.github.samzhu.gamulti.exception;

import java.util.List;

/**
 * 找不到 Property 例外。
 *
 * <p>模糊比對沒有任何結果超過門檻，或以 ID 查詢時清單中不存在該 Property。
 * 訊息中會附上寬鬆搜尋得到的建議名稱（若有）。
 */
public class PropertyNotFoundException extends AnalyticsException {

    private final String query;
    private final List<String> suggestions;

    public PropertyNotFoundException(String query, List<String> suggestions) {
        super(ErrorKind.PROPERTY_NOT_FOUND,
            String.format("Property '%s' not found. Did you mean: %s", query,
                suggestions.isEmpty() ? "no similar properties found" : String.join(", ", suggestions)),
            "Try list_properties or search_properties to find the exact property name or ID");
        this.query = query;
        this.suggestions = List.copyOf(suggestions);
    }

    public String getQuery() {
        return query;
    }

    public List<String> getSuggestions() {
        return suggestions;
    }
}
