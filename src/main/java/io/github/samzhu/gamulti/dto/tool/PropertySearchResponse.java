package io.github.samzhu.gamulti.dto.tool;

import java.util.List;

import io.github.samzhu.gamulti.model.MatchResult;
import io.github.samzhu.gamulti.model.MatchResult.MatchType;

/**
 * search_properties 工具回應。
 *
 * @param query 搜尋字串
 * @param matches 依信心遞減排序的結果
 * @param count 結果數
 * @param bestMatch 信心最高的結果；沒有結果時為 null
 */
public record PropertySearchResponse(
    String query,
    List<MatchView> matches,
    int count,
    MatchView bestMatch
) {
    public static PropertySearchResponse from(String query, List<MatchResult> matches) {
        List<MatchView> views = matches.stream().map(MatchView::from).toList();
        return new PropertySearchResponse(query, views, views.size(), views.isEmpty() ? null : views.get(0));
    }

    /**
     * 單筆比對結果，信心分數取到小數第三位。
     */
    public record MatchView(
        String propertyId,
        String displayName,
        String accountName,
        double confidence,
        MatchType matchedOn
    ) {
        public static MatchView from(MatchResult match) {
            return new MatchView(
                match.property().numericId(),
                match.property().displayName(),
                match.property().accountName(),
                Math.round(match.confidence() * 1000) / 1000.0,
                match.matchedOn()
            );
        }
    }
}
