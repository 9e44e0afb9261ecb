package io.github.samzhu.gamulti.service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import io.github.samzhu.gamulti.config.GaMultiProperties;
import io.github.samzhu.gamulti.exception.PropertyNotFoundException;
import io.github.samzhu.gamulti.model.MatchResult;
import io.github.samzhu.gamulti.model.MatchResult.MatchType;
import io.github.samzhu.gamulti.model.Property;
import io.github.samzhu.gamulti.util.StringSimilarity;

/**
 * 將自然語言的 Property 參照解析為 {@link Property}。
 *
 * <p>解析順序：
 * <ol>
 *   <li>數字 ID（或 {@code properties/<id>}）完全相符，信心 1.0，不受門檻限制</li>
 *   <li>別名相符，信心 1.0，不受門檻限制</li>
 *   <li>對每個 Property 的顯示名稱計算 {@link StringSimilarity#score}，保留不低於門檻者</li>
 * </ol>
 *
 * <p>結果依信心遞減排序；同分時顯示名稱較短者優先，再依數字 ID 字典序。
 */
@Service
public class FuzzyPropertyResolver {

    private static final Logger log = LoggerFactory.getLogger(FuzzyPropertyResolver.class);

    private static final String RESOURCE_PREFIX = "properties/";
    private static final int MAX_SUGGESTIONS = 3;
    private static final int DEFAULT_SEARCH_RESULTS = 5;
    private static final double TIE_EPSILON = 1e-9;

    private static final Comparator<MatchResult> BEST_FIRST = Comparator
        .comparingDouble(MatchResult::confidence).reversed()
        .thenComparingInt(m -> m.property().displayName().length())
        .thenComparing(m -> m.property().numericId());

    private final PropertyRegistry registry;
    private final PropertyAliases aliases;
    private final double fuzzyThreshold;
    private final double searchThreshold;

    public FuzzyPropertyResolver(
            PropertyRegistry registry,
            PropertyAliases aliases,
            GaMultiProperties properties) {
        this.registry = registry;
        this.aliases = aliases;
        this.fuzzyThreshold = properties.resolver().fuzzyThreshold();
        this.searchThreshold = properties.resolver().searchThreshold();
    }

    /**
     * 以 {@code ga.resolver.fuzzy-threshold} 解析。
     */
    public List<MatchResult> resolve(String query) {
        return resolve(query, fuzzyThreshold);
    }

    /**
     * 解析 Property 參照。
     *
     * @param query 顯示名稱、別名、數字 ID 或 {@code properties/<id>}
     * @param threshold 最低信心分數
     * @return 依信心遞減排序的結果；空查詢或沒有任何 Property 時為空清單
     * @throws io.github.samzhu.gamulti.exception.DiscoveryFailedException Property 清單無法取得
     */
    public List<MatchResult> resolve(String query, double threshold) {
        if (query == null || query.isBlank()) {
            return List.of();
        }
        List<Property> properties = registry.listProperties();
        if (properties.isEmpty()) {
            return List.of();
        }

        String trimmed = query.trim();
        String id = trimmed.startsWith(RESOURCE_PREFIX) ? trimmed.substring(RESOURCE_PREFIX.length()) : trimmed;
        Optional<Property> byId = findById(properties, id);
        if (byId.isPresent()) {
            return List.of(new MatchResult(byId.get(), 1.0, MatchType.EXACT_ID));
        }

        Optional<Property> byAlias = aliases.canonicalFor(trimmed)
            .flatMap(canonical -> findCanonical(properties, canonical));
        if (byAlias.isPresent()) {
            return List.of(new MatchResult(byAlias.get(), 1.0, MatchType.ALIAS));
        }

        String normalizedQuery = StringSimilarity.normalize(trimmed);
        String compactQuery = StringSimilarity.compact(trimmed);
        List<MatchResult> matches = new ArrayList<>();
        for (Property property : properties) {
            MatchResult match = score(property, normalizedQuery, compactQuery);
            if (match != null && match.confidence() >= threshold) {
                matches.add(match);
            }
        }
        matches.sort(BEST_FIRST);

        log.debug("Resolved '{}' (threshold={}): {} matches", query, threshold, matches.size());
        return List.copyOf(matches);
    }

    /**
     * 解析並回傳最佳結果。
     *
     * @throws PropertyNotFoundException 沒有任何結果超過門檻
     */
    public MatchResult resolveRequired(String query) {
        List<MatchResult> matches = resolve(query);
        if (matches.isEmpty()) {
            throw notFound(query);
        }
        return matches.get(0);
    }

    /**
     * 以寬鬆門檻 {@code ga.resolver.search-threshold} 搜尋。
     *
     * @param maxResults 最多回傳筆數，非正數時為 5
     */
    public List<MatchResult> search(String query, int maxResults) {
        int limit = maxResults > 0 ? maxResults : DEFAULT_SEARCH_RESULTS;
        List<MatchResult> matches = resolve(query, searchThreshold);
        return matches.size() <= limit ? matches : matches.subList(0, limit);
    }

    /**
     * 回傳與最佳結果同分的其他結果。
     *
     * @param matches {@link #resolve} 的結果
     */
    public List<MatchResult> ambiguousWith(List<MatchResult> matches) {
        if (matches.size() < 2) {
            return List.of();
        }
        double best = matches.get(0).confidence();
        return matches.subList(1, matches.size()).stream()
            .filter(m -> Math.abs(m.confidence() - best) < TIE_EPSILON)
            .toList();
    }

    /**
     * 建立附帶建議名稱的 {@link PropertyNotFoundException}。
     */
    public PropertyNotFoundException notFound(String query) {
        List<String> suggestions = query == null || query.isBlank()
            ? List.of()
            : search(query, MAX_SUGGESTIONS).stream()
                .map(m -> m.property().displayName() + " (" + m.property().numericId() + ")")
                .toList();
        log.info("Property '{}' not found, suggestions={}", query, suggestions);
        return new PropertyNotFoundException(query, suggestions);
    }

    private MatchResult score(Property property, String normalizedQuery, String compactQuery) {
        String name = property.displayName();
        if (StringSimilarity.normalize(name).equals(normalizedQuery)) {
            return new MatchResult(property, 1.0, MatchType.EXACT_NAME);
        }
        double score = StringSimilarity.score(normalizedQuery, name);
        if (score <= 0.0) {
            return null;
        }
        double containment = StringSimilarity.containmentScore(compactQuery, StringSimilarity.compact(name));
        MatchType type = containment > 0.0 && containment >= score ? MatchType.PARTIAL : MatchType.FUZZY;
        return new MatchResult(property, Math.min(1.0, score), type);
    }

    private static Optional<Property> findById(List<Property> properties, String id) {
        return properties.stream().filter(p -> p.numericId().equals(id)).findFirst();
    }

    private static Optional<Property> findCanonical(List<Property> properties, String canonical) {
        String normalized = StringSimilarity.normalize(canonical);
        return properties.stream()
            .filter(p -> p.numericId().equals(canonical.trim())
                || StringSimilarity.normalize(p.displayName()).equals(normalized))
            .findFirst();
    }
}
