package io.github.samzhu.gamulti.service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

import io.github.samzhu.gamulti.config.GaMultiProperties.ResolverConfig;
import io.github.samzhu.gamulti.exception.ConfigurationException;
import io.github.samzhu.gamulti.util.StringSimilarity;

/**
 * 使用者設定的 Property 別名。
 *
 * <p>設定方向為「標準名稱 → 別名清單」，標準名稱可以是 Property 顯示名稱或數字 ID。
 * 查詢時以正規化後的字串比對，不分大小寫與標點。
 */
public class PropertyAliases {

    private static final TypeReference<Map<String, List<String>>> ALIAS_MAP = new TypeReference<>() {};

    private final Map<String, String> canonicalByAlias;

    public PropertyAliases(Map<String, List<String>> aliases) {
        Map<String, String> index = new LinkedHashMap<>();
        aliases.forEach((canonical, names) -> {
            if (names != null) {
                for (String alias : names) {
                    String key = StringSimilarity.normalize(alias);
                    if (!key.isEmpty()) {
                        index.putIfAbsent(key, canonical);
                    }
                }
            }
        });
        this.canonicalByAlias = Map.copyOf(index);
    }

    public static PropertyAliases empty() {
        return new PropertyAliases(Map.of());
    }

    /**
     * 合併 {@code ga.resolver.aliases} 與 {@code ga.resolver.aliases-json}（JSON 優先）。
     *
     * @throws ConfigurationException JSON 格式錯誤
     */
    public static PropertyAliases from(ResolverConfig config, ObjectMapper objectMapper) {
        Map<String, List<String>> merged = new LinkedHashMap<>(config.aliases());
        String json = config.aliasesJson();
        if (json != null && !json.isBlank()) {
            try {
                Map<String, List<String>> parsed = objectMapper.readValue(json, ALIAS_MAP);
                if (parsed != null) {
                    merged.putAll(parsed);
                }
            } catch (JsonProcessingException e) {
                throw new ConfigurationException(
                    "GA_PROPERTY_ALIASES is not valid JSON (expected {\"name\": [\"alias\", ...]}): "
                        + e.getOriginalMessage(), e);
            }
        }
        return new PropertyAliases(merged);
    }

    /**
     * 查詢別名對應的標準名稱。
     */
    public Optional<String> canonicalFor(String alias) {
        return Optional.ofNullable(canonicalByAlias.get(StringSimilarity.normalize(alias)));
    }

    public int size() {
        return canonicalByAlias.size();
    }
}
