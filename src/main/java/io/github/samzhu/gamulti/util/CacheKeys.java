package io.github.samzhu.gamulti.util;

import java.nio.charset.StandardCharsets;
import java.util.stream.Collectors;

import org.springframework.util.DigestUtils;

import io.github.samzhu.gamulti.model.FieldFilter;
import io.github.samzhu.gamulti.model.QuerySpec;

/**
 * 快取鍵命名工具類。
 *
 * <p>鍵格式：
 * <ul>
 *   <li>{@code properties:list}</li>
 *   <li>{@code metadata:<propertyId>}</li>
 *   <li>{@code query:<propertyId>:<md5(查詢規格)>}</li>
 * </ul>
 */
public final class CacheKeys {

    public static final String PROPERTY_LIST = "properties:list";
    public static final String METADATA_PREFIX = "metadata:";
    public static final String QUERY_PREFIX = "query:";

    private CacheKeys() {
        // 工具類不允許實例化
    }

    public static String metadata(String propertyId) {
        return METADATA_PREFIX + propertyId;
    }

    /**
     * 產生查詢結果的快取鍵。
     *
     * <p>metric、dimension、日期、列數、篩選與排序任一不同都會產生不同的鍵；
     * metric 與 dimension 的順序會影響回傳欄位順序，因此不排序。
     *
     * @param propertyId Property 數字 ID
     * @param spec 查詢規格
     * @return 快取鍵
     */
    public static String query(String propertyId, QuerySpec spec) {
        return QUERY_PREFIX + propertyId + ":" + fingerprint(spec);
    }

    static String fingerprint(QuerySpec spec) {
        StringBuilder sb = new StringBuilder()
            .append("m=").append(String.join(",", spec.metrics()))
            .append("|d=").append(String.join(",", spec.dimensions()))
            .append("|r=").append(spec.dateRange().start()).append("..").append(spec.dateRange().end())
            .append("|l=").append(spec.rowLimit())
            .append("|f=").append(spec.filters().stream()
                .map(CacheKeys::describe)
                .collect(Collectors.joining(";")));
        if (spec.orderBy() != null) {
            sb.append("|o=").append(spec.orderBy().field()).append(spec.orderBy().desc() ? ":desc" : ":asc");
        }
        return DigestUtils.md5DigestAsHex(sb.toString().getBytes(StandardCharsets.UTF_8));
    }

    private static String describe(FieldFilter filter) {
        return filter.field() + ":" + filter.operator() + ":" + String.join(",", filter.values());
    }
}
