package io.github.samzhu.gamulti.tools;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.databind.ObjectMapper;

import io.github.samzhu.gamulti.config.GaMultiProperties;
import io.github.samzhu.gamulti.dto.tool.AnalyticsQueryResponse;
import io.github.samzhu.gamulti.dto.tool.DateRangeView;
import io.github.samzhu.gamulti.dto.tool.MultiPropertyQueryResponse;
import io.github.samzhu.gamulti.model.DateRange;
import io.github.samzhu.gamulti.model.FieldFilter;
import io.github.samzhu.gamulti.model.MultiPropertyReport;
import io.github.samzhu.gamulti.model.OrderSpec;
import io.github.samzhu.gamulti.model.QueryResult;
import io.github.samzhu.gamulti.model.QuerySpec;
import io.github.samzhu.gamulti.service.QueryOrchestrator;
import io.github.samzhu.gamulti.util.DateExpressionParser;
import io.modelcontextprotocol.server.McpSyncServer;
import io.modelcontextprotocol.spec.McpSchema.CallToolResult;
import io.modelcontextprotocol.spec.McpSchema.Tool;

/**
 * 報表查詢相關工具：query_analytics、query_multiple_properties、query_realtime。
 *
 * <p>日期參數接受自然語言表達式（見 {@link DateExpressionParser}）；
 * 未指定 limit 時使用 {@code ga.query.default-row-limit}，超過 {@code ga.query.max-row-limit} 時截斷。
 */
public class QueryToolProvider extends AbstractToolProvider {

    private static final String DATE_HINT = "YYYY-MM-DD, MM/DD/YYYY, today, yesterday, 7daysAgo, "
        + "last week, this month, ytd, ...";

    private final QueryOrchestrator orchestrator;
    private final DateExpressionParser dateParser;
    private final GaMultiProperties.QueryConfig queryConfig;

    public QueryToolProvider(
            McpSyncServer server,
            ObjectMapper json,
            QueryOrchestrator orchestrator,
            DateExpressionParser dateParser,
            GaMultiProperties properties) {
        super(server, json);
        this.orchestrator = orchestrator;
        this.dateParser = dateParser;
        this.queryConfig = properties.query();
    }

    @Override
    public void registerTools() {
        registerQueryAnalytics();
        registerQueryMultipleProperties();
        registerQueryRealtime();
    }

    private void registerQueryAnalytics() {
        Map<String, Object> schema = new LinkedHashMap<>();
        schema.put("property", stringProperty("Property name, alias or ID (fuzzy matching supported)"));
        schema.put("metrics", stringArrayProperty("Metrics to query, e.g. [\"activeUsers\", \"sessions\"]"));
        schema.put("dimensions", stringArrayProperty("Dimensions to group by, e.g. [\"date\", \"country\"]"));
        schema.put("start_date", stringProperty("Start date: " + DATE_HINT));
        schema.put("end_date", stringProperty("End date: " + DATE_HINT));
        schema.put("limit", integerProperty("Maximum rows to return (default " + queryConfig.defaultRowLimit() + ")"));
        schema.put("filters", Map.of(
            "type", "array",
            "description", "Filter conditions [{field, operator, value | values}]; operator is one of EXACT, "
                + "CONTAINS, BEGINS_WITH, ENDS_WITH, REGEXP, GREATER_THAN, LESS_THAN, EQUAL, IN_LIST",
            "items", Map.of("type", "object")));
        schema.put("order_by", Map.of(
            "type", "object",
            "description", "Ordering {field, desc}; desc defaults to true"));

        Tool tool = Tool.builder()
            .name("query_analytics")
            .description("Query GA4 report data for a single property. Supports fuzzy property names, "
                + "natural language dates, filters and ordering.")
            .inputSchema(createSchema(schema, List.of("property", "metrics", "start_date", "end_date")))
            .build();

        registerTool(tool, args -> {
            String property = getString(args, "property");
            QuerySpec spec = buildSpec(args);
            QueryResult result = orchestrator.querySingle(property, spec);
            if (!result.isSuccess()) {
                return createErrorResult(result.error());
            }
            return createJsonResult(new AnalyticsQueryResponse(describe(spec.dateRange()), result));
        });
    }

    private void registerQueryMultipleProperties() {
        Map<String, Object> schema = new LinkedHashMap<>();
        schema.put("properties", stringArrayProperty("Property names, aliases or IDs to query"));
        schema.put("metrics", stringArrayProperty("Metrics to query across all properties"));
        schema.put("dimensions", stringArrayProperty("Optional dimensions to group by"));
        schema.put("start_date", stringProperty("Start date: " + DATE_HINT));
        schema.put("end_date", stringProperty("End date: " + DATE_HINT));
        schema.put("limit", integerProperty("Maximum rows per property (default " + queryConfig.defaultRowLimit() + ")"));

        Tool tool = Tool.builder()
            .name("query_multiple_properties")
            .description("Run the same query against several properties concurrently. A failing property "
                + "is reported in its own result without failing the others; the summary totals only "
                + "include successful properties.")
            .inputSchema(createSchema(schema, List.of("properties", "metrics", "start_date", "end_date")))
            .build();

        registerTool(tool, args -> {
            List<String> properties = getStringList(args, "properties");
            QuerySpec spec = QuerySpec.of(
                getStringList(args, "metrics"),
                getOptionalStringList(args, "dimensions", List.of()),
                parseRange(args),
                queryConfig.effectiveLimit(getOptionalInteger(args, "limit", null)));
            MultiPropertyReport report = orchestrator.queryMultiple(properties, spec);
            return createJsonResult(
                MultiPropertyQueryResponse.from(report, dateParser.describe(report.dateRange())));
        });
    }

    private void registerQueryRealtime() {
        Map<String, Object> schema = new LinkedHashMap<>();
        schema.put("property", stringProperty("Property name, alias or ID (fuzzy matching supported)"));
        schema.put("metrics", stringArrayProperty("Realtime metrics (default [\"activeUsers\"])"));
        schema.put("dimensions", stringArrayProperty("Realtime dimensions, e.g. [\"country\", \"unifiedScreenName\"]"));
        schema.put("limit", integerProperty("Maximum rows to return (default 100)"));

        Tool tool = Tool.builder()
            .name("query_realtime")
            .description("Query realtime data (last 30 minutes) for a single property. Never cached.")
            .inputSchema(createSchema(schema, List.of("property")))
            .build();

        registerTool(tool, args -> createJsonResult(orchestrator.queryRealtime(
            getString(args, "property"),
            getOptionalStringList(args, "metrics", List.of()),
            getOptionalStringList(args, "dimensions", List.of()),
            getOptionalInteger(args, "limit", null))));
    }

    private QuerySpec buildSpec(Map<String, Object> args) {
        return new QuerySpec(
            getStringList(args, "metrics"),
            getOptionalStringList(args, "dimensions", List.of()),
            parseRange(args),
            queryConfig.effectiveLimit(getOptionalInteger(args, "limit", null)),
            parseFilters(getOptionalMapList(args, "filters")),
            parseOrder(getOptionalMap(args, "order_by")));
    }

    private DateRange parseRange(Map<String, Object> args) {
        return dateParser.parseRange(getString(args, "start_date"), getString(args, "end_date"));
    }

    private DateRangeView describe(DateRange range) {
        return DateRangeView.of(range, dateParser.describe(range));
    }

    static List<FieldFilter> parseFilters(List<Map<String, Object>> raw) {
        List<FieldFilter> filters = new ArrayList<>(raw.size());
        for (Map<String, Object> item : raw) {
            Object field = item.get("field");
            Object operator = item.get("operator");
            List<String> values = new ArrayList<>();
            Object listValue = item.get("values");
            if (listValue instanceof List<?> list) {
                list.forEach(v -> values.add(String.valueOf(v)));
            }
            Object singleValue = item.get("value");
            if (singleValue instanceof List<?> list) {
                list.forEach(v -> values.add(String.valueOf(v)));
            } else if (singleValue != null) {
                values.add(String.valueOf(singleValue));
            }
            filters.add(new FieldFilter(
                field == null ? null : field.toString(),
                FieldFilter.Operator.from(operator == null ? null : operator.toString()),
                values));
        }
        return filters;
    }

    static OrderSpec parseOrder(Map<String, Object> raw) {
        if (raw == null || raw.isEmpty()) {
            return null;
        }
        Object field = raw.get("field");
        Object desc = raw.get("desc");
        boolean descending = desc == null || (desc instanceof Boolean b ? b : Boolean.parseBoolean(desc.toString()));
        return new OrderSpec(field == null ? null : field.toString(), descending);
    }
}
