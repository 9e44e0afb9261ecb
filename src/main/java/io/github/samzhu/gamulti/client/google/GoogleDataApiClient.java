package io.github.samzhu.gamulti.client.google;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.analytics.data.v1beta.BetaAnalyticsDataClient;
import com.google.analytics.data.v1beta.DateRange;
import com.google.analytics.data.v1beta.Dimension;
import com.google.analytics.data.v1beta.DimensionHeader;
import com.google.analytics.data.v1beta.DimensionMetadata;
import com.google.analytics.data.v1beta.DimensionValue;
import com.google.analytics.data.v1beta.Filter;
import com.google.analytics.data.v1beta.FilterExpression;
import com.google.analytics.data.v1beta.FilterExpressionList;
import com.google.analytics.data.v1beta.GetMetadataRequest;
import com.google.analytics.data.v1beta.Metadata;
import com.google.analytics.data.v1beta.Metric;
import com.google.analytics.data.v1beta.MetricAggregation;
import com.google.analytics.data.v1beta.MetricHeader;
import com.google.analytics.data.v1beta.MetricMetadata;
import com.google.analytics.data.v1beta.MetricValue;
import com.google.analytics.data.v1beta.NumericValue;
import com.google.analytics.data.v1beta.OrderBy;
import com.google.analytics.data.v1beta.Row;
import com.google.analytics.data.v1beta.RunRealtimeReportRequest;
import com.google.analytics.data.v1beta.RunRealtimeReportResponse;
import com.google.analytics.data.v1beta.RunReportRequest;
import com.google.analytics.data.v1beta.RunReportResponse;
import com.google.api.gax.rpc.ApiException;

import io.github.samzhu.gamulti.client.DataApiClient;
import io.github.samzhu.gamulti.client.RealtimeRequest;
import io.github.samzhu.gamulti.client.ReportRequest;
import io.github.samzhu.gamulti.client.ReportTable;
import io.github.samzhu.gamulti.model.FieldFilter;
import io.github.samzhu.gamulti.model.OrderSpec;
import io.github.samzhu.gamulti.model.PropertyMetadata;
import io.github.samzhu.gamulti.model.QuerySpec;

/**
 * 以 GA4 Data API v1beta 實作的 {@link DataApiClient}。
 *
 * <p>報表查詢一律要求 {@link MetricAggregation#TOTAL}，讓多 Property 加總可以使用 API 計算的總計。
 *
 * @see <a href="https://developers.google.com/analytics/devguides/reporting/data/v1/rest/v1beta/properties/runReport">runReport</a>
 */
public class GoogleDataApiClient implements DataApiClient {

    private static final Logger log = LoggerFactory.getLogger(GoogleDataApiClient.class);

    private final BetaAnalyticsDataClient client;

    public GoogleDataApiClient(BetaAnalyticsDataClient client) {
        this.client = client;
    }

    @Override
    public ReportTable runReport(ReportRequest request) {
        try {
            RunReportResponse response = client.runReport(buildReportRequest(request));
            log.debug("runReport property={} rows={} rowCount={}",
                request.propertyId(), response.getRowsCount(), response.getRowCount());
            return toReportTable(response);
        } catch (ApiException e) {
            throw GoogleApiErrors.translate("runReport", e);
        }
    }

    @Override
    public ReportTable runRealtimeReport(RealtimeRequest request) {
        RunRealtimeReportRequest.Builder builder = RunRealtimeReportRequest.newBuilder()
            .setProperty(resourceName(request.propertyId()))
            .setLimit(request.rowLimit());
        request.metrics().forEach(m -> builder.addMetrics(Metric.newBuilder().setName(m)));
        request.dimensions().forEach(d -> builder.addDimensions(Dimension.newBuilder().setName(d)));
        try {
            RunRealtimeReportResponse response = client.runRealtimeReport(builder.build());
            return toTable(response.getDimensionHeadersList(), response.getMetricHeadersList(),
                response.getRowsList(), response.getRowCount(), response.getTotalsList());
        } catch (ApiException e) {
            throw GoogleApiErrors.translate("runRealtimeReport", e);
        }
    }

    @Override
    public PropertyMetadata getMetadata(String propertyId) {
        GetMetadataRequest request = GetMetadataRequest.newBuilder()
            .setName(resourceName(propertyId) + "/metadata")
            .build();
        try {
            return toMetadata(propertyId, client.getMetadata(request));
        } catch (ApiException e) {
            throw GoogleApiErrors.translate("getMetadata", e);
        }
    }

    static RunReportRequest buildReportRequest(ReportRequest request) {
        QuerySpec spec = request.spec();
        RunReportRequest.Builder builder = RunReportRequest.newBuilder()
            .setProperty(resourceName(request.propertyId()))
            .addDateRanges(DateRange.newBuilder()
                .setStartDate(spec.dateRange().start().toString())
                .setEndDate(spec.dateRange().end().toString()))
            .setLimit(spec.rowLimit())
            .addMetricAggregations(MetricAggregation.TOTAL);
        spec.metrics().forEach(m -> builder.addMetrics(Metric.newBuilder().setName(m)));
        spec.dimensions().forEach(d -> builder.addDimensions(Dimension.newBuilder().setName(d)));

        List<FilterExpression> dimensionFilters = new ArrayList<>();
        List<FilterExpression> metricFilters = new ArrayList<>();
        for (FieldFilter filter : spec.filters()) {
            FilterExpression expression = toFilterExpression(filter);
            if (spec.metrics().contains(filter.field())) {
                metricFilters.add(expression);
            } else {
                dimensionFilters.add(expression);
            }
        }
        if (!dimensionFilters.isEmpty()) {
            builder.setDimensionFilter(combine(dimensionFilters));
        }
        if (!metricFilters.isEmpty()) {
            builder.setMetricFilter(combine(metricFilters));
        }

        if (spec.orderBy() != null) {
            builder.addOrderBys(toOrderBy(spec.orderBy(), spec.metrics()));
        }
        return builder.build();
    }

    static FilterExpression toFilterExpression(FieldFilter filter) {
        Filter.Builder f = Filter.newBuilder().setFieldName(filter.field());
        switch (filter.operator()) {
            case IN_LIST -> f.setInListFilter(Filter.InListFilter.newBuilder()
                .addAllValues(filter.values())
                .setCaseSensitive(false));
            case GREATER_THAN, LESS_THAN, EQUAL -> f.setNumericFilter(Filter.NumericFilter.newBuilder()
                .setOperation(Filter.NumericFilter.Operation.valueOf(filter.operator().name()))
                .setValue(numericValue(filter.value())));
            default -> f.setStringFilter(Filter.StringFilter.newBuilder()
                .setMatchType(stringMatchType(filter.operator()))
                .setValue(filter.value())
                .setCaseSensitive(false));
        }
        return FilterExpression.newBuilder().setFilter(f).build();
    }

    static ReportTable toReportTable(RunReportResponse response) {
        return toTable(response.getDimensionHeadersList(), response.getMetricHeadersList(),
            response.getRowsList(), response.getRowCount(), response.getTotalsList());
    }

    static PropertyMetadata toMetadata(String propertyId, Metadata metadata) {
        List<PropertyMetadata.Field> dimensions = new ArrayList<>();
        List<PropertyMetadata.Field> customDimensions = new ArrayList<>();
        for (DimensionMetadata d : metadata.getDimensionsList()) {
            PropertyMetadata.Field field = new PropertyMetadata.Field(
                d.getApiName(), d.getUiName(), d.getDescription(), d.getCustomDefinition());
            (d.getCustomDefinition() ? customDimensions : dimensions).add(field);
        }
        List<PropertyMetadata.Field> metrics = new ArrayList<>();
        List<PropertyMetadata.Field> customMetrics = new ArrayList<>();
        for (MetricMetadata m : metadata.getMetricsList()) {
            PropertyMetadata.Field field = new PropertyMetadata.Field(
                m.getApiName(), m.getUiName(), m.getDescription(), m.getCustomDefinition());
            (m.getCustomDefinition() ? customMetrics : metrics).add(field);
        }
        return new PropertyMetadata(propertyId, dimensions, metrics, customDimensions, customMetrics);
    }

    private static ReportTable toTable(List<DimensionHeader> dimensionHeaders, List<MetricHeader> metricHeaders,
                                       List<Row> rows, int rowCount, List<Row> totals) {
        List<String> dims = dimensionHeaders.stream().map(DimensionHeader::getName).toList();
        List<String> mets = metricHeaders.stream().map(MetricHeader::getName).toList();

        List<ReportTable.Row> tableRows = new ArrayList<>(rows.size());
        for (Row row : rows) {
            tableRows.add(new ReportTable.Row(
                row.getDimensionValuesList().stream().map(DimensionValue::getValue).toList(),
                row.getMetricValuesList().stream().map(MetricValue::getValue).toList()));
        }

        Map<String, String> totalValues = new LinkedHashMap<>();
        if (!totals.isEmpty()) {
            List<MetricValue> values = totals.get(0).getMetricValuesList();
            for (int i = 0; i < mets.size() && i < values.size(); i++) {
                totalValues.put(mets.get(i), values.get(i).getValue());
            }
        }
        return new ReportTable(dims, mets, tableRows, rowCount, totalValues);
    }

    private static FilterExpression combine(List<FilterExpression> expressions) {
        if (expressions.size() == 1) {
            return expressions.get(0);
        }
        return FilterExpression.newBuilder()
            .setAndGroup(FilterExpressionList.newBuilder().addAllExpressions(expressions))
            .build();
    }

    private static OrderBy toOrderBy(OrderSpec order, List<String> metrics) {
        OrderBy.Builder builder = OrderBy.newBuilder().setDesc(order.desc());
        if (metrics.contains(order.field())) {
            builder.setMetric(OrderBy.MetricOrderBy.newBuilder().setMetricName(order.field()));
        } else {
            builder.setDimension(OrderBy.DimensionOrderBy.newBuilder().setDimensionName(order.field()));
        }
        return builder.build();
    }

    private static Filter.StringFilter.MatchType stringMatchType(FieldFilter.Operator operator) {
        return switch (operator) {
            case CONTAINS -> Filter.StringFilter.MatchType.CONTAINS;
            case BEGINS_WITH -> Filter.StringFilter.MatchType.BEGINS_WITH;
            case ENDS_WITH -> Filter.StringFilter.MatchType.ENDS_WITH;
            case REGEXP -> Filter.StringFilter.MatchType.PARTIAL_REGEXP;
            default -> Filter.StringFilter.MatchType.EXACT;
        };
    }

    private static NumericValue numericValue(String raw) {
        String value = raw.trim();
        if (value.contains(".")) {
            return NumericValue.newBuilder().setDoubleValue(Double.parseDouble(value)).build();
        }
        return NumericValue.newBuilder().setInt64Value(Long.parseLong(value)).build();
    }

    private static String resourceName(String propertyId) {
        return "properties/" + propertyId;
    }
}
