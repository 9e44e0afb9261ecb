package io.github.samzhu.gamulti.client.google;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.LocalDate;
import java.util.List;

import org.junit.jupiter.api.Test;

import com.google.analytics.data.v1beta.DimensionHeader;
import com.google.analytics.data.v1beta.DimensionMetadata;
import com.google.analytics.data.v1beta.DimensionValue;
import com.google.analytics.data.v1beta.Filter;
import com.google.analytics.data.v1beta.FilterExpression;
import com.google.analytics.data.v1beta.Metadata;
import com.google.analytics.data.v1beta.MetricAggregation;
import com.google.analytics.data.v1beta.MetricHeader;
import com.google.analytics.data.v1beta.MetricMetadata;
import com.google.analytics.data.v1beta.MetricValue;
import com.google.analytics.data.v1beta.Row;
import com.google.analytics.data.v1beta.RunReportRequest;
import com.google.analytics.data.v1beta.RunReportResponse;

import io.github.samzhu.gamulti.client.ReportRequest;
import io.github.samzhu.gamulti.client.ReportTable;
import io.github.samzhu.gamulti.model.DateRange;
import io.github.samzhu.gamulti.model.FieldFilter;
import io.github.samzhu.gamulti.model.OrderSpec;
import io.github.samzhu.gamulti.model.PropertyMetadata;
import io.github.samzhu.gamulti.model.QuerySpec;

class GoogleDataApiClientTest {

    private static final DateRange MARCH = new DateRange(LocalDate.of(2026, 3, 1), LocalDate.of(2026, 3, 31));

    @Test
    void shouldBuildBasicReportRequest() {
        // Given
        QuerySpec spec = QuerySpec.of(List.of("sessions", "activeUsers"), List.of("date"), MARCH, 250);

        // When
        RunReportRequest request = GoogleDataApiClient.buildReportRequest(new ReportRequest("111", spec));

        // Then
        assertThat(request.getProperty()).isEqualTo("properties/111");
        assertThat(request.getDateRanges(0).getStartDate()).isEqualTo("2026-03-01");
        assertThat(request.getDateRanges(0).getEndDate()).isEqualTo("2026-03-31");
        assertThat(request.getLimit()).isEqualTo(250);
        assertThat(request.getMetricsList()).extracting(m -> m.getName()).containsExactly("sessions", "activeUsers");
        assertThat(request.getDimensionsList()).extracting(d -> d.getName()).containsExactly("date");
        assertThat(request.getMetricAggregationsList()).containsExactly(MetricAggregation.TOTAL);
        assertThat(request.hasDimensionFilter()).isFalse();
        assertThat(request.hasMetricFilter()).isFalse();
    }

    @Test
    void shouldRouteFiltersByFieldKind() {
        // Given
        QuerySpec spec = new QuerySpec(List.of("sessions"), List.of("country"), MARCH, 100,
            List.of(
                new FieldFilter("country", FieldFilter.Operator.IN_LIST, List.of("Taiwan", "Japan")),
                new FieldFilter("pagePath", FieldFilter.Operator.REGEXP, List.of("^/blog")),
                new FieldFilter("sessions", FieldFilter.Operator.GREATER_THAN, List.of("10"))),
            null);

        // When
        RunReportRequest request = GoogleDataApiClient.buildReportRequest(new ReportRequest("111", spec));

        // Then: 兩個 dimension filter 以 AND 組合
        FilterExpression dimensionFilter = request.getDimensionFilter();
        assertThat(dimensionFilter.getAndGroup().getExpressionsList()).hasSize(2);
        Filter inList = dimensionFilter.getAndGroup().getExpressions(0).getFilter();
        assertThat(inList.getInListFilter().getValuesList()).containsExactly("Taiwan", "Japan");
        Filter regexp = dimensionFilter.getAndGroup().getExpressions(1).getFilter();
        assertThat(regexp.getStringFilter().getMatchType()).isEqualTo(Filter.StringFilter.MatchType.PARTIAL_REGEXP);

        Filter metricFilter = request.getMetricFilter().getFilter();
        assertThat(metricFilter.getFieldName()).isEqualTo("sessions");
        assertThat(metricFilter.getNumericFilter().getOperation())
            .isEqualTo(Filter.NumericFilter.Operation.GREATER_THAN);
        assertThat(metricFilter.getNumericFilter().getValue().getInt64Value()).isEqualTo(10L);
    }

    @Test
    void shouldOrderByMetricOrDimension() {
        QuerySpec byMetric = new QuerySpec(List.of("sessions"), List.of("country"), MARCH, 100,
            List.of(), new OrderSpec("sessions", true));
        QuerySpec byDimension = new QuerySpec(List.of("sessions"), List.of("country"), MARCH, 100,
            List.of(), new OrderSpec("country", false));

        RunReportRequest metricOrdered = GoogleDataApiClient.buildReportRequest(new ReportRequest("1", byMetric));
        RunReportRequest dimensionOrdered = GoogleDataApiClient.buildReportRequest(new ReportRequest("1", byDimension));

        assertThat(metricOrdered.getOrderBys(0).getMetric().getMetricName()).isEqualTo("sessions");
        assertThat(metricOrdered.getOrderBys(0).getDesc()).isTrue();
        assertThat(dimensionOrdered.getOrderBys(0).getDimension().getDimensionName()).isEqualTo("country");
        assertThat(dimensionOrdered.getOrderBys(0).getDesc()).isFalse();
    }

    @Test
    void shouldBuildCaseInsensitiveStringFilter() {
        FilterExpression expression = GoogleDataApiClient.toFilterExpression(
            new FieldFilter("city", FieldFilter.Operator.BEGINS_WITH, List.of("Tai")));

        Filter.StringFilter filter = expression.getFilter().getStringFilter();
        assertThat(filter.getMatchType()).isEqualTo(Filter.StringFilter.MatchType.BEGINS_WITH);
        assertThat(filter.getValue()).isEqualTo("Tai");
        assertThat(filter.getCaseSensitive()).isFalse();
    }

    @Test
    void shouldConvertResponseToTable() {
        // Given
        RunReportResponse response = RunReportResponse.newBuilder()
            .addDimensionHeaders(DimensionHeader.newBuilder().setName("country"))
            .addMetricHeaders(MetricHeader.newBuilder().setName("sessions"))
            .addRows(Row.newBuilder()
                .addDimensionValues(DimensionValue.newBuilder().setValue("Taiwan"))
                .addMetricValues(MetricValue.newBuilder().setValue("42")))
            .addTotals(Row.newBuilder()
                .addDimensionValues(DimensionValue.newBuilder().setValue("RESERVED_TOTAL"))
                .addMetricValues(MetricValue.newBuilder().setValue("99")))
            .setRowCount(7)
            .build();

        // When
        ReportTable table = GoogleDataApiClient.toReportTable(response);

        // Then
        assertThat(table.dimensionHeaders()).containsExactly("country");
        assertThat(table.metricHeaders()).containsExactly("sessions");
        assertThat(table.rows()).containsExactly(new ReportTable.Row(List.of("Taiwan"), List.of("42")));
        assertThat(table.totalRowCount()).isEqualTo(7);
        assertThat(table.totals()).containsEntry("sessions", "99");
    }

    @Test
    void shouldSplitCustomDefinitionsInMetadata() {
        // Given
        Metadata metadata = Metadata.newBuilder()
            .addDimensions(DimensionMetadata.newBuilder().setApiName("country").setUiName("Country"))
            .addDimensions(DimensionMetadata.newBuilder().setApiName("customEvent:plan").setCustomDefinition(true))
            .addMetrics(MetricMetadata.newBuilder().setApiName("sessions").setUiName("Sessions"))
            .build();

        // When
        PropertyMetadata result = GoogleDataApiClient.toMetadata("111", metadata);

        // Then
        assertThat(result.dimensions()).extracting(PropertyMetadata.Field::apiName).containsExactly("country");
        assertThat(result.customDimensions()).singleElement()
            .satisfies(f -> assertThat(f.custom()).isTrue());
        assertThat(result.metrics()).extracting(PropertyMetadata.Field::uiName).containsExactly("Sessions");
        assertThat(result.customMetrics()).isEmpty();
    }
}
