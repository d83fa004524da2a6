package dev.devanks.hlsarchive.aggregator.function;

import dev.devanks.hlsarchive.aggregator.exception.AggregationException;
import dev.devanks.hlsarchive.aggregator.exception.IncompleteLinksException;
import dev.devanks.hlsarchive.aggregator.model.AggregationResult;
import dev.devanks.hlsarchive.aggregator.model.MonthlyAggregationRequest;
import dev.devanks.hlsarchive.aggregator.service.MonthlyAggregator;
import dev.devanks.hlsarchive.core.config.ArchiveProperties;
import dev.devanks.hlsarchive.core.model.HlsCollection;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Mono;

import java.time.LocalDate;
import java.time.YearMonth;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("AggregateFunction Unit Tests")
class AggregateFunctionTest {

    @Mock
    private MonthlyAggregator mockAggregator;

    @Captor
    private ArgumentCaptor<MonthlyAggregationRequest> requestCaptor;

    private AggregateFunction aggregateFunction;

    @BeforeEach
    void setUp() {
        var properties = new ArchiveProperties();
        properties.getStorage().setDefaultDestination("s3://default/hls");
        aggregateFunction = new AggregateFunction(mockAggregator, properties);
    }

    private static Map<String, Object> payload(Object... keyValues) {
        var payload = new HashMap<String, Object>();
        for (int i = 0; i < keyValues.length; i += 2) {
            payload.put((String) keyValues[i], keyValues[i + 1]);
        }
        return payload;
    }

    @Test
    @DisplayName("parseYearMonth: dashed, compact and full-date forms")
    void parseYearMonth_formats() {
        assertThat(AggregateFunction.parseYearMonth("2024-02")).isEqualTo(YearMonth.of(2024, 2));
        assertThat(AggregateFunction.parseYearMonth("202402")).isEqualTo(YearMonth.of(2024, 2));
        assertThat(AggregateFunction.parseYearMonth("2024-02-17")).isEqualTo(YearMonth.of(2024, 2));
        assertThatThrownBy(() -> AggregateFunction.parseYearMonth("Feb 2024")).isInstanceOf(RuntimeException.class);
    }

    @Test
    @DisplayName("writeMonthlyGeoParquet: defaults and success summary")
    void writeMonthlyGeoParquet_success() {
        when(mockAggregator.aggregateMonth(any(MonthlyAggregationRequest.class))).thenReturn(Mono.just(AggregationResult.builder()
                .outputPath("s3://default/hls/v0.1.0/HLSL30.v2.0/year=2024/month=02/HLSL30.v2.0-2024-02.parquet")
                .itemCount(29).successCount(29).failureCount(2)
                .build()));

        var result = aggregateFunction.writeMonthlyGeoParquet().apply(payload("collection", "HLSL30", "year_month", "2024-02"));

        assertThat(result).isEqualTo("Wrote 29 items for HLSL30.v2.0 2024-02 to "
                + "s3://default/hls/v0.1.0/HLSL30.v2.0/year=2024/month=02/HLSL30.v2.0-2024-02.parquet"
                + " (2 fetch failures, 0 days without links)");
        verify(mockAggregator).aggregateMonth(requestCaptor.capture());
        var request = requestCaptor.getValue();
        assertThat(request.getCollection()).isEqualTo(HlsCollection.HLSL30);
        assertThat(request.getDestination()).isEqualTo("s3://default/hls");
        assertThat(request.getVersion()).isNull();
        assertThat(request.isRequireCompleteLinks()).isFalse();
        assertThat(request.isSkipExisting()).isFalse();
    }

    @Test
    @DisplayName("toRequest: explicit flags, dest and version")
    void toRequest_allFields() {
        var request = aggregateFunction.toRequest(payload("collection", "HLSS30", "year_month", "202401",
                "dest", "gs://mine", "version", "v1.0.0", "require_complete_links", true, "skip_existing", "TRUE"));

        assertThat(request.getYearMonth()).isEqualTo(YearMonth.of(2024, 1));
        assertThat(request.getDestination()).isEqualTo("gs://mine");
        assertThat(request.getVersion()).isEqualTo("v1.0.0");
        assertThat(request.isRequireCompleteLinks()).isTrue();
        assertThat(request.isSkipExisting()).isTrue();
    }

    @Test
    @DisplayName("writeMonthlyGeoParquet: incomplete links name the missing days")
    void writeMonthlyGeoParquet_incompleteLinks() {
        when(mockAggregator.aggregateMonth(any(MonthlyAggregationRequest.class)))
                .thenReturn(Mono.error(new IncompleteLinksException(List.of(LocalDate.of(2024, 1, 17)))));

        var result = aggregateFunction.writeMonthlyGeoParquet().apply(payload(
                "collection", "HLSL30", "year_month", "2024-01", "require_complete_links", true));

        assertThat(result).isEqualTo("Error: INCOMPLETE_LINKS: missing days [2024-01-17]");
    }

    @Test
    @DisplayName("writeMonthlyGeoParquet: other aggregation errors report their kind")
    void writeMonthlyGeoParquet_noLinks() {
        when(mockAggregator.aggregateMonth(any(MonthlyAggregationRequest.class)))
                .thenReturn(Mono.error(new AggregationException(AggregationException.Kind.NO_LINKS, "No item links")));

        var result = aggregateFunction.writeMonthlyGeoParquet().apply(payload("collection", "HLSL30", "year_month", "2024-01"));

        assertThat(result).isEqualTo("Error: NO_LINKS: No item links");
    }

    @Test
    @DisplayName("writeMonthlyGeoParquet: skipped runs say so")
    void writeMonthlyGeoParquet_skipped() {
        when(mockAggregator.aggregateMonth(any(MonthlyAggregationRequest.class))).thenReturn(Mono.just(AggregationResult.builder()
                .outputPath("s3://x.parquet").skipped(true).build()));

        var result = aggregateFunction.writeMonthlyGeoParquet().apply(payload(
                "collection", "HLSL30", "year_month", "2024-01", "skip_existing", true));

        assertThat(result).isEqualTo("Skipped HLSL30.v2.0 2024-01: s3://x.parquet already exists");
    }

    @Test
    @DisplayName("writeMonthlyGeoParquet: invalid payloads return errors without aggregating")
    void writeMonthlyGeoParquet_invalidPayloads() {
        assertThat(aggregateFunction.writeMonthlyGeoParquet().apply(payload("year_month", "2024-01")))
                .startsWith("Error:").contains("'collection'");
        assertThat(aggregateFunction.writeMonthlyGeoParquet().apply(payload("collection", "HLSL30")))
                .startsWith("Error:").contains("'year_month'");
        assertThat(aggregateFunction.writeMonthlyGeoParquet().apply(payload("collection", "HLSL30", "year_month", "2024-13")))
                .startsWith("Error:");
        assertThat(aggregateFunction.writeMonthlyGeoParquet().apply(payload("collection", "HLSL30", "year_month", "2024-01",
                "require_complete_links", "maybe")))
                .startsWith("Error:").contains("require_complete_links");
        verifyNoInteractions(mockAggregator);
    }
}
