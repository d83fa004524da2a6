package dev.devanks.hlsarchive.harvester.function;

import dev.devanks.hlsarchive.core.config.ArchiveProperties;
import dev.devanks.hlsarchive.core.model.HlsCollection;
import dev.devanks.hlsarchive.core.model.LinkProtocol;
import dev.devanks.hlsarchive.harvester.exception.CatalogUnavailableException;
import dev.devanks.hlsarchive.harvester.exception.HarvestFailedException;
import dev.devanks.hlsarchive.harvester.exception.RangeHarvestFailedException;
import dev.devanks.hlsarchive.harvester.model.HarvestRequest;
import dev.devanks.hlsarchive.harvester.model.HarvestResult;
import dev.devanks.hlsarchive.harvester.service.DailyHarvester;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.LocalDate;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("HarvestFunction Unit Tests")
class HarvestFunctionTest {

    private static final LocalDate DAY = LocalDate.of(2024, 1, 15);

    @Mock
    private DailyHarvester mockDailyHarvester;

    @Captor
    private ArgumentCaptor<HarvestRequest> requestCaptor;

    private HarvestFunction harvestFunction;

    @BeforeEach
    void setUp() {
        var properties = new ArchiveProperties();
        properties.getStorage().setDefaultDestination("gs://default-bucket/hls");
        harvestFunction = new HarvestFunction(mockDailyHarvester, properties);
    }

    private static Map<String, Object> payload(Object... keyValues) {
        var payload = new HashMap<String, Object>();
        for (int i = 0; i < keyValues.length; i += 2) {
            payload.put((String) keyValues[i], keyValues[i + 1]);
        }
        return payload;
    }

    @Test
    @DisplayName("cacheDailyLinks: single day with defaults")
    void cacheDailyLinks_singleDay_defaults() {
        when(mockDailyHarvester.harvestDay(any())).thenReturn(HarvestResult.builder()
                .collection(HlsCollection.HLSL30).date(DAY).manifestLocation("gs://default-bucket/hls/links/x.json")
                .written(true).linkCount(12).build());

        var result = harvestFunction.cacheDailyLinks().apply(payload("collection", "HLSL30", "date", "2024-01-15"));

        assertThat(result).isEqualTo("Cached 12 links for HLSL30.v2.0 on 2024-01-15 at gs://default-bucket/hls/links/x.json");
        verify(mockDailyHarvester).harvestDay(requestCaptor.capture());
        var request = requestCaptor.getValue();
        assertThat(request.getDestination()).isEqualTo("gs://default-bucket/hls");
        assertThat(request.getProtocol()).isEqualTo(LinkProtocol.OBJECT_STORE);
        assertThat(request.isSkipExisting()).isTrue();
        assertThat(request.getBoundingBox()).isNull();
    }

    @Test
    @DisplayName("toRequest: explicit dest, https protocol, bounding box and skip_existing=false")
    void toRequest_allFields() {
        var request = harvestFunction.toRequest(payload(
                "collection", "hlss30", "date", "2024-01-15", "dest", "s3://mine",
                "protocol", "https", "bounding_box", List.of(-10, -5.5, 10, 5.5), "skip_existing", "false"));

        assertThat(request.getCollection()).isEqualTo(HlsCollection.HLSS30);
        assertThat(request.getDestination()).isEqualTo("s3://mine");
        assertThat(request.getProtocol()).isEqualTo(LinkProtocol.HTTPS);
        assertThat(request.getBoundingBox().getSouth()).isEqualTo(-5.5);
        assertThat(request.isSkipExisting()).isFalse();
    }

    @Test
    @DisplayName("cacheDailyLinks: date range delegates to harvestRange")
    void cacheDailyLinks_range() {
        var start = LocalDate.of(2024, 1, 1);
        var end = LocalDate.of(2024, 1, 2);
        when(mockDailyHarvester.harvestRange(any(), any(), any())).thenReturn(List.of(
                HarvestResult.builder().collection(HlsCollection.HLSL30).date(start).written(true).linkCount(3).build(),
                HarvestResult.builder().collection(HlsCollection.HLSL30).date(end).written(false).build()));

        var result = harvestFunction.cacheDailyLinks().apply(payload(
                "collection", "HLSL30", "start_date", "2024-01-01", "end_date", "2024-01-02"));

        verify(mockDailyHarvester).harvestRange(requestCaptor.capture(), any(), any());
        assertThat(requestCaptor.getValue().getDate()).isEqualTo(start);
        assertThat(result).isEqualTo("Harvested HLSL30.v2.0 from 2024-01-01 to 2024-01-02: 1 days written, 1 skipped, 3 links cached");
    }

    @Test
    @DisplayName("cacheDailyLinks: a partly failed range reports the failed days and the completed counts")
    void cacheDailyLinks_rangeWithFailure() {
        var start = LocalDate.of(2024, 1, 1);
        var failed = LocalDate.of(2024, 1, 2);
        var end = LocalDate.of(2024, 1, 3);
        when(mockDailyHarvester.harvestRange(any(), any(), any())).thenThrow(new RangeHarvestFailedException(
                List.of(new HarvestFailedException(failed, new CatalogUnavailableException("CMR down"))),
                List.of(HarvestResult.builder().collection(HlsCollection.HLSL30).date(start).written(true).linkCount(3).build(),
                        HarvestResult.builder().collection(HlsCollection.HLSL30).date(end).written(true).linkCount(2).build())));

        var result = harvestFunction.cacheDailyLinks().apply(payload(
                "collection", "HLSL30", "start_date", "2024-01-01", "end_date", "2024-01-03"));

        assertThat(result).isEqualTo("Error: 1 days failed [2024-01-02], first: Harvest failed for 2024-01-02: CMR down. "
                + "Harvested HLSL30.v2.0 from 2024-01-01 to 2024-01-03: 2 days written, 0 skipped, 5 links cached");
    }

    @Test
    @DisplayName("cacheDailyLinks: invalid payloads return an error without harvesting")
    void cacheDailyLinks_invalidPayloads() {
        assertThat(harvestFunction.cacheDailyLinks().apply(payload("date", "2024-01-15")))
                .startsWith("Error:").contains("'collection'");
        assertThat(harvestFunction.cacheDailyLinks().apply(payload("collection", "HLSX30", "date", "2024-01-15")))
                .startsWith("Error:").contains("Invalid collection");
        assertThat(harvestFunction.cacheDailyLinks().apply(payload("collection", "HLSL30", "date", "15/01/2024")))
                .startsWith("Error:");
        assertThat(harvestFunction.cacheDailyLinks().apply(payload("collection", "HLSL30", "date", "2024-01-15",
                "bounding_box", List.of(10, 0, 5, 10))))
                .startsWith("Error:").contains("min_lon");
        assertThat(harvestFunction.cacheDailyLinks().apply(payload("collection", "HLSL30", "date", "2024-01-15",
                "protocol", "ftp")))
                .startsWith("Error:").contains("Invalid protocol");
        assertThat(harvestFunction.cacheDailyLinks().apply(payload("collection", "HLSL30", "start_date", "2024-01-15")))
                .startsWith("Error:").contains("'end_date'");
        verifyNoInteractions(mockDailyHarvester);
    }

    @Test
    @DisplayName("cacheDailyLinks: harvest failures are reported as errors")
    void cacheDailyLinks_harvestFailure() {
        when(mockDailyHarvester.harvestDay(any()))
                .thenThrow(new HarvestFailedException(DAY, new CatalogUnavailableException("CMR down")));

        var result = harvestFunction.cacheDailyLinks().apply(payload("collection", "HLSL30", "date", "2024-01-15"));

        assertThat(result).isEqualTo("Error: Harvest failed for 2024-01-15: CMR down");
    }
}
