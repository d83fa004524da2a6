package dev.devanks.hlsarchive.harvester.service;

import dev.devanks.hlsarchive.core.exception.StorageWriteException;
import dev.devanks.hlsarchive.core.manifest.LinkManifestStore;
import dev.devanks.hlsarchive.core.model.BoundingBox;
import dev.devanks.hlsarchive.core.model.LinkProtocol;
import dev.devanks.hlsarchive.harvester.catalog.CatalogEntry;
import dev.devanks.hlsarchive.harvester.catalog.CatalogQueryClient;
import dev.devanks.hlsarchive.harvester.exception.CatalogUnavailableException;
import dev.devanks.hlsarchive.harvester.exception.HarvestFailedException;
import dev.devanks.hlsarchive.harvester.exception.RangeHarvestFailedException;
import dev.devanks.hlsarchive.harvester.model.HarvestRequest;
import dev.devanks.hlsarchive.harvester.model.HarvestResult;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.locationtech.jts.geom.Envelope;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;

import static dev.devanks.hlsarchive.core.model.HlsCollection.HLSL30;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("DailyHarvester Unit Tests")
class DailyHarvesterTest {

    private static final String ROOT = "s3://bucket/hls";
    private static final LocalDate DAY = LocalDate.of(2024, 1, 15);

    @Mock
    private CatalogQueryClient mockQueryClient;

    @Mock
    private LinkManifestStore mockManifestStore;

    @InjectMocks
    private DailyHarvester dailyHarvester;

    private static HarvestRequest request(boolean skipExisting) {
        return HarvestRequest.builder()
                .collection(HLSL30)
                .date(DAY)
                .destination(ROOT)
                .skipExisting(skipExisting)
                .build();
    }

    private static CatalogEntry entry(String id, Envelope envelope) {
        return CatalogEntry.builder().id(id).envelope(envelope).build();
    }

    @Test
    @DisplayName("harvestDay: existing manifest with skipExisting makes no catalog calls")
    void harvestDay_skipExisting_noCatalogCalls() {
        when(mockManifestStore.exists(ROOT, HLSL30, DAY)).thenReturn(true);

        var result = dailyHarvester.harvestDay(request(true));

        assertThat(result.isWritten()).isFalse();
        assertThat(result.getManifestLocation()).isEqualTo("s3://bucket/hls/links/HLSL30.v2.0/2024/01/2024-01-15.json");
        verifyNoInteractions(mockQueryClient);
        verify(mockManifestStore, never()).write(any(), any(), any(), anyList());
    }

    @Test
    @DisplayName("harvestDay: zero results still write an empty manifest")
    void harvestDay_noResults_writesEmptyManifest() {
        when(mockManifestStore.exists(ROOT, HLSL30, DAY)).thenReturn(false);
        when(mockQueryClient.search(HLSL30, DAY, null)).thenReturn(Stream.empty());

        var result = dailyHarvester.harvestDay(request(true));

        assertThat(result.isWritten()).isTrue();
        assertThat(result.getLinkCount()).isZero();
        verify(mockManifestStore).write(ROOT, HLSL30, DAY, List.of());
    }

    @Test
    @DisplayName("harvestDay: entries without a protocol link are dropped, order kept")
    void harvestDay_missingLink_skipped() {
        var a = entry("a", null);
        var b = entry("b", null);
        var c = entry("c", null);
        when(mockQueryClient.search(HLSL30, DAY, null)).thenReturn(Stream.of(a, b, c));
        when(mockQueryClient.extractLink(a, LinkProtocol.OBJECT_STORE)).thenReturn(Optional.of("s3://x/a_stac.json"));
        when(mockQueryClient.extractLink(b, LinkProtocol.OBJECT_STORE)).thenReturn(Optional.empty());
        when(mockQueryClient.extractLink(c, LinkProtocol.OBJECT_STORE)).thenReturn(Optional.of("s3://x/c_stac.json"));

        var result = dailyHarvester.harvestDay(request(false));

        assertThat(result.getLinkCount()).isEqualTo(2);
        verify(mockManifestStore).write(ROOT, HLSL30, DAY, List.of("s3://x/a_stac.json", "s3://x/c_stac.json"));
        verify(mockManifestStore, never()).exists(any(), any(), any());
    }

    @Test
    @DisplayName("harvestDay: entries outside the bounding box are dropped, edge contact and unknown extent kept")
    void harvestDay_boundingBoxFilter() {
        var box = BoundingBox.of(0, 0, 10, 10);
        var inside = entry("inside", new Envelope(1, 2, 1, 2));
        var touching = entry("touching", new Envelope(10, 12, 0, 5));
        var outside = entry("outside", new Envelope(20, 30, 20, 30));
        var unknown = entry("unknown", null);
        when(mockQueryClient.search(HLSL30, DAY, box)).thenReturn(Stream.of(inside, touching, outside, unknown));
        when(mockQueryClient.extractLink(any(), eq(LinkProtocol.OBJECT_STORE)))
                .thenAnswer(invocation -> Optional.of("s3://x/" + ((CatalogEntry) invocation.getArgument(0)).getId() + "_stac.json"));

        dailyHarvester.harvestDay(request(false).toBuilder().boundingBox(box).build());

        verify(mockManifestStore).write(ROOT, HLSL30, DAY,
                List.of("s3://x/inside_stac.json", "s3://x/touching_stac.json", "s3://x/unknown_stac.json"));
    }

    @Test
    @DisplayName("harvestDay: catalog failure becomes HarvestFailedException and nothing is written")
    void harvestDay_catalogFailure_throwsHarvestFailed() {
        when(mockQueryClient.search(HLSL30, DAY, null)).thenThrow(new CatalogUnavailableException("CMR down"));

        assertThatThrownBy(() -> dailyHarvester.harvestDay(request(false)))
                .isInstanceOfSatisfying(HarvestFailedException.class, e -> assertThat(e.getDate()).isEqualTo(DAY))
                .hasCauseInstanceOf(CatalogUnavailableException.class);
        verify(mockManifestStore, never()).write(any(), any(), any(), anyList());
    }

    @Test
    @DisplayName("harvestDay: storage failures propagate unchanged")
    void harvestDay_writeFailure_propagates() {
        when(mockQueryClient.search(HLSL30, DAY, null)).thenReturn(Stream.empty());
        doThrow(new StorageWriteException("s3://bucket/x", new RuntimeException("denied")))
                .when(mockManifestStore).write(ROOT, HLSL30, DAY, List.of());

        assertThatThrownBy(() -> dailyHarvester.harvestDay(request(false)))
                .isInstanceOf(StorageWriteException.class);
    }

    @Test
    @DisplayName("harvestRange: continues past a failed day, then reports the first failure")
    void harvestRange_failureInMiddle_continuesThenThrows() {
        var day2 = DAY.plusDays(1);
        var day3 = DAY.plusDays(2);
        when(mockQueryClient.search(HLSL30, DAY, null)).thenReturn(Stream.empty());
        when(mockQueryClient.search(HLSL30, day2, null)).thenThrow(new CatalogUnavailableException("CMR down"));
        when(mockQueryClient.search(HLSL30, day3, null)).thenReturn(Stream.empty());

        assertThatThrownBy(() -> dailyHarvester.harvestRange(request(false), DAY, day3))
                .isInstanceOfSatisfying(RangeHarvestFailedException.class, e -> {
                    assertThat(e.getDate()).isEqualTo(day2);
                    assertThat(e.getFailedDays()).containsExactly(day2);
                    assertThat(e.getCompletedDays()).extracting(HarvestResult::getDate).containsExactly(DAY, day3);
                });
        verify(mockManifestStore).write(ROOT, HLSL30, DAY, List.of());
        verify(mockManifestStore).write(ROOT, HLSL30, day3, List.of());
    }

    @Test
    @DisplayName("harvestRange: one result per day when every day succeeds")
    void harvestRange_allDays() {
        when(mockQueryClient.search(any(), any(), any())).thenAnswer(invocation -> Stream.empty());

        var results = dailyHarvester.harvestRange(request(false), DAY, DAY.plusDays(2));

        assertThat(results).extracting(r -> r.getDate())
                .containsExactly(DAY, DAY.plusDays(1), DAY.plusDays(2));
    }

    @Test
    @DisplayName("harvestRange: end before start is rejected")
    void harvestRange_invertedRange_throws() {
        assertThatThrownBy(() -> dailyHarvester.harvestRange(request(false), DAY, DAY.minusDays(1)))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
