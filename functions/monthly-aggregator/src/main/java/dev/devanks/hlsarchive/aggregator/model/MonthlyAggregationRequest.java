package dev.devanks.hlsarchive.aggregator.model;

import dev.devanks.hlsarchive.core.model.HlsCollection;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

import java.time.YearMonth;

@Value
@Builder
public class MonthlyAggregationRequest {

    @NonNull
    HlsCollection collection;

    @NonNull
    YearMonth yearMonth;

    @NonNull
    String destination;

    /**
     * Output version; null uses the configured default.
     */
    String version;

    boolean requireCompleteLinks;

    boolean skipExisting;
}
