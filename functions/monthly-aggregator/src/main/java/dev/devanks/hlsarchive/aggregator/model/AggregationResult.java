package dev.devanks.hlsarchive.aggregator.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.LocalDate;
import java.util.List;

@Value
@Builder
public class AggregationResult {

    String outputPath;

    /**
     * Rows written to the artifact.
     */
    int itemCount;

    int successCount;
    int failureCount;

    /**
     * Expected days that had no link manifest. Always empty when complete links were required.
     */
    @Singular
    List<LocalDate> missingDays;

    /**
     * True when an existing artifact was kept and nothing was fetched.
     */
    boolean skipped;
}
