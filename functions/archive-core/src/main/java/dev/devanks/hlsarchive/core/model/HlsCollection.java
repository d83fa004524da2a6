package dev.devanks.hlsarchive.core.model;

import java.time.LocalDate;
import java.time.YearMonth;
import java.util.List;
import java.util.Locale;
import java.util.stream.IntStream;

/**
 * HLS collections known to the archive, with their CMR concept ids and the first day data exists.
 */
public enum HlsCollection {

    HLSL30("C2021957657-LPCLOUD", "v2.0", LocalDate.of(2013, 4, 11)),
    HLSS30("C2021957295-LPCLOUD", "v2.0", LocalDate.of(2015, 11, 28));

    private final String conceptId;
    private final String version;
    private final LocalDate originDate;

    HlsCollection(String conceptId, String version, LocalDate originDate) {
        this.conceptId = conceptId;
        this.version = version;
        this.originDate = originDate;
    }

    public String getConceptId() {
        return conceptId;
    }

    public String getVersion() {
        return version;
    }

    public LocalDate getOriginDate() {
        return originDate;
    }

    /**
     * Versioned identifier used in storage keys, e.g. {@code HLSL30.v2.0}.
     */
    public String getCollectionId() {
        return name() + "." + version;
    }

    /**
     * Days of the month for which a link manifest should exist. The origin month starts at the
     * origin day; months before the origin expect nothing.
     */
    public List<LocalDate> expectedDays(YearMonth yearMonth) {
        var originMonth = YearMonth.from(originDate);
        if (yearMonth.isBefore(originMonth)) {
            return List.of();
        }
        int firstDay = yearMonth.equals(originMonth) ? originDate.getDayOfMonth() : 1;
        return IntStream.rangeClosed(firstDay, yearMonth.lengthOfMonth())
                .mapToObj(yearMonth::atDay)
                .toList();
    }

    public static HlsCollection fromValue(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Missing required parameter: 'collection'");
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException(
                    "Invalid collection: " + value + ". Must be 'HLSL30' or 'HLSS30'", e);
        }
    }
}
