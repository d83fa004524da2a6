package dev.devanks.hlsarchive.core.storage;

import dev.devanks.hlsarchive.core.model.HlsCollection;

import java.time.LocalDate;
import java.time.YearMonth;

/**
 * Object key layout for link manifests and monthly artifacts. Every method is a pure function of
 * its arguments.
 */
public final class StorageLayout {

    private StorageLayout() {
    }

    /**
     * {@code {root}/links/{collection}.{version}/{yyyy}/{MM}/{yyyy-MM-dd}.json}
     */
    public static String manifestPath(String root, HlsCollection collection, LocalDate date) {
        return String.format("%s/links/%s/%04d/%02d/%s.json",
                trimRoot(root), collection.getCollectionId(), date.getYear(), date.getMonthValue(), date);
    }

    /**
     * {@code {root}/{version}/{collection}.{version}/year={yyyy}/month={MM}/{collection}.{version}-{yyyy}-{MM}.parquet}
     */
    public static String artifactPath(String root, String outputVersion, HlsCollection collection, YearMonth yearMonth) {
        if (outputVersion == null || outputVersion.isBlank()) {
            throw new IllegalArgumentException("Output version cannot be blank.");
        }
        return String.format("%s/%s/%s/year=%04d/month=%02d/%s",
                trimRoot(root), outputVersion, collection.getCollectionId(),
                yearMonth.getYear(), yearMonth.getMonthValue(), artifactName(collection, yearMonth));
    }

    public static String artifactName(HlsCollection collection, YearMonth yearMonth) {
        return String.format("%s-%04d-%02d.parquet", collection.getCollectionId(), yearMonth.getYear(), yearMonth.getMonthValue());
    }

    private static String trimRoot(String root) {
        if (root == null || root.isBlank()) {
            throw new IllegalArgumentException("Destination root cannot be blank.");
        }
        String trimmed = root.trim();
        while (trimmed.endsWith("/")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
        }
        return trimmed;
    }
}
