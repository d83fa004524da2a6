package dev.devanks.hlsarchive.harvester.function;

import com.google.common.annotations.VisibleForTesting;
import dev.devanks.hlsarchive.core.config.ArchiveProperties;
import dev.devanks.hlsarchive.core.model.BoundingBox;
import dev.devanks.hlsarchive.core.model.HlsCollection;
import dev.devanks.hlsarchive.core.model.LinkProtocol;
import dev.devanks.hlsarchive.harvester.exception.RangeHarvestFailedException;
import dev.devanks.hlsarchive.harvester.model.HarvestRequest;
import dev.devanks.hlsarchive.harvester.model.HarvestResult;
import dev.devanks.hlsarchive.harvester.service.DailyHarvester;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

import static dev.devanks.hlsarchive.core.function.PayloadValues.destination;
import static dev.devanks.hlsarchive.core.function.PayloadValues.flag;
import static dev.devanks.hlsarchive.core.function.PayloadValues.optionalString;
import static dev.devanks.hlsarchive.core.function.PayloadValues.requiredString;

@Service
@RequiredArgsConstructor
@Slf4j
public class HarvestFunction {

    private final DailyHarvester dailyHarvester;
    private final ArchiveProperties archiveProperties;

    /**
     * Main function bean: cacheDailyLinks. Harvests one {@code date}, or every day from
     * {@code start_date} to {@code end_date}.
     */
    @Bean
    public Function<Map<String, Object>, String> cacheDailyLinks() {
        return payload -> {
            log.info("cacheDailyLinks function triggered with payload: {}", payload);

            HarvestRequest request;
            try {
                request = toRequest(payload == null ? Map.of() : payload);
            } catch (IllegalArgumentException | DateTimeParseException e) {
                log.error("Invalid cacheDailyLinks payload {}: {}", payload, e.getMessage());
                return "Error: Invalid payload. Details: " + e.getMessage();
            }

            try {
                if (payload.containsKey("start_date")) {
                    var startDate = LocalDate.parse(requiredString(payload, "start_date"));
                    var endDate = LocalDate.parse(requiredString(payload, "end_date"));
                    return summarize(request, startDate, endDate, dailyHarvester.harvestRange(request, startDate, endDate));
                }
                return summarize(dailyHarvester.harvestDay(request));
            } catch (RangeHarvestFailedException e) {
                log.error("cacheDailyLinks failed for {} of the days in payload {}: {}", e.getFailedDays().size(), payload, e.getMessage(), e);
                return String.format("Error: %d days failed %s, first: %s. %s", e.getFailedDays().size(), e.getFailedDays(),
                        e.getMessage(), summarize(request, LocalDate.parse(requiredString(payload, "start_date")),
                                LocalDate.parse(requiredString(payload, "end_date")), e.getCompletedDays()));
            } catch (Exception e) {
                log.error("cacheDailyLinks failed for payload {}: {}", payload, e.getMessage(), e);
                return "Error: " + e.getMessage();
            }
        };
    }

    /**
     * Builds the day request; for ranges the date is the range start and is replaced per day.
     */
    @VisibleForTesting
    HarvestRequest toRequest(Map<String, Object> payload) {
        var collection = HlsCollection.fromValue(optionalString(payload, "collection"));
        var dateKey = payload.containsKey("start_date") ? "start_date" : "date";
        if (payload.containsKey("start_date") && !payload.containsKey("end_date")) {
            throw new IllegalArgumentException("Missing required parameter: 'end_date'");
        }
        var date = LocalDate.parse(requiredString(payload, dateKey));

        var protocolValue = optionalString(payload, "protocol");
        var boundingBox = payload.get("bounding_box") == null ? null : toBoundingBox(payload.get("bounding_box"));

        return HarvestRequest.builder()
                .collection(collection)
                .date(date)
                .boundingBox(boundingBox)
                .protocol(protocolValue == null ? LinkProtocol.OBJECT_STORE : LinkProtocol.fromValue(protocolValue))
                .destination(destination(payload, archiveProperties.getStorage().getDefaultDestination()))
                .skipExisting(flag(payload, "skip_existing", true))
                .build();
    }

    private static BoundingBox toBoundingBox(Object value) {
        if (!(value instanceof List<?> values)) {
            throw new IllegalArgumentException("Invalid bounding_box: expected a list of 4 numbers, got " + value);
        }
        return BoundingBox.fromList(values);
    }

    private static String summarize(HarvestResult result) {
        if (!result.isWritten()) {
            return String.format("Skipped %s on %s: manifest already exists at %s",
                    result.getCollection().getCollectionId(), result.getDate(), result.getManifestLocation());
        }
        return String.format("Cached %d links for %s on %s at %s", result.getLinkCount(),
                result.getCollection().getCollectionId(), result.getDate(), result.getManifestLocation());
    }

    private static String summarize(HarvestRequest request, LocalDate startDate, LocalDate endDate, List<HarvestResult> results) {
        long written = results.stream().filter(HarvestResult::isWritten).count();
        int links = results.stream().mapToInt(HarvestResult::getLinkCount).sum();
        return String.format("Harvested %s from %s to %s: %d days written, %d skipped, %d links cached",
                request.getCollection().getCollectionId(), startDate, endDate, written, results.size() - written, links);
    }
}
