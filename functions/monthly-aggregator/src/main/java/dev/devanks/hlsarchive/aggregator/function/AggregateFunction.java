package dev.devanks.hlsarchive.aggregator.function;

import com.google.common.annotations.VisibleForTesting;
import dev.devanks.hlsarchive.aggregator.exception.AggregationException;
import dev.devanks.hlsarchive.aggregator.exception.IncompleteLinksException;
import dev.devanks.hlsarchive.aggregator.model.AggregationResult;
import dev.devanks.hlsarchive.aggregator.model.MonthlyAggregationRequest;
import dev.devanks.hlsarchive.aggregator.service.MonthlyAggregator;
import dev.devanks.hlsarchive.core.config.ArchiveProperties;
import dev.devanks.hlsarchive.core.model.HlsCollection;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.time.YearMonth;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Map;
import java.util.function.Function;

import static dev.devanks.hlsarchive.core.function.PayloadValues.destination;
import static dev.devanks.hlsarchive.core.function.PayloadValues.flag;
import static dev.devanks.hlsarchive.core.function.PayloadValues.optionalString;
import static dev.devanks.hlsarchive.core.function.PayloadValues.requiredString;

@Service
@RequiredArgsConstructor
@Slf4j
public class AggregateFunction {

    private static final DateTimeFormatter COMPACT_YEAR_MONTH = DateTimeFormatter.ofPattern("yyyyMM");

    private final MonthlyAggregator monthlyAggregator;
    private final ArchiveProperties archiveProperties;

    /**
     * Main function bean: writeMonthlyGeoParquet.
     */
    @Bean
    public Function<Map<String, Object>, String> writeMonthlyGeoParquet() {
        return payload -> {
            log.info("writeMonthlyGeoParquet function triggered with payload: {}", payload);

            MonthlyAggregationRequest request;
            try {
                request = toRequest(payload == null ? Map.of() : payload);
            } catch (IllegalArgumentException | DateTimeParseException e) {
                log.error("Invalid writeMonthlyGeoParquet payload {}: {}", payload, e.getMessage());
                return "Error: Invalid payload. Details: " + e.getMessage();
            }

            try {
                return summarize(request, monthlyAggregator.aggregateMonth(request).block());
            } catch (IncompleteLinksException e) {
                log.error("Aggregation of {} {} stopped: {}", request.getCollection(), request.getYearMonth(), e.getMessage());
                return "Error: " + e.getKind() + ": missing days " + e.getMissingDays();
            } catch (AggregationException e) {
                log.error("Aggregation of {} {} failed: {}", request.getCollection(), request.getYearMonth(), e.getMessage(), e);
                return "Error: " + e.getKind() + ": " + e.getMessage();
            } catch (Exception e) {
                log.error("Aggregation of {} {} failed unexpectedly: {}", request.getCollection(), request.getYearMonth(), e.getMessage(), e);
                return "Error: " + e.getMessage();
            }
        };
    }

    @VisibleForTesting
    MonthlyAggregationRequest toRequest(Map<String, Object> payload) {
        return MonthlyAggregationRequest.builder()
                .collection(HlsCollection.fromValue(optionalString(payload, "collection")))
                .yearMonth(parseYearMonth(requiredString(payload, "year_month")))
                .destination(destination(payload, archiveProperties.getStorage().getDefaultDestination()))
                .version(optionalString(payload, "version"))
                .requireCompleteLinks(flag(payload, "require_complete_links", false))
                .skipExisting(flag(payload, "skip_existing", false))
                .build();
    }

    /**
     * Accepts {@code yyyy-MM}, {@code yyyyMM}, or a {@code yyyy-MM-dd} date whose day is ignored.
     */
    @VisibleForTesting
    static YearMonth parseYearMonth(String value) {
        if (value.length() == 6 && value.chars().allMatch(Character::isDigit)) {
            return YearMonth.parse(value, COMPACT_YEAR_MONTH);
        }
        if (value.length() == 10) {
            return YearMonth.from(LocalDate.parse(value));
        }
        return YearMonth.parse(value);
    }

    private static String summarize(MonthlyAggregationRequest request, AggregationResult result) {
        if (result.isSkipped()) {
            return String.format("Skipped %s %s: %s already exists",
                    request.getCollection().getCollectionId(), request.getYearMonth(), result.getOutputPath());
        }
        return String.format("Wrote %d items for %s %s to %s (%d fetch failures, %d days without links)",
                result.getItemCount(), request.getCollection().getCollectionId(), request.getYearMonth(),
                result.getOutputPath(), result.getFailureCount(), result.getMissingDays().size());
    }
}
