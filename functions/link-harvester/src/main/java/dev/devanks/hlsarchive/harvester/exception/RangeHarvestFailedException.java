package dev.devanks.hlsarchive.harvester.exception;

import dev.devanks.hlsarchive.harvester.model.HarvestResult;
import lombok.Getter;

import java.time.LocalDate;
import java.util.List;

/**
 * One or more days of a date range failed. Reports the first failed day; later failures are
 * suppressed. The days that did complete are kept so callers can report them.
 */
@Getter
public class RangeHarvestFailedException extends HarvestFailedException {

    private final List<LocalDate> failedDays;
    private final List<HarvestResult> completedDays;

    public RangeHarvestFailedException(List<HarvestFailedException> failures, List<HarvestResult> completedDays) {
        super(failures.get(0).getDate(), failures.get(0).getCause());
        this.failedDays = failures.stream().map(HarvestFailedException::getDate).toList();
        this.completedDays = List.copyOf(completedDays);
        failures.stream().skip(1).forEach(this::addSuppressed);
    }
}
