package dev.devanks.hlsarchive.aggregator.exception;

import lombok.Getter;

import java.time.LocalDate;
import java.util.List;

@Getter
public class IncompleteLinksException extends AggregationException {

    private final List<LocalDate> missingDays;

    public IncompleteLinksException(List<LocalDate> missingDays) {
        super(Kind.INCOMPLETE_LINKS, "Missing link manifests for " + missingDays.size() + " days: " + missingDays);
        this.missingDays = List.copyOf(missingDays);
    }
}
