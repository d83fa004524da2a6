package dev.devanks.hlsarchive.aggregator.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * Result of fetching one item link: either the parsed item, or the kind of error that ended the attempts.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class FetchOutcome {

    String link;
    ItemDocument item;
    FetchErrorKind errorKind;
    int attempts;
    String message;

    public static FetchOutcome success(String link, ItemDocument item, int attempts) {
        return new FetchOutcome(link, item, null, attempts, null);
    }

    public static FetchOutcome failure(String link, FetchErrorKind errorKind, int attempts, String message) {
        return new FetchOutcome(link, null, errorKind, attempts, message);
    }

    public boolean isSuccess() {
        return item != null;
    }
}
