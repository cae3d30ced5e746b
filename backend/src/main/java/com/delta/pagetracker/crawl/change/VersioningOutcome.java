package com.delta.pagetracker.crawl.change;

public record VersioningOutcome(
    Action action,
    Long documentId,
    int version,
    Double changePercentage
) {
    public enum Action {
        CREATED,
        UPDATED,
        UNCHANGED
    }

    public boolean created() {
        return action == Action.CREATED;
    }

    public boolean updated() {
        return action == Action.UPDATED;
    }

    public boolean recordedChange() {
        return action != Action.UNCHANGED;
    }
}
