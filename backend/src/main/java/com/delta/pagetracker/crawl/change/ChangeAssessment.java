package com.delta.pagetracker.crawl.change;

public record ChangeAssessment(
    double changePercentage,
    String summary,
    boolean significant,
    int addedWords,
    int removedWords
) {
    public static ChangeAssessment unchanged() {
        return new ChangeAssessment(0.0, ChangeDetector.NO_CHANGES, false, 0, 0);
    }
}
