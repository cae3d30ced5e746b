package com.delta.pagetracker.crawl.change;

import org.junit.jupiter.api.Test;

import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class ChangeDetectorTest {
    private final ChangeDetector detector = new ChangeDetector(5.0);

    @Test
    void identicalContentIsUnchanged() {
        ChangeAssessment assessment = detector.detectChange("same words here", "same words here");

        assertThat(assessment.changePercentage()).isZero();
        assertThat(assessment.summary()).isEqualTo("No changes detected");
        assertThat(assessment.significant()).isFalse();
    }

    @Test
    void whitespaceOnlyEditsAreMinor() {
        ChangeAssessment assessment = detector.detectChange("alpha  beta\ngamma", "alpha beta gamma");

        assertThat(assessment.changePercentage()).isZero();
        assertThat(assessment.summary()).isEqualTo("Minor changes detected");
        assertThat(assessment.significant()).isFalse();
    }

    @Test
    void replacedWordCountsAsOneAddedAndOneRemoved() {
        ChangeAssessment assessment = detector.detectChange(
            "a b c d e f g h i j",
            "a b c d x f g h i j"
        );

        assertThat(assessment.addedWords()).isEqualTo(1);
        assertThat(assessment.removedWords()).isEqualTo(1);
        assertThat(assessment.changePercentage()).isCloseTo(18.18, within(0.001));
        assertThat(assessment.summary()).isEqualTo("+1 words added, -1 words removed");
        assertThat(assessment.significant()).isTrue();
    }

    @Test
    void smallAppendStaysBelowThreshold() {
        String base = words(100);

        ChangeAssessment assessment = detector.detectChange(base, base + " extra");

        assertThat(assessment.changePercentage()).isCloseTo(0.99, within(0.001));
        assertThat(assessment.summary()).isEqualTo("+1 words added");
        assertThat(assessment.significant()).isFalse();
    }

    @Test
    void thresholdIsStrictlyGreaterThan() {
        String base = words(19);
        String changed = base + " extra";

        ChangeAssessment atThreshold = detector.detectChange(base, changed);
        assertThat(atThreshold.changePercentage()).isEqualTo(5.0);
        assertThat(atThreshold.significant()).isFalse();

        ChangeAssessment lowerThreshold = new ChangeDetector(4.99).detectChange(base, changed);
        assertThat(lowerThreshold.significant()).isTrue();
    }

    @Test
    void emptyToContentIsFullChangeAndPercentageStaysInRange() {
        ChangeAssessment added = detector.detectChange("", "hello world");
        assertThat(added.changePercentage()).isEqualTo(100.0);
        assertThat(added.summary()).isEqualTo("+2 words added");

        ChangeAssessment removed = detector.detectChange("hello world", null);
        assertThat(removed.changePercentage()).isEqualTo(100.0);
        assertThat(removed.summary()).isEqualTo("-2 words removed");
    }

    @Test
    void reorderedParagraphKeepsLongestCommonRun() {
        ChangeAssessment assessment = detector.detectChange("one two three four", "three four one two");

        assertThat(assessment.addedWords()).isEqualTo(2);
        assertThat(assessment.removedWords()).isEqualTo(2);
        assertThat(assessment.changePercentage()).isBetween(0.0, 100.0);
    }

    private static String words(int count) {
        return IntStream.range(0, count).mapToObj(i -> "w" + i).collect(Collectors.joining(" "));
    }
}
