package com.delta.pagetracker.crawl.change;

import com.delta.pagetracker.config.CrawlerProperties;
import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Word-level comparison of two page bodies. The percentage is the share of added plus removed words
 * among all words of the diff, so it always lies in [0, 100].
 */
@Component
public class ChangeDetector {
    static final String NO_CHANGES = "No changes detected";
    static final String MINOR_CHANGES = "Minor changes detected";
    // Above this many DP cells the diff falls back to a bag-of-words comparison.
    private static final long MAX_LCS_CELLS = 25_000_000L;

    private final double significantChangePercent;

    @Autowired
    public ChangeDetector(CrawlerProperties properties) {
        this(properties.getVersioning().getSignificantChangePercent());
    }

    ChangeDetector(double significantChangePercent) {
        this.significantChangePercent = significantChangePercent;
    }

    public ChangeAssessment detectChange(String oldContent, String newContent) {
        String before = oldContent == null ? "" : oldContent;
        String after = newContent == null ? "" : newContent;
        if (Objects.equals(before, after)) {
            return ChangeAssessment.unchanged();
        }
        String[] oldWords = tokenize(before);
        String[] newWords = tokenize(after);

        int prefix = 0;
        while (prefix < oldWords.length && prefix < newWords.length && oldWords[prefix].equals(newWords[prefix])) {
            prefix++;
        }
        int suffix = 0;
        while (suffix < oldWords.length - prefix
            && suffix < newWords.length - prefix
            && oldWords[oldWords.length - 1 - suffix].equals(newWords[newWords.length - 1 - suffix])) {
            suffix++;
        }
        List<String> oldMiddle = slice(oldWords, prefix, oldWords.length - suffix);
        List<String> newMiddle = slice(newWords, prefix, newWords.length - suffix);
        int common = commonWordCount(oldMiddle, newMiddle);

        int unchanged = prefix + suffix + common;
        int removed = oldMiddle.size() - common;
        int added = newMiddle.size() - common;
        int total = unchanged + added + removed;
        if (added == 0 && removed == 0) {
            // Only whitespace moved.
            return new ChangeAssessment(0.0, MINOR_CHANGES, false, 0, 0);
        }
        double percentage = total == 0 ? 0.0 : (added + removed) * 100.0 / total;
        percentage = Math.round(Math.min(100.0, Math.max(0.0, percentage)) * 100.0) / 100.0;
        return new ChangeAssessment(
            percentage,
            summarize(added, removed),
            percentage > significantChangePercent,
            added,
            removed
        );
    }

    public double getSignificantChangePercent() {
        return significantChangePercent;
    }

    static String[] tokenize(String text) {
        String normalized = StringUtils.normalizeSpace(text);
        if (normalized.isEmpty()) {
            return new String[0];
        }
        return normalized.split(" ");
    }

    private String summarize(int added, int removed) {
        List<String> parts = new ArrayList<>();
        if (added > 0) {
            parts.add("+" + added + " words added");
        }
        if (removed > 0) {
            parts.add("-" + removed + " words removed");
        }
        return parts.isEmpty() ? MINOR_CHANGES : String.join(", ", parts);
    }

    private int commonWordCount(List<String> a, List<String> b) {
        if (a.isEmpty() || b.isEmpty()) {
            return 0;
        }
        if ((long) a.size() * b.size() > MAX_LCS_CELLS) {
            return bagIntersection(a, b);
        }
        int[] previous = new int[b.size() + 1];
        int[] current = new int[b.size() + 1];
        for (int i = 1; i <= a.size(); i++) {
            String word = a.get(i - 1);
            for (int j = 1; j <= b.size(); j++) {
                if (word.equals(b.get(j - 1))) {
                    current[j] = previous[j - 1] + 1;
                } else {
                    current[j] = Math.max(previous[j], current[j - 1]);
                }
            }
            int[] swap = previous;
            previous = current;
            current = swap;
        }
        return previous[b.size()];
    }

    private int bagIntersection(List<String> a, List<String> b) {
        Map<String, Integer> counts = new HashMap<>();
        for (String word : a) {
            counts.merge(word, 1, Integer::sum);
        }
        int shared = 0;
        for (String word : b) {
            Integer remaining = counts.get(word);
            if (remaining != null && remaining > 0) {
                counts.put(word, remaining - 1);
                shared++;
            }
        }
        return shared;
    }

    private List<String> slice(String[] words, int from, int to) {
        List<String> out = new ArrayList<>(Math.max(0, to - from));
        for (int i = from; i < to; i++) {
            out.add(words[i]);
        }
        return out;
    }
}
