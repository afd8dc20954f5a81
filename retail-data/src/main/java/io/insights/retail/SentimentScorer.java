package io.insights.retail;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;

/**
 * Keyword polarity heuristic over review text. Each review contributes the number of distinct positive
 * lexicon words it contains minus the number of distinct negative ones; the total is averaged over
 * the reviews and clamped to [-1, 1]. No reviews score 0.
 */
public class SentimentScorer {
    private final Lexicon lexicon;
    private final Map<String, Pattern> wordPatterns = new ConcurrentHashMap<>();

    public SentimentScorer(Lexicon lexicon) {
        this.lexicon = lexicon;
    }

    public Lexicon lexicon() { return lexicon; }

    public double score(List<ReviewRecord> reviews) {
        if (reviews.isEmpty()) return 0.0;
        long total = 0;
        for (ReviewRecord r : reviews) {
            total += delta(r.reviewText());
        }
        double avg = (double) total / reviews.size();
        return Math.max(-1.0, Math.min(1.0, avg));
    }

    /** Distinct positive matches minus distinct negative matches for one text. */
    public int delta(String text) {
        if (text == null || text.isEmpty()) return 0;
        String lower = text.toLowerCase(Locale.ROOT);
        return matches(lower, lexicon.positive()) - matches(lower, lexicon.negative());
    }

    private int matches(String lower, Set<String> words) {
        int n = 0;
        for (String w : words) {
            if (contains(lower, w)) n++;
        }
        return n;
    }

    private boolean contains(String lower, String word) {
        if (!lexicon.wholeWords()) return lower.contains(word);
        Pattern p = wordPatterns.computeIfAbsent(word, w -> Pattern.compile("\\b" + Pattern.quote(w) + "\\b"));
        return p.matcher(lower).find();
    }
}
