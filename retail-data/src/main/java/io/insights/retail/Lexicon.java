package io.insights.retail;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Word lists for polarity counting. Words are stored lower case.
 *
 * @param wholeWords when false a word matches anywhere in the text, including inside longer words
 *                   ("badly" counts as "bad"); when true it must stand alone
 */
public record Lexicon(Set<String> positive, Set<String> negative, boolean wholeWords) {

    public static final List<String> DEFAULT_POSITIVE =
            List.of("good", "great", "excellent", "amazing", "love", "perfect", "wonderful");
    public static final List<String> DEFAULT_NEGATIVE =
            List.of("bad", "terrible", "awful", "hate", "worst", "horrible", "disappointing");

    public Lexicon {
        positive = normalize(positive);
        negative = normalize(negative);
    }

    public static Lexicon defaults() {
        return new Lexicon(Set.copyOf(DEFAULT_POSITIVE), Set.copyOf(DEFAULT_NEGATIVE), false);
    }

    public Lexicon withWholeWords(boolean enabled) {
        return new Lexicon(positive, negative, enabled);
    }

    private static Set<String> normalize(Set<String> words) {
        Set<String> out = new LinkedHashSet<>();
        for (String w : words) {
            String t = w.trim().toLowerCase(Locale.ROOT);
            if (!t.isEmpty()) out.add(t);
        }
        return Set.copyOf(out);
    }
}
