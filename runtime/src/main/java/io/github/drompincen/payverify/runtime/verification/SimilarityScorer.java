package io.github.drompincen.payverify.runtime.verification;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Token-based similarity for free-text fields such as person and employer names.
 *
 * <p>The score is {@code 0.6 * jaccard + 0.4 * containment} over the lower-cased
 * whitespace tokens of both strings, where containment is the share of the
 * smaller token set found in the larger one. Scores are symmetric and lie in
 * {@code [0, 1]}.
 */
@Component
public class SimilarityScorer {

    public static final double MATCH_THRESHOLD = 0.8;

    static final double JACCARD_WEIGHT = 0.6;
    static final double CONTAINMENT_WEIGHT = 0.4;

    static final Set<String> BUSINESS_SUFFIXES = Set.of(
            "inc", "llc", "corp", "ltd", "company", "co", "enterprises", "group");

    public double similarity(String a, String b) {
        if (a == null || b == null) {
            return 0.0;
        }
        String left = a.trim().toLowerCase(Locale.ROOT);
        String right = b.trim().toLowerCase(Locale.ROOT);
        if (left.isEmpty() || right.isEmpty()) {
            return 0.0;
        }
        if (left.equals(right)) {
            return 1.0;
        }

        Set<String> tokensA = tokens(left);
        Set<String> tokensB = tokens(right);
        if (tokensA.isEmpty() || tokensB.isEmpty()) {
            return 0.0;
        }

        Set<String> intersection = new HashSet<>(tokensA);
        intersection.retainAll(tokensB);
        Set<String> union = new HashSet<>(tokensA);
        union.addAll(tokensB);

        double jaccard = (double) intersection.size() / union.size();
        double containment = (double) intersection.size() / Math.min(tokensA.size(), tokensB.size());

        return Math.min(jaccard * JACCARD_WEIGHT + containment * CONTAINMENT_WEIGHT, 1.0);
    }

    /** Similarity after dropping trailing business-entity suffixes such as "Inc" or "LLC". */
    public double employerSimilarity(String a, String b) {
        if (a == null || b == null) {
            return 0.0;
        }
        return similarity(stripBusinessSuffixes(a), stripBusinessSuffixes(b));
    }

    public boolean isMatch(double score) {
        return score >= MATCH_THRESHOLD;
    }

    /**
     * Removes entity suffix tokens from the end of an employer name, ignoring
     * trailing punctuation such as "Corp." or "Acme,". At least one token is kept.
     */
    static String stripBusinessSuffixes(String employer) {
        List<String> words = new ArrayList<>();
        for (String word : employer.trim().toLowerCase(Locale.ROOT).split("\\s+")) {
            String cleaned = word.replaceAll("[.,]+$", "");
            if (!cleaned.isEmpty()) {
                words.add(cleaned);
            }
        }
        while (words.size() > 1 && BUSINESS_SUFFIXES.contains(words.get(words.size() - 1))) {
            words.remove(words.size() - 1);
        }
        return String.join(" ", words);
    }

    private static Set<String> tokens(String text) {
        return new LinkedHashSet<>(Arrays.asList(text.split("\\s+")));
    }
}
