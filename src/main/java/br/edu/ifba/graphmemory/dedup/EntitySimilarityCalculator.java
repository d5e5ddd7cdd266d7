package br.edu.ifba.graphmemory.dedup;

import br.edu.ifba.graphmemory.config.GraphMemoryConfig;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashSet;
import java.util.Locale;
import java.util.Set;

/**
 * Name similarity used to shortlist existing entities before the model-backed judgment.
 *
 * Combines four complementary metrics into a weighted score:
 * - Jaccard similarity (token overlap)
 * - Containment (substring matching)
 * - Levenshtein distance (edit distance)
 * - Abbreviation matching
 *
 * The pre-filter score additionally short-circuits on exact and initials matches.
 */
public class EntitySimilarityCalculator {

    private static final Logger logger = LoggerFactory.getLogger(EntitySimilarityCalculator.class);

    private static final Set<String> STOP_WORDS =
        Set.of("a", "an", "the", "of", "and", "or", "for", "in", "on", "at", "to", "from");

    private final GraphMemoryConfig.Dedup config;

    public EntitySimilarityCalculator(@NotNull GraphMemoryConfig.Dedup config) {
        this.config = config;
    }

    /**
     * Score in [0,1] deciding whether an existing entity enters the shortlist.
     *
     * <ul>
     *   <li>1.0 for equal normalized names</li>
     *   <li>the configured initials score when one name abbreviates given names of the other ("J. Smith")</li>
     *   <li>otherwise the weighted blend of {@link #computeNameSimilarity(String, String)}</li>
     * </ul>
     */
    public double preFilterScore(@NotNull String candidateName, @NotNull String existingName) {
        String normalized1 = normalizeName(candidateName);
        String normalized2 = normalizeName(existingName);
        if (normalized1.isEmpty() || normalized2.isEmpty()) {
            return 0.0;
        }
        if (normalized1.equals(normalized2)) {
            return 1.0;
        }
        if (isInitialsMatch(normalized1, normalized2)) {
            return Math.max(config.initialsScore(), computeNameSimilarity(candidateName, existingName));
        }
        return computeNameSimilarity(candidateName, existingName);
    }

    /**
     * Weighted combination of the four metrics, with early termination on names that
     * clearly cannot match.
     */
    public double computeNameSimilarity(@NotNull String name1, @NotNull String name2) {
        // Names differing drastically in length are unlikely to match, unless one is an acronym
        int len1 = name1.length();
        int len2 = name2.length();
        int minLen = Math.min(len1, len2);
        if (minLen > 10 && Math.max(len1, len2) > minLen * 5) {
            return 0.0;
        }

        if (!firstTokensOverlap(name1, name2)) {
            return 0.0;
        }

        double jaccard = computeJaccardSimilarity(name1, name2);
        double containment = computeContainmentScore(name1, name2);
        double levenshtein = computeLevenshteinSimilarity(name1, name2);
        double abbreviation = computeAbbreviationScore(name1, name2);

        GraphMemoryConfig.Dedup.Weight weight = config.weight();
        double finalScore = weight.jaccard() * jaccard
                          + weight.containment() * containment
                          + weight.edit() * levenshtein
                          + weight.abbreviation() * abbreviation;

        if (abbreviation > 0.5 || finalScore > 0.3) {
            logger.debug("Similarity '{}' vs '{}': jaccard={}, containment={}, edit={}, abbr={}, final={}",
                name1, name2, jaccard, containment, levenshtein, abbreviation, finalScore);
        }
        return Math.min(1.0, finalScore);
    }

    private boolean firstTokensOverlap(String name1, String name2) {
        String[] tokens1 = normalizeName(name1).split(" ");
        String[] tokens2 = normalizeName(name2).split(" ");
        // short single-token names may be acronyms ("MIT")
        boolean potentialAbbreviation =
            (name1.length() <= 10 && !name1.contains(" ")) || (name2.length() <= 10 && !name2.contains(" "));
        if (potentialAbbreviation) {
            return true;
        }
        String first1 = tokens1[0];
        String first2 = tokens2[0];
        if (first1.length() >= 2 && first2.length() >= 2 && first1.regionMatches(0, first2, 0, 2)) {
            return true;
        }
        int sharedChars = 0;
        for (char c : first1.toCharArray()) {
            if (first2.indexOf(c) >= 0) {
                sharedChars++;
            }
        }
        return sharedChars > first1.length() / 2;
    }

    /**
     * Token overlap: |intersection| / |union|.
     */
    public double computeJaccardSimilarity(@NotNull String name1, @NotNull String name2) {
        Set<String> tokens1 = tokenize(name1);
        Set<String> tokens2 = tokenize(name2);
        if (tokens1.isEmpty() || tokens2.isEmpty()) {
            return 0.0;
        }
        Set<String> intersection = new HashSet<>(tokens1);
        intersection.retainAll(tokens2);
        Set<String> union = new HashSet<>(tokens1);
        union.addAll(tokens2);
        return (double) intersection.size() / union.size();
    }

    /**
     * 1.0 if one normalized name contains the other, 0.0 otherwise.
     */
    public double computeContainmentScore(@NotNull String name1, @NotNull String name2) {
        String normalized1 = normalizeName(name1);
        String normalized2 = normalizeName(name2);
        if (normalized1.isEmpty() || normalized2.isEmpty()) {
            return 0.0;
        }
        return normalized1.contains(normalized2) || normalized2.contains(normalized1) ? 1.0 : 0.0;
    }

    /**
     * 1 - editDistance / maxLength over normalized names.
     */
    public double computeLevenshteinSimilarity(@NotNull String name1, @NotNull String name2) {
        String normalized1 = normalizeName(name1);
        String normalized2 = normalizeName(name2);
        if (normalized1.equals(normalized2)) {
            return 1.0;
        }
        int maxLength = Math.max(normalized1.length(), normalized2.length());
        return 1.0 - ((double) levenshteinDistance(normalized1, normalized2) / maxLength);
    }

    private static int levenshteinDistance(String s1, String s2) {
        int[] previous = new int[s2.length() + 1];
        int[] current = new int[s2.length() + 1];
        for (int j = 0; j <= s2.length(); j++) {
            previous[j] = j;
        }
        for (int i = 1; i <= s1.length(); i++) {
            current[0] = i;
            for (int j = 1; j <= s2.length(); j++) {
                int cost = s1.charAt(i - 1) == s2.charAt(j - 1) ? 0 : 1;
                current[j] = Math.min(Math.min(previous[j] + 1, current[j - 1] + 1), previous[j - 1] + cost);
            }
            int[] swap = previous;
            previous = current;
            current = swap;
        }
        return previous[s2.length()];
    }

    /**
     * 1.0 if one name is the acronym of the other ("MIT" / "Massachusetts Institute of Technology").
     */
    public double computeAbbreviationScore(@NotNull String name1, @NotNull String name2) {
        String normalized1 = normalizeName(name1);
        String normalized2 = normalizeName(name2);
        if (normalized1.equals(normalized2)) {
            return 1.0;
        }
        return isAcronymOf(normalized1, normalized2) || isAcronymOf(normalized2, normalized1) ? 1.0 : 0.0;
    }

    private static boolean isAcronymOf(String shortName, String longName) {
        if (shortName.contains(" ") || shortName.length() >= longName.length()) {
            return false;
        }
        String[] words = longName.split(" ");
        if (words.length < 2) {
            return false;
        }
        StringBuilder acronym = new StringBuilder();
        for (String word : words) {
            if (!word.isEmpty() && !STOP_WORDS.contains(word)) {
                acronym.append(word.charAt(0));
            }
        }
        return shortName.equals(acronym.toString());
    }

    /**
     * True when both names have the same number of tokens, every token pair is equal or an
     * initial of the other, and at least one pair is a full-word match.
     */
    public boolean isInitialsMatch(@NotNull String normalized1, @NotNull String normalized2) {
        String[] tokens1 = normalized1.split(" ");
        String[] tokens2 = normalized2.split(" ");
        if (tokens1.length != tokens2.length || tokens1.length < 2) {
            return false;
        }
        boolean initialUsed = false;
        boolean fullWordShared = false;
        for (int i = 0; i < tokens1.length; i++) {
            String a = tokens1[i];
            String b = tokens2[i];
            if (a.equals(b)) {
                fullWordShared |= a.length() > 1;
            } else if (a.length() == 1 && b.length() > 1 && b.charAt(0) == a.charAt(0)
                    || b.length() == 1 && a.length() > 1 && a.charAt(0) == b.charAt(0)) {
                initialUsed = true;
            } else {
                return false;
            }
        }
        return initialUsed && fullWordShared;
    }

    /**
     * Lowercase, punctuation removed, whitespace collapsed.
     */
    @NotNull
    public static String normalizeName(@NotNull String name) {
        return name.replaceAll("[^\\p{L}\\p{N}\\s]", "")
                   .toLowerCase(Locale.ROOT)
                   .trim()
                   .replaceAll("\\s+", " ");
    }

    @NotNull
    public static Set<String> tokenize(@NotNull String name) {
        String normalized = normalizeName(name);
        Set<String> result = new HashSet<>();
        if (normalized.isEmpty()) {
            return result;
        }
        for (String token : normalized.split(" ")) {
            if (!token.isEmpty()) {
                result.add(token);
            }
        }
        return result;
    }
}
