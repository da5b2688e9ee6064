package com.shortphrase.infrastructure.ai.validation;

import java.util.Arrays;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Stopword-profile language guess for short texts.
 * Each language scores one point per token found in its stopword list; the text is
 * attributed to the single best-scoring language. No hits or a tie means undetermined.
 */
public class LanguageDetector {

    private static final Pattern NON_WORD = Pattern.compile("[^\\p{L}\\p{N}]+");

    // Lists are disjoint; words French shares with another language ("es", "su", "con", "y") are left out
    private static final Map<String, Set<String>> PROFILES = new LinkedHashMap<>();

    static {
        PROFILES.put("fr", Set.of(
                "le", "la", "les", "des", "du", "de", "et", "est", "une", "un", "dans", "sur", "avec",
                "pour", "pas", "qui", "que", "il", "elle", "nous", "vous", "ils", "au", "aux", "ce",
                "cette", "sont", "était", "près", "mais", "très", "je", "tu", "suis", "ai", "ont",
                "avait", "comme", "où", "été", "leurs"));
        PROFILES.put("en", Set.of(
                "the", "and", "is", "are", "was", "were", "of", "to", "in", "with", "for", "that",
                "this", "it", "he", "she", "they", "we", "you", "not", "be", "have", "has", "at", "by",
                "from", "but"));
        PROFILES.put("es", Set.of(
                "el", "los", "del", "por", "para", "pero", "muy", "como", "sus", "está", "una", "al",
                "lo", "hay", "fue", "yo", "porque", "cuando", "también"));
        PROFILES.put("it", Set.of(
                "gli", "della", "delle", "degli", "dei", "che", "sono", "è", "nel", "nella", "anche",
                "questo", "questa", "molto", "ed", "perché"));
        PROFILES.put("de", Set.of(
                "der", "die", "das", "und", "ist", "nicht", "ein", "eine", "mit", "auf", "für", "den",
                "dem", "sich", "auch", "von", "zu", "ich", "wir"));
        PROFILES.put("pt", Set.of(
                "não", "do", "da", "dos", "das", "em", "é", "são", "ao", "muito", "você", "ele",
                "ela", "seu", "sua"));
    }

    /**
     * @return ISO 639-1 code of the detected language, empty when undetermined
     */
    public Optional<String> detect(String text) {
        if (text == null || text.isBlank()) {
            return Optional.empty();
        }
        Map<String, Integer> scores = new LinkedHashMap<>();
        for (String token : tokens(text)) {
            PROFILES.forEach((language, stopwords) -> {
                if (stopwords.contains(token)) {
                    scores.merge(language, 1, Integer::sum);
                }
            });
        }

        String best = null;
        int bestScore = 0;
        boolean tie = false;
        for (Map.Entry<String, Integer> entry : scores.entrySet()) {
            if (entry.getValue() > bestScore) {
                best = entry.getKey();
                bestScore = entry.getValue();
                tie = false;
            } else if (entry.getValue() == bestScore) {
                tie = true;
            }
        }
        return tie ? Optional.empty() : Optional.ofNullable(best);
    }

    /**
     * Union of every profile's stopwords, used to ignore function words in content checks.
     */
    public static Set<String> allStopwords() {
        Set<String> all = new HashSet<>();
        PROFILES.values().forEach(all::addAll);
        return all;
    }

    static String[] tokens(String text) {
        return Arrays.stream(NON_WORD.split(text.toLowerCase(Locale.ROOT)))
                .filter(t -> !t.isEmpty())
                .toArray(String[]::new);
    }
}
