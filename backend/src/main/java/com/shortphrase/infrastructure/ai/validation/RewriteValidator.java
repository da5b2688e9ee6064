package com.shortphrase.infrastructure.ai.validation;

import com.shortphrase.domain.rewrite.model.RejectionReason;
import com.shortphrase.domain.rewrite.model.RewriteCandidate;
import com.shortphrase.domain.rewrite.model.ValidationVerdict;
import com.shortphrase.domain.rewrite.service.WordCounter;
import lombok.extern.slf4j.Slf4j;

import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Rule-based check of an oracle rewrite against its original sentence.
 * Rules run in order and the first failure is reported:
 * malformed output, word limit, language, content preservation.
 */
@Slf4j
public class RewriteValidator {

    // French function words that are not in the detector profiles but carry no content
    private static final Set<String> EXTRA_STOPWORDS = Set.of(
            "ou", "donc", "car", "quoi", "dont", "où", "sous", "sans", "par", "vers", "chez",
            "être", "avoir", "son", "sa", "ses", "mon", "ma", "mes", "ton", "ta", "tes", "leur",
            "leurs", "notre", "nos", "votre", "vos", "cet", "ces", "elles", "tu", "me", "te", "se",
            "lui", "en", "y", "ne", "plus", "tout", "tous", "toute", "toutes", "bien", "encore",
            "déjà", "aussi", "ainsi", "alors"
    );

    private final LanguageDetector languageDetector;
    private final int minLanguageWords;
    private final double minContentOverlap;
    private final Set<String> stopwords;

    /**
     * @param languageDetector  heuristic detector shared with other components
     * @param minLanguageWords  fragments shorter than this skip the language rule
     * @param minContentOverlap minimum share of the original's significant words kept, 0..1
     */
    public RewriteValidator(LanguageDetector languageDetector, int minLanguageWords, double minContentOverlap) {
        this.languageDetector = languageDetector;
        this.minLanguageWords = minLanguageWords;
        this.minContentOverlap = minContentOverlap;
        this.stopwords = new HashSet<>(LanguageDetector.allStopwords());
        this.stopwords.addAll(EXTRA_STOPWORDS);
    }

    public ValidationVerdict validate(String original, RewriteCandidate candidate, int limit) {
        if (candidate == null || candidate.isEmpty()) {
            return ValidationVerdict.reject(RejectionReason.MALFORMED_RESPONSE, "no fragments returned");
        }
        List<String> fragments = candidate.fragments();

        for (int i = 0; i < fragments.size(); i++) {
            if (fragments.get(i) == null || fragments.get(i).isBlank()) {
                return ValidationVerdict.reject(RejectionReason.MALFORMED_RESPONSE,
                        "fragment " + (i + 1) + " is blank");
            }
        }

        for (int i = 0; i < fragments.size(); i++) {
            int words = WordCounter.count(fragments.get(i));
            if (words > limit) {
                return ValidationVerdict.reject(RejectionReason.OVER_LIMIT,
                        String.format("fragment %d has %d words (limit %d)", i + 1, words, limit));
            }
        }

        Optional<String> originalLanguage = languageDetector.detect(original);
        if (originalLanguage.isPresent()) {
            for (int i = 0; i < fragments.size(); i++) {
                String fragment = fragments.get(i);
                if (WordCounter.count(fragment) < minLanguageWords) {
                    continue;
                }
                Optional<String> fragmentLanguage = languageDetector.detect(fragment);
                if (fragmentLanguage.isPresent() && !fragmentLanguage.get().equals(originalLanguage.get())) {
                    return ValidationVerdict.reject(RejectionReason.WRONG_LANGUAGE,
                            String.format("fragment %d looks like '%s', original is '%s'",
                                    i + 1, fragmentLanguage.get(), originalLanguage.get()));
                }
            }
        }

        double overlap = contentOverlap(original, fragments);
        if (overlap < minContentOverlap) {
            return ValidationVerdict.reject(RejectionReason.CONTENT_DRIFT,
                    String.format("only %.0f%% of key words preserved (minimum %.0f%%)",
                            overlap * 100, minContentOverlap * 100));
        }

        return ValidationVerdict.accept();
    }

    /**
     * Share of the original's significant words found in the fragments. 1.0 if the
     * original has none.
     */
    public double contentOverlap(String original, List<String> fragments) {
        Set<String> originalKeys = significantWords(original);
        if (originalKeys.isEmpty()) {
            return 1.0;
        }
        Set<String> rewrittenKeys = significantWords(String.join(" ", fragments));
        long kept = originalKeys.stream().filter(rewrittenKeys::contains).count();
        return (double) kept / originalKeys.size();
    }

    Set<String> significantWords(String text) {
        Set<String> words = new HashSet<>();
        for (String token : LanguageDetector.tokens(text)) {
            if (token.length() > 3 && !stopwords.contains(token)) {
                words.add(token);
            }
        }
        return words;
    }
}
