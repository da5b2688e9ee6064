package com.shortphrase.infrastructure.ai;

import com.shortphrase.domain.rewrite.model.BatchComplexityClass;
import com.shortphrase.domain.rewrite.model.OracleRequest;
import com.shortphrase.domain.rewrite.model.RejectionReason;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

@Component
public class RewritePromptBuilder {

    private static final Map<BatchComplexityClass, String> COMPLEXITY_HINTS = Map.of(
            BatchComplexityClass.SIMPLE,
            "These sentences are barely over the limit: two sentences are usually enough.",
            BatchComplexityClass.MEDIUM,
            "These sentences usually need two or three short sentences.",
            BatchComplexityClass.COMPLEX,
            "These sentences are long: split them into as many short sentences as needed."
    );

    private static final Map<RejectionReason, String> REJECTION_HINTS = Map.of(
            RejectionReason.OVER_LIMIT,
            "Your previous answer had a sentence above the word limit. Count the words of every sentence.",
            RejectionReason.WRONG_LANGUAGE,
            "Your previous answer was not written in the language of the original. Answer in that language only.",
            RejectionReason.CONTENT_DRIFT,
            "Your previous answer lost too much of the original wording. Reuse the original words.",
            RejectionReason.MALFORMED_RESPONSE,
            "Your previous answer could not be read. Follow the JSON format exactly."
    );

    // ===== System prompt =====

    private static final String SYSTEM_PROMPT_TEMPLATE = """
            You are a language expert specializing in sentence simplification.
            Rewrite long sentences into shorter, grammatically correct sentences while preserving
            the original meaning and reusing as many original words as possible.

            ## Rules
            1. Every output sentence must contain %d words or fewer (words are separated by spaces).
            2. Write in the same language as the original sentence. Never translate.
            3. Preserve the complete meaning: no added facts, no dropped facts.
            4. Reuse the original vocabulary whenever possible.
            5. Keep the tone and style of the original.
            6. No explanations, commentary, numbering or bullet points.

            ## Output format
            Answer with a JSON object only:
            {"results": [{"id": 1, "sentences": ["...", "..."]}, {"id": 2, "sentences": ["..."]}]}
            One entry per input sentence, using the id given in the input.
            """;

    public String buildSystemPrompt(int wordLimit) {
        return SYSTEM_PROMPT_TEMPLATE.formatted(wordLimit);
    }

    /**
     * Numbered list of the request's sentences, ids starting at 1.
     */
    public String buildUserMessage(OracleRequest request) {
        StringBuilder sb = new StringBuilder();
        if (request.isStrict()) {
            sb.append(REJECTION_HINTS.get(request.previousRejection())).append("\n");
            sb.append("Be strict: at most ").append(request.wordLimit()).append(" words per sentence.\n\n");
        } else if (request.complexity() != null) {
            sb.append(COMPLEXITY_HINTS.get(request.complexity())).append("\n\n");
        }

        sb.append("Rewrite each sentence into sentences of ")
                .append(request.wordLimit())
                .append(" words or fewer:\n");
        List<String> sentences = request.sentences();
        for (int i = 0; i < sentences.size(); i++) {
            sb.append(i + 1).append(". \"").append(sentences.get(i)).append("\"\n");
        }
        return sb.toString();
    }
}
