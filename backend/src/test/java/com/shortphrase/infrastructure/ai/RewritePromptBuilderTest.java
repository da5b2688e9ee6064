package com.shortphrase.infrastructure.ai;

import com.shortphrase.domain.rewrite.model.BatchComplexityClass;
import com.shortphrase.domain.rewrite.model.OracleRequest;
import com.shortphrase.domain.rewrite.model.RejectionReason;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class RewritePromptBuilderTest {

    private final RewritePromptBuilder builder = new RewritePromptBuilder();

    @Test
    void system_prompt_states_the_limit_and_format() {
        String prompt = builder.buildSystemPrompt(8);

        assertThat(prompt).contains("8 words or fewer").contains("Never translate").contains("\"results\"");
    }

    @Test
    void user_message_numbers_sentences_from_one() {
        String message = builder.buildUserMessage(OracleRequest.batch(
                List.of("Première phrase.", "Deuxième phrase."), 8, BatchComplexityClass.MEDIUM));

        assertThat(message)
                .contains("two or three short sentences")
                .contains("1. \"Première phrase.\"")
                .contains("2. \"Deuxième phrase.\"");
    }

    @Test
    void strict_message_cites_the_rejection() {
        String message = builder.buildUserMessage(OracleRequest.strict(
                "Première phrase.", 5, BatchComplexityClass.SIMPLE, RejectionReason.WRONG_LANGUAGE));

        assertThat(message)
                .contains("not written in the language of the original")
                .contains("at most 5 words")
                .doesNotContain("barely over the limit");
    }
}
