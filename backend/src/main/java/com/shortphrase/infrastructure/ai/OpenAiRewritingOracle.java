package com.shortphrase.infrastructure.ai;

import com.openai.client.OpenAIClient;
import com.openai.errors.OpenAIException;
import com.openai.errors.OpenAIIoException;
import com.openai.errors.OpenAIServiceException;
import com.openai.models.ResponseFormatJsonObject;
import com.openai.models.chat.completions.ChatCompletion;
import com.openai.models.chat.completions.ChatCompletionCreateParams;
import com.shortphrase.domain.rewrite.exception.FatalOracleException;
import com.shortphrase.domain.rewrite.exception.TransientOracleException;
import com.shortphrase.domain.rewrite.model.AccessCheckResult;
import com.shortphrase.domain.rewrite.model.OracleRequest;
import com.shortphrase.domain.rewrite.model.OracleResponse;
import com.shortphrase.domain.rewrite.model.OracleUsage;
import com.shortphrase.domain.rewrite.service.RewritingOracle;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

/**
 * OpenAI chat-completions rewriting. One call per request, JSON response format,
 * SDK errors mapped to transient or fatal oracle exceptions.
 */
@Slf4j
@Service
@RequiredArgsConstructor
@ConditionalOnProperty(name = "rewrite.oracle.provider", havingValue = "openai", matchIfMissing = true)
public class OpenAiRewritingOracle implements RewritingOracle {

    public static final String PROVIDER = "openai";

    private final OpenAIClient openAIClient;
    private final RewritePromptBuilder promptBuilder;
    private final OracleResponseParser responseParser;

    @Value("${openai.model}")
    private String model;

    @Value("${openai.temperature}")
    private double temperature;

    @Value("${openai.max-tokens}")
    private int maxTokens;

    @Override
    public String name() {
        return PROVIDER;
    }

    @Override
    public OracleResponse rewrite(OracleRequest request) {
        var params = ChatCompletionCreateParams.builder()
                .model(model)
                .temperature(temperature)
                .maxCompletionTokens(maxTokens)
                .addSystemMessage(promptBuilder.buildSystemPrompt(request.wordLimit()))
                .addUserMessage(promptBuilder.buildUserMessage(request))
                .responseFormat(ResponseFormatJsonObject.builder().build())
                .build();

        ChatCompletion completion = execute(params);

        OracleUsage usage = completion.usage()
                .map(u -> new OracleUsage(u.promptTokens(), u.completionTokens()))
                .orElse(OracleUsage.NONE);
        log.debug("Token usage - prompt: {}, completion: {}", usage.inputTokens(), usage.outputTokens());

        String content = completion.choices().stream()
                .findFirst()
                .flatMap(choice -> choice.message().content())
                .orElse(null);

        return new OracleResponse(responseParser.parse(content, request.sentences().size()), usage);
    }

    @Override
    public AccessCheckResult checkAccess() {
        var params = ChatCompletionCreateParams.builder()
                .model(model)
                .maxCompletionTokens(5)
                .addSystemMessage("You are a helpful assistant.")
                .addUserMessage("Test")
                .build();
        try {
            openAIClient.chat().completions().create(params);
            return new AccessCheckResult(PROVIDER, AccessCheckResult.Status.VALID, "API key is valid and working");
        } catch (OpenAIServiceException e) {
            return switch (e.statusCode()) {
                case 401, 403 -> new AccessCheckResult(PROVIDER, AccessCheckResult.Status.INVALID_KEY,
                        "Invalid API key");
                case 429 -> new AccessCheckResult(PROVIDER, AccessCheckResult.Status.QUOTA_EXCEEDED,
                        "API key is valid but the quota is exhausted");
                default -> new AccessCheckResult(PROVIDER, AccessCheckResult.Status.ERROR,
                        "API error " + e.statusCode() + ": " + e.getMessage());
            };
        } catch (OpenAIException e) {
            return new AccessCheckResult(PROVIDER, AccessCheckResult.Status.ERROR,
                    "API connection error: " + e.getMessage());
        }
    }

    private ChatCompletion execute(ChatCompletionCreateParams params) {
        try {
            return openAIClient.chat().completions().create(params);
        } catch (OpenAIServiceException e) {
            if (isTransientStatus(e.statusCode())) {
                throw new TransientOracleException("OpenAI returned HTTP " + e.statusCode(), e);
            }
            throw new FatalOracleException("OpenAI rejected the request with HTTP " + e.statusCode(), e);
        } catch (OpenAIIoException e) {
            throw new TransientOracleException("OpenAI I/O failure: " + e.getMessage(), e);
        } catch (OpenAIException e) {
            throw new TransientOracleException("OpenAI call failed: " + e.getMessage(), e);
        }
    }

    /**
     * Timeouts, conflicts, rate limits and server errors are worth retrying; every other status is not.
     */
    static boolean isTransientStatus(int statusCode) {
        return statusCode == 408 || statusCode == 409 || statusCode == 429 || statusCode >= 500;
    }
}
