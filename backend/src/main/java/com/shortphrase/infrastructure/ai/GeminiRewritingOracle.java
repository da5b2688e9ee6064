package com.shortphrase.infrastructure.ai;

import com.google.genai.Client;
import com.google.genai.errors.ApiException;
import com.google.genai.types.Content;
import com.google.genai.types.GenerateContentConfig;
import com.google.genai.types.GenerateContentResponse;
import com.google.genai.types.Part;
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
 * Gemini rewriting through the Google Gen AI SDK, same prompts and response format as OpenAI.
 */
@Slf4j
@Service
@RequiredArgsConstructor
@ConditionalOnProperty(name = "rewrite.oracle.provider", havingValue = "gemini")
public class GeminiRewritingOracle implements RewritingOracle {

    public static final String PROVIDER = "gemini";

    private final Client geminiClient;
    private final RewritePromptBuilder promptBuilder;
    private final OracleResponseParser responseParser;

    @Value("${gemini.model}")
    private String model;

    @Value("${gemini.temperature:0.3}")
    private float temperature;

    @Value("${gemini.max-tokens:2000}")
    private int maxTokens;

    @Override
    public String name() {
        return PROVIDER;
    }

    @Override
    public OracleResponse rewrite(OracleRequest request) {
        GenerateContentConfig config = GenerateContentConfig.builder()
                .systemInstruction(Content.fromParts(Part.fromText(promptBuilder.buildSystemPrompt(request.wordLimit()))))
                .temperature(temperature)
                .maxOutputTokens(maxTokens)
                .responseMimeType("application/json")
                .build();

        GenerateContentResponse response = execute(promptBuilder.buildUserMessage(request), config);

        OracleUsage usage = response.usageMetadata()
                .map(u -> new OracleUsage(
                        u.promptTokenCount().orElse(0),
                        u.candidatesTokenCount().orElse(0)))
                .orElse(OracleUsage.NONE);
        log.debug("Token usage - prompt: {}, completion: {}", usage.inputTokens(), usage.outputTokens());

        return new OracleResponse(responseParser.parse(response.text(), request.sentences().size()), usage);
    }

    @Override
    public AccessCheckResult checkAccess() {
        try {
            GenerateContentResponse response = geminiClient.models.generateContent(model, "Test", null);
            if (response.text() == null || response.text().isBlank()) {
                return new AccessCheckResult(PROVIDER, AccessCheckResult.Status.ERROR,
                        "API responded without content");
            }
            return new AccessCheckResult(PROVIDER, AccessCheckResult.Status.VALID, "Gemini API key is valid and working");
        } catch (ApiException e) {
            return switch (e.code()) {
                case 400, 401, 403 -> new AccessCheckResult(PROVIDER, AccessCheckResult.Status.INVALID_KEY,
                        "Invalid API key");
                case 429 -> new AccessCheckResult(PROVIDER, AccessCheckResult.Status.QUOTA_EXCEEDED,
                        "API key is valid but the quota is exhausted");
                default -> new AccessCheckResult(PROVIDER, AccessCheckResult.Status.ERROR,
                        "API error " + e.code() + ": " + e.getMessage());
            };
        } catch (RuntimeException e) {
            return new AccessCheckResult(PROVIDER, AccessCheckResult.Status.ERROR,
                    "API connection error: " + e.getMessage());
        }
    }

    private GenerateContentResponse execute(String userMessage, GenerateContentConfig config) {
        try {
            return geminiClient.models.generateContent(model, userMessage, config);
        } catch (ApiException e) {
            if (OpenAiRewritingOracle.isTransientStatus(e.code())) {
                throw new TransientOracleException("Gemini returned HTTP " + e.code(), e);
            }
            throw new FatalOracleException("Gemini rejected the request with HTTP " + e.code(), e);
        } catch (RuntimeException e) {
            // I/O failures surface as unchecked wrappers from the SDK's HTTP layer
            throw new TransientOracleException("Gemini call failed: " + e.getMessage(), e);
        }
    }
}
