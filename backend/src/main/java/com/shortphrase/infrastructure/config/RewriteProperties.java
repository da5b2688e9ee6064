package com.shortphrase.infrastructure.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.util.HashMap;
import java.util.Map;

/**
 * Tunables of the rewriting pipeline, bound from {@code rewrite.*}.
 */
@Data
@Validated
@ConfigurationProperties(prefix = "rewrite")
public class RewriteProperties {

    @Min(1)
    private int defaultWordLimit = 8;

    private boolean cleanInput = true;

    @Valid
    private Routing routing = new Routing();

    @Valid
    private Chunking chunking = new Chunking();

    @Valid
    private Batching batching = new Batching();

    @Valid
    private Retry retry = new Retry();

    @Valid
    private Cache cache = new Cache();

    @Valid
    private Validation validation = new Validation();

    @Valid
    private Oracle oracle = new Oracle();

    @Valid
    private Executor executor = new Executor();

    @Data
    public static class Routing {
        @Min(1)
        private int ceilingMultiplier = 4;
        @Min(1)
        private int maxOracleWords = 500;
    }

    @Data
    public static class Chunking {
        private boolean preferClauseBreaks = true;
    }

    @Data
    public static class Batching {
        @DecimalMin("1.0")
        private double simpleFactor = 1.5;
        @DecimalMin("1.0")
        private double complexFactor = 2.25;
        @Min(1)
        private int simpleBatchSize = 20;
        @Min(1)
        private int mediumBatchSize = 10;
        @Min(1)
        private int complexBatchSize = 5;
        @Min(100)
        private int maxBatchTokens = 2000;
        @Min(0)
        private int promptOverheadTokens = 250;
    }

    @Data
    public static class Retry {
        @Min(1)
        private int maxAttempts = 3;
        @Min(0)
        private long baseDelayMs = 1000;
        @DecimalMin("1.0")
        private double multiplier = 2.0;
        @Min(0)
        private long maxDelayMs = 10_000;
        @DecimalMin("0.0")
        @DecimalMax(value = "1.0", inclusive = false)
        private double jitter = 0.2;
    }

    @Data
    public static class Cache {
        @Min(1)
        private int capacity = 500;
    }

    @Data
    public static class Validation {
        @Min(1)
        private int minLanguageWords = 3;
        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private double minContentOverlap = 0.4;
    }

    @Data
    public static class Oracle {
        @NotBlank
        @Pattern(regexp = "openai|gemini")
        private String provider = "openai";
        @Min(1)
        private int maxConcurrentBatches = 4;
        @Valid
        private Map<String, Pricing> pricing = new HashMap<>();
    }

    @Data
    public static class Pricing {
        @DecimalMin("0.0")
        private double inputPerMillion;
        @DecimalMin("0.0")
        private double outputPerMillion;
    }

    @Data
    public static class Executor {
        @Min(1)
        private int corePoolSize = 4;
        @Min(1)
        private int maxPoolSize = 8;
        @Min(0)
        private int queueCapacity = 100;
        @NotBlank
        private String threadNamePrefix = "oracle-";
    }
}
