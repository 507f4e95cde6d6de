package com.grademax.pipeline.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.List;
import java.util.Map;

@ConfigurationProperties("pipeline")
public record PipelineProperties(Classification classification,
                                 Storage storage,
                                 Ingestion ingestion,
                                 Map<String, Subject> subjects) {
    public PipelineProperties {
        if (classification == null) classification = new Classification(null, null, null, null, null, null, null);
        if (storage == null) storage = new Storage(null);
        if (ingestion == null) ingestion = new Ingestion(null);
        subjects = subjects == null ? Map.of() : Map.copyOf(subjects);
    }

    public record Classification(Double acceptanceThreshold,
                                 Double keywordConfidenceCap,
                                 Double keywordSaturation,
                                 Double negativeTermPenalty,
                                 Integer batchSize,
                                 Duration rateLimitDelay,
                                 External external) {
        public Classification {
            if (acceptanceThreshold == null) acceptanceThreshold = 0.7;
            if (keywordConfidenceCap == null) keywordConfidenceCap = 0.6;
            if (keywordSaturation == null) keywordSaturation = 2.1;
            if (negativeTermPenalty == null) negativeTermPenalty = 0.2;
            if (batchSize == null || batchSize < 1) batchSize = 20;
            if (rateLimitDelay == null) rateLimitDelay = Duration.ofMillis(1500);
            if (external == null) external = new External(false, null, null, null, null, null, null, null, null);
        }
    }

    public record External(boolean enabled,
                           String baseUrl,
                           String apiKey,
                           String model,
                           Duration timeout,
                           Integer maxAttempts,
                           Duration retryWait,
                           Double temperature,
                           Integer maxTokens) {
        public External {
            if (baseUrl == null) baseUrl = "http://localhost:1234";
            if (model == null) model = "local-model";
            if (timeout == null) timeout = Duration.ofSeconds(30);
            if (maxAttempts == null || maxAttempts < 1) maxAttempts = 2;
            if (retryWait == null) retryWait = Duration.ofSeconds(1);
            if (temperature == null) temperature = 0.1;
            if (maxTokens == null) maxTokens = 1500;
        }
    }

    public record Storage(String root) {
        public Storage {
            if (root == null || root.isBlank()) root = System.getProperty("java.io.tmpdir") + "/grademax-artifacts";
        }
    }

    public record Ingestion(Integer parallelism) {
        public Ingestion {
            if (parallelism == null || parallelism < 1) parallelism = 4;
        }
    }

    public record Subject(String name,
                          List<String> highPriorityPatterns,
                          List<String> lowPriorityPatterns,
                          List<String> validationKeywords,
                          Integer validationWindow,
                          List<String> denyList,
                          Integer minQuestion,
                          Integer maxQuestion,
                          Integer expectedMin,
                          Integer expectedMax,
                          Double leftMarginMax,
                          String fallbackTopic,
                          List<Topic> topics,
                          List<String> negativeTerms) {}

    public record Topic(String code, String name, List<String> core, List<String> supporting) {}
}
