package com.grademax.pipeline.classification;

import com.fasterxml.jackson.databind.JsonNode;
import com.grademax.pipeline.classification.ClassificationModels.ClassificationItem;
import com.grademax.pipeline.classification.ClassificationModels.ExternalClassification;
import com.grademax.pipeline.config.PipelineProperties;
import com.grademax.pipeline.config.SubjectProfile;
import com.grademax.pipeline.config.SubjectProfile.TopicProfile;
import com.grademax.pipeline.exception.ClassificationServiceError;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.core.codec.CodecException;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientException;
import reactor.core.publisher.Mono;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

@Component
@ConditionalOnProperty(prefix = "pipeline.classification.external", name = "enabled", havingValue = "true")
public class LlmClassificationClient implements ClassificationClient {
    private static final Logger log = LoggerFactory.getLogger(LlmClassificationClient.class);
    private static final int MAX_CACHE_ENTRIES = 1000;
    private static final int MAX_ITEM_TEXT = 1500;

    private final WebClient webClient;
    private final PipelineProperties.External config;
    private final ClassificationReplyParser replyParser;
    private final Retry retry;
    private final Map<String, List<ExternalClassification>> cache = new ConcurrentHashMap<>();

    public LlmClassificationClient(WebClient.Builder builder, PipelineProperties properties, ClassificationReplyParser replyParser) {
        this.config = properties.classification().external();
        this.replyParser = replyParser;
        WebClient.Builder configured = builder.baseUrl(config.baseUrl());
        if (config.apiKey() != null && !config.apiKey().isBlank()) {
            configured = configured.defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + config.apiKey());
        }
        this.webClient = configured.build();
        this.retry = Retry.of("classification", RetryConfig.custom()
                .maxAttempts(config.maxAttempts())
                .waitDuration(config.retryWait())
                .retryExceptions(ClassificationServiceError.class)
                .ignoreExceptions(RateLimited.class)
                .build());
    }

    @Override
    public List<ExternalClassification> classifyBatch(SubjectProfile subject, List<ClassificationItem> items) {
        if (items.isEmpty()) return List.of();
        String prompt = userPrompt(subject, items);
        String key = sha256(config.model() + ":" + config.temperature() + ":" + prompt);
        List<ExternalClassification> cached = cache.get(key);
        if (cached != null) {
            log.debug("Classification cache hit for {} items", items.size());
            return cached;
        }

        Supplier<List<ExternalClassification>> call = () -> replyParser.parse(complete(systemPrompt(subject), prompt), items.size());
        List<ExternalClassification> result = Retry.decorateSupplier(retry, call).get();
        if (cache.size() >= MAX_CACHE_ENTRIES) cache.clear();
        cache.put(key, result);
        return result;
    }

    private String complete(String system, String user) {
        Map<String, Object> body = Map.of(
                "model", config.model(),
                "temperature", config.temperature(),
                "max_tokens", config.maxTokens(),
                "messages", List.of(
                        Map.of("role", "system", "content", system),
                        Map.of("role", "user", "content", user)));
        try {
            JsonNode response = webClient.post()
                    .uri("/v1/chat/completions")
                    .bodyValue(body)
                    .retrieve()
                    .onStatus(s -> s.value() == HttpStatus.TOO_MANY_REQUESTS.value(),
                            r -> Mono.error(new RateLimited("Classification service rejected the call: rate limited")))
                    .bodyToMono(JsonNode.class)
                    .block(config.timeout());
            if (response == null) throw new ClassificationServiceError("Empty response from classification service");
            JsonNode content = response.path("choices").path(0).path("message").path("content");
            if (content.isMissingNode() || content.isNull()) {
                throw new ClassificationServiceError("Classification response has no message content");
            }
            return content.asText();
        } catch (ClassificationServiceError e) {
            throw e;
        } catch (WebClientException e) {
            throw new ClassificationServiceError("Classification call failed: " + e.getMessage(), e);
        } catch (CodecException e) {
            throw new ClassificationServiceError("Unreadable classification response: " + e.getMessage(), e);
        } catch (IllegalStateException e) {
            // block(timeout) signals a timeout this way
            throw new ClassificationServiceError("Classification call timed out after " + config.timeout(), e);
        } catch (RuntimeException e) {
            throw new ClassificationServiceError("Classification call failed: " + e, e);
        }
    }

    private String systemPrompt(SubjectProfile subject) {
        return "You classify " + subject.name() + " exam questions into syllabus topics. "
                + "Reply with a JSON array only, one object per question: "
                + "{\"index\": <number>, \"topic\": \"<topic code>\", \"difficulty\": \"easy|medium|hard\", \"confidence\": <0.0-1.0>}.";
    }

    private String userPrompt(SubjectProfile subject, List<ClassificationItem> items) {
        StringBuilder prompt = new StringBuilder("Topics:\n");
        for (TopicProfile topic : subject.topics()) {
            prompt.append(topic.code()).append(": ").append(topic.name());
            if (!topic.core().isEmpty()) prompt.append(" (").append(String.join(", ", topic.core())).append(')');
            prompt.append('\n');
        }
        prompt.append("\nQuestions:\n");
        for (ClassificationItem item : items) {
            prompt.append("[").append(item.index()).append("] ").append(truncate(item.questionText())).append('\n');
            if (item.markSchemeSnippet() != null && !item.markSchemeSnippet().isBlank()) {
                prompt.append("Mark scheme: ").append(truncate(item.markSchemeSnippet())).append('\n');
            }
        }
        return prompt.toString();
    }

    private String truncate(String text) {
        String flat = text == null ? "" : text.replaceAll("\\s+", " ").trim();
        return flat.length() > MAX_ITEM_TEXT ? flat.substring(0, MAX_ITEM_TEXT) : flat;
    }

    private static String sha256(String value) {
        try {
            byte[] digest = MessageDigest.getInstance("SHA-256").digest(value.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(digest);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    static final class RateLimited extends ClassificationServiceError {
        RateLimited(String message) {
            super(message);
        }
    }
}
