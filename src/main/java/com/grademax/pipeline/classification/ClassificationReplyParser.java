package com.grademax.pipeline.classification;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.grademax.pipeline.classification.ClassificationModels.ExternalClassification;
import com.grademax.pipeline.domain.DomainModels.Difficulty;
import com.grademax.pipeline.exception.ClassificationServiceError;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

@Component
public class ClassificationReplyParser {
    private static final Logger log = LoggerFactory.getLogger(ClassificationReplyParser.class);

    private final ObjectMapper objectMapper;

    public ClassificationReplyParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public List<ExternalClassification> parse(String reply, int batchSize) {
        if (reply == null || reply.isBlank()) throw new ClassificationServiceError("Empty classification reply");
        String body = reply.replaceAll("(?s)```(?:json)?", "").trim();
        int start = body.indexOf('[');
        int end = body.lastIndexOf(']');
        if (start < 0 || end <= start) throw new ClassificationServiceError("No JSON array in classification reply");

        JsonNode array;
        try {
            array = objectMapper.readTree(body.substring(start, end + 1));
        } catch (JsonProcessingException e) {
            throw new ClassificationServiceError("Malformed classification reply", e);
        }
        if (!array.isArray()) throw new ClassificationServiceError("Classification reply is not an array");

        List<ExternalClassification> results = new ArrayList<>();
        for (int i = 0; i < array.size(); i++) {
            JsonNode item = array.get(i);
            int index = item.path("index").asInt(i);
            String topic = text(item, "topic", "topicCode", "topic_code");
            double confidence = item.path("confidence").asDouble(-1);
            if (index < 0 || index >= batchSize || topic == null || confidence < 0) {
                log.debug("Dropping unusable classification item {}", item);
                continue;
            }
            Difficulty difficulty = Difficulty.fromLabel(text(item, "difficulty"));
            results.add(new ExternalClassification(index, topic, difficulty, Math.min(1.0, confidence)));
        }
        return results;
    }

    private String text(JsonNode node, String... names) {
        for (String name : names) {
            JsonNode value = node.get(name);
            if (value != null && !value.isNull() && !value.asText().isBlank()) return value.asText().trim();
        }
        return null;
    }
}
