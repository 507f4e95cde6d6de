package com.grademax.pipeline.classification;

import com.grademax.pipeline.classification.ClassificationModels.ClassificationItem;
import com.grademax.pipeline.classification.ClassificationModels.ClassificationReport;
import com.grademax.pipeline.classification.ClassificationModels.ExternalClassification;
import com.grademax.pipeline.classification.ClassificationModels.KeywordMatch;
import com.grademax.pipeline.config.PipelineProperties;
import com.grademax.pipeline.config.SubjectProfile;
import com.grademax.pipeline.domain.DomainModels.Classification;
import com.grademax.pipeline.domain.DomainModels.ClassificationMethod;
import com.grademax.pipeline.domain.DomainModels.Difficulty;
import com.grademax.pipeline.domain.DomainModels.MarkSchemeLink;
import com.grademax.pipeline.domain.PipelineIssue;
import com.grademax.pipeline.domain.QuestionUnit;
import com.grademax.pipeline.exception.ClassificationServiceError;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.*;

import static com.grademax.pipeline.domain.PipelineIssue.Codes.CLASSIFICATION_SERVICE_ERROR;
import static com.grademax.pipeline.domain.PipelineIssue.Codes.LOW_CONFIDENCE_CLASSIFICATION;

@Service
public class TopicClassifier {
    private static final Logger log = LoggerFactory.getLogger(TopicClassifier.class);

    private final KeywordTopicMatcher keywordMatcher;
    private final DifficultyEstimator difficultyEstimator;
    private final double threshold;
    private final int batchSize;

    public TopicClassifier(KeywordTopicMatcher keywordMatcher, DifficultyEstimator difficultyEstimator, PipelineProperties properties) {
        this.keywordMatcher = keywordMatcher;
        this.difficultyEstimator = difficultyEstimator;
        this.threshold = properties.classification().acceptanceThreshold();
        this.batchSize = properties.classification().batchSize();
    }

    public Classification classify(QuestionUnit unit, SubjectProfile profile, ClassificationContext context) {
        classifyAll(List.of(unit), Map.of(), profile, context);
        return new Classification(unit.getTopicCode(), unit.getDifficulty(), unit.getConfidence(), unit.getClassificationMethod());
    }

    public ClassificationReport classifyAll(List<QuestionUnit> units, Map<String, MarkSchemeLink> links,
                                            SubjectProfile profile, ClassificationContext context) {
        List<PipelineIssue> issues = new ArrayList<>();
        Map<String, Classification> candidates = new HashMap<>();
        Map<String, Classification> accepted = new LinkedHashMap<>();

        for (QuestionUnit unit : units) {
            KeywordMatch match = keywordMatcher.match(unit.getText(), profile);
            Difficulty difficulty = difficultyEstimator.estimate(unit.getText(), unit.getMarkValue());
            Classification candidate = match.hit()
                    ? new Classification(match.topicCode(), difficulty, match.confidence(), ClassificationMethod.KEYWORD)
                    : new Classification(profile.fallbackTopic(), difficulty, 0.0, ClassificationMethod.FALLBACK);
            candidates.put(unit.getId(), candidate);
            if (candidate.confidence() >= threshold) accepted.put(unit.getId(), candidate);
        }

        List<QuestionUnit> pending = units.stream().filter(u -> !accepted.containsKey(u.getId())).toList();
        if (context.externalAvailable() && !pending.isEmpty()) {
            external(pending, links, profile, context, candidates, accepted, issues);
        }

        int keyword = 0, external = 0, fallback = 0, review = 0;
        for (QuestionUnit unit : units) {
            Classification result = accepted.getOrDefault(unit.getId(), candidates.get(unit.getId()));
            unit.applyClassification(result);
            switch (result.method()) {
                case KEYWORD -> keyword++;
                case EXTERNAL -> external++;
                case FALLBACK -> fallback++;
            }
            if (result.confidence() < threshold) {
                unit.flagForReview();
                review++;
                issues.add(PipelineIssue.unit(LOW_CONFIDENCE_CLASSIFICATION, String.format(Locale.ROOT,
                        "%s classified as %s with confidence %.2f (%s)", unit, result.topicCode(), result.confidence(), result.method()), unit));
            }
        }
        log.debug("Classified {} units: keyword={}, external={}, fallback={}, review={}", units.size(), keyword, external, fallback, review);
        return new ClassificationReport(keyword, external, fallback, review, context.isCancelled(), issues);
    }

    private void external(List<QuestionUnit> pending, Map<String, MarkSchemeLink> links, SubjectProfile profile,
                          ClassificationContext context, Map<String, Classification> candidates,
                          Map<String, Classification> accepted, List<PipelineIssue> issues) {
        for (int from = 0; from < pending.size(); from += batchSize) {
            if (context.isCancelled()) {
                log.info("Classification cancelled; {} units left to the fallback tier", pending.size() - from);
                return;
            }
            List<QuestionUnit> batch = pending.subList(from, Math.min(pending.size(), from + batchSize));
            List<ClassificationItem> items = new ArrayList<>();
            for (int i = 0; i < batch.size(); i++) {
                MarkSchemeLink link = links.get(batch.get(i).getId());
                items.add(new ClassificationItem(i, batch.get(i).getText(), link == null ? null : link.rawSnippet()));
            }

            List<ExternalClassification> results;
            try {
                results = context.call(profile, items);
            } catch (ClassificationServiceError e) {
                log.warn("External classification failed for {} units: {}", batch.size(), e.getMessage());
                issues.add(PipelineIssue.paper(CLASSIFICATION_SERVICE_ERROR, e.getMessage()));
                continue;
            } catch (RuntimeException e) {
                log.warn("External classification client broke on {} units", batch.size(), e);
                issues.add(PipelineIssue.paper(CLASSIFICATION_SERVICE_ERROR, "Classification client error: " + e));
                continue;
            }

            for (ExternalClassification result : results) {
                if (result == null || result.index() < 0 || result.index() >= batch.size()) continue;
                QuestionUnit unit = batch.get(result.index());
                if (result.confidence() < threshold || !profile.knowsTopic(result.topicCode())) continue;
                Difficulty difficulty = result.difficulty() != null ? result.difficulty() : candidates.get(unit.getId()).difficulty();
                accepted.putIfAbsent(unit.getId(), new Classification(result.topicCode(), difficulty, result.confidence(), ClassificationMethod.EXTERNAL));
            }
        }
    }
}
