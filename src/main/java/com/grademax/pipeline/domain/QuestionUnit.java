package com.grademax.pipeline.domain;

import com.grademax.pipeline.domain.DomainModels.Classification;
import com.grademax.pipeline.domain.DomainModels.ClassificationMethod;
import com.grademax.pipeline.domain.DomainModels.Difficulty;
import com.grademax.pipeline.domain.DomainModels.PageRange;

import java.util.List;

public class QuestionUnit {
    private final String id;
    private final String paperId;
    private final String questionNumber;
    private final String partCode;
    private final List<PageRange> pageRanges;
    private final String text;
    private final Integer markValue;
    private final boolean hasDiagram;

    private String topicCode;
    private Difficulty difficulty;
    private double confidence;
    private ClassificationMethod classificationMethod;
    private boolean reviewRequired;

    public QuestionUnit(String id, String paperId, String questionNumber, String partCode,
                        List<PageRange> pageRanges, String text, Integer markValue, boolean hasDiagram) {
        this.id = id;
        this.paperId = paperId;
        this.questionNumber = questionNumber;
        this.partCode = partCode == null ? "" : partCode;
        this.pageRanges = List.copyOf(pageRanges);
        this.text = text == null ? "" : text;
        this.markValue = markValue;
        this.hasDiagram = hasDiagram;
    }

    public static QuestionUnit restore(String id, String paperId, String questionNumber, String partCode,
                                       List<PageRange> pageRanges, String text, Integer markValue, boolean hasDiagram,
                                       Classification classification, boolean reviewRequired) {
        QuestionUnit unit = new QuestionUnit(id, paperId, questionNumber, partCode, pageRanges, text, markValue, hasDiagram);
        if (classification != null) unit.applyClassification(classification);
        unit.reviewRequired = reviewRequired;
        return unit;
    }

    public synchronized QuestionUnit withPaperId(String newPaperId) {
        Classification classification = topicCode == null ? null
                : new Classification(topicCode, difficulty, confidence, classificationMethod);
        return restore(id, newPaperId, questionNumber, partCode, pageRanges, text, markValue, hasDiagram,
                classification, reviewRequired);
    }

    public synchronized void applyClassification(Classification classification) {
        this.topicCode = classification.topicCode();
        this.difficulty = classification.difficulty();
        this.confidence = Math.max(0.0, Math.min(1.0, classification.confidence()));
        this.classificationMethod = classification.method();
    }

    public synchronized void flagForReview() {
        this.reviewRequired = true;
    }

    public boolean isWholeQuestion() {
        return partCode.isEmpty();
    }

    public int pageCount() {
        return pageRanges.size();
    }

    public String getId() {
        return id;
    }

    public String getPaperId() {
        return paperId;
    }

    public String getQuestionNumber() {
        return questionNumber;
    }

    public String getPartCode() {
        return partCode;
    }

    public List<PageRange> getPageRanges() {
        return pageRanges;
    }

    public String getText() {
        return text;
    }

    public Integer getMarkValue() {
        return markValue;
    }

    public boolean isHasDiagram() {
        return hasDiagram;
    }

    public synchronized String getTopicCode() {
        return topicCode;
    }

    public synchronized Difficulty getDifficulty() {
        return difficulty;
    }

    public synchronized double getConfidence() {
        return confidence;
    }

    public synchronized ClassificationMethod getClassificationMethod() {
        return classificationMethod;
    }

    public synchronized boolean isReviewRequired() {
        return reviewRequired;
    }

    @Override
    public String toString() {
        return "Q" + questionNumber + partCode;
    }
}
