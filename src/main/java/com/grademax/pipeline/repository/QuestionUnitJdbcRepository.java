package com.grademax.pipeline.repository;

import com.fasterxml.jackson.core.type.TypeReference;
import com.grademax.pipeline.domain.DomainModels.Classification;
import com.grademax.pipeline.domain.DomainModels.ClassificationMethod;
import com.grademax.pipeline.domain.DomainModels.Difficulty;
import com.grademax.pipeline.domain.DomainModels.PageRange;
import com.grademax.pipeline.domain.QuestionUnit;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.*;
import java.util.function.Function;
import java.util.stream.Collectors;

@Repository
public class QuestionUnitJdbcRepository {
    private static final TypeReference<List<PageRange>> PAGE_RANGES = new TypeReference<>() {};
    private static final String COLUMNS = "u.id, u.paper_id, u.question_number, u.part_code, u.page_ranges, u.text_excerpt, u.mark_value, "
            + "u.topic_code, u.difficulty, u.confidence, u.has_diagram, u.classification_method, u.review_required";

    private final JdbcTemplate jdbcTemplate;
    private final JsonColumns json;
    private final RowMapper<QuestionUnit> mapper = this::mapUnit;

    public QuestionUnitJdbcRepository(JdbcTemplate jdbcTemplate, JsonColumns json) {
        this.jdbcTemplate = jdbcTemplate;
        this.json = json;
    }

    public void replaceForPaper(String paperId, List<QuestionUnit> units) {
        jdbcTemplate.update("DELETE FROM question_units WHERE paper_id = ?", paperId);
        for (int i = 0; i < units.size(); i++) {
            QuestionUnit u = units.get(i);
            jdbcTemplate.update(
                    "INSERT INTO question_units(id, paper_id, unit_order, question_number, part_code, page_ranges, text_excerpt, mark_value, topic_code, difficulty, confidence, has_diagram, classification_method, review_required) VALUES (?,?,?,?,?,?,?,?,?,?,?,?,?,?)",
                    u.getId(), paperId, i, u.getQuestionNumber(), u.getPartCode(), json.write(u.getPageRanges()), u.getText(), u.getMarkValue(),
                    u.getTopicCode(), u.getDifficulty() == null ? null : u.getDifficulty().name(), u.getConfidence(), u.isHasDiagram(),
                    u.getClassificationMethod() == null ? null : u.getClassificationMethod().name(), u.isReviewRequired());
        }
    }

    public List<QuestionUnit> findByPaper(String paperId) {
        return jdbcTemplate.query("SELECT " + COLUMNS + " FROM question_units u WHERE u.paper_id = ? ORDER BY u.unit_order", mapper, paperId);
    }

    public Optional<QuestionUnit> findById(String id) {
        return jdbcTemplate.query("SELECT " + COLUMNS + " FROM question_units u WHERE u.id = ?", mapper, id).stream().findFirst();
    }

    public List<QuestionUnit> findByIds(List<String> ids) {
        if (ids.isEmpty()) return List.of();
        String placeholders = ids.stream().map(i -> "?").collect(Collectors.joining(","));
        Map<String, QuestionUnit> byId = jdbcTemplate.query(
                        "SELECT " + COLUMNS + " FROM question_units u WHERE u.id IN (" + placeholders + ")", mapper, ids.toArray())
                .stream().collect(Collectors.toMap(QuestionUnit::getId, Function.identity()));
        return ids.stream().map(byId::get).filter(Objects::nonNull).toList();
    }

    public List<StoredUnit> query(UnitQuery query) {
        StringBuilder sql = new StringBuilder("SELECT " + COLUMNS + ", p.exam_year, p.canonical_key, p.question_paper_uri, p.mark_scheme_uri, p.subject_code "
                + "FROM question_units u JOIN papers p ON p.id = u.paper_id WHERE 1=1");
        List<Object> args = new ArrayList<>();
        if (query.topicCodes() != null && !query.topicCodes().isEmpty()) {
            sql.append(" AND u.topic_code IN (").append(query.topicCodes().stream().map(t -> "?").collect(Collectors.joining(","))).append(")");
            args.addAll(query.topicCodes());
        }
        sql.append(" AND (? IS NULL OR p.exam_year >= ?) AND (? IS NULL OR p.exam_year <= ?)");
        args.addAll(Arrays.asList(query.yearFrom(), query.yearFrom(), query.yearTo(), query.yearTo()));
        String difficulty = query.difficulty() == null ? null : query.difficulty().name();
        sql.append(" AND (? IS NULL OR u.difficulty = ?) AND (? IS NULL OR p.subject_code = ?)");
        args.addAll(Arrays.asList(difficulty, difficulty, query.subjectCode(), query.subjectCode()));
        if (query.wholeQuestionsOnly()) sql.append(" AND u.part_code = ''");
        sql.append(" ORDER BY p.exam_year, p.canonical_key, CAST(u.question_number AS INT), u.unit_order");

        return jdbcTemplate.query(sql.toString(), (rs, n) -> new StoredUnit(
                mapUnit(rs, n), rs.getInt(14), rs.getString(15), rs.getString(16), rs.getString(17), rs.getString(18)), args.toArray());
    }

    private QuestionUnit mapUnit(ResultSet rs, int rowNum) throws SQLException {
        String topic = rs.getString(8);
        String difficulty = rs.getString(9);
        String method = rs.getString(12);
        Classification classification = topic == null ? null : new Classification(topic,
                difficulty == null ? null : Difficulty.valueOf(difficulty),
                rs.getDouble(10),
                method == null ? null : ClassificationMethod.valueOf(method));
        return QuestionUnit.restore(rs.getString(1), rs.getString(2), rs.getString(3), rs.getString(4),
                json.read(rs.getString(5), PAGE_RANGES), rs.getString(6), (Integer) rs.getObject(7), rs.getBoolean(11),
                classification, rs.getBoolean(13));
    }

    public record UnitQuery(Set<String> topicCodes, Integer yearFrom, Integer yearTo, Difficulty difficulty,
                            String subjectCode, boolean wholeQuestionsOnly) {}

    public record StoredUnit(QuestionUnit unit, int year, String paperKey, String questionPaperUri, String markSchemeUri,
                             String subjectCode) {}
}
