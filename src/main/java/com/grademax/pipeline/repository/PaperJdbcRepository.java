package com.grademax.pipeline.repository;

import com.grademax.pipeline.domain.DomainModels.Paper;
import com.grademax.pipeline.domain.DomainModels.PaperMetadata;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

@Repository
public class PaperJdbcRepository {
    private static final String COLUMNS = "id, board, exam_level, subject_code, exam_year, season, paper_number, question_paper_uri, mark_scheme_uri, total_questions, revision, ingested_at";
    private static final RowMapper<Paper> MAPPER = (rs, n) -> new Paper(
            rs.getString(1),
            new PaperMetadata(rs.getString(2), rs.getString(3), rs.getString(4), rs.getInt(5), rs.getString(6), rs.getString(7)),
            rs.getString(8), rs.getString(9), rs.getInt(10), rs.getInt(11), Instant.parse(rs.getString(12)));

    private final JdbcTemplate jdbcTemplate;

    public PaperJdbcRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    public void upsert(Paper paper) {
        PaperMetadata m = paper.metadata();
        jdbcTemplate.update(
                "MERGE INTO papers(id, canonical_key, board, exam_level, subject_code, exam_year, season, paper_number, question_paper_uri, mark_scheme_uri, total_questions, revision, ingested_at) KEY(id) VALUES (?,?,?,?,?,?,?,?,?,?,?,?,?)",
                paper.id(), m.canonicalKey(), m.board(), m.level(), m.subjectCode(), m.year(), m.season(), m.paperNumber(),
                paper.questionPaperUri(), paper.markSchemeUri(), paper.totalQuestions(), paper.revision(), paper.ingestedAt().toString());
    }

    public Optional<Paper> findById(String id) {
        return jdbcTemplate.query("SELECT " + COLUMNS + " FROM papers WHERE id = ?", MAPPER, id).stream().findFirst();
    }

    public Optional<Paper> findByCanonicalKey(String canonicalKey) {
        return jdbcTemplate.query("SELECT " + COLUMNS + " FROM papers WHERE canonical_key = ?", MAPPER, canonicalKey).stream().findFirst();
    }

    // row lock held until the surrounding transaction ends
    public Optional<Paper> lockByCanonicalKey(String canonicalKey) {
        return jdbcTemplate.query("SELECT " + COLUMNS + " FROM papers WHERE canonical_key = ? FOR UPDATE", MAPPER, canonicalKey).stream().findFirst();
    }

    public List<Paper> findAll() {
        return jdbcTemplate.query("SELECT " + COLUMNS + " FROM papers ORDER BY exam_year, canonical_key", MAPPER);
    }
}
