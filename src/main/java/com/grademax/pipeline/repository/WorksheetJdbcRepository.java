package com.grademax.pipeline.repository;

import com.fasterxml.jackson.core.type.TypeReference;
import com.grademax.pipeline.assembly.WorksheetModels.Worksheet;
import com.grademax.pipeline.assembly.WorksheetModels.WorksheetCriteria;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

@Repository
public class WorksheetJdbcRepository {
    private static final TypeReference<List<String>> IDS = new TypeReference<>() {};

    private final JdbcTemplate jdbcTemplate;
    private final JsonColumns json;
    private final RowMapper<Worksheet> mapper;

    public WorksheetJdbcRepository(JdbcTemplate jdbcTemplate, JsonColumns json) {
        this.jdbcTemplate = jdbcTemplate;
        this.json = json;
        this.mapper = (rs, n) -> new Worksheet(rs.getString(1), json.read(rs.getString(2), WorksheetCriteria.class),
                json.read(rs.getString(3), IDS), rs.getString(4), rs.getString(5), rs.getInt(6), rs.getInt(7),
                Instant.parse(rs.getString(8)), rs.getBoolean(9));
    }

    public void save(Worksheet worksheet, Collection<String> paperIds) {
        jdbcTemplate.update(
                "MERGE INTO worksheets(id, criteria, unit_ids, worksheet_uri, answer_pack_uri, total_marks, estimated_minutes, created_at, stale) KEY(id) VALUES (?,?,?,?,?,?,?,?,?)",
                worksheet.id(), json.write(worksheet.criteria()), json.write(worksheet.unitIds()), worksheet.worksheetUri(),
                worksheet.answerPackUri(), worksheet.totalMarks(), worksheet.estimatedMinutes(), worksheet.createdAt().toString(),
                worksheet.stale());
        jdbcTemplate.update("DELETE FROM worksheet_papers WHERE worksheet_id = ?", worksheet.id());
        paperIds.stream().distinct().forEach(p -> jdbcTemplate.update(
                "INSERT INTO worksheet_papers(worksheet_id, paper_id) VALUES (?,?)", worksheet.id(), p));
    }

    public Optional<Worksheet> findById(String id) {
        return jdbcTemplate.query(
                "SELECT id, criteria, unit_ids, worksheet_uri, answer_pack_uri, total_marks, estimated_minutes, created_at, stale FROM worksheets WHERE id = ?",
                mapper, id).stream().findFirst();
    }

    public int markStaleForPaper(String paperId) {
        return jdbcTemplate.update(
                "UPDATE worksheets SET stale = TRUE WHERE stale = FALSE AND id IN (SELECT worksheet_id FROM worksheet_papers WHERE paper_id = ?)",
                paperId);
    }
}
