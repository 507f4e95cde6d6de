package com.grademax.pipeline.repository;

import com.fasterxml.jackson.core.type.TypeReference;
import com.grademax.pipeline.domain.DomainModels.MarkPoint;
import com.grademax.pipeline.domain.DomainModels.MarkSchemeLink;
import com.grademax.pipeline.domain.DomainModels.MatchMethod;
import com.grademax.pipeline.domain.DomainModels.PageRange;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.util.*;
import java.util.stream.Collectors;

@Repository
public class MarkSchemeLinkJdbcRepository {
    private static final TypeReference<List<MarkPoint>> MARK_POINTS = new TypeReference<>() {};
    private static final TypeReference<List<PageRange>> PAGE_RANGES = new TypeReference<>() {};
    private static final String COLUMNS = "question_unit_id, mark_points, raw_snippet, confidence, match_method, mark_scheme_pages";

    private final JdbcTemplate jdbcTemplate;
    private final JsonColumns json;
    private final RowMapper<MarkSchemeLink> mapper;

    public MarkSchemeLinkJdbcRepository(JdbcTemplate jdbcTemplate, JsonColumns json) {
        this.jdbcTemplate = jdbcTemplate;
        this.json = json;
        this.mapper = (rs, n) -> new MarkSchemeLink(rs.getString(1), json.read(rs.getString(2), MARK_POINTS), rs.getString(3),
                rs.getDouble(4), MatchMethod.valueOf(rs.getString(5)), json.read(rs.getString(6), PAGE_RANGES));
    }

    public void replaceForPaper(String paperId, List<MarkSchemeLink> links) {
        jdbcTemplate.update("DELETE FROM mark_scheme_links WHERE paper_id = ?", paperId);
        links.forEach(l -> jdbcTemplate.update(
                "INSERT INTO mark_scheme_links(question_unit_id, paper_id, mark_points, raw_snippet, confidence, match_method, mark_scheme_pages) VALUES (?,?,?,?,?,?,?)",
                l.questionUnitId(), paperId, json.write(l.markPoints()), l.rawSnippet(), l.confidence(), l.matchMethod().name(),
                json.write(l.markSchemePages())));
    }

    public List<MarkSchemeLink> findByPaper(String paperId) {
        return jdbcTemplate.query(
                "SELECT l.question_unit_id, l.mark_points, l.raw_snippet, l.confidence, l.match_method, l.mark_scheme_pages "
                        + "FROM mark_scheme_links l JOIN question_units u ON u.id = l.question_unit_id WHERE l.paper_id = ? ORDER BY u.unit_order",
                mapper, paperId);
    }

    public Optional<MarkSchemeLink> findByUnit(String unitId) {
        return jdbcTemplate.query("SELECT " + COLUMNS + " FROM mark_scheme_links WHERE question_unit_id = ?", mapper, unitId)
                .stream().findFirst();
    }

    public Map<String, MarkSchemeLink> findByUnits(Collection<String> unitIds) {
        if (unitIds.isEmpty()) return Map.of();
        String placeholders = unitIds.stream().map(i -> "?").collect(Collectors.joining(","));
        return jdbcTemplate.query("SELECT " + COLUMNS + " FROM mark_scheme_links WHERE question_unit_id IN (" + placeholders + ")",
                        mapper, unitIds.toArray())
                .stream().collect(Collectors.toMap(MarkSchemeLink::questionUnitId, l -> l));
    }
}
