package com.grademax.pipeline.api;

import com.grademax.pipeline.domain.DomainModels.Difficulty;
import com.grademax.pipeline.repository.QuestionUnitJdbcRepository.StoredUnit;
import com.grademax.pipeline.service.IngestionModels.UnitArtifacts;
import com.grademax.pipeline.service.UnitCatalogService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Set;

@RestController
@RequestMapping("/api/units")
public class QuestionUnitController {
    private final UnitCatalogService catalogService;

    public QuestionUnitController(UnitCatalogService catalogService) {
        this.catalogService = catalogService;
    }

    @GetMapping
    public ResponseEntity<List<StoredUnit>> find(@RequestParam(value = "topic", required = false) Set<String> topics,
                                                 @RequestParam(required = false) Integer yearFrom,
                                                 @RequestParam(required = false) Integer yearTo,
                                                 @RequestParam(required = false) String difficulty,
                                                 @RequestParam(required = false) String subjectCode,
                                                 @RequestParam(defaultValue = "false") boolean wholeQuestionsOnly) {
        Difficulty level = Difficulty.fromLabel(difficulty);
        if (difficulty != null && !difficulty.isBlank() && level == null) {
            throw new IllegalArgumentException("Unknown difficulty: " + difficulty);
        }
        return ResponseEntity.ok(catalogService.find(topics, yearFrom, yearTo, level, subjectCode, wholeQuestionsOnly));
    }

    @GetMapping("/{unitId}/artifacts")
    public ResponseEntity<UnitArtifacts> artifacts(@PathVariable String unitId) {
        return ResponseEntity.ok(catalogService.artifacts(unitId));
    }
}
