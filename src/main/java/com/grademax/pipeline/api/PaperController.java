package com.grademax.pipeline.api;

import com.grademax.pipeline.domain.DomainModels.Paper;
import com.grademax.pipeline.domain.QuestionUnit;
import com.grademax.pipeline.exception.DocumentReadException;
import com.grademax.pipeline.markscheme.MarkSchemeLinker.LinkResult;
import com.grademax.pipeline.service.IngestionModels.IngestionRequest;
import com.grademax.pipeline.service.IngestionModels.MetadataHints;
import com.grademax.pipeline.service.IngestionModels.PaperResult;
import com.grademax.pipeline.service.PaperIngestionService;
import com.grademax.pipeline.service.UnitCatalogService;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.util.List;

@RestController
@RequestMapping("/api/papers")
public class PaperController {
    private final PaperIngestionService ingestionService;
    private final UnitCatalogService catalogService;

    public PaperController(PaperIngestionService ingestionService, UnitCatalogService catalogService) {
        this.ingestionService = ingestionService;
        this.catalogService = catalogService;
    }

    @PostMapping(consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<PaperResult> ingest(@RequestParam("questionPaper") MultipartFile questionPaper,
                                              @RequestParam(value = "markScheme", required = false) MultipartFile markScheme,
                                              @RequestParam(required = false) String board,
                                              @RequestParam(required = false) String level,
                                              @RequestParam(required = false) String subjectCode,
                                              @RequestParam(required = false) Integer year,
                                              @RequestParam(required = false) String season,
                                              @RequestParam(required = false) String paperNumber) {
        IngestionRequest request = new IngestionRequest(
                questionPaper.getOriginalFilename(), bytes(questionPaper),
                markScheme == null ? null : markScheme.getOriginalFilename(), markScheme == null ? null : bytes(markScheme),
                new MetadataHints(board, level, subjectCode, year, season, paperNumber));
        return ResponseEntity.ok(ingestionService.ingest(request));
    }

    @GetMapping
    public ResponseEntity<List<Paper>> papers() {
        return ResponseEntity.ok(ingestionService.papers());
    }

    @GetMapping("/{paperId}/units")
    public ResponseEntity<List<QuestionUnit>> units(@PathVariable String paperId) {
        return ResponseEntity.ok(catalogService.unitsOfPaper(paperId));
    }

    @PostMapping("/{paperId}/relink")
    public ResponseEntity<LinkResult> relink(@PathVariable String paperId) {
        return ResponseEntity.ok(ingestionService.relink(paperId));
    }

    private byte[] bytes(MultipartFile file) {
        try {
            return file.getBytes();
        } catch (IOException e) {
            throw new DocumentReadException("Cannot read upload " + file.getOriginalFilename(), e);
        }
    }
}
