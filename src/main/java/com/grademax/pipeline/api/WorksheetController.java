package com.grademax.pipeline.api;

import com.grademax.pipeline.assembly.WorksheetAssembler;
import com.grademax.pipeline.assembly.WorksheetModels.AssemblyResult;
import com.grademax.pipeline.assembly.WorksheetModels.Worksheet;
import com.grademax.pipeline.assembly.WorksheetModels.WorksheetCriteria;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/worksheets")
public class WorksheetController {
    private final WorksheetAssembler assembler;

    public WorksheetController(WorksheetAssembler assembler) {
        this.assembler = assembler;
    }

    @PostMapping
    public ResponseEntity<AssemblyResult> assemble(@RequestBody WorksheetCriteria criteria) {
        return ResponseEntity.ok(assembler.assemble(criteria));
    }

    @GetMapping("/{worksheetId}")
    public ResponseEntity<Worksheet> worksheet(@PathVariable String worksheetId) {
        return ResponseEntity.ok(assembler.findById(worksheetId));
    }

    @PostMapping("/{worksheetId}/regenerate")
    public ResponseEntity<AssemblyResult> regenerate(@PathVariable String worksheetId) {
        return ResponseEntity.ok(assembler.regenerate(worksheetId));
    }
}
