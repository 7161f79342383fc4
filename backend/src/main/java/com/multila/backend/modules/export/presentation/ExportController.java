package com.multila.backend.modules.export.presentation;

import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.List;

import com.multila.backend.modules.export.application.ExportJobService;
import com.multila.backend.modules.export.domain.ExportJob;
import com.multila.backend.modules.export.presentation.dto.ExportFileResponse;
import com.multila.backend.modules.export.presentation.dto.ExportJobResponse;
import com.multila.backend.modules.export.presentation.dto.ExportRequest;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;

import org.springframework.core.io.FileSystemResource;
import org.springframework.core.io.Resource;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/export")
@Tag(name = "Data export")
public class ExportController {

    private static final MediaType TEXT_CSV = new MediaType("text", "csv", StandardCharsets.UTF_8);

    private final ExportJobService exportJobService;

    public ExportController(ExportJobService exportJobService) {
        this.exportJobService = exportJobService;
    }

    @PostMapping({"", "/"})
    @Operation(summary = "Start generating the CSV files for a filter")
    public ResponseEntity<ExportJobResponse> start(@RequestBody(required = false) ExportRequest request) {
        ExportRequest effective = request != null ? request : new ExportRequest(null, null, null, null, null);
        ExportJob job = exportJobService.start(effective.toFilter());
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(ExportJobResponse.from(job));
    }

    @GetMapping("/jobs/{jobId}")
    @Operation(summary = "Poll the per-file progress of an export job")
    public ResponseEntity<ExportJobResponse> poll(@PathVariable String jobId) {
        return ResponseEntity.ok(ExportJobResponse.from(exportJobService.poll(jobId)));
    }

    @GetMapping({"/files", "/files/"})
    @Operation(summary = "List export files and whether they are ready")
    public ResponseEntity<List<ExportFileResponse>> files() {
        return ResponseEntity.ok(exportJobService.listFiles().stream().map(ExportFileResponse::from).toList());
    }

    @GetMapping("/download/{filename}")
    @Operation(summary = "Download a generated export file")
    public ResponseEntity<Resource> download(@PathVariable String filename) {
        Path path = exportJobService.download(filename);
        return ResponseEntity.ok()
                .contentType(TEXT_CSV)
                .header(HttpHeaders.CONTENT_DISPOSITION, ContentDisposition.attachment().filename(filename).build().toString())
                .body(new FileSystemResource(path));
    }

    @GetMapping("/delete/{filename}")
    @Operation(summary = "Delete an export file")
    public ResponseEntity<Void> deleteViaGet(@PathVariable String filename) {
        exportJobService.delete(filename);
        return ResponseEntity.noContent().build();
    }

    @DeleteMapping("/files/{filename}")
    @Operation(summary = "Delete an export file")
    public ResponseEntity<Void> delete(@PathVariable String filename) {
        exportJobService.delete(filename);
        return ResponseEntity.noContent().build();
    }
}
