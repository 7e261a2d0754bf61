package io.github.sysfina.ingestion.controller;

import io.github.sysfina.ingestion.controller.dto.ImportResponse;
import io.github.sysfina.ingestion.domain.model.ImportSummary;
import io.github.sysfina.ingestion.service.ReceivablesImportService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.CrossOrigin;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Manual trigger for the receivables import. Failures are rendered by {@link ImportExceptionHandler}.
 */
@RestController
@RequestMapping("/api/imports/google-sheets")
@RequiredArgsConstructor
@CrossOrigin(origins = "*", allowedHeaders = {"authorization", "x-client-info", "apikey", "content-type"})
public class ImportController {

    private final ReceivablesImportService receivablesImportService;

    @PostMapping
    public ResponseEntity<ImportResponse> importReceivables() {
        ImportSummary summary = receivablesImportService.importReceivables();
        return ResponseEntity.ok(ImportResponse.success(summary));
    }
}
