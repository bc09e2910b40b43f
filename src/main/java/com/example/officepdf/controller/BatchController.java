package com.example.officepdf.controller;

import com.example.officepdf.exception.PreflightFailedException;
import com.example.officepdf.exception.RendererException;
import com.example.officepdf.exception.TemplateProcessingException;
import com.example.officepdf.model.BatchReport;
import com.example.officepdf.model.BatchRequest;
import com.example.officepdf.preflight.PreflightResult;
import com.example.officepdf.renderer.LibreOfficeCommand;
import com.example.officepdf.service.BatchCancellation;
import com.example.officepdf.service.BatchOrchestrator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * REST API for batch runs.
 *
 * POST /api/batches/preflight
 * {
 *   "templateDir": "/data/templates",
 *   "dataPath": "/data/students.xlsx",
 *   "sheet": "Course A"
 * }
 *
 * POST /api/batches/run takes the same body plus output and mode fields
 * ("outputDir", "filenamePattern", "dryRun", "strict", "fromRow", "toRow", "where", ...)
 * and answers with the per-row report once the batch has finished.
 */
@Slf4j
@RestController
@RequestMapping("/api/batches")
@RequiredArgsConstructor
public class BatchController {
    private final BatchOrchestrator orchestrator;
    private final LibreOfficeCommand libreOffice;

    @PostMapping("/preflight")
    public ResponseEntity<?> preflight(@RequestBody BatchRequest request) {
        log.info("Received preflight request for data {}", request.getDataPath());
        try {
            PreflightResult result = orchestrator.preflight(request);
            return ResponseEntity.ok(result);
        } catch (TemplateProcessingException e) {
            return errorResponse(e);
        }
    }

    @PostMapping("/run")
    public ResponseEntity<?> run(@RequestBody BatchRequest request) {
        log.info("Received batch request for data {} -> {}", request.getDataPath(), request.getOutputDir());
        try {
            BatchReport report = orchestrator.run(request, new BatchCancellation());
            return ResponseEntity.ok(report);
        } catch (PreflightFailedException e) {
            Map<String, Object> body = new LinkedHashMap<>();
            body.put("code", e.getCode());
            body.put("description", e.getDescription());
            body.put("preflight", e.getResult());
            return new ResponseEntity<>(body, HttpStatus.BAD_REQUEST);
        } catch (TemplateProcessingException e) {
            return errorResponse(e);
        }
    }

    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", "UP");
        try {
            body.put("libreoffice", libreOffice.detectVersion());
        } catch (RendererException e) {
            body.put("libreoffice", "unavailable: " + e.getMessage());
        }
        return ResponseEntity.ok(body);
    }

    static ResponseEntity<Map<String, String>> errorResponse(TemplateProcessingException e) {
        Map<String, String> body = new LinkedHashMap<>();
        body.put("code", e.getCode());
        body.put("description", e.getDescription());
        return new ResponseEntity<>(body, statusFor(e.getCode()));
    }

    static HttpStatus statusFor(String code) {
        switch (code) {
            case "TEMPLATE_NOT_FOUND":
                return HttpStatus.NOT_FOUND;
            case "PREFLIGHT_FAILED":
            case "MISSING_REQUIRED_COLUMNS":
            case "INVALID_REQUEST":
            case "UNSUPPORTED_DATA_SOURCE":
            case "DATA_SOURCE_UNREADABLE":
                return HttpStatus.BAD_REQUEST;
            default:
                return HttpStatus.INTERNAL_SERVER_ERROR;
        }
    }
}
