package com.example.officepdf.service;

import com.example.officepdf.aspect.LogExecutionTime;
import com.example.officepdf.document.ScanResult;
import com.example.officepdf.document.ScanWarning;
import com.example.officepdf.document.TextDocument;
import com.example.officepdf.document.TextDocumentFactory;
import com.example.officepdf.document.TokenParseFailure;
import com.example.officepdf.document.TokenScanner;
import com.example.officepdf.exception.TemplateProcessingException;
import com.example.officepdf.model.TemplateScan;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.cache.Cache;
import org.springframework.cache.CacheManager;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;

/**
 * Scans each template once per file version. Results are cached under
 * {@code path|last-modified|size}, so editing a template between batches
 * invalidates its entry.
 */
@Slf4j
@Service
public class TemplateScanService {
    public static final String CACHE_NAME = "templateScans";

    private final TextDocumentFactory documentFactory;
    private final TokenScanner scanner;
    private final TemplateNormalizer normalizer;
    private final CacheManager cacheManager;

    @Autowired
    public TemplateScanService(TextDocumentFactory documentFactory, TokenScanner scanner,
                               TemplateNormalizer normalizer, CacheManager cacheManager) {
        this.documentFactory = documentFactory;
        this.scanner = scanner;
        this.normalizer = normalizer;
        this.cacheManager = cacheManager;
    }

    /**
     * @throws TemplateProcessingException {@code TEMPLATE_UNREADABLE} when the file
     *         cannot be opened as a document tree
     */
    @LogExecutionTime("Template Scan")
    public TemplateScan scan(String templateName, Path template) {
        String key = cacheKey(template);
        Cache cache = cacheManager.getCache(CACHE_NAME);
        if (cache == null) {
            return doScan(templateName, template);
        }
        try {
            return cache.get(key, () -> doScan(templateName, template));
        } catch (Cache.ValueRetrievalException e) {
            if (e.getCause() instanceof TemplateProcessingException) {
                throw (TemplateProcessingException) e.getCause();
            }
            throw e;
        }
    }

    private TemplateScan doScan(String templateName, Path template) {
        Path documentPath = normalizer.normalize(template);
        log.info("Scanning template {}", templateName);
        try (TextDocument document = documentFactory.open(documentPath)) {
            ScanResult result = scanner.scan(document);

            List<String> warnings = new ArrayList<>();
            for (ScanWarning warning : result.getWarnings()) {
                log.warn("[{}] {}", templateName, warning.getMessage());
                warnings.add(warning.getMessage());
            }
            List<String> failures = new ArrayList<>();
            for (TokenParseFailure failure : result.getParseFailures()) {
                log.error("[{}] {}", templateName, failure.describe());
                failures.add(failure.describe());
            }
            log.debug("[{}] tokens: {}", templateName, result.expressions());
            return new TemplateScan(templateName, documentPath, document.getFormat(),
                    Collections.unmodifiableSet(new LinkedHashSet<>(result.expressions())),
                    Collections.unmodifiableList(warnings),
                    Collections.unmodifiableList(failures));
        } catch (TemplateProcessingException e) {
            throw e;
        } catch (IOException | RuntimeException e) {
            throw new TemplateProcessingException("TEMPLATE_UNREADABLE",
                    "Cannot open template " + templateName + ": " + e.getMessage(), e);
        }
    }

    static String cacheKey(Path template) {
        Path absolute = template.toAbsolutePath().normalize();
        try {
            BasicFileAttributes attributes = Files.readAttributes(absolute, BasicFileAttributes.class);
            return absolute + "|" + attributes.lastModifiedTime().toMillis() + "|" + attributes.size();
        } catch (IOException e) {
            throw new TemplateProcessingException("TEMPLATE_UNREADABLE",
                    "Cannot read attributes of " + template + ": " + e.getMessage(), e);
        }
    }
}
