package com.example.officepdf.service;

import com.example.officepdf.document.DocumentFormat;
import com.example.officepdf.exception.RendererException;
import com.example.officepdf.exception.TemplateProcessingException;
import com.example.officepdf.renderer.LibreOfficeCommand;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.cache.Cache;
import org.springframework.cache.CacheManager;
import org.springframework.context.event.ContextClosedEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Stream;

/**
 * Converts legacy templates ({@code .doc}, {@code .ppt}, {@code .odt}, {@code .odp},
 * {@code .rtf}) to DOCX/PPTX once through LibreOffice. Converted copies are cached
 * by source path and modification time; DOCX/PPTX templates are returned as they are.
 * The working directories of the conversions are removed when the application shuts down.
 */
@Slf4j
@Service
public class TemplateNormalizer {
    public static final String CACHE_NAME = "normalizedTemplates";

    private final LibreOfficeCommand libreOffice;
    private final CacheManager cacheManager;
    private final Set<Path> workDirs = ConcurrentHashMap.newKeySet();

    @Autowired
    public TemplateNormalizer(LibreOfficeCommand libreOffice, CacheManager cacheManager) {
        this.libreOffice = libreOffice;
        this.cacheManager = cacheManager;
    }

    public Path normalize(Path template) {
        String fileName = template.getFileName().toString();
        if (DocumentFormat.fromFileName(fileName).isPresent()) {
            return template;
        }
        DocumentFormat target = DocumentFormat.legacyTarget(fileName)
                .orElseThrow(() -> new TemplateProcessingException("UNSUPPORTED_TEMPLATE_FORMAT",
                        "Unsupported template extension: " + fileName));

        Cache cache = cacheManager.getCache(CACHE_NAME);
        if (cache == null) {
            return convert(template, target);
        }
        try {
            return cache.get(cacheKey(template), () -> convert(template, target));
        } catch (Cache.ValueRetrievalException e) {
            if (e.getCause() instanceof TemplateProcessingException) {
                throw (TemplateProcessingException) e.getCause();
            }
            throw e;
        }
    }

    private Path convert(Path template, DocumentFormat target) {
        Path workDir;
        try {
            workDir = Files.createTempDirectory("officepdf-normalized-");
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        workDirs.add(workDir);
        boolean converted = false;
        try {
            log.info("Converting legacy template {} to {}", template.getFileName(), target.getExtension());
            libreOffice.convert(template, workDir, target.getExtension());

            String fileName = template.getFileName().toString();
            String stem = fileName.substring(0, fileName.lastIndexOf('.'));
            Path result = workDir.resolve(stem + "." + target.getExtension());
            if (!Files.isRegularFile(result)) {
                throw new TemplateProcessingException("TEMPLATE_UNREADABLE",
                        "Conversion of " + fileName + " produced no " + target.getExtension() + " file");
            }
            converted = true;
            return result;
        } catch (RendererException e) {
            throw new TemplateProcessingException("TEMPLATE_UNREADABLE",
                    "Cannot convert " + template.getFileName() + ": " + e.getMessage(), e);
        } finally {
            if (!converted) {
                delete(workDir);
            }
        }
    }

    @EventListener(ContextClosedEvent.class)
    public void onShutdown() {
        cleanUp();
    }

    /**
     * Deletes every converted copy made so far and clears the conversion cache.
     */
    public void cleanUp() {
        Cache cache = cacheManager.getCache(CACHE_NAME);
        if (cache != null) {
            cache.clear();
        }
        for (Path dir : workDirs) {
            delete(dir);
        }
        log.debug("Removed converted template directories");
    }

    private void delete(Path dir) {
        workDirs.remove(dir);
        try (Stream<Path> paths = Files.walk(dir)) {
            paths.sorted(Comparator.reverseOrder()).forEach(p -> p.toFile().delete());
        } catch (IOException e) {
            log.warn("Could not remove conversion directory {}: {}", dir, e.getMessage());
        }
    }

    static String cacheKey(Path template) {
        Path absolute = template.toAbsolutePath().normalize();
        try {
            return absolute + "|" + Files.getLastModifiedTime(absolute).toMillis();
        } catch (IOException e) {
            return absolute.toString();
        }
    }
}
