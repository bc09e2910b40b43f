package com.example.officepdf.renderer;

import com.example.officepdf.document.DocumentFormat;
import com.example.officepdf.exception.TemplateProcessingException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

/**
 * Chooses a renderer for a selection and template format. Each renderer bean gets
 * one shared {@link RendererGate}, so the single-flight guarantee holds across
 * concurrent batches too.
 */
@Slf4j
@Component
public class RendererResolver {
    private final List<PdfRenderer> renderers;
    private final Map<PdfRenderer, RendererGate> gates = new IdentityHashMap<>();

    public RendererResolver(List<PdfRenderer> renderers) {
        this.renderers = renderers;
    }

    public RendererGate resolve(RendererType type, DocumentFormat format) {
        PdfRenderer renderer = renderers.stream()
                .filter(r -> r.supports(type, format))
                .findFirst()
                .orElseThrow(() -> new TemplateProcessingException("RENDERER_UNAVAILABLE",
                        "No renderer for " + type + " / " + format));
        synchronized (gates) {
            return gates.computeIfAbsent(renderer, RendererGate::new);
        }
    }
}
