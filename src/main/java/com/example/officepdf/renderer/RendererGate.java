package com.example.officepdf.renderer;

import com.example.officepdf.exception.RendererException;

import java.nio.file.Path;
import java.util.concurrent.Semaphore;

/**
 * Single-flight section around a non-reentrant renderer. Reentrant renderers pass
 * straight through. Waiting callers are served in arrival order.
 */
public class RendererGate {
    private final PdfRenderer renderer;
    private final Semaphore permit;

    public RendererGate(PdfRenderer renderer) {
        this.renderer = renderer;
        this.permit = renderer.isReentrant() ? null : new Semaphore(1, true);
    }

    public PdfRenderer getRenderer() {
        return renderer;
    }

    public Path render(Path document, Path outputDir) throws RendererException {
        return render(document, outputDir, GateWaitListener.NONE);
    }

    /**
     * @param listener told when the call starts and stops queueing behind other callers
     */
    public Path render(Path document, Path outputDir, GateWaitListener listener) throws RendererException {
        if (permit == null) {
            return renderer.render(document, outputDir);
        }
        listener.waiting();
        try {
            permit.acquire();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RendererException("Interrupted while waiting for renderer " + renderer.getName(), e);
        } finally {
            listener.acquired();
        }
        try {
            return renderer.render(document, outputDir);
        } finally {
            permit.release();
        }
    }
}
