package com.example.officepdf.renderer;

/**
 * Told when a caller starts and stops waiting for its turn at a {@link RendererGate}.
 */
public interface GateWaitListener {

    GateWaitListener NONE = new GateWaitListener() {
        @Override
        public void waiting() {
        }

        @Override
        public void acquired() {
        }
    };

    void waiting();

    /**
     * Called once the wait is over, also when it ended by interruption.
     */
    void acquired();
}
