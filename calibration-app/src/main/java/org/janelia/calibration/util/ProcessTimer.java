package org.janelia.calibration.util;

/**
 * Tracks the time elapsed since construction.
 *
 * @author Eric Trautman
 */
public class ProcessTimer {

    private final long startNanos;

    public ProcessTimer() {
        this.startNanos = System.nanoTime();
    }

    public long getElapsedMilliseconds() {
        return (System.nanoTime() - startNanos) / 1_000_000;
    }

    @Override
    public String toString() {
        final long elapsed = getElapsedMilliseconds();
        if (elapsed < 1000) {
            return elapsed + " ms";
        }
        return String.format("%.1f s", elapsed / 1000.0);
    }
}
