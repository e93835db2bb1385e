package org.janelia.calibration.filter;

import ij.plugin.filter.RankFilters;
import ij.process.FloatProcessor;

/**
 * Replaces pixels that deviate strongly from their local (3x3) median with that median.
 * A pixel is replaced when {@code |value - median| > threshold * |median|}.
 *
 * @author Eric Trautman
 */
public class MedianThreshold {

    public static final double DEFAULT_THRESHOLD = 0.1;

    // an ImageJ rank radius of 1 covers a 3x3 neighborhood
    private static final double MEDIAN_RADIUS = 1.0;

    /**
     * Applies the filter in place.
     *
     * @return number of replaced pixels.
     */
    public int apply(final FloatProcessor ip,
                     final double threshold) {

        final FloatProcessor median = (FloatProcessor) ip.duplicate();
        new RankFilters().rank(median, MEDIAN_RADIUS, RankFilters.MEDIAN);

        final float[] pixels = (float[]) ip.getPixels();
        final float[] medianPixels = (float[]) median.getPixels();

        int replacedCount = 0;
        for (int i = 0; i < pixels.length; i++) {
            final float m = medianPixels[i];
            if (Math.abs(pixels[i] - m) > threshold * Math.abs(m)) {
                pixels[i] = m;
                replacedCount++;
            }
        }

        return replacedCount;
    }

}
