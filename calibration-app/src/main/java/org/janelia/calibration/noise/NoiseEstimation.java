package org.janelia.calibration.noise;

import ij.process.FloatProcessor;

import java.util.Arrays;

import org.apache.commons.math3.stat.descriptive.rank.Median;

/**
 * Single image noise estimates.
 */
public class NoiseEstimation {

    private static final double MAD_TO_STD = 1.4826;

    /**
     * Estimates the noise standard deviation from the median absolute deviation of
     * horizontal neighbor differences (differences of two noisy pixels have twice the noise variance).
     *
     * @return estimated standard deviation (0 for images narrower than 2 pixels).
     */
    public static double estimateSigma(final FloatProcessor image) {
        final int width = image.getWidth();
        final int height = image.getHeight();
        if (width < 2) {
            return 0.0;
        }

        final double[] differences = new double[(width - 1) * height];
        int count = 0;
        for (int y = 0; y < height; y++) {
            for (int x = 1; x < width; x++) {
                final double d = image.getf(x, y) - image.getf(x - 1, y);
                if (Double.isFinite(d)) {
                    differences[count++] = d;
                }
            }
        }
        if (count == 0) {
            return 0.0;
        }

        final double[] values = Arrays.copyOf(differences, count);
        final double median = median(values);
        for (int i = 0; i < count; i++) {
            values[i] = Math.abs(values[i] - median);
        }
        return MAD_TO_STD * median(values) / Math.sqrt(2.0);
    }

    /**
     * @return median of the values, or NaN if there are none.
     */
    public static double median(final double[] values) {
        return new Median().evaluate(values);
    }

}
