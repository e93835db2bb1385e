package org.janelia.calibration.filter;

import ij.process.FloatProcessor;

import org.janelia.calibration.noise.NoiseEstimation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Non-local means denoising.
 * Each pixel becomes the weighted mean of the pixels within the search window,
 * weighted by {@code exp(-d / h^2)} where {@code d} is the mean squared difference between the
 * surrounding patches.
 * Patch distances are accumulated per offset with summed area tables.
 *
 * @author Eric Trautman
 */
public class NonLocalMeansDenoiser {

    public static final int DEFAULT_PATCH_SIZE = 7;
    public static final int DEFAULT_PATCH_DISTANCE = 11;
    public static final double DEFAULT_STRENGTH_FACTOR = 0.8;

    private final int patchSize;
    private final int patchDistance;
    private final double strengthFactor;

    public NonLocalMeansDenoiser() {
        this(DEFAULT_PATCH_SIZE, DEFAULT_PATCH_DISTANCE, DEFAULT_STRENGTH_FACTOR);
    }

    /**
     * @param  patchSize       edge length of compared patches (odd).
     * @param  patchDistance   maximum offset of compared patch centers.
     * @param  strengthFactor  filter strength {@code h} relative to the estimated noise standard deviation.
     */
    public NonLocalMeansDenoiser(final int patchSize,
                                 final int patchDistance,
                                 final double strengthFactor)
            throws IllegalArgumentException {
        if ((patchSize < 1) || (patchSize % 2 == 0)) {
            throw new IllegalArgumentException("patch size must be a positive odd number but is " + patchSize);
        }
        this.patchSize = patchSize;
        this.patchDistance = patchDistance;
        this.strengthFactor = strengthFactor;
    }

    /**
     * @return denoised copy of the image.
     */
    public FloatProcessor denoise(final FloatProcessor image) {

        final int width = image.getWidth();
        final int height = image.getHeight();
        final float[] pixels = (float[]) image.getPixels();

        final double h = strengthFactor * NoiseEstimation.estimateSigma(image);
        if (h <= 0) {
            LOG.debug("denoise: no noise detected, returning copy");
            return (FloatProcessor) image.duplicate();
        }
        final double hSquared = h * h;

        final int patchRadius = patchSize / 2;
        final double patchArea = patchSize * patchSize;

        final double[] weightedSum = new double[pixels.length];
        final double[] weightSum = new double[pixels.length];
        final double[] squaredDifferences = new double[pixels.length];
        final double[] integral = new double[(width + 1) * (height + 1)];

        for (int dy = -patchDistance; dy <= patchDistance; dy++) {
            for (int dx = -patchDistance; dx <= patchDistance; dx++) {

                for (int y = 0; y < height; y++) {
                    final int ny = clamp(y + dy, height);
                    for (int x = 0; x < width; x++) {
                        final int nx = clamp(x + dx, width);
                        final double d = pixels[(y * width) + x] - pixels[(ny * width) + nx];
                        squaredDifferences[(y * width) + x] = d * d;
                    }
                }

                buildIntegral(squaredDifferences, width, height, integral);

                for (int y = 0; y < height; y++) {
                    final int ny = clamp(y + dy, height);
                    for (int x = 0; x < width; x++) {
                        final int nx = clamp(x + dx, width);
                        final double distance = boxSum(integral, width, height, x, y, patchRadius) / patchArea;
                        final double weight = Math.exp(-distance / hSquared);
                        final int i = (y * width) + x;
                        weightedSum[i] += weight * pixels[(ny * width) + nx];
                        weightSum[i] += weight;
                    }
                }
            }
        }

        final float[] denoised = new float[pixels.length];
        for (int i = 0; i < denoised.length; i++) {
            denoised[i] = (float) (weightedSum[i] / weightSum[i]);
        }

        return new FloatProcessor(width, height, denoised);
    }

    private static int clamp(final int value,
                             final int size) {
        return value < 0 ? 0 : (value >= size ? size - 1 : value);
    }

    private static void buildIntegral(final double[] values,
                                      final int width,
                                      final int height,
                                      final double[] integral) {
        final int integralWidth = width + 1;
        for (int y = 0; y < height; y++) {
            double rowSum = 0;
            for (int x = 0; x < width; x++) {
                rowSum += values[(y * width) + x];
                integral[((y + 1) * integralWidth) + x + 1] = integral[(y * integralWidth) + x + 1] + rowSum;
            }
        }
    }

    /**
     * @return sum of values within the patch around (x, y), with the patch clipped at the image border
     *         and scaled up to the full patch area.
     */
    private static double boxSum(final double[] integral,
                                 final int width,
                                 final int height,
                                 final int x,
                                 final int y,
                                 final int radius) {
        final int integralWidth = width + 1;
        final int minX = Math.max(0, x - radius);
        final int minY = Math.max(0, y - radius);
        final int maxX = Math.min(width, x + radius + 1);
        final int maxY = Math.min(height, y + radius + 1);
        final double sum = integral[(maxY * integralWidth) + maxX]
                           - integral[(minY * integralWidth) + maxX]
                           - integral[(maxY * integralWidth) + minX]
                           + integral[(minY * integralWidth) + minX];
        final double fullArea = (2.0 * radius + 1) * (2.0 * radius + 1);
        return sum * fullArea / ((maxX - minX) * (maxY - minY));
    }

    private static final Logger LOG = LoggerFactory.getLogger(NonLocalMeansDenoiser.class);
}
