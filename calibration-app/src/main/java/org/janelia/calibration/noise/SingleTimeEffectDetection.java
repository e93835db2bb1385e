package org.janelia.calibration.noise;

import ij.process.FloatProcessor;

import java.util.List;

import org.apache.commons.math3.stat.StatUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Removes single time effects (transient artefacts like cosmic ray hits that appear in only one frame)
 * from a stack of exposures of the same scene.
 *
 * For every pixel, a frame value is excluded when it deviates from the mean of the other frames
 * by more than {@code nStd} times the noise level at that mean.
 * The composite pixel is the mean of the remaining values
 * (or the median of all values when every value is excluded).
 *
 * @author Eric Trautman
 */
public class SingleTimeEffectDetection {

    public static final double DEFAULT_N_STD = 4.0;

    private final double nStd;

    public SingleTimeEffectDetection() {
        this(DEFAULT_N_STD);
    }

    public SingleTimeEffectDetection(final double nStd) {
        this.nStd = nStd;
    }

    /**
     * @param  images               two or more exposures with identical dimensions (not modified).
     * @param  noiseLevelFunction   noise model to use, or null to estimate one from the stack.
     *
     * @return outlier suppressed composite and the noise model that was used.
     *
     * @throws IllegalArgumentException
     *   if fewer than two images are given or the image dimensions differ.
     */
    public Result detect(final List<FloatProcessor> images,
                         final NoiseLevelFunction noiseLevelFunction)
            throws IllegalArgumentException {

        if ((images == null) || (images.size() < 2)) {
            throw new IllegalArgumentException("at least two images are needed to detect single time effects");
        }

        final int width = images.get(0).getWidth();
        final int height = images.get(0).getHeight();
        for (final FloatProcessor image : images) {
            if ((image.getWidth() != width) || (image.getHeight() != height)) {
                throw new IllegalArgumentException("all images must be " + width + "x" + height + " but found a " +
                                                   image.getWidth() + "x" + image.getHeight() + " image");
            }
        }

        final int frameCount = images.size();
        final int pixelCount = width * height;
        final float[][] frames = new float[frameCount][];
        for (int f = 0; f < frameCount; f++) {
            frames[f] = (float[]) images.get(f).getPixels();
        }

        final NoiseLevelFunction nlf = noiseLevelFunction == null ?
                                       estimateNoiseLevelFunction(frames, pixelCount) : noiseLevelFunction;

        final float[] composite = new float[pixelCount];
        final double[] values = new double[frameCount];
        int excludedCount = 0;

        for (int i = 0; i < pixelCount; i++) {
            double sum = 0;
            for (int f = 0; f < frameCount; f++) {
                values[f] = frames[f][i];
                sum += values[f];
            }

            double keptSum = 0;
            int keptCount = 0;
            for (int f = 0; f < frameCount; f++) {
                final double othersMean = (sum - values[f]) / (frameCount - 1);
                if (Math.abs(values[f] - othersMean) <= nStd * nlf.valueAt(othersMean)) {
                    keptSum += values[f];
                    keptCount++;
                }
            }

            excludedCount += frameCount - keptCount;

            if (keptCount > 0) {
                composite[i] = (float) (keptSum / keptCount);
            } else {
                composite[i] = (float) NoiseEstimation.median(values);
            }
        }

        LOG.debug("detect: excluded {} of {} values from {} frames", excludedCount, frameCount * pixelCount, frameCount);

        return new Result(new FloatProcessor(width, height, composite), nlf);
    }

    private NoiseLevelFunction estimateNoiseLevelFunction(final float[][] frames,
                                                          final int pixelCount) {
        final int frameCount = frames.length;
        final double[] means = new double[pixelCount];
        final double[] stds = new double[pixelCount];
        final double[] values = new double[frameCount];
        for (int i = 0; i < pixelCount; i++) {
            for (int f = 0; f < frameCount; f++) {
                values[f] = frames[f][i];
            }
            means[i] = StatUtils.mean(values);
            stds[i] = Math.sqrt(StatUtils.variance(values, means[i]));
        }
        return NoiseLevelFunction.estimate(means, stds);
    }

    public static class Result {

        private final FloatProcessor image;
        private final NoiseLevelFunction noiseLevelFunction;

        public Result(final FloatProcessor image,
                      final NoiseLevelFunction noiseLevelFunction) {
            this.image = image;
            this.noiseLevelFunction = noiseLevelFunction;
        }

        public FloatProcessor getImage() {
            return image;
        }

        public NoiseLevelFunction getNoiseLevelFunction() {
            return noiseLevelFunction;
        }
    }

    private static final Logger LOG = LoggerFactory.getLogger(SingleTimeEffectDetection.class);
}
