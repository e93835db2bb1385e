package org.janelia.calibration.flatfield;

import ij.plugin.filter.GaussianBlur;
import ij.process.AutoThresholder;
import ij.process.FloatProcessor;

import java.util.ArrayList;
import java.util.List;

import org.apache.commons.math3.stat.descriptive.DescriptiveStatistics;
import org.janelia.calibration.interpolate.InverseDistanceWeighting;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Estimates a flat field from several images of different objects
 * (instead of images of a homogeneous calibration target).
 * The individual inhomogeneities of the objects average out.
 *
 * Every added image is background subtracted, downscaled, split into signal and background
 * with an Otsu threshold, blurred within the signal area, normalized to [0, 1]
 * and added to a masked running average.
 * Averaged pixels that never received signal are filled with inverse distance weighting.
 *
 * @author Eric Trautman
 */
public class FlatFieldFromImages {

    private static final int SMALL_IMAGE_SIZE = 100;
    private static final int HISTOGRAM_BINS = 256;

    private final FloatProcessor background;
    private Double scaleFactor;
    private Integer kernelSize;

    private int fullWidth;
    private int fullHeight;
    private double[] average;
    private int[] counts;
    private int smallWidth;
    private int smallHeight;
    private final List<Double> backgroundLevels;
    private int imageCount;

    /**
     * @param  background   background image subtracted from every image (null for none).
     * @param  scaleFactor  downscale factor (null to scale the smaller image edge to 100 pixels).
     * @param  kernelSize   blur kernel size in downscaled pixels (null for a tenth of the smaller edge, at least 3).
     */
    public FlatFieldFromImages(final FloatProcessor background,
                               final Double scaleFactor,
                               final Integer kernelSize) {
        this.background = background;
        this.scaleFactor = scaleFactor;
        this.kernelSize = kernelSize;
        this.backgroundLevels = new ArrayList<>();
        this.imageCount = 0;
    }

    public int getImageCount() {
        return imageCount;
    }

    /**
     * Adds an image to the average.
     *
     * @return true if the image was used, false if it contains no separable signal.
     */
    public boolean addImage(final FloatProcessor image)
            throws IllegalArgumentException {

        FloatProcessor fp = (FloatProcessor) image.duplicate();
        if (background != null) {
            if ((background.getWidth() != fp.getWidth()) || (background.getHeight() != fp.getHeight())) {
                throw new IllegalArgumentException("background and image dimensions differ");
            }
            final float[] pixels = (float[]) fp.getPixels();
            final float[] bgPixels = (float[]) background.getPixels();
            for (int i = 0; i < pixels.length; i++) {
                pixels[i] -= bgPixels[i];
            }
        }

        if (average == null) {
            initialize(fp);
        } else if ((fp.getWidth() != fullWidth) || (fp.getHeight() != fullHeight)) {
            throw new IllegalArgumentException("all images must be " + fullWidth + "x" + fullHeight);
        }

        if ((smallWidth != fullWidth) || (smallHeight != fullHeight)) {
            fp = (FloatProcessor) fp.resize(smallWidth, smallHeight, true);
        }

        final float[] pixels = (float[]) fp.getPixels();
        final double signalMinimum = signalMinimum(pixels);
        if (Double.isNaN(signalMinimum)) {
            LOG.info("addImage: skipping image without separable signal");
            return false;
        }

        final boolean[] signal = new boolean[pixels.length];
        double backgroundSum = 0;
        int backgroundCount = 0;
        for (int i = 0; i < pixels.length; i++) {
            signal[i] = pixels[i] > signalMinimum;
            if (! signal[i]) {
                backgroundSum += pixels[i];
                backgroundCount++;
            }
        }

        final float[] blurred = maskedMean(pixels, signal, 2 * kernelSize);

        final double min = backgroundCount == 0 ? 0.0 : backgroundSum / backgroundCount;
        double max = -Double.MAX_VALUE;
        for (int i = 0; i < blurred.length; i++) {
            if (signal[i]) {
                max = Math.max(max, blurred[i]);
            }
        }
        final double range = max - min;
        if (range <= 0) {
            LOG.info("addImage: skipping image with signal range {}", range);
            return false;
        }

        for (int i = 0; i < blurred.length; i++) {
            if (signal[i]) {
                final double normalized = (blurred[i] - min) / range;
                counts[i]++;
                average[i] += (normalized - average[i]) / counts[i];
            }
        }

        backgroundLevels.add(min);
        imageCount++;

        LOG.debug("addImage: added image {} with background level {} and signal maximum {}", imageCount, min, max);

        return true;
    }

    /**
     * @return median background level of all added images.
     */
    public double getBackgroundLevel() {
        if (backgroundLevels.isEmpty()) {
            return Double.NaN;
        }
        final DescriptiveStatistics statistics = new DescriptiveStatistics();
        backgroundLevels.forEach(statistics::addValue);
        return statistics.getPercentile(50);
    }

    /**
     * @return mask of downscaled pixels that received signal from at least one image.
     */
    public boolean[] getMask() {
        final boolean[] mask = new boolean[counts == null ? 0 : counts.length];
        for (int i = 0; i < mask.length; i++) {
            mask[i] = counts[i] > 0;
        }
        return mask;
    }

    /**
     * @return estimated flat field at full image size with gaps filled.
     *
     * @throws IllegalStateException
     *   if no image has been added successfully.
     */
    public FloatProcessor getFlatField()
            throws IllegalStateException {

        if (imageCount == 0) {
            throw new IllegalStateException("no images with signal have been added");
        }

        final float[] values = new float[average.length];
        final boolean[] gaps = new boolean[average.length];
        for (int i = 0; i < values.length; i++) {
            values[i] = (float) average[i];
            gaps[i] = counts[i] == 0;
        }

        final FloatProcessor small = new FloatProcessor(smallWidth, smallHeight, values);
        new InverseDistanceWeighting().fillMasked(small, gaps, Math.max(smallWidth, smallHeight), 1.0, 1.0);

        final FloatProcessor flatField;
        if ((smallWidth != fullWidth) || (smallHeight != fullHeight)) {
            small.setInterpolationMethod(FloatProcessor.BILINEAR);
            flatField = (FloatProcessor) small.resize(fullWidth, fullHeight);
        } else {
            flatField = small;
        }
        return flatField;
    }

    /**
     * Convenience method to estimate a flat field from a complete set of images.
     */
    public static FloatProcessor fromImages(final List<FloatProcessor> images,
                                            final FloatProcessor background) {
        final FlatFieldFromImages estimator = new FlatFieldFromImages(background, null, null);
        for (final FloatProcessor image : images) {
            estimator.addImage(image);
        }
        return estimator.getFlatField();
    }

    private void initialize(final FloatProcessor firstImage) {
        fullWidth = firstImage.getWidth();
        fullHeight = firstImage.getHeight();
        if (scaleFactor == null) {
            scaleFactor = Math.min(1.0, (double) SMALL_IMAGE_SIZE / Math.min(fullWidth, fullHeight));
        }
        smallWidth = Math.max(1, (int) Math.round(fullWidth * scaleFactor));
        smallHeight = Math.max(1, (int) Math.round(fullHeight * scaleFactor));
        if (kernelSize == null) {
            kernelSize = Math.max(3, Math.min(smallWidth, smallHeight) / 10);
        }
        average = new double[smallWidth * smallHeight];
        counts = new int[average.length];

        LOG.debug("initialize: scaling {}x{} images to {}x{}, kernel size {}",
                  fullWidth, fullHeight, smallWidth, smallHeight, kernelSize);
    }

    /**
     * @return smallest signal value (Otsu threshold of the value histogram),
     *         or NaN if all values are equal.
     */
    static double signalMinimum(final float[] pixels) {
        double min = Double.MAX_VALUE;
        double max = -Double.MAX_VALUE;
        for (final float p : pixels) {
            if (Float.isFinite(p)) {
                min = Math.min(min, p);
                max = Math.max(max, p);
            }
        }
        if (! (max > min)) {
            return Double.NaN;
        }

        final int[] histogram = new int[HISTOGRAM_BINS];
        final double binWidth = (max - min) / HISTOGRAM_BINS;
        for (final float p : pixels) {
            if (Float.isFinite(p)) {
                final int bin = Math.min(HISTOGRAM_BINS - 1, (int) ((p - min) / binWidth));
                histogram[bin]++;
            }
        }

        final int thresholdBin = new AutoThresholder().getThreshold(AutoThresholder.Method.Otsu, histogram);
        return min + ((thresholdBin + 1) * binWidth);
    }

    /**
     * @return gaussian weighted mean of the masked values (normalized convolution),
     *         with sigma derived from the kernel size.
     */
    private float[] maskedMean(final float[] pixels,
                               final boolean[] mask,
                               final int size) {
        final float[] maskedValues = new float[pixels.length];
        final float[] weights = new float[pixels.length];
        for (int i = 0; i < pixels.length; i++) {
            if (mask[i]) {
                maskedValues[i] = pixels[i];
                weights[i] = 1.0f;
            }
        }

        final FloatProcessor valueProcessor = new FloatProcessor(smallWidth, smallHeight, maskedValues);
        final FloatProcessor weightProcessor = new FloatProcessor(smallWidth, smallHeight, weights);
        final double sigma = size / 4.0;
        final GaussianBlur gaussianBlur = new GaussianBlur();
        gaussianBlur.blurGaussian(valueProcessor, sigma, sigma, 0.002);
        gaussianBlur.blurGaussian(weightProcessor, sigma, sigma, 0.002);

        final float[] result = new float[pixels.length];
        for (int i = 0; i < result.length; i++) {
            result[i] = weights[i] > 0 ? maskedValues[i] / weights[i] : 0f;
        }

        return result;
    }

    private static final Logger LOG = LoggerFactory.getLogger(FlatFieldFromImages.class);
}
