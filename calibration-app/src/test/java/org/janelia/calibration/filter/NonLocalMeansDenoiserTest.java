package org.janelia.calibration.filter;

import ij.process.FloatProcessor;

import java.util.Random;

import org.junit.Assert;
import org.junit.Test;

/**
 * Tests the {@link NonLocalMeansDenoiser} class.
 *
 * @author Eric Trautman
 */
public class NonLocalMeansDenoiserTest {

    @Test
    public void testDenoiseReducesNoise() {

        final int size = 40;
        final Random random = new Random(11);
        final FloatProcessor image = new FloatProcessor(size, size);
        for (int y = 0; y < size; y++) {
            for (int x = 0; x < size; x++) {
                image.setf(x, y, (float) (100 + (5 * random.nextGaussian())));
            }
        }
        final float[] original = ((float[]) image.getPixels()).clone();

        final FloatProcessor denoised = new NonLocalMeansDenoiser().denoise(image);

        Assert.assertArrayEquals("input should not be modified", original, (float[]) image.getPixels(), 0.0f);
        Assert.assertTrue("noise should be reduced",
                          standardDeviation((float[]) denoised.getPixels()) < (0.8 * standardDeviation(original)));
    }

    @Test
    public void testConstantImageIsCopied() {
        final FloatProcessor image = new FloatProcessor(8, 8);
        image.setValue(3.0);
        image.fill();

        final FloatProcessor denoised = new NonLocalMeansDenoiser().denoise(image);

        Assert.assertNotSame("copy should be returned", image, denoised);
        Assert.assertEquals("invalid value", 3.0f, denoised.getf(4, 4), 0.0f);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testEvenPatchSize() {
        new NonLocalMeansDenoiser(4, 5, 1.0);
    }

    private static double standardDeviation(final float[] values) {
        double sum = 0;
        for (final float v : values) {
            sum += v;
        }
        final double mean = sum / values.length;
        double squaredSum = 0;
        for (final float v : values) {
            squaredSum += (v - mean) * (v - mean);
        }
        return Math.sqrt(squaredSum / values.length);
    }

}
