package org.janelia.calibration.flatfield;

import ij.process.FloatProcessor;

import java.util.Arrays;

import org.junit.Assert;
import org.junit.Test;

/**
 * Tests the {@link FlatFieldFromImages} class.
 *
 * @author Eric Trautman
 */
public class FlatFieldFromImagesTest {

    private static final int WIDTH = 40;
    private static final int HEIGHT = 30;

    @Test
    public void testSingleImage() {

        final FlatFieldFromImages estimator = new FlatFieldFromImages(null, null, null);
        Assert.assertTrue("background level should be unknown before any image is added",
                          Double.isNaN(estimator.getBackgroundLevel()));
        Assert.assertTrue("image with signal should be added", estimator.addImage(halfSignalImage(true)));

        Assert.assertEquals("invalid image count", 1, estimator.getImageCount());
        Assert.assertEquals("invalid background level", 10.0, estimator.getBackgroundLevel(), 0.001);

        final boolean[] mask = estimator.getMask();
        Assert.assertFalse("background should not be masked", mask[0]);
        Assert.assertTrue("signal should be masked", mask[WIDTH - 1]);

        final FloatProcessor flatField = estimator.getFlatField();
        Assert.assertEquals("invalid width", WIDTH, flatField.getWidth());
        Assert.assertEquals("invalid height", HEIGHT, flatField.getHeight());
        Assert.assertEquals("invalid signal value", 1.0f, flatField.getf(WIDTH - 2, HEIGHT / 2), 0.001f);
        Assert.assertEquals("invalid filled value", 1.0f, flatField.getf(1, HEIGHT / 2), 0.001f);
    }

    @Test
    public void testBackgroundSubtraction() {

        final FloatProcessor background = new FloatProcessor(WIDTH, HEIGHT);
        background.setValue(10.0);
        background.fill();

        final FloatProcessor flatField =
                FlatFieldFromImages.fromImages(Arrays.asList(halfSignalImage(true), halfSignalImage(false)),
                                               background);

        Assert.assertEquals("invalid value", 1.0f, flatField.getf(3, 3), 0.001f);
        Assert.assertEquals("invalid value", 1.0f, flatField.getf(WIDTH - 3, HEIGHT - 3), 0.001f);
    }

    @Test
    public void testImageWithoutSignal() {
        final FlatFieldFromImages estimator = new FlatFieldFromImages(null, null, null);
        final FloatProcessor uniform = new FloatProcessor(WIDTH, HEIGHT);
        uniform.setValue(5.0);
        uniform.fill();

        Assert.assertFalse("uniform image should be skipped", estimator.addImage(uniform));
        try {
            estimator.getFlatField();
            Assert.fail("flat field without images should fail");
        } catch (final IllegalStateException e) {
            Assert.assertTrue("invalid message", e.getMessage().contains("no images"));
        }
    }

    @Test
    public void testSignalMinimum() {
        final float[] pixels = new float[100];
        Arrays.fill(pixels, 0, 60, 10f);
        Arrays.fill(pixels, 60, 100, 110f);

        final double minimum = FlatFieldFromImages.signalMinimum(pixels);
        Assert.assertTrue("minimum " + minimum + " should separate values", (minimum > 10) && (minimum < 110));

        Assert.assertTrue("equal values should not be separable",
                          Double.isNaN(FlatFieldFromImages.signalMinimum(new float[] {3f, 3f})));
    }

    private static FloatProcessor halfSignalImage(final boolean rightHalf) {
        final FloatProcessor image = new FloatProcessor(WIDTH, HEIGHT);
        for (int y = 0; y < HEIGHT; y++) {
            for (int x = 0; x < WIDTH; x++) {
                final boolean signal = rightHalf ? x >= WIDTH / 2 : x < WIDTH / 2;
                image.setf(x, y, signal ? 110f : 10f);
            }
        }
        return image;
    }

}
