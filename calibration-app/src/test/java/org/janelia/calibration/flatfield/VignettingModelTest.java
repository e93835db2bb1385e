package org.janelia.calibration.flatfield;

import ij.process.FloatProcessor;

import org.junit.Assert;
import org.junit.Test;

/**
 * Tests the {@link VignettingModel} class.
 *
 * @author Eric Trautman
 */
public class VignettingModelTest {

    @Test
    public void testValueAt() {
        final VignettingModel model = new VignettingModel(100, 0, 0, 0, 50, 40);

        Assert.assertEquals("center should not be attenuated", 1.0, model.valueAt(50, 40), 1e-9);
        // distance equal to focal length
        Assert.assertEquals("invalid off axis attenuation", 0.25, model.valueAt(150, 40), 1e-9);
        Assert.assertEquals("no tilt should give unit tilt factor", 1.0, model.tiltFactor(10, 20), 1e-9);

        final VignettingModel geometric = new VignettingModel(1e9, 0.01, 0, 0, 0, 0);
        Assert.assertEquals("invalid geometric attenuation", 0.9, geometric.valueAt(10, 0), 1e-6);
    }

    @Test
    public void testGuess() {
        Assert.assertArrayEquals("invalid guess",
                                 new double[] {28.0, 0, 0, 0, 30.0, 20.0},
                                 VignettingModel.guess(60, 40).getParameters(),
                                 1e-9);
    }

    @Test
    public void testFit() {

        final int width = 64;
        final int height = 48;
        final VignettingModel expected = new VignettingModel(40, 0, 0, 0, 30, 26);
        final FloatProcessor flatField = expected.render(width, height);
        flatField.multiply(0.8);

        final VignettingModel fitted = VignettingModel.fit(flatField, null);

        final FloatProcessor rendered = fitted.render(width, height);
        for (int y = 0; y < height; y += 7) {
            for (int x = 0; x < width; x += 7) {
                Assert.assertEquals("invalid fitted value for (" + x + ", " + y + ")",
                                    expected.valueAt(x, y), rendered.getf(x, y), 0.02);
            }
        }
    }

    @Test(expected = IllegalArgumentException.class)
    public void testFitWithoutValidPixels() {
        VignettingModel.fit(new FloatProcessor(10, 10), new boolean[100]);
    }

}
