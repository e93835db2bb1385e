package org.janelia.calibration.lens;

import ij.process.FloatProcessor;

import java.awt.Rectangle;
import java.nio.file.Path;

import org.janelia.calibration.spec.LensCoefficients;
import org.junit.Assert;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

/**
 * Tests the {@link PolynomialLensDistortion} class.
 *
 * @author Eric Trautman
 */
public class PolynomialLensDistortionTest {

    @Rule
    public TemporaryFolder temporaryFolder = new TemporaryFolder();

    @Test
    public void testIdentityCorrection() {

        final int width = 20;
        final int height = 15;
        final FloatProcessor image = new FloatProcessor(width, height);
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                image.setf(x, y, 10 + x + (2 * y));
            }
        }

        final PolynomialLensDistortion identity = PolynomialLensDistortion.identity(3, 40, 30);

        final FloatProcessor corrected = identity.correct(image, true);
        Assert.assertEquals("invalid corrected width", width, corrected.getWidth());
        Assert.assertEquals("invalid corrected height", height, corrected.getHeight());
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                Assert.assertEquals("invalid value for (" + x + ", " + y + ")",
                                    image.getf(x, y), corrected.getf(x, y), 0.05);
            }
        }

        final FloatProcessor cropped = identity.correct(image, false);
        Assert.assertEquals("identity correction should not crop", width, cropped.getWidth());
        Assert.assertEquals("identity correction should not crop", height, cropped.getHeight());

        final FloatProcessor uncertainty = identity.uncertainty(width, height);
        Assert.assertEquals("unknown error should give zero uncertainty", 0.0f, uncertainty.getf(5, 5), 0.0f);
    }

    @Test
    public void testFit() {

        // radial distortion: distorted = corrected * (1 + k * r^2)
        final int width = 100;
        final int height = 80;
        final double k = 1.0e-5;

        final int gridSize = 11;
        final double[][] corrected = new double[gridSize * gridSize][];
        final double[][] distorted = new double[gridSize * gridSize][];
        int i = 0;
        for (int gy = 0; gy < gridSize; gy++) {
            for (int gx = 0; gx < gridSize; gx++) {
                final double x = gx * (width - 1) / (gridSize - 1.0);
                final double y = gy * (height - 1) / (gridSize - 1.0);
                final double dx = x - width / 2.0;
                final double dy = y - height / 2.0;
                final double factor = 1 + k * ((dx * dx) + (dy * dy));
                corrected[i] = new double[] {x, y};
                distorted[i] = new double[] {(width / 2.0) + dx * factor, (height / 2.0) + dy * factor};
                i++;
            }
        }

        final PolynomialLensDistortion lens = new PolynomialLensDistortion(3, width, height);
        lens.fit(corrected, distorted, 0.0);

        Assert.assertNotNull("rms error not computed", lens.getRmsError());
        Assert.assertTrue("rms error too large: " + lens.getRmsError(), lens.getRmsError() < 0.05);

        final double[] p = lens.apply(10.0, 10.0);
        final double dx = 10.0 - width / 2.0;
        final double dy = 10.0 - height / 2.0;
        final double factor = 1 + k * ((dx * dx) + (dy * dy));
        Assert.assertEquals("invalid fitted x", (width / 2.0) + dx * factor, p[0], 0.1);
        Assert.assertEquals("invalid fitted y", (height / 2.0) + dy * factor, p[1], 0.1);
    }

    @Test
    public void testSaveAndLoad() throws Exception {

        final PolynomialLensDistortion identity = PolynomialLensDistortion.identity(2, 64, 48);
        final Path path = temporaryFolder.getRoot().toPath().resolve("lens.json");
        identity.save(path);

        final PolynomialLensDistortion loaded = PolynomialLensDistortion.load(path);
        Assert.assertEquals("invalid dimension", 2, loaded.getDimension());
        Assert.assertEquals("invalid width", 64, loaded.getWidth());
        Assert.assertEquals("invalid height", 48, loaded.getHeight());

        final double[] p = loaded.apply(3.0, 4.0);
        Assert.assertEquals("invalid x", 3.0, p[0], 1e-9);
        Assert.assertEquals("invalid y", 4.0, p[1], 1e-9);
    }

    @Test
    public void testFindFullyValidRectangle() {

        // source data shifted by 3 columns and 2 rows leaves the right and bottom borders uncovered
        final int width = 20;
        final int height = 16;
        final boolean[] valid = new boolean[width * height];
        for (int y = 0; y < height - 2; y++) {
            for (int x = 0; x < width - 3; x++) {
                valid[y * width + x] = true;
            }
        }

        final Rectangle bounds = PolynomialLensDistortion.findFullyValidRectangle(valid, width, height);
        Assert.assertEquals("invalid bounds", new Rectangle(0, 0, width - 3, height - 2), bounds);

        // uncovered corners
        valid[0] = false;
        valid[(height - 3) * width + (width - 4)] = false;
        final Rectangle cornerBounds = PolynomialLensDistortion.findFullyValidRectangle(valid, width, height);
        Assert.assertEquals("invalid corner bounds width", width - 5, cornerBounds.width);
        Assert.assertEquals("invalid corner bounds height", height - 2, cornerBounds.height);
    }

    @Test(expected = IllegalStateException.class)
    public void testNothingValid() {
        PolynomialLensDistortion.findFullyValidRectangle(new boolean[12], 4, 3);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testInvalidCoefficients() {
        final PolynomialLensDistortion identity = PolynomialLensDistortion.identity(2, 64, 48);
        final LensCoefficients coefficients = identity.getCoefficients();
        new PolynomialLensDistortion(new LensCoefficients(3,
                                                         coefficients.getBeta(),
                                                         coefficients.getNormMean(),
                                                         coefficients.getNormVar(),
                                                         64, 48, null));
    }

}
