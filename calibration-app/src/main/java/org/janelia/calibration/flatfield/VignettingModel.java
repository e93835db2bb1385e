package org.janelia.calibration.flatfield;

import ij.process.FloatProcessor;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.List;

import org.apache.commons.math3.fitting.leastsquares.LeastSquaresBuilder;
import org.apache.commons.math3.fitting.leastsquares.LeastSquaresOptimizer;
import org.apache.commons.math3.fitting.leastsquares.LeastSquaresProblem;
import org.apache.commons.math3.fitting.leastsquares.LevenbergMarquardtOptimizer;
import org.apache.commons.math3.linear.MatrixUtils;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;
import org.apache.commons.math3.util.Pair;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Kang-Weiss vignetting model: the product of an off-axis illumination factor
 * {@code 1 / (1 + (d/f)^2)^2}, a geometric factor {@code 1 - alpha * d}
 * and a tilt factor for planar scenes that are not perpendicular to the optical axis,
 * where {@code d} is the distance to the image center (cx, cy).
 *
 * @author Eric Trautman
 */
public class VignettingModel
        implements Serializable {

    private static final int PARAMETER_COUNT = 6;
    private static final double STEP_FACTOR = 1.0e-6;
    private static final int MAX_FIT_SAMPLES = 10000;

    private final double focalLength;
    private final double alpha;
    private final double rotation;
    private final double tilt;
    private final double centerX;
    private final double centerY;

    /**
     * @param  focalLength  focal length in pixels.
     * @param  alpha        geometric vignetting coefficient.
     * @param  rotation     rotation angle of the planar scene (radians).
     * @param  tilt         tilt angle of the planar scene (radians).
     * @param  centerX      image center x.
     * @param  centerY      image center y.
     */
    public VignettingModel(final double focalLength,
                           final double alpha,
                           final double rotation,
                           final double tilt,
                           final double centerX,
                           final double centerY) {
        this.focalLength = focalLength;
        this.alpha = alpha;
        this.rotation = rotation;
        this.tilt = tilt;
        this.centerX = centerX;
        this.centerY = centerY;
    }

    public VignettingModel(final double[] parameters) {
        this(parameters[0], parameters[1], parameters[2], parameters[3], parameters[4], parameters[5]);
    }

    /**
     * @return starting parameters for an image: focal length 0.7 * height, no tilt, centered.
     */
    public static VignettingModel guess(final int width,
                                        final int height) {
        return new VignettingModel(height * 0.7, 0, 0, 0, width / 2.0, height / 2.0);
    }

    public double[] getParameters() {
        return new double[] {focalLength, alpha, rotation, tilt, centerX, centerY};
    }

    public double valueAt(final double x,
                          final double y) {
        final double dx = x - centerX;
        final double dy = y - centerY;
        final double distance = Math.sqrt((dx * dx) + (dy * dy));

        final double relativeDistance = distance / focalLength;
        final double offAxis = 1.0 / Math.pow(1 + (relativeDistance * relativeDistance), 2);
        final double geometric = alpha == 0 ? 1.0 : 1 - (alpha * distance);

        return offAxis * geometric * tiltFactor(x, y);
    }

    /**
     * @return vignetting attributed to perspective distortion of a tilted planar scene.
     */
    public double tiltFactor(final double x,
                             final double y) {
        final double t = 1 + (Math.tan(tilt) / focalLength) * ((x * Math.sin(rotation)) - (y * Math.cos(rotation)));
        return Math.cos(tilt) * t * t * t;
    }

    /**
     * @return image of model values (a synthetic flat field).
     */
    public FloatProcessor render(final int width,
                                 final int height) {
        final FloatProcessor fp = new FloatProcessor(width, height);
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                fp.setf(x, y, (float) valueAt(x, y));
            }
        }
        return fp;
    }

    /**
     * Fits the model to a flat field with Levenberg-Marquardt, starting from {@link #guess}.
     * Values are normalized by their maximum before fitting and pixels are subsampled on a regular grid.
     *
     * @param  flatField  measured flat field.
     * @param  valid      mask of pixels to fit (null for all), same dimensions as the flat field.
     *
     * @return fitted model.
     */
    public static VignettingModel fit(final FloatProcessor flatField,
                                      final boolean[] valid)
            throws IllegalArgumentException {

        final int width = flatField.getWidth();
        final int height = flatField.getHeight();
        final int step = Math.max(1, (int) Math.ceil(Math.sqrt((double) width * height / MAX_FIT_SAMPLES)));

        final List<double[]> samples = new ArrayList<>();
        double max = 0;
        for (int y = 0; y < height; y += step) {
            for (int x = 0; x < width; x += step) {
                final double value = flatField.getf(x, y);
                if (((valid == null) || valid[(y * width) + x]) && Double.isFinite(value)) {
                    samples.add(new double[] {x, y, value});
                    max = Math.max(max, value);
                }
            }
        }

        if (samples.size() < PARAMETER_COUNT || max <= 0) {
            throw new IllegalArgumentException("not enough valid flat field values to fit vignetting model");
        }

        final double[] target = new double[samples.size()];
        for (int i = 0; i < target.length; i++) {
            target[i] = samples.get(i)[2] / max;
        }

        final LeastSquaresProblem lsp = new LeastSquaresBuilder().
                start(MatrixUtils.createRealVector(guess(width, height).getParameters())).
                target(MatrixUtils.createRealVector(target)).
                model(parameters -> jacobian(parameters, samples)).
                lazyEvaluation(false).
                maxEvaluations(1000).
                maxIterations(1000).
                build();

        final LeastSquaresOptimizer.Optimum optimum = new LevenbergMarquardtOptimizer().optimize(lsp);

        final VignettingModel model = new VignettingModel(optimum.getPoint().toArray());

        LOG.info("fit: fitted {} to {} samples with rms {} after {} iterations",
                 model, samples.size(), optimum.getRMS(), optimum.getIterations());

        return model;
    }

    private static double[] evaluate(final double[] parameters,
                                     final List<double[]> samples) {
        final VignettingModel model = new VignettingModel(parameters);
        final double[] values = new double[samples.size()];
        for (int i = 0; i < values.length; i++) {
            final double[] sample = samples.get(i);
            values[i] = model.valueAt(sample[0], sample[1]);
        }
        return values;
    }

    // approximate through forward differences
    private static Pair<RealVector, RealMatrix> jacobian(final RealVector variables,
                                                         final List<double[]> samples) {
        final double[] parameters = variables.toArray();
        final double[] initial = evaluate(parameters, samples);
        final double[][] jacobian = new double[samples.size()][PARAMETER_COUNT];

        for (int p = 0; p < PARAMETER_COUNT; p++) {
            final double[] shifted = parameters.clone();
            final double delta = STEP_FACTOR * Math.max(1.0, Math.abs(parameters[p]));
            shifted[p] += delta;
            final double[] values = evaluate(shifted, samples);
            for (int i = 0; i < values.length; i++) {
                jacobian[i][p] = (values[i] - initial[i]) / delta;
            }
        }

        return new Pair<>(MatrixUtils.createRealVector(initial), MatrixUtils.createRealMatrix(jacobian));
    }

    @Override
    public String toString() {
        return "VignettingModel{focalLength: " + focalLength +
               ", alpha: " + alpha +
               ", rotation: " + rotation +
               ", tilt: " + tilt +
               ", center: (" + centerX + ", " + centerY + ")}";
    }

    private static final Logger LOG = LoggerFactory.getLogger(VignettingModel.class);
}
