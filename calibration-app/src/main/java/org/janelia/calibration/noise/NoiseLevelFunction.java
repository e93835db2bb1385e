package org.janelia.calibration.noise;

import java.io.Serializable;
import java.util.Arrays;

import org.apache.commons.math3.stat.regression.SimpleRegression;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Bounded noise level function: {@code max(minY, ay * sqrt(x - ax))}.
 * Maps a signal value to the expected standard deviation of its noise.
 *
 * @author Eric Trautman
 */
public class NoiseLevelFunction
        implements Serializable {

    private final double minY;
    private final double ax;
    private final double ay;

    public NoiseLevelFunction(final double minY,
                              final double ax,
                              final double ay) {
        this.minY = minY;
        this.ax = ax;
        this.ay = ay;
    }

    /**
     * @param  coefficients  stored coefficients in (minY, ax, ay) order.
     */
    public static NoiseLevelFunction fromCoefficients(final double... coefficients)
            throws IllegalArgumentException {
        if ((coefficients == null) || (coefficients.length != 3)) {
            throw new IllegalArgumentException("noise level function requires 3 coefficients (minY, ax, ay) but " +
                                               Arrays.toString(coefficients) + " were given");
        }
        return new NoiseLevelFunction(coefficients[0], coefficients[1], coefficients[2]);
    }

    public double[] getCoefficients() {
        return new double[] {minY, ax, ay};
    }

    public double valueAt(final double x) {
        if (x <= ax) {
            return minY;
        }
        return Math.max(minY, ay * Math.sqrt(x - ax));
    }

    /**
     * Estimates a function from paired signal means and noise standard deviations.
     * Variance is linear in the signal for this model (var = ay^2 * x - ay^2 * ax),
     * so a least squares line through (mean, std^2) yields both parameters.
     * Falls back to a constant function when the fitted slope is not positive.
     */
    public static NoiseLevelFunction estimate(final double[] means,
                                              final double[] stds)
            throws IllegalArgumentException {

        if (means.length != stds.length) {
            throw new IllegalArgumentException("received " + means.length + " means but " + stds.length + " stds");
        }

        final SimpleRegression regression = new SimpleRegression();
        double minStd = Double.MAX_VALUE;
        double stdSum = 0;
        int count = 0;
        for (int i = 0; i < means.length; i++) {
            final double std = stds[i];
            if (Double.isFinite(means[i]) && Double.isFinite(std)) {
                regression.addData(means[i], std * std);
                if (std > 0) {
                    minStd = Math.min(minStd, std);
                }
                stdSum += std;
                count++;
            }
        }

        if (count == 0) {
            throw new IllegalArgumentException("no finite values to estimate noise level function from");
        }

        final double meanStd = stdSum / count;
        final double minY = minStd == Double.MAX_VALUE ? 0.0 : minStd;

        final NoiseLevelFunction nlf;
        final double slope = count > 1 ? regression.getSlope() : Double.NaN;
        if ((slope > 0) && Double.isFinite(slope)) {
            final double ay = Math.sqrt(slope);
            final double ax = -regression.getIntercept() / slope;
            nlf = new NoiseLevelFunction(minY, ax, ay);
        } else {
            LOG.warn("estimate: variance does not increase with signal (slope {}), using constant std {}",
                     slope, meanStd);
            nlf = new NoiseLevelFunction(meanStd, 0.0, 0.0);
        }

        LOG.debug("estimate: returning {} derived from {} samples", nlf, count);

        return nlf;
    }

    @Override
    public String toString() {
        return "NoiseLevelFunction{minY: " + minY + ", ax: " + ax + ", ay: " + ay + '}';
    }

    private static final Logger LOG = LoggerFactory.getLogger(NoiseLevelFunction.class);
}
