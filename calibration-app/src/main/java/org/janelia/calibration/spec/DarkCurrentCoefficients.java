package org.janelia.calibration.spec;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.function.UnaryOperator;

/**
 * Dark current calibration: either a constant background array
 * or an offset and slope pair describing background growth with exposure time.
 *
 * @author Eric Trautman
 */
public class DarkCurrentCoefficients
        implements CalibrationPayload {

    private final CoefficientArray background;
    private final CoefficientArray offset;
    private final CoefficientArray slope;

    // no-arg constructor needed for JSON deserialization
    @SuppressWarnings("unused")
    private DarkCurrentCoefficients() {
        this(null, null, null);
    }

    private DarkCurrentCoefficients(final CoefficientArray background,
                                    final CoefficientArray offset,
                                    final CoefficientArray slope) {
        this.background = background;
        this.offset = offset;
        this.slope = slope;
    }

    public static DarkCurrentCoefficients constant(final CoefficientArray background) {
        if (background == null) {
            throw new IllegalArgumentException("background array must be specified");
        }
        return new DarkCurrentCoefficients(background, null, null);
    }

    public static DarkCurrentCoefficients linear(final CoefficientArray offset,
                                                 final CoefficientArray slope) {
        if ((offset == null) || (slope == null)) {
            throw new IllegalArgumentException("offset and slope arrays must both be specified");
        }
        if (! offset.hasSpatialShape(slope.getSpatialShape())) {
            throw new IllegalArgumentException("offset shape " + offset.describe() +
                                               " differs from slope shape " + slope.describe());
        }
        return new DarkCurrentCoefficients(null, offset, slope);
    }

    @JsonIgnore
    public boolean isLinear() {
        return background == null;
    }

    public CoefficientArray getBackground() {
        return background;
    }

    public CoefficientArray getOffset() {
        return offset;
    }

    public CoefficientArray getSlope() {
        return slope;
    }

    /**
     * @param  exposureTime  exposure time in seconds (only needed for linear coefficients).
     * @param  maximumValue  largest value the sensor can represent.
     *
     * @return background array for the specified exposure time,
     *         values of linear backgrounds are clamped at the maximum value.
     *
     * @throws IllegalArgumentException
     *   if linear coefficients are stored but no exposure time is specified.
     */
    public CoefficientArray backgroundFor(final Double exposureTime,
                                          final double maximumValue)
            throws IllegalArgumentException {

        if (! isLinear()) {
            return background;
        }

        if (exposureTime == null) {
            throw new IllegalArgumentException("exposure time is required to derive background from dark current slope");
        }

        final double[] offsetData = offset.getData();
        final double[] slopeData = slope.getData();
        final double[] data = new double[offsetData.length];
        for (int i = 0; i < data.length; i++) {
            final double value = offsetData[i] + slopeData[i] * exposureTime;
            data[i] = value > maximumValue ? maximumValue : value;
        }

        return new CoefficientArray(offset.getShape(), data);
    }

    @Override
    public DarkCurrentCoefficients mapArrays(final UnaryOperator<CoefficientArray> operator) {
        if (isLinear()) {
            return new DarkCurrentCoefficients(null, operator.apply(offset), operator.apply(slope));
        } else {
            return new DarkCurrentCoefficients(operator.apply(background), null, null);
        }
    }

    @Override
    public String describe() {
        if (isLinear()) {
            return "slope:" + slope.describe() + ", intercept:" + offset.describe();
        } else {
            return "background:" + background.describe();
        }
    }
}
