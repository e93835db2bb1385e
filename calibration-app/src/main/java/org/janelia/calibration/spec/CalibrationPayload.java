package org.janelia.calibration.spec;

import java.io.Serializable;
import java.util.function.UnaryOperator;

/**
 * Common interface for all data stored in a {@link CalibrationRecord}.
 *
 * @author Eric Trautman
 */
public interface CalibrationPayload extends Serializable {

    /**
     * @param  operator  function to apply to every coefficient array held by this payload.
     *
     * @return a payload of the same type with each array replaced by the operator's result
     *         (or this payload if it holds no arrays).
     */
    CalibrationPayload mapArrays(final UnaryOperator<CoefficientArray> operator);

    /**
     * @return short summary (shapes or coefficients, never full arrays) for overview listings.
     */
    String describe();

}
