package org.janelia.calibration.store;

import org.janelia.calibration.spec.CalibrationCategory;

/**
 * Thrown when a required calibration record does not exist.
 *
 * @author Eric Trautman
 */
public class MissingCalibrationException
        extends RuntimeException {

    private final CalibrationCategory category;

    public MissingCalibrationException(final CalibrationCategory category,
                                       final String message) {
        super(message);
        this.category = category;
    }

    public CalibrationCategory getCategory() {
        return category;
    }
}
