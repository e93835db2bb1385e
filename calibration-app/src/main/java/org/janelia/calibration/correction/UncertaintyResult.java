package org.janelia.calibration.correction;

import ij.process.FloatProcessor;

/**
 * Relative intensity uncertainty and absolute position uncertainty (pixels) of a corrected image.
 */
public class UncertaintyResult {

    private final FloatProcessor intensity;
    private final FloatProcessor position;

    public UncertaintyResult(final FloatProcessor intensity,
                             final FloatProcessor position) {
        this.intensity = intensity;
        this.position = position;
    }

    public FloatProcessor getIntensity() {
        return intensity;
    }

    /**
     * @return position uncertainty map, or null if no lens calibration exists.
     */
    public FloatProcessor getPosition() {
        return position;
    }
}
