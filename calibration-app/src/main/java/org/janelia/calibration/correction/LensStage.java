package org.janelia.calibration.correction;

import ij.process.FloatProcessor;

import org.janelia.calibration.lens.PolynomialLensDistortion;
import org.janelia.calibration.spec.CalibrationCategory;

/**
 * Removes lens distortion.
 * A missing lens calibration is a normal condition and skips the stage without a warning.
 *
 * @author Eric Trautman
 */
public class LensStage
        implements CorrectionStage {

    public static final String NAME = "lens";

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public boolean isBestEffort() {
        return true;
    }

    @Override
    public Outcome process(final FloatProcessor image,
                           final CorrectionContext context) {

        final PolynomialLensDistortion lens =
                context.getStore().getLens(context.getLightSpectrum(), context.getDate(CalibrationCategory.LENS));
        if (lens == null) {
            return Outcome.skipped("no lens calibration found", false);
        }

        return Outcome.applied(lens.correct(image, context.getParameters().isKeepSize()),
                               context.getSpectrumFallbackWarnings(CalibrationCategory.LENS));
    }

}
